package guraa.photoclean.repository;

import guraa.photoclean.model.Aggregation;
import guraa.photoclean.model.BlurSettings;
import guraa.photoclean.model.FileRecord;
import guraa.photoclean.model.ImageFile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteFeatureCacheTest {

    private static final String BLUR_LAYOUT = BlurSettings.defaults().layout();

    @TempDir
    Path dir;

    private Path file;
    private MutableClock clock;
    private SqliteFeatureCache cache;

    @BeforeEach
    void open() {
        file = dir.resolve("cache.sqlite");
        clock = new MutableClock(1_000L);
        cache = new SqliteFeatureCache(file, clock, BLUR_LAYOUT);
        cache.beginSession();
    }

    @AfterEach
    void close() {
        cache.close();
    }

    @Test
    void writingOneFeatureKeepsTheOthers() {
        cache.upsert(List.of(record("/p/a.jpg", 10, 100).blurScore(42.0).build()));
        cache.upsert(List.of(record("/p/a.jpg", 10, 100).phash(0xF0F0L).build()));
        cache.upsert(List.of(record("/p/a.jpg", 10, 100).dhash(-1L).tenengrad(7.5).build()));

        FileRecord stored = cache.lookup(List.of("/p/a.jpg")).get("/p/a.jpg");

        assertThat(stored.getBlurScore()).isEqualTo(42.0);
        assertThat(stored.getPhash()).isEqualTo(0xF0F0L);
        assertThat(stored.getDhash()).isEqualTo(-1L);
        assertThat(stored.getTenengrad()).isEqualTo(7.5);
        assertThat(stored.getLastSeen()).isEqualTo(1_000L);
    }

    @Test
    void changedSignatureClearsStaleFeatures() {
        cache.upsert(List.of(record("/p/a.jpg", 10, 100).blurScore(42.0).phash(5L).build()));
        cache.upsert(List.of(record("/p/a.jpg", 11, 100).blurScore(43.0).build()));

        FileRecord stored = cache.lookup(List.of("/p/a.jpg")).get("/p/a.jpg");

        assertThat(stored.getModifiedTime()).isEqualTo(11);
        assertThat(stored.getBlurScore()).isEqualTo(43.0);
        assertThat(stored.getPhash()).isNull();
    }

    @Test
    void freshnessFollowsSignature() {
        cache.upsert(List.of(record("/p/a.jpg", 10, 100).blurScore(1.0).build()));
        FileRecord stored = cache.lookup(List.of("/p/a.jpg")).get("/p/a.jpg");

        assertThat(stored.isFreshFor(new ImageFile("/p/a.jpg", 10, 100))).isTrue();
        assertThat(stored.isFreshFor(new ImageFile("/p/a.jpg", 10, 101))).isFalse();
        assertThat(stored.isFreshFor(new ImageFile("/p/a.jpg", 12, 100))).isFalse();
    }

    @Test
    void lookupHandlesMoreParametersThanOneStatementAllows() {
        List<FileRecord> records = new ArrayList<>();
        List<String> paths = new ArrayList<>();
        for (int i = 0; i < 1500; i++) {
            String path = "/p/" + i + ".jpg";
            paths.add(path);
            records.add(record(path, i, i).blurScore((double) i).build());
        }
        cache.upsert(records);

        Map<String, FileRecord> found = cache.lookup(paths);

        assertThat(found).hasSize(1500);
        assertThat(found.get("/p/1499.jpg").getBlurScore()).isEqualTo(1499.0);
        assertThat(cache.lookup(List.of("/p/missing.jpg"))).isEmpty();
    }

    @Test
    void purgeRemovesRecordsNotSeenThisSession() {
        cache.upsert(List.of(
                record("/p/kept.jpg", 1, 1).blurScore(1.0).build(),
                record("/p/deleted.jpg", 1, 1).blurScore(2.0).build()));

        clock.set(2_000L);
        cache.beginSession();
        int purged = cache.finalizeSession(List.of("/p/kept.jpg"), true);

        assertThat(purged).isEqualTo(1);
        Map<String, FileRecord> found = cache.lookup(List.of("/p/kept.jpg", "/p/deleted.jpg"));
        assertThat(found).containsOnlyKeys("/p/kept.jpg");
        assertThat(found.get("/p/kept.jpg").getLastSeen()).isEqualTo(2_000L);
    }

    @Test
    void finalizeWithoutPurgeKeepsEverything() {
        cache.upsert(List.of(record("/p/a.jpg", 1, 1).blurScore(1.0).build()));

        clock.set(3_000L);
        cache.beginSession();

        assertThat(cache.finalizeSession(List.of(), false)).isZero();
        assertThat(cache.lookup(List.of("/p/a.jpg"))).containsKey("/p/a.jpg");
    }

    @Test
    void deletedCacheFileIsRebuilt() throws IOException {
        cache.upsert(List.of(record("/p/a.jpg", 1, 1).blurScore(1.0).build()));
        cache.close();
        Files.delete(file);

        cache = new SqliteFeatureCache(file, clock, BLUR_LAYOUT);

        assertThat(Files.exists(file)).isTrue();
        assertThat(cache.lookup(List.of("/p/a.jpg"))).isEmpty();
    }

    @Test
    void foreignHashLayoutClearsStoredHashes() {
        cache.upsert(List.of(record("/p/a.jpg", 1, 1).blurScore(9.0).phash(3L).dhash(4L).build()));
        cache.close();

        SingleConnectionDataSource dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + file, true);
        try {
            new JdbcTemplate(dataSource).update(
                    "UPDATE cache_meta SET meta_value = 'older-layout' WHERE meta_key = ?",
                    SqliteFeatureCache.PHASH_LAYOUT_KEY);
        } finally {
            dataSource.destroy();
        }

        cache = new SqliteFeatureCache(file, clock, BLUR_LAYOUT);
        FileRecord stored = cache.lookup(List.of("/p/a.jpg")).get("/p/a.jpg");

        assertThat(stored.getPhash()).isNull();
        assertThat(stored.getDhash()).isEqualTo(4L);
        assertThat(stored.getBlurScore()).isEqualTo(9.0);
    }

    @Test
    void changedBlurSettingsClearStoredScores() {
        cache.upsert(List.of(record("/p/a.jpg", 1, 1).blurScore(9.0).tenengrad(4.0).phash(3L).build()));
        cache.close();

        String meanLayout = BlurSettings.builder().aggregation(Aggregation.MEAN).build().layout();
        cache = new SqliteFeatureCache(file, clock, meanLayout);
        FileRecord stored = cache.lookup(List.of("/p/a.jpg")).get("/p/a.jpg");

        assertThat(meanLayout).isNotEqualTo(BLUR_LAYOUT);
        assertThat(stored.getBlurScore()).isNull();
        assertThat(stored.getTenengrad()).isNull();
        assertThat(stored.getPhash()).isEqualTo(3L);
    }

    @Test
    void unchangedBlurSettingsKeepStoredScores() {
        cache.upsert(List.of(record("/p/a.jpg", 1, 1).blurScore(9.0).tenengrad(4.0).build()));
        cache.close();

        cache = new SqliteFeatureCache(file, clock, BlurSettings.defaults().layout());
        FileRecord stored = cache.lookup(List.of("/p/a.jpg")).get("/p/a.jpg");

        assertThat(stored.getBlurScore()).isEqualTo(9.0);
        assertThat(stored.getTenengrad()).isEqualTo(4.0);
    }

    @Test
    void corruptFileFailsWithDataAccessException() throws IOException {
        Path corrupt = dir.resolve("corrupt.sqlite");
        Files.write(corrupt, "x".repeat(4096).getBytes());

        assertThatThrownBy(() -> new SqliteFeatureCache(corrupt, clock, BLUR_LAYOUT)).isInstanceOf(DataAccessException.class);
    }

    @Test
    void hexRoundTripKeepsSignBit() {
        assertThat(SqliteFeatureCache.toHex(-1L)).isEqualTo("ffffffffffffffff");
        assertThat(SqliteFeatureCache.fromHex("8000000000000000")).isEqualTo(Long.MIN_VALUE);
        assertThat(SqliteFeatureCache.fromHex("not-hex")).isNull();
    }

    private static FileRecord.FileRecordBuilder record(String path, long mtime, long size) {
        return FileRecord.builder().path(path).modifiedTime(mtime).sizeBytes(size);
    }

    /**
     * Clock whose instant is set explicitly.
     */
    static class MutableClock extends Clock {

        private volatile long epochSecond;

        MutableClock(long epochSecond) {
            this.epochSecond = epochSecond;
        }

        void set(long epochSecond) {
            this.epochSecond = epochSecond;
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochSecond(epochSecond);
        }
    }
}
