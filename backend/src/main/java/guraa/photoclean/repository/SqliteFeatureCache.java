package guraa.photoclean.repository;

import guraa.photoclean.model.FileRecord;
import guraa.photoclean.visual.PerceptualHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Feature cache in a single SQLite file. Access is serialized through one
 * connection and a lock, so the cache may be shared by threads.
 * <p>
 * Hashes are stored as 16 hex digits. The bit layout of each hash kind and the
 * blur parameters are recorded in {@code cache_meta}; when one does not match the
 * running configuration, the stored values it governs are cleared on open.
 */
@Slf4j
public class SqliteFeatureCache implements FeatureCache {

    static final String PHASH_LAYOUT_KEY = "phash_layout";
    static final String DHASH_LAYOUT_KEY = "dhash_layout";
    static final String BLUR_LAYOUT_KEY = "blur_layout";

    // SQLite limits host parameters per statement
    private static final int LOOKUP_CHUNK = 500;

    private static final String SELECT_PREFIX =
            "SELECT path, mtime, size, blur, tenengrad, phash, dhash, last_seen FROM files WHERE path IN (";

    private static final String UPSERT_SQL =
            "INSERT INTO files(path, mtime, size, blur, tenengrad, phash, dhash, last_seen) VALUES(?,?,?,?,?,?,?,?) "
                    + "ON CONFLICT(path) DO UPDATE SET "
                    + "blur = COALESCE(excluded.blur, CASE WHEN " + sameSignature() + " THEN files.blur END), "
                    + "tenengrad = COALESCE(excluded.tenengrad, CASE WHEN " + sameSignature() + " THEN files.tenengrad END), "
                    + "phash = COALESCE(excluded.phash, CASE WHEN " + sameSignature() + " THEN files.phash END), "
                    + "dhash = COALESCE(excluded.dhash, CASE WHEN " + sameSignature() + " THEN files.dhash END), "
                    + "mtime = excluded.mtime, size = excluded.size, last_seen = excluded.last_seen";

    private final Path file;
    private final Clock clock;
    private final SingleConnectionDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile long sessionTimestamp;

    /**
     * Open (creating if needed) the cache file.
     *
     * @param file The SQLite database file
     * @param clock Source of session timestamps
     * @param blurLayout Marker of the blur parameters in use; stored scores from other parameters are cleared
     * @throws org.springframework.dao.DataAccessException If the file cannot be opened or initialized
     */
    public SqliteFeatureCache(Path file, Clock clock, String blurLayout) {
        this.file = file;
        this.clock = clock;
        this.dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + file.toAbsolutePath(), true);
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.sessionTimestamp = clock.instant().getEpochSecond();

        try {
            ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
            populator.addScript(new ClassPathResource("cache-schema.sql"));
            populator.execute(dataSource);
            ensureColumns();
            checkLayout(PHASH_LAYOUT_KEY, PerceptualHasher.PHASH_LAYOUT, "phash");
            checkLayout(DHASH_LAYOUT_KEY, PerceptualHasher.DHASH_LAYOUT, "dhash");
            checkLayout(BLUR_LAYOUT_KEY, blurLayout, "blur", "tenengrad");
        } catch (RuntimeException e) {
            dataSource.destroy();
            throw e;
        }
        log.debug("Opened feature cache {}", file);
    }

    public Path getFile() {
        return file;
    }

    public long getSessionTimestamp() {
        return sessionTimestamp;
    }

    @Override
    public void beginSession() {
        withLock(() -> {
            sessionTimestamp = clock.instant().getEpochSecond();
            return null;
        });
    }

    @Override
    public Map<String, FileRecord> lookup(Collection<String> paths) {
        if (paths.isEmpty()) {
            return Collections.emptyMap();
        }
        return withLock(() -> {
            Map<String, FileRecord> result = new HashMap<>();
            List<String> all = new ArrayList<>(paths);
            for (int i = 0; i < all.size(); i += LOOKUP_CHUNK) {
                List<String> chunk = all.subList(i, Math.min(i + LOOKUP_CHUNK, all.size()));
                String sql = SELECT_PREFIX + String.join(",", Collections.nCopies(chunk.size(), "?")) + ")";
                for (FileRecord record : jdbcTemplate.query(sql, RECORD_MAPPER, chunk.toArray())) {
                    result.put(record.getPath(), record);
                }
            }
            return result;
        });
    }

    @Override
    public void upsert(Collection<FileRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        List<FileRecord> batch = new ArrayList<>(records);
        withLock(() -> transactionTemplate.execute(status -> {
            long stamp = sessionTimestamp;
            jdbcTemplate.batchUpdate(UPSERT_SQL, new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    FileRecord record = batch.get(i);
                    ps.setString(1, record.getPath());
                    ps.setLong(2, record.getModifiedTime());
                    ps.setLong(3, record.getSizeBytes());
                    setDouble(ps, 4, record.getBlurScore());
                    setDouble(ps, 5, record.getTenengrad());
                    ps.setString(6, toHex(record.getPhash()));
                    ps.setString(7, toHex(record.getDhash()));
                    ps.setLong(8, stamp);
                }

                @Override
                public int getBatchSize() {
                    return batch.size();
                }
            });
            return null;
        }));
        log.debug("Upserted {} cache records", batch.size());
    }

    @Override
    public int finalizeSession(Collection<String> seenPaths, boolean purgeUnseen) {
        List<String> seen = new ArrayList<>(seenPaths);
        Integer purged = withLock(() -> transactionTemplate.execute(status -> {
            long stamp = sessionTimestamp;
            if (!seen.isEmpty()) {
                jdbcTemplate.batchUpdate("UPDATE files SET last_seen = ? WHERE path = ?", new BatchPreparedStatementSetter() {
                    @Override
                    public void setValues(PreparedStatement ps, int i) throws SQLException {
                        ps.setLong(1, stamp);
                        ps.setString(2, seen.get(i));
                    }

                    @Override
                    public int getBatchSize() {
                        return seen.size();
                    }
                });
            }
            return purgeUnseen ? jdbcTemplate.update("DELETE FROM files WHERE last_seen < ?", stamp) : 0;
        }));
        if (purged != null && purged > 0) {
            log.info("Purged {} cache records of files no longer present", purged);
        }
        return purged != null ? purged : 0;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            dataSource.destroy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Caches written before the Tenengrad or dHash columns existed get them added.
     */
    private void ensureColumns() {
        List<String> columns = jdbcTemplate.query("PRAGMA table_info(files)", (rs, rowNum) -> rs.getString("name"));
        for (String column : new String[]{"tenengrad", "dhash"}) {
            if (!columns.contains(column)) {
                String type = "tenengrad".equals(column) ? "REAL" : "TEXT";
                log.info("Adding missing column {} to feature cache {}", column, file);
                jdbcTemplate.execute("ALTER TABLE files ADD COLUMN " + column + " " + type);
            }
        }
    }

    /**
     * Clear the given columns when the stored marker differs from the running layout, then record it.
     */
    private void checkLayout(String key, String layout, String... columns) {
        List<String> stored = jdbcTemplate.queryForList(
                "SELECT meta_value FROM cache_meta WHERE meta_key = ?", String.class, key);
        if (!stored.isEmpty() && layout.equals(stored.get(0))) {
            return;
        }
        for (String column : columns) {
            int cleared = jdbcTemplate.update("UPDATE files SET " + column + " = NULL WHERE " + column + " IS NOT NULL");
            if (cleared > 0) {
                log.info("Layout of {} changed ({} -> {}), cleared {} stored values",
                        column, stored.isEmpty() ? "unknown" : stored.get(0), layout, cleared);
            }
        }
        jdbcTemplate.update("INSERT INTO cache_meta(meta_key, meta_value) VALUES(?, ?) "
                + "ON CONFLICT(meta_key) DO UPDATE SET meta_value = excluded.meta_value", key, layout);
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static String sameSignature() {
        return "files.mtime = excluded.mtime AND files.size = excluded.size";
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.REAL);
        } else {
            ps.setDouble(index, value);
        }
    }

    static String toHex(Long hash) {
        return hash == null ? null : String.format(Locale.ROOT, "%016x", hash);
    }

    static Long fromHex(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseUnsignedLong(text.trim(), 16);
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed stored hash '{}'", text);
            return null;
        }
    }

    private static final RowMapper<FileRecord> RECORD_MAPPER = (ResultSet rs, int rowNum) -> {
        double blur = rs.getDouble("blur");
        Double blurScore = rs.wasNull() ? null : blur;
        double ten = rs.getDouble("tenengrad");
        Double tenengrad = rs.wasNull() ? null : ten;
        return FileRecord.builder()
                .path(rs.getString("path"))
                .modifiedTime(rs.getLong("mtime"))
                .sizeBytes(rs.getLong("size"))
                .blurScore(blurScore)
                .tenengrad(tenengrad)
                .phash(fromHex(rs.getString("phash")))
                .dhash(fromHex(rs.getString("dhash")))
                .lastSeen(rs.getLong("last_seen"))
                .build();
    };
}
