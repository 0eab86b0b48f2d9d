package guraa.photoclean;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application class for Photo Clean: blur and near-duplicate detection
 * over photo directories.
 * <p>
 * The feature cache is a SQLite file per scanned directory, opened by each scan,
 * so no application-wide DataSource is configured.
 */
@Slf4j
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
public class PhotoCleanApplication {

    public static void main(String[] args) {
        Instant startTime = Instant.now();

        configureJVMOptions();

        SpringApplication.run(PhotoCleanApplication.class, args);

        logStartupInfo(Duration.between(startTime, Instant.now()));
    }

    /**
     * Configure JVM options. Image decoding needs no display.
     */
    private static void configureJVMOptions() {
        System.getProperties().putIfAbsent("java.awt.headless", "true");

        long maxMemory = Runtime.getRuntime().maxMemory();
        if (maxMemory != Long.MAX_VALUE) {
            log.info("Current heap size: {} MB", maxMemory / (1024 * 1024));
        }
    }

    /**
     * Log information about the application startup.
     *
     * @param startupTime The time taken to start up
     */
    private static void logStartupInfo(Duration startupTime) {
        log.info("==========================================================");
        log.info("Photo Clean application started in {}", formatDuration(startupTime));
        log.info("System information:");
        log.info("  Java: {}", System.getProperty("java.version"));
        log.info("  OS: {} {}", System.getProperty("os.name"), System.getProperty("os.version"));
        log.info("  Available processors: {}", Runtime.getRuntime().availableProcessors());
        log.info("  JVM Max memory: {} MB", Runtime.getRuntime().maxMemory() / (1024 * 1024));
        log.info("==========================================================");
    }

    /**
     * Format a duration to a readable string.
     *
     * @param duration The duration
     * @return A formatted string (e.g., "2m 30s")
     */
    static String formatDuration(Duration duration) {
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        long seconds = duration.toSecondsPart();
        long millis = duration.toMillisPart();

        if (hours > 0) {
            return String.format("%dh %dm %d.%03ds", hours, minutes, seconds, millis);
        } else if (minutes > 0) {
            return String.format("%dm %d.%03ds", minutes, seconds, millis);
        } else {
            return String.format("%d.%03ds", seconds, millis);
        }
    }
}
