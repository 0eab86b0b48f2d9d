package guraa.photoclean.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuration for thread pools. Scans run one at a time on the scan
 * executor; each scan creates its own extraction pool sized by its options.
 */
@Slf4j
@Configuration
public class ConcurrencyConfig {

    /**
     * Task executor running submitted scans, one at a time.
     */
    @Bean(name = "scanExecutor", destroyMethod = "shutdownNow")
    public ExecutorService scanExecutor() {
        log.info("Creating scan executor with 1 thread");
        return Executors.newSingleThreadExecutor(createThreadFactory("scan-", Thread.NORM_PRIORITY));
    }

    /**
     * Create a fixed pool for feature extraction.
     *
     * @param workers Number of threads
     * @return The pool; the caller shuts it down
     */
    public static ExecutorService newExtractionExecutor(int workers) {
        return Executors.newFixedThreadPool(workers, createThreadFactory("extract-", Thread.NORM_PRIORITY - 1));
    }

    /**
     * Create a thread factory with proper naming, priority and error handling.
     *
     * @param prefix Thread name prefix
     * @param priority Thread priority
     * @return A ThreadFactory
     */
    static ThreadFactory createThreadFactory(String prefix, int priority) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName(prefix + threadNumber.getAndIncrement());
                thread.setPriority(priority);
                thread.setDaemon(true);

                // Handle uncaught exceptions
                thread.setUncaughtExceptionHandler((t, e) ->
                        log.error("Uncaught exception in thread {}: {}", t.getName(), e.getMessage(), e));

                return thread;
            }
        };
    }
}
