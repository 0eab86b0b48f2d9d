package guraa.photoclean.service;

import guraa.photoclean.config.ScanProperties;
import guraa.photoclean.model.ScanConfigurationException;
import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.ScanResult;
import guraa.photoclean.model.ScanRow;
import guraa.photoclean.model.ScanStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs submitted scans in the background, one at a time, and keeps a bounded
 * number of finished scans for status and row queries.
 */
@Slf4j
@Service
public class ScanTaskManager {

    private final ScanOrchestrator orchestrator;
    private final ExecutorService scanExecutor;
    private final Clock clock;
    private final int retainFinished;

    // Insertion ordered so the oldest finished tasks are evicted first
    private final Map<String, ScanTask> tasks = new LinkedHashMap<>();

    public ScanTaskManager(ScanOrchestrator orchestrator,
                           @Qualifier("scanExecutor") ExecutorService scanExecutor,
                           Clock clock,
                           ScanProperties properties) {
        this.orchestrator = orchestrator;
        this.scanExecutor = scanExecutor;
        this.clock = clock;
        this.retainFinished = Math.max(1, properties.getTasks().getRetainFinished());
    }

    /**
     * Validate options and queue a scan.
     *
     * @param options The scan options
     * @return The queued task
     * @throws ScanConfigurationException If the options are invalid
     */
    public ScanTask submit(ScanOptions options) {
        options.validate();
        ScanTask task = new ScanTask(UUID.randomUUID().toString(), options, clock.instant());
        synchronized (tasks) {
            tasks.put(task.getId(), task);
        }

        try {
            scanExecutor.submit(() -> run(task));
        } catch (RejectedExecutionException e) {
            task.fail("Scan executor is not accepting work", clock.instant());
            throw e;
        }
        log.info("Queued scan {} of {}", task.getId(), options.getRoot());
        return task;
    }

    public ScanStatus getStatus(String scanId) {
        return find(scanId).toStatus();
    }

    /**
     * Rows of a finished scan. A cancelled scan returns the rows it completed.
     *
     * @throws ScanNotFoundException If the id is unknown
     * @throws ScanNotFinishedException If the scan is still queued or running
     */
    public List<ScanRow> getRows(String scanId) {
        ScanTask task = find(scanId);
        ScanResult result = task.getResult();
        if (!task.getState().isFinished()) {
            throw new ScanNotFinishedException(scanId);
        }
        return result != null ? Collections.unmodifiableList(result.getRows()) : Collections.emptyList();
    }

    public ScanStatus cancel(String scanId) {
        ScanTask task = find(scanId);
        task.cancel(clock.instant());
        log.info("Cancellation requested for scan {}", scanId);
        return task.toStatus();
    }

    public List<ScanStatus> listStatuses() {
        List<ScanStatus> statuses = new ArrayList<>();
        synchronized (tasks) {
            tasks.values().forEach(task -> statuses.add(task.toStatus()));
        }
        return statuses;
    }

    private void run(ScanTask task) {
        try {
            if (task.getToken().isCancelled()) {
                log.info("Scan {} was cancelled before it started", task.getId());
                return;
            }
            task.markRunning();
            ScanResult result = orchestrator.scan(task.getOptions(), task, task.getToken());
            task.complete(result, clock.instant());
            log.info("Scan {} {}", task.getId(), result.isCancelled() ? "cancelled" : "completed");
        } catch (ScanConfigurationException e) {
            log.warn("Scan {} rejected: {}", task.getId(), e.getMessage());
            task.fail(e.getMessage(), clock.instant());
        } catch (RuntimeException e) {
            log.error("Scan {} failed: {}", task.getId(), e.getMessage(), e);
            task.fail(e.getMessage(), clock.instant());
        } finally {
            evictFinished();
        }
    }

    private ScanTask find(String scanId) {
        synchronized (tasks) {
            ScanTask task = tasks.get(scanId);
            if (task == null) {
                throw new ScanNotFoundException(scanId);
            }
            return task;
        }
    }

    private void evictFinished() {
        synchronized (tasks) {
            long finished = tasks.values().stream().filter(t -> t.getState().isFinished()).count();
            Iterator<ScanTask> it = tasks.values().iterator();
            while (finished > retainFinished && it.hasNext()) {
                ScanTask task = it.next();
                if (task.getState().isFinished()) {
                    it.remove();
                    finished--;
                    log.debug("Evicted finished scan {}", task.getId());
                }
            }
        }
    }
}
