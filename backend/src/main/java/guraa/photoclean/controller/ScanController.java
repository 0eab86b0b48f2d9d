package guraa.photoclean.controller;

import guraa.photoclean.config.ScanProperties;
import guraa.photoclean.model.ScanConfigurationException;
import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.ScanRow;
import guraa.photoclean.model.ScanStatus;
import guraa.photoclean.service.ScanTask;
import guraa.photoclean.service.ScanTaskManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/scans")
@RequiredArgsConstructor
public class ScanController {

    private final ScanTaskManager taskManager;
    private final ScanProperties scanProperties;

    /**
     * Submit a scan. It runs in the background; poll the status endpoint.
     *
     * @param request The scan request
     * @return 202 Accepted with the scan id
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> submitScan(@RequestBody ScanRequest request) {
        if (request.getRoot() == null || request.getRoot().isBlank()) {
            throw new ScanConfigurationException("Scan root is missing");
        }
        ScanOptions options = request.applyTo(scanProperties.toOptions(Path.of(request.getRoot()))).build();
        ScanTask task = taskManager.submit(options);

        Map<String, Object> response = new HashMap<>();
        response.put("scanId", task.getId());
        response.put("status", task.getState());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping
    public List<ScanStatus> listScans() {
        return taskManager.listStatuses();
    }

    /**
     * Get the status of a scan.
     *
     * @param scanId The scan id
     * @return Phase, progress and, once finished, summary figures
     */
    @GetMapping("/{scanId}")
    public ScanStatus getScanStatus(@PathVariable String scanId) {
        return taskManager.getStatus(scanId);
    }

    /**
     * Get the rows of a finished scan.
     *
     * @param scanId The scan id
     * @return Blur rows followed by duplicate rows; 409 while the scan is still running
     */
    @GetMapping("/{scanId}/rows")
    public List<ScanRow> getScanRows(@PathVariable String scanId) {
        return taskManager.getRows(scanId);
    }

    @PostMapping("/{scanId}/cancel")
    public ScanStatus cancelScan(@PathVariable String scanId) {
        return taskManager.cancel(scanId);
    }
}
