package guraa.photoclean.service;

import guraa.photoclean.config.ScanProperties;
import guraa.photoclean.model.CancellationToken;
import guraa.photoclean.model.RowKind;
import guraa.photoclean.model.ScanResult;
import guraa.photoclean.model.ScanRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Scans {@code app.scan.startup-root} once when the application starts and
 * logs the resulting rows. Nothing is moved or deleted.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.scan", name = "startup-root")
@RequiredArgsConstructor
public class StartupScanRunner implements CommandLineRunner {

    private final ScanOrchestrator orchestrator;
    private final ScanProperties scanProperties;

    @Override
    public void run(String... args) {
        Path root = Path.of(scanProperties.getStartupRoot());
        ScanResult result = orchestrator.scan(scanProperties.toOptions(root).build(),
                (phase, current, total) -> log.debug("{} {}/{}", phase, current, total),
                CancellationToken.none());

        log.info("Startup scan of {}: {} blur rows, {} duplicate rows in {} groups",
                root, result.countRows(RowKind.BLUR), result.countRows(RowKind.DUPLICATE), result.getGroups().size());
        for (ScanRow row : result.getRows()) {
            log.info("  [{}] {} {} {}", row.getKind().getLabel(),
                    row.getGroup() != null ? "group " + row.getGroup() + " keep " + row.getKeep() + " ->" : "",
                    row.getCandidate(), row.getRelation());
        }
        result.getWarnings().forEach(warning -> log.warn("  {}", warning));
    }
}
