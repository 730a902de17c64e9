package org.learningjava.settingscan.infrastructure.adapter.in.web.admin;

import org.learningjava.settingscan.application.usecase.ExtractSettingsUseCase;
import org.learningjava.settingscan.domain.model.settings.ExtractionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Executor;

@RestController
@RequestMapping("/settings/jobs")
public class ScanAdminController {

    private static final Logger log = LoggerFactory.getLogger(ScanAdminController.class);

    private final ExtractSettingsUseCase useCase;
    private final JobRegistry jobs;
    private final Executor executor;

    public ScanAdminController(ExtractSettingsUseCase useCase,
                               JobRegistry jobs,
                               @Qualifier("applicationTaskExecutor") Executor executor) {
        this.useCase = useCase;
        this.jobs = jobs;
        this.executor = executor;
    }

    // --- Scan a server/container directory in the background
    @PostMapping
    public Map<String, Object> start(@RequestParam(required = false) String rootDir) {
        String jobId = jobs.start(JobRegistry.DEFAULT_TYPE, 0);

        if (rootDir == null || rootDir.isBlank()) {
            jobs.fail(jobId, "rootDir is blank");
            return Map.of("jobId", jobId);
        }
        Path dir = Path.of(rootDir);
        if (!Files.isDirectory(dir)) {
            jobs.fail(jobId, "Directory not found: " + rootDir);
            return Map.of("jobId", jobId);
        }

        jobs.update(jobId, 0, "Scanning: " + rootDir);

        executor.execute(() -> {
            try {
                log.info("[{}] Scan start: {}", jobId, rootDir);
                ExtractionReport report = useCase.extract(dir,
                        (processed, total, file) -> jobs.progress(jobId, processed, total, file));
                String summary = "Extracted " + report.records().size() + " settings from "
                        + report.scannedFiles() + " files";
                if (report.hasFailures()) {
                    summary += " (" + report.failures().size() + " files failed)";
                }
                jobs.done(jobId, summary);
                log.info("[{}] Scan done: {}", jobId, summary);
            } catch (Exception e) {
                jobs.fail(jobId, e.getMessage());
                log.error("[{}] Scan failed: {}", jobId, e.toString(), e);
            }
        });

        return Map.of("jobId", jobId);
    }

    @GetMapping("/{id}")
    public JobRegistry.JobStatus status(@PathVariable("id") String id) {
        JobRegistry.JobStatus status = jobs.get(id);
        if (status == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown job: " + id);
        }
        return status;
    }
}
