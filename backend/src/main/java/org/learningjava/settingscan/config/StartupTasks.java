package org.learningjava.settingscan.config;

import org.learningjava.settingscan.application.usecase.ExtractSettingsUseCase;
import org.learningjava.settingscan.domain.model.settings.ExtractionFailure;
import org.learningjava.settingscan.domain.model.settings.ExtractionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Batch mode: scans {@code settingscan.root-directory} once the context is up and writes the
 * report to {@code settingscan.output-path}.
 */
@Component
public class StartupTasks implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupTasks.class);

    private final ExtractSettingsUseCase extract;
    private final SettingScanProperties props;

    public StartupTasks(ExtractSettingsUseCase extract, SettingScanProperties props) {
        this.extract = extract;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!props.isRunOnStartup()) {
            log.debug("Start-up scan disabled (settingscan.run-on-startup=false)");
            return;
        }
        if (props.getRootDirectory() == null || props.getRootDirectory().isBlank()) {
            log.error("Start-up scan requested but settingscan.root-directory is not set");
            return;
        }

        log.info("=== Start-up scan BEGIN: {} ===", props.getRootDirectory());
        try {
            ExtractionReport report = extract.extractAndWrite(
                    Path.of(props.getRootDirectory()), Path.of(props.getOutputPath()));
            for (ExtractionFailure f : report.failures()) {
                log.warn("Not scanned: {} ({})", f.sourceFile(), f.reason());
            }
        } catch (Exception e) {
            log.error("Start-up scan failed for {}", props.getRootDirectory(), e);
        }
        log.info("=== Start-up scan END ===");
    }
}
