package org.learningjava.settingscan.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import org.learningjava.settingscan.application.usecase.ExtractSettingsUseCase;
import org.learningjava.settingscan.domain.model.settings.ExtractionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;

@RestController
@RequestMapping("/settings")
public class SettingsController {

    private static final Logger log = LoggerFactory.getLogger(SettingsController.class);

    private final ExtractSettingsUseCase useCase;

    public SettingsController(ExtractSettingsUseCase useCase) {
        this.useCase = useCase;
    }

    @PostMapping("/extract")
    public ExtractionReport extract(@Valid @RequestBody ExtractSettingsRequest req) {
        log.info("Extract request: rootDir={}, outputPath={}", req.rootDir(), req.outputPath());
        Path root = Path.of(req.rootDir());
        if (req.outputPath() == null || req.outputPath().isBlank()) {
            return useCase.extract(root);
        }
        return useCase.extractAndWrite(root, Path.of(req.outputPath()));
    }
}
