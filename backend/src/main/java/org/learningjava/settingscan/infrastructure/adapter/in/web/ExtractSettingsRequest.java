package org.learningjava.settingscan.infrastructure.adapter.in.web;

import jakarta.validation.constraints.NotBlank;

public record ExtractSettingsRequest(
        @NotBlank(message = "rootDir must not be blank") String rootDir,
        String outputPath       // optional; when set the records are also written there
) {}
