package org.learningjava.settingscan.config;

import org.junit.jupiter.api.Test;
import org.learningjava.settingscan.application.usecase.ExtractSettingsUseCase;
import org.learningjava.settingscan.domain.model.settings.ExtractionFailure;
import org.learningjava.settingscan.domain.model.settings.ExtractionReport;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StartupTasksTest {

    private final ExtractSettingsUseCase useCase = mock(ExtractSettingsUseCase.class);
    private final SettingScanProperties props = new SettingScanProperties();

    @Test
    void does_nothing_when_disabled() {
        props.setRootDirectory("/code");

        new StartupTasks(useCase, props).run(new DefaultApplicationArguments());

        verifyNoInteractions(useCase);
    }

    @Test
    void does_nothing_without_root_directory() {
        props.setRunOnStartup(true);

        new StartupTasks(useCase, props).run(new DefaultApplicationArguments());

        verifyNoInteractions(useCase);
    }

    @Test
    void scans_configured_root_into_output_path() {
        props.setRunOnStartup(true);
        props.setRootDirectory("/code");
        props.setOutputPath("build/settings.json");
        Instant now = Instant.now();
        when(useCase.extractAndWrite(Path.of("/code"), Path.of("build/settings.json")))
                .thenReturn(new ExtractionReport("/code", 1, List.of(), List.of(),
                        List.of(new ExtractionFailure("A.java", "HTTP 500")), now, now));

        new StartupTasks(useCase, props).run(new DefaultApplicationArguments());

        verify(useCase).extractAndWrite(Path.of("/code"), Path.of("build/settings.json"));
    }

    @Test
    void failing_scan_does_not_escape() {
        props.setRunOnStartup(true);
        props.setRootDirectory("/nope");
        when(useCase.extractAndWrite(any(), any())).thenThrow(new IllegalArgumentException("Directory not found: /nope"));

        assertDoesNotThrow(() -> new StartupTasks(useCase, props).run(new DefaultApplicationArguments()));
    }
}
