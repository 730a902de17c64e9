package org.learningjava.settingscan.domain.model.settings;

import java.time.Instant;
import java.util.List;

public record ExtractionReport(
        String root,
        int scannedFiles,
        List<SettingRecord> records,
        List<ExtractionDiagnostic> diagnostics,
        List<ExtractionFailure> failures,
        Instant startedAt,
        Instant finishedAt
) {
    public ExtractionReport {
        records = List.copyOf(records);
        diagnostics = List.copyOf(diagnostics);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
