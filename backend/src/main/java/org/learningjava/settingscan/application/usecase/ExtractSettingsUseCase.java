package org.learningjava.settingscan.application.usecase;

import org.learningjava.settingscan.application.port.SettingReportWriterPort;
import org.learningjava.settingscan.application.port.SourceScannerPort;
import org.learningjava.settingscan.application.port.UastParseException;
import org.learningjava.settingscan.application.port.UastParserPort;
import org.learningjava.settingscan.config.SettingScanProperties;
import org.learningjava.settingscan.domain.model.settings.ExtractionDiagnostic;
import org.learningjava.settingscan.domain.model.settings.ExtractionFailure;
import org.learningjava.settingscan.domain.model.settings.ExtractionReport;
import org.learningjava.settingscan.domain.model.settings.FileExtraction;
import org.learningjava.settingscan.domain.model.settings.SettingRecord;
import org.learningjava.settingscan.domain.model.uast.UastNode;
import org.learningjava.settingscan.domain.service.extract.SettingRecordExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class ExtractSettingsUseCase {

    private static final Logger log = LoggerFactory.getLogger(ExtractSettingsUseCase.class);

    @FunctionalInterface
    public interface ProgressListener {
        ProgressListener NONE = (processed, total, file) -> { };

        void onFile(int processed, int total, String sourceFile);
    }

    private final SourceScannerPort scanner;
    private final UastParserPort parser;
    private final SettingRecordExtractor extractor;
    private final SettingReportWriterPort writer;
    private final SettingScanProperties properties;

    public ExtractSettingsUseCase(SourceScannerPort scanner,
                                  UastParserPort parser,
                                  SettingRecordExtractor extractor,
                                  SettingReportWriterPort writer,
                                  SettingScanProperties properties) {
        this.scanner = scanner;
        this.parser = parser;
        this.extractor = extractor;
        this.writer = writer;
        this.properties = properties;
    }

    public ExtractionReport extract(Path root) {
        return extract(root, ProgressListener.NONE);
    }

    /**
     * Parses every eligible file under {@code root}, one after the other, and merges the
     * per-file results in traversal order. A file whose tree cannot be produced is recorded as a
     * failure; the run always continues with the next file.
     */
    public ExtractionReport extract(Path root, ProgressListener progress) {
        Instant started = Instant.now();
        Path base = root.toAbsolutePath().normalize();
        List<Path> files = scanner.discover(base, properties.getFileExtensionFilter());
        log.info("Scanning {} {} file(s) under {}", files.size(), properties.getFileExtensionFilter(), base);

        List<SettingRecord> records = new ArrayList<>();
        List<ExtractionDiagnostic> diagnostics = new ArrayList<>();
        List<ExtractionFailure> failures = new ArrayList<>();

        int processed = 0;
        for (Path file : files) {
            String relative = relativize(base, file);
            try {
                UastNode tree = parser.parse(file);
                FileExtraction result = extractor.extract(tree, relative);
                records.addAll(result.records());
                diagnostics.addAll(result.diagnostics());
                if (!result.records().isEmpty()) {
                    log.debug("{}: {} setting(s)", relative, result.records().size());
                }
            } catch (UastParseException e) {
                log.warn("Skipping {}: {}", relative, e.getMessage());
                failures.add(new ExtractionFailure(relative, e.getMessage()));
            } catch (RuntimeException e) {
                log.warn("Skipping {} after unexpected error: {}", relative, e.toString(), e);
                failures.add(new ExtractionFailure(relative, e.toString()));
            }
            progress.onFile(++processed, files.size(), relative);
        }

        ExtractionReport report = new ExtractionReport(
                base.toString(), files.size(), records, diagnostics, failures, started, Instant.now());
        log.info("Extraction finished: files={}, settings={}, diagnostics={}, failures={}",
                report.scannedFiles(), records.size(), diagnostics.size(), failures.size());
        return report;
    }

    public ExtractionReport extractAndWrite(Path root, Path output) {
        ExtractionReport report = extract(root);
        writer.write(report.records(), output);
        log.info("Wrote {} settings to {}", report.records().size(), output.toAbsolutePath());
        return report;
    }

    static String relativize(Path base, Path file) {
        Path abs = file.toAbsolutePath().normalize();
        Path rel = abs.startsWith(base) ? base.relativize(abs) : abs;
        return rel.toString().replace('\\', '/');
    }
}
