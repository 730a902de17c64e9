package org.learningjava.settingscan.infrastructure.adapter.out.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.learningjava.settingscan.application.port.SettingReportWriterPort;
import org.learningjava.settingscan.domain.model.settings.SettingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Component
public class JsonSettingReportWriter implements SettingReportWriterPort {

    private static final Logger log = LoggerFactory.getLogger(JsonSettingReportWriter.class);

    private final ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public void write(List<SettingRecord> records, Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.write(output, om.writeValueAsBytes(records));
            log.debug("Report with {} settings written to {}", records.size(), output);
        } catch (IOException e) {
            log.error("Writing report to {} failed: {}", output, e.getMessage());
            throw new UncheckedIOException("Failed to write report to " + output, e);
        }
    }
}
