package org.learningjava.settingscan.application.port;

import org.learningjava.settingscan.domain.model.settings.SettingRecord;

import java.nio.file.Path;
import java.util.List;

public interface SettingReportWriterPort {
    void write(List<SettingRecord> records, Path output);
}
