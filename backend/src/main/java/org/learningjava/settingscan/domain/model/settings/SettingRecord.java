package org.learningjava.settingscan.domain.model.settings;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"name", "rawName", "type", "properties", "defaultValue", "sourceLine", "sourceFile"})
public record SettingRecord(
        String name,            // e.g. "index.translog.durability"
        String rawName,         // e.g. INDEX_TRANSLOG_DURABILITY_SETTING
        String type,            // e.g. "Integer" or "List of String"
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        List<String> properties, // e.g. ["Dynamic", "IndexScope"]
        String defaultValue,
        long sourceLine,
        String sourceFile       // relative to the scanned root
) {
    public SettingRecord {
        properties = properties == null ? List.of() : List.copyOf(properties);
    }
}
