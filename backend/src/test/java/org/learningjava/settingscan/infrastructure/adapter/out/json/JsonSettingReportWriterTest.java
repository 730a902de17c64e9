package org.learningjava.settingscan.infrastructure.adapter.out.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.learningjava.settingscan.domain.model.settings.SettingRecord;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonSettingReportWriterTest {

    private final JsonSettingReportWriter writer = new JsonSettingReportWriter();

    @Test
    void writes_records_with_fixed_field_order(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("reports/nested/settings.json");
        writer.write(List.of(
                new SettingRecord("index.a", "A_SETTING", "Integer", List.of("Dynamic"), "5", 14, "x/A.java"),
                new SettingRecord("index.b", "B_SETTING", "String", List.of(), "", 20, "x/B.java")
        ), out);

        JsonNode json = new ObjectMapper().readTree(Files.readString(out));
        assertTrue(json.isArray());
        assertEquals(2, json.size());

        assertEquals(List.of("name", "rawName", "type", "properties", "defaultValue", "sourceLine", "sourceFile"),
                fieldNames(json.get(0)));
        assertEquals("Dynamic", json.get(0).get("properties").get(0).asText());
        assertEquals(14, json.get(0).get("sourceLine").asLong());

        // empty flag lists are left out
        assertFalse(json.get(1).has("properties"));
        assertEquals("", json.get(1).get("defaultValue").asText());
    }

    @Test
    void identical_input_gives_identical_bytes(@TempDir Path dir) throws Exception {
        List<SettingRecord> records = List.of(
                new SettingRecord("index.a", "A_SETTING", "Integer", List.of("Dynamic"), "5", 14, "x/A.java"));

        writer.write(records, dir.resolve("one.json"));
        writer.write(records, dir.resolve("two.json"));

        assertArrayEquals(Files.readAllBytes(dir.resolve("one.json")), Files.readAllBytes(dir.resolve("two.json")));
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> it = node.fieldNames();
        it.forEachRemaining(names::add);
        return names;
    }
}
