package org.learningjava.settingscan.domain.service.extract;

import org.learningjava.settingscan.domain.model.settings.ExtractionDiagnostic;
import org.learningjava.settingscan.domain.model.settings.FileExtraction;
import org.learningjava.settingscan.domain.model.settings.SettingRecord;
import org.learningjava.settingscan.domain.model.uast.UastNode;
import org.learningjava.settingscan.domain.model.uast.UastRoles;
import org.learningjava.settingscan.domain.service.query.UastPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.learningjava.settingscan.domain.model.uast.UastTags.*;

/**
 * Finds {@code Setting<T>} field declarations in one syntax tree and turns each into a
 * {@link SettingRecord}. Holds no state between calls.
 */
public class SettingRecordExtractor {

    private static final Logger log = LoggerFactory.getLogger(SettingRecordExtractor.class);

    static final int MIN_ARGUMENTS = 3;
    static final String NESTED_TYPE_SEPARATOR = " of ";

    private static final UastPath FIELD = UastPath.descendant(FIELD_DECLARATION);
    private static final UastPath FRAGMENT = FIELD.thenChild(VARIABLE_DECLARATION_FRAGMENT);

    private static final UastPath RAW_NAME = FRAGMENT.thenChild(SIMPLE_NAME);
    private static final UastPath DIRECT_TYPE_ARGUMENT = FIELD
            .thenChild(PARAMETERIZED_TYPE)
            .thenChild(SIMPLE_TYPE).withRole(UastRoles.TYPE_ARGUMENTS)
            .thenChild(SIMPLE_NAME);
    private static final UastPath NESTED_TYPE_ARGUMENT_PARTS = FIELD
            .thenChild(PARAMETERIZED_TYPE)
            .thenChild(PARAMETERIZED_TYPE).withRole(UastRoles.TYPE_ARGUMENTS)
            .thenChild("*");
    // Setting.intSetting("a.b", 5, Property.Dynamic)
    private static final UastPath FACTORY_ARGUMENTS = FRAGMENT
            .thenChild(METHOD_INVOCATION)
            .thenChild("*").withRole(UastRoles.ARGUMENTS);
    // new Setting<>("a.b", "5", Integer::parseInt, Property.Dynamic)
    private static final UastPath CONSTRUCTOR_ARGUMENTS = FRAGMENT
            .thenChild(CLASS_INSTANCE_CREATION)
            .thenChild("*").withRole(UastRoles.ARGUMENTS);

    private final UastPath candidates;
    private final DefaultValueSerializer defaultValues;
    private final PropertyFlagResolver flags;

    public SettingRecordExtractor(String settingTypeName,
                                  DefaultValueSerializer defaultValues,
                                  PropertyFlagResolver flags) {
        if (settingTypeName == null || settingTypeName.isBlank()) {
            throw new IllegalArgumentException("Setting type name must not be blank");
        }
        this.candidates = FIELD
                .thenChild(PARAMETERIZED_TYPE)
                .thenChild(SIMPLE_TYPE).withRole(UastRoles.TYPE)
                .thenChild(SIMPLE_NAME).withToken(settingTypeName)
                .parent().parent().parent();
        this.defaultValues = defaultValues;
        this.flags = flags;
    }

    public FileExtraction extract(UastNode root, String sourceFile) {
        List<SettingRecord> records = new ArrayList<>();
        List<ExtractionDiagnostic> diagnostics = new ArrayList<>();

        for (UastNode field : candidates.evaluate(root)) {
            String rawName = rawName(field);
            List<UastNode> arguments = arguments(field);
            long line = field.position().line();

            if (arguments.size() < MIN_ARGUMENTS) {
                String message = "Problem with " + (rawName.isEmpty() ? "<unnamed setting>" : rawName)
                        + ": expected at least " + MIN_ARGUMENTS + " arguments, found " + arguments.size();
                log.warn("{}:{} {}", sourceFile, line, message);
                diagnostics.add(new ExtractionDiagnostic(sourceFile, line, rawName, message));
                continue;
            }

            SettingRecord record = new SettingRecord(
                    arguments.get(0).token(),
                    rawName,
                    type(field),
                    flags.resolve(arguments),
                    defaultValues.serialize(arguments.get(1)),
                    line,
                    sourceFile
            );
            log.debug("Recognized setting {} ({}) at {}:{}", record.name(), rawName, sourceFile, line);
            records.add(record);
        }
        return new FileExtraction(sourceFile, records, diagnostics);
    }

    String rawName(UastNode field) {
        return RAW_NAME.first(field).map(UastNode::token).orElse("");
    }

    String type(UastNode field) {
        var direct = DIRECT_TYPE_ARGUMENT.first(field);
        if (direct.isPresent()) {
            return direct.get().token();
        }
        // Setting<List<String>> -> "List of String"
        return NESTED_TYPE_ARGUMENT_PARTS.evaluate(field).stream()
                .map(part -> part.children().isEmpty() ? "" : part.children().get(0).token())
                .collect(Collectors.joining(NESTED_TYPE_SEPARATOR));
    }

    List<UastNode> arguments(UastNode field) {
        List<UastNode> viaFactory = FACTORY_ARGUMENTS.evaluate(field);
        if (!viaFactory.isEmpty()) {
            return viaFactory;
        }
        return CONSTRUCTOR_ARGUMENTS.evaluate(field);
    }
}
