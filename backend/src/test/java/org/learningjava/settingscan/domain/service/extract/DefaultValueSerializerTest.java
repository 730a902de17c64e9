package org.learningjava.settingscan.domain.service.extract;

import org.junit.jupiter.api.Test;
import org.learningjava.settingscan.domain.model.uast.UastNode;
import org.learningjava.settingscan.domain.model.uast.UastRoles;
import org.learningjava.settingscan.domain.model.uast.UastTags;

import static org.junit.jupiter.api.Assertions.*;
import static org.learningjava.settingscan.domain.service.extract.SettingTrees.*;

class DefaultValueSerializerTest {

    private final DefaultValueSerializer serializer = new DefaultValueSerializer();

    @Test
    void number_literal_uses_its_token() {
        assertEquals("5", serializer.serialize(numberArg("5")));
    }

    @Test
    void boolean_literal_uses_boolean_value() {
        UastNode b = UastNode.builder(UastTags.BOOLEAN_LITERAL).token("true")
                .attribute(UastTags.ATTR_BOOLEAN_VALUE, "true").build();
        UastNode withoutAttribute = UastNode.builder(UastTags.BOOLEAN_LITERAL).token("false").build();

        assertEquals("true", serializer.serialize(b));
        assertEquals("false", serializer.serialize(withoutAttribute));
    }

    @Test
    void object_instantiation_joins_numbers_and_qualified_names() {
        UastNode creation = UastNode.builder(UastTags.CLASS_INSTANCE_CREATION)
                .child(simpleType("ByteSizeValue", UastRoles.TYPE))
                .child(numberArg("7"))
                .child(qualifiedName(UastRoles.ARGUMENTS, "X", "Y"))
                .build();

        assertEquals("7->X.Y", serializer.serialize(creation));
    }

    @Test
    void method_invocation_joins_child_tokens() {
        UastNode call = UastNode.builder(UastTags.METHOD_INVOCATION)
                .child(simpleName("TimeValue", UastRoles.EXPRESSION))
                .child(simpleName("timeValueSeconds", UastRoles.NAME))
                .child(numberArg("30"))
                .build();

        assertEquals("TimeValue->timeValueSeconds->30", serializer.serialize(call));
    }

    @Test
    void anything_else_falls_back_to_own_token() {
        assertEquals("1s", serializer.serialize(stringArg("1s")));
        assertEquals("ByteSizeUnit.MB", serializer.serialize(qualifiedName(UastRoles.ARGUMENTS, "ByteSizeUnit", "MB")));
        assertEquals("", serializer.serialize(UastNode.builder("PrefixExpression").build()));
        assertEquals("", serializer.serialize(null));
    }
}
