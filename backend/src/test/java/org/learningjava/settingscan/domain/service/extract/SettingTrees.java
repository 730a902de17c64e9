package org.learningjava.settingscan.domain.service.extract;

import org.learningjava.settingscan.domain.model.uast.UastNode;
import org.learningjava.settingscan.domain.model.uast.UastRoles;

import static org.learningjava.settingscan.domain.model.uast.UastTags.*;

/**
 * Hand-built trees in the shape the tree producers emit for setting declarations.
 */
final class SettingTrees {

    private SettingTrees() {
    }

    static UastNode simpleName(String token, String role) {
        return UastNode.builder(SIMPLE_NAME).token(token).role(role).build();
    }

    /** {@code qualifiedName(role, "Setting", "Property", "Dynamic")} nests left to right like JDT. */
    static UastNode qualifiedName(String role, String... parts) {
        UastNode acc = simpleName(parts[0], UastRoles.QUALIFIER);
        String text = parts[0];
        for (int i = 1; i < parts.length; i++) {
            text = text + "." + parts[i];
            boolean last = i == parts.length - 1;
            acc = UastNode.builder(QUALIFIED_NAME)
                    .role(last ? role : UastRoles.QUALIFIER)
                    .token(text)
                    .child(acc)
                    .child(simpleName(parts[i], UastRoles.NAME))
                    .build();
        }
        return acc;
    }

    static UastNode stringArg(String value) {
        return UastNode.builder(STRING_LITERAL).role(UastRoles.ARGUMENTS).token(value)
                .attribute(ATTR_ESCAPED_VALUE, "\"" + value + "\"").build();
    }

    static UastNode numberArg(String value) {
        return UastNode.builder(NUMBER_LITERAL).role(UastRoles.ARGUMENTS).token(value)
                .attribute(ATTR_TOKEN, value).build();
    }

    static UastNode flagArg(String... parts) {
        return qualifiedName(UastRoles.ARGUMENTS, parts);
    }

    static UastNode simpleType(String name, String role) {
        return UastNode.builder(SIMPLE_TYPE).role(role).child(simpleName(name, UastRoles.NAME)).build();
    }

    /** {@code Setting<T>} as a field type. */
    static UastNode settingOf(String typeArgument) {
        return UastNode.builder(PARAMETERIZED_TYPE).role(UastRoles.TYPE)
                .child(simpleType("Setting", UastRoles.TYPE))
                .child(simpleType(typeArgument, UastRoles.TYPE_ARGUMENTS))
                .build();
    }

    /** {@code Setting<Outer<Inner...>>} as a field type. */
    static UastNode settingOfNested(String outer, String... inner) {
        UastNode.Builder nested = UastNode.builder(PARAMETERIZED_TYPE).role(UastRoles.TYPE_ARGUMENTS)
                .child(simpleType(outer, UastRoles.TYPE));
        for (String i : inner) nested.child(simpleType(i, UastRoles.TYPE_ARGUMENTS));
        return UastNode.builder(PARAMETERIZED_TYPE).role(UastRoles.TYPE)
                .child(simpleType("Setting", UastRoles.TYPE))
                .child(nested.build())
                .build();
    }

    /** {@code Setting.<method>(args...)}. */
    static UastNode factory(String method, UastNode... args) {
        UastNode.Builder b = UastNode.builder(METHOD_INVOCATION).role(UastRoles.INITIALIZER)
                .child(simpleName("Setting", UastRoles.EXPRESSION))
                .child(simpleName(method, UastRoles.NAME));
        for (UastNode a : args) b.child(a);
        return b.build();
    }

    /** {@code new Setting<>(args...)}. */
    static UastNode constructor(UastNode... args) {
        UastNode.Builder b = UastNode.builder(CLASS_INSTANCE_CREATION).role(UastRoles.INITIALIZER)
                .child(UastNode.builder(PARAMETERIZED_TYPE).role(UastRoles.TYPE)
                        .child(simpleType("Setting", UastRoles.TYPE))
                        .build());
        for (UastNode a : args) b.child(a);
        return b.build();
    }

    static UastNode field(int line, String rawName, UastNode type, UastNode initializer) {
        return UastNode.builder(FIELD_DECLARATION).position(line, 5)
                .child(UastNode.builder(MODIFIER).role(UastRoles.MODIFIERS).token("public").build())
                .child(UastNode.builder(MODIFIER).role(UastRoles.MODIFIERS).token("static").build())
                .child(type)
                .child(UastNode.builder(VARIABLE_DECLARATION_FRAGMENT).role(UastRoles.FRAGMENTS)
                        .child(simpleName(rawName, UastRoles.NAME))
                        .child(initializer)
                        .build())
                .build();
    }

    static UastNode compilationUnit(UastNode... members) {
        UastNode.Builder type = UastNode.builder("TypeDeclaration")
                .child(simpleName("IndexSettings", UastRoles.NAME));
        for (UastNode m : members) type.child(m);
        return UastNode.builder(COMPILATION_UNIT).child(type.build()).build();
    }
}
