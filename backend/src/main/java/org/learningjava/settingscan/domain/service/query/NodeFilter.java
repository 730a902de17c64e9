package org.learningjava.settingscan.domain.service.query;

import org.learningjava.settingscan.domain.model.uast.UastNode;

import java.util.Objects;

/**
 * Equality filter of one path step, written {@code [@name='value']}.
 * {@code @token} compares the node's token, {@code @internalRole} its role,
 * any other name an entry of the node's attributes.
 */
public record NodeFilter(String name, String value) {

    public static final String TOKEN = "token";
    public static final String INTERNAL_ROLE = "internalRole";

    public NodeFilter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    public static NodeFilter token(String value) {
        return new NodeFilter(TOKEN, value);
    }

    public static NodeFilter role(String value) {
        return new NodeFilter(INTERNAL_ROLE, value);
    }

    public static NodeFilter attribute(String name, String value) {
        return new NodeFilter(name, value);
    }

    public boolean test(UastNode node) {
        return switch (name) {
            case TOKEN -> value.equals(node.token());
            case INTERNAL_ROLE -> value.equals(node.role());
            default -> value.equals(node.attribute(name));
        };
    }

    @Override
    public String toString() {
        return "[@" + name + "='" + value + "']";
    }
}
