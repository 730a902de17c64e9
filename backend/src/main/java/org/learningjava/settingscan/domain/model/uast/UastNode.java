package org.learningjava.settingscan.domain.model.uast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One node of a syntax tree as handed over by a tree producer.
 * <p>
 * Nodes are immutable and never know their parent; parent navigation is resolved against the
 * tree a query runs on (see {@code UastDocument}). Identity matters: two structurally equal
 * nodes at different places of a tree are different nodes, so equals/hashCode are not overridden.
 */
public final class UastNode {

    private final String tag;
    private final String token;
    private final String role;
    private final Map<String, String> attributes;
    private final List<UastNode> children;
    private final Position position;

    private UastNode(Builder b) {
        this.tag = Objects.requireNonNull(b.tag, "tag");
        this.token = b.token == null ? "" : b.token;
        this.role = b.role;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(b.attributes));
        this.children = List.copyOf(b.children);
        this.position = b.position == null ? Position.UNKNOWN : b.position;
    }

    public static Builder builder(String tag) {
        return new Builder(tag);
    }

    public String tag() { return tag; }

    /** Literal text of the node, empty when the node carries none. */
    public String token() { return token; }

    /** Syntactic role relative to the parent, or null. */
    public String role() { return role; }

    public Map<String, String> attributes() { return attributes; }

    public String attribute(String name) { return attributes.get(name); }

    public List<UastNode> children() { return children; }

    public Position position() { return position; }

    public boolean is(String expectedTag) {
        return tag.equals(expectedTag);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(tag);
        if (!token.isEmpty()) sb.append(" '").append(token).append('\'');
        if (role != null) sb.append(" @").append(role);
        if (position.isKnown()) sb.append(" (").append(position.line()).append(':').append(position.column()).append(')');
        return sb.toString();
    }

    public static final class Builder {
        private final String tag;
        private String token;
        private String role;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<UastNode> children = new ArrayList<>();
        private Position position;

        private Builder(String tag) {
            this.tag = tag;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder attribute(String name, String value) {
            if (value != null) attributes.put(name, value);
            return this;
        }

        public Builder attributes(Map<String, String> values) {
            if (values != null) values.forEach(this::attribute);
            return this;
        }

        public Builder child(UastNode child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder children(List<UastNode> nodes) {
            nodes.forEach(this::child);
            return this;
        }

        public Builder position(Position position) {
            this.position = position;
            return this;
        }

        public Builder position(int line, int column) {
            return position(new Position(line, column));
        }

        public UastNode build() {
            return new UastNode(this);
        }
    }
}
