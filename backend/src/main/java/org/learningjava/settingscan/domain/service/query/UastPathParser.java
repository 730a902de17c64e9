package org.learningjava.settingscan.domain.service.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand-written parser for the textual path form:
 * <pre>
 *   path   := step+
 *   step   := ("//" | "/") (name | "*") filter*  |  "/.."
 *   filter := "[@" name "=" value "]"      value quoted with ' or ", or bare up to ']'
 * </pre>
 */
final class UastPathParser {

    private final String src;
    private int pos;

    private UastPathParser(String src) {
        this.src = src;
    }

    static List<PathStep> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Empty path expression");
        }
        return new UastPathParser(expression.trim()).steps();
    }

    private List<PathStep> steps() {
        List<PathStep> out = new ArrayList<>();
        while (pos < src.length()) {
            out.add(step());
        }
        return out;
    }

    private PathStep step() {
        expect('/');
        PathStep.Axis axis = PathStep.Axis.CHILD;
        if (peek('/')) {
            pos++;
            axis = PathStep.Axis.DESCENDANT;
        }
        if (src.startsWith("..", pos)) {
            if (axis == PathStep.Axis.DESCENDANT) throw error("'//..' is not supported");
            pos += 2;
            if (peek('[')) throw error("parent step cannot be filtered");
            return PathStep.parent();
        }
        String tag = peek('*') ? String.valueOf(src.charAt(pos++)) : name();
        List<NodeFilter> filters = new ArrayList<>();
        while (peek('[')) {
            filters.add(filter());
        }
        return new PathStep(axis, tag, filters);
    }

    private NodeFilter filter() {
        expect('[');
        expect('@');
        String name = name();
        expect('=');
        String value;
        if (peek('\'') || peek('"')) {
            char quote = src.charAt(pos++);
            int end = src.indexOf(quote, pos);
            if (end < 0) throw error("unterminated quoted value");
            value = src.substring(pos, end);
            pos = end + 1;
        } else {
            int end = src.indexOf(']', pos);
            if (end < 0) throw error("missing ']'");
            value = src.substring(pos, end).trim();
            pos = end;
        }
        expect(']');
        return new NodeFilter(name, value);
    }

    private String name() {
        int start = pos;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '-')) break;
            pos++;
        }
        if (start == pos) throw error("expected a name");
        return src.substring(start, pos);
    }

    private boolean peek(char c) {
        return pos < src.length() && src.charAt(pos) == c;
    }

    private void expect(char c) {
        if (!peek(c)) throw error("expected '" + c + "'");
        pos++;
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException("Invalid path '" + src + "' at " + pos + ": " + message);
    }
}
