package org.learningjava.settingscan.domain.service.extract;

import org.learningjava.settingscan.domain.model.uast.UastNode;
import org.learningjava.settingscan.domain.model.uast.UastTags;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the default-value argument of a setting as a canonical string.
 * The joiners and the literal-vs-token choice below are the published output format.
 */
public class DefaultValueSerializer {

    static final String PIECE_SEPARATOR = "->";
    static final String QUALIFIER_SEPARATOR = ".";

    public String serialize(UastNode node) {
        if (node == null) return "";
        return switch (node.tag()) {
            case UastTags.NUMBER_LITERAL -> literalToken(node);
            case UastTags.BOOLEAN_LITERAL -> booleanValue(node);
            case UastTags.METHOD_INVOCATION -> methodInvocation(node);
            case UastTags.CLASS_INSTANCE_CREATION -> classInstanceCreation(node);
            default -> node.token();
        };
    }

    // e.g. TimeValue.timeValueSeconds(30) -> "TimeValue->timeValueSeconds->30"
    private String methodInvocation(UastNode node) {
        return node.children().stream()
                .map(c -> c.is(UastTags.NUMBER_LITERAL) ? literalToken(c) : c.token())
                .collect(Collectors.joining(PIECE_SEPARATOR));
    }

    // e.g. new ByteSizeValue(7, ByteSizeUnit.MB) -> "7->ByteSizeUnit.MB"
    private String classInstanceCreation(UastNode node) {
        List<String> pieces = new ArrayList<>();
        for (UastNode c : node.children()) {
            if (c.is(UastTags.NUMBER_LITERAL)) {
                pieces.add(literalToken(c));
            } else if (c.is(UastTags.QUALIFIED_NAME)) {
                pieces.add(c.children().stream()
                        .map(UastNode::token)
                        .collect(Collectors.joining(QUALIFIER_SEPARATOR)));
            }
        }
        return String.join(PIECE_SEPARATOR, pieces);
    }

    private String booleanValue(UastNode node) {
        String v = node.attribute(UastTags.ATTR_BOOLEAN_VALUE);
        return v != null ? v : node.token();
    }

    static String literalToken(UastNode numberLiteral) {
        String t = numberLiteral.attribute(UastTags.ATTR_TOKEN);
        return t != null ? t : numberLiteral.token();
    }
}
