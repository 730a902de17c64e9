package org.learningjava.settingscan.infrastructure.adapter.out.uastParser;

import com.fasterxml.jackson.databind.JsonNode;
import org.learningjava.settingscan.domain.model.uast.Position;
import org.learningjava.settingscan.domain.model.uast.UastNode;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Maps the tree service's JSON node into {@link UastNode}. The {@code internalRole} property
 * becomes the node role, every other scalar property becomes an attribute.
 */
final class UastJsonReader {

    static final String INTERNAL_ROLE = "internalRole";

    private UastJsonReader() {
    }

    static UastNode read(JsonNode json) throws IOException {
        if (json == null || !json.isObject()) {
            throw new IOException("Expected a tree node object, got: " + json);
        }
        JsonNode type = json.get("internalType");
        if (type == null || !type.isTextual() || type.asText().isEmpty()) {
            throw new IOException("Tree node without internalType");
        }
        UastNode.Builder b = UastNode.builder(type.asText())
                .token(json.path("token").asText(""));

        JsonNode props = json.path("properties");
        if (props.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = props.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!e.getValue().isValueNode()) continue;
                if (INTERNAL_ROLE.equals(e.getKey())) b.role(e.getValue().asText());
                else b.attribute(e.getKey(), e.getValue().asText());
            }
        }

        JsonNode start = json.path("startPosition");
        if (start.isObject()) {
            b.position(start.path("line").asInt(0), start.path("col").asInt(0));
        }

        for (JsonNode child : json.path("children")) {
            b.child(read(child));
        }
        return b.build();
    }
}
