package org.learningjava.settingscan.domain.service.query;

import org.learningjava.settingscan.domain.model.uast.UastNode;

import java.util.ArrayList;
import java.util.List;

public record PathStep(Axis axis, String tag, List<NodeFilter> filters) {

    public static final String ANY = "*";

    public enum Axis { CHILD, DESCENDANT, PARENT }

    public PathStep {
        filters = List.copyOf(filters);
        if (axis == Axis.PARENT && (tag != null || !filters.isEmpty())) {
            throw new IllegalArgumentException("Parent step takes neither a tag nor filters");
        }
        if (axis != Axis.PARENT && (tag == null || tag.isBlank())) {
            throw new IllegalArgumentException("Step on axis " + axis + " needs a tag or '*'");
        }
    }

    static PathStep parent() {
        return new PathStep(Axis.PARENT, null, List.of());
    }

    PathStep with(NodeFilter filter) {
        if (axis == Axis.PARENT) {
            throw new IllegalArgumentException("Cannot filter a parent step: " + filter);
        }
        List<NodeFilter> extended = new ArrayList<>(filters);
        extended.add(filter);
        return new PathStep(axis, tag, extended);
    }

    boolean matches(UastNode node) {
        if (!ANY.equals(tag) && !node.is(tag)) return false;
        for (NodeFilter f : filters) {
            if (!f.test(node)) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        if (axis == Axis.PARENT) return "/..";
        StringBuilder sb = new StringBuilder(axis == Axis.DESCENDANT ? "//" : "/").append(tag);
        filters.forEach(sb::append);
        return sb.toString();
    }
}
