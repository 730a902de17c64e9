package org.learningjava.settingscan.domain.service.query;

import org.learningjava.settingscan.domain.model.uast.UastNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Restricted path expression over a {@link UastNode} tree.
 * <p>
 * A path is a left-to-right chain of steps. Each step maps the current node set to a new one
 * (children, descendants or parents, narrowed by tag and filters); the set is kept free of
 * duplicates and in document order after every step, and an empty set ends the evaluation.
 * <p>
 * The tree passed to {@link #evaluate(UastNode)} behaves like the document element of an XML
 * document: a leading {@code /X} selects the root itself when it is an {@code X}, a leading
 * {@code //X} considers the root and all of its descendants, and {@code ..} never goes above it.
 * <p>
 * Instances are immutable; every combinator returns a new path.
 */
public final class UastPath {

    private final List<PathStep> steps;

    private UastPath(List<PathStep> steps) {
        this.steps = List.copyOf(steps);
    }

    // -------------------- construction --------------------

    public static UastPath descendant(String tag) {
        return new UastPath(List.of(new PathStep(PathStep.Axis.DESCENDANT, tag, List.of())));
    }

    public static UastPath child(String tag) {
        return new UastPath(List.of(new PathStep(PathStep.Axis.CHILD, tag, List.of())));
    }

    /** Parses the textual form, e.g. {@code //QualifiedName/SimpleName[@token='Property']/..}. */
    public static UastPath compile(String expression) {
        return new UastPath(UastPathParser.parse(expression));
    }

    static UastPath of(List<PathStep> steps) {
        if (steps.isEmpty()) throw new IllegalArgumentException("A path needs at least one step");
        return new UastPath(steps);
    }

    public UastPath thenDescendant(String tag) {
        return append(new PathStep(PathStep.Axis.DESCENDANT, tag, List.of()));
    }

    public UastPath thenChild(String tag) {
        return append(new PathStep(PathStep.Axis.CHILD, tag, List.of()));
    }

    public UastPath parent() {
        return append(PathStep.parent());
    }

    public UastPath withToken(String value) {
        return filterLast(NodeFilter.token(value));
    }

    public UastPath withRole(String value) {
        return filterLast(NodeFilter.role(value));
    }

    public UastPath withAttribute(String name, String value) {
        return filterLast(NodeFilter.attribute(name, value));
    }

    public List<PathStep> steps() {
        return steps;
    }

    private UastPath append(PathStep step) {
        List<PathStep> next = new ArrayList<>(steps);
        next.add(step);
        return new UastPath(next);
    }

    private UastPath filterLast(NodeFilter filter) {
        List<PathStep> next = new ArrayList<>(steps);
        int last = next.size() - 1;
        next.set(last, next.get(last).with(filter));
        return new UastPath(next);
    }

    // -------------------- evaluation --------------------

    public List<UastNode> evaluate(UastNode root) {
        if (root == null) return List.of();
        UastDocument doc = new UastDocument(root);

        List<UastNode> current = selectFromDocument(doc, steps.get(0));
        for (int i = 1; i < steps.size() && !current.isEmpty(); i++) {
            current = select(doc, current, steps.get(i));
        }
        return Collections.unmodifiableList(current);
    }

    public Optional<UastNode> first(UastNode root) {
        List<UastNode> matches = evaluate(root);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    /** First step: context is the virtual document node whose only child is the root. */
    private List<UastNode> selectFromDocument(UastDocument doc, PathStep step) {
        List<UastNode> out = new ArrayList<>();
        switch (step.axis()) {
            case CHILD -> {
                if (step.matches(doc.root())) out.add(doc.root());
            }
            case DESCENDANT -> {
                if (step.matches(doc.root())) out.add(doc.root());
                collectDescendants(doc.root(), step, out);
            }
            case PARENT -> {
                // the document node has no parent
            }
        }
        return out;
    }

    private List<UastNode> select(UastDocument doc, List<UastNode> context, PathStep step) {
        List<UastNode> out = new ArrayList<>();
        for (UastNode node : context) {
            switch (step.axis()) {
                case CHILD -> {
                    for (UastNode c : node.children()) {
                        if (step.matches(c)) out.add(c);
                    }
                }
                case DESCENDANT -> collectDescendants(node, step, out);
                case PARENT -> {
                    UastNode p = doc.parentOf(node);
                    if (p != null) out.add(p);
                }
            }
        }
        return normalize(doc, out);
    }

    private static void collectDescendants(UastNode node, PathStep step, List<UastNode> out) {
        for (UastNode c : node.children()) {
            if (step.matches(c)) out.add(c);
            collectDescendants(c, step, out);
        }
    }

    /** Drops duplicates (by identity) and restores document order. */
    private static List<UastNode> normalize(UastDocument doc, List<UastNode> nodes) {
        if (nodes.size() < 2) return nodes;
        Map<UastNode, Boolean> seen = new IdentityHashMap<>();
        List<UastNode> unique = new ArrayList<>(nodes.size());
        for (UastNode n : nodes) {
            if (seen.put(n, Boolean.TRUE) == null) unique.add(n);
        }
        unique.sort(Comparator.comparingInt(doc::orderOf));
        return unique;
    }

    @Override
    public String toString() {
        return steps.stream().map(PathStep::toString).collect(Collectors.joining());
    }
}
