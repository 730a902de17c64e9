package org.learningjava.settingscan.domain.model.uast;

public record Position(
        int line,       // 1-based, 0 when the producer did not report it
        int column
) {
    public static final Position UNKNOWN = new Position(0, 0);

    public boolean isKnown() {
        return line > 0;
    }
}
