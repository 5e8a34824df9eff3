package com.genex.model;

/**
 * A non-fatal problem found while parsing. {@code line} is 0 when the problem was found
 * after the line scan, e.g. during pointer resolution.
 */
public record ParseWarning(int line, String message) {

    public static ParseWarning atLine(int line, String message) {
        return new ParseWarning(line, message);
    }

    public static ParseWarning unlocated(String message) {
        return new ParseWarning(0, message);
    }

    @Override
    public String toString() {
        return line > 0 ? "line " + line + ": " + message : message;
    }
}
