package com.genex.parser;

/**
 * The input does not look like any format the importer recognizes. Fatal for the import.
 */
public class FormatException extends RuntimeException {

    private final String source;

    public FormatException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public FormatException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
