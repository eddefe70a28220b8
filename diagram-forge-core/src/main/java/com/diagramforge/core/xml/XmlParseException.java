package com.diagramforge.core.xml;

/**
 * Thrown when a document is not well-formed XML.
 *
 * <p>Carries the 1-based line and column reported by the parser, or {@code -1} when the
 * location is unknown.
 */
public class XmlParseException extends Exception {

    private final int line;
    private final int column;

    public XmlParseException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public XmlParseException(String message, Throwable cause) {
        this(message, -1, -1, cause);
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public boolean hasLocation() {
        return line > 0;
    }
}
