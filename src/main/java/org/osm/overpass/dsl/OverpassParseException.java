package org.osm.overpass.dsl;

import java.util.List;

/**
 * Exception thrown when an Overpass query is not syntactically valid.
 * Carries the position of the offending input and, where the parser knows
 * them, the token names that would have been accepted there.
 */
public class OverpassParseException extends RuntimeException {

    private final int line;
    private final int column;
    private final int offset;
    private final List<String> expected;

    public OverpassParseException(String message) {
        super(message);
        this.line = -1;
        this.column = -1;
        this.offset = -1;
        this.expected = List.of();
    }

    public OverpassParseException(String message, int line, int column, int offset, List<String> expected) {
        super("line " + line + ":" + column + " " + message);
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.expected = List.copyOf(expected);
    }

    /**
     * @return 1-based line of the error, or -1
     */
    public int getLine() {
        return line;
    }

    /**
     * @return 0-based column of the error, or -1
     */
    public int getColumn() {
        return column;
    }

    /**
     * @return 0-based character offset of the error in the query, or -1
     */
    public int getOffset() {
        return offset;
    }

    public List<String> getExpected() {
        return expected;
    }

    public boolean hasLocation() {
        return line >= 0 && column >= 0;
    }
}
