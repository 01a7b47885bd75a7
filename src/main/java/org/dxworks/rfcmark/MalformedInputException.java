package org.dxworks.rfcmark;

/**
 * The input is not well-formed XML. Position values are -1 when the parser did not report them.
 */
public class MalformedInputException extends ConversionException {

    private final int line;
    private final int column;
    private final int characterOffset;

    public MalformedInputException(String detail, int line, int column, int characterOffset, Throwable cause) {
        super("Malformed XML at line " + line + ", column " + column + " (offset " + characterOffset + "): " + detail, cause);
        this.line = line;
        this.column = column;
        this.characterOffset = characterOffset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getCharacterOffset() {
        return characterOffset;
    }
}
