package org.dxworks.rfcmark;

/**
 * Non-fatal notice collected while converting a document.
 */
public class ConversionWarning {

    public enum Kind {
        UNRESOLVED_REFERENCE,
        UNKNOWN_ELEMENT,
        UNKNOWN_ATTRIBUTE
    }

    private final Kind kind;
    private final String subject;
    private final String message;
    private final int line;

    public ConversionWarning(Kind kind, String subject, String message, int line) {
        this.kind = kind;
        this.subject = subject;
        this.message = message;
        this.line = line;
    }

    public Kind getKind() {
        return kind;
    }

    /** Target id of an unresolved reference, or the tag name of an unknown element. */
    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return "line " + line + ": " + message;
    }
}
