package org.dxworks.rfcmark;

/**
 * An element, or an attribute value of a known element, that the vocabulary does not recognize
 * in the place it was found.
 */
public class UnknownStructureException extends ConversionException {

    private final String tag;
    private final String attribute;
    private final int line;

    public UnknownStructureException(String tag, String attribute, String detail, int line) {
        super(describe(tag, attribute, detail, line));
        this.tag = tag;
        this.attribute = attribute;
        this.line = line;
    }

    public String getTag() {
        return tag;
    }

    /** Offending attribute, or null when the element itself is unknown. */
    public String getAttribute() {
        return attribute;
    }

    public int getLine() {
        return line;
    }

    private static String describe(String tag, String attribute, String detail, int line) {
        String subject = attribute == null ? "<" + tag + ">" : "<" + tag + " " + attribute + ">";
        return "Unknown structure " + subject + " at line " + line + ": " + detail;
    }
}
