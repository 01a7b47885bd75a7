package org.dxworks.rfcmark;

/**
 * An anchor id is declared twice, or declared empty. The document is ambiguous and is rejected.
 */
public class DuplicateAnchorException extends ConversionException {

    private final String anchorId;

    public DuplicateAnchorException(String anchorId, String message) {
        super(message);
        this.anchorId = anchorId;
    }

    public String getAnchorId() {
        return anchorId;
    }
}
