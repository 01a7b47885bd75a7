package org.dxworks.rfcmark;

/**
 * Fatal failure converting a single document. No output is produced for the document.
 */
public class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
