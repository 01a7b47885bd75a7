package org.dxworks.rfcmark;

public class RenderException extends ConversionException {

    public RenderException(String message) {
        super(message);
    }
}
