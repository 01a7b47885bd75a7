package org.dxworks.rfcmark.model.xml;

public final class XmlText implements XmlNode {

    private final String text;

    public XmlText(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    @Override
    public String toString() {
        return text;
    }
}
