package org.dxworks.rfcmark.model.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable element of the generic tree produced by the loader.
 * Children keep their source order; attribute order carries no meaning.
 */
public final class XmlElement implements XmlNode {

    private final String name;
    private final Map<String, String> attributes;
    private final List<XmlNode> children;
    private final int line;

    public XmlElement(String name, Map<String, String> attributes, List<XmlNode> children, int line) {
        this.name = name;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.children = List.copyOf(children);
        this.line = line;
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String attributeName) {
        return attributes.get(attributeName);
    }

    public List<XmlNode> getChildren() {
        return children;
    }

    /** Line of the start tag, 1-based, or -1 when the parser could not tell. */
    public int getLine() {
        return line;
    }

    public List<XmlElement> childElements() {
        List<XmlElement> elements = new ArrayList<>();
        for (XmlNode child : children) {
            if (child instanceof XmlElement element) {
                elements.add(element);
            }
        }
        return elements;
    }

    public List<XmlElement> childElements(String childName) {
        List<XmlElement> elements = new ArrayList<>();
        for (XmlNode child : children) {
            if (child instanceof XmlElement element && element.name.equals(childName)) {
                elements.add(element);
            }
        }
        return elements;
    }

    /** First direct child with the given name, or null. */
    public XmlElement firstChild(String childName) {
        for (XmlNode child : children) {
            if (child instanceof XmlElement element && element.name.equals(childName)) {
                return element;
            }
        }
        return null;
    }

    /**
     * Follows a slash separated path of child names, taking the first match at each step.
     */
    public XmlElement find(String path) {
        XmlElement current = this;
        for (String step : path.split("/")) {
            current = current.firstChild(step);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /** Concatenated text of all descendants, unmodified. */
    public String textContent() {
        StringBuilder sb = new StringBuilder();
        appendText(this, sb);
        return sb.toString();
    }

    private static void appendText(XmlElement element, StringBuilder sb) {
        for (XmlNode child : element.children) {
            if (child instanceof XmlText text) {
                sb.append(text.getText());
            } else if (child instanceof XmlElement nested) {
                appendText(nested, sb);
            }
        }
    }

    @Override
    public String toString() {
        return "<" + name + ">";
    }
}
