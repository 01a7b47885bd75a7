package org.dxworks.rfcmark.loader;

import org.dxworks.rfcmark.MalformedInputException;
import org.dxworks.rfcmark.model.xml.XmlElement;
import org.dxworks.rfcmark.model.xml.XmlNode;
import org.dxworks.rfcmark.model.xml.XmlText;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses raw XML text into a generic {@link XmlElement} tree.
 *
 * Comments and processing instructions are dropped, adjacent text runs are merged and
 * all text is kept exactly as written; deciding which whitespace matters is left to the
 * model builder. The internal DTD subset is honoured so that entities such as
 * {@code &nbsp;} declared by published RFCs expand, while external DTDs are never fetched.
 * Elements nested deeper than {@link #MAX_DEPTH} are rejected, since every later stage
 * walks the tree recursively.
 */
public class XmlTreeLoader {

    public static final int MAX_DEPTH = 256;

    private final XMLInputFactory factory;

    public XmlTreeLoader() {
        factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, true);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_REPLACING_ENTITY_REFERENCES, true);
        factory.setXMLResolver((publicId, systemId, baseUri, namespace) -> new ByteArrayInputStream(new byte[0]));
    }

    public XmlElement load(String sourceText) throws MalformedInputException {
        if (sourceText == null || sourceText.isBlank()) {
            throw new MalformedInputException("document is empty", 1, 1, 0, null);
        }

        try {
            return read(factory.createXMLStreamReader(new StringReader(sourceText)));
        } catch (XMLStreamException e) {
            throw toMalformedInput(e);
        }
    }

    /**
     * Parses raw bytes, decoding them as the XML declaration or byte order mark says
     * (UTF-8 when neither does). Bytes invalid in that encoding are malformed input.
     */
    public XmlElement load(byte[] source) throws MalformedInputException {
        if (source == null || new String(source, StandardCharsets.ISO_8859_1).isBlank()) {
            throw new MalformedInputException("document is empty", 1, 1, 0, null);
        }

        try {
            return read(factory.createXMLStreamReader(new ByteArrayInputStream(source)));
        } catch (XMLStreamException e) {
            throw toMalformedInput(e);
        }
    }

    private XmlElement read(XMLStreamReader reader) throws XMLStreamException, MalformedInputException {
        try {
            return readTree(reader);
        } finally {
            reader.close();
        }
    }

    private XmlElement readTree(XMLStreamReader reader) throws XMLStreamException, MalformedInputException {
        Deque<PendingElement> stack = new ArrayDeque<>();
        XmlElement root = null;

        while (reader.hasNext()) {
            int event = reader.next();
            switch (event) {
                case XMLStreamConstants.START_ELEMENT -> {
                    if (stack.size() >= MAX_DEPTH) {
                        Location location = reader.getLocation();
                        throw new MalformedInputException("elements nested deeper than " + MAX_DEPTH + " levels",
                                location.getLineNumber(), location.getColumnNumber(), location.getCharacterOffset(), null);
                    }
                    stack.push(startElement(reader));
                }
                case XMLStreamConstants.END_ELEMENT -> {
                    XmlElement element = stack.pop().build();
                    if (stack.isEmpty()) {
                        root = element;
                    } else {
                        stack.peek().children.add(element);
                    }
                }
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE -> {
                    if (!stack.isEmpty()) {
                        stack.peek().appendText(reader.getText());
                    }
                }
                default -> {
                    // comments, processing instructions, DTD and document events carry no content
                }
            }
        }

        if (root == null) {
            Location location = reader.getLocation();
            throw new MalformedInputException("no root element",
                    location.getLineNumber(), location.getColumnNumber(), location.getCharacterOffset(), null);
        }
        return root;
    }

    private PendingElement startElement(XMLStreamReader reader) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            attributes.put(qualifiedName(reader.getAttributePrefix(i), reader.getAttributeLocalName(i)),
                    reader.getAttributeValue(i));
        }
        String name = qualifiedName(reader.getPrefix(), reader.getLocalName());
        return new PendingElement(name, attributes, reader.getLocation().getLineNumber());
    }

    private static String qualifiedName(String prefix, String localName) {
        return prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
    }

    private static MalformedInputException toMalformedInput(XMLStreamException e) {
        Location location = e.getLocation();
        int line = location != null ? location.getLineNumber() : -1;
        int column = location != null ? location.getColumnNumber() : -1;
        int offset = location != null ? location.getCharacterOffset() : -1;
        return new MalformedInputException(parserDetail(e), line, column, offset, e);
    }

    // StAX prefixes its messages with "ParseError at [row,col]:[l,c]\nMessage: "
    private static String parserDetail(XMLStreamException e) {
        String message = e.getMessage();
        if (message == null) {
            return "unparsable input";
        }
        int marker = message.indexOf("Message: ");
        return marker >= 0 ? message.substring(marker + "Message: ".length()).trim() : message.trim();
    }

    private static final class PendingElement {
        private final String name;
        private final Map<String, String> attributes;
        private final int line;
        private final List<XmlNode> children = new ArrayList<>();

        private PendingElement(String name, Map<String, String> attributes, int line) {
            this.name = name;
            this.attributes = attributes;
            this.line = line;
        }

        private void appendText(String text) {
            if (text == null || text.isEmpty()) {
                return;
            }
            // A comment between two runs would otherwise split them
            int last = children.size() - 1;
            if (last >= 0 && children.get(last) instanceof XmlText previous) {
                children.set(last, new XmlText(previous.getText() + text));
            } else {
                children.add(new XmlText(text));
            }
        }

        private XmlElement build() {
            return new XmlElement(name, attributes, children, line);
        }
    }
}
