package org.dxworks.rfcmark.builder;

import org.dxworks.rfcmark.UnknownStructureException;
import org.dxworks.rfcmark.model.doc.AuthorInfo;
import org.dxworks.rfcmark.model.doc.DocNode;
import org.dxworks.rfcmark.model.doc.NodeKind;
import org.dxworks.rfcmark.model.xml.XmlElement;
import org.dxworks.rfcmark.model.xml.XmlNode;
import org.dxworks.rfcmark.model.xml.XmlText;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rules for the block level of the vocabulary: sections, paragraphs, lists, quotes,
 * literal blocks, tables and contact cards.
 */
class BlockRules {

    private static final Set<String> LITERAL_TAGS = Set.of("artwork", "sourcecode", "artset");
    private static final Set<String> FIGURE_SKIPPED_TAGS = Set.of("name", "iref");

    private final ModelBuilder builder;

    BlockRules(ModelBuilder builder) {
        this.builder = builder;
    }

    void register(Map<String, TagRule> rules) {
        rules.put("section", TagRule.block(builder::section));
        rules.put("t", TagRule.block(this::paragraph));
        rules.put("ul", TagRule.block(this::unorderedList));
        rules.put("ol", TagRule.block(this::orderedList));
        rules.put("dl", TagRule.block(this::definitionList));
        rules.put("blockquote", TagRule.block(this::blockQuote));
        rules.put("aside", TagRule.block(this::blockQuote));
        rules.put("figure", TagRule.block(this::figure));
        rules.put("artwork", TagRule.block(this::literal));
        rules.put("sourcecode", TagRule.block(this::literal));
        rules.put("artset", TagRule.block(this::literal));
        rules.put("table", TagRule.block(this::table));
        rules.put("author", TagRule.either(this::contactCard, this::contactName));
        rules.put("contact", TagRule.either(this::contactCard, this::contactName));
        rules.put("toc", TagRule.skip());
        rules.put("displayreference", TagRule.skip());
    }

    private List<DocNode> paragraph(XmlElement element) throws UnknownStructureException {
        DocNode paragraph = builder.newNode(NodeKind.PARAGRAPH, element);
        paragraph.children = builder.buildInline(element);
        return List.of(paragraph);
    }

    private List<DocNode> unorderedList(XmlElement element) throws UnknownStructureException {
        DocNode list = builder.newNode(NodeKind.UNORDERED_LIST, element);
        addItems(list, element);
        return List.of(list);
    }

    private List<DocNode> orderedList(XmlElement element) throws UnknownStructureException {
        DocNode list = builder.newNode(NodeKind.ORDERED_LIST, element);
        String start = element.getAttribute("start");
        if (start != null) {
            try {
                list.properties.put("start", String.valueOf(Integer.parseInt(start.trim())));
            } catch (NumberFormatException e) {
                builder.unknownAttribute(element, "start", start, "list start is not a number");
            }
        }
        if (element.getAttribute("type") != null) {
            list.properties.put("type", element.getAttribute("type"));
        }
        addItems(list, element);
        return List.of(list);
    }

    private void addItems(DocNode list, XmlElement element) throws UnknownStructureException {
        for (XmlNode child : element.getChildren()) {
            if (child instanceof XmlText text) {
                if (!text.isBlank()) {
                    list.children.add(wrap(NodeKind.LIST_ITEM, builder.strayText(element, text)));
                }
                continue;
            }
            XmlElement li = (XmlElement) child;
            if ("li".equals(li.getName())) {
                DocNode item = builder.newNode(NodeKind.LIST_ITEM, li);
                item.children = builder.buildFlow(li, Map.of());
                list.children.add(item);
            } else {
                list.children.add(wrap(NodeKind.LIST_ITEM, builder.unknownInline(element, li)));
            }
        }
    }

    private List<DocNode> definitionList(XmlElement element) throws UnknownStructureException {
        DocNode list = builder.newNode(NodeKind.DEFINITION_LIST, element);
        for (XmlNode child : element.getChildren()) {
            if (child instanceof XmlText text) {
                if (!text.isBlank()) {
                    list.children.add(wrap(NodeKind.DEFINITION_DESCRIPTION, builder.strayText(element, text)));
                }
                continue;
            }
            XmlElement entry = (XmlElement) child;
            switch (entry.getName()) {
                case "dt" -> {
                    DocNode term = builder.newNode(NodeKind.DEFINITION_TERM, entry);
                    term.children = builder.buildInline(entry);
                    list.children.add(term);
                }
                case "dd" -> {
                    DocNode description = builder.newNode(NodeKind.DEFINITION_DESCRIPTION, entry);
                    description.children = builder.buildFlow(entry, Map.of());
                    list.children.add(description);
                }
                default -> list.children.add(wrap(NodeKind.DEFINITION_DESCRIPTION, builder.unknownInline(element, entry)));
            }
        }
        return List.of(list);
    }

    private List<DocNode> blockQuote(XmlElement element) throws UnknownStructureException {
        DocNode quote = builder.newNode(NodeKind.BLOCK_QUOTE, element);
        if ("aside".equals(element.getName())) {
            quote.properties.put("aside", "true");
        }
        quote.children = builder.buildFlow(element, Map.of());
        return List.of(quote);
    }

    /**
     * A figure becomes the artwork it wraps, carrying the figure's anchor and title. Figures
     * holding several literal blocks yield one artwork each, the last one captioned.
     * A preamble becomes a paragraph before the artwork, a postamble one after it.
     */
    private List<DocNode> figure(XmlElement element) throws UnknownStructureException {
        List<DocNode> preambles = new ArrayList<>();
        List<DocNode> artworks = new ArrayList<>();
        List<DocNode> extras = new ArrayList<>();
        for (XmlElement child : element.childElements()) {
            if (LITERAL_TAGS.contains(child.getName())) {
                artworks.add(literalNode(child));
            } else if ("preamble".equals(child.getName())) {
                addAmble(preambles, child);
            } else if ("postamble".equals(child.getName())) {
                addAmble(extras, child);
            } else if (!FIGURE_SKIPPED_TAGS.contains(child.getName())) {
                extras.add(ModelBuilder.paragraphOf(builder.unknownInline(element, child)));
            }
        }
        if (artworks.isEmpty()) {
            DocNode empty = new DocNode(NodeKind.ARTWORK);
            empty.text = "";
            empty.line = element.getLine();
            artworks.add(empty);
        }

        DocNode captioned = artworks.get(artworks.size() - 1);
        String figureAnchor = element.getAttribute("anchor");
        if (figureAnchor != null) {
            if (captioned.anchorId != null) {
                DocNode inner = new DocNode(NodeKind.ANCHOR);
                inner.anchorId = captioned.anchorId;
                inner.line = captioned.line;
                captioned.children.add(inner);
            }
            captioned.anchorId = figureAnchor;
        }
        builder.applyName(captioned, element);
        captioned.properties.put("figure", "true");

        List<DocNode> result = new ArrayList<>(preambles);
        result.addAll(artworks);
        result.addAll(extras);
        return result;
    }

    private void addAmble(List<DocNode> target, XmlElement amble) throws UnknownStructureException {
        DocNode paragraph = builder.newNode(NodeKind.PARAGRAPH, amble);
        paragraph.children = builder.buildInline(amble);
        boolean blank = paragraph.children.stream()
                .allMatch(node -> node.kind == NodeKind.INLINE_TEXT && node.text.isBlank());
        if (!blank) {
            target.add(paragraph);
        }
    }

    private List<DocNode> literal(XmlElement element) {
        return List.of(literalNode(element));
    }

    private DocNode literalNode(XmlElement element) {
        if ("artset".equals(element.getName())) {
            XmlElement chosen = pickFromArtset(element);
            DocNode node = chosen != null ? artworkNode(chosen) : emptyArtwork(element);
            if (element.getAttribute("anchor") != null) {
                node.anchorId = element.getAttribute("anchor");
            }
            return node;
        }
        return artworkNode(element);
    }

    /** Markdown cannot carry SVG, so an artset contributes its ASCII-art variant. */
    private static XmlElement pickFromArtset(XmlElement artset) {
        List<XmlElement> artworks = artset.childElements("artwork");
        for (XmlElement artwork : artworks) {
            if ("ascii-art".equals(artwork.getAttribute("type"))) {
                return artwork;
            }
        }
        return artworks.isEmpty() ? null : artworks.get(0);
    }

    private DocNode artworkNode(XmlElement element) {
        DocNode node = builder.newNode(NodeKind.ARTWORK, element);
        node.text = literalText(element.textContent());
        if ("sourcecode".equals(element.getName())) {
            String type = element.getAttribute("type");
            if (type != null && !type.isBlank()) {
                node.properties.put("language", type.trim());
            }
        } else if (element.getAttribute("type") != null) {
            node.properties.put("type", element.getAttribute("type"));
        }
        if ("true".equals(element.getAttribute("markers"))) {
            node.properties.put("markers", "true");
        }
        if (element.getAttribute("name") != null) {
            node.properties.put("name", element.getAttribute("name"));
        }
        return node;
    }

    private DocNode emptyArtwork(XmlElement element) {
        DocNode node = builder.newNode(NodeKind.ARTWORK, element);
        node.text = "";
        return node;
    }

    /**
     * Literal content exactly as written, minus the line break that usually follows the
     * opening tag and the whitespace-only line that usually precedes the closing tag.
     */
    static String literalText(String raw) {
        String text = raw;
        if (text.startsWith("\r\n")) {
            text = text.substring(2);
        } else if (text.startsWith("\n")) {
            text = text.substring(1);
        }
        if (text.isBlank()) {
            return "";
        }
        int lastBreak = text.lastIndexOf('\n');
        if (lastBreak >= 0 && text.substring(lastBreak + 1).isBlank()) {
            text = text.substring(0, lastBreak);
        }
        return text;
    }

    private List<DocNode> table(XmlElement element) throws UnknownStructureException {
        DocNode table = builder.newNode(NodeKind.TABLE, element);
        builder.applyName(table, element);
        for (XmlNode child : element.getChildren()) {
            if (child instanceof XmlText text) {
                if (!text.isBlank()) {
                    table.children.add(singleCellRow(builder.strayText(element, text)));
                }
                continue;
            }
            XmlElement part = (XmlElement) child;
            switch (part.getName()) {
                case "name", "iref" -> {
                }
                case "thead" -> addRows(table, part, true);
                case "tbody", "tfoot" -> addRows(table, part, false);
                case "tr" -> table.children.add(row(part, false));
                default -> table.children.add(singleCellRow(builder.unknownInline(element, part)));
            }
        }
        return List.of(table);
    }

    private void addRows(DocNode table, XmlElement group, boolean header) throws UnknownStructureException {
        for (XmlNode child : group.getChildren()) {
            if (child instanceof XmlText text) {
                if (!text.isBlank()) {
                    table.children.add(singleCellRow(builder.strayText(group, text)));
                }
                continue;
            }
            XmlElement tr = (XmlElement) child;
            if ("tr".equals(tr.getName())) {
                table.children.add(row(tr, header));
            } else {
                table.children.add(singleCellRow(builder.unknownInline(group, tr)));
            }
        }
    }

    private DocNode row(XmlElement tr, boolean header) throws UnknownStructureException {
        DocNode row = builder.newNode(NodeKind.TABLE_ROW, tr);
        row.header = header;
        for (XmlNode child : tr.getChildren()) {
            if (child instanceof XmlText text) {
                if (!text.isBlank()) {
                    row.children.add(wrap(NodeKind.TABLE_CELL, builder.strayText(tr, text)));
                }
                continue;
            }
            XmlElement cellElement = (XmlElement) child;
            String name = cellElement.getName();
            if ("th".equals(name) || "td".equals(name)) {
                DocNode cell = builder.newNode(NodeKind.TABLE_CELL, cellElement);
                cell.header = "th".equals(name);
                copyAttribute(cellElement, cell, "align");
                copyAttribute(cellElement, cell, "colspan");
                copyAttribute(cellElement, cell, "rowspan");
                cell.children = builder.buildFlow(cellElement, Map.of());
                row.children.add(cell);
            } else {
                row.children.add(wrap(NodeKind.TABLE_CELL, builder.unknownInline(tr, cellElement)));
            }
        }
        return row;
    }

    private static DocNode singleCellRow(DocNode passthrough) {
        DocNode row = new DocNode(NodeKind.TABLE_ROW);
        row.line = passthrough.line;
        row.children.add(wrap(NodeKind.TABLE_CELL, passthrough));
        return row;
    }

    private List<DocNode> contactCard(XmlElement element) {
        DocNode card = builder.newNode(NodeKind.PARAGRAPH, element);
        AuthorInfo info = FrontMatterReader.readAuthor(element);

        List<String> lines = new ArrayList<>();
        String displayName = info.name != null ? info.name : info.ins;
        addLine(lines, displayName);
        if (info.organization != null && !info.organization.equals(displayName)) {
            lines.add(info.organization);
        }
        addLine(lines, info.street);
        addLine(lines, joinNonNull(", ", info.city, joinNonNull(" ", info.region, info.code)));
        addLine(lines, info.country);
        addLine(lines, info.phone != null ? "Phone: " + info.phone : null);
        addLine(lines, info.email != null ? "Email: " + info.email : null);
        addLine(lines, info.uri != null ? "URI: " + info.uri : null);

        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) {
                card.children.add(new DocNode(NodeKind.LINE_BREAK));
            }
            card.children.add(DocNode.text(lines.get(i)));
        }
        return card.children.isEmpty() ? List.of() : List.of(card);
    }

    private List<DocNode> contactName(XmlElement element) {
        AuthorInfo info = FrontMatterReader.readAuthor(element);
        String name = info.name != null ? info.name : info.ins != null ? info.ins : info.organization;
        return name == null ? List.of() : List.of(DocNode.text(name));
    }

    private static void addLine(List<String> lines, String line) {
        if (line != null && !line.isBlank()) {
            lines.add(line);
        }
    }

    private static String joinNonNull(String separator, String first, String second) {
        if (first == null || first.isBlank()) {
            return second;
        }
        if (second == null || second.isBlank()) {
            return first;
        }
        return first + separator + second;
    }

    private static void copyAttribute(XmlElement element, DocNode node, String attribute) {
        String value = element.getAttribute(attribute);
        if (value != null) {
            node.properties.put(attribute, value);
        }
    }

    /** Puts tolerated content into a node of the kind its container expects. */
    private static DocNode wrap(NodeKind kind, DocNode passthrough) {
        DocNode wrapper = new DocNode(kind);
        wrapper.line = passthrough.line;
        wrapper.children.add(ModelBuilder.paragraphOf(passthrough));
        return wrapper;
    }
}
