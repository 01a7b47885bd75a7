package org.dxworks.rfcmark.builder;

import org.dxworks.rfcmark.ConversionOptions;
import org.dxworks.rfcmark.ConversionWarning;
import org.dxworks.rfcmark.UnknownStructureException;
import org.dxworks.rfcmark.model.doc.DocNode;
import org.dxworks.rfcmark.model.doc.NodeKind;
import org.dxworks.rfcmark.model.doc.RfcDocument;
import org.dxworks.rfcmark.model.xml.XmlElement;
import org.dxworks.rfcmark.model.xml.XmlNode;
import org.dxworks.rfcmark.model.xml.XmlText;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Walks the generic XML tree of an xml2rfc v3 document and builds the document model.
 *
 * Every recognized tag has exactly one {@link TagRule}. Tags without a rule follow the
 * unknown-element policy: conversion fails with {@link UnknownStructureException}, or, when
 * unknown elements are tolerated, the element's text is passed through and a warning is kept.
 * One instance converts one document.
 */
public class ModelBuilder {

    private static final Pattern WHITESPACE = Pattern.compile("[ \\t\\r\\n]+");
    private static final Map<String, TagRule> SECTION_LOCAL_RULES = Map.of("name", TagRule.skip());

    private final ConversionOptions options;
    private final Map<String, TagRule> rules = new HashMap<>();
    private final List<ConversionWarning> warnings = new ArrayList<>();
    private final FrontMatterReader frontMatterReader = new FrontMatterReader();
    private final ReferenceRules referenceRules;

    private int sectionDepth;
    private boolean inBackMatter;

    public ModelBuilder(ConversionOptions options) {
        this.options = options;
        this.referenceRules = new ReferenceRules(this);
        new BlockRules(this).register(rules);
        new InlineRules(this).register(rules);
    }

    public RfcDocument build(XmlElement root) throws UnknownStructureException {
        if (!"rfc".equals(root.getName())) {
            throw new UnknownStructureException(root.getName(), null, "expected <rfc> as the root element", root.getLine());
        }

        RfcDocument document = new RfcDocument();
        DocNode body = document.root;
        body.line = root.getLine();

        for (XmlNode child : root.getChildren()) {
            if (child instanceof XmlText text) {
                if (!text.isBlank()) {
                    body.children.add(paragraphOf(strayText(root, text)));
                }
                continue;
            }
            XmlElement element = (XmlElement) child;
            switch (element.getName()) {
                case "front" -> readFront(root, element, document);
                case "middle" -> body.children.addAll(buildFlow(element, Map.of()));
                case "back" -> body.children.addAll(buildBack(element));
                case "link" -> {
                    // related-document links have no Markdown counterpart
                }
                default -> body.children.add(paragraphOf(unknownInline(root, element)));
            }
        }
        return document;
    }

    /** Warnings collected so far, in document order. */
    public List<ConversionWarning> getWarnings() {
        return List.copyOf(warnings);
    }

    public ConversionOptions getOptions() {
        return options;
    }

    private void readFront(XmlElement rfc, XmlElement front, RfcDocument document) throws UnknownStructureException {
        document.frontMatter = frontMatterReader.read(rfc, front);

        for (XmlNode child : front.getChildren()) {
            if (child instanceof XmlText text) {
                if (!text.isBlank()) {
                    document.root.children.add(paragraphOf(strayText(front, text)));
                }
                continue;
            }
            XmlElement element = (XmlElement) child;
            if (FrontMatterReader.METADATA_TAGS.contains(element.getName())) {
                continue;
            }
            switch (element.getName()) {
                case "abstract" -> document.root.children.add(frontSection(element, "Abstract"));
                case "note" -> document.root.children.add(frontSection(element, "Note"));
                case "boilerplate", "toc" -> {
                    // regenerated by whoever publishes the Markdown
                }
                default -> document.root.children.add(paragraphOf(unknownInline(front, element)));
            }
        }
    }

    private DocNode frontSection(XmlElement element, String defaultTitle) throws UnknownStructureException {
        DocNode section = newSection(element);
        section.numbered = false;
        if (section.title == null) {
            section.title = defaultTitle;
            section.titleContent.add(DocNode.text(defaultTitle));
        }
        section.children = sectionBody(element, SECTION_LOCAL_RULES);
        return section;
    }

    private List<DocNode> buildBack(XmlElement back) throws UnknownStructureException {
        referenceRules.collectDisplayLabels(back);
        inBackMatter = true;
        try {
            return buildFlow(back, referenceRules.backMatterRules());
        } finally {
            inBackMatter = false;
        }
    }

    List<DocNode> section(XmlElement element) throws UnknownStructureException {
        DocNode section = newSection(element);
        section.numbered = !"false".equals(element.getAttribute("numbered"));
        section.children = sectionBody(element, SECTION_LOCAL_RULES);
        return List.of(section);
    }

    /** A section one level below the one being built, with anchor and title applied. */
    DocNode newSection(XmlElement element) throws UnknownStructureException {
        DocNode section = newNode(NodeKind.SECTION, element);
        section.depth = sectionDepth + 1;
        section.appendix = inBackMatter;
        applyName(section, element);
        return section;
    }

    /** Builds the content of a section created by {@link #newSection} one nesting level deeper. */
    List<DocNode> sectionBody(XmlElement element, Map<String, TagRule> localRules) throws UnknownStructureException {
        sectionDepth++;
        try {
            return buildFlow(element, localRules);
        } finally {
            sectionDepth--;
        }
    }

    /**
     * Builds block content. Runs of text and inline elements between blocks become paragraphs;
     * whitespace between blocks is dropped. Local rules take precedence over the vocabulary.
     */
    List<DocNode> buildFlow(XmlElement container, Map<String, TagRule> localRules) throws UnknownStructureException {
        List<DocNode> blocks = new ArrayList<>();
        List<DocNode> pending = new ArrayList<>();

        for (XmlNode child : container.getChildren()) {
            if (child instanceof XmlText text) {
                pending.add(DocNode.text(collapse(text.getText())));
                continue;
            }
            XmlElement element = (XmlElement) child;
            TagRule rule = localRules.containsKey(element.getName())
                    ? localRules.get(element.getName())
                    : rules.get(element.getName());
            if (rule == null) {
                pending.add(unknownInline(container, element));
                continue;
            }
            switch (rule.getPlacement()) {
                case SKIP -> {
                }
                case INLINE -> pending.addAll(rule.getInlineFactory().create(element));
                case BLOCK, EITHER -> {
                    flushParagraph(pending, blocks);
                    blocks.addAll(rule.getBlockFactory().create(element));
                }
            }
        }
        flushParagraph(pending, blocks);
        return blocks;
    }

    /** Builds running text; block elements are not allowed here. */
    List<DocNode> buildInline(XmlElement container) throws UnknownStructureException {
        List<DocNode> nodes = new ArrayList<>();
        for (XmlNode child : container.getChildren()) {
            if (child instanceof XmlText text) {
                nodes.add(DocNode.text(collapse(text.getText())));
                continue;
            }
            XmlElement element = (XmlElement) child;
            TagRule rule = rules.get(element.getName());
            if (rule == null || rule.getPlacement() == TagRule.Placement.BLOCK) {
                nodes.add(unknownInline(container, element));
                continue;
            }
            if (rule.getPlacement() != TagRule.Placement.SKIP) {
                nodes.addAll(rule.getInlineFactory().create(element));
            }
        }
        return nodes;
    }

    private static void flushParagraph(List<DocNode> pending, List<DocNode> blocks) {
        boolean hasContent = false;
        for (DocNode node : pending) {
            if (node.kind != NodeKind.INLINE_TEXT || !node.text.isBlank()) {
                hasContent = true;
                break;
            }
        }
        if (hasContent) {
            DocNode paragraph = new DocNode(NodeKind.PARAGRAPH);
            paragraph.children.addAll(pending);
            blocks.add(paragraph);
        }
        pending.clear();
    }

    DocNode newNode(NodeKind kind, XmlElement element) {
        DocNode node = new DocNode(kind);
        node.line = element.getLine();
        node.anchorId = element.getAttribute("anchor");
        return node;
    }

    /** Takes the title from the element's {@code <name>} child, if it has one. */
    void applyName(DocNode node, XmlElement element) throws UnknownStructureException {
        XmlElement name = element.firstChild("name");
        if (name != null) {
            node.titleContent = buildInline(name);
            node.title = plainText(name);
        }
    }

    DocNode unknownInline(XmlElement container, XmlElement element) throws UnknownStructureException {
        if (!options.isTolerateUnknown()) {
            throw new UnknownStructureException(element.getName(), null,
                    "not recognized inside <" + container.getName() + ">", element.getLine());
        }
        warnings.add(new ConversionWarning(ConversionWarning.Kind.UNKNOWN_ELEMENT, element.getName(),
                "unknown element <" + element.getName() + "> inside <" + container.getName() + "> passed through as text",
                element.getLine()));
        return passthrough(element.textContent(), element.getLine());
    }

    DocNode strayText(XmlElement container, XmlText text) throws UnknownStructureException {
        if (!options.isTolerateUnknown()) {
            throw new UnknownStructureException(container.getName(), null,
                    "text is not allowed directly inside this element", container.getLine());
        }
        warnings.add(new ConversionWarning(ConversionWarning.Kind.UNKNOWN_ELEMENT, "#text",
                "text directly inside <" + container.getName() + "> passed through", container.getLine()));
        return passthrough(text.getText(), container.getLine());
    }

    /**
     * Reports an attribute value the vocabulary does not define. Returns normally only when
     * unknown structures are tolerated, in which case the caller falls back to the default.
     */
    void unknownAttribute(XmlElement element, String attribute, String value, String detail) throws UnknownStructureException {
        if (!options.isTolerateUnknown()) {
            throw new UnknownStructureException(element.getName(), attribute + "=\"" + value + "\"", detail, element.getLine());
        }
        warnings.add(new ConversionWarning(ConversionWarning.Kind.UNKNOWN_ATTRIBUTE, element.getName(),
                "<" + element.getName() + " " + attribute + "=\"" + value + "\">: " + detail + ", using the default",
                element.getLine()));
    }

    private static DocNode passthrough(String text, int line) {
        DocNode node = new DocNode(NodeKind.PASSTHROUGH);
        node.text = collapse(text).trim();
        node.line = line;
        return node;
    }

    static DocNode paragraphOf(DocNode... inlines) {
        DocNode paragraph = new DocNode(NodeKind.PARAGRAPH);
        paragraph.children.addAll(List.of(inlines));
        return paragraph;
    }

    static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ");
    }

    static String plainText(XmlElement element) {
        return collapse(element.textContent()).trim();
    }
}
