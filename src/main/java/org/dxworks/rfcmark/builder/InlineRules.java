package org.dxworks.rfcmark.builder;

import org.dxworks.rfcmark.UnknownStructureException;
import org.dxworks.rfcmark.model.doc.DocNode;
import org.dxworks.rfcmark.model.doc.EmphasisStyle;
import org.dxworks.rfcmark.model.doc.NodeKind;
import org.dxworks.rfcmark.model.xml.XmlElement;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rules for running text: emphasis, cross-references, external links and line breaks.
 */
class InlineRules {

    private static final Set<String> XREF_FORMATS = Set.of("default", "counter", "title", "none");
    private static final Set<String> SECTION_FORMATS = Set.of("of", "comma", "parens", "bare");

    private final ModelBuilder builder;

    InlineRules(ModelBuilder builder) {
        this.builder = builder;
    }

    void register(Map<String, TagRule> rules) {
        rules.put("em", TagRule.inline(element -> emphasis(element, EmphasisStyle.EMPHASIS)));
        rules.put("strong", TagRule.inline(element -> emphasis(element, EmphasisStyle.STRONG)));
        rules.put("tt", TagRule.inline(element -> emphasis(element, EmphasisStyle.CODE)));
        rules.put("u", TagRule.inline(element -> emphasis(element, EmphasisStyle.UNDERLINE)));
        rules.put("sup", TagRule.inline(element -> emphasis(element, EmphasisStyle.SUPERSCRIPT)));
        rules.put("sub", TagRule.inline(element -> emphasis(element, EmphasisStyle.SUBSCRIPT)));
        rules.put("bcp14", TagRule.inline(builder::buildInline));
        rules.put("br", TagRule.inline(element -> List.of(new DocNode(NodeKind.LINE_BREAK))));
        rules.put("xref", TagRule.inline(this::crossReference));
        rules.put("eref", TagRule.inline(this::externalLink));
        rules.put("iref", TagRule.skip());
        rules.put("cref", TagRule.skip());
        rules.put("svg", TagRule.skip());
    }

    private List<DocNode> emphasis(XmlElement element, EmphasisStyle style) throws UnknownStructureException {
        DocNode node = builder.newNode(NodeKind.INLINE_EMPHASIS, element);
        node.style = style;
        if (style == EmphasisStyle.CODE) {
            // code spans are literal, their content is not markup
            node.text = ModelBuilder.collapse(element.textContent());
        } else {
            node.children = builder.buildInline(element);
        }
        return List.of(node);
    }

    private List<DocNode> crossReference(XmlElement element) throws UnknownStructureException {
        String target = element.getAttribute("target");
        if (target == null) {
            builder.unknownAttribute(element, "target", "", "a cross-reference needs a target");
            return builder.buildInline(element);
        }

        DocNode xref = builder.newNode(NodeKind.CROSS_REFERENCE, element);
        xref.anchorId = null;
        xref.targetId = target.trim();
        xref.children = builder.buildInline(element);

        String format = element.getAttribute("format");
        if (format != null) {
            if (XREF_FORMATS.contains(format)) {
                xref.properties.put("format", format);
            } else {
                builder.unknownAttribute(element, "format", format, "unsupported cross-reference format");
            }
        }

        String section = element.getAttribute("section");
        if (section != null && !section.isBlank()) {
            xref.properties.put("section", section.trim());
            String sectionFormat = element.getAttribute("sectionFormat");
            if (sectionFormat == null) {
                xref.properties.put("sectionFormat", "of");
            } else if (SECTION_FORMATS.contains(sectionFormat)) {
                xref.properties.put("sectionFormat", sectionFormat);
            } else {
                builder.unknownAttribute(element, "sectionFormat", sectionFormat, "unsupported section format");
                xref.properties.put("sectionFormat", "of");
            }
            String relative = element.getAttribute("relative");
            if (relative != null) {
                xref.properties.put("relative", relative);
            }
        }
        return List.of(xref);
    }

    private List<DocNode> externalLink(XmlElement element) throws UnknownStructureException {
        String target = element.getAttribute("target");
        if (target == null || target.isBlank()) {
            builder.unknownAttribute(element, "target", target == null ? "" : target, "an external link needs a target");
            return builder.buildInline(element);
        }
        DocNode link = builder.newNode(NodeKind.EXTERNAL_LINK, element);
        link.targetId = target.trim();
        link.children = builder.buildInline(element);
        if (element.getAttribute("brackets") != null) {
            link.properties.put("brackets", element.getAttribute("brackets"));
        }
        return List.of(link);
    }
}
