package org.dxworks.rfcmark.builder;

import org.dxworks.rfcmark.ConversionException;
import org.dxworks.rfcmark.ConversionOptions;
import org.dxworks.rfcmark.ConversionWarning;
import org.dxworks.rfcmark.UnknownStructureException;
import org.dxworks.rfcmark.loader.XmlTreeLoader;
import org.dxworks.rfcmark.model.doc.DocNode;
import org.dxworks.rfcmark.model.doc.EmphasisStyle;
import org.dxworks.rfcmark.model.doc.NodeKind;
import org.dxworks.rfcmark.model.doc.RfcDocument;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ModelBuilderTest {

    private static final ConversionOptions STRICT = ConversionOptions.defaults();
    private static final ConversionOptions TOLERANT = ConversionOptions.builder().tolerateUnknown(true).build();

    @Test
    void build_nestsSectionsByDepth() throws ConversionException {
        RfcDocument document = build(middle(
                "<section anchor=\"a\"><name>First</name>"
                        + "<section anchor=\"b\"><name>Inner <tt>part</tt></name><t>x</t></section>"
                        + "</section>"), STRICT);

        DocNode outer = document.root.children.get(0);
        assertEquals(NodeKind.SECTION, outer.kind);
        assertEquals("a", outer.anchorId);
        assertEquals("First", outer.title);
        assertEquals(1, outer.depth);

        DocNode inner = outer.children.get(0);
        assertEquals(NodeKind.SECTION, inner.kind);
        assertEquals(2, inner.depth);
        assertEquals("Inner part", inner.title);
        assertEquals(EmphasisStyle.CODE, inner.titleContent.get(1).style);
        assertEquals(NodeKind.PARAGRAPH, inner.children.get(0).kind);
    }

    @Test
    void build_groupsLooseTextIntoParagraphs() throws ConversionException {
        RfcDocument document = build(middle(
                "<section><name>S</name>\n  text <em>here</em><ul><li>x</li></ul>tail\n</section>"), STRICT);

        List<DocNode> blocks = document.root.children.get(0).children;
        assertEquals(List.of(NodeKind.PARAGRAPH, NodeKind.UNORDERED_LIST, NodeKind.PARAGRAPH), kinds(blocks));
        assertEquals(EmphasisStyle.EMPHASIS, blocks.get(0).children.get(1).style);
    }

    @Test
    void build_unknownElement_failsByDefault() {
        UnknownStructureException e = assertThrows(UnknownStructureException.class,
                () -> build(middle("<section>\n<t>a <blink>b</blink></t></section>"), STRICT));

        assertEquals("blink", e.getTag());
        assertNull(e.getAttribute());
        assertEquals(2, e.getLine());
    }

    @Test
    void build_unknownElement_passedThroughWhenTolerated() throws ConversionException {
        ModelBuilder builder = new ModelBuilder(TOLERANT);
        RfcDocument document = builder.build(new XmlTreeLoader().load(
                middle("<section><t>a <blink>b  c</blink></t></section>")));

        DocNode paragraph = document.root.children.get(0).children.get(0);
        DocNode passthrough = paragraph.children.get(1);
        assertEquals(NodeKind.PASSTHROUGH, passthrough.kind);
        assertEquals("b c", passthrough.text);

        List<ConversionWarning> warnings = builder.getWarnings();
        assertEquals(1, warnings.size());
        assertEquals(ConversionWarning.Kind.UNKNOWN_ELEMENT, warnings.get(0).getKind());
        assertEquals("blink", warnings.get(0).getSubject());
    }

    @Test
    void build_rootOtherThanRfc_failsEvenWhenTolerated() {
        assertThrows(UnknownStructureException.class, () -> build("<html><body/></html>", TOLERANT));
    }

    @Test
    void build_tableRowsKeepSourceOrderWithoutPadding() throws ConversionException {
        RfcDocument document = build(middle("<section><table anchor=\"t\">"
                + "<tbody>"
                + "<tr><td>a</td><td>b</td><td>c</td></tr>"
                + "<tr><td>d</td><td>e</td><td>f</td></tr>"
                + "<tr><td>g</td><td>h</td></tr>"
                + "</tbody></table></section>"), STRICT);

        DocNode table = document.root.children.get(0).children.get(0);
        assertEquals(NodeKind.TABLE, table.kind);
        List<Integer> cellCounts = new ArrayList<>();
        for (DocNode row : table.children) {
            assertEquals(NodeKind.TABLE_ROW, row.kind);
            cellCounts.add(row.children.size());
        }
        assertEquals(List.of(3, 3, 2), cellCounts);
        assertEquals("h", table.children.get(2).children.get(1).children.get(0).children.get(0).text);
    }

    @Test
    void build_headerCellsKeepAlignment() throws ConversionException {
        RfcDocument document = build(middle("<section><table>"
                + "<thead><tr><th align=\"center\">H</th></tr></thead>"
                + "<tbody><tr><td>v</td></tr></tbody></table></section>"), STRICT);

        DocNode table = document.root.children.get(0).children.get(0);
        DocNode headerRow = table.children.get(0);
        assertTrue(headerRow.header);
        assertEquals("center", headerRow.children.get(0).property("align"));
        assertFalse(table.children.get(1).header);
    }

    @Test
    void build_artworkKeepsInnerWhitespace() throws ConversionException {
        RfcDocument document = build(middle(
                "<section><artwork><![CDATA[\n  a\n\tb\n    c\n]]></artwork></section>"), STRICT);

        DocNode artwork = document.root.children.get(0).children.get(0);
        assertEquals(NodeKind.ARTWORK, artwork.kind);
        assertEquals("  a\n\tb\n    c", artwork.text);
    }

    @Test
    void literalText_dropsOnlyTheFramingLineBreaks() {
        assertEquals("x", BlockRules.literalText("\r\nx\n   "));
        assertEquals("  x\n\n  y", BlockRules.literalText("\n  x\n\n  y\n"));
        assertEquals("", BlockRules.literalText("\n   \n"));
        assertEquals("  inline", BlockRules.literalText("  inline"));
    }

    @Test
    void build_figureLendsAnchorAndTitleToItsArtwork() throws ConversionException {
        RfcDocument document = build(middle("<section><figure anchor=\"fig\"><name>Layout</name>"
                + "<sourcecode anchor=\"inner\" type=\"abnf\">rule = 1*DIGIT</sourcecode>"
                + "</figure></section>"), STRICT);

        DocNode artwork = document.root.children.get(0).children.get(0);
        assertEquals(NodeKind.ARTWORK, artwork.kind);
        assertEquals("fig", artwork.anchorId);
        assertEquals("Layout", artwork.title);
        assertEquals("abnf", artwork.property("language"));
        assertEquals("true", artwork.property("figure"));
        assertEquals(NodeKind.ANCHOR, artwork.children.get(0).kind);
        assertEquals("inner", artwork.children.get(0).anchorId);
    }

    @Test
    void build_figurePreambleAndPostambleSurroundTheArtwork() throws ConversionException {
        RfcDocument document = build(middle("<section><figure><name>F</name>"
                + "<preamble>Before <em>this</em>:</preamble>"
                + "<artwork>x</artwork>"
                + "<postamble>After.</postamble><preamble> </preamble>"
                + "</figure></section>"), STRICT);

        List<DocNode> blocks = document.root.children.get(0).children;
        assertEquals(3, blocks.size());
        assertEquals(NodeKind.PARAGRAPH, blocks.get(0).kind);
        assertEquals(NodeKind.INLINE_EMPHASIS, blocks.get(0).children.get(1).kind);
        assertEquals(NodeKind.ARTWORK, blocks.get(1).kind);
        assertEquals("F", blocks.get(1).title);
        assertEquals(NodeKind.PARAGRAPH, blocks.get(2).kind);
        assertEquals("After.", blocks.get(2).children.get(0).text);
    }

    @Test
    void build_artsetPrefersAsciiArt() throws ConversionException {
        RfcDocument document = build(middle("<section><figure><artset>"
                + "<artwork type=\"svg\"><svg xmlns=\"http://www.w3.org/2000/svg\"/></artwork>"
                + "<artwork type=\"ascii-art\">[box]</artwork>"
                + "</artset></figure></section>"), STRICT);

        DocNode artwork = document.root.children.get(0).children.get(0);
        assertEquals("[box]", artwork.text);
        assertEquals("ascii-art", artwork.property("type"));
    }

    @Test
    void build_orderedListWithInvalidStart_isUnknownAttribute() {
        UnknownStructureException e = assertThrows(UnknownStructureException.class,
                () -> build(middle("<section><ol start=\"x\"><li>a</li></ol></section>"), STRICT));

        assertEquals("ol", e.getTag());
        assertEquals("start=\"x\"", e.getAttribute());
    }

    @Test
    void build_orderedListStartAndItems() throws ConversionException {
        RfcDocument document = build(middle("<section><ol start=\"4\"><li>a</li><li><t>b</t><t>c</t></li></ol></section>"), STRICT);

        DocNode list = document.root.children.get(0).children.get(0);
        assertEquals(NodeKind.ORDERED_LIST, list.kind);
        assertEquals("4", list.property("start"));
        assertEquals(2, list.children.size());
        assertEquals(2, list.children.get(1).children.size());
    }

    @Test
    void build_crossReferenceAttributes() throws ConversionException {
        RfcDocument document = build(middle("<section><t><xref target=\"RFC8446\" section=\"4.1\" sectionFormat=\"comma\"/>"
                + " <xref target=\"s\" format=\"title\">the text</xref></t></section>"), STRICT);

        List<DocNode> inline = document.root.children.get(0).children.get(0).children;
        DocNode withSection = inline.get(0);
        assertEquals(NodeKind.CROSS_REFERENCE, withSection.kind);
        assertEquals("RFC8446", withSection.targetId);
        assertEquals("4.1", withSection.property("section"));
        assertEquals("comma", withSection.property("sectionFormat"));

        DocNode withText = inline.get(2);
        assertEquals("title", withText.property("format"));
        assertEquals("the text", withText.children.get(0).text);
    }

    @Test
    void build_unsupportedSectionFormat_isUnknownAttribute() {
        UnknownStructureException e = assertThrows(UnknownStructureException.class,
                () -> build(middle("<section><t><xref target=\"a\" section=\"1\" sectionFormat=\"sideways\"/></t></section>"), STRICT));

        assertEquals("xref", e.getTag());
        assertEquals("sectionFormat=\"sideways\"", e.getAttribute());
    }

    @Test
    void build_unsupportedSectionFormat_toleratedFallsBackToOf() throws ConversionException {
        ModelBuilder builder = new ModelBuilder(TOLERANT);
        RfcDocument document = builder.build(new XmlTreeLoader().load(
                middle("<section><t><xref target=\"a\" section=\"1\" sectionFormat=\"sideways\"/></t></section>")));

        DocNode xref = document.root.children.get(0).children.get(0).children.get(0);
        assertEquals("of", xref.property("sectionFormat"));
        assertEquals(ConversionWarning.Kind.UNKNOWN_ATTRIBUTE, builder.getWarnings().get(0).getKind());
    }

    @Test
    void build_frontMatterAndAbstract() throws ConversionException {
        RfcDocument document = build("<rfc number=\"9000\" docName=\"draft-x-00\" category=\"std\">"
                + "<front><title abbrev=\"QUIC\">QUIC Transport</title>"
                + "<author initials=\"J.\" surname=\"Iyengar\" fullname=\"Jana Iyengar\" role=\"editor\">"
                + "<organization>Fastly</organization>"
                + "<address><postal><street>1 Main St</street><city>Springfield</city><country>US</country></postal>"
                + "<email>jri@example.com</email></address></author>"
                + "<date day=\"3\" month=\"May\" year=\"2021\"/>"
                + "<keyword>transport</keyword><keyword>udp</keyword>"
                + "<abstract><t>Summary.</t></abstract>"
                + "</front></rfc>", STRICT);

        assertEquals("QUIC Transport", document.frontMatter.title);
        assertEquals("QUIC", document.frontMatter.abbrev);
        assertEquals("9000", document.frontMatter.number);
        assertEquals("draft-x-00", document.frontMatter.docname);
        assertEquals("3 May 2021", document.frontMatter.date);
        assertEquals(List.of("transport", "udp"), document.frontMatter.keyword);
        assertEquals("J. Iyengar", document.frontMatter.author.get(0).ins);
        assertEquals("Springfield", document.frontMatter.author.get(0).city);
        assertEquals("jri@example.com", document.frontMatter.author.get(0).email);

        DocNode abstractSection = document.root.children.get(0);
        assertEquals(NodeKind.SECTION, abstractSection.kind);
        assertEquals("Abstract", abstractSection.title);
        assertFalse(abstractSection.numbered);
    }

    @Test
    void build_bibliographyEntries() throws ConversionException {
        RfcDocument document = build("<rfc><back>"
                + "<displayreference target=\"RFC2119\" to=\"KEYWORDS\"/>"
                + "<references><name>Normative References</name>"
                + "<reference anchor=\"RFC2119\" target=\"https://www.rfc-editor.org/info/rfc2119\">"
                + "<front><title>Key words</title><author initials=\"S.\" surname=\"Bradner\"/><date month=\"March\" year=\"1997\"/></front>"
                + "<seriesInfo name=\"BCP\" value=\"14\"/><seriesInfo name=\"RFC\" value=\"2119\"/></reference>"
                + "<reference anchor=\"TRIO\"><front><title>Three</title>"
                + "<author initials=\"A.\" surname=\"One\"/><author initials=\"B.\" surname=\"Two\" role=\"editor\"/>"
                + "<author><organization>Three Org</organization></author></front>"
                + "<refcontent>Work in Progress</refcontent></reference>"
                + "</references></back></rfc>", STRICT);

        DocNode references = document.root.children.get(0);
        assertEquals(NodeKind.SECTION, references.kind);
        assertFalse(references.appendix);
        assertEquals("Normative References", references.title);

        DocNode first = references.children.get(0);
        assertEquals(NodeKind.REFERENCE, first.kind);
        assertEquals("RFC2119", first.anchorId);
        assertEquals("KEYWORDS", first.property("label"));
        assertEquals("Bradner, S.", first.property("authors"));
        assertEquals("BCP 14, RFC 2119", first.property("series"));
        assertEquals("March 1997", first.property("date"));

        DocNode second = references.children.get(1);
        assertEquals("TRIO", second.property("label"));
        assertEquals("One, A., Two, B., Ed., and Three Org", second.property("authors"));
        assertEquals("Work in Progress", second.property("refcontent"));
    }

    @Test
    void build_backMatterSectionsAreAppendices() throws ConversionException {
        RfcDocument document = build("<rfc><middle><section><name>Body</name></section></middle>"
                + "<back><section><name>Extra</name><section><name>More</name></section></section></back></rfc>", STRICT);

        assertFalse(document.root.children.get(0).appendix);
        DocNode appendix = document.root.children.get(1);
        assertTrue(appendix.appendix);
        assertTrue(appendix.children.get(0).appendix);
        assertEquals(2, appendix.children.get(0).depth);
    }

    @Test
    void build_contactInTheBodyBecomesACard() throws ConversionException {
        RfcDocument document = build(middle("<section><name>Contributors</name>"
                + "<contact fullname=\"Ann Lee\"><organization>Org</organization>"
                + "<address><email>ann@example.com</email></address></contact>"
                + "<t>Thanks to <contact fullname=\"Bo Chen\"/>.</t></section>"), STRICT);

        List<DocNode> blocks = document.root.children.get(0).children;
        DocNode card = blocks.get(0);
        assertEquals(NodeKind.PARAGRAPH, card.kind);
        assertEquals(List.of(NodeKind.INLINE_TEXT, NodeKind.LINE_BREAK, NodeKind.INLINE_TEXT,
                NodeKind.LINE_BREAK, NodeKind.INLINE_TEXT), kinds(card.children));
        assertEquals("Email: ann@example.com", card.children.get(4).text);

        assertEquals("Bo Chen", blocks.get(1).children.get(1).text);
    }

    @Test
    void build_skipsEditorialElements() throws ConversionException {
        RfcDocument document = build(middle("<section><name>S</name>"
                + "<t>a<iref item=\"x\"/><cref>fix me</cref> b</t></section>"), STRICT);

        DocNode paragraph = document.root.children.get(0).children.get(0);
        assertEquals(List.of(NodeKind.INLINE_TEXT, NodeKind.INLINE_TEXT), kinds(paragraph.children));
    }

    private static RfcDocument build(String xml, ConversionOptions options) throws ConversionException {
        return new ModelBuilder(options).build(new XmlTreeLoader().load(xml));
    }

    private static String middle(String content) {
        return "<rfc><middle>" + content + "</middle></rfc>";
    }

    private static List<NodeKind> kinds(List<DocNode> nodes) {
        List<NodeKind> kinds = new ArrayList<>();
        for (DocNode node : nodes) {
            kinds.add(node.kind);
        }
        return kinds;
    }
}
