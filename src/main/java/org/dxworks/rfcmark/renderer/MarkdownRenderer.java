package org.dxworks.rfcmark.renderer;

import org.dxworks.rfcmark.ConversionOptions;
import org.dxworks.rfcmark.RenderException;
import org.dxworks.rfcmark.model.doc.DocNode;
import org.dxworks.rfcmark.model.doc.NodeKind;
import org.dxworks.rfcmark.model.doc.RfcDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Renders a numbered and bound document as Markdown.
 *
 * Blocks are separated by one blank line and the output ends with a single newline.
 * Anchors become empty HTML anchors placed at the start of the first line of the node
 * that declares them, so headings and list items keep their own syntax. Literal blocks
 * are fenced and copied unchanged; every other text goes through {@link MarkdownEscaper}.
 */
public class MarkdownRenderer {

    private static final String HARD_BREAK = "\n";
    private static final String HEADING_BREAK = " ";
    private static final String CELL_BREAK = "<br>";
    private static final int MIN_LIST_INDENT = 4;
    private static final int DEFINITION_INDENT = 4;
    private static final int QUOTE_INDENT = 2;
    private static final Pattern ABSOLUTE_URL = Pattern.compile("[A-Za-z][A-Za-z0-9+.-]{1,31}:[^\\s<>]*");

    private final ConversionOptions options;
    private final FrontMatterWriter frontMatterWriter = new FrontMatterWriter();

    public MarkdownRenderer(ConversionOptions options) {
        this.options = options;
    }

    public String render(RfcDocument document) throws RenderException {
        StringBuilder out = new StringBuilder();
        if (options.isFrontMatter() && document.frontMatter != null) {
            String frontMatter = frontMatterWriter.write(document.frontMatter);
            if (!frontMatter.isEmpty()) {
                out.append(frontMatter).append('\n');
            }
        }
        TextWrapper wrapper = new TextWrapper(options.getReflowWidth());
        out.append(String.join("\n\n", renderBlocks(document.root.children, wrapper)));

        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == '\n') {
            end--;
        }
        out.setLength(end);
        return out.append('\n').toString();
    }

    private List<String> renderBlocks(List<DocNode> nodes, TextWrapper wrapper) throws RenderException {
        List<String> blocks = new ArrayList<>();
        for (DocNode node : nodes) {
            String block = renderBlock(node, wrapper);
            if (!block.isEmpty()) {
                blocks.add(block);
            }
        }
        return blocks;
    }

    private String renderBlock(DocNode node, TextWrapper wrapper) throws RenderException {
        return switch (node.kind) {
            case SECTION -> section(node, wrapper);
            case PARAGRAPH -> paragraph(node, wrapper);
            case ORDERED_LIST, UNORDERED_LIST -> list(node, wrapper);
            case DEFINITION_LIST -> definitionList(node, wrapper);
            case BLOCK_QUOTE -> blockQuote(node, wrapper);
            case TABLE -> table(node);
            case ARTWORK -> artwork(node);
            case REFERENCE -> reference(node, wrapper);
            case LIST_ITEM, DEFINITION_DESCRIPTION, TABLE_CELL -> withAnchor(node, renderBlocks(node.children, wrapper));
            default -> throw new RenderException("Cannot render " + node.kind + " as a block (line " + node.line + ")");
        };
    }

    private String section(DocNode section, TextWrapper wrapper) throws RenderException {
        List<String> parts = new ArrayList<>();
        parts.add(heading(section));
        parts.addAll(renderBlocks(section.children, wrapper));
        return String.join("\n\n", parts);
    }

    private String heading(DocNode section) throws RenderException {
        int level = Math.min(Math.max(1, section.depth), options.getMaxHeadingLevel());
        String prefix = "";
        if (options.isNumberingInHeadings() && section.number != null) {
            prefix = section.appendix && section.depth == 1
                    ? "Appendix " + section.number + ". "
                    : section.number + ". ";
        }
        String title = MarkdownEscaper.escapeHeadingEnd(renderInline(section.titleContent, HEADING_BREAK).trim());
        return ("#".repeat(level) + " " + anchorTag(section) + prefix + title).stripTrailing();
    }

    private String paragraph(DocNode paragraph, TextWrapper wrapper) throws RenderException {
        List<String> lines = proseLines(renderInline(paragraph.children, HARD_BREAK), wrapper);
        if (lines.isEmpty()) {
            return anchorTag(paragraph);
        }
        lines.set(0, anchorTag(paragraph) + lines.get(0));
        return String.join("\n", lines);
    }

    /**
     * Splits rendered inline text at its hard breaks, wraps each segment and makes the first
     * word of each segment safe at the start of a line.
     */
    private static List<String> proseLines(String inline, TextWrapper wrapper) {
        List<String> segments = new ArrayList<>();
        for (String segment : inline.split(HARD_BREAK)) {
            String trimmed = segment.trim();
            if (!trimmed.isEmpty()) {
                segments.add(trimmed);
            }
        }

        List<String> lines = new ArrayList<>();
        for (int i = 0; i < segments.size(); i++) {
            List<String> wrapped = new ArrayList<>(wrapper.wrap(segments.get(i)));
            String first = wrapped.get(0);
            int space = first.indexOf(' ');
            String firstWord = space < 0 ? first : first.substring(0, space);
            wrapped.set(0, MarkdownEscaper.escapeLineStart(firstWord) + (space < 0 ? "" : first.substring(space)));
            if (i < segments.size() - 1) {
                int last = wrapped.size() - 1;
                wrapped.set(last, wrapped.get(last) + "\\");
            }
            lines.addAll(wrapped);
        }
        return lines;
    }

    private String list(DocNode list, TextWrapper wrapper) throws RenderException {
        boolean ordered = list.kind == NodeKind.ORDERED_LIST;
        int start = 1;
        if (ordered && list.property("start") != null) {
            start = Integer.parseInt(list.property("start"));
        }

        List<String> markers = new ArrayList<>();
        int widest = 0;
        for (int i = 0; i < list.children.size(); i++) {
            String marker = ordered ? (start + i) + "." : "-";
            markers.add(marker);
            widest = Math.max(widest, marker.length());
        }
        int indent = Math.max(MIN_LIST_INDENT, widest + 1);
        TextWrapper inner = wrapper.indented(indent);

        List<List<String>> items = new ArrayList<>();
        boolean loose = false;
        for (DocNode item : list.children) {
            List<String> blocks = item.kind == NodeKind.LIST_ITEM
                    ? anchoredBlocks(item, renderBlocks(item.children, inner))
                    : List.of(renderBlock(item, inner));
            loose |= blocks.size() > 1;
            items.add(blocks);
        }

        List<String> rendered = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            rendered.add(hangingIndent(markers.get(i), indent, String.join("\n\n", items.get(i))));
        }
        String body = String.join(loose ? "\n\n" : "\n", rendered);
        return list.anchorId != null ? anchorTag(list) + "\n\n" + body : body;
    }

    private String definitionList(DocNode list, TextWrapper wrapper) throws RenderException {
        TextWrapper inner = wrapper.indented(DEFINITION_INDENT);
        StringBuilder out = new StringBuilder();
        if (list.anchorId != null) {
            out.append(anchorTag(list));
        }
        NodeKind previous = null;
        for (DocNode entry : list.children) {
            String text;
            if (entry.kind == NodeKind.DEFINITION_TERM) {
                String term = renderInline(entry.children, HEADING_BREAK).trim();
                text = anchorTag(entry) + escapeFirstWord(term);
            } else if (entry.kind == NodeKind.DEFINITION_DESCRIPTION) {
                List<String> blocks = anchoredBlocks(entry, renderBlocks(entry.children, inner));
                text = hangingIndent(":", DEFINITION_INDENT, String.join("\n\n", blocks));
            } else {
                text = renderBlock(entry, inner);
            }
            if (text.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                boolean describesTerm = previous == NodeKind.DEFINITION_TERM && entry.kind == NodeKind.DEFINITION_DESCRIPTION;
                out.append(describesTerm ? "\n" : "\n\n");
            }
            out.append(text);
            previous = entry.kind;
        }
        return out.toString();
    }

    private String blockQuote(DocNode quote, TextWrapper wrapper) throws RenderException {
        List<String> blocks = anchoredBlocks(quote, renderBlocks(quote.children, wrapper.indented(QUOTE_INDENT)));
        if (blocks.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        for (String line : String.join("\n\n", blocks).split("\n", -1)) {
            lines.add(line.isEmpty() ? ">" : "> " + line);
        }
        return String.join("\n", lines);
    }

    private String table(DocNode table) throws RenderException {
        List<DocNode> rows = new ArrayList<>();
        for (DocNode child : table.children) {
            if (child.kind == NodeKind.TABLE_ROW) {
                rows.add(child);
            }
        }
        int columns = 1;
        DocNode headerRow = null;
        for (DocNode row : rows) {
            columns = Math.max(columns, row.children.size());
            if (headerRow == null && row.header) {
                headerRow = row;
            }
        }

        List<String> lines = new ArrayList<>();
        lines.add(tableRow(headerRow != null ? cells(headerRow) : List.of(), columns));
        lines.add(delimiterRow(headerRow != null ? headerRow : rows.isEmpty() ? null : rows.get(0), columns));
        for (DocNode row : rows) {
            if (row != headerRow) {
                lines.add(tableRow(cells(row), columns));
            }
        }

        return String.join("\n", lines) + "\n\n" + caption(table, "Table");
    }

    private List<String> cells(DocNode row) throws RenderException {
        List<String> cells = new ArrayList<>();
        for (DocNode cell : row.children) {
            cells.add(cell(cell));
        }
        return cells;
    }

    private String cell(DocNode cell) throws RenderException {
        List<String> parts = new ArrayList<>();
        for (DocNode block : cell.children) {
            String part;
            if (block.kind == NodeKind.PARAGRAPH) {
                part = anchorTag(block) + renderInline(block.children, CELL_BREAK).trim();
            } else if (block.kind == NodeKind.ARTWORK) {
                part = cellLiteral(block);
            } else {
                part = renderBlock(block, new TextWrapper(0)).replace("\n", CELL_BREAK);
            }
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return (anchorTag(cell) + String.join(CELL_BREAK, parts)).replace("|", "\\|");
    }

    /** Short rows are padded with empty cells; long rows are never cut. */
    private static String tableRow(List<String> cells, int columns) {
        List<String> padded = new ArrayList<>(cells);
        while (padded.size() < columns) {
            padded.add("");
        }
        return "| " + String.join(" | ", padded) + " |";
    }

    private static String delimiterRow(DocNode alignmentRow, int columns) {
        List<String> delimiters = new ArrayList<>();
        for (int i = 0; i < columns; i++) {
            String align = alignmentRow != null && i < alignmentRow.children.size()
                    ? alignmentRow.children.get(i).property("align")
                    : null;
            delimiters.add(align == null ? "---" : switch (align) {
                case "left" -> ":--";
                case "center" -> ":-:";
                case "right" -> "--:";
                default -> "---";
            });
        }
        return "| " + String.join(" | ", delimiters) + " |";
    }

    private String artwork(DocNode artwork) throws RenderException {
        String text = artwork.text == null ? "" : artwork.text;
        String fence = "`".repeat(Math.max(3, longestRun(text, '`') + 1));
        String language = artwork.property("language");
        String info = language != null ? language.replace("`", "") : "";
        StringBuilder block = new StringBuilder(fence).append(info).append('\n');
        for (String part : literalBody(artwork)) {
            block.append(part).append('\n');
        }
        block.append(fence);

        if (needsCaption(artwork)) {
            block.append("\n\n").append(caption(artwork, "Figure"));
        }
        return block.toString();
    }

    /** The literal text, framed by the code markers when the source asks for them. */
    private static List<String> literalBody(DocNode artwork) {
        String text = artwork.text == null ? "" : artwork.text;
        List<String> body = new ArrayList<>();
        boolean markers = "true".equals(artwork.property("markers"));
        if (markers) {
            String name = artwork.property("name");
            body.add(name != null ? "<CODE BEGINS> file \"" + name + "\"" : "<CODE BEGINS>");
        }
        if (!text.isEmpty()) {
            body.add(text);
        }
        if (markers) {
            body.add("<CODE ENDS>");
        }
        return body;
    }

    /**
     * A table row is a single line, so a literal block in a cell becomes an HTML {@code pre}
     * element with its line breaks and markup characters written as character references.
     */
    private String cellLiteral(DocNode artwork) throws RenderException {
        String text = String.join("\n", literalBody(artwork));
        StringBuilder sb = new StringBuilder(anchorTag(artwork)).append("<pre><code>");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\n' -> sb.append("&#10;");
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '|', '\\', '*', '_', '`', '[', ']', '~' -> sb.append("&#").append((int) c).append(';');
                default -> sb.append(c);
            }
        }
        sb.append("</code></pre>");
        if (needsCaption(artwork)) {
            sb.append(CELL_BREAK).append(caption(artwork, "Figure"));
        }
        return sb.toString();
    }

    private static boolean needsCaption(DocNode artwork) {
        if ("true".equals(artwork.property("figure")) || artwork.title != null || artwork.anchorId != null) {
            return true;
        }
        for (DocNode child : artwork.children) {
            if (child.kind == NodeKind.ANCHOR) {
                return true;
            }
        }
        return false;
    }

    private String caption(DocNode node, String label) throws RenderException {
        StringBuilder caption = new StringBuilder(anchorTag(node));
        for (DocNode child : node.children) {
            if (child.kind == NodeKind.ANCHOR) {
                caption.append(anchorTag(child));
            }
        }
        caption.append(label);
        if (node.number != null) {
            caption.append(' ').append(node.number);
        }
        String title = renderInline(node.titleContent, HEADING_BREAK).trim();
        if (!title.isEmpty()) {
            caption.append(": ").append(title);
        }
        return caption.toString();
    }

    private String reference(DocNode reference, TextWrapper wrapper) {
        StringBuilder text = new StringBuilder();
        text.append("\\[").append(MarkdownEscaper.escape(reference.property("label"))).append("\\]");
        if ("true".equals(reference.property("group"))) {
            for (DocNode member : reference.children) {
                if (member.kind == NodeKind.REFERENCE) {
                    text.append(HARD_BREAK).append(anchorTag(member)).append(referenceBody(member));
                }
            }
            if (reference.property("target") != null) {
                text.append(HARD_BREAK).append(link(reference.property("target")));
            }
        } else {
            text.append(' ').append(referenceBody(reference));
        }

        List<String> lines = proseLines(text.toString(), wrapper);
        lines.set(0, anchorTag(reference) + lines.get(0));
        return String.join("\n", lines);
    }

    /** Authors, "Title", series, refcontent, date, target. */
    private static String referenceBody(DocNode reference) {
        List<String> parts = new ArrayList<>();
        addEscaped(parts, reference.property("authors"));
        if (reference.property("title") != null) {
            parts.add("\"" + MarkdownEscaper.escape(reference.property("title")) + "\"");
        }
        addEscaped(parts, reference.property("series"));
        addEscaped(parts, reference.property("refcontent"));
        addEscaped(parts, reference.property("date"));
        if (reference.property("target") != null) {
            parts.add(link(reference.property("target")));
        }
        return parts.isEmpty() ? "" : String.join(", ", parts) + ".";
    }

    private static void addEscaped(List<String> parts, String value) {
        if (value != null) {
            parts.add(MarkdownEscaper.escape(value));
        }
    }

    private String renderInline(List<DocNode> nodes, String lineBreak) throws RenderException {
        StringBuilder sb = new StringBuilder();
        for (DocNode node : nodes) {
            sb.append(renderInline(node, lineBreak));
        }
        return sb.toString();
    }

    private String renderInline(DocNode node, String lineBreak) throws RenderException {
        return switch (node.kind) {
            case INLINE_TEXT -> MarkdownEscaper.escape(node.text);
            case PASSTHROUGH -> node.text;
            case LINE_BREAK -> lineBreak;
            case INLINE_EMPHASIS -> emphasis(node, lineBreak);
            case CROSS_REFERENCE -> crossReference(node, lineBreak);
            case EXTERNAL_LINK -> externalLink(node, lineBreak);
            case ANCHOR -> anchorTag(node);
            default -> throw new RenderException("Cannot render " + node.kind + " inside running text (line " + node.line + ")");
        };
    }

    private String emphasis(DocNode node, String lineBreak) throws RenderException {
        String inner = switch (node.style) {
            case CODE -> node.text == null ? "" : node.text;
            default -> renderInline(node.children, lineBreak);
        };
        String core = inner.strip();
        if (core.isEmpty()) {
            return inner;
        }
        // markers must touch the text, so surrounding spaces go outside
        String leading = inner.substring(0, inner.indexOf(core));
        String trailing = inner.substring(inner.indexOf(core) + core.length());
        String marked = switch (node.style) {
            case EMPHASIS -> "*" + core + "*";
            case STRONG -> "**" + core + "**";
            case CODE -> codeSpan(core);
            case UNDERLINE -> "<u>" + core + "</u>";
            case SUPERSCRIPT -> "<sup>" + core + "</sup>";
            case SUBSCRIPT -> "<sub>" + core + "</sub>";
        };
        return leading + marked + trailing;
    }

    static String codeSpan(String content) {
        String fence = "`".repeat(longestRun(content, '`') + 1);
        boolean pad = content.startsWith("`") || content.endsWith("`");
        return pad ? fence + " " + content + " " + fence : fence + content + fence;
    }

    private String crossReference(DocNode xref, String lineBreak) throws RenderException {
        String content = renderInline(xref.children, lineBreak).trim();
        String target = xref.targetId;
        if (!xref.resolved) {
            // a code span keeps the id searchable exactly as written in the source
            String marker = "\\[\\[" + codeSpan(target) + "\\]\\]";
            return content.isEmpty() ? marker : content + " " + marker;
        }

        String destination = "#" + target;
        String section = xref.property("section");
        if (section != null) {
            String linkText = content.isEmpty() ? defaultText(xref) : content;
            String link = "[" + linkText + "](" + destination(destination) + ")";
            String sectionText = (Character.isLetter(section.charAt(0)) ? "Appendix " : "Section ")
                    + MarkdownEscaper.escape(section);
            return switch (xref.property("sectionFormat")) {
                case "comma" -> link + ", " + sectionText;
                case "parens" -> link + " (" + sectionText + ")";
                case "bare" -> "[" + MarkdownEscaper.escape(section) + "](" + destination(destination) + ")";
                default -> sectionText + " of " + link;
            };
        }

        String linkText;
        if (!content.isEmpty()) {
            linkText = content;
        } else {
            String format = xref.property("format") != null ? xref.property("format") : "default";
            linkText = switch (format) {
                case "counter" -> xref.targetNumber != null
                        ? MarkdownEscaper.escape(xref.targetNumber)
                        : MarkdownEscaper.escape(target);
                case "title" -> xref.targetTitle != null ? MarkdownEscaper.escape(xref.targetTitle) : defaultText(xref);
                case "none" -> MarkdownEscaper.escape(target);
                default -> defaultText(xref);
            };
        }
        return "[" + linkText + "](" + destination(destination) + ")";
    }

    private String defaultText(DocNode xref) {
        String number = xref.targetNumber;
        if (options.getXrefText() == ConversionOptions.XrefText.TITLE && xref.targetTitle != null
                && xref.targetKind != NodeKind.REFERENCE) {
            return MarkdownEscaper.escape(xref.targetTitle);
        }
        if (number == null) {
            return MarkdownEscaper.escape(xref.targetTitle != null ? xref.targetTitle : xref.targetId);
        }
        return switch (xref.targetKind) {
            case TABLE -> "Table " + number;
            case ARTWORK -> "Figure " + number;
            case REFERENCE -> "\\[" + MarkdownEscaper.escape(number) + "\\]";
            default -> (xref.targetAppendix ? "Appendix " : "Section ") + number;
        };
    }

    private String externalLink(DocNode link, String lineBreak) throws RenderException {
        String url = link.targetId;
        String content = renderInline(link.children, lineBreak).trim();
        if (content.isEmpty()) {
            return link(url);
        }
        if ("angle".equals(link.property("brackets"))) {
            return content + " " + link(url);
        }
        return "[" + content + "](" + destination(url) + ")";
    }

    /** An autolink for absolute URLs, escaped text for anything else. */
    private static String link(String url) {
        if (ABSOLUTE_URL.matcher(url).matches()) {
            return "<" + url + ">";
        }
        return MarkdownEscaper.escape(url);
    }

    private static String destination(String url) {
        if (url.matches(".*[\\s()<>].*")) {
            return "<" + url.replace("<", "%3C").replace(">", "%3E").replace(" ", "%20") + ">";
        }
        return url;
    }

    private static String anchorTag(DocNode node) {
        if (node.anchorId == null) {
            return "";
        }
        String id = node.anchorId.replace("&", "&amp;").replace("\"", "&quot;")
                .replace("<", "&lt;").replace(">", "&gt;");
        return "<a id=\"" + id + "\"></a>";
    }

    /** Puts the container's anchor on its first paragraph, or on a line of its own before other blocks. */
    private static List<String> anchoredBlocks(DocNode container, List<String> blocks) {
        if (container.anchorId == null) {
            return blocks;
        }
        List<String> anchored = new ArrayList<>(blocks);
        boolean startsWithParagraph = !container.children.isEmpty()
                && container.children.get(0).kind == NodeKind.PARAGRAPH
                && !anchored.isEmpty();
        if (startsWithParagraph) {
            anchored.set(0, anchorTag(container) + anchored.get(0));
        } else {
            anchored.add(0, anchorTag(container));
        }
        return anchored;
    }

    private static String withAnchor(DocNode container, List<String> blocks) {
        return String.join("\n\n", anchoredBlocks(container, blocks));
    }

    /** Marker on the first line, the rest indented to the content column; empty lines stay empty. */
    private static String hangingIndent(String marker, int indent, String content) {
        if (content.isEmpty()) {
            return marker;
        }
        String padding = " ".repeat(indent);
        String[] lines = content.split("\n", -1);
        StringBuilder sb = new StringBuilder(marker).append(" ".repeat(indent - marker.length())).append(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            sb.append('\n');
            if (!lines[i].isEmpty()) {
                sb.append(padding).append(lines[i]);
            }
        }
        return sb.toString();
    }

    private static String escapeFirstWord(String text) {
        int space = text.indexOf(' ');
        String firstWord = space < 0 ? text : text.substring(0, space);
        return MarkdownEscaper.escapeLineStart(firstWord) + (space < 0 ? "" : text.substring(space));
    }

    private static int longestRun(String text, char c) {
        int longest = 0;
        int current = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                current++;
                longest = Math.max(longest, current);
            } else {
                current = 0;
            }
        }
        return longest;
    }
}
