package org.dxworks.rfcmark.model.doc;

public enum NodeKind {
    DOCUMENT(false),
    SECTION(false),
    PARAGRAPH(false),
    ORDERED_LIST(false),
    UNORDERED_LIST(false),
    LIST_ITEM(false),
    DEFINITION_LIST(false),
    DEFINITION_TERM(false),
    DEFINITION_DESCRIPTION(false),
    BLOCK_QUOTE(false),
    TABLE(false),
    TABLE_ROW(false),
    TABLE_CELL(false),
    ARTWORK(false),
    REFERENCE(false),
    CROSS_REFERENCE(true),
    EXTERNAL_LINK(true),
    ANCHOR(true),
    INLINE_TEXT(true),
    INLINE_EMPHASIS(true),
    LINE_BREAK(true),
    PASSTHROUGH(true);

    private final boolean inline;

    NodeKind(boolean inline) {
        this.inline = inline;
    }

    /** Inline kinds live inside paragraphs, titles and terms; the rest are blocks or containers. */
    public boolean isInline() {
        return inline;
    }
}
