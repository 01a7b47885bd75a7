package org.dxworks.rfcmark.model.doc;

public enum EmphasisStyle {
    EMPHASIS,
    STRONG,
    CODE,
    UNDERLINE,
    SUPERSCRIPT,
    SUBSCRIPT
}
