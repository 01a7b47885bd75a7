package org.dxworks.rfcmark.model.doc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the intermediate document model. The {@link #kind} tells which of the fields
 * below are meaningful; every node owns its children exclusively.
 */
public class DocNode {
    public NodeKind kind;
    public String anchorId; // nullable, unique within a document
    public String title; // plain text of the <name> child, nullable
    public List<DocNode> titleContent = new ArrayList<>(); // inline content of the <name> child
    public String text; // INLINE_TEXT, PASSTHROUGH and ARTWORK content
    public EmphasisStyle style; // INLINE_EMPHASIS
    public int depth; // SECTION nesting level, starting at 1
    public boolean numbered = true; // SECTION
    public boolean appendix; // SECTION in the back matter
    public boolean header; // TABLE_ROW from <thead>, TABLE_CELL from <th>
    public String number; // assigned by the resolver
    public int line; // source line of the element this node came from

    // CROSS_REFERENCE target and binding; EXTERNAL_LINK keeps its URL in targetId
    public String targetId;
    public boolean resolved;
    public NodeKind targetKind;
    public String targetNumber;
    public String targetTitle;
    public boolean targetAppendix;

    public Map<String, String> properties = new LinkedHashMap<>(); // kind specific attributes, e.g. language, align, start
    public List<DocNode> children = new ArrayList<>();

    public DocNode(NodeKind kind) {
        this.kind = kind;
    }

    public static DocNode text(String text) {
        DocNode node = new DocNode(NodeKind.INLINE_TEXT);
        node.text = text;
        return node;
    }

    public String property(String name) {
        return properties.get(name);
    }

    public boolean isInline() {
        return kind.isInline();
    }

    @Override
    public String toString() {
        return kind + (anchorId != null ? "#" + anchorId : "");
    }
}
