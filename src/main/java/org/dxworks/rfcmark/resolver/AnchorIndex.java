package org.dxworks.rfcmark.resolver;

import org.dxworks.rfcmark.DuplicateAnchorException;
import org.dxworks.rfcmark.model.doc.DocNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Document-wide map from anchor id to the node declaring it.
 */
class AnchorIndex {

    /**
     * The declaring node, and the node whose number names it in a cross-reference: the node
     * itself for sections, tables, figures and bibliography entries, otherwise the figure or
     * section around it. The label node is null for anchors outside any section.
     */
    static final class Entry {
        final DocNode node;
        final DocNode labelNode;

        private Entry(DocNode node, DocNode labelNode) {
            this.node = node;
            this.labelNode = labelNode;
        }
    }

    private final Map<String, Entry> entries = new HashMap<>();

    void add(DocNode node, DocNode labelNode) throws DuplicateAnchorException {
        String anchorId = node.anchorId;
        if (anchorId.isBlank()) {
            throw new DuplicateAnchorException(anchorId, "Empty anchor id at line " + node.line);
        }
        Entry existing = entries.get(anchorId);
        if (existing != null) {
            throw new DuplicateAnchorException(anchorId, "Anchor \"" + anchorId + "\" declared at line "
                    + existing.node.line + " and again at line " + node.line);
        }
        entries.put(anchorId, new Entry(node, labelNode));
    }

    Entry find(String anchorId) {
        return entries.get(anchorId);
    }

    int size() {
        return entries.size();
    }
}
