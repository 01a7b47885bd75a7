package org.dxworks.rfcmark.resolver;

import org.dxworks.rfcmark.ConversionWarning;
import org.dxworks.rfcmark.DuplicateAnchorException;
import org.dxworks.rfcmark.model.doc.DocNode;
import org.dxworks.rfcmark.model.doc.NodeKind;
import org.dxworks.rfcmark.model.doc.RfcDocument;

import java.util.ArrayList;
import java.util.List;

/**
 * Numbers sections, tables and figures and binds every cross-reference to its target.
 *
 * The numbering pass walks the tree in document order, keeping one counter per section
 * depth. Top-level sections of the back matter count separately with letters, so the first
 * appendix is "A" and its first subsection "A.1". Unnumbered sections take no number and
 * neither do their descendants. Tables and figures are numbered document-wide. The same walk
 * fills the anchor index, so the binding pass sees forward references as well.
 *
 * Binding never fails: a target missing from the index leaves the reference unresolved and
 * adds a warning.
 */
public class ReferenceResolver {

    private final AnchorIndex index = new AnchorIndex();
    private final List<Integer> sectionCounters = new ArrayList<>();
    private int mainSections;
    private int appendices;
    private int tables;
    private int figures;

    public List<ConversionWarning> resolve(RfcDocument document) throws DuplicateAnchorException {
        number(document.root, null, true);

        List<ConversionWarning> warnings = new ArrayList<>();
        bind(document.root, warnings);
        return warnings;
    }

    private void number(DocNode node, DocNode section, boolean numberedContext) throws DuplicateAnchorException {
        DocNode enclosing = section;
        boolean childContext = numberedContext;

        switch (node.kind) {
            case SECTION -> {
                if (numberedContext && node.numbered) {
                    node.number = sectionNumber(node);
                } else {
                    childContext = false;
                }
                enclosing = node;
            }
            case TABLE -> node.number = String.valueOf(++tables);
            case ARTWORK -> node.number = String.valueOf(++figures);
            case REFERENCE -> node.number = node.property("label");
            default -> {
            }
        }

        if (node.anchorId != null) {
            index.add(node, labelNode(node, section));
        }

        for (DocNode title : node.titleContent) {
            number(title, enclosing, childContext);
        }
        for (DocNode child : node.children) {
            if (child.kind == NodeKind.ANCHOR && child.anchorId != null && node.kind == NodeKind.ARTWORK) {
                index.add(child, node);
                continue;
            }
            number(child, enclosing, childContext);
        }
    }

    private String sectionNumber(DocNode section) {
        int depth = section.depth;
        if (depth <= 1) {
            sectionCounters.clear();
            if (section.appendix) {
                return letter(++appendices);
            }
            return String.valueOf(++mainSections);
        }

        // one entry per depth below the top level
        while (sectionCounters.size() < depth - 1) {
            sectionCounters.add(0);
        }
        while (sectionCounters.size() > depth - 1) {
            sectionCounters.remove(sectionCounters.size() - 1);
        }
        int last = depth - 2;
        sectionCounters.set(last, sectionCounters.get(last) + 1);

        StringBuilder number = new StringBuilder(section.appendix ? letter(appendices) : String.valueOf(mainSections));
        for (int counter : sectionCounters) {
            number.append('.').append(counter);
        }
        return number.toString();
    }

    private static DocNode labelNode(DocNode node, DocNode section) {
        return switch (node.kind) {
            case SECTION, TABLE, ARTWORK, REFERENCE -> node;
            default -> section;
        };
    }

    /** 1 is "A", 26 is "Z", 27 is "AA". */
    static String letter(int n) {
        StringBuilder sb = new StringBuilder();
        int value = n;
        while (value > 0) {
            value--;
            sb.insert(0, (char) ('A' + value % 26));
            value /= 26;
        }
        return sb.toString();
    }

    private void bind(DocNode node, List<ConversionWarning> warnings) {
        if (node.kind == NodeKind.CROSS_REFERENCE) {
            bindReference(node, warnings);
        }
        for (DocNode title : node.titleContent) {
            bind(title, warnings);
        }
        for (DocNode child : node.children) {
            bind(child, warnings);
        }
    }

    private void bindReference(DocNode xref, List<ConversionWarning> warnings) {
        AnchorIndex.Entry entry = index.find(xref.targetId);
        if (entry == null) {
            xref.resolved = false;
            warnings.add(new ConversionWarning(ConversionWarning.Kind.UNRESOLVED_REFERENCE, xref.targetId,
                    "unresolved cross-reference to \"" + xref.targetId + "\"", xref.line));
            return;
        }

        xref.resolved = true;
        DocNode label = entry.labelNode;
        if (label == null) {
            xref.targetKind = entry.node.kind;
            return;
        }
        xref.targetKind = label.kind;
        xref.targetNumber = label.number;
        xref.targetTitle = label.kind == NodeKind.REFERENCE ? label.property("title") : label.title;
        xref.targetAppendix = label.appendix;
    }
}
