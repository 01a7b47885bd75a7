package org.dxworks.rfcmark.model.doc;

/**
 * One converted document: its metadata plus the root of the node tree.
 * Built once, numbered and bound in place by the resolver, then only read.
 */
public class RfcDocument {
    public FrontMatter frontMatter = new FrontMatter();
    public DocNode root = new DocNode(NodeKind.DOCUMENT);
}
