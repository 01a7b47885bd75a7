package org.dxworks.rfcmark.builder;

import org.dxworks.rfcmark.UnknownStructureException;
import org.dxworks.rfcmark.model.doc.DocNode;
import org.dxworks.rfcmark.model.xml.XmlElement;

import java.util.List;

@FunctionalInterface
public interface NodeFactory {
    List<DocNode> create(XmlElement element) throws UnknownStructureException;
}
