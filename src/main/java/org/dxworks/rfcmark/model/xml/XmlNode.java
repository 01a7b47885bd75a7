package org.dxworks.rfcmark.model.xml;

/**
 * Marker interface for the children of an {@link XmlElement}: nested elements and text runs.
 */
public interface XmlNode {
}
