package org.dxworks.rfcmark.batch;

/**
 * Supplies the raw XML of a document given its number.
 */
public interface DocumentSource {

    byte[] fetch(int documentId) throws DocumentFetchException;

    /** Where the document is read from, for progress messages. */
    String locate(int documentId);
}
