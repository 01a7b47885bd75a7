package org.dxworks.rfcmark.batch;

/**
 * No document exists under the requested number.
 */
public class DocumentNotFoundException extends DocumentFetchException {

    public DocumentNotFoundException(int documentId, String location) {
        super(documentId, "RFC " + documentId + " not found at " + location);
    }
}
