package org.dxworks.rfcmark.batch;

import java.io.IOException;

/**
 * The text of a document could not be retrieved.
 */
public class DocumentFetchException extends IOException {

    private final int documentId;

    public DocumentFetchException(int documentId, String message) {
        super(message);
        this.documentId = documentId;
    }

    public DocumentFetchException(int documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }

    public int getDocumentId() {
        return documentId;
    }
}
