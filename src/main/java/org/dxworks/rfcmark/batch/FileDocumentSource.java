package org.dxworks.rfcmark.batch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code rfc<N>-orig.xml} files from a directory.
 */
public class FileDocumentSource implements DocumentSource {

    public static final String INPUT_FILE_PATTERN = "rfc%d-orig.xml";

    private final Path directory;

    public FileDocumentSource(Path directory) {
        this.directory = directory;
    }

    public Path pathOf(int documentId) {
        return directory.resolve(String.format(INPUT_FILE_PATTERN, documentId));
    }

    @Override
    public byte[] fetch(int documentId) throws DocumentFetchException {
        Path path = pathOf(documentId);
        if (!Files.isRegularFile(path)) {
            throw new DocumentNotFoundException(documentId, path.toString());
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new DocumentFetchException(documentId, "Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String locate(int documentId) {
        return pathOf(documentId).toString();
    }
}
