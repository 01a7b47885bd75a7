package org.dxworks.rfcmark.batch;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Downloads documents from the RFC Editor, or from any server following the same URL pattern.
 */
public class HttpDocumentSource implements DocumentSource {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final String urlPattern;
    private final HttpClient client;

    /** @param urlPattern {@link String#format} pattern with one {@code %d} for the document number */
    public HttpDocumentSource(String urlPattern) {
        this(urlPattern, HttpClient.newBuilder()
                .connectTimeout(TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public HttpDocumentSource(String urlPattern, HttpClient client) {
        this.urlPattern = urlPattern;
        this.client = client;
    }

    @Override
    public byte[] fetch(int documentId) throws DocumentFetchException {
        String url = locate(documentId);
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(TIMEOUT)
                .GET()
                .build();
        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            int status = response.statusCode();
            if (status == 404 || status == 410) {
                throw new DocumentNotFoundException(documentId, url);
            }
            if (status < 200 || status >= 300) {
                throw new DocumentFetchException(documentId, "GET " + url + " returned HTTP " + status);
            }
            return response.body();
        } catch (IOException e) {
            if (e instanceof DocumentFetchException fetchException) {
                throw fetchException;
            }
            throw new DocumentFetchException(documentId, "GET " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DocumentFetchException(documentId, "GET " + url + " interrupted", e);
        }
    }

    @Override
    public String locate(int documentId) {
        return String.format(urlPattern, documentId);
    }
}
