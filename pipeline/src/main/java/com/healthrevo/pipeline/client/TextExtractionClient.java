package com.healthrevo.pipeline.client;

import reactor.core.publisher.Mono;

/**
 * Opaque OCR collaborator: turns an uploaded PDF or image into plain text.
 */
public interface TextExtractionClient {

    /**
     * @param documentBase64 the document bytes, base64 encoded
     * @param contentType    MIME type of the document, e.g. {@code application/pdf}
     * @return the extracted text; errors with {@code UpstreamUnavailableException} once the retry
     * budget is spent
     */
    Mono<String> extractText(String documentBase64, String contentType);
}
