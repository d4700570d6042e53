package com.eainde.extraction.adapter;

/**
 * Boundary to the external natural-language extraction service.
 */
public interface ExtractionService {

    /**
     * Sends one request and returns the raw structured payload.
     *
     * @throws ExtractionServiceException when the service fails
     */
    String extract(ExtractionRequest request);
}
