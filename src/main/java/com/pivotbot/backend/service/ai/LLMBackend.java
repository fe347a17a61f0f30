package com.pivotbot.backend.service.ai;

import org.springframework.web.client.HttpClientErrorException;

import java.io.IOException;

/**
 * Contract for a text-completion backend that the advisor can query.
 */
public interface LLMBackend {

    /**
     * Gets the unique name of the backend (e.g., "OLLAMA").
     * @return The backend's name.
     */
    String getBackendName();

    /**
     * Cheap reachability check made before a completion request.
     * @return true if the backend answered its health endpoint successfully.
     */
    boolean isAvailable();

    /**
     * Runs a single non-streaming completion.
     *
     * @param prompt The full prompt text.
     * @param model The model to run the prompt against.
     * @return The raw text the model produced.
     * @throws IOException If there is an issue with the underlying HTTP client or the response body.
     * @throws InterruptedException If the request is interrupted.
     * @throws HttpClientErrorException If the backend returns an HTTP error (4xx or 5xx).
     */
    String complete(String prompt, String model) throws IOException, InterruptedException, HttpClientErrorException;
}
