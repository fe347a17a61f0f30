package com.pivotbot.backend.service.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.HttpClientErrorException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Local Ollama server: {@code POST /api/generate} without streaming, {@code GET /api/tags} as health check.
 */
public class OllamaBackend implements LLMBackend {

    private static final Logger logger = LoggerFactory.getLogger(OllamaBackend.class);

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    @Value("${advisor.ollama.url:http://localhost:11434}")
    private String baseUrl;

    @Value("${advisor.temperature:0.3}")
    private double temperature;

    @Value("${advisor.max-tokens:1000}")
    private int maxTokens;

    @Value("${advisor.timeout-ms:120000}")
    private long requestTimeoutMs;

    @Value("${advisor.health-check-timeout-ms:5000}")
    private long healthCheckTimeoutMs;

    @Autowired
    public OllamaBackend(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String getBackendName() {
        return "OLLAMA";
    }

    @Override
    public boolean isAvailable() {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/tags"))
                .timeout(Duration.ofMillis(healthCheckTimeoutMs))
                .GET()
                .build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            if (HttpStatusCode.valueOf(response.statusCode()).is2xxSuccessful()) {
                return true;
            }
            logger.warn("Ollama at {} responded with status {}", baseUrl, response.statusCode());
            return false;
        } catch (IOException e) {
            logger.warn("Cannot connect to Ollama at {}: {}", baseUrl, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public String complete(String prompt, String model)
            throws IOException, InterruptedException, HttpClientErrorException {

        ObjectNode requestBody = objectMapper.createObjectNode();
        requestBody.put("model", model);
        requestBody.put("prompt", prompt);
        requestBody.put("stream", false);
        ObjectNode options = requestBody.putObject("options");
        options.put("temperature", temperature);
        options.put("num_predict", maxTokens);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/generate"))
                .timeout(Duration.ofMillis(requestTimeoutMs))
                .header("content-type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(requestBody)))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        HttpStatusCode statusCode = HttpStatusCode.valueOf(response.statusCode());
        if (statusCode.isError()) {
            throw new HttpClientErrorException(statusCode, response.body());
        }

        JsonNode responseJson = objectMapper.readTree(response.body());
        JsonNode text = responseJson.path("response");
        if (text.isTextual() && !text.asText().isBlank()) {
            return text.asText();
        }

        throw new IOException("Failed to extract text from Ollama response: " + response.body());
    }
}
