package com.adlanda.recommender.provider;

import com.adlanda.recommender.exception.ProviderFatalException;
import com.adlanda.recommender.exception.ProviderTransientException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Embedding provider calling the Cohere embed API. Used as the fallback
 * behind the primary provider.
 */
public class CohereEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(CohereEmbeddingProvider.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String apiKey;
    private final String model;
    private final int maxBatchSize;
    private final Duration timeout;

    public CohereEmbeddingProvider(HttpClient httpClient, ObjectMapper objectMapper, String apiUrl,
                                   String apiKey, String model, int maxBatchSize, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.model = model;
        this.maxBatchSize = maxBatchSize;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "cohere";
    }

    @Override
    public int maxBatchSize() {
        return maxBatchSize;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl))
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(texts)))
                .build();

        log.debug("Sending embedding request to Cohere for {} texts", texts.size());

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderTransientException("Cohere request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderTransientException("Cohere request interrupted", e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            log.warn("Cohere API error: {} - {}", status, response.body());
            throw new ProviderTransientException("Cohere API error: " + status);
        }
        if (status != 200) {
            log.error("Cohere API rejected request: {} - {}", status, response.body());
            throw new ProviderFatalException("Cohere API error: " + status);
        }

        return parseEmbeddings(response.body());
    }

    private String requestBody(List<String> texts) {
        try {
            return objectMapper.writeValueAsString(Map.of(
                    "texts", texts,
                    "model", model,
                    "input_type", "search_document"));
        } catch (IOException e) {
            throw new ProviderFatalException("Could not serialise Cohere request", e);
        }
    }

    private List<float[]> parseEmbeddings(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new ProviderTransientException("Unreadable Cohere response", e);
        }

        List<float[]> embeddings = new ArrayList<>();
        for (JsonNode item : root.path("embeddings")) {
            float[] vector = new float[item.size()];
            for (int i = 0; i < item.size(); i++) {
                vector[i] = (float) item.get(i).asDouble();
            }
            embeddings.add(vector);
        }
        return embeddings;
    }
}
