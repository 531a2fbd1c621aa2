package com.wikigen.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Embeds through a remote endpoint. Accepts OpenAI style ({@code data[].embedding}),
 * Ollama style ({@code embeddings[][]}) and single-vector ({@code embedding[]}) responses.
 */
public class HttpEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpEmbeddingProvider.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public HttpEmbeddingProvider(OkHttpClient httpClient, String endpoint, String model, String apiKey, int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        JsonNode root = post(texts);
        List<float[]> vectors = parse(root);
        if (vectors.size() != texts.size()) {
            throw new EmbeddingException("Endpoint returned %d embeddings for %d inputs"
                    .formatted(vectors.size(), texts.size()));
        }
        for (float[] vector : vectors) {
            if (vector.length != dimension) {
                throw new EmbeddingException("Endpoint returned dimension %d, expected %d"
                        .formatted(vector.length, dimension));
            }
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelName() {
        return model;
    }

    private JsonNode post(List<String> texts) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("input", texts);
        try {
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful() || body == null) {
                    throw new EmbeddingException("Embedding endpoint " + endpoint + " answered HTTP " + response.code());
                }
                return mapper.readTree(body.string());
            }
        } catch (IOException e) {
            log.debug("Embedding request to {} failed", endpoint, e);
            throw new EmbeddingException("Embedding request to " + endpoint + " failed: " + e.getMessage(), e);
        }
    }

    private List<float[]> parse(JsonNode root) {
        List<float[]> vectors = new ArrayList<>();
        JsonNode data = root.path("data");
        if (data.isArray()) {
            float[][] ordered = new float[data.size()][];
            for (int i = 0; i < data.size(); i++) {
                JsonNode item = data.get(i);
                int position = item.path("index").asInt(i);
                if (position < 0 || position >= ordered.length) {
                    throw new EmbeddingException("Embedding index out of range: " + position);
                }
                ordered[position] = toVector(item.path("embedding"));
            }
            for (float[] vector : ordered) {
                if (vector == null) {
                    throw new EmbeddingException("Embedding response has gaps in its index sequence");
                }
                vectors.add(vector);
            }
            return vectors;
        }
        JsonNode embeddings = root.path("embeddings");
        if (embeddings.isArray()) {
            for (JsonNode item : embeddings) {
                vectors.add(toVector(item));
            }
            return vectors;
        }
        JsonNode single = root.path("embedding");
        if (single.isArray()) {
            vectors.add(toVector(single));
            return vectors;
        }
        throw new EmbeddingException("Embedding response has no data, embeddings or embedding field");
    }

    private static float[] toVector(JsonNode node) {
        if (!node.isArray()) {
            throw new EmbeddingException("Embedding is not a JSON array");
        }
        float[] out = new float[node.size()];
        for (int i = 0; i < node.size(); i++) {
            out[i] = (float) node.get(i).asDouble();
        }
        return out;
    }
}
