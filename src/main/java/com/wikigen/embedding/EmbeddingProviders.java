package com.wikigen.embedding;

import java.time.Duration;
import java.util.Locale;

import com.wikigen.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingProviders {
    private EmbeddingProviders() {
    }

    public static EmbeddingProvider fromConfig(AppConfig.EmbeddingConfig config) {
        String provider = config.getProvider() == null ? "local" : config.getProvider().toLowerCase(Locale.ROOT);
        int dimension = config.getDimension();
        switch (provider) {
            case "local", "hashing" -> {
                return new LazyEmbeddingProvider(() -> new HashingEmbeddingProvider(dimension), dimension, "hashing-v1");
            }
            case "http", "openai", "ollama" -> {
                String endpoint = config.getEndpoint();
                if (endpoint == null || endpoint.isBlank()) {
                    throw new IllegalArgumentException("embedding.endpoint is required for provider " + provider);
                }
                String apiKey = config.getApiKeyEnv() == null ? null : System.getenv(config.getApiKeyEnv());
                return new LazyEmbeddingProvider(
                        () -> new HttpEmbeddingProvider(httpClient(config.getTimeoutMs()), endpoint, config.getModel(), apiKey, dimension),
                        dimension,
                        config.getModel());
            }
            default -> throw new IllegalArgumentException("Unknown embedding provider: " + config.getProvider());
        }
    }

    private static OkHttpClient httpClient(int timeoutMs) {
        Duration timeout = Duration.ofMillis(Math.max(1, timeoutMs));
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout.multipliedBy(2))
                .build();
    }
}
