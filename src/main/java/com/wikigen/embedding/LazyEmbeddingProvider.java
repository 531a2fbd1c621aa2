package com.wikigen.embedding;

import java.util.List;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Defers construction of the real provider until the first embedding call. The
 * configured dimension and model name are answered without initializing it.
 */
public class LazyEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(LazyEmbeddingProvider.class);

    private final Supplier<EmbeddingProvider> factory;
    private final int dimension;
    private final String modelName;
    private volatile EmbeddingProvider delegate;

    public LazyEmbeddingProvider(Supplier<EmbeddingProvider> factory, int dimension, String modelName) {
        this.factory = factory;
        this.dimension = dimension;
        this.modelName = modelName;
    }

    @Override
    public float[] embed(String text) {
        return delegate().embed(text);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        return delegate().embedBatch(texts);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelName() {
        return modelName;
    }

    public boolean isInitialized() {
        return delegate != null;
    }

    private EmbeddingProvider delegate() {
        EmbeddingProvider current = delegate;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (delegate == null) {
                EmbeddingProvider created = factory.get();
                if (created == null) {
                    throw new EmbeddingException("Embedding provider factory returned null");
                }
                if (created.dimension() != dimension) {
                    throw new EmbeddingException("Embedding model %s produces dimension %d, configured %d"
                            .formatted(created.modelName(), created.dimension(), dimension));
                }
                log.info("Initialized embedding model {} (dimension={})", created.modelName(), created.dimension());
                delegate = created;
            }
            return delegate;
        }
    }
}
