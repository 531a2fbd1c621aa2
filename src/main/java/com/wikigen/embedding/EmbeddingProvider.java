package com.wikigen.embedding;

import java.util.ArrayList;
import java.util.List;

public interface EmbeddingProvider {
    float[] embed(String text);

    default List<float[]> embedBatch(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    int dimension();

    default String modelName() {
        return "hashing-v1";
    }
}
