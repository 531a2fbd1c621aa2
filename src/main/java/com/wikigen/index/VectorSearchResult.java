package com.wikigen.index;

/**
 * @param distance squared L2 distance to the query; lower is more similar
 */
public record VectorSearchResult(long chunkId, float distance, ChunkMetadata metadata) {
}
