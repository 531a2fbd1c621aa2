package com.wikigen.index;

/**
 * @param indexSize stored rows, including vectors no longer reachable after removals
 */
public record VectorStoreStats(long totalChunks, long totalFilesWithChunks, long indexSize, int embeddingDimension) {
}
