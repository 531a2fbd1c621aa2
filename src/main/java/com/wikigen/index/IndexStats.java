package com.wikigen.index;

/**
 * @param vectorStats {@code null} when semantic search is off
 */
public record IndexStats(
        long totalFiles,
        long totalSize,
        long totalDirectories,
        String databasePath,
        boolean semanticSearchEnabled,
        VectorStoreStats vectorStats) {
}
