package com.wikigen.index;

public record CatalogStats(long totalFiles, long totalSize, long totalDirectories, String databasePath) {
}
