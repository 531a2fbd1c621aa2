package com.wikigen.index;

public record IndexedFile(
        long id,
        String filePath,
        String fileName,
        String resourceName,
        String directory,
        long size,
        double modifiedTime,
        double indexedTime,
        String contentHash) {
}
