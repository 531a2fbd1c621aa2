package com.wikigen.index;

public record ChunkMetadata(String filePath, int chunkIndex, String content, int startPos, int endPos) {
}
