package com.wikigen.index;

public record Chunk(String content, int startPos, int endPos, int chunkIndex) {
}
