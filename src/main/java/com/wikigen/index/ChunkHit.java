package com.wikigen.index;

/**
 * One search hit. Keyword-only hits (semantic search off or unavailable) carry the
 * file fields only: {@code chunkIndex} is -1 and {@code content} is empty.
 *
 * @param score squared L2 distance of the chunk to the query, lower is better
 */
public record ChunkHit(
        String filePath,
        String fileName,
        String resourceName,
        String directory,
        int chunkIndex,
        String content,
        int startPos,
        int endPos,
        double score) {

    public static ChunkHit of(IndexedFile file, ChunkMetadata chunk, double score) {
        return new ChunkHit(file.filePath(), file.fileName(), file.resourceName(), file.directory(),
                chunk.chunkIndex(), chunk.content(), chunk.startPos(), chunk.endPos(), score);
    }

    public static ChunkHit fileOnly(IndexedFile file) {
        return new ChunkHit(file.filePath(), file.fileName(), file.resourceName(), file.directory(),
                -1, "", 0, 0, 0d);
    }

    public boolean hasChunk() {
        return chunkIndex >= 0;
    }
}
