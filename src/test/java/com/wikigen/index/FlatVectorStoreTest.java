package com.wikigen.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FlatVectorStoreTest {

    private static final String MODEL = "test-model";

    @TempDir
    Path tempDir;

    @Test
    void shouldRejectMismatchedChunksAndEmbeddings() {
        FlatVectorStore store = newStore(4);

        assertThrows(IllegalArgumentException.class,
                () -> store.addChunks("a.md", chunks(2), List.of(vector(1, 0, 0, 0))));
        assertThrows(IllegalArgumentException.class,
                () -> store.addChunks("a.md", chunks(1), List.of(new float[] { 1, 0, 0 })));
        assertThrows(IllegalArgumentException.class, () -> store.search(new float[] { 1, 0 }, 3));
        assertEquals(0, store.getStats().totalChunks());
    }

    @Test
    void shouldReturnNearestChunksFirst() {
        FlatVectorStore store = newStore(4);
        store.addChunks("a.md", chunks(3), List.of(vector(1, 0, 0, 0), vector(0, 1, 0, 0), vector(0, 0, 1, 0)));

        List<VectorSearchResult> results = store.search(vector(0, 0.9f, 0.1f, 0), 3);

        assertEquals(3, results.size());
        assertEquals(1, results.get(0).metadata().chunkIndex());
        assertEquals(2, results.get(1).metadata().chunkIndex());
        assertEquals("a.md", results.get(0).metadata().filePath());
        assertTrue(results.get(0).distance() <= results.get(1).distance());
        assertTrue(store.search(vector(1, 0, 0, 0), 0).isEmpty());
    }

    @Test
    void shouldBreakDistanceTiesByChunkId() {
        FlatVectorStore store = newStore(4);
        store.addChunks("first.md", chunks(1), List.of(vector(1, 0, 0, 0)));
        store.addChunks("second.md", chunks(1), List.of(vector(1, 0, 0, 0)));

        List<VectorSearchResult> results = store.search(vector(1, 0, 0, 0), 2);

        assertEquals("first.md", results.get(0).metadata().filePath());
        assertEquals("second.md", results.get(1).metadata().filePath());
        assertTrue(results.get(0).chunkId() < results.get(1).chunkId());
    }

    @Test
    void shouldHideRemovedFileUntilCompaction() {
        FlatVectorStore store = newStore(4);
        store.addChunks("a.md", chunks(3), List.of(vector(1, 0, 0, 0), vector(1, 0, 0, 0), vector(1, 0, 0, 0)));
        store.addChunks("b.md", chunks(1), List.of(vector(0, 1, 0, 0)));

        store.removeFile("a.md");

        List<VectorSearchResult> results = store.search(vector(1, 0, 0, 0), 5);
        assertEquals(1, results.size());
        assertEquals("b.md", results.get(0).metadata().filePath());
        VectorStoreStats stats = store.getStats();
        assertEquals(1, stats.totalChunks());
        assertEquals(1, stats.totalFilesWithChunks());
        assertEquals(4, stats.indexSize());
        assertTrue(store.chunkIds("a.md").isEmpty());
    }

    @Test
    void shouldReplaceChunksWhenFileIsAddedAgain() {
        FlatVectorStore store = newStore(4);
        store.addChunks("a.md", chunks(2), List.of(vector(1, 0, 0, 0), vector(0, 1, 0, 0)));
        List<Long> oldIds = store.chunkIds("a.md");

        store.addChunks("a.md", chunks(1), List.of(vector(0, 0, 1, 0)));

        List<Long> newIds = store.chunkIds("a.md");
        assertEquals(1, newIds.size());
        assertFalse(oldIds.contains(newIds.get(0)));
        assertEquals(1, store.getStats().totalChunks());
        assertEquals(3, store.getStats().indexSize());

        store.addChunks("a.md", List.of(), List.of());
        assertEquals(0, store.getStats().totalChunks());
    }

    @Test
    void shouldApplyFileFilterAndPerFileCap() {
        FlatVectorStore store = newStore(4);
        List<float[]> many = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            many.add(vector(1, i * 0.01f, 0, 0));
        }
        store.addChunks("big.md", chunks(7), many);
        store.addChunks("small.md", chunks(1), List.of(vector(0.5f, 0.5f, 0, 0)));
        float[] query = vector(1, 0, 0, 0);

        List<VectorSearchResult> defaultCap = store.search(query, 10, List.of("big.md", "small.md"));
        assertEquals(FlatVectorStore.DEFAULT_MAX_CHUNKS_PER_FILE, countFor(defaultCap, "big.md"));
        assertEquals(1, countFor(defaultCap, "small.md"));

        List<VectorSearchResult> capped = store.search(query, 10, List.of("big.md", "small.md"), 2);
        assertEquals(2, countFor(capped, "big.md"));
        assertEquals(1, countFor(capped, "small.md"));

        List<VectorSearchResult> onlySmall = store.search(query, 10, List.of("small.md"));
        assertEquals(1, onlySmall.size());
        assertEquals("small.md", onlySmall.get(0).metadata().filePath());

        assertEquals(7, countFor(store.search(query, 10), "big.md"));
    }

    @Test
    void shouldPersistAndReload() throws Exception {
        FlatVectorStore store = newStore(4);
        store.addChunks("a.md", List.of(new Chunk("alpha text", 3, 13, 0)), List.of(vector(1, 0, 0, 0)));
        store.addChunks("b.md", chunks(1), List.of(vector(0, 1, 0, 0)));
        store.save();

        assertTrue(Files.exists(indexPath()));
        assertTrue(Files.exists(FlatVectorStore.metadataPathFor(indexPath())));

        assertFalse(store.wasLoadedFromDisk());
        FlatVectorStore reloaded = newStore(4);
        assertFalse(reloaded.wasResetOnLoad());
        assertTrue(reloaded.wasLoadedFromDisk());
        List<VectorSearchResult> results = reloaded.search(vector(1, 0, 0, 0), 1);
        ChunkMetadata chunk = results.get(0).metadata();
        assertEquals("a.md", chunk.filePath());
        assertEquals("alpha text", chunk.content());
        assertEquals(3, chunk.startPos());
        assertEquals(13, chunk.endPos());
        assertEquals(store.chunkIds("a.md"), reloaded.chunkIds("a.md"));

        reloaded.addChunks("c.md", chunks(1), List.of(vector(0, 0, 1, 0)));
        long newest = reloaded.chunkIds("c.md").get(0);
        assertTrue(newest > reloaded.chunkIds("b.md").get(0));
    }

    @Test
    void shouldPropagateSaveFailure() throws Exception {
        FlatVectorStore store = newStore(4);
        store.addChunks("a.md", chunks(1), List.of(vector(1, 0, 0, 0)));
        Files.createDirectories(tempDir.resolve("vector_index.bin.tmp"));

        assertThrows(IOException.class, store::save);
        assertFalse(Files.exists(indexPath()));
    }

    @Test
    void shouldStartEmptyWhenDimensionChanges() throws Exception {
        FlatVectorStore store = newStore(4);
        store.addChunks("a.md", chunks(1), List.of(vector(1, 0, 0, 0)));
        store.save();

        FlatVectorStore reloaded = new FlatVectorStore(indexPath(), 8, MODEL);

        assertTrue(reloaded.wasResetOnLoad());
        assertEquals(0, reloaded.getStats().totalChunks());
        assertEquals(8, reloaded.getStats().embeddingDimension());
    }

    @Test
    void shouldStartEmptyWhenModelChanges() throws Exception {
        FlatVectorStore store = newStore(4);
        store.addChunks("a.md", chunks(1), List.of(vector(1, 0, 0, 0)));
        store.save();

        FlatVectorStore reloaded = new FlatVectorStore(indexPath(), 4, "other-model");

        assertTrue(reloaded.wasResetOnLoad());
        assertEquals(0, reloaded.getStats().indexSize());
    }

    @Test
    void shouldStartEmptyWhenFilesAreCorruptOrIncomplete() throws Exception {
        FlatVectorStore store = newStore(4);
        store.addChunks("a.md", chunks(1), List.of(vector(1, 0, 0, 0)));
        store.save();

        Files.write(indexPath(), new byte[] { 1, 2, 3 });
        FlatVectorStore corrupt = newStore(4);
        assertTrue(corrupt.wasResetOnLoad());
        assertEquals(0, corrupt.getStats().totalChunks());

        Files.delete(indexPath());
        FlatVectorStore incomplete = newStore(4);
        assertTrue(incomplete.wasResetOnLoad());

        Files.delete(FlatVectorStore.metadataPathFor(indexPath()));
        FlatVectorStore fresh = newStore(4);
        assertFalse(fresh.wasResetOnLoad());
    }

    @Test
    void shouldCompactWithoutChangingChunkIds() throws Exception {
        FlatVectorStore store = newStore(4);
        store.addChunks("a.md", chunks(2), List.of(vector(1, 0, 0, 0), vector(1, 0, 0, 0)));
        store.addChunks("b.md", chunks(1), List.of(vector(0, 1, 0, 0)));
        long survivor = store.chunkIds("b.md").get(0);
        store.removeFile("a.md");

        assertEquals(2, store.compact());
        assertEquals(1, store.getStats().indexSize());
        assertEquals(0, store.compact());

        List<VectorSearchResult> results = store.search(vector(0, 1, 0, 0), 1);
        assertEquals(survivor, results.get(0).chunkId());

        store.save();
        assertEquals(survivor, newStore(4).search(vector(0, 1, 0, 0), 1).get(0).chunkId());
    }

    @Test
    void shouldClearEverything() {
        FlatVectorStore store = newStore(4);
        store.addChunks("a.md", chunks(2), List.of(vector(1, 0, 0, 0), vector(0, 1, 0, 0)));

        store.clear();

        assertEquals(0, store.getStats().indexSize());
        assertTrue(store.search(vector(1, 0, 0, 0), 5).isEmpty());
    }

    @Test
    void shouldDeriveSidecarName() {
        assertEquals(tempDir.resolve("vector_index.metadata.json"),
                FlatVectorStore.metadataPathFor(tempDir.resolve("vector_index.bin")));
    }

    private FlatVectorStore newStore(int dimension) {
        return new FlatVectorStore(indexPath(), dimension, MODEL);
    }

    private Path indexPath() {
        return tempDir.resolve("vector_index.bin");
    }

    private static List<Chunk> chunks(int count) {
        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            chunks.add(new Chunk("chunk " + i, i * 10, i * 10 + 10, i));
        }
        return chunks;
    }

    private static float[] vector(float... values) {
        return values;
    }

    private static long countFor(List<VectorSearchResult> results, String filePath) {
        return results.stream().filter(result -> result.metadata().filePath().equals(filePath)).count();
    }
}
