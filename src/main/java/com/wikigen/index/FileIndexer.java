package com.wikigen.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wikigen.embedding.EmbeddingException;
import com.wikigen.embedding.EmbeddingProvider;
import com.wikigen.embedding.EmbeddingProviders;
import com.wikigen.runtime.AppConfig;

/**
 * Facade over the file catalog and the vector store. A scan catalogs every file
 * but re-embeds only the added or changed ones; semantic search narrows candidates
 * by keyword first and reranks their chunks by vector distance.
 */
public class FileIndexer {
    private static final Logger log = LoggerFactory.getLogger(FileIndexer.class);

    private final FileCatalog catalog;
    private final FlatVectorStore vectorStore;
    private final EmbeddingProvider embeddingProvider;
    private final MarkdownChunker chunker;
    private final boolean semanticSearchEnabled;
    private final int candidateLimit;
    // Scan, removal, clear and compaction touch both indexes and must not interleave.
    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * @param vectorStore       {@code null} disables semantic search
     * @param embeddingProvider {@code null} disables semantic search
     */
    public FileIndexer(FileCatalog catalog,
            FlatVectorStore vectorStore,
            EmbeddingProvider embeddingProvider,
            MarkdownChunker chunker,
            boolean semanticSearchEnabled,
            int candidateLimit) throws IOException {
        this.catalog = catalog;
        this.vectorStore = vectorStore;
        this.embeddingProvider = embeddingProvider;
        this.chunker = chunker;
        this.semanticSearchEnabled = semanticSearchEnabled;
        this.candidateLimit = candidateLimit;
        if (isSemanticSearchAvailable()) {
            scheduleReembeddingIfNeeded();
        }
    }

    public static FileIndexer fromConfig(AppConfig config) throws IOException {
        AppConfig.IndexConfig indexConfig = config.getIndex();
        AppConfig.SearchConfig searchConfig = config.getSearch();
        FileCatalog catalog = new FileCatalog(config.databasePath(), indexConfig.getMaxFileSize(), indexConfig.getExcludePatterns());

        FlatVectorStore vectorStore = null;
        EmbeddingProvider embeddingProvider = null;
        if (searchConfig.isSemanticSearchEnabled()) {
            try {
                embeddingProvider = EmbeddingProviders.fromConfig(config.getEmbedding());
                vectorStore = new FlatVectorStore(config.vectorIndexPath(), embeddingProvider.dimension(), embeddingProvider.modelName());
            } catch (IllegalArgumentException e) {
                log.warn("Semantic search unavailable, falling back to keyword search: {}", e.getMessage());
                embeddingProvider = null;
                vectorStore = null;
            }
        }
        return new FileIndexer(
                catalog,
                vectorStore,
                embeddingProvider,
                new MarkdownChunker(searchConfig.getChunkSize(), searchConfig.getChunkOverlap()),
                searchConfig.isSemanticSearchEnabled(),
                searchConfig.getCandidateLimit());
    }

    public boolean isSemanticSearchAvailable() {
        return semanticSearchEnabled && vectorStore != null && embeddingProvider != null;
    }

    public IndexReport indexDirectory(Path root) throws IOException {
        return indexDirectory(root, ScanOptions.defaults());
    }

    public IndexReport indexDirectory(Path root, ScanOptions options) throws IOException {
        writeLock.lock();
        try {
            CatalogScan scan = catalog.indexDirectory(root, options);
            int chunked = 0;
            int failed = 0;
            if (isSemanticSearchAvailable() && !scan.changedFiles().isEmpty()) {
                for (IndexedFile file : scan.changedFiles()) {
                    try {
                        if (indexChunks(file) > 0) {
                            chunked++;
                        }
                    } catch (IOException | RuntimeException e) {
                        failed++;
                        vectorStore.removeFile(file.filePath());
                        log.warn("Could not index chunks for {}: {}", file.filePath(), e.getMessage());
                    }
                }
                vectorStore.save();
            }
            log.info("Indexed {}: added={} updated={} skipped={} chunked={} failed={}",
                    root, scan.added(), scan.updated(), scan.skipped(), chunked, failed);
            return new IndexReport(scan.added(), scan.updated(), scan.skipped(), chunked, failed);
        } finally {
            writeLock.unlock();
        }
    }

    public List<IndexedFile> search(String query, int limit, String directoryFilter) throws IOException {
        if (limit <= 0) {
            return List.of();
        }
        return catalog.search(query, limit, directoryFilter);
    }

    public List<ChunkHit> searchSemantic(String query, int limit, String directoryFilter, int maxChunksPerFile)
            throws IOException {
        if (limit <= 0) {
            return List.of();
        }
        if (!isSemanticSearchAvailable()) {
            return keywordHits(query, limit, directoryFilter);
        }

        List<IndexedFile> candidates = catalog.search(query, candidateLimit, directoryFilter);
        if (candidates.isEmpty()) {
            candidates = catalog.getAllFiles(directoryFilter);
            if (candidates.isEmpty()) {
                return List.of();
            }
        }
        Map<String, IndexedFile> byPath = new LinkedHashMap<>();
        for (IndexedFile candidate : candidates) {
            byPath.put(candidate.filePath(), candidate);
        }

        List<VectorSearchResult> nearest;
        try {
            float[] queryEmbedding = embeddingProvider.embed(query == null ? "" : query);
            int k = (int) Math.min(Integer.MAX_VALUE, 2L * limit);
            nearest = vectorStore.search(queryEmbedding, k, byPath.keySet(), maxChunksPerFile);
        } catch (EmbeddingException | IllegalArgumentException e) {
            log.warn("Could not embed query, falling back to keyword search: {}", e.getMessage());
            return keywordHits(query, limit, directoryFilter);
        }

        List<ChunkHit> results = new ArrayList<>();
        Map<String, Integer> perFile = new HashMap<>();
        for (VectorSearchResult hit : nearest) {
            ChunkMetadata chunk = hit.metadata();
            IndexedFile file = byPath.get(chunk.filePath());
            if (file == null) {
                continue;
            }
            int seen = perFile.getOrDefault(chunk.filePath(), 0);
            if (maxChunksPerFile > 0 && seen >= maxChunksPerFile) {
                continue;
            }
            perFile.put(chunk.filePath(), seen + 1);
            results.add(ChunkHit.of(file, chunk, hit.distance()));
            if (results.size() >= limit) {
                break;
            }
        }
        return results;
    }

    public Optional<IndexedFile> getFileByPath(String filePath) throws IOException {
        return catalog.getFileByPath(filePath);
    }

    public List<IndexedFile> getAllFiles(String directoryFilter) throws IOException {
        return catalog.getAllFiles(directoryFilter);
    }

    public int removeDirectory(Path root) throws IOException {
        writeLock.lock();
        try {
            List<String> removed = catalog.removeDirectory(root);
            if (vectorStore != null && !removed.isEmpty()) {
                removed.forEach(vectorStore::removeFile);
                vectorStore.save();
            }
            return removed.size();
        } finally {
            writeLock.unlock();
        }
    }

    public void clearIndex() throws IOException {
        writeLock.lock();
        try {
            catalog.clear();
            if (vectorStore != null) {
                vectorStore.clear();
                vectorStore.save();
            }
            log.info("Cleared index {}", catalog.databasePath());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @return vector rows reclaimed, 0 when semantic search is off
     */
    public int compactVectorStore() throws IOException {
        if (vectorStore == null) {
            return 0;
        }
        writeLock.lock();
        try {
            int reclaimed = vectorStore.compact();
            vectorStore.save();
            return reclaimed;
        } finally {
            writeLock.unlock();
        }
    }

    public IndexStats getStats() throws IOException {
        CatalogStats stats = catalog.getStats();
        VectorStoreStats vectorStats = isSemanticSearchAvailable() ? vectorStore.getStats() : null;
        return new IndexStats(
                stats.totalFiles(),
                stats.totalSize(),
                stats.totalDirectories(),
                stats.databasePath(),
                isSemanticSearchAvailable(),
                vectorStats);
    }

    /**
     * @return number of chunks stored for the file
     */
    private int indexChunks(IndexedFile file) throws IOException {
        String content = Files.readString(Path.of(file.filePath()));
        List<Chunk> chunks = chunker.chunk(content);
        if (chunks.isEmpty()) {
            vectorStore.removeFile(file.filePath());
            return 0;
        }
        List<String> texts = chunks.stream().map(Chunk::content).toList();
        List<float[]> embeddings = embeddingProvider.embedBatch(texts);
        vectorStore.addChunks(file.filePath(), chunks, embeddings);
        log.debug("Embedded {} chunks for {}", chunks.size(), file.filePath());
        return chunks.size();
    }

    // Only a discarded or missing vector index leaves catalogued files without vectors.
    // An index that loaded but holds no rows is legitimately empty.
    private void scheduleReembeddingIfNeeded() throws IOException {
        if (!vectorStore.wasResetOnLoad() && vectorStore.wasLoadedFromDisk()) {
            return;
        }
        int invalidated = catalog.invalidateContentHashes();
        if (invalidated > 0) {
            log.info("Vector index was reset or missing; {} catalogued files will be re-embedded on the next scan",
                    invalidated);
        }
    }

    private List<ChunkHit> keywordHits(String query, int limit, String directoryFilter) throws IOException {
        return catalog.search(query, limit, directoryFilter).stream()
                .map(ChunkHit::fileOnly)
                .toList();
    }
}
