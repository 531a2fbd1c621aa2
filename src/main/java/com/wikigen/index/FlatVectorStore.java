package com.wikigen.index;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Exact (flat) L2 index over chunk embeddings with chunk provenance.
 *
 * <p>Removing a file only drops its metadata; its vectors stay in the matrix but are
 * never returned because every hit is resolved through the metadata map.
 * {@link #compact()} rebuilds the matrix without them.
 *
 * <p>Persisted as a binary matrix file plus a JSON sidecar
 * ({@code <name>.metadata.json}) holding metadata, file mapping and the id counter.
 */
public class FlatVectorStore {
    public static final int DEFAULT_MAX_CHUNKS_PER_FILE = 5;

    private static final Logger log = LoggerFactory.getLogger(FlatVectorStore.class);
    private static final int MAGIC = 0x57474649;
    private static final int FORMAT_VERSION = 1;
    private static final Comparator<Neighbor> NEAREST_FIRST = Comparator
            .comparingDouble(Neighbor::distance)
            .thenComparingLong(Neighbor::chunkId);

    private final Path indexPath;
    private final Path metadataPath;
    private final int dimension;
    private final String modelName;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Object lock = new Object();

    private float[] vectors;
    private long[] rowIds;
    private int rows;
    private Map<Long, ChunkMetadata> metadata;
    private Map<String, List<Long>> fileToChunks;
    private long nextChunkId;
    private boolean resetOnLoad;
    private boolean loadedFromDisk;

    public FlatVectorStore(Path indexPath, int dimension, String modelName) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.indexPath = indexPath.toAbsolutePath();
        this.metadataPath = metadataPathFor(this.indexPath);
        this.dimension = dimension;
        this.modelName = modelName;
        load();
    }

    public static Path metadataPathFor(Path indexPath) {
        String name = indexPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return indexPath.resolveSibling(stem + ".metadata.json");
    }

    public int dimension() {
        return dimension;
    }

    public String modelName() {
        return modelName;
    }

    /**
     * True when persisted state existed but was discarded on load (dimension or
     * model mismatch, unreadable or inconsistent files).
     */
    public boolean wasResetOnLoad() {
        return resetOnLoad;
    }

    /**
     * True when the store started from persisted files rather than empty.
     */
    public boolean wasLoadedFromDisk() {
        return loadedFromDisk;
    }

    public void addChunks(String filePath, List<Chunk> chunks, List<float[]> embeddings) {
        if (chunks.size() != embeddings.size()) {
            throw new IllegalArgumentException("Number of chunks (%d) does not match number of embeddings (%d)"
                    .formatted(chunks.size(), embeddings.size()));
        }
        for (float[] embedding : embeddings) {
            checkDimension(embedding);
        }
        synchronized (lock) {
            evict(filePath);
            if (chunks.isEmpty()) {
                return;
            }
            ensureCapacity(rows + chunks.size());
            List<Long> ids = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                Chunk chunk = chunks.get(i);
                long chunkId = nextChunkId++;
                System.arraycopy(embeddings.get(i), 0, vectors, rows * dimension, dimension);
                rowIds[rows] = chunkId;
                rows++;
                metadata.put(chunkId, new ChunkMetadata(
                        filePath, chunk.chunkIndex(), chunk.content(), chunk.startPos(), chunk.endPos()));
                ids.add(chunkId);
            }
            fileToChunks.put(filePath, ids);
        }
    }

    public List<VectorSearchResult> search(float[] queryEmbedding, int k) {
        return search(queryEmbedding, k, null, 0);
    }

    public List<VectorSearchResult> search(float[] queryEmbedding, int k, Collection<String> fileFilter) {
        return search(queryEmbedding, k, fileFilter, fileFilter == null ? 0 : DEFAULT_MAX_CHUNKS_PER_FILE);
    }

    /**
     * Looks at the {@code 2k} nearest stored vectors, then drops unreachable ones,
     * applies the file filter and the per-file cap and keeps at most {@code k}.
     *
     * @param maxPerFile per-file cap, {@code <= 0} for none
     */
    public List<VectorSearchResult> search(float[] queryEmbedding, int k, Collection<String> fileFilter, int maxPerFile) {
        checkDimension(queryEmbedding);
        if (k <= 0) {
            return List.of();
        }
        Set<String> allowed = fileFilter == null ? null : new HashSet<>(fileFilter);
        synchronized (lock) {
            if (rows == 0) {
                return List.of();
            }
            List<Neighbor> neighbors = nearest(queryEmbedding, (int) Math.min(rows, 2L * k));
            List<VectorSearchResult> results = new ArrayList<>();
            Map<String, Integer> perFile = new HashMap<>();
            for (Neighbor neighbor : neighbors) {
                ChunkMetadata chunk = metadata.get(neighbor.chunkId());
                if (chunk == null) {
                    continue;
                }
                if (allowed != null && !allowed.contains(chunk.filePath())) {
                    continue;
                }
                if (maxPerFile > 0) {
                    int seen = perFile.getOrDefault(chunk.filePath(), 0);
                    if (seen >= maxPerFile) {
                        continue;
                    }
                    perFile.put(chunk.filePath(), seen + 1);
                }
                results.add(new VectorSearchResult(neighbor.chunkId(), neighbor.distance(), chunk));
                if (results.size() >= k) {
                    break;
                }
            }
            return results;
        }
    }

    public void removeFile(String filePath) {
        synchronized (lock) {
            evict(filePath);
        }
    }

    public List<Long> chunkIds(String filePath) {
        synchronized (lock) {
            return List.copyOf(fileToChunks.getOrDefault(filePath, List.of()));
        }
    }

    /**
     * Drops unreachable vectors from the matrix. Chunk ids are kept.
     *
     * @return number of rows reclaimed
     */
    public int compact() {
        synchronized (lock) {
            int live = 0;
            float[] compacted = new float[Math.max(metadata.size(), 16) * dimension];
            long[] compactedIds = new long[Math.max(metadata.size(), 16)];
            for (int row = 0; row < rows; row++) {
                if (metadata.containsKey(rowIds[row])) {
                    System.arraycopy(vectors, row * dimension, compacted, live * dimension, dimension);
                    compactedIds[live] = rowIds[row];
                    live++;
                }
            }
            int reclaimed = rows - live;
            vectors = compacted;
            rowIds = compactedIds;
            rows = live;
            if (reclaimed > 0) {
                log.info("Compacted vector index {}: reclaimed {} rows, {} remain", indexPath, reclaimed, live);
            }
            return reclaimed;
        }
    }

    public void clear() {
        synchronized (lock) {
            reset();
        }
    }

    public void save() throws IOException {
        synchronized (lock) {
            if (indexPath.getParent() != null) {
                Files.createDirectories(indexPath.getParent());
            }
            Path matrixTemp = indexPath.resolveSibling(indexPath.getFileName() + ".tmp");
            try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(matrixTemp)))) {
                out.writeInt(MAGIC);
                out.writeInt(FORMAT_VERSION);
                out.writeInt(dimension);
                out.writeInt(rows);
                for (int row = 0; row < rows; row++) {
                    out.writeLong(rowIds[row]);
                }
                for (int i = 0; i < rows * dimension; i++) {
                    out.writeFloat(vectors[i]);
                }
            }
            Path sidecarTemp = metadataPath.resolveSibling(metadataPath.getFileName() + ".tmp");
            objectMapper.writeValue(sidecarTemp.toFile(),
                    new Sidecar(dimension, modelName, nextChunkId, rows, metadata, fileToChunks));
            move(matrixTemp, indexPath);
            move(sidecarTemp, metadataPath);
        }
    }

    public VectorStoreStats getStats() {
        synchronized (lock) {
            return new VectorStoreStats(metadata.size(), fileToChunks.size(), rows, dimension);
        }
    }

    private void load() {
        synchronized (lock) {
            reset();
            boolean hasMatrix = Files.exists(indexPath);
            boolean hasSidecar = Files.exists(metadataPath);
            if (!hasMatrix && !hasSidecar) {
                return;
            }
            if (!hasMatrix || !hasSidecar) {
                log.warn("Vector index {} is incomplete (matrix={}, metadata={}); starting empty",
                        indexPath, hasMatrix, hasSidecar);
                resetOnLoad = true;
                return;
            }
            try {
                Sidecar sidecar = objectMapper.readValue(metadataPath.toFile(), Sidecar.class);
                if (sidecar.dimension() != dimension) {
                    log.warn("Vector index {} has dimension {} but the embedding model produces {}; starting empty",
                            indexPath, sidecar.dimension(), dimension);
                    resetOnLoad = true;
                    return;
                }
                if (modelName != null && sidecar.model() != null && !modelName.equals(sidecar.model())) {
                    log.warn("Vector index {} was built with model {} but {} is configured; starting empty",
                            indexPath, sidecar.model(), modelName);
                    resetOnLoad = true;
                    return;
                }
                readMatrix(sidecar);
                metadata = new HashMap<>(sidecar.metadata() == null ? Map.of() : sidecar.metadata());
                fileToChunks = new LinkedHashMap<>();
                if (sidecar.fileToChunks() != null) {
                    sidecar.fileToChunks().forEach((file, ids) -> fileToChunks.put(file, new ArrayList<>(ids)));
                }
                nextChunkId = sidecar.nextChunkId();
                loadedFromDisk = true;
                log.info("Loaded vector index {}: {} chunks in {} rows", indexPath, metadata.size(), rows);
            } catch (IOException | RuntimeException e) {
                log.warn("Could not load vector index {}; starting empty: {}", indexPath, e.getMessage());
                reset();
                resetOnLoad = true;
            }
        }
    }

    private void readMatrix(Sidecar sidecar) throws IOException {
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(indexPath)))) {
            if (in.readInt() != MAGIC) {
                throw new IOException("not a vector index file");
            }
            int version = in.readInt();
            if (version != FORMAT_VERSION) {
                throw new IOException("unsupported vector index format " + version);
            }
            int storedDimension = in.readInt();
            int storedRows = in.readInt();
            if (storedDimension != dimension || storedRows != sidecar.rows() || storedRows < 0) {
                throw new IOException("matrix header (dimension=%d, rows=%d) disagrees with metadata (dimension=%d, rows=%d)"
                        .formatted(storedDimension, storedRows, sidecar.dimension(), sidecar.rows()));
            }
            ensureCapacity(storedRows);
            for (int row = 0; row < storedRows; row++) {
                rowIds[row] = in.readLong();
            }
            for (int i = 0; i < storedRows * dimension; i++) {
                vectors[i] = in.readFloat();
            }
            rows = storedRows;
        }
    }

    private List<Neighbor> nearest(float[] query, int want) {
        PriorityQueue<Neighbor> worstFirst = new PriorityQueue<>(want + 1, NEAREST_FIRST.reversed());
        for (int row = 0; row < rows; row++) {
            Neighbor candidate = new Neighbor(rowIds[row], squaredDistance(query, row));
            if (worstFirst.size() < want) {
                worstFirst.add(candidate);
            } else if (NEAREST_FIRST.compare(candidate, worstFirst.peek()) < 0) {
                worstFirst.poll();
                worstFirst.add(candidate);
            }
        }
        List<Neighbor> ordered = new ArrayList<>(worstFirst);
        ordered.sort(NEAREST_FIRST);
        return ordered;
    }

    private float squaredDistance(float[] query, int row) {
        int offset = row * dimension;
        float sum = 0f;
        for (int i = 0; i < dimension; i++) {
            float diff = query[i] - vectors[offset + i];
            sum += diff * diff;
        }
        return sum;
    }

    private void evict(String filePath) {
        List<Long> ids = fileToChunks.remove(filePath);
        if (ids != null) {
            ids.forEach(metadata::remove);
        }
    }

    private void ensureCapacity(int neededRows) {
        if (neededRows <= rowIds.length) {
            return;
        }
        int capacity = Math.max(neededRows, rowIds.length * 2);
        vectors = Arrays.copyOf(vectors, capacity * dimension);
        rowIds = Arrays.copyOf(rowIds, capacity);
    }

    private void reset() {
        vectors = new float[16 * dimension];
        rowIds = new long[16];
        rows = 0;
        metadata = new HashMap<>();
        fileToChunks = new LinkedHashMap<>();
        nextChunkId = 0;
    }

    private void checkDimension(float[] embedding) {
        if (embedding == null || embedding.length != dimension) {
            throw new IllegalArgumentException("Embedding dimension %s does not match index dimension %d"
                    .formatted(embedding == null ? "null" : String.valueOf(embedding.length), dimension));
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private record Neighbor(long chunkId, float distance) {
    }

    record Sidecar(
            int dimension,
            String model,
            long nextChunkId,
            int rows,
            Map<Long, ChunkMetadata> metadata,
            Map<String, List<Long>> fileToChunks) {
    }
}
