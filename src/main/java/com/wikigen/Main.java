package com.wikigen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.wikigen.index.ChunkHit;
import com.wikigen.index.FileIndexer;
import com.wikigen.index.IndexReport;
import com.wikigen.index.IndexStats;
import com.wikigen.index.IndexedFile;
import com.wikigen.index.ScanOptions;
import com.wikigen.runtime.AppConfig;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "wikigen-search",
        mixinStandardHelpOptions = true,
        version = "wikigen-search 0.1.0",
        description = "Index markdown documentation and search it by keyword or meaning.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "stats")
    Mode mode;

    @Option(names = "--data-dir", description = "Directory holding the catalog database and vector index")
    Path dataDir;

    @Option(names = "--directory", description = "Directory to index or remove")
    Path directory;

    @Option(names = "--query", description = "Query text used in search and semantic modes")
    String query;

    @Option(names = "--limit", description = "Maximum results to return (defaults to search.defaultLimit)")
    Integer limit;

    @Option(names = "--directory-filter", description = "Only return files whose directory contains this text")
    String directoryFilter;

    @Option(names = "--chunk-limit", description = "Maximum chunks per file in semantic mode (defaults to search.maxChunksPerFile)")
    Integer chunkLimit;

    @Option(names = "--pattern", description = "File name glob used when indexing (defaults to index.pattern)")
    String pattern;

    @Option(names = "--max-depth", description = "Directory levels below --directory to descend into")
    Integer maxDepth;

    @Option(names = "--include-hidden", description = "Index hidden files and directories", defaultValue = "false")
    boolean includeHidden;

    enum Mode {
        index,
        search,
        semantic,
        remove,
        clear,
        stats,
        compact
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        if (dataDir != null) {
            config.getIndex().setDataDir(dataDir.toString());
        }
        log.info("Starting wikigen-search in {} mode", mode);
        log.info("Using config file: {}", configPath);

        if ((mode == Mode.index || mode == Mode.remove) && directory == null) {
            log.error("--directory is required in {} mode", mode);
            return 2;
        }
        if ((mode == Mode.search || mode == Mode.semantic) && query == null) {
            log.error("--query is required in {} mode", mode);
            return 2;
        }

        FileIndexer indexer = FileIndexer.fromConfig(config);
        int resultLimit = limit == null ? config.getSearch().getDefaultLimit() : limit;

        if (mode == Mode.index) {
            if (!Files.isDirectory(directory)) {
                log.error("Not a directory: {}", directory);
                return 1;
            }
            String filePattern = pattern == null ? config.getIndex().getPattern() : pattern;
            boolean excludeHidden = !includeHidden && config.getIndex().isExcludeHidden();
            IndexReport report = indexer.indexDirectory(directory, new ScanOptions(filePattern, excludeHidden, maxDepth));
            log.info("Indexed directory: added={}, updated={}, skipped={}, chunked={}, failed={}",
                    report.added(),
                    report.updated(),
                    report.skipped(),
                    report.chunkedFiles(),
                    report.failedFiles());
        }
        if (mode == Mode.search) {
            List<IndexedFile> results = indexer.search(query, resultLimit, directoryFilter);
            for (int i = 0; i < results.size(); i++) {
                IndexedFile file = results.get(i);
                log.info("Result #{} resource={} size={} path={}",
                        i + 1,
                        file.resourceName(),
                        file.size(),
                        file.filePath());
            }
            log.info("{} result(s)", results.size());
        }
        if (mode == Mode.semantic) {
            int perFile = chunkLimit == null ? config.getSearch().getMaxChunksPerFile() : chunkLimit;
            List<ChunkHit> results = indexer.searchSemantic(query, resultLimit, directoryFilter, perFile);
            for (int i = 0; i < results.size(); i++) {
                ChunkHit hit = results.get(i);
                if (hit.hasChunk()) {
                    log.info("Result #{} distance={} resource={} chunk={} [{}-{}] path={}",
                            i + 1,
                            String.format("%.4f", hit.score()),
                            hit.resourceName(),
                            hit.chunkIndex(),
                            hit.startPos(),
                            hit.endPos(),
                            hit.filePath());
                } else {
                    log.info("Result #{} resource={} path={}", i + 1, hit.resourceName(), hit.filePath());
                }
            }
            log.info("{} result(s)", results.size());
        }
        if (mode == Mode.remove) {
            int removed = indexer.removeDirectory(directory);
            log.info("Removed {} file(s) under {}", removed, directory);
        }
        if (mode == Mode.clear) {
            indexer.clearIndex();
        }
        if (mode == Mode.compact) {
            int reclaimed = indexer.compactVectorStore();
            log.info("Compacted vector index, reclaimed {} row(s)", reclaimed);
        }
        if (mode == Mode.stats) {
            logStats(indexer.getStats());
        }

        return 0;
    }

    private void logStats(IndexStats stats) {
        log.info("Catalog files={} bytes={} directories={} database={}",
                stats.totalFiles(),
                stats.totalSize(),
                stats.totalDirectories(),
                stats.databasePath());
        if (stats.vectorStats() == null) {
            log.info("Semantic search disabled");
            return;
        }
        log.info("Vectors chunks={} files={} rows={} dimension={}",
                stats.vectorStats().totalChunks(),
                stats.vectorStats().totalFilesWithChunks(),
                stats.vectorStats().indexSize(),
                stats.vectorStats().embeddingDimension());
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
