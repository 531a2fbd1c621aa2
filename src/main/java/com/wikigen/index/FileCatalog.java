package com.wikigen.index;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SQLite catalog of indexed files with an FTS5 projection over path, file name,
 * resource name and directory. Every write to {@code files} is mirrored into
 * {@code files_fts} inside the same transaction. One lock serializes all reads
 * and writes.
 */
public class FileCatalog {
    private static final Logger log = LoggerFactory.getLogger(FileCatalog.class);

    private static final String COLUMNS = "f.id, f.file_path, f.file_name, f.resource_name, f.directory, "
            + "f.size, f.modified_time, f.indexed_time, f.content_hash";

    private final Path databasePath;
    private final String jdbcUrl;
    private final long maxFileSize;
    private final List<PathMatcher> excludeMatchers;
    private final ReentrantLock lock = new ReentrantLock();

    public FileCatalog(Path databasePath) throws IOException {
        this(databasePath, Long.MAX_VALUE, List.of());
    }

    public FileCatalog(Path databasePath, long maxFileSize, List<String> excludePatterns) throws IOException {
        this.databasePath = databasePath.toAbsolutePath();
        this.jdbcUrl = "jdbc:sqlite:" + this.databasePath;
        this.maxFileSize = maxFileSize <= 0 ? Long.MAX_VALUE : maxFileSize;
        this.excludeMatchers = excludePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
        if (this.databasePath.getParent() != null) {
            Files.createDirectories(this.databasePath.getParent());
        }
        initSchema();
    }

    public Path databasePath() {
        return databasePath;
    }

    public CatalogScan indexDirectory(Path root, ScanOptions options) throws IOException {
        if (!Files.isDirectory(root)) {
            log.warn("Not indexing {}: not a directory", root);
            return CatalogScan.empty();
        }
        Path base = root.toAbsolutePath().normalize();
        List<Path> candidates = enumerate(base, options);
        double indexedTime = epochSeconds(Instant.now().toEpochMilli() * 1000L);

        int added = 0;
        int updated = 0;
        int skipped = 0;
        List<IndexedFile> changed = new ArrayList<>();

        lock.lock();
        try (Connection connection = open()) {
            connection.setAutoCommit(false);
            try {
                for (Path file : candidates) {
                    IndexedFile scanned = inspect(base, file, indexedTime);
                    if (scanned == null) {
                        skipped++;
                        continue;
                    }
                    IndexedFile existing = findByPath(connection, scanned.filePath());
                    if (existing == null) {
                        IndexedFile inserted = insert(connection, scanned);
                        changed.add(inserted);
                        added++;
                        log.debug("Catalogued new file {}", scanned.filePath());
                    } else if (!scanned.contentHash().equals(existing.contentHash())
                            || scanned.modifiedTime() > existing.modifiedTime()) {
                        IndexedFile replaced = update(connection, existing.id(), scanned);
                        changed.add(replaced);
                        updated++;
                        log.debug("Catalogued changed file {}", scanned.filePath());
                    } else {
                        skipped++;
                    }
                }
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IndexStorageException("Failed to catalog " + base + " in " + databasePath, e);
        } finally {
            lock.unlock();
        }
        return new CatalogScan(added, updated, skipped, List.copyOf(changed));
    }

    public List<IndexedFile> search(String query, int limit, String directoryFilter) throws IOException {
        Optional<String> match = FtsQuery.build(query);
        lock.lock();
        try (Connection connection = open()) {
            if (match.isEmpty()) {
                return listFiles(connection, directoryFilter, limit);
            }
            List<IndexedFile> ranked = ranked(connection, match.get(), directoryFilter, limit);
            if (!ranked.isEmpty()) {
                return ranked;
            }
            return substring(connection, query.strip(), directoryFilter, limit);
        } catch (SQLException e) {
            throw new IndexStorageException("Search failed for query '" + query + "'", e);
        } finally {
            lock.unlock();
        }
    }

    public List<IndexedFile> getAllFiles(String directoryFilter) throws IOException {
        lock.lock();
        try (Connection connection = open()) {
            return listFiles(connection, directoryFilter, -1);
        } catch (SQLException e) {
            throw new IndexStorageException("Failed to list catalogued files", e);
        } finally {
            lock.unlock();
        }
    }

    public Optional<IndexedFile> getFileByPath(String filePath) throws IOException {
        lock.lock();
        try (Connection connection = open()) {
            return Optional.ofNullable(findByPath(connection, filePath));
        } catch (SQLException e) {
            throw new IndexStorageException("Failed to look up " + filePath, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes the root itself and everything below it; a sibling sharing the prefix
     * ({@code docs2} next to {@code docs}) is kept.
     *
     * @return absolute paths of the removed files
     */
    public List<String> removeDirectory(Path root) throws IOException {
        String base = root.toAbsolutePath().normalize().toString();
        String separator = root.getFileSystem().getSeparator();
        String below = base.endsWith(separator) ? base : base + separator;

        lock.lock();
        try (Connection connection = open()) {
            connection.setAutoCommit(false);
            try {
                List<Long> ids = new ArrayList<>();
                List<String> paths = new ArrayList<>();
                try (PreparedStatement select = connection.prepareStatement(
                        "SELECT id, file_path FROM files WHERE file_path = ? OR substr(file_path, 1, length(?)) = ?")) {
                    // LIKE ignores ASCII case; the prefix must match exactly
                    select.setString(1, base);
                    select.setString(2, below);
                    select.setString(3, below);
                    try (ResultSet rs = select.executeQuery()) {
                        while (rs.next()) {
                            ids.add(rs.getLong(1));
                            paths.add(rs.getString(2));
                        }
                    }
                }
                try (PreparedStatement deleteFts = connection.prepareStatement("DELETE FROM files_fts WHERE rowid = ?");
                        PreparedStatement deleteFile = connection.prepareStatement("DELETE FROM files WHERE id = ?")) {
                    for (Long id : ids) {
                        deleteFts.setLong(1, id);
                        deleteFts.addBatch();
                        deleteFile.setLong(1, id);
                        deleteFile.addBatch();
                    }
                    deleteFts.executeBatch();
                    deleteFile.executeBatch();
                }
                connection.commit();
                log.info("Removed {} catalogued files under {}", paths.size(), base);
                return paths;
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IndexStorageException("Failed to remove " + base + " from catalog", e);
        } finally {
            lock.unlock();
        }
    }

    public void clear() throws IOException {
        lock.lock();
        try (Connection connection = open()) {
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                statement.executeUpdate("DELETE FROM files");
                statement.executeUpdate("DELETE FROM files_fts");
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IndexStorageException("Failed to clear catalog " + databasePath, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forgets every stored content hash so the next scan reports all files as
     * updated. Used after the vector store was reset and needs re-embedding.
     */
    public int invalidateContentHashes() throws IOException {
        lock.lock();
        try (Connection connection = open(); Statement statement = connection.createStatement()) {
            return statement.executeUpdate("UPDATE files SET content_hash = ''");
        } catch (SQLException e) {
            throw new IndexStorageException("Failed to invalidate content hashes", e);
        } finally {
            lock.unlock();
        }
    }

    public CatalogStats getStats() throws IOException {
        lock.lock();
        try (Connection connection = open(); Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery(
                        "SELECT COUNT(*), COALESCE(SUM(size), 0), COUNT(DISTINCT directory) FROM files")) {
            rs.next();
            return new CatalogStats(rs.getLong(1), rs.getLong(2), rs.getLong(3), databasePath.toString());
        } catch (SQLException e) {
            throw new IndexStorageException("Failed to read catalog statistics", e);
        } finally {
            lock.unlock();
        }
    }

    public static String contentHash(Path path) throws IOException {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(Files.readAllBytes(path)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private void initSchema() throws IOException {
        lock.lock();
        try (Connection connection = open(); Statement statement = connection.createStatement()) {
            connection.setAutoCommit(false);
            statement.executeUpdate("""
                    CREATE TABLE IF NOT EXISTS files (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        file_path TEXT NOT NULL UNIQUE,
                        file_name TEXT NOT NULL,
                        resource_name TEXT NOT NULL,
                        directory TEXT NOT NULL,
                        size INTEGER,
                        modified_time REAL,
                        indexed_time REAL NOT NULL,
                        content_hash TEXT
                    )""");
            statement.executeUpdate("CREATE INDEX IF NOT EXISTS idx_file_name ON files(file_name)");
            statement.executeUpdate("CREATE INDEX IF NOT EXISTS idx_directory ON files(directory)");
            statement.executeUpdate("""
                    CREATE VIRTUAL TABLE IF NOT EXISTS files_fts USING fts5(
                        file_path, file_name, resource_name, directory
                    )""");
            int orphans = statement.executeUpdate("DELETE FROM files_fts WHERE rowid NOT IN (SELECT id FROM files)");
            int backfilled = statement.executeUpdate("""
                    INSERT INTO files_fts(rowid, file_path, file_name, resource_name, directory)
                    SELECT id, file_path, file_name, resource_name, directory FROM files
                    WHERE id NOT IN (SELECT rowid FROM files_fts)""");
            connection.commit();
            if (orphans > 0 || backfilled > 0) {
                log.info("Repaired full-text projection in {}: removed={} backfilled={}", databasePath, orphans, backfilled);
            }
        } catch (SQLException e) {
            throw new IndexStorageException("Failed to initialize catalog " + databasePath, e);
        } finally {
            lock.unlock();
        }
    }

    private Connection open() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    private List<Path> enumerate(Path base, ScanOptions options) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + options.pattern());
        boolean matchRelative = options.pattern().contains("/");
        int depth = options.maxDepth() == null ? Integer.MAX_VALUE : options.maxDepth() + 1;
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(base, EnumSet.noneOf(FileVisitOption.class), depth, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(base) && options.excludeHidden() && isHidden(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                if (options.excludeHidden() && isHidden(file)) {
                    return FileVisitResult.CONTINUE;
                }
                Path candidate = matchRelative ? base.relativize(file) : file.getFileName();
                if (matcher.matches(candidate)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Cannot visit {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        return files;
    }

    private static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    // Returns null when the file is filtered out or cannot be stat-ed; both count as skipped.
    private IndexedFile inspect(Path base, Path file, double indexedTime) {
        long size;
        double modifiedTime;
        try {
            size = Files.size(file);
            modifiedTime = epochSeconds(Files.getLastModifiedTime(file).to(TimeUnit.MICROSECONDS));
        } catch (IOException e) {
            log.warn("Skipping unreadable file {}: {}", file, e.getMessage());
            return null;
        }
        if (size > maxFileSize) {
            log.debug("Skipping {}: {} bytes exceeds limit {}", file, size, maxFileSize);
            return null;
        }
        for (PathMatcher exclude : excludeMatchers) {
            if (exclude.matches(file)) {
                log.debug("Skipping excluded file {}", file);
                return null;
            }
        }

        String hash;
        try {
            hash = contentHash(file);
        } catch (IOException e) {
            log.warn("Cannot hash {}, cataloguing without content hash: {}", file, e.getMessage());
            hash = "";
        }

        String relative = base.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String resourceName = dot > 0 ? relative.substring(0, relative.length() - (fileName.length() - dot)) : relative;
        return new IndexedFile(
                0L,
                file.toAbsolutePath().toString(),
                fileName,
                resourceName,
                file.toAbsolutePath().getParent().toString(),
                size,
                modifiedTime,
                indexedTime,
                hash);
    }

    private IndexedFile insert(Connection connection, IndexedFile file) throws SQLException {
        long id;
        try (PreparedStatement statement = connection.prepareStatement("""
                INSERT INTO files (file_path, file_name, resource_name, directory,
                                   size, modified_time, indexed_time, content_hash)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)""", Statement.RETURN_GENERATED_KEYS)) {
            statement.setString(1, file.filePath());
            bindAttributes(statement, 2, file);
            statement.executeUpdate();
            try (ResultSet keys = statement.getGeneratedKeys()) {
                keys.next();
                id = keys.getLong(1);
            }
        }
        insertProjection(connection, id, file);
        return withId(file, id);
    }

    private IndexedFile update(Connection connection, long id, IndexedFile file) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                UPDATE files
                SET file_name = ?, resource_name = ?, directory = ?, size = ?,
                    modified_time = ?, indexed_time = ?, content_hash = ?
                WHERE id = ?""")) {
            bindAttributes(statement, 1, file);
            statement.setLong(8, id);
            statement.executeUpdate();
        }
        try (PreparedStatement delete = connection.prepareStatement("DELETE FROM files_fts WHERE rowid = ?")) {
            delete.setLong(1, id);
            delete.executeUpdate();
        }
        insertProjection(connection, id, file);
        return withId(file, id);
    }

    private static void bindAttributes(PreparedStatement statement, int from, IndexedFile file) throws SQLException {
        statement.setString(from, file.fileName());
        statement.setString(from + 1, file.resourceName());
        statement.setString(from + 2, file.directory());
        statement.setLong(from + 3, file.size());
        statement.setDouble(from + 4, file.modifiedTime());
        statement.setDouble(from + 5, file.indexedTime());
        statement.setString(from + 6, file.contentHash());
    }

    private static void insertProjection(Connection connection, long id, IndexedFile file) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO files_fts(rowid, file_path, file_name, resource_name, directory) VALUES (?, ?, ?, ?, ?)")) {
            statement.setLong(1, id);
            statement.setString(2, file.filePath());
            statement.setString(3, file.fileName());
            statement.setString(4, file.resourceName());
            statement.setString(5, file.directory());
            statement.executeUpdate();
        }
    }

    private static IndexedFile findByPath(Connection connection, String filePath) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT " + COLUMNS + " FROM files f WHERE f.file_path = ?")) {
            statement.setString(1, filePath);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? map(rs) : null;
            }
        }
    }

    private static List<IndexedFile> ranked(Connection connection, String match, String directoryFilter, int limit)
            throws SQLException {
        boolean filtered = hasFilter(directoryFilter);
        String sql = "SELECT " + COLUMNS + " FROM files_fts JOIN files f ON files_fts.rowid = f.id "
                + "WHERE files_fts MATCH ?"
                + (filtered ? " AND f.directory LIKE ? ESCAPE '\\'" : "")
                + " ORDER BY files_fts.rank LIMIT ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            int index = 1;
            statement.setString(index++, match);
            if (filtered) {
                statement.setString(index++, contains(directoryFilter));
            }
            statement.setInt(index, limit);
            return collect(statement);
        }
    }

    private static List<IndexedFile> substring(Connection connection, String query, String directoryFilter, int limit)
            throws SQLException {
        boolean filtered = hasFilter(directoryFilter);
        String sql = "SELECT " + COLUMNS + " FROM files f "
                + "WHERE (f.file_name LIKE ? ESCAPE '\\' OR f.file_path LIKE ? ESCAPE '\\')"
                + (filtered ? " AND f.directory LIKE ? ESCAPE '\\'" : "")
                + " ORDER BY f.file_path LIMIT ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            String like = contains(query);
            int index = 1;
            statement.setString(index++, like);
            statement.setString(index++, like);
            if (filtered) {
                statement.setString(index++, contains(directoryFilter));
            }
            statement.setInt(index, limit);
            return collect(statement);
        }
    }

    private static List<IndexedFile> listFiles(Connection connection, String directoryFilter, int limit)
            throws SQLException {
        boolean filtered = hasFilter(directoryFilter);
        String sql = "SELECT " + COLUMNS + " FROM files f"
                + (filtered ? " WHERE f.directory LIKE ? ESCAPE '\\'" : "")
                + " ORDER BY f.file_path LIMIT ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            int index = 1;
            if (filtered) {
                statement.setString(index++, contains(directoryFilter));
            }
            statement.setInt(index, limit);
            return collect(statement);
        }
    }

    private static List<IndexedFile> collect(PreparedStatement statement) throws SQLException {
        List<IndexedFile> files = new ArrayList<>();
        try (ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                files.add(map(rs));
            }
        }
        return files;
    }

    private static IndexedFile map(ResultSet rs) throws SQLException {
        return new IndexedFile(
                rs.getLong("id"),
                rs.getString("file_path"),
                rs.getString("file_name"),
                rs.getString("resource_name"),
                rs.getString("directory"),
                rs.getLong("size"),
                rs.getDouble("modified_time"),
                rs.getDouble("indexed_time"),
                rs.getString("content_hash") == null ? "" : rs.getString("content_hash"));
    }

    private static IndexedFile withId(IndexedFile file, long id) {
        return new IndexedFile(id, file.filePath(), file.fileName(), file.resourceName(), file.directory(),
                file.size(), file.modifiedTime(), file.indexedTime(), file.contentHash());
    }

    private static boolean hasFilter(String directoryFilter) {
        return directoryFilter != null && !directoryFilter.isBlank();
    }

    private static String contains(String value) {
        return "%" + escapeLike(value) + "%";
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static double epochSeconds(long micros) {
        return micros / 1_000_000.0;
    }
}
