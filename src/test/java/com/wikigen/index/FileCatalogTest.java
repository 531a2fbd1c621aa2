package com.wikigen.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCatalogTest {

    @TempDir
    Path tempDir;

    private Path corpus;
    private FileCatalog catalog;

    @BeforeEach
    void setUp() throws IOException {
        corpus = Files.createDirectories(tempDir.resolve("corpus"));
        catalog = new FileCatalog(tempDir.resolve("data").resolve("file_index.db"));
    }

    @Test
    void shouldSkipUnchangedFilesOnRescan() throws Exception {
        write("alpha.md", "# Alpha\n");
        write("beta.md", "# Beta\n");
        write("notes.txt", "not markdown");

        CatalogScan first = catalog.indexDirectory(corpus, ScanOptions.defaults());
        assertEquals(2, first.added());
        assertEquals(2, first.changedFiles().size());

        CatalogScan second = catalog.indexDirectory(corpus, ScanOptions.defaults());
        assertEquals(0, second.added());
        assertEquals(0, second.updated());
        assertEquals(2, second.skipped());
        assertTrue(second.changedFiles().isEmpty());
        assertEquals(2, catalog.getAllFiles(null).size());
    }

    @Test
    void shouldReportChangedContentAsUpdated() throws Exception {
        Path alpha = write("alpha.md", "# Alpha\nfirst draft\n");
        write("beta.md", "# Beta\n");
        catalog.indexDirectory(corpus, ScanOptions.defaults());
        String before = catalog.getFileByPath(alpha.toAbsolutePath().toString()).orElseThrow().contentHash();

        Files.writeString(alpha, "# Alpha\nsecond draft with more words\n");
        CatalogScan rescan = catalog.indexDirectory(corpus, ScanOptions.defaults());

        assertEquals(0, rescan.added());
        assertEquals(1, rescan.updated());
        assertEquals(1, rescan.skipped());
        assertEquals(alpha.toAbsolutePath().toString(), rescan.changedFiles().get(0).filePath());
        IndexedFile after = catalog.getFileByPath(alpha.toAbsolutePath().toString()).orElseThrow();
        assertNotEquals(before, after.contentHash());
        assertEquals(Files.size(alpha), after.size());
    }

    @Test
    void shouldRankKeywordMatchesOnFileNames() throws Exception {
        write("alpha.md", "a");
        write("beta.md", "b");
        write("gamma.md", "c");
        catalog.indexDirectory(corpus, ScanOptions.defaults());

        List<IndexedFile> results = catalog.search("beta", 10, null);

        assertEquals(1, results.size());
        assertEquals("beta.md", results.get(0).fileName());
    }

    @Test
    void shouldMatchTokenPrefixes() throws Exception {
        write("configuration.md", "a");
        write("deployment.md", "b");
        catalog.indexDirectory(corpus, ScanOptions.defaults());

        List<IndexedFile> results = catalog.search("config", 10, null);

        assertEquals(1, results.size());
        assertEquals("configuration.md", results.get(0).fileName());
    }

    @Test
    void shouldListAllFilesForBlankQuery() throws Exception {
        write("c.md", "c");
        write("a.md", "a");
        write("b.md", "b");
        catalog.indexDirectory(corpus, ScanOptions.defaults());

        List<IndexedFile> all = catalog.search("", 10, null);
        assertEquals(List.of("a.md", "b.md", "c.md"), all.stream().map(IndexedFile::fileName).toList());

        assertEquals(2, catalog.search("   ", 2, null).size());
        assertEquals(3, catalog.search("*** ()", 10, null).size());
    }

    @Test
    void shouldFallBackToSubstringMatch() throws Exception {
        write("release-notes.md", "notes");
        write("overview.md", "overview");
        catalog.indexDirectory(corpus, ScanOptions.defaults());

        List<IndexedFile> results = catalog.search("lease", 10, null);

        assertEquals(1, results.size());
        assertEquals("release-notes.md", results.get(0).fileName());
        assertTrue(catalog.search("zzz", 10, null).isEmpty());
    }

    @Test
    void shouldFilterByDirectory() throws Exception {
        write("guides/setup.md", "setup");
        write("guides/usage.md", "usage");
        write("api/setup.md", "api setup");
        catalog.indexDirectory(corpus, ScanOptions.defaults());

        List<IndexedFile> guides = catalog.search("setup", 10, "guides");
        assertEquals(1, guides.size());
        assertEquals("guides/setup", guides.get(0).resourceName());

        assertEquals(2, catalog.getAllFiles("guides").size());
        assertEquals(3, catalog.getAllFiles(null).size());
        assertTrue(catalog.getAllFiles("100%_missing").isEmpty());
    }

    @Test
    void shouldDescribeCataloguedFile() throws Exception {
        Path setup = write("guides/setup.md", "# Setup\n");
        catalog.indexDirectory(corpus, ScanOptions.defaults());

        IndexedFile file = catalog.getFileByPath(setup.toAbsolutePath().toString()).orElseThrow();

        assertTrue(file.id() > 0);
        assertEquals("setup.md", file.fileName());
        assertEquals("guides/setup", file.resourceName());
        assertEquals(setup.toAbsolutePath().getParent().toString(), file.directory());
        assertEquals(Files.size(setup), file.size());
        assertEquals(FileCatalog.contentHash(setup), file.contentHash());
        assertTrue(file.indexedTime() > 0);
        assertEquals(Optional.empty(), catalog.getFileByPath(corpus.resolve("missing.md").toString()));
    }

    @Test
    void shouldRemoveDirectoryButKeepSiblingWithSharedPrefix() throws Exception {
        write("docs/intro.md", "intro");
        write("docs/nested/deep.md", "deep");
        Path sibling = write("docs2/other.md", "other");
        catalog.indexDirectory(corpus, ScanOptions.defaults());

        List<String> removed = catalog.removeDirectory(corpus.resolve("docs"));

        assertEquals(2, removed.size());
        List<IndexedFile> remaining = catalog.getAllFiles(null);
        assertEquals(1, remaining.size());
        assertEquals(sibling.toAbsolutePath().toString(), remaining.get(0).filePath());
        assertTrue(catalog.search("intro", 10, null).isEmpty());
        assertEquals(1, catalog.search("other", 10, null).size());
    }

    @Test
    void shouldRemoveDirectoryWithCaseSensitivePrefix() throws Exception {
        Path upper = write("Docs/a.md", "upper");
        Path lower = write("docs/b.md", "lower");
        catalog.indexDirectory(corpus, ScanOptions.defaults());

        List<String> removed = catalog.removeDirectory(corpus.resolve("Docs"));

        assertEquals(List.of(upper.toAbsolutePath().toString()), removed);
        List<IndexedFile> remaining = catalog.getAllFiles(null);
        assertEquals(1, remaining.size());
        assertEquals(lower.toAbsolutePath().toString(), remaining.get(0).filePath());
    }

    @Test
    void shouldHonorMaxDepth() throws Exception {
        write("top.md", "top");
        write("sub/mid.md", "mid");
        write("sub/deeper/low.md", "low");

        assertEquals(1, catalog.indexDirectory(corpus, new ScanOptions("*.md", true, 0)).added());
        assertEquals(1, catalog.indexDirectory(corpus, new ScanOptions("*.md", true, 1)).added());
        assertEquals(1, catalog.indexDirectory(corpus, new ScanOptions("*.md", true, null)).added());
    }

    @Test
    void shouldSkipHiddenFilesUnlessIncluded() throws Exception {
        write("visible.md", "visible");
        write(".secret.md", "secret");
        write(".cache/cached.md", "cached");

        assertEquals(1, catalog.indexDirectory(corpus, ScanOptions.defaults()).added());
        assertEquals(2, catalog.indexDirectory(corpus, new ScanOptions("*.md", false, null)).added());
    }

    @Test
    void shouldMatchPatternAgainstRelativePathWhenItHasSeparators() throws Exception {
        write("guides/setup.md", "setup");
        write("api/setup.md", "api");

        CatalogScan scan = catalog.indexDirectory(corpus, new ScanOptions("guides/*.md", true, null));

        assertEquals(1, scan.added());
        assertEquals("guides/setup", scan.changedFiles().get(0).resourceName());
    }

    @Test
    void shouldSkipOversizedAndExcludedFiles() throws Exception {
        FileCatalog limited = new FileCatalog(tempDir.resolve("limited.db"), 50, List.of("**/node_modules/**"));
        write("small.md", "small");
        write("large.md", "x".repeat(200));
        write("node_modules/pkg/readme.md", "vendored");

        CatalogScan scan = limited.indexDirectory(corpus, ScanOptions.defaults());

        assertEquals(1, scan.added());
        assertEquals(2, scan.skipped());
        assertEquals("small.md", limited.getAllFiles(null).get(0).fileName());
    }

    @Test
    void shouldIgnoreMissingRoot() throws Exception {
        CatalogScan scan = catalog.indexDirectory(tempDir.resolve("absent"), ScanOptions.defaults());

        assertEquals(0, scan.added() + scan.updated() + scan.skipped());
    }

    @Test
    void shouldReportStats() throws Exception {
        write("a.md", "12345");
        write("sub/b.md", "1234567890");
        catalog.indexDirectory(corpus, ScanOptions.defaults());

        CatalogStats stats = catalog.getStats();

        assertEquals(2, stats.totalFiles());
        assertEquals(15, stats.totalSize());
        assertEquals(2, stats.totalDirectories());
        assertEquals(catalog.databasePath().toString(), stats.databasePath());
    }

    @Test
    void shouldClearEverything() throws Exception {
        write("a.md", "a");
        catalog.indexDirectory(corpus, ScanOptions.defaults());

        catalog.clear();

        assertEquals(0, catalog.getStats().totalFiles());
        assertTrue(catalog.search("a", 10, null).isEmpty());
        assertEquals(1, catalog.indexDirectory(corpus, ScanOptions.defaults()).added());
    }

    @Test
    void shouldPersistAcrossInstances() throws Exception {
        write("persistent.md", "p");
        catalog.indexDirectory(corpus, ScanOptions.defaults());

        FileCatalog reopened = new FileCatalog(catalog.databasePath());

        assertEquals(1, reopened.search("persistent", 10, null).size());
        assertEquals(1, reopened.indexDirectory(corpus, ScanOptions.defaults()).skipped());
    }

    @Test
    void shouldRescanEverythingAfterHashInvalidation() throws Exception {
        write("a.md", "a");
        write("b.md", "b");
        catalog.indexDirectory(corpus, ScanOptions.defaults());

        assertEquals(2, catalog.invalidateContentHashes());
        CatalogScan rescan = catalog.indexDirectory(corpus, ScanOptions.defaults());

        assertEquals(2, rescan.updated());
        assertEquals(0, rescan.skipped());
    }

    @Test
    void shouldHashContentWithSha256() throws Exception {
        Path file = write("abc.md", "abc");

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", FileCatalog.contentHash(file));
    }

    private Path write(String relative, String content) throws IOException {
        Path file = corpus.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
