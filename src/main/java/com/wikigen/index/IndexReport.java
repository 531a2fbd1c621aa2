package com.wikigen.index;

/**
 * Outcome of one directory scan. {@code chunkedFiles} and {@code failedFiles} only
 * count semantic indexing of added or updated files.
 */
public record IndexReport(int added, int updated, int skipped, int chunkedFiles, int failedFiles) {
}
