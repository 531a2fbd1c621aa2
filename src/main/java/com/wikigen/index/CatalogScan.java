package com.wikigen.index;

import java.util.List;

public record CatalogScan(int added, int updated, int skipped, List<IndexedFile> changedFiles) {
    public static CatalogScan empty() {
        return new CatalogScan(0, 0, 0, List.of());
    }
}
