package com.wikigen.index;

/**
 * @param maxDepth directory levels below the root to descend into, {@code null} for unlimited
 */
public record ScanOptions(String pattern, boolean excludeHidden, Integer maxDepth) {
    public static final String DEFAULT_PATTERN = "*.md";

    public ScanOptions {
        if (pattern == null || pattern.isBlank()) {
            pattern = DEFAULT_PATTERN;
        }
        if (maxDepth != null && maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
    }

    public static ScanOptions defaults() {
        return new ScanOptions(DEFAULT_PATTERN, true, null);
    }
}
