package com.wikigen.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns free text into an FTS5 MATCH expression: every whitespace token is reduced to
 * letters, digits and underscores, quoted, given a prefix wildcard and OR-joined.
 * An empty result means match-all.
 */
public final class FtsQuery {
    private static final Pattern UNSAFE = Pattern.compile("[^\\p{L}\\p{N}_]+");

    private FtsQuery() {
    }

    public static Optional<String> build(String query) {
        List<String> terms = terms(query);
        if (terms.isEmpty()) {
            return Optional.empty();
        }
        List<String> parts = new ArrayList<>(terms.size());
        for (String term : terms) {
            parts.add("\"" + term + "\"*");
        }
        return Optional.of(String.join(" OR ", parts));
    }

    static List<String> terms(String query) {
        List<String> terms = new ArrayList<>();
        if (query == null || query.isBlank()) {
            return terms;
        }
        for (String word : query.strip().split("\\s+")) {
            for (String token : UNSAFE.matcher(word).replaceAll(" ").strip().split(" +")) {
                if (!token.isEmpty()) {
                    terms.add(token);
                }
            }
        }
        return terms;
    }
}
