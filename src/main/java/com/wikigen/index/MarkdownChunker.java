package com.wikigen.index;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits markdown into overlapping chunks. Sizes are given in approximate tokens
 * (four characters each). Breaks prefer a header, then a blank line, then a
 * sentence end, then whitespace. Fenced code blocks are never cut.
 */
public class MarkdownChunker {
    public static final int CHARS_PER_TOKEN = 4;
    public static final int MIN_CHUNK_LENGTH = 100;

    private static final Pattern CODE_BLOCK = Pattern.compile("```.*?```", Pattern.DOTALL);
    private static final Pattern HEADER = Pattern.compile("\\n#{1,6}\\s+");
    private static final Pattern PARAGRAPH = Pattern.compile("\\n\\n+");
    private static final Pattern SENTENCE = Pattern.compile("[.!?]\\s+");
    private static final Pattern WORD = Pattern.compile("\\s+");

    private static final int HEADER_LOOKAHEAD = 100;
    private static final int PARAGRAPH_LOOKBEHIND = 200;
    private static final int PARAGRAPH_LOOKAHEAD = 100;
    private static final int SENTENCE_LOOKBEHIND = 100;
    private static final int SENTENCE_LOOKAHEAD = 50;
    private static final int WORD_WINDOW = 50;

    private final int chunkSize;
    private final int overlap;

    public MarkdownChunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap must not be negative: " + overlap);
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<Chunk> chunk(String text) {
        List<Chunk> chunks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return chunks;
        }
        if (text.strip().length() < MIN_CHUNK_LENGTH) {
            chunks.add(new Chunk(text.strip(), 0, text.length(), 0));
            return chunks;
        }

        int charSize = chunkSize * CHARS_PER_TOKEN;
        int charOverlap = overlap * CHARS_PER_TOKEN;
        int minProgress = Math.max(1, charSize / 2);
        List<int[]> codeBlocks = codeBlocks(text);
        int length = text.length();

        int start = 0;
        int chunkIndex = 0;
        while (start < length) {
            int end = Math.min(start + charSize, length);
            if (end < length) {
                end = breakPoint(text, start, end, Math.max(MIN_CHUNK_LENGTH, minProgress));
            }
            end = extendPastCodeBlock(codeBlocks, end);

            String content = text.substring(start, end).strip();
            if (content.length() >= MIN_CHUNK_LENGTH) {
                chunks.add(new Chunk(content, start, end, chunkIndex));
                chunkIndex++;
            }
            if (end >= length) {
                break;
            }

            int next = end - charOverlap;
            if (next - start < minProgress) {
                next = Math.min(start + minProgress, end);
            }
            start = moveOutOfCodeBlock(codeBlocks, next, start);
        }
        return chunks;
    }

    // Breaks closer than minLength to the start would yield a fragment too short to keep.
    private int breakPoint(String text, int start, int end, int minLength) {
        int length = text.length();
        int floor = Math.min(start + minLength, end);

        int header = firstMatchStart(HEADER, text, Math.max(start + 1, floor), Math.min(end + HEADER_LOOKAHEAD, length));
        if (header > start) {
            return header;
        }
        int paragraph = firstMatchEnd(PARAGRAPH, text, Math.max(floor, end - PARAGRAPH_LOOKBEHIND),
                Math.min(end + PARAGRAPH_LOOKAHEAD, length));
        if (paragraph > start) {
            return paragraph;
        }
        int sentence = firstMatchEnd(SENTENCE, text, Math.max(floor, end - SENTENCE_LOOKBEHIND),
                Math.min(end + SENTENCE_LOOKAHEAD, length));
        if (sentence > start) {
            return sentence;
        }
        int word = firstMatchEnd(WORD, text, Math.max(floor, end - WORD_WINDOW), Math.min(end + WORD_WINDOW, length));
        if (word > start) {
            return word;
        }
        return end;
    }

    private static int firstMatchStart(Pattern pattern, String text, int from, int to) {
        if (from >= to) {
            return -1;
        }
        Matcher matcher = pattern.matcher(text).region(from, to);
        return matcher.find() ? matcher.start() : -1;
    }

    private static int firstMatchEnd(Pattern pattern, String text, int from, int to) {
        if (from >= to) {
            return -1;
        }
        Matcher matcher = pattern.matcher(text).region(from, to);
        return matcher.find() ? matcher.end() : -1;
    }

    private static List<int[]> codeBlocks(String text) {
        List<int[]> blocks = new ArrayList<>();
        Matcher matcher = CODE_BLOCK.matcher(text);
        while (matcher.find()) {
            blocks.add(new int[] { matcher.start(), matcher.end() });
        }
        return blocks;
    }

    private static int extendPastCodeBlock(List<int[]> blocks, int end) {
        for (int[] block : blocks) {
            if (block[0] < end && end < block[1]) {
                return block[1];
            }
        }
        return end;
    }

    // A start inside a fence moves back to the fence when that still advances, otherwise past it.
    private static int moveOutOfCodeBlock(List<int[]> blocks, int next, int previousStart) {
        for (int[] block : blocks) {
            if (block[0] < next && next < block[1]) {
                return block[0] > previousStart ? block[0] : block[1];
            }
        }
        return next;
    }
}
