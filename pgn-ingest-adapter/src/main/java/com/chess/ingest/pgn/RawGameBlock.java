package com.chess.ingest.pgn;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One game block as read from the input: its tag pairs, its move text and the
 * raw lines it was built from.
 *
 * @param tags          tag name to value, in input order
 * @param moveText      move text lines joined with newlines
 * @param rawText       the block exactly as read, kept for rejections
 * @param malformedTags tag-looking lines that could not be parsed
 * @param startLine     1-based line number of the first line of the block
 * @param skippedChars  characters the block spanned when it was cut off for size, 0 for a complete block
 */
public record RawGameBlock(
        Map<String, String> tags,
        String moveText,
        String rawText,
        List<String> malformedTags,
        long startLine,
        long skippedChars
) {

    public RawGameBlock {
        tags = Collections.unmodifiableMap(tags);
        malformedTags = List.copyOf(malformedTags);
    }

    public RawGameBlock(Map<String, String> tags, String moveText, String rawText, List<String> malformedTags,
                        long startLine) {
        this(tags, moveText, rawText, malformedTags, startLine, 0);
    }

    public boolean isTruncated() {
        return skippedChars > 0;
    }

    public String tag(String name) {
        return tags.get(name);
    }
}
