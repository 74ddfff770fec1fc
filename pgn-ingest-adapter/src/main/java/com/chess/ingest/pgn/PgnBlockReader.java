package com.chess.ingest.pgn;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Splits a PGN character stream into game blocks, one block at a time.
 * Only the block being assembled is held in memory.
 * <p>
 * A block is a run of tag lines followed by move text. The move text ends at a
 * blank line or at the next tag line.
 * <p>
 * A block longer than the character limit stops accumulating once it crosses
 * the limit. The rest of it is read and discarded up to the next block
 * boundary, and the block is handed on marked as truncated with only the
 * start of its raw text.
 */
public class PgnBlockReader implements Iterator<RawGameBlock> {

    public static final long UNBOUNDED = Long.MAX_VALUE;

    /** Raw text kept from a truncated block, for the rejection report */
    static final int TRUNCATED_PREVIEW_CHARS = 1024;

    private static final Pattern TAG_LINE = Pattern.compile("^\\[\\s*([A-Za-z0-9_]+)\\s+\"((?:[^\"\\\\]|\\\\.)*)\"\\s*]$");

    private enum State { EMPTY, TAGS, MOVES }

    private final BufferedReader reader;
    private final long maxBlockChars;

    private State state = State.EMPTY;
    private Map<String, String> tags = new LinkedHashMap<>();
    private List<String> malformedTags = new ArrayList<>();
    private StringBuilder moveText = new StringBuilder();
    private StringBuilder rawText = new StringBuilder();
    private long startLine;
    private long lineNumber;
    private long blockChars;
    private boolean truncated;
    private long lastLineLength;

    private String pushedBack;
    private RawGameBlock next;
    private boolean exhausted;

    public PgnBlockReader(BufferedReader reader) {
        this(reader, UNBOUNDED);
    }

    /**
     * @param maxBlockChars characters a block may span before it is truncated
     */
    public PgnBlockReader(BufferedReader reader, long maxBlockChars) {
        if (maxBlockChars < 1) {
            throw new IllegalArgumentException("maxBlockChars must be positive: " + maxBlockChars);
        }
        this.reader = reader;
        this.maxBlockChars = maxBlockChars;
    }

    /**
     * Lazy stream of blocks. Closing the stream closes the reader.
     */
    public static Stream<RawGameBlock> blocks(BufferedReader reader) {
        return blocks(reader, UNBOUNDED);
    }

    public static Stream<RawGameBlock> blocks(BufferedReader reader, long maxBlockChars) {
        PgnBlockReader blockReader = new PgnBlockReader(reader, maxBlockChars);
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(blockReader, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(() -> {
                    try {
                        reader.close();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
    }

    @Override
    public boolean hasNext() {
        if (next == null && !exhausted) {
            next = readBlock();
            if (next == null) {
                exhausted = true;
            }
        }
        return next != null;
    }

    @Override
    public RawGameBlock next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        RawGameBlock block = next;
        next = null;
        return block;
    }

    private RawGameBlock readBlock() {
        try {
            String line;
            while ((line = nextLine()) != null) {
                String trimmed = line.trim();

                if (line.startsWith("%")) {
                    // escape mechanism, ignored
                    continue;
                }

                if (trimmed.isEmpty()) {
                    if (state == State.MOVES) {
                        return emit();
                    }
                    if (state == State.TAGS && admit()) {
                        rawText.append(line).append('\n');
                    }
                    continue;
                }

                if (trimmed.startsWith("[")) {
                    if (state == State.MOVES) {
                        pushedBack = line;
                        lineNumber--;
                        return emit();
                    }
                    begin();
                    state = State.TAGS;
                    if (!admit()) {
                        continue;
                    }
                    rawText.append(line).append('\n');
                    Matcher m = TAG_LINE.matcher(trimmed);
                    if (m.matches()) {
                        tags.putIfAbsent(m.group(1), unescape(m.group(2)));
                    } else {
                        malformedTags.add(trimmed);
                    }
                    continue;
                }

                begin();
                state = State.MOVES;
                if (!admit()) {
                    continue;
                }
                rawText.append(line).append('\n');
                if (moveText.length() > 0) {
                    moveText.append('\n');
                }
                moveText.append(trimmed);
            }
            return state == State.EMPTY ? null : emit();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read PGN input at line " + lineNumber, e);
        }
    }

    private String nextLine() throws IOException {
        lineNumber++;
        if (pushedBack != null) {
            String line = pushedBack;
            pushedBack = null;
            return line;
        }
        if (maxBlockChars == UNBOUNDED) {
            String line = reader.readLine();
            lastLineLength = line == null ? 0 : line.length();
            return line;
        }
        return readBoundedLine();
    }

    /**
     * Like {@link BufferedReader#readLine()}, but keeps at most one character
     * more than the block limit. {@link #lastLineLength} holds the full length.
     */
    private String readBoundedLine() throws IOException {
        long keep = Math.min(maxBlockChars + 1, Integer.MAX_VALUE - 8);
        StringBuilder line = new StringBuilder();
        long length = 0;
        boolean readAny = false;
        int c;
        while ((c = reader.read()) != -1) {
            readAny = true;
            if (c == '\n') {
                break;
            }
            if (c == '\r') {
                reader.mark(1);
                int following = reader.read();
                if (following != '\n' && following != -1) {
                    reader.reset();
                }
                break;
            }
            if (length < keep) {
                line.append((char) c);
            }
            length++;
        }
        if (!readAny) {
            return null;
        }
        lastLineLength = length;
        return line.toString();
    }

    /**
     * Count the current line against the block limit.
     *
     * @return false once the block is over the limit and the line must be dropped
     */
    private boolean admit() {
        blockChars += lastLineLength + 1;
        if (!truncated && blockChars > maxBlockChars) {
            truncated = true;
            if (rawText.length() > TRUNCATED_PREVIEW_CHARS) {
                rawText.setLength(TRUNCATED_PREVIEW_CHARS);
            }
            rawText.trimToSize();
            moveText = new StringBuilder();
        }
        return !truncated;
    }

    private void begin() {
        if (state == State.EMPTY) {
            startLine = lineNumber;
        }
    }

    private RawGameBlock emit() {
        RawGameBlock block = new RawGameBlock(tags, moveText.toString(), rawText.toString(), malformedTags, startLine,
                truncated ? blockChars : 0);
        state = State.EMPTY;
        blockChars = 0;
        truncated = false;
        tags = new LinkedHashMap<>();
        malformedTags = new ArrayList<>();
        moveText = new StringBuilder();
        rawText = new StringBuilder();
        return block;
    }

    private static String unescape(String value) {
        return value.replace("\\\"", "\"").replace("\\\\", "\\");
    }
}
