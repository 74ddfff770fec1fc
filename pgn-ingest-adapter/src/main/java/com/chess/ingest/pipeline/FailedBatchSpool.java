package com.chess.ingest.pipeline;

import com.chess.ingest.pgn.GameRecord;
import com.chess.ingest.pgn.PgnWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the records of a batch that could not be committed to a PGN file,
 * so the run does not hold them in memory and the file can be imported again.
 */
public class FailedBatchSpool {

    private static final Logger log = LoggerFactory.getLogger(FailedBatchSpool.class);

    private final Path directory;

    public FailedBatchSpool(Path directory) {
        this.directory = directory;
    }

    /**
     * @return the file holding the records
     * @throws IOException if the directory or the file cannot be written
     */
    public Path write(long sequence, List<GameRecord> records) throws IOException {
        Files.createDirectories(directory);
        Path file = Files.createTempFile(directory, "failed-batch-" + sequence + "-", ".pgn");
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            PgnWriter writer = new PgnWriter(out);
            for (GameRecord record : records) {
                writer.write(record);
            }
        }
        log.info("Spooled {} records of failed batch {} to {}", records.size(), sequence, file);
        return file;
    }

    public Path getDirectory() {
        return directory;
    }
}
