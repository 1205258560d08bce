package com.ledgerindexer.ingestion.feed;

import com.ledgerindexer.common.RetryPolicy;
import com.ledgerindexer.domain.Checkpoint;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.stream.Stream;

/**
 * Reads checkpoints from {@code <directory>/<sequence>.json}.
 */
public class LocalCheckpointFeed extends AbstractCheckpointFeed {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final CheckpointJsonReader reader;

    public LocalCheckpointFeed(Path directory, CheckpointJsonReader reader, RetryPolicy retryPolicy,
                               long cacheSize, long headCacheTtlMs) {
        super(retryPolicy, cacheSize, headCacheTtlMs);
        this.directory = directory;
        this.reader = reader;
    }

    @Override
    protected Optional<Checkpoint> read(long sequence) {
        Path file = directory.resolve(sequence + SUFFIX);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new FeedUnavailableException("Cannot read " + file + ": " + e.getMessage(), e);
        }
        try {
            return Optional.of(reader.read(content));
        } catch (IOException e) {
            throw new MalformedCheckpointException(sequence, "Unparsable checkpoint file " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected OptionalLong readHead() {
        if (!Files.isDirectory(directory)) {
            throw new FeedUnavailableException("Checkpoint directory missing: " + directory);
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .filter(LocalCheckpointFeed::isSequence)
                    .mapToLong(Long::parseLong)
                    .max();
        } catch (IOException e) {
            throw new FeedUnavailableException("Cannot list " + directory + ": " + e.getMessage(), e);
        }
    }

    private static boolean isSequence(String name) {
        if (name.isEmpty() || name.length() > 18) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!Character.isDigit(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
