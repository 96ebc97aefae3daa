package ai.subtitle.translator.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the JSON progress file of one target. Saves go through a temporary file in the
 * same directory followed by a move, so readers only ever see a complete file.
 */
public class ProgressStore {

    public static final String FILE_SUFFIX = ".progress.json";

    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressStore.class);

    private final Path progressFile;
    private final ObjectMapper objectMapper;

    public ProgressStore(Path progressFile) {
        this(progressFile, defaultObjectMapper());
    }

    ProgressStore(Path progressFile, ObjectMapper objectMapper) {
        this.progressFile = Objects.requireNonNull(progressFile, "progressFile").toAbsolutePath().normalize();
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public static ProgressStore forTarget(Path target) {
        return new ProgressStore(pathFor(target));
    }

    /**
     * {@code <target file name>.progress.json} beside the target.
     */
    public static Path pathFor(Path target) {
        Path absolute = target.toAbsolutePath().normalize();
        return absolute.resolveSibling(absolute.getFileName() + FILE_SUFFIX);
    }

    static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path progressFile() {
        return progressFile;
    }

    public boolean exists() {
        return Files.exists(progressFile);
    }

    /**
     * Loads the stored record. A missing file yields empty; an unreadable one is logged and also
     * yields empty.
     */
    public Optional<ProgressRecord> load() {
        if (!exists()) {
            return Optional.empty();
        }
        try {
            return Optional.of(read());
        } catch (ProgressCorruptionException ex) {
            LOGGER.warn("Ignoring progress file {}: {}", progressFile, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads the stored record.
     *
     * @throws ProgressCorruptionException when the file is missing, unreadable, malformed or of an
     *                                     unsupported schema version
     */
    public ProgressRecord read() {
        ProgressRecord progressRecord;
        try {
            progressRecord = objectMapper.readValue(progressFile.toFile(), ProgressRecord.class);
        } catch (JsonProcessingException ex) {
            throw new ProgressCorruptionException("malformed progress file: " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new ProgressCorruptionException("cannot read progress file: " + ex.getMessage(), ex);
        }
        if (progressRecord == null) {
            throw new ProgressCorruptionException("progress file is empty");
        }
        if (progressRecord.schemaVersion() != ProgressRecord.CURRENT_SCHEMA_VERSION) {
            throw new ProgressCorruptionException("unsupported schema version " + progressRecord.schemaVersion());
        }
        return progressRecord;
    }

    public void save(ProgressRecord progressRecord) {
        Objects.requireNonNull(progressRecord, "progressRecord");
        Path directory = progressFile.getParent();
        Path temporary = null;
        try {
            Files.createDirectories(directory);
            temporary = Files.createTempFile(directory, progressFile.getFileName().toString(), ".tmp");
            Files.write(temporary, objectMapper.writeValueAsBytes(progressRecord));
            try {
                Files.move(temporary, progressFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                LOGGER.debug("Atomic move not supported in {}; replacing {}", directory, progressFile.getFileName());
                Files.move(temporary, progressFile, StandardCopyOption.REPLACE_EXISTING);
            }
            LOGGER.debug("Saved progress: {}/{} units, state {}", progressRecord.completedUnits().size(),
                    progressRecord.totalUnits(), progressRecord.state());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to save progress file " + progressFile, ex);
        } finally {
            deleteQuietly(temporary);
        }
    }

    public boolean delete() {
        try {
            return Files.deleteIfExists(progressFile);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to delete progress file " + progressFile, ex);
        }
    }

    private void deleteQuietly(Path temporary) {
        if (temporary == null) {
            return;
        }
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException ex) {
            LOGGER.warn("Could not remove temporary progress file {}: {}", temporary, ex.getMessage());
        }
    }
}
