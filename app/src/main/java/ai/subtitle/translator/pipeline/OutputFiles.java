package ai.subtitle.translator.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes subtitle output through a temporary sibling file so a reader never sees a partial file.
 */
final class OutputFiles {

    private static final Logger LOGGER = LoggerFactory.getLogger(OutputFiles.class);

    private OutputFiles() {
    }

    static Path write(Path target, String content) {
        Path absolute = target.toAbsolutePath().normalize();
        Path temporary = null;
        try {
            Files.createDirectories(absolute.getParent());
            temporary = Files.createTempFile(absolute.getParent(), absolute.getFileName().toString(), ".tmp");
            Files.writeString(temporary, content, StandardCharsets.UTF_8);
            try {
                Files.move(temporary, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temporary, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            return absolute;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + absolute, ex);
        } finally {
            if (temporary != null) {
                try {
                    Files.deleteIfExists(temporary);
                } catch (IOException ex) {
                    LOGGER.warn("Could not remove temporary output {}: {}", temporary, ex.getMessage());
                }
            }
        }
    }
}
