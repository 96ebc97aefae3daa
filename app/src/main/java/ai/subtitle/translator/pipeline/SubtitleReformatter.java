package ai.subtitle.translator.pipeline;

import ai.subtitle.translator.subtitle.RowReflow;
import ai.subtitle.translator.subtitle.SubtitleDocument;
import ai.subtitle.translator.subtitle.SubtitleEntry;
import ai.subtitle.translator.subtitle.SubtitleParseException;
import ai.subtitle.translator.subtitle.SubtitleParser;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Re-splits the existing text of subtitle files into display rows without translating them.
 * Each source line is reflowed on its own; index and timing lines are kept as they are.
 */
public class SubtitleReformatter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleReformatter.class);

    private final RowReflow reflow;
    private final SubtitleParser parser = new SubtitleParser();

    public SubtitleReformatter(RowReflow reflow) {
        this.reflow = Objects.requireNonNull(reflow, "reflow");
    }

    /**
     * Reflows {@code source} into {@code target}, which may be the source itself.
     *
     * @return the number of entries whose rows changed
     * @throws SubtitleParseException when the source is malformed; nothing is written then
     */
    public int reformat(Path source, Path target) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        MDC.put(SubtitleTranslationOrchestrator.MDC_FILE, String.valueOf(source.getFileName()));
        try {
            SubtitleDocument document = parser.parse(readAll(source));
            int changed = 0;
            for (SubtitleEntry entry : document.entries()) {
                List<String> rows = reflow.reflow(entry.text());
                if (!rows.equals(entry.lines())) {
                    changed++;
                }
                entry.attachTranslation(entry.text());
            }
            Path written = OutputFiles.write(target, document.format(reflow));
            LOGGER.info("Reformatted {} of {} entries into {} (max {} chars, {} split)", changed, document.size(),
                    written, reflow.maxRowLength(), reflow.method().id());
            return changed;
        } finally {
            MDC.remove(SubtitleTranslationOrchestrator.MDC_FILE);
        }
    }

    /**
     * Reformats each source in place and returns how many files failed to parse, read or write.
     */
    public int reformatInPlace(List<Path> sources) {
        int failures = 0;
        for (Path source : sources) {
            if (!tryReformat(source, source)) {
                failures++;
            }
        }
        LOGGER.info("Reformatted {} file(s), {} failed", sources.size() - failures, failures);
        return failures;
    }

    /**
     * Same as {@link #reformat(Path, Path)} but logs a failure instead of throwing it.
     */
    public boolean tryReformat(Path source, Path target) {
        try {
            reformat(source, target);
            return true;
        } catch (SubtitleParseException ex) {
            LOGGER.error("Cannot parse {}: {}", source, ex.getMessage());
        } catch (UncheckedIOException ex) {
            LOGGER.error("Cannot reformat {}: {}", source, ex.getMessage());
        }
        return false;
    }

    private static byte[] readAll(Path source) {
        try {
            return Files.readAllBytes(source);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + source, ex);
        }
    }
}
