package ai.subtitle.translator.pipeline;

import ai.subtitle.translator.progress.ProgressState;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-file outcome of a translation run.
 *
 * @param flaggedEntries entries that received the continuation marker instead of their own share
 * @param providerCalls  provider invocations made for this file, retries included
 * @param error          set when the file could not be processed at all
 */
public record FileTranslationSummary(Path source,
                                     Path target,
                                     int totalUnits,
                                     int completedUnits,
                                     int failedUnits,
                                     int flaggedEntries,
                                     int providerCalls,
                                     ProgressState state,
                                     boolean cancelled,
                                     boolean outputWritten,
                                     Optional<String> error) {

    public FileTranslationSummary {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(state, "state");
        error = error == null ? Optional.empty() : error;
    }

    public static FileTranslationSummary failure(Path source, Path target, String message) {
        return new FileTranslationSummary(source, target, 0, 0, 0, 0, 0, ProgressState.NOT_STARTED, false,
                false, Optional.of(message));
    }

    public boolean isSuccessful() {
        return error.isEmpty() && !cancelled && state == ProgressState.COMPLETED && failedUnits == 0;
    }

    public String describe() {
        if (error.isPresent()) {
            return "%s: failed (%s)".formatted(source.getFileName(), error.get());
        }
        return "%s -> %s: %s, %d/%d units translated, %d failed, %d entries flagged, %d provider calls%s".formatted(
                source.getFileName(), target.getFileName(), state, completedUnits, totalUnits, failedUnits,
                flaggedEntries, providerCalls, cancelled ? ", cancelled before output was written" : "");
    }
}
