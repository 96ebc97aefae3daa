package ai.subtitle.translator.progress;

/**
 * Raised when a progress file cannot be read or does not describe a valid record.
 */
public class ProgressCorruptionException extends RuntimeException {

    public ProgressCorruptionException(String message) {
        super(message);
    }

    public ProgressCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
