package ai.subtitle.translator.progress;

/**
 * Raised when a stored progress record was produced for different input or settings.
 */
public class ConfigMismatchException extends RuntimeException {

    public ConfigMismatchException(String message) {
        super(message);
    }
}
