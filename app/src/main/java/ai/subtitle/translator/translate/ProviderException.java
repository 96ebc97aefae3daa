package ai.subtitle.translator.translate;

/**
 * Runtime exception used to propagate provider failures: transport errors, timeouts and
 * malformed or mismatched responses.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
