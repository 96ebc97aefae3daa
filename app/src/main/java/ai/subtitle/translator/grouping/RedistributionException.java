package ai.subtitle.translator.grouping;

/**
 * Raised when a translated sentence cannot be shared out so that every member entry receives
 * at least one word.
 */
public class RedistributionException extends RuntimeException {

    public RedistributionException(String message) {
        super(message);
    }
}
