package ai.subtitle.translator.subtitle;

/**
 * Raised when a subtitle file contains a block that cannot be parsed.
 */
public class SubtitleParseException extends RuntimeException {

    private final int lineNumber;

    public SubtitleParseException(String message, int lineNumber) {
        super(lineNumber > 0 ? message + " (line " + lineNumber + ")" : message);
        this.lineNumber = lineNumber;
    }

    public SubtitleParseException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = -1;
    }

    /**
     * Returns the 1-based line number of the offending line, or {@code -1} when unknown.
     */
    public int lineNumber() {
        return lineNumber;
    }
}
