package ai.subtitle.translator.progress;

/**
 * Resume state of one target file.
 */
public enum ProgressState {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
