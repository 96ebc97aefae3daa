package ai.subtitle.translator.cli;

import ai.subtitle.translator.config.LogFormat;
import ai.subtitle.translator.engine.ProcessingMode;
import ai.subtitle.translator.subtitle.SplitMethod;
import ai.subtitle.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-subtitle-translator", mixinStandardHelpOptions = true,
        version = "ai-subtitle-translator 0.1.0",
        description = "Translates SubRip subtitle files with resumable progress")
public class CliArguments {

    @CommandLine.Parameters(paramLabel = "FILE", arity = "1..*", description = "Subtitle files (.srt) to translate")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output file (single input only)", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = {"-s", "--source"}, description = "Source language code", paramLabel = "LANG")
    private String sourceLanguage;

    @CommandLine.Option(names = {"-t", "--target"}, description = "Target language code", paramLabel = "LANG")
    private String targetLanguage;

    @CommandLine.Option(names = "--mode", converter = ProcessingModeConverter.class, description = "Processing mode: line-by-line, batch or whole-file")
    private ProcessingMode processingMode;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--batch-size", description = "Units per provider call in batch mode", paramLabel = "COUNT")
    private Integer batchSize;

    @CommandLine.Option(names = "--overlap", description = "Previously translated units repeated before each batch", paramLabel = "COUNT")
    private Integer overlapSize;

    @CommandLine.Option(names = "--overlap-reassessment", negatable = true, description = "Retranslate overlap units and keep the newer answer")
    private Boolean overlapReassessment;

    @CommandLine.Option(names = "--max-row-length", description = "Maximum characters per subtitle row, 0 disables reflow", paramLabel = "CHARS")
    private Integer maxRowLength;

    @CommandLine.Option(names = "--split-method", converter = SplitMethodConverter.class, description = "Row split method: word, char or even")
    private SplitMethod splitMethod;

    @CommandLine.Option(names = "--cross-entry", negatable = true, description = "Merge entries that continue one sentence")
    private Boolean crossEntryDetection;

    @CommandLine.Option(names = "--continuity-gap", description = "Largest gap in milliseconds across which a sentence continues", paramLabel = "MILLIS")
    private Long continuityGapMillis;

    @CommandLine.Option(names = "--dialogue-markers", split = ",", description = "Line prefixes that start a new speaker", paramLabel = "MARKER")
    private List<String> dialogueMarkers;

    @CommandLine.Option(names = "--max-group-size", description = "Most entries merged into one sentence", paramLabel = "COUNT")
    private Integer maxGroupSize;

    @CommandLine.Option(names = "--context-window", description = "Neighbouring units sent as context", paramLabel = "COUNT")
    private Integer contextWindow;

    @CommandLine.Option(names = "--whole-file-max-units", description = "Largest file translated in a single call", paramLabel = "COUNT")
    private Integer wholeFileMaxUnits;

    @CommandLine.Option(names = "--provider", description = "Provider as provider:model; repeat for fallbacks in priority order", paramLabel = "PROVIDER")
    private List<String> providers;

    @CommandLine.Option(names = "--retries", description = "Attempts per provider before falling back", paramLabel = "COUNT")
    private Integer maxRetryAttempts;

    @CommandLine.Option(names = "--timeout", description = "Per-call timeout in seconds", paramLabel = "SECONDS")
    private Integer timeoutSeconds;

    @CommandLine.Option(names = "--failed-placeholder", description = "Line written above the original text of untranslated units", paramLabel = "TEXT")
    private String failedPlaceholder;

    @CommandLine.Option(names = "--parallelism", description = "Files translated concurrently", paramLabel = "COUNT")
    private Integer parallelism;

    @CommandLine.Option(names = "--restart", description = "Discard stored progress and start over")
    private boolean restart;

    @CommandLine.Option(names = "--reformat-only", description = "Reflow the existing text into rows without translating; rewrites each file unless --output is given")
    private boolean reformatOnly;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public List<Path> inputs() {
        return inputs;
    }

    public Path output() {
        return output;
    }

    public String sourceLanguage() {
        return sourceLanguage;
    }

    public String targetLanguage() {
        return targetLanguage;
    }

    public ProcessingMode processingMode() {
        return processingMode;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public Integer batchSize() {
        return batchSize;
    }

    public Integer overlapSize() {
        return overlapSize;
    }

    public Boolean overlapReassessment() {
        return overlapReassessment;
    }

    public Integer maxRowLength() {
        return maxRowLength;
    }

    public SplitMethod splitMethod() {
        return splitMethod;
    }

    public Boolean crossEntryDetection() {
        return crossEntryDetection;
    }

    public Long continuityGapMillis() {
        return continuityGapMillis;
    }

    public List<String> dialogueMarkers() {
        return dialogueMarkers;
    }

    public Integer maxGroupSize() {
        return maxGroupSize;
    }

    public Integer contextWindow() {
        return contextWindow;
    }

    public Integer wholeFileMaxUnits() {
        return wholeFileMaxUnits;
    }

    public List<String> providers() {
        return providers;
    }

    public Integer maxRetryAttempts() {
        return maxRetryAttempts;
    }

    public Integer timeoutSeconds() {
        return timeoutSeconds;
    }

    public String failedPlaceholder() {
        return failedPlaceholder;
    }

    public Integer parallelism() {
        return parallelism;
    }

    public boolean restart() {
        return restart;
    }

    public boolean reformatOnly() {
        return reformatOnly;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
