package ai.subtitle.translator.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One source file and the output it is translated into.
 */
public record TranslationJob(Path source, Path target) {

    public TranslationJob {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (source.toAbsolutePath().normalize().equals(target.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("target must differ from source: " + source);
        }
    }

    /**
     * {@code <stem>.<target language>.srt} beside the source.
     */
    public static TranslationJob besideSource(Path source, String targetLanguage) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return new TranslationJob(source, source.resolveSibling(stem + "." + targetLanguage + ".srt"));
    }
}
