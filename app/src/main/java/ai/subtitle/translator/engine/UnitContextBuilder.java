package ai.subtitle.translator.engine;

import ai.subtitle.translator.grouping.CrossEntryGroup;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the surrounding-lines context that accompanies a unit. Context is source text only and
 * is never translated.
 */
public class UnitContextBuilder {

    static final String BEFORE_PREFIX = "Before: ";
    static final String AFTER_PREFIX = "After: ";

    private final int window;

    public UnitContextBuilder(int window) {
        if (window < 0) {
            throw new IllegalArgumentException("window must be zero or greater");
        }
        this.window = window;
    }

    public String contextFor(List<CrossEntryGroup> units, int position) {
        return contextForRange(units, position, position + 1);
    }

    /**
     * Context for the units in {@code [from, toExclusive)}: up to {@code window} units before the
     * first and after the last.
     */
    public String contextForRange(List<CrossEntryGroup> units, int from, int toExclusive) {
        if (window == 0 || units.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        for (int i = Math.max(0, from - window); i < from; i++) {
            lines.add(BEFORE_PREFIX + flatten(units.get(i).sourceText()));
        }
        for (int i = toExclusive; i < Math.min(units.size(), toExclusive + window); i++) {
            lines.add(AFTER_PREFIX + flatten(units.get(i).sourceText()));
        }
        return String.join("\n", lines);
    }

    private static String flatten(String text) {
        return text.replaceAll("\\s*\\R\\s*", " / ");
    }
}
