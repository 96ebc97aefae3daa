package ai.subtitle.translator.translate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes units as {@code [id] text} lines for a chat prompt and decodes the numbered lines of
 * the model's reply. Hard line breaks inside a unit travel as {@code <br>}.
 */
public class NumberedUnitCodec {

    static final String LINE_BREAK_TOKEN = "<br>";

    private static final Pattern NUMBERED_LINE = Pattern.compile("^\\s*\\[(\\d+)]\\s?(.*)$");
    private static final Pattern LINE_BREAK = Pattern.compile("\\s*<br\\s*/?>\\s*", Pattern.CASE_INSENSITIVE);

    public String encode(List<TranslationUnit> units) {
        StringBuilder builder = new StringBuilder();
        for (TranslationUnit unit : units) {
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append('[').append(unit.unitId()).append("] ")
                    .append(unit.text().strip().replaceAll("\\s*\\R\\s*", " " + LINE_BREAK_TOKEN + " "));
        }
        return builder.toString();
    }

    /**
     * Parses numbered lines from a reply. Unnumbered lines before the first numbered line are
     * ignored; later ones continue the preceding unit.
     *
     * @throws ProviderException when the reply has no numbered line or repeats a number
     */
    public List<TranslatedUnit> decode(String response) {
        if (response == null || response.isBlank()) {
            throw new ProviderException("Empty response from provider");
        }
        List<Integer> ids = new ArrayList<>();
        List<StringBuilder> texts = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (String line : response.split("\\R")) {
            Matcher matcher = NUMBERED_LINE.matcher(line);
            if (matcher.matches()) {
                int id;
                try {
                    id = Integer.parseInt(matcher.group(1));
                } catch (NumberFormatException ex) {
                    throw new ProviderException("Unit number out of range: " + matcher.group(1), ex);
                }
                if (!seen.add(id)) {
                    throw new ProviderException("Response repeats unit " + id);
                }
                ids.add(id);
                texts.add(new StringBuilder(matcher.group(2).strip()));
            } else if (!texts.isEmpty() && !line.isBlank() && !isFence(line)) {
                StringBuilder last = texts.get(texts.size() - 1);
                if (last.length() > 0) {
                    last.append(' ');
                }
                last.append(line.strip());
            }
        }
        if (ids.isEmpty()) {
            throw new ProviderException("Response contains no numbered lines");
        }
        List<TranslatedUnit> result = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            result.add(new TranslatedUnit(ids.get(i), restoreLineBreaks(clean(texts.get(i).toString()))));
        }
        return result;
    }

    private String restoreLineBreaks(String text) {
        return LINE_BREAK.matcher(text).replaceAll("\n").strip();
    }

    private String clean(String text) {
        String value = text.strip();
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1).strip();
        }
        return value;
    }

    private boolean isFence(String line) {
        return line.strip().startsWith("```");
    }
}
