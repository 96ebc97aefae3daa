package ai.subtitle.translator.grouping;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a translated sentence across the entries it came from, in proportion to each entry's
 * share of the original text. Split points always fall on whitespace, and every entry receives
 * at least one word. Whitespace runs are collapsed when the text is split.
 */
public class TextRedistributor {

    public List<String> redistribute(String translated, List<Integer> weights) {
        Objects.requireNonNull(translated, "translated");
        Objects.requireNonNull(weights, "weights");
        if (weights.isEmpty()) {
            throw new IllegalArgumentException("weights must not be empty");
        }
        String text = translated.strip();
        int parts = weights.size();
        if (parts == 1) {
            return List.of(text);
        }
        text = text.replaceAll("\\s+", " ");

        List<int[]> gaps = whitespaceRuns(text);
        if (gaps.size() < parts - 1) {
            throw new RedistributionException("Cannot split %d words across %d entries"
                    .formatted(text.isEmpty() ? 0 : gaps.size() + 1, parts));
        }

        double[] targets = splitTargets(text.length(), weights);
        int[] chosen = new int[parts - 1];
        int previous = -1;
        for (int k = 0; k < parts - 1; k++) {
            int lowest = previous + 1;
            int highest = gaps.size() - (parts - 1 - k);
            int best = lowest;
            double bestDistance = Double.MAX_VALUE;
            for (int g = lowest; g <= highest; g++) {
                int[] gap = gaps.get(g);
                double distance = Math.abs((gap[0] + gap[1]) / 2.0 - targets[k]);
                if (distance < bestDistance) {
                    best = g;
                    bestDistance = distance;
                }
            }
            chosen[k] = best;
            previous = best;
        }

        List<String> result = new ArrayList<>(parts);
        int start = 0;
        for (int k = 0; k < parts - 1; k++) {
            int[] gap = gaps.get(chosen[k]);
            result.add(text.substring(start, gap[0]));
            start = gap[1];
        }
        result.add(text.substring(start));
        return result;
    }

    private double[] splitTargets(int length, List<Integer> weights) {
        long total = 0;
        for (Integer weight : weights) {
            total += Math.max(0, weight);
        }
        double[] targets = new double[weights.size() - 1];
        long cumulative = 0;
        for (int k = 0; k < targets.length; k++) {
            if (total == 0) {
                targets[k] = (double) length * (k + 1) / weights.size();
            } else {
                cumulative += Math.max(0, weights.get(k));
                targets[k] = (double) length * cumulative / total;
            }
        }
        return targets;
    }

    private List<int[]> whitespaceRuns(String text) {
        List<int[]> runs = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            if (Character.isWhitespace(text.charAt(i))) {
                int start = i;
                while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                runs.add(new int[] {start, i});
            } else {
                i++;
            }
        }
        return runs;
    }
}
