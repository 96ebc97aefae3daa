package ai.subtitle.translator.grouping;

import ai.subtitle.translator.subtitle.FormattingMarkup;
import ai.subtitle.translator.subtitle.MarkupExtraction;
import ai.subtitle.translator.subtitle.SubtitleDocument;
import ai.subtitle.translator.subtitle.SubtitleEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partitions subtitle entries into sentence groups by scanning left to right and extending the
 * current group while the previous entry carries its sentence into the next.
 */
public class CrossEntryGrouper {

    private static final Logger LOGGER = LoggerFactory.getLogger(CrossEntryGrouper.class);

    private final GroupingRules rules;
    private final boolean enabled;

    public CrossEntryGrouper(GroupingRules rules, boolean enabled) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.enabled = enabled;
    }

    public List<CrossEntryGroup> group(SubtitleDocument document) {
        return group(document.entries());
    }

    public List<CrossEntryGroup> group(List<SubtitleEntry> entries) {
        List<CrossEntryGroup> groups = new ArrayList<>();
        if (entries == null || entries.isEmpty()) {
            return groups;
        }
        List<SubtitleEntry> current = new ArrayList<>();
        current.add(entries.get(0));
        for (int i = 1; i < entries.size(); i++) {
            SubtitleEntry previous = entries.get(i - 1);
            SubtitleEntry next = entries.get(i);
            if (enabled && current.size() < rules.maxGroupSize() && continuesInto(previous, next)) {
                current.add(next);
            } else {
                groups.add(toGroup(groups.size(), current));
                current = new ArrayList<>();
                current.add(next);
            }
        }
        groups.add(toGroup(groups.size(), current));

        long merged = groups.stream().filter(CrossEntryGroup::isCrossEntry).count();
        LOGGER.debug("Grouped {} entries into {} units ({} cross-entry)", entries.size(), groups.size(), merged);
        return groups;
    }

    /**
     * True when {@code current} leaves its sentence open and {@code next} follows closely
     * enough, with no speaker turn on either side.
     */
    public boolean continuesInto(SubtitleEntry current, SubtitleEntry next) {
        if (rules.completesSentence(current.text())) {
            return false;
        }
        if (rules.hasSpeakerTurn(current) || rules.hasSpeakerTurn(next)) {
            return false;
        }
        long gap = Math.max(0, next.startMillis() - current.endMillis());
        return gap < rules.continuityGapMillis();
    }

    private CrossEntryGroup toGroup(int unitId, List<SubtitleEntry> members) {
        List<MarkupExtraction> extractions = new ArrayList<>(members.size());
        for (SubtitleEntry member : members) {
            extractions.add(FormattingMarkup.extract(member.lines(), rules.hasSpeakerTurn(member)));
        }
        return new CrossEntryGroup(unitId, members, extractions);
    }
}
