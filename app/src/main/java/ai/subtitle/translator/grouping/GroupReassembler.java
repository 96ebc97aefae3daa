package ai.subtitle.translator.grouping;

import ai.subtitle.translator.subtitle.SubtitleEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Puts a translated unit back onto its member entries: shares out the text, restores each
 * entry's formatting markup and attaches the result.
 */
public class GroupReassembler {

    public static final String CONTINUATION_MARKER = "…";

    private static final Logger LOGGER = LoggerFactory.getLogger(GroupReassembler.class);

    private final TextRedistributor redistributor;

    public GroupReassembler() {
        this(new TextRedistributor());
    }

    public GroupReassembler(TextRedistributor redistributor) {
        this.redistributor = Objects.requireNonNull(redistributor, "redistributor");
    }

    public Reassembly reassemble(CrossEntryGroup group, String translated) {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(translated, "translated");
        List<String> shares;
        boolean fallback = false;
        try {
            shares = redistributor.redistribute(translated, group.weights());
        } catch (RedistributionException ex) {
            LOGGER.warn("Unit {} (entries {}): {}; assigning the whole translation to entry {}",
                    group.unitId(), group.entryIndices(), ex.getMessage(), group.entries().get(0).index());
            shares = new ArrayList<>(group.size());
            shares.add(translated.strip());
            fallback = true;
        }

        List<String> texts = new ArrayList<>(group.size());
        for (int i = 0; i < group.size(); i++) {
            if (i < shares.size()) {
                texts.add(group.extractions().get(i).reinsert(shares.get(i)));
            } else {
                texts.add(CONTINUATION_MARKER);
            }
        }
        return new Reassembly(texts, fallback);
    }

    /**
     * Reassembles the unit and attaches the texts to its entries. Returns the number of entries
     * flagged because they could not receive their own share.
     */
    public int apply(CrossEntryGroup group, String translated) {
        Reassembly reassembly = reassemble(group, translated);
        int flagged = 0;
        for (int i = 0; i < group.size(); i++) {
            SubtitleEntry entry = group.entries().get(i);
            entry.attachTranslation(reassembly.texts().get(i));
            if (reassembly.fallback() && i > 0) {
                entry.flag();
                flagged++;
            }
        }
        return flagged;
    }

    /**
     * Per-entry texts of a reassembled unit; {@code fallback} is set when the whole translation
     * went to the first entry.
     */
    public record Reassembly(List<String> texts, boolean fallback) {

        public Reassembly {
            texts = List.copyOf(texts);
        }
    }
}
