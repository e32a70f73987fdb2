package ai.legaldoc.reviser.article;

import ai.legaldoc.reviser.format.FormatPreservingCopier;
import ai.legaldoc.reviser.model.Block;
import ai.legaldoc.reviser.model.Document;
import ai.legaldoc.reviser.model.Paragraph;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accretes the official gazette citations of an amendment into the citation paragraph of a law.
 */
public class GazetteMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(GazetteMerger.class);

    private static final Comparator<String> CITATION_ORDER = Comparator
            .comparing((String token) -> !isAllDigits(token))
            .thenComparing(Comparator.naturalOrder());

    private final FormatPreservingCopier copier;

    public GazetteMerger(FormatPreservingCopier copier) {
        this.copier = Objects.requireNonNull(copier, "copier");
    }

    /**
     * Patches the first gazette paragraph of {@code targetDocument} with the citations of both sources.
     *
     * @return {@code true} when a target paragraph was found and overwritten
     */
    public boolean mergeGazette(Document oldDocument, Document amendmentDocument, Document targetDocument) {
        Optional<Paragraph> oldParagraph = findGazetteParagraph(oldDocument);
        if (oldParagraph.isEmpty()) {
            LOGGER.info("Original document has no gazette paragraph; citation merge skipped");
            return false;
        }
        String amendmentText = findGazetteParagraph(amendmentDocument)
                .map(Paragraph::text)
                .orElse("");
        String merged = mergeGazetteText(oldParagraph.get().text(), amendmentText);

        Optional<Paragraph> target = findGazetteParagraph(targetDocument);
        if (target.isEmpty()) {
            LOGGER.warn("Target document has no gazette paragraph; citation merge not applied");
            return false;
        }
        copier.copyParagraph(oldParagraph.get(), target.get());
        target.get().setText(merged);
        LOGGER.info("Gazette citation updated: {}", merged);
        return true;
    }

    /**
     * Returns {@code oldText} with its citation list replaced by the union of both lists. When either
     * side has no parseable citation the old text is returned unchanged.
     */
    public String mergeGazetteText(String oldText, String newText) {
        Matcher oldMatch = LegalPatterns.GAZETTE_CITATION.matcher(oldText == null ? "" : oldText);
        Matcher newMatch = LegalPatterns.GAZETTE_CITATION.matcher(newText == null ? "" : newText);
        if (!oldMatch.find() || !newMatch.find()) {
            return oldText;
        }
        Set<String> union = new LinkedHashSet<>(parseCitations(oldMatch.group(1)));
        union.addAll(parseCitations(newMatch.group(1)));
        String rendered = LegalPatterns.GAZETTE_CITATION_PREFIX
                + String.join(LegalPatterns.CITATION_SEPARATOR, sortCitations(union))
                + ")";
        return oldText.replace(oldMatch.group(0), rendered);
    }

    static List<String> parseCitations(String citationList) {
        return Arrays.stream(citationList.split(Pattern.quote(LegalPatterns.CITATION_SEPARATOR)))
                .map(String::trim)
                .collect(Collectors.toList());
    }

    static List<String> sortCitations(Set<String> citations) {
        return citations.stream()
                .sorted(CITATION_ORDER)
                .collect(Collectors.toList());
    }

    private Optional<Paragraph> findGazetteParagraph(Document document) {
        for (Block block : document.blocks()) {
            if (block.isParagraph() && block.asParagraph().text().contains(LegalPatterns.GAZETTE_MARKER)) {
                return Optional.of(block.asParagraph());
            }
        }
        return Optional.empty();
    }

    private static boolean isAllDigits(String token) {
        return !token.isEmpty() && token.chars().allMatch(Character::isDigit);
    }
}
