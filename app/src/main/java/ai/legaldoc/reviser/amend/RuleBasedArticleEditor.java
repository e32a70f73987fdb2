package ai.legaldoc.reviser.amend;

import ai.legaldoc.reviser.article.LegalPatterns;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.stream.Collectors;

/**
 * Deterministic, offline editor implementing the repeal contract locally: every targeted stav is dropped
 * and the header is flagged with the modification marker. Used in mock mode.
 */
public class RuleBasedArticleEditor implements ArticleEditor {

    @Override
    public String edit(String articleText, String instruction) {
        List<String> lines = Arrays.stream(articleText == null ? new String[0] : articleText.split("\\R"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));
        if (lines.isEmpty()) {
            throw new ArticleEditException("Article text is empty");
        }
        String header = lines.get(0);
        Matcher headerMatcher = LegalPatterns.ARTICLE_HEADER.matcher(header);
        if (!headerMatcher.find()) {
            throw new ArticleEditException("First line is not an article header: " + header);
        }
        String articleNumber = headerMatcher.group(1);
        int bodySize = lines.size() - 1;
        SortedSet<Integer> ordinals = resolveOrdinals(articleNumber, instruction);
        for (int ordinal : ordinals) {
            if (ordinal < 1 || ordinal > bodySize) {
                throw new ArticleEditException("Stav %d does not exist; article %s has %d paragraphs".formatted(ordinal, articleNumber, bodySize));
            }
        }
        // highest ordinal first, so earlier removals don't shift the later ones
        for (int ordinal : ordinals) {
            lines.remove(ordinal);
        }
        if (header.indexOf(LegalPatterns.MODIFICATION_MARKER) < 0) {
            lines.set(0, header + LegalPatterns.MODIFICATION_MARKER);
        }
        return String.join("\n", lines);
    }

    /**
     * Every stav the instruction repeals in this article, highest first. An instruction naming only
     * other articles applies its first ordinal.
     */
    private SortedSet<Integer> resolveOrdinals(String articleNumber, String instruction) {
        Matcher matcher = LegalPatterns.REPEAL_INSTRUCTION.matcher(instruction == null ? "" : instruction);
        SortedSet<Integer> ordinals = new TreeSet<>(Comparator.reverseOrder());
        Integer firstOrdinal = null;
        while (matcher.find()) {
            int ordinal = Integer.parseInt(matcher.group(2));
            if (articleNumber.equalsIgnoreCase(matcher.group(1))) {
                ordinals.add(ordinal);
            }
            if (firstOrdinal == null) {
                firstOrdinal = ordinal;
            }
        }
        if (firstOrdinal == null) {
            throw new ArticleEditException("Instruction does not name a repealed stav: " + instruction);
        }
        if (ordinals.isEmpty()) {
            ordinals.add(firstOrdinal);
        }
        return ordinals;
    }
}
