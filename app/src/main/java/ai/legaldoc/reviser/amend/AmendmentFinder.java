package ai.legaldoc.reviser.amend;

import ai.legaldoc.reviser.article.LegalPatterns;
import ai.legaldoc.reviser.model.Block;
import ai.legaldoc.reviser.model.Document;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Reads repeal directives and the amending act's own citation out of a government amendment document.
 */
public class AmendmentFinder {

    private static final String LAW_NAME_MARKER = "ZAKON O";
    private static final String GAZETTE_MARKER_UPPER = LegalPatterns.GAZETTE_MARKER.toUpperCase(Locale.ROOT);

    public List<AmendmentInstruction> findAmendments(Document amendmentDocument) {
        List<AmendmentInstruction> instructions = new ArrayList<>();
        for (Block block : amendmentDocument.blocks()) {
            if (!block.isParagraph()) {
                continue;
            }
            String text = block.asParagraph().text();
            if (!text.contains(LegalPatterns.CEASES_TO_BE_VALID)) {
                continue;
            }
            String instructionText = text.trim();
            Matcher matcher = LegalPatterns.REPEAL_INSTRUCTION.matcher(instructionText);
            while (matcher.find()) {
                instructions.add(new AmendmentInstruction(matcher.group(1),
                        Integer.parseInt(matcher.group(2)), instructionText));
            }
        }
        return instructions;
    }

    /**
     * Composes {@code [ARTICLE LAW GAZETTE]} from the first article header, the first paragraph naming a
     * law and the first gazette paragraph. Empty when any of the three is missing.
     */
    public Optional<String> extractAmendingReference(Document amendmentDocument) {
        String article = null;
        String lawName = null;
        String gazette = null;
        for (Block block : amendmentDocument.blocks()) {
            if (!block.isParagraph()) {
                continue;
            }
            String text = block.asParagraph().text().trim();
            String upper = text.toUpperCase(Locale.ROOT);
            if (article == null && LegalPatterns.isArticleHeader(text)) {
                article = upper;
            }
            if (lawName == null && upper.contains(LAW_NAME_MARKER)) {
                lawName = upper;
            }
            if (gazette == null && upper.contains(GAZETTE_MARKER_UPPER)) {
                gazette = upper;
            }
        }
        if (article == null || lawName == null || gazette == null) {
            return Optional.empty();
        }
        return Optional.of("[" + article + " " + lawName + " " + gazette + "]");
    }
}
