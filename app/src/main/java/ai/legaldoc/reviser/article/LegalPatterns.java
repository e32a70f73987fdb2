package ai.legaldoc.reviser.article;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text patterns of Serbian legislation the engine depends on. They must stay bit-for-bit compatible
 * with the published documents.
 */
public final class LegalPatterns {

    public static final Pattern ARTICLE_HEADER =
            Pattern.compile("^Član\\s+(\\d+[a-zA-Z]*)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    public static final Pattern GAZETTE_CITATION = Pattern.compile("\"Sl\\. glasnik RS\", br\\. (.+?)\\)");

    public static final Pattern REPEAL_INSTRUCTION =
            Pattern.compile("člana (\\d+)\\. stav (\\d+)\\. Zakona o računovodstvu");

    public static final String GAZETTE_MARKER = "Sl. glasnik RS";
    public static final String GAZETTE_CITATION_PREFIX = "\"Sl. glasnik RS\", br. ";
    public static final String CEASES_TO_BE_VALID = "prestaju da važe";
    public static final String CITATION_SEPARATOR = " i ";
    public static final String ARTICLE_WORD = "Član";
    public static final char MODIFICATION_MARKER = '*';

    private LegalPatterns() {
    }

    public static boolean isArticleHeader(String text) {
        return text != null && ARTICLE_HEADER.matcher(text.trim()).find();
    }

    /**
     * Header text flagged as modified, e.g. {@code Član 9*}.
     */
    public static boolean isModifiedArticleHeader(String text) {
        return isArticleHeader(text) && text.indexOf(MODIFICATION_MARKER) >= 0;
    }

    /**
     * Normalized article id for a header line: {@code ČLAN 9} and {@code član 9} both become
     * {@code Član 9}; a trailing marker is kept attached ({@code Član 9*}), other trailing text after one
     * space ({@code Član 9 (brisan)}).
     */
    public static Optional<String> articleId(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        Matcher matcher = ARTICLE_HEADER.matcher(trimmed);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String rest = trimmed.substring(matcher.end()).trim();
        String id = ARTICLE_WORD + " " + matcher.group(1);
        if (rest.isEmpty()) {
            return Optional.of(id);
        }
        return Optional.of(rest.charAt(0) == MODIFICATION_MARKER ? id + rest : id + " " + rest);
    }

    public static String articleId(int number) {
        return ARTICLE_WORD + " " + number;
    }
}
