package ai.legaldoc.reviser.amend;

/**
 * Text-transform service that rewrites one article according to a natural-language repeal directive.
 * Implementations return the raw response; validation happens in {@link AmendmentApplier}.
 */
@FunctionalInterface
public interface ArticleEditor {

    String edit(String articleText, String instruction);
}
