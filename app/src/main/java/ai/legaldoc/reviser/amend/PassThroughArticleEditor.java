package ai.legaldoc.reviser.amend;

/**
 * Editor used for dry runs: returns the article untouched without invoking remote APIs, so every
 * amendment ends on the unmodified fallback.
 */
public class PassThroughArticleEditor implements ArticleEditor {

    @Override
    public String edit(String articleText, String instruction) {
        return articleText == null ? "" : articleText;
    }
}
