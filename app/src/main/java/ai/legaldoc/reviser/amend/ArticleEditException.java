package ai.legaldoc.reviser.amend;

/**
 * Runtime exception used to propagate article editing failures.
 */
public class ArticleEditException extends RuntimeException {

    public ArticleEditException(String message) {
        super(message);
    }

    public ArticleEditException(String message, Throwable cause) {
        super(message, cause);
    }
}
