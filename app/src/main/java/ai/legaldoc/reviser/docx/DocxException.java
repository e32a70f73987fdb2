package ai.legaldoc.reviser.docx;

/**
 * Raised when a {@code .docx} container cannot be read or written.
 */
public class DocxException extends RuntimeException {

    public DocxException(String message, Throwable cause) {
        super(message, cause);
    }
}
