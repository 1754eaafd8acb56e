package fun.fengwk.mfr.core.service.forum;

/**
 * Raised when the forum cannot be reached or answers unexpectedly.
 *
 * @author fengwk
 */
public class ForumClientException extends RuntimeException {

    public ForumClientException(String message) {
        super(message);
    }

    public ForumClientException(String message, Throwable cause) {
        super(message, cause);
    }

}
