package fun.fengwk.mfr.core.service.forum;

/**
 * Raised when the forum session is missing, expired or rejected.
 *
 * @author fengwk
 */
public class ForumLoginException extends ForumClientException {

    public ForumLoginException(String message) {
        super(message);
    }

}
