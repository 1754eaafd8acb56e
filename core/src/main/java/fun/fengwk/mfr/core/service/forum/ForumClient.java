package fun.fengwk.mfr.core.service.forum;

import fun.fengwk.mfr.core.service.forum.model.ForumPost;
import fun.fengwk.mfr.core.service.forum.model.PostDetails;
import fun.fengwk.mfr.core.service.forum.model.PostDetailsLoader;

import java.util.List;

/**
 * Logged-in access to the forum.
 *
 * @author fengwk
 */
public interface ForumClient extends PostDetailsLoader {

    /**
     * Logs in unless the current session is still valid.
     *
     * @return true once logged in
     * @throws ForumLoginException when the forum rejects the credentials
     */
    boolean login();

    boolean checkLoginStatus();

    boolean isLoggedIn();

    /**
     * Newest threads, each as a lazily loaded post.
     *
     * @throws ForumLoginException when not logged in or the session expired
     */
    List<ForumPost> getLatestPosts(int limit);

    /**
     * Loads and parses one thread page.
     *
     * @return details, or null when the page is unavailable or holds no post
     */
    PostDetails loadPostDetails(String url);

    /**
     * Fetches a thread by id with its details loaded.
     *
     * @return the post, or null when the thread page is unavailable
     */
    ForumPost fetchPost(long threadId);

    String threadUrl(long threadId);

    void clearSession();

    @Override
    default PostDetails load(String url) {
        return loadPostDetails(url);
    }

}
