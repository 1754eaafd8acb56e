package fun.fengwk.mfr.core.service.forum.model;

/**
 * Loads the details of a thread page.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface PostDetailsLoader {

    /**
     * @param url thread url
     * @return details, or null when the page could not be parsed
     */
    PostDetails load(String url);

}
