package fun.fengwk.mfr.core.service.forum.model;

/**
 * One row of the new thread list.
 *
 * @author fengwk
 */
public record ThreadEntry(long id, String title, String url, String author) {

}
