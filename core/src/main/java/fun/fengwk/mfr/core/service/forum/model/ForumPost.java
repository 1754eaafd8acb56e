package fun.fengwk.mfr.core.service.forum.model;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Forum post whose details are loaded once, on first access.
 *
 * <p>The first read of {@link #getContent()}, {@link #getPublishTime()}, {@link #getImages()} or
 * {@link #getTags()} calls the loader exactly once. A failed load leaves fixed fallback values and is
 * never retried. Instances are not thread-safe, callers that share a post across threads must lock
 * around the first read.
 *
 * @author fengwk
 */
@Slf4j
public class ForumPost {

    public static final String LOAD_FAILED_CONTENT = "内容加载失败";

    @Getter
    private final long id;
    @Getter
    private final String title;
    @Getter
    private final String url;
    @Getter
    private final String author;

    private final PostDetailsLoader loader;

    private String content;
    private LocalDateTime publishTime;
    private List<String> images;
    private List<String> tags;
    private boolean loaded;

    public ForumPost(long id, String title, String url, String author, PostDetailsLoader loader) {
        this.id = id;
        this.title = title == null ? "" : title;
        this.url = url;
        this.author = author == null ? "" : author;
        this.loader = loader;
    }

    /**
     * Creates a post with details already in hand.
     */
    public static ForumPost loaded(long id, String url, PostDetails details) {
        ForumPost post = new ForumPost(id, details.getTitle(), url, details.getAuthor(), null);
        post.apply(details);
        return post;
    }

    public void ensureLoaded() {
        if (loaded) {
            return;
        }
        PostDetails details = null;
        if (loader != null) {
            try {
                details = loader.load(url);
            } catch (RuntimeException ex) {
                log.warn("load post details failed, id={}, url={}, error={}", id, url, ex.getMessage());
            }
        }
        if (details == null) {
            applyFallback();
        } else {
            apply(details);
        }
    }

    public boolean isLoaded() {
        return loaded;
    }

    public String getContent() {
        ensureLoaded();
        return content;
    }

    public LocalDateTime getPublishTime() {
        ensureLoaded();
        return publishTime;
    }

    public List<String> getImages() {
        ensureLoaded();
        return images;
    }

    public List<String> getTags() {
        ensureLoaded();
        return tags;
    }

    private void apply(PostDetails details) {
        this.content = details.getContent() == null ? "" : details.getContent();
        this.publishTime = details.getPublishTime() == null ? LocalDateTime.now() : details.getPublishTime();
        this.images = details.getImages() == null ? List.of() : List.copyOf(details.getImages());
        this.tags = details.getTags() == null ? List.of() : List.copyOf(details.getTags());
        this.loaded = true;
    }

    private void applyFallback() {
        this.content = LOAD_FAILED_CONTENT;
        this.publishTime = LocalDateTime.now();
        this.images = List.of();
        this.tags = List.of();
        this.loaded = true;
    }

}
