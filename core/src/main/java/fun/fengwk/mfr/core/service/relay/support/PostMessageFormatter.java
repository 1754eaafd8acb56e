package fun.fengwk.mfr.core.service.relay.support;

import freemarker.template.Template;
import fun.fengwk.mfr.core.service.forum.model.ForumPost;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.StringWriter;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

/**
 * Renders a post as a chat message.
 *
 * @author fengwk
 */
@Component
public class PostMessageFormatter {

    static final String TEMPLATE_NAME = "post-message.ftl";

    private static final DateTimeFormatter PUBLISH_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final freemarker.template.Configuration relayTemplateConfiguration;

    public PostMessageFormatter(@Qualifier("relayTemplateConfiguration") freemarker.template.Configuration relayTemplateConfiguration) {
        this.relayTemplateConfiguration = relayTemplateConfiguration;
    }

    /**
     * Formats the post, loading its details if needed.
     *
     * @throws IllegalStateException when the template cannot be rendered
     */
    public String format(ForumPost post) {
        Map<String, Object> model = new HashMap<>();
        model.put("title", post.getTitle());
        model.put("author", post.getAuthor());
        model.put("publishTime", PUBLISH_TIME_FORMATTER.format(post.getPublishTime()));
        model.put("tags", post.getTags());
        model.put("content", post.getContent());
        model.put("url", post.getUrl() == null ? "" : post.getUrl());

        StringWriter result = new StringWriter(1024);
        try {
            Template template = relayTemplateConfiguration.getTemplate(TEMPLATE_NAME);
            template.process(model, result);
            return result.toString();
        } catch (Exception e) {
            throw new IllegalStateException("format post message failed, id=" + post.getId() + ", error=" + e.getMessage(), e);
        }
    }

}
