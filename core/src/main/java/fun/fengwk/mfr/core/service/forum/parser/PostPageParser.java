package fun.fengwk.mfr.core.service.forum.parser;

import fun.fengwk.mfr.core.service.extract.PostContentExtractor;
import fun.fengwk.mfr.core.service.extract.model.ExtractionResult;
import fun.fengwk.mfr.core.service.forum.model.PostDetails;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Locates the first post of a thread page and extracts it.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PostPageParser {

    private static final DateTimeFormatter PUBLISH_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-M-d H:mm[:ss]");

    private final PostContentExtractor postContentExtractor;

    /**
     * @return details, or null when the page holds no post body
     */
    public PostDetails parse(Document document, String baseUrl) {
        Element post = document.selectFirst("div#postlist > div[id^=post_]");
        if (post == null) {
            log.warn("post element not found, location={}", document.location());
            return null;
        }
        String postId = post.id().substring(post.id().lastIndexOf('_') + 1);
        Element message = post.selectFirst("td#postmessage_" + postId);
        if (message == null) {
            log.warn("post message not found, postId={}, location={}", postId, document.location());
            return null;
        }

        ExtractionResult result = postContentExtractor.extract(message, baseUrl);
        return PostDetails.builder()
            .title(textOf(document.selectFirst("span#thread_subject")))
            .author(textOf(post.selectFirst("div.authi > a")))
            .content(result.text())
            .publishTime(parsePublishTime(post.selectFirst("em#authorposton" + postId + " > span[title]")))
            .images(result.images())
            .tags(result.tags())
            .build();
    }

    private LocalDateTime parsePublishTime(Element timeElement) {
        if (timeElement == null) {
            log.warn("publish time not found, use current time");
            return LocalDateTime.now();
        }
        String value = timeElement.attr("title").trim();
        try {
            return LocalDateTime.parse(value, PUBLISH_TIME_FORMATTER);
        } catch (DateTimeParseException ex) {
            log.error("parse publish time failed, value={}", value);
            return LocalDateTime.now();
        }
    }

    private String textOf(Element element) {
        return element == null ? "" : element.text().trim();
    }

}
