package fun.fengwk.mfr.core.service.forum.parser;

import fun.fengwk.mfr.core.service.extract.ExtractProperties;
import fun.fengwk.mfr.core.service.extract.impl.PostContentExtractorImpl;
import fun.fengwk.mfr.core.service.extract.parser.TagClassifier;
import fun.fengwk.mfr.core.service.extract.parser.TagCollector;
import fun.fengwk.mfr.core.service.extract.parser.TextAssembler;
import fun.fengwk.mfr.core.service.forum.model.PostDetails;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class PostPageParserTest {

    private static final String BASE_URL = "https://forum.test";

    private PostPageParser parser;

    @BeforeEach
    void setUp() {
        parser = new PostPageParser(new PostContentExtractorImpl(
            new ExtractProperties(),
            new TagClassifier(),
            new TagCollector(),
            new TextAssembler()
        ));
    }

    @Test
    public void shouldParseFirstPost() {
        String html = """
            <span id="thread_subject">Free game today</span>
            <div id="postlist">
              <div id="post_555">
                <div class="authi"><a href="space-uid-1.html">alice</a></div>
                <em id="authorposton555">发表于 <span title="2024-05-01 12:30:15">3 天前</span></em>
                <table><tr><td id="postmessage_555">
                  Grab it <strong>now</strong>
                  <img file="data/attachment/forum/a.jpg">
                  <span class="tag">限免</span>
                </td></tr></table>
              </div>
              <div id="post_556">
                <td id="postmessage_556">reply</td>
              </div>
            </div>
            """;

        PostDetails details = parser.parse(Jsoup.parse(html), BASE_URL);

        assertThat(details).isNotNull();
        assertThat(details.getTitle()).isEqualTo("Free game today");
        assertThat(details.getAuthor()).isEqualTo("alice");
        assertThat(details.getPublishTime()).isEqualTo(LocalDateTime.of(2024, 5, 1, 12, 30, 15));
        assertThat(details.getContent()).startsWith("Grab it **now**");
        assertThat(details.getContent()).doesNotContain("reply");
        assertThat(details.getImages()).containsExactly("https://forum.test/data/attachment/forum/a.jpg");
        assertThat(details.getTags()).containsExactly("限免");
    }

    @Test
    public void shouldAcceptShortPublishTime() {
        String html = """
            <div id="postlist"><div id="post_1">
              <em id="authorposton1"><span title="2024-5-1 8:05">x</span></em>
              <table><tr><td id="postmessage_1">body</td></tr></table>
            </div></div>
            """;

        PostDetails details = parser.parse(Jsoup.parse(html), BASE_URL);

        assertThat(details.getPublishTime()).isEqualTo(LocalDateTime.of(2024, 5, 1, 8, 5));
    }

    @Test
    public void shouldUseCurrentTimeWhenPublishTimeMissing() {
        String html = """
            <div id="postlist"><div id="post_1">
              <table><tr><td id="postmessage_1">body</td></tr></table>
            </div></div>
            """;
        LocalDateTime before = LocalDateTime.now();

        PostDetails details = parser.parse(Jsoup.parse(html), BASE_URL);

        assertThat(details.getPublishTime()).isAfterOrEqualTo(before);
        assertThat(details.getContent()).isEqualTo("body");
        assertThat(details.getTitle()).isEmpty();
    }

    @Test
    public void shouldReturnNullWithoutPost() {
        assertThat(parser.parse(Jsoup.parse("<div id=\"messagetext\">没有权限</div>"), BASE_URL)).isNull();
    }

    @Test
    public void shouldReturnNullWithoutMessageBody() {
        String html = "<div id=\"postlist\"><div id=\"post_1\"><p>locked</p></div></div>";

        assertThat(parser.parse(Jsoup.parse(html), BASE_URL)).isNull();
    }

}
