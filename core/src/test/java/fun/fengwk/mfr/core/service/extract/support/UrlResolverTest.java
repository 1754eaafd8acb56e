package fun.fengwk.mfr.core.service.extract.support;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class UrlResolverTest {

    @Test
    public void shouldKeepAbsoluteUrls() {
        assertThat(UrlResolver.resolve("https://forum.test", "https://cdn.test/a.png")).isEqualTo("https://cdn.test/a.png");
        assertThat(UrlResolver.resolve("https://forum.test", "http://cdn.test/a.png")).isEqualTo("http://cdn.test/a.png");
    }

    @Test
    public void shouldResolveRootRelativeReference() {
        assertThat(UrlResolver.resolve("https://forum.test", "/img/pic.png")).isEqualTo("https://forum.test/img/pic.png");
    }

    @Test
    public void shouldResolvePathRelativeReference() {
        assertThat(UrlResolver.resolve("https://forum.test", "data/attachment/a.jpg"))
            .isEqualTo("https://forum.test/data/attachment/a.jpg");
    }

    @Test
    public void shouldIgnoreTrailingSlashOfBase() {
        assertThat(UrlResolver.resolve("https://forum.test/", "/img/pic.png")).isEqualTo("https://forum.test/img/pic.png");
    }

    @Test
    public void shouldDetectDataPayloads() {
        assertThat(UrlResolver.isDataPayload("data:image/png;base64,AAAA")).isTrue();
        assertThat(UrlResolver.isDataPayload(" DATA:text/plain,x")).isTrue();
        assertThat(UrlResolver.isDataPayload("data/attachment/a.jpg")).isFalse();
        assertThat(UrlResolver.isDataPayload("")).isFalse();
        assertThat(UrlResolver.isDataPayload(null)).isFalse();
    }

}
