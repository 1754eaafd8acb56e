package fun.fengwk.mfr.core.service.forum.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.HttpCookie;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class ForumSessionStoreTest {

    @TempDir
    Path tempDir;

    private final ForumSessionStore store = new ForumSessionStore(new ObjectMapper());

    @Test
    public void shouldSaveAndLoadCookies() {
        Path file = tempDir.resolve("nested/forum_session_u.json");
        HttpCookie cookie = new HttpCookie("auth", "abc");
        cookie.setDomain("forum.test");
        cookie.setPath("/");

        store.save(file, List.of(cookie), true);
        ForumSessionStore.SessionState state = store.load(file);

        assertThat(state).isNotNull();
        assertThat(state.isLoggedIn()).isTrue();
        assertThat(state.getSavedAt()).isNotBlank();
        List<HttpCookie> cookies = state.toHttpCookies();
        assertThat(cookies).hasSize(1);
        assertThat(cookies.get(0).getName()).isEqualTo("auth");
        assertThat(cookies.get(0).getValue()).isEqualTo("abc");
        assertThat(cookies.get(0).getDomain()).isEqualTo("forum.test");
        assertThat(cookies.get(0).getPath()).isEqualTo("/");
    }

    @Test
    public void shouldReturnNullWhenFileMissing() {
        assertThat(store.load(tempDir.resolve("absent.json"))).isNull();
    }

    @Test
    public void shouldReturnNullWhenFileCorrupted() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{not json");

        assertThat(store.load(file)).isNull();
    }

    @Test
    public void shouldClearSessionFile() {
        Path file = tempDir.resolve("forum_session_u.json");
        store.save(file, List.of(), false);
        assertThat(file).exists();

        store.clear(file);

        assertThat(file).doesNotExist();
        store.clear(file);
    }

}
