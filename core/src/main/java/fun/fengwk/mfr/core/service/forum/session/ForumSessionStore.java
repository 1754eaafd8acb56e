package fun.fengwk.mfr.core.service.forum.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mfr.core.utils.AtomicFiles;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.HttpCookie;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists forum cookies and login state between runs.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForumSessionStore {

    private final ObjectMapper objectMapper;

    public void save(Path sessionFile, List<HttpCookie> cookies, boolean loggedIn) {
        SessionState state = new SessionState();
        state.setLoggedIn(loggedIn);
        state.setSavedAt(Instant.now().toString());
        for (HttpCookie cookie : cookies) {
            state.getCookies().add(StoredCookie.from(cookie));
        }
        try {
            AtomicFiles.writeString(sessionFile, objectMapper.writeValueAsString(state));
            log.info("forum session saved, sessionFile={}, cookies={}", sessionFile, cookies.size());
        } catch (Exception ex) {
            log.error("save forum session failed, sessionFile={}, error={}", sessionFile, ex.getMessage(), ex);
        }
    }

    /**
     * Reads the saved session, null when absent or unreadable.
     */
    public SessionState load(Path sessionFile) {
        if (!Files.exists(sessionFile)) {
            log.info("forum session file not found, a new session will be created, sessionFile={}", sessionFile);
            return null;
        }
        try {
            return objectMapper.readValue(Files.readString(sessionFile), SessionState.class);
        } catch (Exception ex) {
            log.error("load forum session failed, sessionFile={}, error={}", sessionFile, ex.getMessage(), ex);
            return null;
        }
    }

    public void clear(Path sessionFile) {
        try {
            if (Files.deleteIfExists(sessionFile)) {
                log.info("forum session cleared, sessionFile={}", sessionFile);
            }
        } catch (Exception ex) {
            log.error("clear forum session failed, sessionFile={}, error={}", sessionFile, ex.getMessage(), ex);
        }
    }

    @Data
    public static class SessionState {

        private List<StoredCookie> cookies = new ArrayList<>();
        private boolean loggedIn;
        private String savedAt;

        public List<HttpCookie> toHttpCookies() {
            List<HttpCookie> httpCookies = new ArrayList<>();
            for (StoredCookie cookie : cookies) {
                httpCookies.add(cookie.toHttpCookie());
            }
            return httpCookies;
        }

    }

    @Data
    public static class StoredCookie {

        private String name;
        private String value;
        private String domain;
        private String path;

        static StoredCookie from(HttpCookie cookie) {
            StoredCookie stored = new StoredCookie();
            stored.setName(cookie.getName());
            stored.setValue(cookie.getValue());
            stored.setDomain(cookie.getDomain());
            stored.setPath(cookie.getPath());
            return stored;
        }

        HttpCookie toHttpCookie() {
            HttpCookie cookie = new HttpCookie(name, value);
            cookie.setDomain(domain);
            cookie.setPath(path);
            cookie.setVersion(0);
            return cookie;
        }

    }

}
