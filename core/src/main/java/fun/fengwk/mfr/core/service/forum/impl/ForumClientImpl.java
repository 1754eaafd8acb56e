package fun.fengwk.mfr.core.service.forum.impl;

import fun.fengwk.mfr.core.configuration.HttpClientProxyProperties;
import fun.fengwk.mfr.core.service.forum.ForumClient;
import fun.fengwk.mfr.core.service.forum.ForumLoginException;
import fun.fengwk.mfr.core.service.forum.ForumProperties;
import fun.fengwk.mfr.core.service.forum.model.ForumPost;
import fun.fengwk.mfr.core.service.forum.model.PostDetails;
import fun.fengwk.mfr.core.service.forum.model.ThreadEntry;
import fun.fengwk.mfr.core.service.forum.parser.PostPageParser;
import fun.fengwk.mfr.core.service.forum.parser.ThreadListParser;
import fun.fengwk.mfr.core.service.forum.session.ForumSessionStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Discuz forum client over a cookie carrying HttpClient.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ForumClientImpl implements ForumClient {

    private static final String LOGIN_PAGE_PATH = "/member.php?mod=logging&action=login";
    private static final String LOGIN_SUBMIT_PATH = "/member.php?mod=logging&action=login&loginsubmit=yes&loginhash=";
    private static final String NEW_THREAD_PATH = "/forum.php?mod=guide&view=newthread";

    private final ForumProperties forumProperties;
    private final ForumSessionStore forumSessionStore;
    private final ThreadListParser threadListParser;
    private final PostPageParser postPageParser;
    private final ForumHttpSession session;

    private volatile boolean loggedIn;

    public ForumClientImpl(
        ForumProperties forumProperties,
        HttpClientProxyProperties httpClientProxyProperties,
        ForumSessionStore forumSessionStore,
        ThreadListParser threadListParser,
        PostPageParser postPageParser
    ) {
        this.forumProperties = forumProperties;
        this.forumSessionStore = forumSessionStore;
        this.threadListParser = threadListParser;
        this.postPageParser = postPageParser;
        this.session = new ForumHttpSession(
            forumProperties.getUserAgent(),
            forumProperties.getTimeoutMs(),
            httpClientProxyProperties.resolveProxySelector()
        );
    }

    /**
     * Restores cookies saved by an earlier run.
     */
    @PostConstruct
    public void restoreSession() {
        ForumSessionStore.SessionState state = forumSessionStore.load(forumProperties.resolveSessionFile());
        if (state == null) {
            return;
        }
        session.restoreCookies(baseUrl(), state.toHttpCookies());
        loggedIn = state.isLoggedIn();
        log.info("forum session restored, loggedIn={}, cookies={}", loggedIn, state.getCookies().size());
    }

    @Override
    public boolean login() {
        if (loggedIn && checkLoginStatus()) {
            log.info("forum session still valid, skip login, username={}", forumProperties.getUsername());
            return true;
        }

        ForumResponse loginPage = session.get(baseUrl() + LOGIN_PAGE_PATH);
        if (!loginPage.isOk()) {
            throw new ForumLoginException("login page unavailable, status=" + loginPage.statusCode());
        }
        Document document = Jsoup.parse(loginPage.body(), loginPage.finalUrl());
        Element form = document.selectFirst("form[name=login]");
        Element formHashInput = form == null ? null : form.selectFirst("input[name=formhash]");
        if (form == null || formHashInput == null) {
            throw new ForumLoginException("login form not found");
        }
        String loginHash = form.id().substring(form.id().lastIndexOf('_') + 1);

        Map<String, String> loginData = new LinkedHashMap<>();
        loginData.put("duceapp", "yes");
        loginData.put("formhash", formHashInput.attr("value"));
        loginData.put("referer", baseUrl() + "/");
        loginData.put("lssubmit", "yes");
        loginData.put("loginfield", "auto");
        loginData.put("username", forumProperties.getUsername());
        loginData.put("password", forumProperties.getPassword());
        loginData.put("questionid", "0");
        loginData.put("answer", "");
        loginData.put("cookietime", "2592000");
        loginData.put("smscode", "");

        ForumResponse response = session.postForm(baseUrl() + LOGIN_SUBMIT_PATH + loginHash + "&inajax=1", loginData);
        if (response.body().contains("reload") && response.body().contains(baseUrl())) {
            loggedIn = true;
            saveSession();
            log.info("forum login succeeded, username={}", forumProperties.getUsername());
            return true;
        }
        throw new ForumLoginException("login failed, check username, password or captcha");
    }

    @Override
    public boolean checkLoginStatus() {
        if (!loggedIn) {
            return false;
        }
        try {
            ForumResponse response = session.get(baseUrl());
            boolean valid = !isLoginUrl(response.finalUrl());
            if (!valid) {
                loggedIn = false;
            }
            return valid;
        } catch (RuntimeException ex) {
            log.error("check login status failed, error={}", ex.getMessage());
            return false;
        }
    }

    @Override
    public boolean isLoggedIn() {
        return loggedIn;
    }

    @Override
    public List<ForumPost> getLatestPosts(int limit) {
        if (!loggedIn) {
            throw new ForumLoginException("not logged in");
        }
        ForumResponse response = session.get(baseUrl() + NEW_THREAD_PATH);
        if (response.finalUrl().contains("login") || response.body().contains("登录")) {
            clearSession();
            throw new ForumLoginException("login expired");
        }

        Document document = Jsoup.parse(response.body(), response.finalUrl());
        List<ForumPost> posts = new ArrayList<>();
        for (ThreadEntry entry : threadListParser.parse(document, baseUrl())) {
            if (posts.size() >= limit) {
                break;
            }
            posts.add(new ForumPost(entry.id(), entry.title(), entry.url(), entry.author(), this));
        }
        return posts;
    }

    @Override
    public PostDetails loadPostDetails(String url) {
        log.info("load post details, url={}", url);
        ForumResponse response = session.get(url);
        if (!response.isOk()) {
            log.error("post page unavailable, url={}, status={}", url, response.statusCode());
            return null;
        }
        Document document = Jsoup.parse(response.body(), response.finalUrl());
        return postPageParser.parse(document, baseUrl());
    }

    @Override
    public ForumPost fetchPost(long threadId) {
        String url = threadUrl(threadId);
        PostDetails details = loadPostDetails(url);
        if (details == null) {
            return null;
        }
        return ForumPost.loaded(threadId, url, details);
    }

    @Override
    public String threadUrl(long threadId) {
        return baseUrl() + "/t" + threadId + "-1-1";
    }

    @Override
    public void clearSession() {
        loggedIn = false;
        session.clearCookies();
        forumSessionStore.clear(forumProperties.resolveSessionFile());
    }

    private void saveSession() {
        forumSessionStore.save(forumProperties.resolveSessionFile(), session.cookies(), loggedIn);
    }

    private boolean isLoginUrl(String url) {
        return url.contains("mod=logging") && url.contains("action=login");
    }

    private String baseUrl() {
        return forumProperties.normalizedBaseUrl();
    }

}
