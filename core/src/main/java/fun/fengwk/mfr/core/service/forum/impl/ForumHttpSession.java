package fun.fengwk.mfr.core.service.forum.impl;

import fun.fengwk.mfr.core.service.forum.ForumClientException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.HttpCookie;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Cookie carrying HTTP session against the forum.
 *
 * @author fengwk
 */
@Slf4j
public class ForumHttpSession {

    private final CookieManager cookieManager;
    private final HttpClient httpClient;
    private final String userAgent;
    private final Duration timeout;

    public ForumHttpSession(String userAgent, int timeoutMs, ProxySelector proxySelector) {
        this.cookieManager = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        this.userAgent = userAgent;
        this.timeout = Duration.ofMillis(Math.max(1000, timeoutMs));
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(timeout)
            .cookieHandler(cookieManager);
        if (proxySelector != null) {
            builder.proxy(proxySelector);
        }
        this.httpClient = builder.build();
    }

    public ForumResponse get(String url) {
        HttpRequest request = newRequest(url)
            .GET()
            .build();
        return send(request);
    }

    public ForumResponse postForm(String url, Map<String, String> form) {
        HttpRequest request = newRequest(url)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(buildFormBody(form)))
            .build();
        return send(request);
    }

    public List<HttpCookie> cookies() {
        return List.copyOf(cookieManager.getCookieStore().getCookies());
    }

    public void restoreCookies(String baseUrl, List<HttpCookie> cookies) {
        URI uri = URI.create(baseUrl);
        for (HttpCookie cookie : cookies) {
            if (cookie.getDomain() == null) {
                cookie.setDomain(uri.getHost());
            }
            if (cookie.getPath() == null) {
                cookie.setPath("/");
            }
            cookieManager.getCookieStore().add(uri, cookie);
        }
    }

    public void clearCookies() {
        cookieManager.getCookieStore().removeAll();
    }

    private HttpRequest.Builder newRequest(String url) {
        return HttpRequest.newBuilder(URI.create(url))
            .timeout(timeout)
            .header("User-Agent", userAgent);
    }

    private ForumResponse send(HttpRequest request) {
        try {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            String body = new String(response.body(), resolveCharset(response));
            return new ForumResponse(response.statusCode(), response.uri().toString(), body);
        } catch (IOException ex) {
            log.warn("forum request failed, method={}, url={}, error={}", request.method(), request.uri(), ex.getMessage());
            throw new ForumClientException("forum request failed: " + request.uri(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ForumClientException("forum request interrupted: " + request.uri(), ex);
        }
    }

    private Charset resolveCharset(HttpResponse<?> response) {
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                try {
                    return Charset.forName(trimmed.substring("charset=".length()).replace("\"", "").trim());
                } catch (IllegalArgumentException ex) {
                    log.debug("unknown response charset, contentType={}", contentType);
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private String buildFormBody(Map<String, String> form) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : form.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            String key = URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8);
            String value = URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8);
            joiner.add(key + "=" + value);
        }
        return joiner.toString();
    }

}
