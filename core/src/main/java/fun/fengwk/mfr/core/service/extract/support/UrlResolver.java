package fun.fengwk.mfr.core.service.extract.support;

import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Resolves forum relative references against the forum base url.
 *
 * @author fengwk
 */
public final class UrlResolver {

    private static final String DATA_PREFIX = "data:";

    private UrlResolver() {
    }

    public static String resolve(String baseUrl, String ref) {
        if (ref == null) {
            return null;
        }
        if (ref.startsWith("http")) {
            return ref;
        }
        String base = normalizeBaseUrl(baseUrl);
        if (ref.startsWith("/")) {
            return base + ref;
        }
        return base + "/" + ref;
    }

    public static boolean isDataPayload(String ref) {
        if (!StringUtils.hasText(ref)) {
            return false;
        }
        return ref.trim().toLowerCase(Locale.ROOT).startsWith(DATA_PREFIX);
    }

    public static String normalizeBaseUrl(String baseUrl) {
        if (!StringUtils.hasText(baseUrl)) {
            return "";
        }
        String base = baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

}
