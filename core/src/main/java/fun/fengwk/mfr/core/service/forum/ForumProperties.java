package fun.fengwk.mfr.core.service.forum;

import fun.fengwk.mfr.core.service.extract.support.UrlResolver;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;

/**
 * Forum access configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mfr.forum")
public class ForumProperties {

    /**
     * Forum base url, e.g. https://keylol.com.
     */
    private String baseUrl = "";

    private String username = "";

    private String password = "";

    /**
     * Directory holding the session file.
     */
    private String workDir = "data";

    /**
     * Session file name, blank means forum_session_{username}.json.
     */
    private String sessionFile = "";

    /**
     * Request timeout in milliseconds.
     */
    private int timeoutMs = 15000;

    private String userAgent =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/137.0.0.0 Safari/537.36";

    public String normalizedBaseUrl() {
        return UrlResolver.normalizeBaseUrl(baseUrl);
    }

    public Path resolveSessionFile() {
        String fileName = StringUtils.hasText(sessionFile)
            ? sessionFile.trim()
            : "forum_session_" + username + ".json";
        if (!StringUtils.hasText(workDir)) {
            return Path.of(fileName);
        }
        return Path.of(workDir.trim()).resolve(fileName);
    }

}
