package fun.fengwk.mfr.core.facade.telegram;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Telegram Bot API configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mfr.telegram")
public class TelegramProperties {

    private String apiBaseUrl = "https://api.telegram.org";

    private String botToken = "";

    /**
     * Target channel, numeric id or @name.
     */
    private String channelId = "";

    /**
     * Chat receiving operational notifications, blank disables them.
     */
    private String adminId = "";

    private int timeoutMs = 15000;

    /**
     * Log messages instead of sending them.
     */
    private boolean dryRun = false;

    /**
     * Bot API parse mode, blank sends plain text.
     */
    private String parseMode = "Markdown";

    private boolean disableWebPagePreview = false;

    private int maxMessageLength = 4096;

}
