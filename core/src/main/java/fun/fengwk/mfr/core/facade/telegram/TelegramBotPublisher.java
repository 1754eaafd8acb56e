package fun.fengwk.mfr.core.facade.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mfr.core.configuration.HttpClientProxyProperties;
import fun.fengwk.mfr.core.service.relay.PostPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publisher on the Telegram Bot API sendMessage method.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class TelegramBotPublisher implements PostPublisher {

    private static final String SEND_MESSAGE_METHOD = "sendMessage";
    private static final String ENTITY_PARSE_ERROR = "can't parse entities";

    private final TelegramProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public TelegramBotPublisher(
        TelegramProperties properties,
        HttpClientProxyProperties httpClientProxyProperties,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        HttpClient.Builder builder = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getTimeoutMs()));
        ProxySelector proxySelector = httpClientProxyProperties.resolveProxySelector();
        if (proxySelector != null) {
            builder.proxy(proxySelector);
        }
        this.httpClient = builder.build();
    }

    @Override
    public boolean publishToChannel(String text) {
        return sendMessage(properties.getChannelId(), text);
    }

    @Override
    public boolean notifyAdmin(String text) {
        if (!StringUtils.hasText(properties.getAdminId())) {
            log.info("admin chat not configured, drop notification, text={}", text);
            return false;
        }
        return sendMessage(properties.getAdminId(), text);
    }

    @Override
    public boolean sendMessage(String chatId, String text) {
        if (!StringUtils.hasText(chatId)) {
            log.warn("send message skipped, chat id is blank");
            return false;
        }
        String message = truncate(text == null ? "" : text);
        if (properties.isDryRun()) {
            log.info("dry run, message to chatId={}:\n{}", chatId, message);
            return true;
        }

        try {
            String parseMode = properties.getParseMode();
            HttpResponse<String> response = post(chatId, message, parseMode);
            if (!isOk(response) && StringUtils.hasText(parseMode) && isEntityParseError(response)) {
                log.warn("message rejected by parse mode, resend as plain text, chatId={}, parseMode={}, body={}",
                    chatId, parseMode, response.body());
                response = post(chatId, message, null);
            }
            if (isOk(response)) {
                log.info("message sent, chatId={}, length={}", chatId, message.length());
                return true;
            }
            log.error("send message failed, chatId={}, status={}, body={}", chatId, response.statusCode(), response.body());
            return false;
        } catch (IOException ex) {
            log.error("send message failed, chatId={}, error={}", chatId, ex.getMessage());
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("send message interrupted, chatId={}", chatId);
            return false;
        }
    }

    String truncate(String text) {
        int max = properties.getMaxMessageLength();
        if (max <= 0 || text.length() <= max) {
            return text;
        }
        int end = Character.isHighSurrogate(text.charAt(max - 1)) ? max - 1 : max;
        return text.substring(0, end);
    }

    private HttpResponse<String> post(String chatId, String message, String parseMode)
        throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(buildMethodUri(SEND_MESSAGE_METHOD))
            .timeout(Duration.ofMillis(properties.getTimeoutMs()))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(
                objectMapper.writeValueAsString(buildPayload(chatId, message, parseMode)), StandardCharsets.UTF_8))
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    private Map<String, Object> buildPayload(String chatId, String text, String parseMode) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", chatId);
        payload.put("text", text);
        if (StringUtils.hasText(parseMode)) {
            payload.put("parse_mode", parseMode);
        }
        payload.put("disable_web_page_preview", properties.isDisableWebPagePreview());
        return payload;
    }

    private boolean isOk(HttpResponse<String> response) throws IOException {
        if (response.statusCode() != 200 || !StringUtils.hasText(response.body())) {
            return false;
        }
        JsonNode root = objectMapper.readTree(response.body());
        return root.path("ok").asBoolean(false);
    }

    private boolean isEntityParseError(HttpResponse<String> response) {
        if (response.statusCode() != 400 || !StringUtils.hasText(response.body())) {
            return false;
        }
        try {
            String description = objectMapper.readTree(response.body()).path("description").asText("");
            return description.contains(ENTITY_PARSE_ERROR);
        } catch (IOException ex) {
            log.debug("unreadable error body, status={}, error={}", response.statusCode(), ex.getMessage());
            return false;
        }
    }

    private URI buildMethodUri(String method) {
        String baseUrl = properties.getApiBaseUrl().trim();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return URI.create(baseUrl + "/bot" + properties.getBotToken() + "/" + method);
    }

}
