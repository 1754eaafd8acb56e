package fun.fengwk.mfr.core.cli;

import fun.fengwk.mfr.core.facade.telegram.TelegramProperties;
import fun.fengwk.mfr.core.service.forum.ForumClient;
import fun.fengwk.mfr.core.service.forum.ForumProperties;
import fun.fengwk.mfr.core.service.relay.PostPublisher;
import fun.fengwk.mfr.core.service.relay.RelayService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Logs in, announces the service and runs the first check when the relay starts.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "mfr.relay", name = "enabled", havingValue = "true")
public class RelayStartupRunner implements ApplicationRunner {

    static final String STARTED_MESSAGE = "论坛转发服务已启动";
    static final String STOPPED_MESSAGE = "论坛转发服务已停止";
    static final String LOGIN_FAILED_PREFIX = "服务已启动，但论坛登录失败: ";

    private final ForumClient forumClient;
    private final RelayService relayService;
    private final PostPublisher postPublisher;
    private final ForumProperties forumProperties;
    private final TelegramProperties telegramProperties;

    private volatile boolean started;

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(ExtractCommand.OPTION_FILE) || args.containsOption(ThreadCommand.OPTION_THREAD)) {
            return;
        }
        List<String> missing = missingSettings();
        if (!missing.isEmpty()) {
            log.error("relay configuration incomplete, missing={}", missing);
            return;
        }

        try {
            forumClient.login();
            postPublisher.notifyAdmin(STARTED_MESSAGE);
        } catch (RuntimeException ex) {
            log.error("initial forum login failed, error={}", ex.getMessage());
            postPublisher.notifyAdmin(LOGIN_FAILED_PREFIX + ex.getMessage());
        }
        started = true;
        log.info("relay started, monitoring {}", forumProperties.normalizedBaseUrl());
        relayService.checkAndSendNewPosts();
    }

    @PreDestroy
    public void stop() {
        if (started) {
            log.info("relay stopping");
            postPublisher.notifyAdmin(STOPPED_MESSAGE);
        }
    }

    List<String> missingSettings() {
        List<String> missing = new ArrayList<>();
        if (!StringUtils.hasText(forumProperties.getBaseUrl())) {
            missing.add("mfr.forum.base-url");
        }
        if (!StringUtils.hasText(telegramProperties.getChannelId())) {
            missing.add("mfr.telegram.channel-id");
        }
        if (!telegramProperties.isDryRun() && !StringUtils.hasText(telegramProperties.getBotToken())) {
            missing.add("mfr.telegram.bot-token");
        }
        return missing;
    }

}
