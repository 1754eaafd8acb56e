package fun.fengwk.mfr.core.cli;

import fun.fengwk.mfr.core.service.forum.ForumClient;
import fun.fengwk.mfr.core.service.forum.model.ForumPost;
import fun.fengwk.mfr.core.service.relay.RelayService;
import fun.fengwk.mfr.core.service.relay.support.PostMessageFormatter;
import fun.fengwk.mfr.core.service.relay.support.ThreadLinkParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Fetches threads by id or link and prints them, or relays them to a chat.
 *
 * <p>Usage: {@code --thread=<id|text with links> [--chat=<chatId>]}.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThreadCommand implements ApplicationRunner {

    static final String OPTION_THREAD = "thread";
    static final String OPTION_CHAT = "chat";

    private final ForumClient forumClient;
    private final RelayService relayService;
    private final PostMessageFormatter postMessageFormatter;
    private final ThreadLinkParser threadLinkParser;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION_THREAD)) {
            return;
        }
        String thread = CommandOptions.firstValue(args, OPTION_THREAD);
        String chatId = CommandOptions.firstValue(args, OPTION_CHAT);
        System.exit(execute(thread, chatId, System.out));
    }

    /**
     * @return process exit code
     */
    int execute(String thread, String chatId, PrintStream out) {
        List<Long> threadIds = resolveThreadIds(thread);
        if (threadIds.isEmpty()) {
            log.error("no thread id found, thread={}", thread);
            return 2;
        }
        try {
            forumClient.login();
        } catch (RuntimeException ex) {
            log.error("forum login failed, error={}", ex.getMessage());
            return 1;
        }

        int failed = 0;
        for (Long threadId : threadIds) {
            boolean success = chatId == null
                ? printThread(threadId, out)
                : relayService.relaySingleThread(threadId, chatId);
            if (!success) {
                log.warn("thread failed, threadId={}", threadId);
                failed++;
            }
        }
        return failed == 0 ? 0 : 1;
    }

    private boolean printThread(long threadId, PrintStream out) {
        ForumPost post = forumClient.fetchPost(threadId);
        if (post == null) {
            return false;
        }
        out.println(postMessageFormatter.format(post));
        out.println();
        return true;
    }

    private List<Long> resolveThreadIds(String thread) {
        if (thread == null || thread.isBlank()) {
            return List.of();
        }
        String trimmed = thread.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return List.of(Long.parseLong(trimmed));
            } catch (NumberFormatException ex) {
                return List.of();
            }
        }
        return threadLinkParser.extractThreadIds(trimmed);
    }

}
