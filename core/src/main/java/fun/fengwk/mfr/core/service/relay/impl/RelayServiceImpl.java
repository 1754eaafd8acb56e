package fun.fengwk.mfr.core.service.relay.impl;

import fun.fengwk.mfr.core.service.forum.ForumClient;
import fun.fengwk.mfr.core.service.forum.ForumLoginException;
import fun.fengwk.mfr.core.service.forum.model.ForumPost;
import fun.fengwk.mfr.core.service.relay.PostPublisher;
import fun.fengwk.mfr.core.service.relay.RelayProperties;
import fun.fengwk.mfr.core.service.relay.RelayService;
import fun.fengwk.mfr.core.service.relay.store.ProcessedPostStore;
import fun.fengwk.mfr.core.service.relay.support.PostMessageFormatter;
import fun.fengwk.mfr.core.service.relay.support.ThreadLinkParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * @author fengwk
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RelayServiceImpl implements RelayService {

    static final String RELOGIN_SUCCEEDED = "✅ 论坛自动重新登录成功";
    static final String RELOGIN_REJECTED = "❌ 论坛登录失效，自动登录失败，请检查账号状态";
    static final String RELOGIN_FAILED_PREFIX = "❌ 重新登录失败: ";
    static final String CHECK_FAILED_PREFIX = "❌ 检查新帖子时出错: ";
    static final String THREAD_FAILED_PREFIX = "抓取失败: ";

    private final ForumClient forumClient;
    private final PostPublisher postPublisher;
    private final PostMessageFormatter postMessageFormatter;
    private final ProcessedPostStore processedPostStore;
    private final ThreadLinkParser threadLinkParser;
    private final RelayProperties relayProperties;

    private final ReentrantLock runLock = new ReentrantLock();

    @Override
    public int checkAndSendNewPosts() {
        if (!runLock.tryLock()) {
            log.warn("previous relay run still in progress, skip this run");
            return 0;
        }
        try {
            if (!forumClient.checkLoginStatus()) {
                handleLoginRequired();
                return 0;
            }

            List<ForumPost> newPosts = new ArrayList<>();
            for (ForumPost post : forumClient.getLatestPosts(relayProperties.getMaxPostsPerCheck())) {
                if (!processedPostStore.isProcessed(post.getId())) {
                    newPosts.add(post);
                }
            }
            if (newPosts.isEmpty()) {
                log.info("no new posts");
                return 0;
            }
            log.info("new posts found, count={}", newPosts.size());

            int sent = 0;
            for (int i = 0; i < newPosts.size(); i++) {
                if (i > 0 && !pause()) {
                    break;
                }
                ForumPost post = newPosts.get(i);
                if (postPublisher.publishToChannel(postMessageFormatter.format(post))) {
                    processedPostStore.markProcessed(post.getId());
                    sent++;
                    log.info("post relayed, id={}, title={}", post.getId(), post.getTitle());
                } else {
                    log.warn("relay post failed, it will be retried next run, id={}", post.getId());
                }
            }
            processedPostStore.save();
            return sent;
        } catch (ForumLoginException ex) {
            log.warn("forum login required, error={}", ex.getMessage());
            handleLoginRequired();
            return 0;
        } catch (RuntimeException ex) {
            log.error("check new posts failed, error={}", ex.getMessage(), ex);
            postPublisher.notifyAdmin(CHECK_FAILED_PREFIX + ex.getMessage());
            return 0;
        } finally {
            runLock.unlock();
        }
    }

    @Override
    public boolean relaySingleThread(long threadId, String chatId) {
        try {
            ForumPost post = forumClient.fetchPost(threadId);
            if (post == null) {
                log.warn("thread unavailable, threadId={}", threadId);
                return false;
            }
            return postPublisher.sendMessage(chatId, postMessageFormatter.format(post));
        } catch (RuntimeException ex) {
            log.error("relay thread failed, threadId={}, chatId={}, error={}", threadId, chatId, ex.getMessage(), ex);
            return false;
        }
    }

    @Override
    public List<Long> relayLinks(String text, String chatId) {
        List<Long> delivered = new ArrayList<>();
        for (Long threadId : threadLinkParser.extractThreadIds(text)) {
            if (relaySingleThread(threadId, chatId)) {
                delivered.add(threadId);
            } else {
                postPublisher.sendMessage(chatId, THREAD_FAILED_PREFIX + threadId);
            }
        }
        return delivered;
    }

    private void handleLoginRequired() {
        try {
            boolean success = forumClient.login();
            postPublisher.notifyAdmin(success ? RELOGIN_SUCCEEDED : RELOGIN_REJECTED);
        } catch (RuntimeException ex) {
            log.error("forum re-login failed, error={}", ex.getMessage());
            postPublisher.notifyAdmin(RELOGIN_FAILED_PREFIX + ex.getMessage());
        }
    }

    private boolean pause() {
        long interval = relayProperties.getSendIntervalMs();
        if (interval <= 0) {
            return true;
        }
        try {
            sleep(interval);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("relay interrupted while pausing between posts");
            return false;
        }
    }

    void sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }

}
