package fun.fengwk.mfr.core.service.relay;

import java.util.List;

/**
 * Moves new forum threads into chats.
 *
 * @author fengwk
 */
public interface RelayService {

    /**
     * Relays unseen threads from the newest-thread list to the channel. Login problems trigger a
     * re-login, other faults are reported to the admin chat. Never throws.
     *
     * @return number of posts delivered
     */
    int checkAndSendNewPosts();

    /**
     * Fetches one thread and sends it to the given chat.
     *
     * @return true when delivered
     */
    boolean relaySingleThread(long threadId, String chatId);

    /**
     * Relays every thread linked in the text to the chat, answering failed ids with a short notice.
     *
     * @return ids that were delivered
     */
    List<Long> relayLinks(String text, String chatId);

}
