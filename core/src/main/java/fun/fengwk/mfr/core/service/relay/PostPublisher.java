package fun.fengwk.mfr.core.service.relay;

/**
 * Delivers formatted post messages to chats.
 *
 * <p>Implementations never throw for delivery faults, they log and return false.
 *
 * @author fengwk
 */
public interface PostPublisher {

    boolean publishToChannel(String text);

    boolean sendMessage(String chatId, String text);

    boolean notifyAdmin(String text);

}
