package fun.fengwk.mfr.core.service.relay;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic new-thread check.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "mfr.relay", name = "enabled", havingValue = "true")
public class RelayScheduler {

    private final RelayService relayService;

    @Scheduled(
        fixedDelayString = "${mfr.relay.check-interval-ms:300000}",
        initialDelayString = "${mfr.relay.check-interval-ms:300000}"
    )
    public void checkNewPosts() {
        int sent = relayService.checkAndSendNewPosts();
        log.info("scheduled relay check finished, sent={}", sent);
    }

}
