package fun.fengwk.mfr.core.configuration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * @author fengwk
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "mfr.relay", name = "enabled", havingValue = "true")
public class SchedulingConfiguration {
}
