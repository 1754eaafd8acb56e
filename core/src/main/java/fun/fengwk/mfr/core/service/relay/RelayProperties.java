package fun.fengwk.mfr.core.service.relay;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Relay loop configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mfr.relay")
public class RelayProperties {

    /**
     * Enables the scheduled check and the startup run.
     */
    private boolean enabled = false;

    private long checkIntervalMs = 300000;

    /**
     * Newest threads inspected per check.
     */
    private int maxPostsPerCheck = 10;

    /**
     * Pause after each delivered post.
     */
    private long sendIntervalMs = 2000;

    /**
     * Most recent processed ids kept on disk.
     */
    private int processedKeep = 1000;

    private String processedPostsFile = "data/processed_posts.json";

}
