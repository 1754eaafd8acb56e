package fun.fengwk.mfr.core.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * @author fengwk
 */
@Configuration
@EnableConfigurationProperties(HttpClientProxyProperties.class)
public class HttpClientConfiguration {

}
