package fun.fengwk.mfr.core.configuration;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;

/**
 * Proxy configuration for outgoing HttpClient requests.
 *
 * @author fengwk
 */
@Slf4j
@Data
@ConfigurationProperties(prefix = "mfr.http.proxy")
public class HttpClientProxyProperties {

    /**
     * HTTP proxy in URL form, e.g. http://host:port or host:port.
     */
    private String httpProxy;

    /**
     * Proxy selector for the configured proxy, null when none is configured.
     */
    public ProxySelector resolveProxySelector() {
        InetSocketAddress address = parseProxy(httpProxy);
        if (address == null) {
            return null;
        }
        log.info("http proxy configured: {}", httpProxy);
        return ProxySelector.of(address);
    }

    private InetSocketAddress parseProxy(String proxyStr) {
        if (!StringUtils.hasText(proxyStr)) {
            return null;
        }
        try {
            String uriStr = proxyStr.trim();
            if (!uriStr.contains("://")) {
                uriStr = "http://" + uriStr;
            }
            URI uri = new URI(uriStr);
            String host = uri.getHost();
            int port = uri.getPort();
            if (host == null) {
                String[] parts = proxyStr.trim().split(":");
                host = parts[0];
                port = parts.length > 1 ? Integer.parseInt(parts[1]) : 80;
            }
            if (port == -1) {
                port = 80;
            }
            return InetSocketAddress.createUnresolved(host, port);
        } catch (Exception ex) {
            throw new IllegalArgumentException("invalid proxy: " + proxyStr, ex);
        }
    }

}
