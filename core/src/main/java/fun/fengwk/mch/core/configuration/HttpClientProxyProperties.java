package fun.fengwk.mch.core.configuration;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.SocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

/**
 * Proxy configuration for the outbound HttpClient.
 *
 * @author fengwk
 */
@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "mch.http.proxy")
public class HttpClientProxyProperties {

    /**
     * HTTP proxy in URL form, e.g. http://host:port or host:port.
     */
    private String httpProxy;

    /**
     * HTTPS proxy in URL form, e.g. http://host:port or host:port.
     */
    private String httpsProxy;

    /**
     * Build a selector routing http and https traffic to the configured proxies.
     *
     * @return proxy selector, or null when no proxy is configured.
     */
    public ProxySelector toProxySelector() {
        Proxy http = parseProxy(httpProxy);
        Proxy https = parseProxy(httpsProxy);
        if (http == null && https == null) {
            return null;
        }
        log.info("http proxy configured, httpProxy={}, httpsProxy={}", httpProxy, httpsProxy);
        return new SchemeProxySelector(http, https);
    }

    static Proxy parseProxy(String proxyStr) {
        if (!StringUtils.hasText(proxyStr)) {
            return null;
        }
        try {
            String uriStr = proxyStr.trim();
            if (!uriStr.contains("://")) {
                uriStr = "http://" + uriStr;
            }
            URI uri = new URI(uriStr);
            String scheme = uri.getScheme();
            Proxy.Type type = scheme != null && scheme.toLowerCase(Locale.ROOT).startsWith("socks")
                ? Proxy.Type.SOCKS
                : Proxy.Type.HTTP;
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("invalid proxy: " + proxyStr);
            }
            int port = uri.getPort() == -1 ? 80 : uri.getPort();
            return new Proxy(type, InetSocketAddress.createUnresolved(uri.getHost(), port));
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("invalid proxy: " + proxyStr, ex);
        }
    }

    private static final class SchemeProxySelector extends ProxySelector {

        private final Proxy http;
        private final Proxy https;

        SchemeProxySelector(Proxy http, Proxy https) {
            this.http = http;
            this.https = https;
        }

        @Override
        public List<Proxy> select(URI uri) {
            boolean secure = uri != null && "https".equalsIgnoreCase(uri.getScheme());
            Proxy proxy = secure ? (https != null ? https : http) : (http != null ? http : https);
            return List.of(proxy);
        }

        @Override
        public void connectFailed(URI uri, SocketAddress sa, IOException ioe) {
            log.warn("proxy connect failed, uri={}, proxy={}, error={}", uri, sa, ioe.getMessage());
        }

    }

}
