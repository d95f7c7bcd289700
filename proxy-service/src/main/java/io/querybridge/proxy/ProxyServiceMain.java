package io.querybridge.proxy;

import io.querybridge.proxy.server.SearchProxyApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the search proxy. Delegates to
 * {@link SearchProxyApp#start(String[])} and exits with status {@code 1} if
 * startup fails.
 */
public final class ProxyServiceMain {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyServiceMain.class);

    private ProxyServiceMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            SearchProxyApp app = SearchProxyApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "proxy-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
