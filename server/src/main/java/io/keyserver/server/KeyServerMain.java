package io.keyserver.server;

import io.keyserver.server.config.ConfigLoadException;
import io.keyserver.server.http.RestServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the REST front end.
 *
 * <p>
 * Starts the server with {@link #run(String[])} and exits with status 1 when
 * startup fails. A running server is stopped by a JVM shutdown hook, so
 * SIGTERM drains Jetty instead of dropping in-flight requests.
 */
public final class KeyServerMain {

    private static final Logger LOG = LoggerFactory.getLogger(KeyServerMain.class);

    static final int EXIT_STARTUP_FAILURE = 1;

    private KeyServerMain() {
        // utility class
    }

    /**
     * @param args command-line arguments (e.g.
     *             {@code --config path/to/config.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            run(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", describe(e), e);
            System.exit(EXIT_STARTUP_FAILURE);
        }
    }

    /**
     * Starts the server and registers the hook that stops it on JVM exit.
     *
     * @return the running server
     */
    static RestServer run(String[] args) {
        RestServer server = RestServer.start(args);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "keyserver-rest-shutdown"));
        return server;
    }

    /** Startup failure text; configuration errors name the offending key. */
    static String describe(Exception e) {
        if (e instanceof ConfigLoadException configError && configError.key().isPresent()) {
            return "invalid configuration key " + configError.key().get() + ": " + e.getMessage();
        }
        return e.getMessage();
    }
}
