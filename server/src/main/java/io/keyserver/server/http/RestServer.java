package io.keyserver.server.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import io.keyserver.core.binding.KeyServerRoutes;
import io.keyserver.core.binding.RouteBinding;
import io.keyserver.core.binding.RouteTable;
import io.keyserver.core.dispatch.DispatchPipeline;
import io.keyserver.core.json.JacksonMessageDecoder;
import io.keyserver.core.spi.KeyServer;
import io.keyserver.server.backend.UnimplementedKeyServer;
import io.keyserver.server.config.ConfigLoader;
import io.keyserver.server.config.ServerConfig;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the REST front end.
 *
 * <p>
 * Startup sequence of {@link #start(String[])}:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback from {@code logging.format} and
 * {@code logging.level}</li>
 * <li>Build the key server route table</li>
 * <li>Register one Javalin handler per route, plus the health endpoint</li>
 * <li>Start the Javalin HTTP server</li>
 * </ol>
 *
 * <p>
 * {@link #serve(ServerConfig, RouteTable, Object)} skips the first two steps
 * and takes any route table and backend, which is what the integration tests
 * use.
 */
public final class RestServer {

    private static final Logger LOG = LoggerFactory.getLogger(RestServer.class);

    private final Javalin app;
    private final ServerConfig config;
    private final RouteTable<?> routes;

    private RestServer(Javalin app, ServerConfig config, RouteTable<?> routes) {
        this.app = app;
        this.config = config;
        this.routes = routes;
    }

    /**
     * Executes the full startup sequence and returns a running server.
     *
     * @param args command-line arguments (e.g.
     *             {@code --config path/to/config.yaml})
     * @return a running server
     * @throws io.keyserver.server.config.ConfigLoadException if the
     *                                                         configuration
     *                                                         is unusable
     */
    public static RestServer start(String[] args) {
        long startTime = System.nanoTime();

        Path configPath = ConfigLoader.resolveConfigPath(args);
        ServerConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config);
        LOG.info("Configuration loaded from {}", configPath);

        RouteTable<KeyServer> routes = KeyServerRoutes.table();
        RestServer server = serve(config, routes, new UnimplementedKeyServer());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "keyserver-rest started: host={}, port={}, routes={}, health={}, startupMs={}",
                config.host(),
                server.port(),
                routes.size(),
                config.healthEnabled() ? config.healthPath() : "disabled",
                elapsedMs);
        return server;
    }

    /**
     * Starts a server for {@code routes} backed by {@code backend}.
     *
     * @param config  listener, body limit and health settings; logging settings
     *                are ignored
     * @param routes  the routes to serve
     * @param backend the backend every handler is invoked with
     * @return a running server
     */
    public static <B> RestServer serve(ServerConfig config, RouteTable<B> routes, B backend) {
        ObjectMapper mapper = new ObjectMapper();
        DispatchPipeline<B> pipeline = new DispatchPipeline<>(backend, new JacksonMessageDecoder(mapper), mapper);
        JavalinRequestAdapter adapter = new JavalinRequestAdapter();

        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            javalinConfig.http.maxRequestSize = Math.max(config.maxBodyBytes(), 1L);
        });

        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler(routes));
        }

        for (RouteBinding<B, ?, ?> binding : routes.bindings()) {
            app.addHttpHandler(
                    HandlerType.valueOf(binding.method().name()),
                    binding.pathPattern(),
                    new BindingHandler<>(binding, pipeline, adapter, config.maxBodyBytes()));
            LOG.debug("Route {} {} -> {}", binding.method(), binding.pathPattern(), binding.name());
        }

        app.start(config.host(), config.port());
        return new RestServer(app, config, routes);
    }

    /** Returns the port the server is listening on. */
    public int port() {
        return app.port();
    }

    /** Returns the Javalin application. */
    public Javalin javalin() {
        return app;
    }

    public ServerConfig config() {
        return config;
    }

    public RouteTable<?> routes() {
        return routes;
    }

    public void stop() {
        app.stop();
        LOG.info("keyserver-rest stopped");
    }
}
