package org.genemeta.node.processes.http;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.genemeta.node.processes.http.api.AbstractApiController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import io.javalin.Javalin;

/**
 * Node process that serves the query API over HTTP.
 * <p>
 * <strong>Configuration:</strong>
 * <pre>
 * http {
 *   host = "0.0.0.0"
 *   port = 8080          # 0 picks a free port
 *   base-path = "/api"
 * }
 * </pre>
 * <p>
 * <strong>Thread Safety:</strong> {@link #start()} and {@link #stop()} are idempotent and may be
 * called from different threads.
 */
public class HttpServerProcess implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServerProcess.class);

    private final String processName;
    private final String host;
    private final int port;
    private final String basePath;
    private final List<AbstractApiController> controllers;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private Javalin app;

    /**
     * Creates the process.
     *
     * @param processName Name used in log messages.
     * @param options     The {@code genemeta.http} block.
     * @param controllers Controllers whose routes are registered on start.
     */
    public HttpServerProcess(final String processName, final Config options,
                             final List<AbstractApiController> controllers) {
        this.processName = processName;
        this.host = options.hasPath("host") ? options.getString("host") : "0.0.0.0";
        this.port = options.hasPath("port") ? options.getInt("port") : 8080;
        this.basePath = options.hasPath("base-path") ? options.getString("base-path") : "/api";
        this.controllers = List.copyOf(controllers);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("http.port must be in [0, 65535], got " + port);
        }
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        app = Javalin.create(config -> config.showJavalinBanner = false);
        for (final AbstractApiController controller : controllers) {
            controller.registerRoutes(app, basePath);
        }
        app.start(host, port);
        log.info("{} started: listening on http://{}:{}{}", processName, host, app.port(), basePath);
    }

    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        app.stop();
        log.info("{} stopped", processName);
    }

    /**
     * Returns the bound port, which differs from the configured one when that was 0.
     *
     * @throws IllegalStateException if the process is not running.
     */
    public int getPort() {
        if (!started.get()) {
            throw new IllegalStateException(processName + " is not running");
        }
        return app.port();
    }

    public String getBasePath() {
        return basePath;
    }

    @Override
    public void close() {
        stop();
    }
}
