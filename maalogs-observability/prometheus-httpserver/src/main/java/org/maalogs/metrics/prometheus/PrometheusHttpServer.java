// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.prometheus;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.sun.net.httpserver.spi.HttpServerProvider;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.zip.GZIPOutputStream;
import org.maalogs.metrics.core.MetricRegistrySnapshot;
import org.maalogs.metrics.core.MetricsExporter;
import org.maalogs.metrics.prometheus.config.PrometheusHttpServerConfig;

/**
 * An HTTP server that exposes metrics in the Prometheus text format.
 * <p>
 * The server listens on a configurable hostname, port and path, and serves metrics snapshots
 * in response to HTTP GET requests. HEAD requests are also supported for health checks.
 * It supports gzip compression if the client indicates support for it via the "Accept-Encoding" header.
 * Any other path or method is answered with 404.
 * <p>
 * {@link #start()} returns immediately, binding happens on a daemon thread. A failed bind leaves the server
 * {@link State#UNAVAILABLE} and is only logged. Requests are handled one at a time on a single daemon thread.
 */
class PrometheusHttpServer implements MetricsExporter {

    private static final System.Logger logger = System.getLogger(PrometheusHttpServer.class.getName());

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
    static final String PLAIN_TEXT_CONTENT_TYPE = "text/plain; charset=utf-8";
    static final String NOT_FOUND_BODY = "not found";
    static final String ENCODE_ERROR_BODY = "encode error";

    private static final int BACKLOG = 3;

    /**
     * Lifecycle of the server.
     */
    enum State {
        NOT_STARTED,
        STARTING,
        LISTENING,
        UNAVAILABLE,
        STOPPED
    }

    private final String hostname;
    private final int port;
    private final String path;
    private final int bufferSize;
    private final PrometheusTextWriter writer = new PrometheusTextWriter();

    // guarded by this
    private State state = State.NOT_STARTED;
    private HttpServer server;
    private ExecutorService executorService;

    private volatile Supplier<MetricRegistrySnapshot> snapshotSupplier;

    PrometheusHttpServer(int port, @NonNull PrometheusHttpServerConfig config) {
        Objects.requireNonNull(config, "Prometheus HTTP server config must not be null");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }

        this.hostname = config.hostname();
        this.port = port;
        this.path = config.path();
        this.bufferSize = config.bufferSize();
    }

    /**
     * Start binding the server on a background daemon thread and return immediately.
     *
     * @throws IllegalStateException if the server has already been started or closed
     */
    @Override
    public void start() {
        synchronized (this) {
            if (state != State.NOT_STARTED) {
                throw new IllegalStateException("Prometheus HTTP server already started, state=" + state);
            }
            state = State.STARTING;
        }

        // the dispatcher thread of the HttpServer is created by the starting thread and inherits its daemon flag
        Thread starter = new Thread(this::bind, "metrics-exporter-start");
        starter.setDaemon(true);
        starter.start();
    }

    private void bind() {
        final InetSocketAddress address;
        if (hostname != null && !hostname.isBlank()) {
            address = new InetSocketAddress(hostname, port);
        } else {
            address = new InetSocketAddress(port);
        }

        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "metrics-exporter");
            thread.setDaemon(true);
            return thread;
        });

        final HttpServer httpServer;
        try {
            httpServer = HttpServerProvider.provider().createHttpServer(address, BACKLOG);
            httpServer.setExecutor(executor);
            httpServer.createContext("/", this::handle);
            httpServer.start();
        } catch (IOException | RuntimeException e) {
            executor.shutdownNow();
            logger.log(WARNING, "Prometheus HTTP server is unavailable, failed to bind " + address, e);
            synchronized (this) {
                if (state == State.STARTING) {
                    state = State.UNAVAILABLE;
                }
            }
            return;
        }

        synchronized (this) {
            if (state != State.STARTING) {
                // closed while binding
                httpServer.stop(0);
                executor.shutdownNow();
                return;
            }
            server = httpServer;
            executorService = executor;
            state = State.LISTENING;
        }

        logger.log(
                INFO,
                "Prometheus HTTP server started. hostname={0}, port={1,number,#}, path={2}",
                hostname,
                boundPort(),
                path);
    }

    /**
     * @return current lifecycle state of the server
     */
    synchronized State state() {
        return state;
    }

    /**
     * @return the port the server listens on, which differs from the configured one when that was 0,
     * or -1 if the server is not listening
     */
    synchronized int boundPort() {
        if (state != State.LISTENING) {
            return -1;
        }
        return server.getAddress().getPort();
    }

    @Override
    public void setSnapshotSupplier(@NonNull Supplier<MetricRegistrySnapshot> snapshotSupplier) {
        this.snapshotSupplier = Objects.requireNonNull(snapshotSupplier, "snapshot supplier must not be null");
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            String method = exchange.getRequestMethod();
            boolean isGet = "GET".equalsIgnoreCase(method);
            boolean isHead = "HEAD".equalsIgnoreCase(method);

            if (!path.equals(exchange.getRequestURI().getPath()) || !(isGet || isHead)) {
                logger.log(DEBUG, "Not found. method={0}, uri={1}", method, exchange.getRequestURI());
                sendText(exchange, 404, NOT_FOUND_BODY);
                return;
            }

            Supplier<MetricRegistrySnapshot> snapshotSupplierRef = this.snapshotSupplier;
            if (snapshotSupplierRef == null) {
                handleNoSnapshotSupplier(exchange);
            } else if (isHead) {
                handleHeadRequest(exchange);
            } else {
                handleGetRequest(exchange, snapshotSupplierRef);
            }
        } catch (RuntimeException e) {
            logger.log(WARNING, "Unexpected error while handling metrics request", e);
            if (exchange.getResponseCode() == -1) {
                exchange.sendResponseHeaders(500, -1);
            }
        } finally {
            exchange.close();
        }
    }

    private void handleHeadRequest(HttpExchange exchange) throws IOException {
        setCommonOkResponseHeaders(exchange.getResponseHeaders());
        handleGzipHeaders(exchange);
        exchange.sendResponseHeaders(200, -1);
    }

    private void handleGetRequest(HttpExchange exchange, Supplier<MetricRegistrySnapshot> snapshotSupplierRef)
            throws IOException {
        boolean useGzip = acceptsGzip(exchange);

        final UnsynchronizedByteArrayOutputStream body;
        try {
            body = render(snapshotSupplierRef.get(), useGzip);
        } catch (IOException | RuntimeException e) {
            logger.log(WARNING, "Failed to encode metrics", e);
            sendText(exchange, 500, ENCODE_ERROR_BODY);
            return;
        }

        setCommonOkResponseHeaders(exchange.getResponseHeaders());
        handleGzipHeaders(exchange);
        sendBody(exchange, 200, body);
    }

    private UnsynchronizedByteArrayOutputStream render(MetricRegistrySnapshot registrySnapshot, boolean useGzip)
            throws IOException {
        UnsynchronizedByteArrayOutputStream body = new UnsynchronizedByteArrayOutputStream(bufferSize);
        if (useGzip) {
            try (OutputStream gzip = new GZIPOutputStream(body)) {
                writer.write(registrySnapshot, gzip);
            }
        } else {
            writer.write(registrySnapshot, body);
        }
        return body;
    }

    private void handleNoSnapshotSupplier(HttpExchange exchange) throws IOException {
        logger.log(INFO, "No snapshot supplier configured yet. method={0}", exchange.getRequestMethod());
        exchange.getResponseHeaders().set("Cache-Control", "no-store");
        exchange.sendResponseHeaders(204, -1); // No Content
    }

    private void sendText(HttpExchange exchange, int code, String text) throws IOException {
        UnsynchronizedByteArrayOutputStream body = new UnsynchronizedByteArrayOutputStream(text.length());
        body.write(text.getBytes(StandardCharsets.UTF_8));
        exchange.getResponseHeaders().set("Content-Type", PLAIN_TEXT_CONTENT_TYPE);
        exchange.getResponseHeaders().set("Cache-Control", "no-store");
        sendBody(exchange, code, body);
    }

    private void sendBody(HttpExchange exchange, int code, UnsynchronizedByteArrayOutputStream body)
            throws IOException {
        // HEAD responses and empty bodies carry no content, a length of 0 would mean chunked encoding
        if ("HEAD".equalsIgnoreCase(exchange.getRequestMethod()) || body.size() == 0) {
            exchange.sendResponseHeaders(code, -1);
            return;
        }
        exchange.sendResponseHeaders(code, body.size());
        try (OutputStream os = exchange.getResponseBody()) {
            body.writeTo(os);
        }
    }

    private void setCommonOkResponseHeaders(Headers responseHeaders) {
        responseHeaders.set("Content-Type", CONTENT_TYPE);
        responseHeaders.set("Cache-Control", "no-store");
        responseHeaders.set("Vary", "Accept-Encoding");
    }

    private void handleGzipHeaders(HttpExchange exchange) {
        if (acceptsGzip(exchange)) {
            exchange.getResponseHeaders().set("Content-Encoding", "gzip");
        }
    }

    private static boolean acceptsGzip(HttpExchange exchange) {
        List<String> encodingHeaders = exchange.getRequestHeaders().get("Accept-Encoding");
        if (encodingHeaders == null) {
            return false;
        }
        for (String encodingHeader : encodingHeaders) {
            String[] encodings = encodingHeader.split(",");
            for (String encoding : encodings) {
                if (encoding.trim().equalsIgnoreCase("gzip")) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public void close() {
        final HttpServer serverRef;
        final ExecutorService executorRef;
        synchronized (this) {
            if (state == State.STOPPED) {
                return;
            }
            state = State.STOPPED;
            serverRef = server;
            executorRef = executorService;
            server = null;
            executorService = null;
        }

        if (serverRef != null) {
            logger.log(INFO, "Stopping Prometheus HTTP server...");
            serverRef.stop(0);
        }
        if (executorRef != null) {
            executorRef.shutdownNow();
        }
    }

    @Override
    public String toString() {
        return "PrometheusHttpServer{hostname=" + hostname + ", port=" + port + ", path=" + path + "}";
    }
}
