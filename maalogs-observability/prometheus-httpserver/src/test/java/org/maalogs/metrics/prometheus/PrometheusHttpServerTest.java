// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.prometheus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.Supplier;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.maalogs.metrics.LongCounter;
import org.maalogs.metrics.LongGauge;
import org.maalogs.metrics.core.MetricRegistry;
import org.maalogs.metrics.core.MetricRegistrySnapshot;
import org.maalogs.metrics.prometheus.config.PrometheusHttpServerConfig;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

public class PrometheusHttpServerTest {

    private static final PrometheusHttpServerConfig CONFIG =
            new PrometheusHttpServerConfig("127.0.0.1", "/metrics", 1024);

    private static final HttpResponse.BodyHandler<String> BODY_HANDLER = responseInfo -> {
        var byteSubscriber = HttpResponse.BodySubscribers.ofByteArray();
        return HttpResponse.BodySubscribers.mapping(byteSubscriber, bytes -> {
            boolean isGzip = responseInfo
                    .headers()
                    .firstValue("Content-Encoding")
                    .map(v -> v.equalsIgnoreCase("gzip"))
                    .orElse(false);

            if (isGzip) {
                try (var bais = new ByteArrayInputStream(bytes);
                        var gis = new GZIPInputStream(bais)) {
                    return new String(gis.readAllBytes(), StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            } else {
                return new String(bytes, StandardCharsets.UTF_8);
            }
        });
    };

    private static final HttpClient httpClient = HttpClient.newHttpClient();

    // helper to find an ephemeral free port
    static int findFreePort() {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to find free port", e);
        }
    }

    static HttpResponse<String> send(HttpRequest.Builder requestBuilder) {
        try {
            return httpClient.send(requestBuilder.timeout(Duration.ofSeconds(2)).build(), BODY_HANDLER);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
    }

    static PrometheusHttpServer startAndAwait(int port) {
        PrometheusHttpServer server = new PrometheusHttpServer(port, CONFIG);
        server.start();
        await().atMost(Duration.ofSeconds(5))
                .until(() -> server.state() != PrometheusHttpServer.State.STARTING);
        assertThat(server.state()).isEqualTo(PrometheusHttpServer.State.LISTENING);
        return server;
    }

    abstract static class BaseTest {

        protected PrometheusHttpServer server;
        protected URI baseUri;
        protected URI uri;

        @BeforeEach
        void startServer() {
            server = startAndAwait(findFreePort());
            baseUri = URI.create("http://127.0.0.1:" + server.boundPort());
            uri = baseUri.resolve("/metrics");
        }

        @AfterEach
        void stopServer() {
            server.close();
        }

        protected HttpResponse<String> callMetrics(boolean useGzip) {
            HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri).GET();
            if (useGzip) {
                builder.header("Accept-Encoding", "gzip");
            }
            return send(builder);
        }
    }

    @Nested
    class RealMetricsTest extends BaseTest {

        private MetricRegistry registry;

        @BeforeEach
        void setUp() {
            registry = new MetricRegistry();
            registry.attachExporter(server);
        }

        @Test
        void testScrape() {
            registry.register(LongGauge.builder("app_up").setDescription("App up"))
                    .unlabeled()
                    .set(1);
            registry.register(LongCounter.builder("calls_total")
                            .setDescription("Calls")
                            .addLabelNames("command"))
                    .labeled("command", "greet")
                    .increment(5);

            String expected = """
                    # HELP app_up App up
                    # TYPE app_up gauge
                    app_up 1
                    # HELP calls_total Calls
                    # TYPE calls_total counter
                    calls_total{command="greet"} 5
                    """;

            HttpResponse<String> plain = callMetrics(false);
            assertThat(plain.statusCode()).isEqualTo(200);
            assertThat(plain.body()).isEqualTo(expected);
            assertThat(plain.headers().firstValue("Content-Encoding")).isEmpty();

            HttpResponse<String> gzip = callMetrics(true);
            assertThat(gzip.statusCode()).isEqualTo(200);
            assertThat(gzip.body()).isEqualTo(expected);
            assertThat(gzip.headers().firstValue("Content-Encoding")).hasValue("gzip");
        }

        @Test
        void testScrapeSeesNewValues() {
            LongCounter counter = registry.register(LongCounter.builder("calls_total"));

            counter.unlabeled().increment();
            assertThat(callMetrics(false).body()).contains("calls_total 1\n");

            counter.unlabeled().increment();
            assertThat(callMetrics(false).body()).contains("calls_total 2\n");
        }

        @Test
        void testQueryStringIgnored() {
            registry.register(LongGauge.builder("app_up")).unlabeled().set(1);

            HttpResponse<String> response =
                    send(HttpRequest.newBuilder().uri(baseUri.resolve("/metrics?name=app_up")).GET());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("app_up 1");
        }

        @Test
        void testRequestsHandledOnDaemonThread() {
            assertThat(callMetrics(false).statusCode()).isEqualTo(200);

            assertThat(Thread.getAllStackTraces().keySet())
                    .filteredOn(thread -> thread.getName().equals("metrics-exporter"))
                    .isNotEmpty()
                    .allMatch(Thread::isDaemon);
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    class MockMetricsTest extends BaseTest {

        @Mock
        private Supplier<MetricRegistrySnapshot> snapshotSupplier;

        @Test
        void testNoSupplierSetYet() {
            HttpResponse<String> response = callMetrics(false);

            assertThat(response.statusCode()).isEqualTo(204);
            assertThat(response.body()).isEmpty();
            assertThat(response.headers().firstValue("Cache-Control")).hasValue("no-store");
        }

        @Test
        void testEmptyMetricsHeaders() {
            server.setSnapshotSupplier(snapshotSupplier);
            when(snapshotSupplier.get()).thenReturn(MetricRegistrySnapshot.empty());

            HttpResponse<String> response = callMetrics(false);
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEmpty();
            assertThat(response.headers().firstValue("Content-Type"))
                    .hasValue("text/plain; version=0.0.4; charset=utf-8");
            assertThat(response.headers().firstValue("Cache-Control")).hasValue("no-store");
            assertThat(response.headers().firstValue("Vary")).hasValue("Accept-Encoding");

            response = callMetrics(true);
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEmpty();
            assertThat(response.headers().firstValue("Content-Encoding")).hasValue("gzip");

            verify(snapshotSupplier, times(2)).get();
        }

        @Test
        void testEncodeErrorReturns500() {
            server.setSnapshotSupplier(snapshotSupplier);
            when(snapshotSupplier.get())
                    .thenThrow(new IllegalStateException("broken"))
                    .thenReturn(MetricRegistrySnapshot.empty());

            HttpResponse<String> response = callMetrics(false);
            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(response.body()).isEqualTo("encode error");

            // the server keeps serving after a failed scrape
            response = callMetrics(false);
            assertThat(response.statusCode()).isEqualTo(200);

            verify(snapshotSupplier, times(2)).get();
        }

        @Test
        void testHeadRequest() {
            server.setSnapshotSupplier(snapshotSupplier);

            HttpResponse<String> response = send(HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept-Encoding", "gzip")
                    .method("HEAD", HttpRequest.BodyPublishers.noBody()));

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEmpty();
            assertThat(response.headers().firstValue("Content-Type"))
                    .hasValue("text/plain; version=0.0.4; charset=utf-8");
            assertThat(response.headers().firstValue("Content-Encoding")).hasValue("gzip");
            verifyNoInteractions(snapshotSupplier);
        }

        @ParameterizedTest
        @ValueSource(strings = {"/", "/foo", "/metrics/", "/metricsx", "/METRICS"})
        void testUnknownPathReturns404(String path) {
            server.setSnapshotSupplier(snapshotSupplier);

            HttpResponse<String> response =
                    send(HttpRequest.newBuilder().uri(baseUri.resolve(path)).GET());

            assertThat(response.statusCode()).isEqualTo(404);
            assertThat(response.body()).isEqualTo("not found");
            verifyNoInteractions(snapshotSupplier);
        }

        @ParameterizedTest
        @ValueSource(strings = {"POST", "PUT", "DELETE", "PATCH", "OPTIONS"})
        void testOtherMethodsReturn404(String method) {
            server.setSnapshotSupplier(snapshotSupplier);

            HttpResponse<String> response = send(HttpRequest.newBuilder()
                    .uri(uri)
                    .method(method, HttpRequest.BodyPublishers.noBody()));

            assertThat(response.statusCode()).isEqualTo(404);
            assertThat(response.body()).isEqualTo("not found");
            verifyNoInteractions(snapshotSupplier);
        }
    }

    @Nested
    class Lifecycle {

        @Test
        void testOccupiedPortLeavesServerUnavailable() throws IOException {
            try (ServerSocket socket = new ServerSocket(0, 10, InetAddress.getByName("127.0.0.1"))) {
                PrometheusHttpServer server = new PrometheusHttpServer(socket.getLocalPort(), CONFIG);

                assertThatCode(server::start).doesNotThrowAnyException();

                await().atMost(Duration.ofSeconds(5))
                        .until(() -> server.state() == PrometheusHttpServer.State.UNAVAILABLE);
                assertThat(server.boundPort()).isEqualTo(-1);
                server.close();
                assertThat(server.state()).isEqualTo(PrometheusHttpServer.State.STOPPED);
            }
        }

        @Test
        void testEphemeralPort() {
            PrometheusHttpServer server = startAndAwait(0);
            try {
                assertThat(server.boundPort()).isPositive();
            } finally {
                server.close();
            }
        }

        @Test
        void testStartTwiceThrows() {
            PrometheusHttpServer server = startAndAwait(0);
            try {
                assertThatThrownBy(server::start)
                        .isInstanceOf(IllegalStateException.class)
                        .hasMessageContaining("already started");
            } finally {
                server.close();
            }
        }

        @Test
        void testCloseStopsListening() {
            PrometheusHttpServer server = startAndAwait(0);
            URI uri = URI.create("http://127.0.0.1:" + server.boundPort() + "/metrics");

            server.close();
            server.close();

            assertThat(server.state()).isEqualTo(PrometheusHttpServer.State.STOPPED);
            assertThat(server.boundPort()).isEqualTo(-1);
            assertThatThrownBy(() -> send(HttpRequest.newBuilder().uri(uri).GET()))
                    .isInstanceOf(UncheckedIOException.class);
        }

        @Test
        void testCloseBeforeStart() {
            PrometheusHttpServer server = new PrometheusHttpServer(0, CONFIG);

            server.close();

            assertThat(server.state()).isEqualTo(PrometheusHttpServer.State.STOPPED);
            assertThatThrownBy(server::start).isInstanceOf(IllegalStateException.class);
        }

        @ParameterizedTest
        @ValueSource(ints = {-1, 65536})
        void testInvalidPortThrows(int port) {
            assertThatThrownBy(() -> new PrometheusHttpServer(port, CONFIG))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Port out of range: " + port);
        }
    }
}
