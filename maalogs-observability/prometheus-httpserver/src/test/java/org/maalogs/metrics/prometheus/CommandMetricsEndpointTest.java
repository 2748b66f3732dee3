// SPDX-License-Identifier: Apache-2.0
package org.maalogs.metrics.prometheus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.maalogs.metrics.CommandMetrics;

/**
 * Drives the process-wide {@link CommandMetrics} through its public entry points and scrapes the endpoint.
 * The only test in this module that starts the process-wide endpoint.
 */
public class CommandMetricsEndpointTest {

    private final HttpClient httpClient = HttpClient.newHttpClient();

    private HttpResponse<String> scrape(URI uri) {
        try {
            return httpClient.send(
                    HttpRequest.newBuilder()
                            .uri(uri)
                            .timeout(Duration.ofSeconds(2))
                            .GET()
                            .build(),
                    HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
    }

    private String awaitScrape(URI uri) {
        AtomicReference<HttpResponse<String>> response = new AtomicReference<>();
        await().atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(50))
                .until(() -> {
                    response.set(scrape(uri));
                    return response.get() != null && response.get().statusCode() == 200;
                });
        return response.get().body();
    }

    @Test
    void testRecordedCommandIsScraped() {
        int port = PrometheusHttpServerTest.findFreePort();
        URI uri = URI.create("http://127.0.0.1:" + port + "/metrics");

        CommandMetrics.startServer(port);

        String baseline = awaitScrape(uri);
        assertThat(baseline)
                .contains("# HELP tauri_app_up Tauri app up\n# TYPE tauri_app_up gauge\ntauri_app_up 1\n")
                .contains("# HELP tauri_command_total Tauri command total\n# TYPE tauri_command_total counter\n")
                .contains("# TYPE tauri_command_duration_seconds histogram\n")
                .doesNotContain("tauri_command_total{command=\"greet\"");

        CommandMetrics.record("greet", CommandMetrics.STATUS_SUCCESS, 0.002);

        String body = awaitScrape(uri);
        assertThat(body.lines())
                .contains(
                        "tauri_command_total{command=\"greet\",status=\"success\"} 1",
                        "tauri_command_duration_seconds_bucket{command=\"greet\",le=\"0.005\"} 1",
                        "tauri_command_duration_seconds_bucket{command=\"greet\",le=\"10\"} 1",
                        "tauri_command_duration_seconds_bucket{command=\"greet\",le=\"+Inf\"} 1",
                        "tauri_command_duration_seconds_sum{command=\"greet\"} 0.002",
                        "tauri_command_duration_seconds_count{command=\"greet\"} 1");

        // a repeated start is ignored and the endpoint keeps serving
        CommandMetrics.startServer(PrometheusHttpServerTest.findFreePort());
        assertThat(awaitScrape(uri)).contains("tauri_app_up 1");

        HttpResponse<String> notFound = scrape(URI.create("http://127.0.0.1:" + port + "/foo"));
        assertThat(notFound).isNotNull();
        assertThat(notFound.statusCode()).isEqualTo(404);
        assertThat(notFound.body()).isEqualTo("not found");
    }
}
