package com.example.apistress.clients;

import com.example.apistress.model.ResultRecord;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StressHttpClientTest {

    private HttpServer server;
    private ExecutorService serverExecutor;
    private String baseUrl;
    private StressHttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        serverExecutor = Executors.newFixedThreadPool(4);
        server.setExecutor(serverExecutor);
        server.createContext("/json", exchange -> respond(exchange, 200, "application/json", "{\"ok\":true}"));
        server.createContext("/json-charset", exchange ->
                respond(exchange, 201, "application/json; charset=utf-8", "{\"items\":[1,2,3],\"name\":\"café\"}"));
        server.createContext("/text", exchange -> respond(exchange, 200, "text/plain", "{\"ok\":true}"));
        server.createContext("/broken", exchange -> respond(exchange, 200, "application/json", "{not json"));
        server.createContext("/missing", exchange -> respond(exchange, 404, "text/plain", "not found"));
        server.createContext("/boom", exchange -> respond(exchange, 500, "application/json", "{\"error\":\"boom\"}"));
        server.createContext("/redirect", exchange -> {
            exchange.getResponseHeaders().add("Location", "/json");
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        server.createContext("/empty", exchange -> {
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.createContext("/echo", exchange -> {
            String query = exchange.getRequestURI().getRawQuery();
            String header = exchange.getRequestHeaders().getFirst("X-Test");
            String body = "{\"method\":\"" + exchange.getRequestMethod() + "\",\"query\":\"" + query
                    + "\",\"header\":\"" + header + "\"}";
            respond(exchange, 200, "application/json", body);
        });
        server.createContext("/stalled-body", exchange -> {
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, 2);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write('{');
                os.flush();
                TimeUnit.MILLISECONDS.sleep(2_000);
                os.write('}');
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (IOException ignored) {
                // client gave up on the body
            }
        });
        server.createContext("/slow", exchange -> {
            try {
                TimeUnit.MILLISECONDS.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "application/json", "{}");
        });
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
        client = new StressHttpClient(Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void jsonResponseIsParsedAndMarkedSuccessful() {
        ResultRecord record = client.execute(descriptor("/json", Map.of()), 7);

        assertThat(record.requestId()).isEqualTo(7);
        assertThat(record.statusCode()).isEqualTo(200);
        assertThat(record.success()).isTrue();
        assertThat(record.error()).isNull();
        assertThat(record.method()).isEqualTo("GET");
        assertThat(record.url()).isEqualTo(baseUrl + "/json");
        assertThat(record.contentLength()).isEqualTo(11L);
        assertThat(record.responseBody()).isNotNull();
        assertThat(record.responseBody().get("ok").asBoolean()).isTrue();
        assertThat(record.responseTimeMs()).isGreaterThanOrEqualTo(0.0);
        assertThat(record.timestamp()).isNotNull();
        assertThat(record.responseHeaders()).containsKey("content-type");
    }

    @Test
    void contentLengthCountsBytesNotCharacters() {
        ResultRecord record = client.execute(descriptor("/json-charset", Map.of()), 1);

        String expected = "{\"items\":[1,2,3],\"name\":\"café\"}";
        assertThat(record.statusCode()).isEqualTo(201);
        assertThat(record.success()).isTrue();
        assertThat(record.contentLength()).isEqualTo((long) expected.getBytes(StandardCharsets.UTF_8).length);
        assertThat(record.responseBody().get("name").asText()).isEqualTo("café");
        assertThat(record.responseBody().get("items").size()).isEqualTo(3);
    }

    @Test
    void nonJsonContentTypeOmitsBodyEvenWhenTextIsJson() {
        ResultRecord record = client.execute(descriptor("/text", Map.of()), 1);

        assertThat(record.success()).isTrue();
        assertThat(record.responseBody()).isNull();
        assertThat(record.contentLength()).isEqualTo(11L);
    }

    @Test
    void unparsableJsonBodyDegradesToOmittedBody() {
        ResultRecord record = client.execute(descriptor("/broken", Map.of()), 1);

        assertThat(record.statusCode()).isEqualTo(200);
        assertThat(record.success()).isTrue();
        assertThat(record.error()).isNull();
        assertThat(record.responseBody()).isNull();
    }

    @Test
    void clientErrorStatusIsNotSuccess() {
        ResultRecord record = client.execute(descriptor("/missing", Map.of()), 1);

        assertThat(record.statusCode()).isEqualTo(404);
        assertThat(record.success()).isFalse();
        assertThat(record.error()).isNull();
    }

    @Test
    void serverErrorIsRecordedWithoutTransportError() {
        ResultRecord record = client.execute(descriptor("/boom", Map.of()), 1);

        assertThat(record.statusCode()).isEqualTo(500);
        assertThat(record.success()).isFalse();
        assertThat(record.error()).isNull();
        assertThat(record.responseBody().get("error").asText()).isEqualTo("boom");
    }

    @Test
    void redirectIsNotFollowedAndCountsAsSuccess() {
        ResultRecord record = client.execute(descriptor("/redirect", Map.of()), 1);

        assertThat(record.statusCode()).isEqualTo(302);
        assertThat(record.success()).isTrue();
        assertThat(record.contentLength()).isZero();
        assertThat(record.responseBody()).isNull();
    }

    @Test
    void emptyJsonBodyIsOmitted() {
        ResultRecord record = client.execute(descriptor("/empty", Map.of()), 1);

        assertThat(record.statusCode()).isEqualTo(204);
        assertThat(record.success()).isTrue();
        assertThat(record.contentLength()).isZero();
        assertThat(record.responseBody()).isNull();
    }

    @Test
    void headersAndEncodedParamsAreSentAndEchoed() {
        RequestDescriptor descriptor = RequestDescriptor.builder()
                .method(HttpMethod.GET)
                .url(baseUrl + "/echo")
                .headers(Map.of("X-Test", "stress"))
                .params(Map.of("q", "a b&c"))
                .timeout(Duration.ofSeconds(2))
                .build();

        ResultRecord record = client.execute(descriptor, 3);

        assertThat(record.success()).isTrue();
        assertThat(record.headers()).containsEntry("X-Test", "stress");
        assertThat(record.params()).containsEntry("q", "a b&c");
        assertThat(record.url()).isEqualTo(baseUrl + "/echo");
        assertThat(record.responseBody().get("header").asText()).isEqualTo("stress");
        assertThat(record.responseBody().get("query").asText()).isEqualTo("q=a+b%26c");
    }

    @Test
    void configuredMethodIsUsed() {
        RequestDescriptor descriptor = RequestDescriptor.builder()
                .method(HttpMethod.DELETE)
                .url(baseUrl + "/echo")
                .timeout(Duration.ofSeconds(2))
                .build();

        ResultRecord record = client.execute(descriptor, 1);

        assertThat(record.method()).isEqualTo("DELETE");
        assertThat(record.responseBody().get("method").asText()).isEqualTo("DELETE");
    }

    @Test
    void timeoutBecomesErrorRecord() {
        RequestDescriptor descriptor = RequestDescriptor.builder()
                .url(baseUrl + "/slow")
                .timeout(Duration.ofMillis(200))
                .build();

        ResultRecord record = client.execute(descriptor, 9);

        assertThat(record.requestId()).isEqualTo(9);
        assertThat(record.success()).isFalse();
        assertThat(record.statusCode()).isNull();
        assertThat(record.error()).startsWith("TIMEOUT");
        assertThat(record.responseTimeMs()).isGreaterThanOrEqualTo(150.0);
        assertThat(record.responseHeaders()).isNull();
        assertThat(record.contentLength()).isNull();
    }

    @Test
    void timeoutCoversSlowResponseBody() {
        RequestDescriptor descriptor = RequestDescriptor.builder()
                .url(baseUrl + "/stalled-body")
                .timeout(Duration.ofMillis(300))
                .build();

        ResultRecord record = client.execute(descriptor, 4);

        assertThat(record.success()).isFalse();
        assertThat(record.statusCode()).isNull();
        assertThat(record.error()).startsWith("TIMEOUT");
        assertThat(record.responseTimeMs()).isBetween(250.0, 1_500.0);
        assertThat(record.responseBody()).isNull();
    }

    @Test
    void refusedConnectionBecomesErrorRecord() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        RequestDescriptor descriptor = RequestDescriptor.builder()
                .url("http://localhost:" + closedPort + "/nothing")
                .timeout(Duration.ofSeconds(2))
                .build();

        ResultRecord record = client.execute(descriptor, 2);

        assertThat(record.success()).isFalse();
        assertThat(record.statusCode()).isNull();
        assertThat(record.error()).startsWith("CONNECT");
        assertThat(record.responseBody()).isNull();
    }

    @Test
    void malformedUrlBecomesErrorRecordInsteadOfThrowing() {
        RequestDescriptor descriptor = RequestDescriptor.builder()
                .url("http://exa mple.com/")
                .timeout(Duration.ofSeconds(1))
                .build();

        ResultRecord record = client.execute(descriptor, 1);

        assertThat(record.success()).isFalse();
        assertThat(record.error()).isNotBlank();
    }

    @Test
    void appendQueryMergesWithExistingQueryString() {
        assertThat(StressHttpClient.appendQuery("http://h/p", Map.of("a", "1"))).isEqualTo("http://h/p?a=1");
        assertThat(StressHttpClient.appendQuery("http://h/p?x=1", Map.of("a", "1"))).isEqualTo("http://h/p?x=1&a=1");
        assertThat(StressHttpClient.appendQuery("http://h/p?", Map.of("a", "1"))).isEqualTo("http://h/p?a=1");
        assertThat(StressHttpClient.appendQuery("http://h/p#frag", Map.of("a", "1"))).isEqualTo("http://h/p?a=1#frag");
        assertThat(StressHttpClient.appendQuery("http://h/p", Map.of())).isEqualTo("http://h/p");
    }

    @Test
    void jsonContentTypeDetection() {
        assertThat(StressHttpClient.isJsonContentType("application/json")).isTrue();
        assertThat(StressHttpClient.isJsonContentType("Application/JSON; charset=UTF-8")).isTrue();
        assertThat(StressHttpClient.isJsonContentType("application/problem+json")).isTrue();
        assertThat(StressHttpClient.isJsonContentType("text/plain")).isFalse();
        assertThat(StressHttpClient.isJsonContentType(null)).isFalse();
    }

    private RequestDescriptor descriptor(String path, Map<String, String> params) {
        return RequestDescriptor.builder()
                .method(HttpMethod.GET)
                .url(baseUrl + path)
                .params(params)
                .timeout(Duration.ofSeconds(2))
                .build();
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
