/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.flink.kubernetes.heimdall.proxy;

import org.apache.flink.kubernetes.heimdall.exception.ProxyException;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Test for {@link StreamingProxy}. */
public class StreamingProxyTest {

    private HttpServer backend;
    private ExecutorService backendExecutor;
    private StreamingProxy proxy;

    @BeforeEach
    public void setup() throws IOException {
        backendExecutor = Executors.newCachedThreadPool();
        backend = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        backend.setExecutor(backendExecutor);
        backend.createContext("/echo", StreamingProxyTest::echo);
        backend.createContext(
                "/missing", exchange -> respond(exchange, 404, "{\"errors\":[\"Not found\"]}"));
        backend.createContext(
                "/slow",
                exchange -> {
                    try {
                        Thread.sleep(2_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    respond(exchange, 200, "late");
                });
        backend.start();

        proxy = createProxy(backend.getAddress().getPort(), Duration.ofSeconds(10));
    }

    @AfterEach
    public void cleanup() {
        backend.stop(0);
        backendExecutor.shutdownNow();
    }

    @Test
    public void testForwardGet() throws Exception {
        ProxyRequest request =
                ProxyRequest.builder()
                        .appName("backend")
                        .method("GET")
                        .path("/echo/jobs")
                        .query("a=1&b=two")
                        .headers(
                                Map.of(
                                        "X-Custom", List.of("yes"),
                                        "Proxy-Authorization", List.of("Basic Zm9v"),
                                        "Keep-Alive", List.of("timeout=5"),
                                        "TE", List.of("trailers")))
                        .build();

        ProxyResponse response = proxy.forward(request).get(10, TimeUnit.SECONDS);

        assertEquals(200, response.getStatusCode());
        String body = readBody(response);
        assertThat(body)
                .contains("GET /echo/jobs?a=1&b=two")
                .contains("x-custom: yes")
                .doesNotContain("proxy-authorization")
                .doesNotContain("keep-alive")
                .doesNotContain("\nte: ")
                .doesNotContain("accept-encoding");
        assertThat(response.getHeaders().keySet())
                .map(String::toLowerCase)
                .contains("x-backend")
                .doesNotContain("content-encoding", "transfer-encoding", "connection");
    }

    @Test
    public void testForwardBodyWithKnownLength() throws Exception {
        String payload = "{\"parallelism\": 2}";
        ProxyRequest request =
                ProxyRequest.builder()
                        .appName("backend")
                        .method("POST")
                        .path("/echo")
                        .headers(Map.of("Content-Type", List.of("application/json")))
                        .body(HttpRequest.BodyPublishers.ofString(payload))
                        .contentLength(payload.getBytes(StandardCharsets.UTF_8).length)
                        .build();

        String body = readBody(proxy.forward(request).get(10, TimeUnit.SECONDS));

        assertThat(body)
                .contains("POST /echo")
                .contains("content-length: " + payload.length())
                .endsWith("\n\n" + payload);
    }

    @Test
    public void testForwardBodyWithUnknownLength() throws Exception {
        String payload = "x".repeat(100_000);
        ProxyRequest request =
                ProxyRequest.builder()
                        .appName("backend")
                        .method("PUT")
                        .path("/echo")
                        .body(HttpRequest.BodyPublishers.ofString(payload))
                        .build();

        String body = readBody(proxy.forward(request).get(10, TimeUnit.SECONDS));

        assertThat(body).contains("PUT /echo").contains("transfer-encoding: chunked");
        assertThat(body).endsWith("\n\n" + payload);
    }

    @Test
    public void testBackendErrorStatusPassesThrough() throws Exception {
        ProxyRequest request =
                ProxyRequest.builder().appName("backend").method("GET").path("/missing").build();

        ProxyResponse response = proxy.forward(request).get(10, TimeUnit.SECONDS);

        assertEquals(404, response.getStatusCode());
        assertEquals("{\"errors\":[\"Not found\"]}", readBody(response));
    }

    @Test
    public void testUnreachableBackend() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        StreamingProxy unreachable = createProxy(port, Duration.ofSeconds(10));

        var exception =
                assertThrows(
                        CompletionException.class,
                        () ->
                                unreachable
                                        .forward(
                                                ProxyRequest.builder()
                                                        .appName("backend")
                                                        .method("GET")
                                                        .build())
                                        .join());

        var proxyException = assertInstanceOf(ProxyException.class, exception.getCause());
        assertEquals(ProxyException.Kind.UNREACHABLE, proxyException.getKind());
        assertEquals("backend", proxyException.getAppName());
    }

    @Test
    public void testBackendTimeout() {
        StreamingProxy impatient =
                createProxy(backend.getAddress().getPort(), Duration.ofMillis(200));

        var exception =
                assertThrows(
                        CompletionException.class,
                        () ->
                                impatient
                                        .forward(
                                                ProxyRequest.builder()
                                                        .appName("backend")
                                                        .method("GET")
                                                        .path("/slow")
                                                        .build())
                                        .join());

        var proxyException = assertInstanceOf(ProxyException.class, exception.getCause());
        assertEquals(ProxyException.Kind.TIMEOUT, proxyException.getKind());
    }

    @Test
    public void testInvalidAppName() {
        assertThrows(
                IllegalArgumentException.class,
                () ->
                        proxy.forward(
                                ProxyRequest.builder().appName("Not_Valid").method("GET").build()));
    }

    private static StreamingProxy createProxy(int port, Duration requestTimeout) {
        return new StreamingProxy(
                new ProxyTargetResolver(
                        Map.of("backend", "http://localhost:" + port), "http://{app}:8081"),
                StreamingProxy.createHttpClient(Duration.ofSeconds(5)),
                requestTimeout);
    }

    private static String readBody(ProxyResponse response) throws Exception {
        HttpResponse.BodySubscriber<String> subscriber =
                HttpResponse.BodySubscribers.ofString(StandardCharsets.UTF_8);
        response.getBody().subscribe(subscriber);
        return subscriber.getBody().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    /** Answers with the request line, the lower cased request headers and the request body. */
    private static void echo(HttpExchange exchange) throws IOException {
        StringBuilder echo = new StringBuilder();
        echo.append(exchange.getRequestMethod())
                .append(' ')
                .append(exchange.getRequestURI())
                .append('\n');
        exchange.getRequestHeaders()
                .forEach(
                        (name, values) ->
                                values.forEach(
                                        value ->
                                                echo.append(name.toLowerCase())
                                                        .append(": ")
                                                        .append(value)
                                                        .append('\n')));
        echo.append('\n');
        echo.append(
                new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));

        exchange.getResponseHeaders().add("X-Backend", "yes");
        exchange.getResponseHeaders().add("Content-Encoding", "identity");
        respond(exchange, 200, echo.toString());
    }

    private static void respond(HttpExchange exchange, int status, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        // chunked response
        exchange.sendResponseHeaders(status, 0);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
