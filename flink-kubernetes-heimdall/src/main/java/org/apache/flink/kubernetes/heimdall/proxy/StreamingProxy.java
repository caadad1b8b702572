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

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.kubernetes.heimdall.config.HeimdallConfiguration;
import org.apache.flink.kubernetes.heimdall.exception.ProxyException;
import org.apache.flink.util.ExceptionUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Flow;

/**
 * Forwards requests to application backends without buffering bodies.
 *
 * <p>Request bodies are pulled from the given publisher as the backend connection accepts them,
 * response bodies are handed out as a publisher reading from the backend connection. A single
 * {@link HttpClient} with its connection pool is shared by all requests.
 */
public class StreamingProxy {

    private static final Logger LOG = LoggerFactory.getLogger(StreamingProxy.class);

    private final ProxyTargetResolver targetResolver;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public StreamingProxy(HeimdallConfiguration config) {
        this(
                new ProxyTargetResolver(config),
                createHttpClient(config.getProxyConnectTimeout()),
                config.getProxyRequestTimeout());
    }

    @VisibleForTesting
    public StreamingProxy(
            ProxyTargetResolver targetResolver, HttpClient httpClient, Duration requestTimeout) {
        this.targetResolver = targetResolver;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    public static HttpClient createHttpClient(Duration connectTimeout) {
        // HTTP/2 upgrade negotiation would add headers the backend never asked for
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(connectTimeout)
                .build();
    }

    /**
     * Sends the request to the backend of its application.
     *
     * <p>The returned future completes once the response headers arrived; backend error statuses
     * complete it normally. It fails with a {@link ProxyException} if the backend could not be
     * reached or did not answer in time. Cancelling it aborts the exchange.
     *
     * @throws IllegalArgumentException if no backend URL can be derived for the request
     */
    public CompletableFuture<ProxyResponse> forward(ProxyRequest request) {
        URI target =
                targetResolver.resolve(request.getAppName(), request.getPath(), request.getQuery());

        HttpRequest.Builder builder =
                HttpRequest.newBuilder(target)
                        .timeout(requestTimeout)
                        .method(request.getMethod(), bodyPublisher(request));
        HttpHeaderFilters.filterRequestHeaders(request.getHeaders())
                .forEach((name, values) -> values.forEach(value -> builder.header(name, value)));

        LOG.debug("Proxying {} {} to {}", request.getMethod(), request.getAppName(), target);

        CompletableFuture<HttpResponse<Flow.Publisher<List<ByteBuffer>>>> exchange =
                httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofPublisher());

        CompletableFuture<ProxyResponse> result =
                exchange.handle(
                        (response, error) -> {
                            if (error != null) {
                                throw toProxyFailure(request.getAppName(), target, error);
                            }
                            return new ProxyResponse(
                                    response.statusCode(),
                                    HttpHeaderFilters.filterResponseHeaders(
                                            response.headers().map()),
                                    response.body());
                        });
        result.whenComplete(
                (response, error) -> {
                    if (error instanceof CancellationException) {
                        exchange.cancel(true);
                    }
                });
        return result;
    }

    private static HttpRequest.BodyPublisher bodyPublisher(ProxyRequest request) {
        Flow.Publisher<ByteBuffer> body = request.getBody();
        if (body == null || request.getContentLength() == 0) {
            return HttpRequest.BodyPublishers.noBody();
        }
        if (request.getContentLength() > 0) {
            return HttpRequest.BodyPublishers.fromPublisher(body, request.getContentLength());
        }
        return HttpRequest.BodyPublishers.fromPublisher(body);
    }

    private static CompletionException toProxyFailure(String appName, URI target, Throwable error) {
        Throwable cause = ExceptionUtils.stripCompletionException(error);
        if (cause instanceof HttpTimeoutException) {
            LOG.warn("Timeout while proxying to {} for application {}", target, appName);
            return new CompletionException(
                    new ProxyException(ProxyException.Kind.TIMEOUT, appName, target, cause));
        }
        if (cause instanceof IOException) {
            LOG.warn(
                    "Backend {} of application {} is unreachable: {}",
                    target,
                    appName,
                    cause.toString());
            return new CompletionException(
                    new ProxyException(ProxyException.Kind.UNREACHABLE, appName, target, cause));
        }
        LOG.error("Proxy request to {} for application {} failed", target, appName, cause);
        return new CompletionException(cause);
    }
}
