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

package org.apache.flink.kubernetes.heimdall.webserver;

import org.apache.flink.kubernetes.heimdall.api.Job;
import org.apache.flink.kubernetes.heimdall.config.HeimdallConfiguration;
import org.apache.flink.kubernetes.heimdall.exception.NoServedVersionException;
import org.apache.flink.kubernetes.heimdall.exception.ProxyException;
import org.apache.flink.kubernetes.heimdall.locator.FlinkJobLocator;
import org.apache.flink.kubernetes.heimdall.locator.JobListingCache;
import org.apache.flink.kubernetes.heimdall.proxy.ProxyRequest;
import org.apache.flink.kubernetes.heimdall.proxy.ProxyResponse;
import org.apache.flink.kubernetes.heimdall.proxy.StreamingProxy;
import org.apache.flink.util.ExceptionUtils;

import org.apache.flink.shaded.netty4.io.netty.buffer.Unpooled;
import org.apache.flink.shaded.netty4.io.netty.channel.ChannelFuture;
import org.apache.flink.shaded.netty4.io.netty.channel.ChannelFutureListener;
import org.apache.flink.shaded.netty4.io.netty.channel.ChannelHandlerContext;
import org.apache.flink.shaded.netty4.io.netty.channel.ChannelInboundHandlerAdapter;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.DefaultFullHttpResponse;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.DefaultHttpResponse;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.FullHttpRequest;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.HttpContent;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.HttpMethod;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.HttpRequest;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.HttpResponse;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.HttpResponseStatus;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.HttpUtil;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.HttpVersion;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.LastHttpContent;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.QueryStringDecoder;
import org.apache.flink.shaded.netty4.io.netty.util.ReferenceCountUtil;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

import static org.apache.flink.shaded.netty4.io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static org.apache.flink.shaded.netty4.io.netty.handler.codec.http.HttpHeaderValues.APPLICATION_JSON;
import static org.apache.flink.shaded.netty4.io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Serves the heimdall HTTP endpoints of a single connection.
 *
 * <p>Requests are not aggregated: proxied request bodies are handed to the backend chunk by chunk
 * while the channel only reads on demand, and proxied response bodies are written as they arrive.
 * Auto read is switched off for the duration of every request, so requests of a connection are
 * answered in order.
 */
public class HeimdallHttpHandler extends ChannelInboundHandlerAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(HeimdallHttpHandler.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    protected static final String JOBS_REQUEST_PATH = "/api/jobs";
    protected static final String CONFIG_REQUEST_PATH = "/api/config";
    protected static final String HEALTH_REQUEST_PATH = "/healthz";
    protected static final String PROXY_REQUEST_PATH_PREFIX = "/proxy/";

    private final HeimdallConfiguration config;
    private final FlinkJobLocator jobLocator;
    private final JobListingCache jobListingCache;
    private final StreamingProxy proxy;

    // state of the request in flight, only accessed from the event loop
    private boolean inFlight;
    private boolean rejectingInput;
    private boolean keepAlive;
    private boolean supportsChunking;
    private boolean requestComplete = true;
    private ChannelBodyPublisher requestBody;
    private CompletableFuture<ProxyResponse> pendingExchange;

    public HeimdallHttpHandler(
            HeimdallConfiguration config,
            FlinkJobLocator jobLocator,
            JobListingCache jobListingCache,
            StreamingProxy proxy) {
        this.config = config;
        this.jobLocator = jobLocator;
        this.jobListingCache = jobListingCache;
        this.proxy = proxy;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof HttpRequest && inFlight) {
            LOG.warn("Closing {}, pipelined requests are not supported", ctx.channel());
            rejectingInput = true;
            ctx.close();
        }
        if (rejectingInput) {
            ReferenceCountUtil.release(msg);
            return;
        }
        if (msg instanceof HttpRequest) {
            handleRequest(ctx, (HttpRequest) msg);
        }
        if (msg instanceof HttpContent) {
            handleContent((HttpContent) msg);
        } else if (!(msg instanceof HttpRequest)) {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (requestBody != null && !requestBody.isCompleted()) {
            requestBody.onError(new ClosedChannelException());
        }
        if (pendingExchange != null) {
            pendingExchange.cancel(true);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOG.warn("Closing connection {} after unexpected error", ctx.channel(), cause);
        ctx.close();
    }

    private void handleRequest(ChannelHandlerContext ctx, HttpRequest httpRequest) {
        inFlight = true;
        keepAlive = HttpUtil.isKeepAlive(httpRequest);
        supportsChunking = !HttpVersion.HTTP_1_0.equals(httpRequest.protocolVersion());
        requestComplete = false;
        requestBody = null;
        ctx.channel().config().setAutoRead(false);

        if (httpRequest.decoderResult().isFailure()) {
            keepAlive = false;
            sendError(ctx, HttpResponseStatus.BAD_REQUEST, "Malformed HTTP request");
            return;
        }

        QueryStringDecoder decoder = new QueryStringDecoder(httpRequest.uri());
        String path = decoder.rawPath();
        HttpMethod method = httpRequest.method();
        LOG.debug("{} {}", method, path);

        if (path.startsWith(PROXY_REQUEST_PATH_PREFIX)) {
            handleProxyRequest(ctx, httpRequest, path, decoder.rawQuery());
        } else if (JOBS_REQUEST_PATH.equals(path) && HttpMethod.GET.equals(method)) {
            handleJobsRequest(ctx);
        } else if (CONFIG_REQUEST_PATH.equals(path) && HttpMethod.GET.equals(method)) {
            sendJson(ctx, HttpResponseStatus.OK, getUiConfig());
        } else if (HEALTH_REQUEST_PATH.equals(path) && HttpMethod.GET.equals(method)) {
            sendJson(ctx, HttpResponseStatus.OK, Map.of("ok", true));
        } else if (JOBS_REQUEST_PATH.equals(path)
                || CONFIG_REQUEST_PATH.equals(path)
                || HEALTH_REQUEST_PATH.equals(path)) {
            sendError(
                    ctx,
                    HttpResponseStatus.METHOD_NOT_ALLOWED,
                    String.format("Method %s is not allowed for %s", method, path));
        } else {
            sendError(
                    ctx,
                    HttpResponseStatus.NOT_FOUND,
                    String.format("Illegal path requested: %s", path));
        }
    }

    private void handleContent(HttpContent content) {
        boolean last = content instanceof LastHttpContent;
        if (requestBody != null) {
            requestBody.onContent(content.content());
            if (last) {
                requestBody.onComplete();
            }
        } else {
            content.release();
        }
        if (last) {
            requestComplete = true;
        }
    }

    private void handleJobsRequest(ChannelHandlerContext ctx) {
        jobListingCache
                .getOrLoad(jobLocator::findAll)
                .whenComplete(
                        (jobs, error) ->
                                runInEventLoop(
                                        ctx,
                                        () -> {
                                            if (error == null) {
                                                sendJson(ctx, HttpResponseStatus.OK, jobs);
                                            } else {
                                                sendJobsError(ctx, error);
                                            }
                                        }));
    }

    private void sendJobsError(ChannelHandlerContext ctx, Throwable error) {
        Throwable cause = ExceptionUtils.stripCompletionException(error);
        HttpResponseStatus status =
                cause instanceof NoServedVersionException
                        ? HttpResponseStatus.SERVICE_UNAVAILABLE
                        : HttpResponseStatus.INTERNAL_SERVER_ERROR;
        LOG.debug("Answering jobs request with {}: {}", status, cause.toString());
        sendError(ctx, status, cause.getMessage());
    }

    private Map<String, Object> getUiConfig() {
        Map<String, Object> uiConfig = new LinkedHashMap<>();
        uiConfig.put("appVersion", config.resolvedAppVersion());
        uiConfig.put("patterns", config.getUiPatterns());
        uiConfig.put("endpointPathPatterns", config.getUiEndpointPathPatterns());
        return uiConfig;
    }

    private void handleProxyRequest(
            ChannelHandlerContext ctx, HttpRequest httpRequest, String path, String query) {
        String target = path.substring(PROXY_REQUEST_PATH_PREFIX.length());
        int separator = target.indexOf('/');
        String appName = separator < 0 ? target : target.substring(0, separator);
        String subPath = separator < 0 ? "" : target.substring(separator);

        ProxyRequest.ProxyRequestBuilder request =
                ProxyRequest.builder()
                        .appName(appName)
                        .method(httpRequest.method().name())
                        .path(subPath)
                        .query(query.isEmpty() ? null : query)
                        .headers(toHeaderMap(httpRequest));

        long contentLength = getContentLength(httpRequest);
        if (contentLength != 0) {
            requestBody = new ChannelBodyPublisher(ctx.channel());
            request.body(requestBody).contentLength(contentLength);
        }

        try {
            pendingExchange = proxy.forward(request.build());
        } catch (IllegalArgumentException e) {
            LOG.debug("Rejecting proxy request for {}: {}", appName, e.getMessage());
            requestBody = null;
            sendError(ctx, HttpResponseStatus.BAD_REQUEST, e.getMessage());
            return;
        }
        pendingExchange.whenComplete(
                (response, error) ->
                        runInEventLoop(
                                ctx,
                                () ->
                                        onProxyResponse(
                                                ctx, httpRequest.method(), response, error)));
    }

    /** Length of the request body, {@link ProxyRequest#UNKNOWN_LENGTH} for chunked bodies. */
    private static long getContentLength(HttpRequest httpRequest) {
        if (httpRequest instanceof FullHttpRequest) {
            return ((FullHttpRequest) httpRequest).content().readableBytes();
        }
        if (HttpUtil.isTransferEncodingChunked(httpRequest)) {
            return ProxyRequest.UNKNOWN_LENGTH;
        }
        return Math.max(0, HttpUtil.getContentLength(httpRequest, 0L));
    }

    private static Map<String, List<String>> toHeaderMap(HttpRequest httpRequest) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : httpRequest.headers().names()) {
            headers.put(name, new ArrayList<>(httpRequest.headers().getAll(name)));
        }
        return headers;
    }

    private void onProxyResponse(
            ChannelHandlerContext ctx,
            HttpMethod method,
            ProxyResponse proxyResponse,
            Throwable error) {
        pendingExchange = null;
        if (error != null) {
            Throwable cause = ExceptionUtils.stripCompletionException(error);
            if (cause instanceof CancellationException) {
                return;
            }
            sendError(ctx, getProxyErrorStatus(cause), cause.getMessage());
            return;
        }
        if (!ctx.channel().isActive()) {
            proxyResponse.getBody().subscribe(new CancellingSubscriber());
            return;
        }

        HttpResponse response =
                new DefaultHttpResponse(
                        HTTP_1_1, HttpResponseStatus.valueOf(proxyResponse.getStatusCode()));
        proxyResponse.getHeaders().forEach(response.headers()::add);
        if (!HttpUtil.isContentLengthSet(response) && mayHaveBody(method, response)) {
            if (keepAlive && supportsChunking) {
                HttpUtil.setTransferEncodingChunked(response, true);
            } else {
                // the end of the body is signalled by closing the connection
                keepAlive = false;
            }
        }
        HttpUtil.setKeepAlive(response, keepAlive);
        ctx.channel().writeAndFlush(response);

        proxyResponse
                .getBody()
                .subscribe(
                        new ChannelResponseSubscriber(
                                ctx.channel(),
                                lastWrite ->
                                        runInEventLoop(
                                                ctx, () -> completeResponse(ctx, lastWrite))));
    }

    private static HttpResponseStatus getProxyErrorStatus(Throwable cause) {
        if (cause instanceof ProxyException) {
            return ((ProxyException) cause).getKind() == ProxyException.Kind.TIMEOUT
                    ? HttpResponseStatus.GATEWAY_TIMEOUT
                    : HttpResponseStatus.BAD_GATEWAY;
        }
        if (cause instanceof IllegalArgumentException) {
            return HttpResponseStatus.BAD_REQUEST;
        }
        LOG.error("Unexpected proxy failure", cause);
        return HttpResponseStatus.INTERNAL_SERVER_ERROR;
    }

    private static boolean mayHaveBody(HttpMethod method, HttpResponse response) {
        int code = response.status().code();
        return !HttpMethod.HEAD.equals(method)
                && code >= 200
                && code != HttpResponseStatus.NO_CONTENT.code()
                && code != HttpResponseStatus.NOT_MODIFIED.code();
    }

    private void sendError(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", status.reasonPhrase());
        error.put("message", message == null ? status.reasonPhrase() : message);
        sendJson(ctx, status, error);
    }

    private void sendJson(ChannelHandlerContext ctx, HttpResponseStatus status, Object body) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize response", e);
            status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
            json =
                    "{\"error\":\"Internal Server Error\",\"message\":\"Serialization failed\"}"
                            .getBytes(StandardCharsets.UTF_8);
        }
        DefaultFullHttpResponse response =
                new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(json));
        response.headers().set(CONTENT_TYPE, APPLICATION_JSON);
        HttpUtil.setContentLength(response, json.length);
        HttpUtil.setKeepAlive(response, keepAlive);
        completeResponse(ctx, ctx.channel().writeAndFlush(response));
    }

    /**
     * Resumes reading the next request once the response was written, a connection with an
     * unfinished proxied request body is closed instead.
     */
    private void completeResponse(ChannelHandlerContext ctx, ChannelFuture lastWrite) {
        boolean unreadBody = requestBody != null && !requestComplete;
        requestBody = null;
        inFlight = false;
        if (!keepAlive || unreadBody) {
            lastWrite.addListener(ChannelFutureListener.CLOSE);
        } else {
            ctx.channel().config().setAutoRead(true);
        }
    }

    private static void runInEventLoop(ChannelHandlerContext ctx, Runnable task) {
        if (ctx.executor().inEventLoop()) {
            task.run();
        } else {
            ctx.executor().execute(task);
        }
    }

    /** Releases the backend connection of a response nobody is going to read. */
    private static class CancellingSubscriber implements Flow.Subscriber<List<ByteBuffer>> {

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            subscription.cancel();
        }

        @Override
        public void onNext(List<ByteBuffer> item) {}

        @Override
        public void onError(Throwable throwable) {}

        @Override
        public void onComplete() {}
    }
}
