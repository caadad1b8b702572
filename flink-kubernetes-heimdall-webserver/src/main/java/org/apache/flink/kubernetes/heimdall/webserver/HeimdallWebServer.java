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

import org.apache.flink.kubernetes.heimdall.client.FlinkDeploymentClient;
import org.apache.flink.kubernetes.heimdall.config.HeimdallConfiguration;
import org.apache.flink.kubernetes.heimdall.locator.FlinkJobLocator;
import org.apache.flink.kubernetes.heimdall.locator.JobListingCache;
import org.apache.flink.kubernetes.heimdall.locator.JobLocatorFactory;
import org.apache.flink.kubernetes.heimdall.proxy.StreamingProxy;
import org.apache.flink.kubernetes.heimdall.utils.EnvUtils;

import org.apache.flink.shaded.netty4.io.netty.bootstrap.ServerBootstrap;
import org.apache.flink.shaded.netty4.io.netty.channel.Channel;
import org.apache.flink.shaded.netty4.io.netty.channel.ChannelInitializer;
import org.apache.flink.shaded.netty4.io.netty.channel.nio.NioEventLoopGroup;
import org.apache.flink.shaded.netty4.io.netty.channel.socket.SocketChannel;
import org.apache.flink.shaded.netty4.io.netty.channel.socket.nio.NioServerSocketChannel;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.HttpServerCodec;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.HttpServerExpectContinueHandler;
import org.apache.flink.shaded.netty4.io.netty.handler.stream.ChunkedWriteHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;

/** Main class of the heimdall web server. */
public class HeimdallWebServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(HeimdallWebServer.class);

    private final HeimdallConfiguration config;
    private final FlinkJobLocator jobLocator;
    private final JobListingCache jobListingCache;
    private final StreamingProxy proxy;

    private NioEventLoopGroup bossGroup;
    private NioEventLoopGroup workerGroup;
    private Channel serverChannel;

    public HeimdallWebServer(
            HeimdallConfiguration config,
            FlinkJobLocator jobLocator,
            JobListingCache jobListingCache,
            StreamingProxy proxy) {
        this.config = config;
        this.jobLocator = jobLocator;
        this.jobListingCache = jobListingCache;
        this.proxy = proxy;
    }

    public static void main(String[] args) throws Exception {
        EnvUtils.logEnvironmentInfo(LOG, "Flink Kubernetes Heimdall", args);
        HeimdallConfiguration config = HeimdallConfiguration.load();
        try (FlinkDeploymentClient client = new FlinkDeploymentClient(config);
                HeimdallWebServer server =
                        new HeimdallWebServer(
                                config,
                                JobLocatorFactory.create(config, client),
                                new JobListingCache(config.getJobsCacheTtl()),
                                new StreamingProxy(config))) {
            server.start(config.getServerPort());
            server.awaitTermination();
        }
    }

    /**
     * Binds the server.
     *
     * @param port port to listen on, 0 picks a free port
     */
    public synchronized void start(int port) throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Web server already started");
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(createChannelInitializer());

            serverChannel = bootstrap.bind(port).sync().channel();
        } catch (Exception e) {
            shutdownEventLoops();
            throw e;
        }

        InetSocketAddress bindAddress = (InetSocketAddress) serverChannel.localAddress();
        InetAddress inetAddress = bindAddress.getAddress();
        LOG.info(
                "Heimdall listening at {}" + ':' + "{}",
                inetAddress.getHostAddress(),
                bindAddress.getPort());
        if (config.isDebug()) {
            LOG.info("Running with configuration {}", config);
        }
    }

    public synchronized int getPort() {
        if (serverChannel == null) {
            throw new IllegalStateException("Web server not started");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    /** Blocks until the server channel is closed. */
    public void awaitTermination() throws InterruptedException {
        Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    @Override
    public synchronized void close() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        shutdownEventLoops();
    }

    private void shutdownEventLoops() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
    }

    private ChannelInitializer<SocketChannel> createChannelInitializer() {
        return new ChannelInitializer<>() {

            @Override
            protected void initChannel(SocketChannel ch) {
                ch.pipeline()
                        .addLast(new HttpServerCodec())
                        .addLast(new HttpServerExpectContinueHandler())
                        .addLast(new ChunkedWriteHandler())
                        .addLast(
                                HeimdallHttpHandler.class.getName(),
                                new HeimdallHttpHandler(
                                        config, jobLocator, jobListingCache, proxy));
            }
        };
    }
}
