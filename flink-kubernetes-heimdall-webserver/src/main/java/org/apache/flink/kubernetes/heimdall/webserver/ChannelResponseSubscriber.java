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

import org.apache.flink.shaded.netty4.io.netty.buffer.Unpooled;
import org.apache.flink.shaded.netty4.io.netty.channel.Channel;
import org.apache.flink.shaded.netty4.io.netty.channel.ChannelFuture;
import org.apache.flink.shaded.netty4.io.netty.channel.ChannelFutureListener;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.DefaultHttpContent;
import org.apache.flink.shaded.netty4.io.netty.handler.codec.http.LastHttpContent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.Flow;
import java.util.function.Consumer;

/**
 * Writes a proxied response body to the client channel. The next chunk is only requested from
 * the backend once the previous one was written, so a slow client slows down the backend read.
 */
class ChannelResponseSubscriber implements Flow.Subscriber<List<ByteBuffer>> {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelResponseSubscriber.class);

    private final Channel channel;
    private final Consumer<ChannelFuture> onLastContentWritten;

    private volatile Flow.Subscription subscription;
    private volatile boolean done;

    /**
     * @param onLastContentWritten invoked with the future of the last content write once the body
     *     was relayed completely
     */
    ChannelResponseSubscriber(Channel channel, Consumer<ChannelFuture> onLastContentWritten) {
        this.channel = channel;
        this.onLastContentWritten = onLastContentWritten;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        this.subscription = subscription;
        channel.closeFuture().addListener(future -> cancel());
        if (channel.isActive()) {
            subscription.request(1);
        } else {
            cancel();
        }
    }

    @Override
    public void onNext(List<ByteBuffer> buffers) {
        if (done) {
            return;
        }
        channel.writeAndFlush(
                        new DefaultHttpContent(
                                Unpooled.wrappedBuffer(buffers.toArray(new ByteBuffer[0]))))
                .addListener(
                        (ChannelFutureListener)
                                future -> {
                                    if (future.isSuccess()) {
                                        subscription.request(1);
                                    } else {
                                        LOG.debug(
                                                "Could not write response content to {}",
                                                channel,
                                                future.cause());
                                        cancel();
                                    }
                                });
    }

    @Override
    public void onError(Throwable throwable) {
        if (done) {
            return;
        }
        done = true;
        // the status line is already sent, the client can only notice the truncated body
        LOG.warn("Proxied response body to {} failed: {}", channel, throwable.toString());
        channel.close();
    }

    @Override
    public void onComplete() {
        if (done) {
            return;
        }
        done = true;
        onLastContentWritten.accept(channel.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT));
    }

    /** Stops reading from the backend, which releases the backend connection. */
    void cancel() {
        if (!done) {
            done = true;
            Flow.Subscription current = subscription;
            if (current != null) {
                current.cancel();
            }
        }
    }
}
