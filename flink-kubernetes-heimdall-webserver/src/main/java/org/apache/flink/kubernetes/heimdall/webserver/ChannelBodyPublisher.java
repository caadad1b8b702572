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

import org.apache.flink.shaded.netty4.io.netty.buffer.ByteBuf;
import org.apache.flink.shaded.netty4.io.netty.channel.Channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Flow;

/**
 * Publishes the body of an inbound request as it is read from the channel.
 *
 * <p>The channel must have auto read disabled: reads are only issued while the subscriber has
 * outstanding demand, so at most one read worth of content is buffered. All state is confined to
 * the event loop of the channel.
 */
class ChannelBodyPublisher implements Flow.Publisher<ByteBuffer> {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelBodyPublisher.class);

    private final Channel channel;
    private final Deque<ByteBuffer> buffered = new ArrayDeque<>();

    private Flow.Subscriber<? super ByteBuffer> subscriber;
    private long demand;
    private boolean completed;
    private Throwable failure;
    private boolean terminated;

    ChannelBodyPublisher(Channel channel) {
        this.channel = channel;
    }

    @Override
    public void subscribe(Flow.Subscriber<? super ByteBuffer> newSubscriber) {
        runInEventLoop(
                () -> {
                    if (subscriber != null) {
                        newSubscriber.onSubscribe(NoopSubscription.INSTANCE);
                        newSubscriber.onError(
                                new IllegalStateException(
                                        "Request body can only be subscribed once"));
                        return;
                    }
                    subscriber = newSubscriber;
                    subscriber.onSubscribe(new ChannelSubscription());
                    drain();
                });
    }

    /** Called by the handler for every content chunk, takes over the buffer. */
    void onContent(ByteBuf content) {
        try {
            if (terminated || !content.isReadable()) {
                return;
            }
            ByteBuffer copy = ByteBuffer.allocate(content.readableBytes());
            content.readBytes(copy);
            copy.flip();
            buffered.add(copy);
        } finally {
            content.release();
        }
        drain();
    }

    /** Called by the handler once the last content of the request was read. */
    void onComplete() {
        completed = true;
        drain();
    }

    /** Called by the handler if the request can not be read to its end. */
    void onError(Throwable error) {
        if (!completed) {
            failure = error;
            drain();
        }
    }

    boolean isCompleted() {
        return completed;
    }

    private void drain() {
        if (subscriber == null || terminated) {
            return;
        }
        while (demand > 0 && !buffered.isEmpty()) {
            demand--;
            subscriber.onNext(buffered.poll());
        }
        if (buffered.isEmpty()) {
            if (completed) {
                terminated = true;
                subscriber.onComplete();
            } else if (failure != null) {
                terminated = true;
                subscriber.onError(failure);
            } else if (demand > 0) {
                channel.read();
            }
        }
    }

    private void runInEventLoop(Runnable task) {
        if (channel.eventLoop().inEventLoop()) {
            task.run();
        } else {
            channel.eventLoop().execute(task);
        }
    }

    private class ChannelSubscription implements Flow.Subscription {

        @Override
        public void request(long n) {
            runInEventLoop(
                    () -> {
                        if (terminated) {
                            return;
                        }
                        if (n <= 0) {
                            terminated = true;
                            buffered.clear();
                            subscriber.onError(
                                    new IllegalArgumentException(
                                            "Demand must be positive, got " + n));
                            return;
                        }
                        demand = demand + n < 0 ? Long.MAX_VALUE : demand + n;
                        drain();
                    });
        }

        @Override
        public void cancel() {
            runInEventLoop(
                    () -> {
                        if (!terminated) {
                            LOG.debug("Request body subscription of {} cancelled", channel);
                            terminated = true;
                            buffered.clear();
                        }
                    });
        }
    }

    private enum NoopSubscription implements Flow.Subscription {
        INSTANCE;

        @Override
        public void request(long n) {}

        @Override
        public void cancel() {}
    }
}
