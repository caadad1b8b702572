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

package org.apache.flink.kubernetes.heimdall.locator;

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.kubernetes.heimdall.api.Job;

import lombok.Value;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Single slot cache of the latest successful job listing.
 *
 * <p>A listing younger than the TTL is served from the slot, anything else triggers the loader.
 * The slot is only replaced by a successful load, so a failing refresh leaves the previous listing
 * in place for the next caller. Concurrent misses are not coalesced and the last finished load
 * wins. A TTL of zero or less disables caching.
 */
public class JobListingCache {

    private final Duration ttl;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();

    private Clock clock = Clock.systemUTC();

    public JobListingCache(Duration ttl) {
        this.ttl = ttl;
    }

    public CompletableFuture<List<Job>> getOrLoad(Supplier<CompletableFuture<List<Job>>> loader) {
        if (!isEnabled()) {
            return loader.get();
        }
        Snapshot current = snapshot.get();
        if (current != null && isFresh(current)) {
            return CompletableFuture.completedFuture(current.getJobs());
        }
        return loader.get()
                .thenApply(
                        jobs -> {
                            List<Job> copy = List.copyOf(jobs);
                            snapshot.set(new Snapshot(copy, clock.instant()));
                            return copy;
                        });
    }

    /** Drops the cached listing, the next call loads again. */
    public void invalidate() {
        snapshot.set(null);
    }

    public boolean isEnabled() {
        return !ttl.isNegative() && !ttl.isZero();
    }

    @VisibleForTesting
    Optional<Snapshot> getSnapshot() {
        return Optional.ofNullable(snapshot.get());
    }

    @VisibleForTesting
    void setClock(Clock clock) {
        this.clock = clock;
    }

    private boolean isFresh(Snapshot current) {
        return Duration.between(current.getTimestamp(), clock.instant()).compareTo(ttl) < 0;
    }

    /** Cached listing and the time it was loaded. */
    @Value
    static class Snapshot {
        List<Job> jobs;
        Instant timestamp;
    }
}
