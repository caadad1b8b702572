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

package org.apache.flink.kubernetes.heimdall.api;

import org.apache.flink.annotation.Experimental;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Replica count and raw resource quantities of a JobManager or TaskManager. */
@Experimental
@Value
public class JobResources {

    /** Resources of a component the upstream resource says nothing about. */
    public static final JobResources EMPTY = new JobResources(0, "", "");

    /** Number of pod replicas, never negative. */
    int replicas;

    /** CPU as written in the resource, e.g. {@code 0.5} or {@code 500m}. */
    String cpu;

    /** Memory as written in the resource, e.g. {@code 1024m} or {@code 2g}. */
    String mem;

    @Builder(toBuilder = true)
    @Jacksonized
    private JobResources(int replicas, String cpu, String mem) {
        this.replicas = Math.max(0, replicas);
        this.cpu = cpu == null ? "" : cpu;
        this.mem = mem == null ? "" : mem;
    }

    public static JobResources of(int replicas, String cpu, String mem) {
        return new JobResources(replicas, cpu, mem);
    }
}
