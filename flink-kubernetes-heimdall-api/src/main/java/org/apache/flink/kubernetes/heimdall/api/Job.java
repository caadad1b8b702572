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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import javax.annotation.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized, read-only view of a Flink job deployment.
 *
 * <p>Instances are snapshots created per lookup. Strings are never null, the {@link #resources}
 * map always holds a {@link #JOB_MANAGER} and a {@link #TASK_MANAGER} entry and all maps are
 * unmodifiable.
 */
@Experimental
@Value
@JsonPropertyOrder({
    "id",
    "name",
    "status",
    "type",
    "startTime",
    "shortImage",
    "flinkVersion",
    "parallelism",
    "resources",
    "metadata"
})
public class Job {

    public static final String JOB_MANAGER = "jm";
    public static final String TASK_MANAGER = "tm";
    public static final String UNKNOWN_STATUS = "UNKNOWN";

    /** Kubernetes UID of the resource. */
    String id;

    /** Name of the resource. */
    String name;

    /** Job state reported by the operator or {@link #UNKNOWN_STATUS}. */
    String status;

    JobType type;

    /** Job start time reported by the operator, null when the job is not running. */
    @Nullable Long startTime;

    /** Image reference without its registry part. */
    String shortImage;

    /** Flink version in dotted form, e.g. {@code 1.18}. */
    String flinkVersion;

    int parallelism;

    Map<String, JobResources> resources;

    /** Labels of the resource. */
    Map<String, String> metadata;

    @Builder(toBuilder = true)
    @Jacksonized
    private Job(
            String id,
            String name,
            String status,
            @NonNull JobType type,
            @Nullable Long startTime,
            String shortImage,
            String flinkVersion,
            int parallelism,
            Map<String, JobResources> resources,
            Map<String, String> metadata) {
        this.id = nullToEmpty(id);
        this.name = nullToEmpty(name);
        this.status = status == null ? UNKNOWN_STATUS : status;
        this.type = type;
        this.startTime = startTime;
        this.shortImage = nullToEmpty(shortImage);
        this.flinkVersion = nullToEmpty(flinkVersion);
        this.parallelism = Math.max(0, parallelism);
        this.resources = completeResources(resources);
        this.metadata =
                metadata == null
                        ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    private static Map<String, JobResources> completeResources(
            @Nullable Map<String, JobResources> resources) {
        var complete = new LinkedHashMap<String, JobResources>();
        complete.put(JOB_MANAGER, JobResources.EMPTY);
        complete.put(TASK_MANAGER, JobResources.EMPTY);
        if (resources != null) {
            resources.forEach(
                    (component, value) -> {
                        if (complete.containsKey(component) && value != null) {
                            complete.put(component, value);
                        }
                    });
        }
        return Collections.unmodifiableMap(complete);
    }

    private static String nullToEmpty(@Nullable String value) {
        return value == null ? "" : value;
    }
}
