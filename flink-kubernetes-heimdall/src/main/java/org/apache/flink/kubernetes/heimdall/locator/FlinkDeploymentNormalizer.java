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

import org.apache.flink.kubernetes.heimdall.api.Job;
import org.apache.flink.kubernetes.heimdall.api.JobResources;
import org.apache.flink.kubernetes.heimdall.api.JobType;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;
import java.util.Optional;

import static org.apache.flink.kubernetes.heimdall.utils.JsonNodeUtils.getLong;
import static org.apache.flink.kubernetes.heimdall.utils.JsonNodeUtils.getStringMap;
import static org.apache.flink.kubernetes.heimdall.utils.JsonNodeUtils.getText;
import static org.apache.flink.kubernetes.heimdall.utils.JsonNodeUtils.isPresent;
import static org.apache.flink.kubernetes.heimdall.utils.JsonNodeUtils.path;

/**
 * Turns a raw {@code FlinkDeployment} document into a {@link Job}.
 *
 * <p>Documents come from operator versions with different schemas, so every field is optional: a
 * missing or malformed value falls back to the default of the corresponding {@link Job} field and
 * never fails the conversion.
 */
public class FlinkDeploymentNormalizer {

    public static final String NUM_TASK_SLOTS_KEY = "taskmanager.numberOfTaskSlots";

    private static final String METADATA = "metadata";
    private static final String SPEC = "spec";
    private static final String STATUS = "status";
    private static final String JOB_MANAGER = "jobManager";
    private static final String TASK_MANAGER = "taskManager";
    private static final String RESOURCE = "resource";
    private static final String REPLICAS = "replicas";

    public Job normalize(JsonNode document) {
        JsonNode spec = path(document, SPEC);
        JsonNode status = path(document, STATUS);

        JobType type = isPresent(spec, "job") ? JobType.APPLICATION : JobType.SESSION;
        JobResources jobManager =
                getResources(spec, JOB_MANAGER, getReplicas(spec, JOB_MANAGER));
        JobResources taskManager =
                getResources(spec, TASK_MANAGER, getTaskManagerReplicas(spec, status, type));

        return Job.builder()
                .id(getText(document, METADATA, "uid").orElse(""))
                .name(getText(document, METADATA, "name").orElse(""))
                .status(getStatus(status))
                .type(type)
                .startTime(getLong(status, "jobStatus", "startTime").orElse(null))
                .shortImage(getShortImage(spec))
                .flinkVersion(getFlinkVersion(spec))
                .parallelism(getParallelism(spec))
                .resources(Map.of(Job.JOB_MANAGER, jobManager, Job.TASK_MANAGER, taskManager))
                .metadata(getStringMap(document, METADATA, "labels"))
                .build();
    }

    private static String getStatus(JsonNode status) {
        return getText(status, "jobStatus", "state")
                .or(() -> getText(status, "state"))
                .orElse(Job.UNKNOWN_STATUS);
    }

    private static String getShortImage(JsonNode spec) {
        String image = getText(spec, "image").orElse("");
        int separator = image.indexOf('/');
        return separator < 0 ? image : image.substring(separator + 1);
    }

    private static String getFlinkVersion(JsonNode spec) {
        return getText(spec, "flinkVersion")
                .map(version -> StringUtils.remove(version.replace('_', '.'), 'v'))
                .orElse("");
    }

    private static int getParallelism(JsonNode spec) {
        long jobParallelism = getLong(spec, "job", "parallelism").orElse(0L);
        if (jobParallelism != 0) {
            return toInt(jobParallelism);
        }

        JsonNode slots = getNumTaskSlotsNode(spec);
        JsonNode replicas = path(spec, TASK_MANAGER, REPLICAS);
        if (slots.isMissingNode() || replicas.isMissingNode()) {
            return 0;
        }
        Optional<Long> slotCount = getLong(slots);
        Optional<Long> replicaCount = getLong(replicas);
        if (slotCount.isEmpty() || replicaCount.isEmpty()) {
            return 0;
        }
        try {
            return toInt(Math.multiplyExact(slotCount.get(), replicaCount.get()));
        } catch (ArithmeticException e) {
            return 0;
        }
    }

    /** Reads the slot count from a flat or a nested flinkConfiguration. */
    private static JsonNode getNumTaskSlotsNode(JsonNode spec) {
        JsonNode flinkConfiguration = path(spec, "flinkConfiguration");
        JsonNode flat = path(flinkConfiguration, NUM_TASK_SLOTS_KEY);
        if (!flat.isMissingNode()) {
            return flat;
        }
        return path(flinkConfiguration, NUM_TASK_SLOTS_KEY.split("\\."));
    }

    private static int getReplicas(JsonNode spec, String component) {
        return toInt(getLong(spec, component, REPLICAS).orElse(0L));
    }

    private static int getTaskManagerReplicas(JsonNode spec, JsonNode status, JobType type) {
        int replicas = getReplicas(spec, TASK_MANAGER);
        if (replicas == 0 && type == JobType.APPLICATION) {
            // application clusters usually leave the count to the operator
            return toInt(getLong(status, TASK_MANAGER, REPLICAS).orElse(0L));
        }
        return replicas;
    }

    private static JobResources getResources(JsonNode spec, String component, int replicas) {
        JsonNode resource = path(spec, component, RESOURCE);
        return JobResources.of(
                replicas, getQuantity(resource, "cpu"), getQuantity(resource, "memory"));
    }

    /** Quantity in its textual form, empty for absent or zero values. */
    private static String getQuantity(JsonNode resource, String field) {
        JsonNode quantity = path(resource, field);
        if (quantity.isNumber()) {
            return quantity.decimalValue().signum() == 0 ? "" : quantity.asText();
        }
        return getText(quantity).orElse("");
    }

    private static int toInt(long value) {
        return (int) Math.max(0, Math.min(Integer.MAX_VALUE, value));
    }
}
