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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/** Test for {@link FlinkDeploymentNormalizer}. */
public class FlinkDeploymentNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final FlinkDeploymentNormalizer normalizer = new FlinkDeploymentNormalizer();

    @Test
    public void testApplicationDeployment() throws IOException {
        Job job = normalizer.normalize(readDeployment("application.json"));

        assertEquals("0d7c1f8e-3b7a-4c39-9a2e-5a3cf4b1e2d1", job.getId());
        assertEquals("basic-example", job.getName());
        assertEquals("RUNNING", job.getStatus());
        assertEquals(JobType.APPLICATION, job.getType());
        assertEquals(1700000000000L, job.getStartTime());
        assertEquals("flink:1.18", job.getShortImage());
        assertEquals("1.18", job.getFlinkVersion());
        assertEquals(4, job.getParallelism());
        assertEquals(JobResources.of(1, "1", "2048m"), job.getResources().get(Job.JOB_MANAGER));
        assertEquals(JobResources.of(3, "0.5", "2048m"), job.getResources().get(Job.TASK_MANAGER));
        assertEquals(Map.of("app", "basic-example", "team", "data"), job.getMetadata());
    }

    @Test
    public void testApplicationDeploymentWithOperatorManagedReplicas() throws IOException {
        Job job = normalizer.normalize(readDeployment("application-derived.json"));

        assertEquals(JobType.APPLICATION, job.getType());
        assertEquals("DEPLOYING", job.getStatus());
        assertNull(job.getStartTime());
        assertEquals("flink:1.19", job.getShortImage());
        assertEquals("1.19", job.getFlinkVersion());
        // slots and replicas are both set, replicas being 0
        assertEquals(0, job.getParallelism());
        assertEquals(JobResources.of(0, "500m", "1g"), job.getResources().get(Job.JOB_MANAGER));
        assertEquals(JobResources.of(5, "", "4g"), job.getResources().get(Job.TASK_MANAGER));
        assertEquals(Map.of(), job.getMetadata());
    }

    @Test
    public void testSessionDeployment() throws IOException {
        Job job = normalizer.normalize(readDeployment("session.json"));

        assertEquals(JobType.SESSION, job.getType());
        assertEquals(Job.UNKNOWN_STATUS, job.getStatus());
        assertNull(job.getStartTime());
        assertEquals("flink:1.17", job.getShortImage());
        assertEquals("1.17", job.getFlinkVersion());
        assertEquals(0, job.getParallelism());
        assertEquals(JobResources.of(1, "1.0", "1024m"), job.getResources().get(Job.JOB_MANAGER));
        // no fallback to the observed replicas for session clusters
        assertEquals(JobResources.of(0, "2", "4096m"), job.getResources().get(Job.TASK_MANAGER));
    }

    @Test
    public void testMalformedDeployment() throws IOException {
        Job job = normalizer.normalize(readDeployment("malformed.json"));

        assertEquals("", job.getId());
        assertEquals("", job.getName());
        assertEquals(Job.UNKNOWN_STATUS, job.getStatus());
        assertEquals(JobType.APPLICATION, job.getType());
        assertNull(job.getStartTime());
        assertEquals("", job.getShortImage());
        assertEquals("", job.getFlinkVersion());
        assertEquals(0, job.getParallelism());
        assertEquals(JobResources.EMPTY, job.getResources().get(Job.JOB_MANAGER));
        assertEquals(JobResources.EMPTY, job.getResources().get(Job.TASK_MANAGER));
        assertEquals(Map.of(), job.getMetadata());
    }

    @Test
    public void testEmptyDocument() throws IOException {
        for (String document : new String[] {"{}", "null", "[]", "\"text\""}) {
            Job job = normalizer.normalize(objectMapper.readTree(document));

            assertEquals(JobType.SESSION, job.getType());
            assertEquals(Job.UNKNOWN_STATUS, job.getStatus());
            assertEquals(0, job.getParallelism());
            assertEquals("", job.getShortImage());
            assertEquals("", job.getFlinkVersion());
            assertEquals("", job.getId());
            assertEquals("", job.getName());
            assertEquals(JobResources.EMPTY, job.getResources().get(Job.JOB_MANAGER));
            assertEquals(JobResources.EMPTY, job.getResources().get(Job.TASK_MANAGER));
        }
    }

    @Test
    public void testParallelismFromTaskSlots() throws IOException {
        Job job =
                normalize(
                        "{'spec': {'flinkConfiguration': {'taskmanager.numberOfTaskSlots': '2'},"
                                + " 'taskManager': {'replicas': 3}, 'job': {'parallelism': 0}}}");
        assertEquals(6, job.getParallelism());

        job =
                normalize(
                        "{'spec': {'flinkConfiguration': {'taskmanager': {'numberOfTaskSlots': 4}},"
                                + " 'taskManager': {'replicas': '2'}}}");
        assertEquals(8, job.getParallelism());

        job =
                normalize(
                        "{'spec': {'flinkConfiguration': {'taskmanager.numberOfTaskSlots': 'x'},"
                                + " 'taskManager': {'replicas': 3}}}");
        assertEquals(0, job.getParallelism());

        job = normalize("{'spec': {'taskManager': {'replicas': 3}}}");
        assertEquals(0, job.getParallelism());
    }

    @Test
    public void testJobParallelismWins() throws IOException {
        Job job =
                normalize(
                        "{'spec': {'flinkConfiguration': {'taskmanager.numberOfTaskSlots': '2'},"
                                + " 'taskManager': {'replicas': 3}, 'job': {'parallelism': 4}}}");
        assertEquals(4, job.getParallelism());
    }

    @Test
    public void testImageAndVersion() throws IOException {
        Job job =
                normalize(
                        "{'spec': {'image': 'docker.io/library/flink:1.18',"
                                + " 'flinkVersion': 'v1_20'}}");
        assertEquals("library/flink:1.18", job.getShortImage());
        assertEquals("1.20", job.getFlinkVersion());

        job = normalize("{'spec': {'image': 'flink:1.18', 'flinkVersion': '1.18'}}");
        assertEquals("flink:1.18", job.getShortImage());
        assertEquals("1.18", job.getFlinkVersion());
    }

    @Test
    public void testStatusFallbacks() throws IOException {
        assertEquals(
                "FAILED",
                normalize("{'status': {'jobStatus': {'state': 'FAILED'}, 'state': 'X'}}")
                        .getStatus());
        assertEquals("X", normalize("{'status': {'jobStatus': {}, 'state': 'X'}}").getStatus());
        assertEquals(
                "",
                normalize("{'status': {'jobStatus': {'state': ''}, 'state': 'DEPLOYED'}}")
                        .getStatus());
        assertEquals(12L, normalize("{'status': {'jobStatus': {'startTime': 12}}}").getStartTime());
        assertNull(normalize("{'status': {'jobStatus': {'startTime': 'soon'}}}").getStartTime());
        assertNull(
                normalize("{'status': {'jobStatus': {'startTime': '1e2000000000'}}}")
                        .getStartTime());
    }

    @Test
    public void testNormalizeIsRepeatable() throws IOException {
        JsonNode document = readDeployment("application.json");
        assertEquals(normalizer.normalize(document), normalizer.normalize(document));
    }

    private Job normalize(String json) throws IOException {
        return normalizer.normalize(objectMapper.readTree(json.replace('\'', '"')));
    }

    private JsonNode readDeployment(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/deployments/" + name)) {
            return objectMapper.readTree(in);
        }
    }
}
