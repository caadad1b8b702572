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

import org.apache.flink.configuration.Configuration;
import org.apache.flink.kubernetes.heimdall.api.Job;
import org.apache.flink.kubernetes.heimdall.api.JobType;
import org.apache.flink.kubernetes.heimdall.client.FlinkDeploymentClient;
import org.apache.flink.kubernetes.heimdall.config.HeimdallConfigOptions;
import org.apache.flink.kubernetes.heimdall.config.HeimdallConfiguration;
import org.apache.flink.kubernetes.heimdall.exception.NoServedVersionException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Test for {@link KubernetesOperatorJobLocator}. */
public class KubernetesOperatorJobLocatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<String> queries = new ArrayList<>();

    private TestingFlinkDeploymentClient client;

    @AfterEach
    public void cleanup() {
        if (client != null) {
            client.close();
        }
    }

    @Test
    public void testFindAllKeepsOrder() throws Exception {
        client =
                new TestingFlinkDeploymentClient(
                        CompletableFuture.completedFuture(
                                List.of(
                                        deployment("b-job", true),
                                        deployment("a-session", false),
                                        deployment("c-job", true))));
        var locator = createLocator(Map.of(HeimdallConfigOptions.DEBUG.key(), "true"));

        List<Job> jobs = locator.findAll().get();

        assertThat(jobs).extracting(Job::getName).containsExactly("b-job", "a-session", "c-job");
        assertThat(jobs)
                .extracting(Job::getType)
                .containsExactly(JobType.APPLICATION, JobType.SESSION, JobType.APPLICATION);
        assertEquals(List.of("default|null"), queries);
    }

    @Test
    public void testNamespaceAndSelectorArePassed() throws Exception {
        client = new TestingFlinkDeploymentClient(CompletableFuture.completedFuture(List.of()));
        var locator =
                createLocator(
                        Map.of(
                                HeimdallConfigOptions.NAMESPACE_TO_WATCH.key(), "*",
                                HeimdallConfigOptions.LABEL_SELECTOR.key(), "env=prod"));

        assertThat(locator.findAll().get()).isEmpty();
        assertEquals(List.of("*|env=prod"), queries);
    }

    @Test
    public void testErrorsArePropagated() {
        var error = new NoServedVersionException("g", "p", List.of("v1"), null);
        client = new TestingFlinkDeploymentClient(CompletableFuture.failedFuture(error));
        var locator = createLocator(Map.of());

        var exception = assertThrows(CompletionException.class, () -> locator.findAll().join());
        assertInstanceOf(NoServedVersionException.class, exception.getCause());
    }

    @Test
    public void testFactoryCreatesConfiguredLocator() {
        client = new TestingFlinkDeploymentClient(CompletableFuture.completedFuture(List.of()));
        var config = HeimdallConfiguration.fromConfiguration(new Configuration());

        assertInstanceOf(
                KubernetesOperatorJobLocator.class, JobLocatorFactory.create(config, client));
    }

    private FlinkJobLocator createLocator(Map<String, String> conf) {
        var config = HeimdallConfiguration.fromConfiguration(Configuration.fromMap(conf));
        return new KubernetesOperatorJobLocator(config, client, new FlinkDeploymentNormalizer());
    }

    private JsonNode deployment(String name, boolean application) {
        var document = objectMapper.createObjectNode();
        document.putObject("metadata").put("name", name);
        var spec = document.putObject("spec");
        if (application) {
            spec.putObject("job").put("parallelism", 1);
        }
        return document;
    }

    private class TestingFlinkDeploymentClient extends FlinkDeploymentClient {

        private final CompletableFuture<List<JsonNode>> result;

        TestingFlinkDeploymentClient(CompletableFuture<List<JsonNode>> result) {
            super(
                    () -> {
                        throw new IllegalStateException("No Kubernetes access in tests");
                    });
            this.result = result;
        }

        @Override
        public CompletableFuture<List<JsonNode>> find(
                String namespace, @Nullable String labelSelector) {
            queries.add(namespace + "|" + labelSelector);
            return result;
        }
    }
}
