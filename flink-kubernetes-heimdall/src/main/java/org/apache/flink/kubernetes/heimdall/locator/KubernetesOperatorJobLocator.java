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
import org.apache.flink.kubernetes.heimdall.client.FlinkDeploymentClient;
import org.apache.flink.kubernetes.heimdall.config.HeimdallConfiguration;
import org.apache.flink.util.ExceptionUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/** Locates jobs by listing the FlinkDeployment resources of the Flink Kubernetes Operator. */
public class KubernetesOperatorJobLocator implements FlinkJobLocator {

    private static final Logger LOG = LoggerFactory.getLogger(KubernetesOperatorJobLocator.class);

    private final FlinkDeploymentClient client;
    private final FlinkDeploymentNormalizer normalizer;
    private final String namespace;
    private final String labelSelector;
    private final boolean debug;

    public KubernetesOperatorJobLocator(
            HeimdallConfiguration config,
            FlinkDeploymentClient client,
            FlinkDeploymentNormalizer normalizer) {
        this.client = client;
        this.normalizer = normalizer;
        this.namespace = config.getNamespaceToWatch();
        this.labelSelector = config.getLabelSelector();
        this.debug = config.isDebug();
    }

    @Override
    public CompletableFuture<List<Job>> findAll() {
        return client.find(namespace, labelSelector)
                .whenComplete(
                        (documents, error) -> {
                            if (error != null) {
                                LOG.error(
                                        "Failed to list FlinkDeployments (namespace: {}, label selector: {})",
                                        namespace,
                                        labelSelector,
                                        ExceptionUtils.stripCompletionException(error));
                            } else if (debug) {
                                LOG.info(
                                        "Found {} FlinkDeployments (namespace: {}, label selector: {})",
                                        documents.size(),
                                        namespace,
                                        labelSelector);
                            }
                        })
                .thenApply(
                        documents ->
                                documents.stream()
                                        .map(normalizer::normalize)
                                        .collect(Collectors.toList()));
    }
}
