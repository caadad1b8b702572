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

package org.apache.flink.kubernetes.heimdall.client;

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.kubernetes.heimdall.config.HeimdallConfiguration;
import org.apache.flink.kubernetes.heimdall.exception.NoServedVersionException;
import org.apache.flink.kubernetes.heimdall.utils.KubernetesClientUtils;
import org.apache.flink.util.concurrent.ExecutorThreadFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.net.HttpURLConnection;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Lists {@code FlinkDeployment} custom resources as raw JSON documents.
 *
 * <p>The operator has served the resource under different API versions over time, so every listing
 * probes the known versions in order and uses the first one the API server accepts. The Kubernetes
 * client is created on first use and shared afterwards.
 */
public class FlinkDeploymentClient implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FlinkDeploymentClient.class);

    public static final String GROUP = "flink.apache.org";
    public static final String PLURAL = "flinkdeployments";
    public static final String KIND = "FlinkDeployment";
    public static final List<String> VERSIONS = List.of("v1beta1", "v1");

    public static final Set<String> ALL_NAMESPACES = Set.of("*", "_all_", "ALL", "all");

    private static final int IO_THREADS = 2;

    private final Supplier<KubernetesClient> clientFactory;
    private final ExecutorService ioExecutor;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Object clientLock = new Object();

    private volatile KubernetesClient kubernetesClient;

    public FlinkDeploymentClient(HeimdallConfiguration config) {
        this(() -> KubernetesClientUtils.getKubernetesClient(config));
    }

    @VisibleForTesting
    public FlinkDeploymentClient(Supplier<KubernetesClient> clientFactory) {
        this.clientFactory = clientFactory;
        this.ioExecutor =
                Executors.newFixedThreadPool(
                        IO_THREADS, new ExecutorThreadFactory("heimdall-kubernetes-io"));
    }

    /**
     * Lists the FlinkDeployments of a namespace.
     *
     * @param namespace namespace to list, or one of {@link #ALL_NAMESPACES} for a cluster wide list
     * @param labelSelector optional label selector, passed to the API server as is
     * @return the resources as JSON trees, in the order returned by the API server
     */
    public CompletableFuture<List<JsonNode>> find(
            String namespace, @Nullable String labelSelector) {
        return CompletableFuture.supplyAsync(() -> list(namespace, labelSelector), ioExecutor);
    }

    @VisibleForTesting
    List<JsonNode> list(String namespace, @Nullable String labelSelector) {
        KubernetesClient client = getKubernetesClient();
        String selector = StringUtils.trimToNull(labelSelector);
        KubernetesClientException lastError = null;
        for (String version : VERSIONS) {
            try {
                GenericKubernetesResourceList resources =
                        list(client, version, namespace, selector);
                List<JsonNode> documents = new ArrayList<>(resources.getItems().size());
                for (GenericKubernetesResource resource : resources.getItems()) {
                    documents.add(objectMapper.valueToTree(resource));
                }
                LOG.debug(
                        "Listed {} {} in namespace {} using {}/{}",
                        documents.size(),
                        PLURAL,
                        namespace,
                        GROUP,
                        version);
                return documents;
            } catch (KubernetesClientException e) {
                if (!isVersionNotServed(e)) {
                    throw e;
                }
                LOG.debug("{}/{} {} not served: {}", GROUP, version, PLURAL, e.getMessage());
                lastError = e;
            }
        }
        throw new NoServedVersionException(GROUP, PLURAL, VERSIONS, lastError);
    }

    private static GenericKubernetesResourceList list(
            KubernetesClient client,
            String version,
            String namespace,
            @Nullable String labelSelector) {
        var resources = client.genericKubernetesResources(resourceContext(version));
        if (isAllNamespaces(namespace)) {
            var operation = resources.inAnyNamespace();
            return labelSelector == null
                    ? operation.list()
                    : operation.withLabelSelector(labelSelector).list();
        }
        var operation = resources.inNamespace(namespace);
        return labelSelector == null
                ? operation.list()
                : operation.withLabelSelector(labelSelector).list();
    }

    public static boolean isAllNamespaces(String namespace) {
        return ALL_NAMESPACES.contains(namespace);
    }

    @VisibleForTesting
    static ResourceDefinitionContext resourceContext(String version) {
        return new ResourceDefinitionContext.Builder()
                .withGroup(GROUP)
                .withVersion(version)
                .withPlural(PLURAL)
                .withKind(KIND)
                .withNamespaced(true)
                .build();
    }

    private static boolean isVersionNotServed(KubernetesClientException e) {
        return e.getCode() == HttpURLConnection.HTTP_BAD_REQUEST
                || e.getCode() == HttpURLConnection.HTTP_NOT_FOUND;
    }

    private KubernetesClient getKubernetesClient() {
        KubernetesClient client = kubernetesClient;
        if (client == null) {
            synchronized (clientLock) {
                client = kubernetesClient;
                if (client == null) {
                    // only assigned once creation succeeded, a failure is retried on the next call
                    client = clientFactory.get();
                    kubernetesClient = client;
                }
            }
        }
        return client;
    }

    @Override
    public void close() {
        ioExecutor.shutdownNow();
        synchronized (clientLock) {
            if (kubernetesClient != null) {
                kubernetesClient.close();
                kubernetesClient = null;
            }
        }
    }
}
