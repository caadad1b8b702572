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

package org.apache.flink.kubernetes.heimdall.utils;

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.kubernetes.heimdall.config.HeimdallConfiguration;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

import static org.apache.flink.kubernetes.heimdall.utils.EnvUtils.ENV_KUBERNETES_SERVICE_HOST;
import static org.apache.flink.kubernetes.heimdall.utils.EnvUtils.ENV_KUBERNETES_SERVICE_PORT;

/** Kubernetes client utils. */
public class KubernetesClientUtils {

    private static final Logger LOG = LoggerFactory.getLogger(KubernetesClientUtils.class);

    @VisibleForTesting
    static final Path SERVICE_ACCOUNT_DIR =
            Paths.get("/var/run/secrets/kubernetes.io/serviceaccount");

    private static final String TOKEN_FILE = "token";
    private static final String CA_CERT_FILE = "ca.crt";
    private static final String NAMESPACE_FILE = "namespace";

    /**
     * Creates a client using the pod service account when running inside a cluster, and the local
     * kubeconfig (optionally with the configured context) otherwise.
     */
    public static KubernetesClient getKubernetesClient(HeimdallConfiguration config) {
        Config clientConfig =
                getInClusterConfig(SERVICE_ACCOUNT_DIR)
                        .orElseGet(
                                () -> {
                                    LOG.info(
                                            "Not running in a cluster, using kubeconfig"
                                                    + " (context: {})",
                                            config.getKubernetesContext() == null
                                                    ? "<current>"
                                                    : config.getKubernetesContext());
                                    return Config.autoConfigure(config.getKubernetesContext());
                                });
        return getKubernetesClient(clientConfig);
    }

    @VisibleForTesting
    public static KubernetesClient getKubernetesClient(Config kubernetesClientConfig) {
        return new KubernetesClientBuilder().withConfig(kubernetesClientConfig).build();
    }

    @VisibleForTesting
    static Optional<Config> getInClusterConfig(Path serviceAccountDir) {
        Optional<String> host = EnvUtils.get(ENV_KUBERNETES_SERVICE_HOST);
        Optional<String> port = EnvUtils.get(ENV_KUBERNETES_SERVICE_PORT);
        Path tokenFile = serviceAccountDir.resolve(TOKEN_FILE);
        if (host.isEmpty() || port.isEmpty() || !Files.isReadable(tokenFile)) {
            return Optional.empty();
        }
        return Optional.of(buildInClusterConfig(host.get(), port.get(), serviceAccountDir));
    }

    @VisibleForTesting
    static Config buildInClusterConfig(String host, String port, Path serviceAccountDir) {
        String hostPart = host.contains(":") ? "[" + host + "]" : host;
        String masterUrl = "https://" + hostPart + ":" + port;
        Path caCert = serviceAccountDir.resolve(CA_CERT_FILE);
        // re-read on every refresh, projected service account tokens are rotated
        Path tokenFile = serviceAccountDir.resolve(TOKEN_FILE);
        LOG.info("Using in-cluster service account credentials for {}", masterUrl);
        return new ConfigBuilder(Config.empty())
                .withMasterUrl(masterUrl)
                .withCaCertFile(Files.isReadable(caCert) ? caCert.toString() : null)
                .withOauthTokenProvider(() -> readTrimmed(tokenFile))
                .withNamespace(readOptional(serviceAccountDir.resolve(NAMESPACE_FILE)))
                .build();
    }

    @Nullable
    private static String readOptional(Path file) {
        return Files.isReadable(file) ? readTrimmed(file) : null;
    }

    private static String readTrimmed(Path file) {
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        }
    }
}
