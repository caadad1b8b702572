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

package org.apache.flink.kubernetes.heimdall.config;

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.configuration.GlobalConfiguration;
import org.apache.flink.kubernetes.heimdall.locator.JobLocatorType;
import org.apache.flink.kubernetes.heimdall.utils.EnvUtils;

import lombok.Value;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

import static org.apache.flink.kubernetes.heimdall.utils.EnvUtils.ENV_CONF_DIR;
import static org.apache.flink.kubernetes.heimdall.utils.EnvUtils.ENV_LABEL_SELECTOR;
import static org.apache.flink.kubernetes.heimdall.utils.EnvUtils.ENV_WATCH_NAMESPACE;

/** Configuration class for heimdall. */
@Value
public class HeimdallConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(HeimdallConfiguration.class);

    public static final String DEFAULT_APP_VERSION = "0.0.0";

    JobLocatorType jobLocatorType;
    String namespaceToWatch;
    @Nullable String labelSelector;
    @Nullable String kubernetesContext;
    Duration jobsCacheTtl;
    Map<String, String> proxyTargets;
    String proxyDefaultTargetPattern;
    Duration proxyConnectTimeout;
    Duration proxyRequestTimeout;
    Map<String, String> uiPatterns;
    Map<String, String> uiEndpointPathPatterns;
    @Nullable String appVersion;
    boolean debug;
    int serverPort;

    /**
     * Loads the configuration from the directory given by {@code HEIMDALL_CONF_DIR}, or through
     * the default Flink lookup if unset, and applies the environment overrides.
     */
    public static HeimdallConfiguration load() {
        Configuration conf =
                EnvUtils.get(ENV_CONF_DIR)
                        .map(
                                dir -> {
                                    LOG.info("Loading configuration from {}", dir);
                                    return GlobalConfiguration.loadConfiguration(dir);
                                })
                        .orElseGet(GlobalConfiguration::loadConfiguration);
        return fromConfiguration(conf);
    }

    public static HeimdallConfiguration fromConfiguration(Configuration conf) {
        return fromConfiguration(conf, EnvUtils::get);
    }

    @VisibleForTesting
    static HeimdallConfiguration fromConfiguration(
            Configuration conf, Function<String, Optional<String>> env) {
        JobLocatorType jobLocatorType = conf.get(HeimdallConfigOptions.JOB_LOCATOR_TYPE);

        // environment wins over the config file
        String namespaceToWatch =
                env.apply(ENV_WATCH_NAMESPACE)
                        .orElseGet(() -> conf.get(HeimdallConfigOptions.NAMESPACE_TO_WATCH));
        String labelSelector =
                env.apply(ENV_LABEL_SELECTOR)
                        .orElseGet(() -> conf.get(HeimdallConfigOptions.LABEL_SELECTOR));

        String kubernetesContext = conf.get(HeimdallConfigOptions.KUBERNETES_CONTEXT);
        Duration jobsCacheTtl = conf.get(HeimdallConfigOptions.JOBS_CACHE_TTL);

        Map<String, String> proxyTargets =
                getPrefixedMap(conf, HeimdallConfigOptions.PROXY_TARGET_CONF_PREFIX);
        String proxyDefaultTargetPattern =
                conf.get(HeimdallConfigOptions.PROXY_DEFAULT_TARGET_PATTERN);
        Duration proxyConnectTimeout = conf.get(HeimdallConfigOptions.PROXY_CONNECT_TIMEOUT);
        Duration proxyRequestTimeout = conf.get(HeimdallConfigOptions.PROXY_REQUEST_TIMEOUT);

        Map<String, String> uiPatterns =
                getPrefixedMap(conf, HeimdallConfigOptions.UI_PATTERN_CONF_PREFIX);
        Map<String, String> uiEndpointPathPatterns =
                getPrefixedMap(conf, HeimdallConfigOptions.UI_ENDPOINT_PATH_PATTERN_CONF_PREFIX);

        String appVersion = conf.get(HeimdallConfigOptions.APP_VERSION);
        boolean debug = conf.get(HeimdallConfigOptions.DEBUG);
        int serverPort = conf.get(HeimdallConfigOptions.SERVER_PORT);

        return new HeimdallConfiguration(
                jobLocatorType,
                StringUtils.trim(namespaceToWatch),
                StringUtils.trimToNull(labelSelector),
                StringUtils.trimToNull(kubernetesContext),
                jobsCacheTtl,
                proxyTargets,
                proxyDefaultTargetPattern,
                proxyConnectTimeout,
                proxyRequestTimeout,
                uiPatterns,
                uiEndpointPathPatterns,
                StringUtils.trimToNull(appVersion),
                debug,
                serverPort);
    }

    /**
     * Version reported to clients: the configured one, else the implementation version of the
     * packaged jar, else {@value #DEFAULT_APP_VERSION}.
     */
    public String resolvedAppVersion() {
        if (appVersion != null) {
            return appVersion;
        }
        String implementationVersion =
                HeimdallConfiguration.class.getPackage().getImplementationVersion();
        return StringUtils.defaultIfBlank(implementationVersion, DEFAULT_APP_VERSION);
    }

    private static Map<String, String> getPrefixedMap(Configuration conf, String prefix) {
        Map<String, String> result = new TreeMap<>();
        conf.toMap()
                .forEach(
                        (key, value) -> {
                            if (key.startsWith(prefix) && key.length() > prefix.length()) {
                                result.put(key.substring(prefix.length()), value.trim());
                            }
                        });
        return Collections.unmodifiableMap(result);
    }
}
