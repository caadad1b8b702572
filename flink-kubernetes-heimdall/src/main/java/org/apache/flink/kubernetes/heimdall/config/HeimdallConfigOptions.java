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

import org.apache.flink.annotation.docs.Documentation;
import org.apache.flink.configuration.ConfigOption;
import org.apache.flink.configuration.ConfigOptions;
import org.apache.flink.kubernetes.heimdall.locator.JobLocatorType;

import java.time.Duration;

/** This class holds configuration constants used by heimdall. */
public class HeimdallConfigOptions {

    public static final String HEIMDALL_CONF_PREFIX = "heimdall.";
    public static final String JOB_LOCATOR_CONF_PREFIX = HEIMDALL_CONF_PREFIX + "job-locator.";
    public static final String PROXY_TARGET_CONF_PREFIX = HEIMDALL_CONF_PREFIX + "proxy.target.";
    public static final String UI_PATTERN_CONF_PREFIX = HEIMDALL_CONF_PREFIX + "ui.pattern.";
    public static final String UI_ENDPOINT_PATH_PATTERN_CONF_PREFIX =
            HEIMDALL_CONF_PREFIX + "ui.endpoint-path-pattern.";
    public static final String APP_NAME_PLACEHOLDER = "{app}";

    public static final String SECTION_LOCATOR = "locator";
    public static final String SECTION_PROXY = "proxy";
    public static final String SECTION_SERVER = "server";

    public static ConfigOptions.OptionBuilder heimdallConfig(String key) {
        return ConfigOptions.key(HEIMDALL_CONF_PREFIX + key);
    }

    @Documentation.Section(SECTION_LOCATOR)
    public static final ConfigOption<JobLocatorType> JOB_LOCATOR_TYPE =
            heimdallConfig("job-locator.type")
                    .enumType(JobLocatorType.class)
                    .defaultValue(JobLocatorType.KUBERNETES_OPERATOR)
                    .withDescription("Strategy used to discover Flink jobs.");

    @Documentation.Section(SECTION_LOCATOR)
    public static final ConfigOption<String> NAMESPACE_TO_WATCH =
            heimdallConfig("job-locator.k8s-operator.namespace-to-watch")
                    .stringType()
                    .defaultValue("default")
                    .withDescription(
                            "Namespace to list FlinkDeployments from. Use '*', '_all_', 'all' or 'ALL' to list them in all namespaces.");

    @Documentation.Section(SECTION_LOCATOR)
    public static final ConfigOption<String> LABEL_SELECTOR =
            heimdallConfig("job-locator.k8s-operator.label-selector")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Optional Kubernetes label selector applied when listing FlinkDeployments.");

    @Documentation.Section(SECTION_LOCATOR)
    public static final ConfigOption<String> KUBERNETES_CONTEXT =
            heimdallConfig("kubernetes.context")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Kubeconfig context used when not running inside a Kubernetes cluster. The current context is used if not set.");

    @Documentation.Section(SECTION_LOCATOR)
    public static final ConfigOption<Duration> JOBS_CACHE_TTL =
            heimdallConfig("jobs-cache.ttl")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(10))
                    .withDescription(
                            "How long a job listing is served from cache. Zero disables caching.");

    @Documentation.Section(SECTION_PROXY)
    public static final ConfigOption<String> PROXY_DEFAULT_TARGET_PATTERN =
            heimdallConfig("proxy.default-target-pattern")
                    .stringType()
                    .defaultValue("http://" + APP_NAME_PLACEHOLDER + "-rest:8081")
                    .withDescription(
                            "Base URL used for applications without an explicit '"
                                    + PROXY_TARGET_CONF_PREFIX
                                    + "<app>' entry. '"
                                    + APP_NAME_PLACEHOLDER
                                    + "' is replaced with the application name.");

    @Documentation.Section(SECTION_PROXY)
    public static final ConfigOption<Duration> PROXY_CONNECT_TIMEOUT =
            heimdallConfig("proxy.connect-timeout")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(10))
                    .withDescription("Timeout for establishing connections to proxied backends.");

    @Documentation.Section(SECTION_PROXY)
    public static final ConfigOption<Duration> PROXY_REQUEST_TIMEOUT =
            heimdallConfig("proxy.request-timeout")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(60))
                    .withDescription(
                            "Time to wait for the response headers of a proxied backend.");

    @Documentation.Section(SECTION_SERVER)
    public static final ConfigOption<Integer> SERVER_PORT =
            heimdallConfig("server.port")
                    .intType()
                    .defaultValue(8088)
                    .withDescription("Port of the HTTP endpoint.");

    @Documentation.Section(SECTION_SERVER)
    public static final ConfigOption<String> APP_VERSION =
            heimdallConfig("app-version")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Version reported to the UI. Defaults to the version of the heimdall jar.");

    @Documentation.Section(SECTION_SERVER)
    public static final ConfigOption<Boolean> DEBUG =
            heimdallConfig("debug")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription("Log additional information about located jobs.");
}
