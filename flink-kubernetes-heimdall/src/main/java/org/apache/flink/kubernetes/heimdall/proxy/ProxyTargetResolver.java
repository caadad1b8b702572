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

package org.apache.flink.kubernetes.heimdall.proxy;

import org.apache.flink.kubernetes.heimdall.config.HeimdallConfigOptions;
import org.apache.flink.kubernetes.heimdall.config.HeimdallConfiguration;

import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;

import java.net.URI;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps application names to backend base URLs. Explicitly configured targets win, other names are
 * substituted into the default target pattern.
 */
public class ProxyTargetResolver {

    private static final Pattern DNS_1123_LABEL = Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?");
    private static final int DNS_1123_LABEL_MAX_LENGTH = 63;

    private final Map<String, String> targets;
    private final String defaultTargetPattern;

    public ProxyTargetResolver(HeimdallConfiguration config) {
        this(config.getProxyTargets(), config.getProxyDefaultTargetPattern());
    }

    public ProxyTargetResolver(Map<String, String> targets, String defaultTargetPattern) {
        this.targets = Map.copyOf(targets);
        this.defaultTargetPattern = defaultTargetPattern;
    }

    /**
     * Base URL of the application backend.
     *
     * @throws IllegalArgumentException if the name is not configured and not a valid DNS label
     */
    public URI resolve(String appName) {
        String configured = targets.get(appName);
        if (configured != null) {
            return URI.create(configured);
        }
        if (!isValidAppName(appName)) {
            throw new IllegalArgumentException("Invalid application name: " + appName);
        }
        return URI.create(
                StringUtils.replace(
                        defaultTargetPattern, HeimdallConfigOptions.APP_NAME_PLACEHOLDER, appName));
    }

    /**
     * URL of a request below the application backend.
     *
     * @param path raw path, empty or starting with {@code /}
     * @param query raw query string without {@code ?}
     */
    public URI resolve(String appName, String path, @Nullable String query) {
        String base = StringUtils.removeEnd(resolve(appName).toString(), "/");
        StringBuilder target = new StringBuilder(base);
        if (StringUtils.isNotEmpty(path)) {
            if (!path.startsWith("/")) {
                target.append('/');
            }
            target.append(path);
        }
        if (StringUtils.isNotEmpty(query)) {
            target.append('?').append(query);
        }
        return URI.create(target.toString());
    }

    public static boolean isValidAppName(@Nullable String appName) {
        return appName != null
                && appName.length() <= DNS_1123_LABEL_MAX_LENGTH
                && DNS_1123_LABEL.matcher(appName).matches();
    }
}
