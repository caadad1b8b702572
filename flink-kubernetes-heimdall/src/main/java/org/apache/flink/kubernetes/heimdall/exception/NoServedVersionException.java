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

package org.apache.flink.kubernetes.heimdall.exception;

import javax.annotation.Nullable;

import java.util.List;

/**
 * Signals that none of the candidate API versions of a custom resource is served by the
 * Kubernetes API server, typically because the CRD is not installed.
 */
public class NoServedVersionException extends HeimdallException {

    private static final long serialVersionUID = 1L;

    private final String group;
    private final String plural;
    private final List<String> versions;

    public NoServedVersionException(
            String group, String plural, List<String> versions, @Nullable Throwable lastError) {
        super(
                String.format(
                        "Unable to query %s.%s: no served versions available (tried %s)",
                        plural, group, versions),
                lastError);
        this.group = group;
        this.plural = plural;
        this.versions = List.copyOf(versions);
    }

    public String getGroup() {
        return group;
    }

    public String getPlural() {
        return plural;
    }

    public List<String> getVersions() {
        return versions;
    }
}
