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

import java.net.URI;

/**
 * Failure to exchange a request with a proxied backend. Error responses sent by the backend
 * itself are not reported through this exception.
 */
public class ProxyException extends HeimdallException {

    private static final long serialVersionUID = 1L;

    /** What went wrong while talking to the backend. */
    public enum Kind {
        /** The backend could not be connected to or the connection broke. */
        UNREACHABLE,
        /** The backend did not answer in time. */
        TIMEOUT
    }

    private final Kind kind;
    private final String appName;
    private final URI target;

    public ProxyException(Kind kind, String appName, URI target, Throwable cause) {
        super(
                String.format(
                        "Proxy request for application '%s' to %s failed (%s): %s",
                        appName, target, kind, cause.getMessage()),
                cause);
        this.kind = kind;
        this.appName = appName;
        this.target = target;
    }

    public Kind getKind() {
        return kind;
    }

    public String getAppName() {
        return appName;
    }

    public URI getTarget() {
        return target;
    }
}
