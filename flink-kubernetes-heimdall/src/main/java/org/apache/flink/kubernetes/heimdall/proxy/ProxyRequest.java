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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import javax.annotation.Nullable;

import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Flow;

/** Inbound request to be forwarded to the backend of an application. */
@Value
@Builder
public class ProxyRequest {

    /** Length value for bodies whose size is not known upfront. */
    public static final long UNKNOWN_LENGTH = -1;

    /** Routing key of the backend. */
    @NonNull String appName;

    @NonNull String method;

    /** Raw (still encoded) path below the application, empty or starting with {@code /}. */
    @Builder.Default String path = "";

    /** Raw query string without the leading {@code ?}. */
    @Nullable String query;

    @Builder.Default Map<String, List<String>> headers = Collections.emptyMap();

    /** Request body, null if the request has none. */
    @Nullable Flow.Publisher<ByteBuffer> body;

    @Builder.Default long contentLength = UNKNOWN_LENGTH;
}
