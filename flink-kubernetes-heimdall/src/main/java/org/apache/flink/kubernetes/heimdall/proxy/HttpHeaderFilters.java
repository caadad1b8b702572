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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Header rules applied when relaying requests and responses between client and backend. */
public class HttpHeaderFilters {

    /** Connection specific headers that are never relayed. */
    public static final Set<String> HOP_BY_HOP_HEADERS =
            Set.of(
                    "host",
                    "connection",
                    "keep-alive",
                    "proxy-authenticate",
                    "proxy-authorization",
                    "te",
                    "trailers",
                    "transfer-encoding",
                    "upgrade");

    /**
     * Request headers set by the HTTP client itself. Bodies are relayed without decoding, hence
     * compression is not negotiated with the backend.
     */
    public static final Set<String> CLIENT_MANAGED_REQUEST_HEADERS =
            Set.of("content-length", "expect", "accept-encoding");

    public static final Set<String> STRIPPED_RESPONSE_HEADERS = Set.of("content-encoding");

    private HttpHeaderFilters() {}

    public static Map<String, List<String>> filterRequestHeaders(
            Map<String, List<String>> headers) {
        return filter(headers, CLIENT_MANAGED_REQUEST_HEADERS);
    }

    public static Map<String, List<String>> filterResponseHeaders(
            Map<String, List<String>> headers) {
        return filter(headers, STRIPPED_RESPONSE_HEADERS);
    }

    private static Map<String, List<String>> filter(
            Map<String, List<String>> headers, Set<String> additionalExcludes) {
        Set<String> excluded = new HashSet<>(HOP_BY_HOP_HEADERS);
        excluded.addAll(additionalExcludes);
        excluded.addAll(connectionTokens(headers));

        Map<String, List<String>> result = new LinkedHashMap<>();
        headers.forEach(
                (name, values) -> {
                    if (!excluded.contains(name.toLowerCase(Locale.ROOT))) {
                        result.computeIfAbsent(name, key -> new ArrayList<>())
                                .addAll(values);
                    }
                });
        return result;
    }

    /** Headers listed in {@code Connection} are hop-by-hop for this message as well. */
    private static Set<String> connectionTokens(Map<String, List<String>> headers) {
        Set<String> tokens = new HashSet<>();
        headers.forEach(
                (name, values) -> {
                    if ("connection".equalsIgnoreCase(name)) {
                        values.stream()
                                .map(value -> value.split(","))
                                .flatMap(Arrays::stream)
                                .map(token -> token.trim().toLowerCase(Locale.ROOT))
                                .filter(token -> !token.isEmpty())
                                .forEach(tokens::add);
                    }
                });
        return tokens;
    }
}
