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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lenient accessors for loosely typed JSON documents such as custom resources read from the
 * Kubernetes API. Lookups never throw: a missing, null or wrongly typed node along the path yields
 * an empty result.
 */
public class JsonNodeUtils {

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private JsonNodeUtils() {}

    /**
     * Walks the given object fields starting at {@code root}.
     *
     * @return the node at the end of the path, or a {@link MissingNode} if any segment is absent,
     *     null or not an object.
     */
    public static JsonNode path(@Nullable JsonNode root, String... fields) {
        JsonNode current = root == null ? MissingNode.getInstance() : root;
        for (String field : fields) {
            if (!current.isObject()) {
                return MissingNode.getInstance();
            }
            current = current.path(field);
        }
        return current.isNull() ? MissingNode.getInstance() : current;
    }

    /** True if the path leads to an existing, non-null node. */
    public static boolean isPresent(@Nullable JsonNode root, String... fields) {
        return !path(root, fields).isMissingNode();
    }

    /** Textual value of a string, number or boolean node. */
    public static Optional<String> getText(@Nullable JsonNode root, String... fields) {
        JsonNode node = path(root, fields);
        return node.isValueNode() ? Optional.of(node.asText()) : Optional.empty();
    }

    /**
     * Integral value of a number node or of a string holding a number. Fractional values are
     * truncated, values outside the long range yield an empty result.
     */
    public static Optional<Long> getLong(@Nullable JsonNode root, String... fields) {
        JsonNode node = path(root, fields);
        if (node.isNumber()) {
            return node.canConvertToLong() ? Optional.of(node.longValue()) : Optional.empty();
        }
        if (node.isTextual()) {
            return parseLong(node.textValue());
        }
        return Optional.empty();
    }

    /** String entries of an object node. Nested objects and arrays are skipped. */
    public static Map<String, String> getStringMap(@Nullable JsonNode root, String... fields) {
        JsonNode node = path(root, fields);
        if (!node.isObject()) {
            return Collections.emptyMap();
        }
        Map<String, String> result = new LinkedHashMap<>();
        node.fields()
                .forEachRemaining(
                        entry -> {
                            if (entry.getValue().isValueNode() && !entry.getValue().isNull()) {
                                result.put(entry.getKey(), entry.getValue().asText());
                            }
                        });
        return result;
    }

    private static Optional<Long> parseLong(@Nullable String value) {
        String trimmed = StringUtils.trimToNull(value);
        if (trimmed == null) {
            return Optional.empty();
        }
        BigDecimal number;
        try {
            number = new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (number.compareTo(LONG_MIN) < 0 || number.compareTo(LONG_MAX) > 0) {
            return Optional.empty();
        }
        return Optional.of(number.longValue());
    }
}
