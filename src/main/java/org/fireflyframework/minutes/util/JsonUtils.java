/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.minutes.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds single-line JSON log payloads from alternating key/value arguments.
 * Values are rendered with {@link String#valueOf(Object)}; {@code null} becomes an empty string.
 */
public final class JsonUtils {
    private static final Logger log = LoggerFactory.getLogger(JsonUtils.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonUtils() {
    }

    /**
     * Creates a JSON object string from key-value pairs.
     *
     * @param keyValuePairs key1, value1, key2, value2, ...
     * @return JSON string, or {@code "{}"} if Jackson cannot write the map
     * @throws IllegalArgumentException if the number of arguments is odd or a key is not a string
     */
    public static String json(Object... keyValuePairs) {
        if (keyValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Key-value pairs must be provided in pairs (even number of arguments)");
        }

        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValuePairs.length; i += 2) {
            if (!(keyValuePairs[i] instanceof String key)) {
                throw new IllegalArgumentException("Key at position " + i + " must be a String");
            }
            Object value = keyValuePairs[i + 1];
            map.put(key, value != null ? String.valueOf(value) : "");
        }

        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            log.error("Failed to create JSON from key-value pairs", e);
            return "{}";
        }
    }

    /**
     * Short description of an error for log payloads: simple class name plus message.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "";
        }
        return error.getClass().getSimpleName() + ": " + (error.getMessage() != null ? error.getMessage() : "No message");
    }
}
