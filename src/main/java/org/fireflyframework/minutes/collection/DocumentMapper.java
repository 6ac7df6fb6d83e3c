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

package org.fireflyframework.minutes.collection;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;
import java.util.Objects;

/**
 * Converts workflow entities to plain field-map documents and back using Jackson.
 * Dates are written as ISO-8601 strings so documents stay comparable across stores.
 */
public class DocumentMapper {

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public DocumentMapper() {
        this(createDefaultObjectMapper());
    }

    public DocumentMapper(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public Map<String, Object> toDocument(Object entity) {
        Map<String, Object> document = objectMapper.convertValue(entity, DOCUMENT_TYPE);
        if (document.containsKey(Documents.ID) && document.get(Documents.ID) == null) {
            document.remove(Documents.ID);
        }
        return document;
    }

    public <T> T fromDocument(Map<String, Object> document, Class<T> type) {
        return objectMapper.convertValue(document, type);
    }

    /**
     * Converts an arbitrary value (for example a list of topics) to its document representation,
     * suitable as a {@code $set} value.
     */
    public Object toValue(Object value) {
        return objectMapper.convertValue(value, Object.class);
    }

    public static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
