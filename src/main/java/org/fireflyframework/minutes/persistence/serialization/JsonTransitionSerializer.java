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

package org.fireflyframework.minutes.persistence.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.minutes.collection.DocumentMapper;
import org.fireflyframework.minutes.persistence.TransitionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * JSON-based implementation of TransitionRecordSerializer using Jackson.
 * <p>
 * Records are wrapped together with the content type and format version, and only records
 * written in the same version are read back.
 */
public class JsonTransitionSerializer implements TransitionRecordSerializer {

    private static final Logger log = LoggerFactory.getLogger(JsonTransitionSerializer.class);

    private static final String CONTENT_TYPE = "application/json";
    private static final String VERSION = "1.0";

    private final ObjectMapper objectMapper;

    public JsonTransitionSerializer() {
        this(DocumentMapper.createDefaultObjectMapper());
    }

    public JsonTransitionSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] serialize(TransitionRecord record) throws SerializationException {
        try {
            log.debug("Serializing transition record: {}", record.getTransitionId());
            String json = objectMapper.writeValueAsString(new Envelope(CONTENT_TYPE, VERSION, record));
            return json.getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            String message = String.format("Failed to serialize transition record: %s", record.getTransitionId());
            log.error(message, e);
            throw new SerializationException(message, e);
        }
    }

    @Override
    public TransitionRecord deserialize(byte[] data) throws SerializationException {
        Envelope envelope;
        try {
            envelope = objectMapper.readValue(data, Envelope.class);
        } catch (IOException e) {
            String message = "Failed to deserialize transition record from JSON";
            log.error(message, e);
            throw new SerializationException(message, e);
        }
        if (!CONTENT_TYPE.equals(envelope.contentType()) || !VERSION.equals(envelope.version())) {
            throw new SerializationException(String.format(
                    "Incompatible serialization format: %s version %s", envelope.contentType(), envelope.version()));
        }
        return envelope.payload();
    }

    @Override
    public String getContentType() {
        return CONTENT_TYPE;
    }

    @Override
    public String getVersion() {
        return VERSION;
    }

    record Envelope(String contentType, String version, TransitionRecord payload) {
    }
}
