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

import org.fireflyframework.minutes.persistence.TransitionRecord;

/**
 * Converts transition records to and from the bytes stored by external journals.
 */
public interface TransitionRecordSerializer {

    /**
     * @throws SerializationException if serialization fails
     */
    byte[] serialize(TransitionRecord record) throws SerializationException;

    /**
     * @throws SerializationException if the data is corrupted or written in an incompatible format
     */
    TransitionRecord deserialize(byte[] data) throws SerializationException;

    /**
     * Content type identifier written next to each record (e.g., "application/json").
     */
    String getContentType();

    String getVersion();

    /**
     * Exception thrown when serialization or deserialization fails.
     */
    class SerializationException extends Exception {

        public SerializationException(String message) {
            super(message);
        }

        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
