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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Field-level modification applied to every document matched by a {@link DocumentSelector}.
 * <p>
 * Supports three operators, applied in this order:
 * <ul>
 *   <li>{@code $set} - replace a field value</li>
 *   <li>{@code $push} - append a value to a list field, creating the list if missing</li>
 *   <li>{@code $pull} - remove every occurrence of a value from a list field</li>
 * </ul>
 */
public final class DocumentUpdate {

    private final Map<String, Object> set;
    private final Map<String, Object> push;
    private final Map<String, Object> pull;

    private DocumentUpdate(Map<String, Object> set, Map<String, Object> push, Map<String, Object> pull) {
        this.set = Collections.unmodifiableMap(set);
        this.push = Collections.unmodifiableMap(push);
        this.pull = Collections.unmodifiableMap(pull);
    }

    public static DocumentUpdate set(String field, Object value) {
        return new DocumentUpdate(new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>()).andSet(field, value);
    }

    public static DocumentUpdate setAll(Map<String, Object> fields) {
        Objects.requireNonNull(fields, "fields");
        return new DocumentUpdate(new LinkedHashMap<>(fields), new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    public static DocumentUpdate push(String field, Object value) {
        Map<String, Object> push = new LinkedHashMap<>();
        push.put(Objects.requireNonNull(field, "field"), value);
        return new DocumentUpdate(new LinkedHashMap<>(), push, new LinkedHashMap<>());
    }

    public static DocumentUpdate pull(String field, Object value) {
        Map<String, Object> pull = new LinkedHashMap<>();
        pull.put(Objects.requireNonNull(field, "field"), value);
        return new DocumentUpdate(new LinkedHashMap<>(), new LinkedHashMap<>(), pull);
    }

    public DocumentUpdate andSet(String field, Object value) {
        Objects.requireNonNull(field, "field");
        Map<String, Object> combined = new LinkedHashMap<>(set);
        combined.put(field, value);
        return new DocumentUpdate(combined, new LinkedHashMap<>(push), new LinkedHashMap<>(pull));
    }

    public Map<String, Object> setFields() {
        return set;
    }

    public Map<String, Object> pushFields() {
        return push;
    }

    public Map<String, Object> pullFields() {
        return pull;
    }

    public boolean isEmpty() {
        return set.isEmpty() && push.isEmpty() && pull.isEmpty();
    }

    /**
     * Applies this update to {@code document} in place.
     *
     * @throws IllegalStateException if a push or pull targets a field that is not a list
     */
    public void applyTo(Map<String, Object> document) {
        set.forEach((field, value) -> document.put(field, Documents.copyValue(value)));
        push.forEach((field, value) -> {
            List<Object> list = listField(document, field);
            list.add(Documents.copyValue(value));
            document.put(field, list);
        });
        pull.forEach((field, value) -> {
            if (document.containsKey(field)) {
                List<Object> list = listField(document, field);
                list.removeIf(element -> Objects.equals(element, value));
                document.put(field, list);
            }
        });
    }

    private static List<Object> listField(Map<String, Object> document, String field) {
        Object current = document.get(field);
        if (current == null) {
            return new ArrayList<>();
        }
        if (!(current instanceof Collection<?> collection)) {
            throw new IllegalStateException("Field '" + field + "' is not a list");
        }
        return new ArrayList<>(collection);
    }

    @Override
    public String toString() {
        return "DocumentUpdate{$set=" + set.keySet() + ", $push=" + push + ", $pull=" + pull + "}";
    }
}
