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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Equality-only selector over top-level document fields. All criteria must match.
 * An empty selector matches every document.
 */
public final class DocumentSelector {

    private final Map<String, Object> criteria;

    private DocumentSelector(Map<String, Object> criteria) {
        this.criteria = Collections.unmodifiableMap(criteria);
    }

    public static DocumentSelector byId(String id) {
        Objects.requireNonNull(id, "id");
        return where(Documents.ID, id);
    }

    public static DocumentSelector where(String field, Object value) {
        Objects.requireNonNull(field, "field");
        Map<String, Object> criteria = new LinkedHashMap<>();
        criteria.put(field, value);
        return new DocumentSelector(criteria);
    }

    public static DocumentSelector all() {
        return new DocumentSelector(new LinkedHashMap<>());
    }

    /**
     * Returns a new selector with an additional equality criterion.
     */
    public DocumentSelector and(String field, Object value) {
        Objects.requireNonNull(field, "field");
        Map<String, Object> combined = new LinkedHashMap<>(criteria);
        combined.put(field, value);
        return new DocumentSelector(combined);
    }

    public Map<String, Object> criteria() {
        return criteria;
    }

    /**
     * Returns the id criterion when this selector addresses a single document by primary key.
     */
    public String idCriterion() {
        Object id = criteria.get(Documents.ID);
        return id != null ? id.toString() : null;
    }

    public boolean matches(Map<String, Object> document) {
        for (Map.Entry<String, Object> criterion : criteria.entrySet()) {
            if (!document.containsKey(criterion.getKey())) {
                return false;
            }
            if (!Objects.equals(document.get(criterion.getKey()), criterion.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DocumentSelector that)) return false;
        return criteria.equals(that.criteria);
    }

    @Override
    public int hashCode() {
        return criteria.hashCode();
    }

    @Override
    public String toString() {
        return "DocumentSelector" + criteria;
    }
}
