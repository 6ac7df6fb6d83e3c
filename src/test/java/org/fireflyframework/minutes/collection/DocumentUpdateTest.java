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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentUpdateTest {

    @Test
    void setReplacesFields() {
        Map<String, Object> doc = new LinkedHashMap<>(Map.of("isFinalized", false));

        DocumentUpdate.set("isFinalized", true).andSet("finalizedBy", "alice").applyTo(doc);

        assertThat(doc).containsEntry("isFinalized", true).containsEntry("finalizedBy", "alice");
    }

    @Test
    void pushCreatesListWhenMissing() {
        Map<String, Object> doc = new LinkedHashMap<>();

        DocumentUpdate.push("minutes", "m1").applyTo(doc);
        DocumentUpdate.push("minutes", "m2").applyTo(doc);

        assertThat(doc.get("minutes")).isEqualTo(List.of("m1", "m2"));
    }

    @Test
    void pullRemovesEveryOccurrence() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("minutes", new ArrayList<>(List.of("m1", "m2", "m1")));

        DocumentUpdate.pull("minutes", "m1").applyTo(doc);

        assertThat(doc.get("minutes")).isEqualTo(List.of("m2"));
    }

    @Test
    void pullOnMissingFieldLeavesDocumentUntouched() {
        Map<String, Object> doc = new LinkedHashMap<>();

        DocumentUpdate.pull("minutes", "m1").applyTo(doc);

        assertThat(doc).doesNotContainKey("minutes");
    }

    @Test
    void pushOnScalarFails() {
        Map<String, Object> doc = new LinkedHashMap<>(Map.of("name", "weekly"));

        assertThatThrownBy(() -> DocumentUpdate.push("name", "x").applyTo(doc))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void setValuesAreCopied() {
        List<Object> topics = new ArrayList<>(List.of("t1"));
        Map<String, Object> doc = new LinkedHashMap<>();

        DocumentUpdate.setAll(Map.of("topics", topics)).applyTo(doc);
        topics.add("t2");

        assertThat(doc.get("topics")).isEqualTo(List.of("t1"));
    }

    @Test
    void selectorMatchesOnlyWhenAllCriteriaHold() {
        DocumentSelector selector = DocumentSelector.byId("m1").and("isFinalized", false);

        assertThat(selector.idCriterion()).isEqualTo("m1");
        assertThat(selector.matches(Map.of(Documents.ID, "m1", "isFinalized", false))).isTrue();
        assertThat(selector.matches(Map.of(Documents.ID, "m1", "isFinalized", true))).isFalse();
        assertThat(selector.matches(Map.of(Documents.ID, "m1"))).isFalse();
        assertThat(DocumentSelector.all().matches(Map.of())).isTrue();
        assertThat(DocumentSelector.all().idCriterion()).isNull();
    }
}
