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

package org.fireflyframework.minutes.domain;

import org.fireflyframework.minutes.collection.DocumentMapper;
import org.fireflyframework.minutes.collection.Documents;
import org.fireflyframework.minutes.collection.WorkflowCollections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowEntityLoaderTest {

    private WorkflowCollections collections;
    private DocumentMapper mapper;
    private WorkflowEntityLoader loader;

    @BeforeEach
    void setUp() {
        collections = WorkflowCollections.inMemory();
        mapper = new DocumentMapper();
        loader = new WorkflowEntityLoader(collections, mapper);
    }

    @Test
    void documentsUseStoredFieldNames() {
        Minutes minutes = new Minutes("ms-1", LocalDate.of(2024, 3, 1))
                .withTopic(new Topic("t1", "Budget", true).withItem(InfoItem.action("a1", "Report", true)));
        minutes.setFinalizedAt(Instant.parse("2024-03-01T10:00:00Z"));

        Map<String, Object> doc = mapper.toDocument(minutes);

        assertThat(doc).doesNotContainKey(Documents.ID)
                .containsEntry("meetingSeries_id", "ms-1")
                .containsEntry("date", "2024-03-01")
                .containsEntry("isFinalized", false)
                .containsEntry("isUnfinalized", false)
                .containsEntry("finalizedAt", "2024-03-01T10:00:00Z");
        assertThat(mapper.fromDocument(doc, Minutes.class).getTopics().get(0).getInfoItems())
                .containsExactly(InfoItem.action("a1", "Report", true));
    }

    @Test
    void loadsSeriesWithMinutesInListOrder() {
        collections.minutes().insert(Map.of(Documents.ID, "m2", "meetingSeries_id", "ms-1", "date", "2024-01-08")).block();
        collections.minutes().insert(Map.of(Documents.ID, "m1", "meetingSeries_id", "ms-1", "date", "2024-01-01",
                "isFinalized", true)).block();
        collections.meetingSeries().insert(Map.of(Documents.ID, "ms-1", "name", "Weekly",
                "minutes", List.of("m1", "missing", "m2"))).block();

        StepVerifier.create(loader.loadMeetingSeries("ms-1"))
                .assertNext(series -> {
                    assertThat(series.getName()).isEqualTo("Weekly");
                    assertThat(series.attachedMinutes()).extracting(Minutes::getId).containsExactly("m1", "m2");
                    assertThat(series.lastMinutes().getId()).isEqualTo("m2");
                    assertThat(series.lastFinalizedMinutes().getId()).isEqualTo("m1");
                })
                .verifyComplete();
    }

    @Test
    void absentEntitiesAreEmpty() {
        StepVerifier.create(loader.loadMinutes("nope")).verifyComplete();
        StepVerifier.create(loader.loadMeetingSeries("nope")).verifyComplete();
        StepVerifier.create(new Minutes().parentMeetingSeries(loader)).verifyComplete();
    }
}
