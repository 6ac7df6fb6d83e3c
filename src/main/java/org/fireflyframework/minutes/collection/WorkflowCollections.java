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

import java.util.Objects;

/**
 * The two collections the workflow writes to. Constructed once at start-up and injected,
 * so no component looks collections up from global state.
 *
 * @param minutes       collection of minutes documents
 * @param meetingSeries collection of meeting series documents
 */
public record WorkflowCollections(DocumentCollection minutes, DocumentCollection meetingSeries) {

    public static final String MINUTES = "minutes";
    public static final String MEETING_SERIES = "meetingSeries";

    public WorkflowCollections {
        Objects.requireNonNull(minutes, "minutes");
        Objects.requireNonNull(meetingSeries, "meetingSeries");
    }

    public static WorkflowCollections inMemory() {
        return new WorkflowCollections(
                new InMemoryDocumentCollection(MINUTES),
                new InMemoryDocumentCollection(MEETING_SERIES));
    }
}
