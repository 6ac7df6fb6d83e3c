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

package org.fireflyframework.minutes.persistence;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Journal of workflow transitions.
 * <p>
 * Each transition is recorded when it starts, after every write step and when it ends, so that
 * transitions interrupted mid-way or left inconsistent by a failed compensation can be found later.
 * Implementations can be in-memory (default) or external storage like Redis.
 * <p>
 * Thread-safety: All implementations must be thread-safe for concurrent access.
 */
public interface WorkflowJournal {

    /**
     * Stores a new transition record.
     *
     * @param record the record, normally in {@link TransitionStatus#STARTED}
     * @return Mono that completes when the record is stored
     */
    Mono<Void> begin(TransitionRecord record);

    /**
     * Records the outcome of a single write step.
     *
     * @return Mono that completes when the outcome is stored; unknown transitions are ignored
     */
    Mono<Void> recordStep(String transitionId, String stepId, StepOutcome outcome);

    /**
     * Marks a transition as ended with the given final status.
     *
     * @param reason failure description, {@code null} on success
     */
    Mono<Void> complete(String transitionId, TransitionStatus status, String reason);

    /**
     * @return Mono containing the record if found, empty Optional otherwise
     */
    Mono<Optional<TransitionRecord>> get(String transitionId);

    /**
     * @return Flux of all transitions still in {@link TransitionStatus#STARTED}
     */
    Flux<TransitionRecord> findInFlight();

    /**
     * @return Flux of in-flight transitions last updated before {@code before}
     */
    Flux<TransitionRecord> findStale(Instant before);

    Flux<TransitionRecord> findByStatus(TransitionStatus status);

    /**
     * Removes completed records older than the specified duration.
     * Inconsistent records are kept until they are resolved manually.
     *
     * @return Mono containing the number of removed records
     */
    Mono<Long> cleanupCompleted(Duration olderThan);

    Mono<Boolean> isHealthy();

    JournalProviderType getProviderType();

    enum JournalProviderType {
        /**
         * Journal disabled; nothing is recorded.
         */
        NONE,

        IN_MEMORY,

        REDIS
    }
}
