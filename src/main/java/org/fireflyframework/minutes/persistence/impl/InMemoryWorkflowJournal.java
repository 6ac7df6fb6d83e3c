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

package org.fireflyframework.minutes.persistence.impl;

import org.fireflyframework.minutes.persistence.StepOutcome;
import org.fireflyframework.minutes.persistence.TransitionRecord;
import org.fireflyframework.minutes.persistence.TransitionStatus;
import org.fireflyframework.minutes.persistence.WorkflowJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of WorkflowJournal.
 * <p>
 * The default journal. Records live only as long as the application does, which is enough to
 * surface inconsistent transitions through logs, metrics and the health endpoint.
 */
public class InMemoryWorkflowJournal implements WorkflowJournal {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkflowJournal.class);

    private final ConcurrentMap<String, TransitionRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryWorkflowJournal() {
        this(Clock.systemUTC());
    }

    public InMemoryWorkflowJournal(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Void> begin(TransitionRecord record) {
        return Mono.fromRunnable(() -> {
            log.debug("Journaling transition in memory: {}", record.getTransitionId());
            records.put(record.getTransitionId(), record);
        });
    }

    @Override
    public Mono<Void> recordStep(String transitionId, String stepId, StepOutcome outcome) {
        return Mono.fromRunnable(() -> {
            log.debug("Recording step in memory for transition: {}, step: {}, outcome: {}",
                    transitionId, stepId, outcome);
            if (records.computeIfPresent(transitionId,
                    (id, current) -> current.withStep(stepId, outcome, clock.instant())) == null) {
                log.warn("Attempted to record step for unknown transition: {}", transitionId);
            }
        });
    }

    @Override
    public Mono<Void> complete(String transitionId, TransitionStatus status, String reason) {
        return Mono.fromRunnable(() -> {
            log.debug("Completing transition in memory: {}, status: {}", transitionId, status);
            if (records.computeIfPresent(transitionId,
                    (id, current) -> current.completed(status, reason, clock.instant())) == null) {
                log.warn("Attempted to complete unknown transition: {}", transitionId);
            }
        });
    }

    @Override
    public Mono<Optional<TransitionRecord>> get(String transitionId) {
        return Mono.fromCallable(() -> Optional.ofNullable(records.get(transitionId)));
    }

    @Override
    public Flux<TransitionRecord> findInFlight() {
        return Flux.defer(() -> Flux.fromIterable(records.values()))
                .filter(record -> record.getStatus().isInFlight());
    }

    @Override
    public Flux<TransitionRecord> findStale(Instant before) {
        return Flux.defer(() -> Flux.fromIterable(records.values()))
                .filter(record -> record.isStale(before))
                .doOnSubscribe(subscription -> log.debug("Retrieving stale transitions from memory before: {}", before));
    }

    @Override
    public Flux<TransitionRecord> findByStatus(TransitionStatus status) {
        return Flux.defer(() -> Flux.fromIterable(records.values()))
                .filter(record -> record.getStatus() == status);
    }

    @Override
    public Mono<Long> cleanupCompleted(Duration olderThan) {
        return Mono.fromCallable(() -> {
            Instant cutoff = clock.instant().minus(olderThan);
            var toRemove = records.values().stream()
                    .filter(record -> record.getStatus().isCompleted() && !record.getStatus().requiresIntervention())
                    .filter(record -> record.getCompletedAt() != null && record.getCompletedAt().isBefore(cutoff))
                    .map(TransitionRecord::getTransitionId)
                    .toList();
            toRemove.forEach(records::remove);
            log.debug("Cleaned up {} completed transitions from memory", toRemove.size());
            return (long) toRemove.size();
        });
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    @Override
    public JournalProviderType getProviderType() {
        return JournalProviderType.IN_MEMORY;
    }

    /**
     * Gets the current number of records in memory.
     */
    public int size() {
        return records.size();
    }
}
