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
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Journal used when {@code firefly.minutes.journal.enabled=false}: records nothing.
 */
public class NoOpWorkflowJournal implements WorkflowJournal {

    @Override
    public Mono<Void> begin(TransitionRecord record) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> recordStep(String transitionId, String stepId, StepOutcome outcome) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> complete(String transitionId, TransitionStatus status, String reason) {
        return Mono.empty();
    }

    @Override
    public Mono<Optional<TransitionRecord>> get(String transitionId) {
        return Mono.just(Optional.empty());
    }

    @Override
    public Flux<TransitionRecord> findInFlight() {
        return Flux.empty();
    }

    @Override
    public Flux<TransitionRecord> findStale(Instant before) {
        return Flux.empty();
    }

    @Override
    public Flux<TransitionRecord> findByStatus(TransitionStatus status) {
        return Flux.empty();
    }

    @Override
    public Mono<Long> cleanupCompleted(Duration olderThan) {
        return Mono.just(0L);
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    @Override
    public JournalProviderType getProviderType() {
        return JournalProviderType.NONE;
    }
}
