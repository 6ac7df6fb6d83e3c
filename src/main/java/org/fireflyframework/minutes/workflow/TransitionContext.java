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

package org.fireflyframework.minutes.workflow;

import org.fireflyframework.minutes.observability.WorkflowEvents;
import org.fireflyframework.minutes.persistence.StepOutcome;
import org.fireflyframework.minutes.persistence.TransitionRecord;
import org.fireflyframework.minutes.persistence.TransitionStatus;
import org.fireflyframework.minutes.persistence.WorkflowJournal;
import org.fireflyframework.minutes.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Per-transition bookkeeping: emits {@link WorkflowEvents} and keeps the {@link WorkflowJournal} entry current.
 * <p>
 * A transition is journaled only once its first write starts, so transitions rejected during
 * authorization or validation leave no journal entry. Journal failures are logged and never fail
 * the transition.
 */
public final class TransitionContext {

    private static final Logger log = LoggerFactory.getLogger(TransitionContext.class);

    private final String transition;
    private final String transitionId;
    private final String targetId;
    private final WorkflowEvents events;
    private final WorkflowJournal journal;
    private final Clock clock;
    private final long startMillis;

    private final AtomicBoolean journaled = new AtomicBoolean(false);
    private final AtomicReference<TransitionStatus> failureStatus = new AtomicReference<>(TransitionStatus.FAILED);

    public TransitionContext(String transition, String transitionId, String targetId,
                             WorkflowEvents events, WorkflowJournal journal, Clock clock) {
        this.transition = Objects.requireNonNull(transition, "transition");
        this.transitionId = Objects.requireNonNull(transitionId, "transitionId");
        this.targetId = targetId;
        this.events = Objects.requireNonNull(events, "events");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startMillis = clock.millis();
    }

    public String transition() {
        return transition;
    }

    public String transitionId() {
        return transitionId;
    }

    public boolean isJournaled() {
        return journaled.get();
    }

    /**
     * Status a failed transition is journaled with: {@code FAILED} unless a compensation ran.
     */
    public TransitionStatus failureStatus() {
        return failureStatus.get();
    }

    /**
     * Journals the transition as started; later calls do nothing.
     */
    public Mono<Void> markStarted() {
        return Mono.defer(() -> {
            if (!journaled.compareAndSet(false, true)) {
                return Mono.empty();
            }
            return safely(journal.begin(TransitionRecord.started(transitionId, transition, targetId, clock.instant())));
        });
    }

    /**
     * Runs one write, reporting its outcome. A write that completes without a value is treated as failed.
     */
    public <T> Mono<T> step(String stepId, Supplier<Mono<T>> write) {
        return Mono.defer(() -> {
            long start = clock.millis();
            return Mono.defer(write)
                    .switchIfEmpty(Mono.error(() -> new IllegalStateException("Step " + stepId + " completed without a result")))
                    .flatMap(value -> {
                        events.onStepSuccess(transition, transitionId, stepId, clock.millis() - start);
                        return recordStep(stepId, StepOutcome.SUCCEEDED).thenReturn(value);
                    })
                    .onErrorResume(error -> {
                        events.onStepFailed(transition, transitionId, stepId, error, clock.millis() - start);
                        return recordStep(stepId, StepOutcome.FAILED).then(Mono.<T>error(error));
                    });
        });
    }

    /**
     * Reports the outcome of compensating {@code stepId}; {@code error} is {@code null} on success.
     */
    public Mono<Void> compensated(String stepId, Throwable error) {
        return Mono.defer(() -> {
            events.onCompensated(transition, transitionId, stepId, error);
            if (error == null) {
                failureStatus.compareAndSet(TransitionStatus.FAILED, TransitionStatus.COMPENSATED);
                return recordStep(stepId, StepOutcome.COMPENSATED);
            }
            failureStatus.set(TransitionStatus.INCONSISTENT);
            return recordStep(stepId, StepOutcome.COMPENSATION_FAILED);
        });
    }

    Mono<Void> succeeded() {
        return Mono.defer(() -> {
            events.onTransitionCompleted(transition, transitionId, true, elapsedMillis());
            return journaled.get() ? safely(journal.complete(transitionId, TransitionStatus.COMPLETED, null)) : Mono.empty();
        });
    }

    Mono<Void> failed(Throwable error) {
        return Mono.defer(() -> {
            if (!journaled.get() && error instanceof WorkflowException rejection) {
                events.onTransitionRejected(transition, transitionId, rejection.getKind(), rejection.getDetail());
                return Mono.empty();
            }
            events.onTransitionCompleted(transition, transitionId, false, elapsedMillis());
            return journaled.get()
                    ? safely(journal.complete(transitionId, failureStatus.get(), JsonUtils.describe(error)))
                    : Mono.empty();
        });
    }

    private Mono<Void> recordStep(String stepId, StepOutcome outcome) {
        return journaled.get() ? safely(journal.recordStep(transitionId, stepId, outcome)) : Mono.empty();
    }

    private long elapsedMillis() {
        return clock.millis() - startMillis;
    }

    private Mono<Void> safely(Mono<Void> journalCall) {
        return journalCall.onErrorResume(error -> {
            log.warn("Journal update failed for transition {} ({})", transitionId, transition, error);
            return Mono.empty();
        });
    }
}
