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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable journal entry of one workflow transition.
 * <p>
 * Step outcomes keep the order in which the steps were recorded.
 */
public final class TransitionRecord {

    private final String transitionId;
    private final String transition;
    private final String targetId;
    private final TransitionStatus status;
    private final Instant startedAt;
    private final Instant lastUpdatedAt;
    private final Instant completedAt;
    private final Map<String, StepOutcome> steps;
    private final String failureReason;

    @JsonCreator
    public TransitionRecord(@JsonProperty("transitionId") String transitionId,
                            @JsonProperty("transition") String transition,
                            @JsonProperty("targetId") String targetId,
                            @JsonProperty("status") TransitionStatus status,
                            @JsonProperty("startedAt") Instant startedAt,
                            @JsonProperty("lastUpdatedAt") Instant lastUpdatedAt,
                            @JsonProperty("completedAt") Instant completedAt,
                            @JsonProperty("steps") Map<String, StepOutcome> steps,
                            @JsonProperty("failureReason") String failureReason) {
        this.transitionId = Objects.requireNonNull(transitionId, "transitionId");
        this.transition = Objects.requireNonNull(transition, "transition");
        this.targetId = targetId;
        this.status = Objects.requireNonNull(status, "status");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.lastUpdatedAt = lastUpdatedAt != null ? lastUpdatedAt : startedAt;
        this.completedAt = completedAt;
        this.steps = Collections.unmodifiableMap(new LinkedHashMap<>(steps != null ? steps : Map.of()));
        this.failureReason = failureReason;
    }

    public static TransitionRecord started(String transitionId, String transition, String targetId, Instant at) {
        return new TransitionRecord(transitionId, transition, targetId, TransitionStatus.STARTED,
                at, at, null, Map.of(), null);
    }

    public String getTransitionId() { return transitionId; }
    public String getTransition() { return transition; }
    public String getTargetId() { return targetId; }
    public TransitionStatus getStatus() { return status; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getLastUpdatedAt() { return lastUpdatedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public Map<String, StepOutcome> getSteps() { return steps; }
    public String getFailureReason() { return failureReason; }

    /**
     * Creates a new record with the outcome of {@code stepId} replaced or appended.
     */
    public TransitionRecord withStep(String stepId, StepOutcome outcome, Instant at) {
        Map<String, StepOutcome> updated = new LinkedHashMap<>(steps);
        updated.put(stepId, outcome);
        return new TransitionRecord(transitionId, transition, targetId, status,
                startedAt, at, completedAt, updated, failureReason);
    }

    /**
     * Creates a completed record. Completing with {@link TransitionStatus#STARTED} is rejected.
     */
    public TransitionRecord completed(TransitionStatus finalStatus, String reason, Instant at) {
        if (!finalStatus.isCompleted()) {
            throw new IllegalArgumentException("Not a final status: " + finalStatus);
        }
        return new TransitionRecord(transitionId, transition, targetId, finalStatus,
                startedAt, at, at, steps, reason);
    }

    public boolean isStale(Instant before) {
        return status.isInFlight() && lastUpdatedAt.isBefore(before);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransitionRecord that)) return false;
        return transitionId.equals(that.transitionId)
                && transition.equals(that.transition)
                && Objects.equals(targetId, that.targetId)
                && status == that.status
                && startedAt.equals(that.startedAt)
                && lastUpdatedAt.equals(that.lastUpdatedAt)
                && Objects.equals(completedAt, that.completedAt)
                && steps.equals(that.steps)
                && Objects.equals(failureReason, that.failureReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(transitionId, transition, targetId, status, startedAt, lastUpdatedAt,
                completedAt, steps, failureReason);
    }

    @Override
    public String toString() {
        return "TransitionRecord{" +
                "transitionId='" + transitionId + '\'' +
                ", transition='" + transition + '\'' +
                ", targetId='" + targetId + '\'' +
                ", status=" + status +
                ", steps=" + steps +
                '}';
    }
}
