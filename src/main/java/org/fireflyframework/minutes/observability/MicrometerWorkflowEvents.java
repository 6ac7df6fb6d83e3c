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

package org.fireflyframework.minutes.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import org.fireflyframework.minutes.workflow.WorkflowErrorKind;

import java.time.Duration;
import java.util.Objects;

/**
 * Micrometer-based implementation of WorkflowEvents.
 * <p>
 * Publishes counters and timers under {@code minutes.workflow.*}, tagged by transition name.
 */
public class MicrometerWorkflowEvents implements WorkflowEvents {

    private final MeterRegistry registry;

    public MicrometerWorkflowEvents(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void onTransitionStarted(String transition, String transitionId, String targetId) {
        registry.counter("minutes.workflow.transition.started", Tags.of(Tag.of("transition", transition))).increment();
    }

    @Override
    public void onStepSuccess(String transition, String transitionId, String stepId, long latencyMs) {
        Tags tags = Tags.of(
            Tag.of("transition", transition),
            Tag.of("step.id", stepId),
            Tag.of("outcome", "success")
        );
        registry.counter("minutes.workflow.step.completed", tags).increment();
        if (latencyMs > 0) {
            registry.timer("minutes.workflow.step.duration", tags).record(Duration.ofMillis(latencyMs));
        }
    }

    @Override
    public void onStepFailed(String transition, String transitionId, String stepId, Throwable error, long latencyMs) {
        Tags tags = Tags.of(
            Tag.of("transition", transition),
            Tag.of("step.id", stepId),
            Tag.of("outcome", "failure"),
            Tag.of("error.type", error.getClass().getSimpleName())
        );
        registry.counter("minutes.workflow.step.completed", tags).increment();
        if (latencyMs > 0) {
            registry.timer("minutes.workflow.step.duration", tags).record(Duration.ofMillis(latencyMs));
        }
    }

    @Override
    public void onCompensated(String transition, String transitionId, String stepId, Throwable error) {
        Tags tags = Tags.of(
            Tag.of("transition", transition),
            Tag.of("step.id", stepId),
            Tag.of("outcome", error == null ? "success" : "failure")
        );
        registry.counter("minutes.workflow.compensation", tags).increment();
    }

    @Override
    public void onTransitionRejected(String transition, String transitionId, WorkflowErrorKind kind, String detail) {
        Tags tags = Tags.of(
            Tag.of("transition", transition),
            Tag.of("error.kind", kind.name())
        );
        registry.counter("minutes.workflow.transition.rejected", tags).increment();
    }

    @Override
    public void onTransitionCompleted(String transition, String transitionId, boolean success, long latencyMs) {
        Tags tags = Tags.of(
            Tag.of("transition", transition),
            Tag.of("outcome", success ? "success" : "failure")
        );
        registry.counter("minutes.workflow.transition.completed", tags).increment();
        if (latencyMs > 0) {
            registry.timer("minutes.workflow.transition.duration", tags).record(Duration.ofMillis(latencyMs));
        }
    }

    @Override
    public void onNotificationScheduled(String minutesId, String senderAddress) {
        registry.counter("minutes.workflow.notification", Tags.of(Tag.of("outcome", "scheduled"))).increment();
    }

    @Override
    public void onNotificationSkipped(String minutesId, String reason) {
        registry.counter("minutes.workflow.notification", Tags.of(Tag.of("outcome", "skipped"))).increment();
    }

    @Override
    public void onNotificationFailed(String minutesId, Throwable error) {
        registry.counter("minutes.workflow.notification", Tags.of(Tag.of("outcome", "failed"))).increment();
    }
}
