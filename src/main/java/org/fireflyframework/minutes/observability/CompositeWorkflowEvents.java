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

import org.fireflyframework.minutes.workflow.WorkflowErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fan-out implementation of WorkflowEvents that delegates to multiple sinks
 * (e.g., logs + metrics). Used by default configuration to avoid bean conflicts
 * while enabling multiple observability channels.
 * <p>
 * A delegate that throws is logged and skipped; the remaining delegates still receive the event
 * and the failure never reaches the workflow.
 */
public class CompositeWorkflowEvents implements WorkflowEvents {

    private static final Logger log = LoggerFactory.getLogger(CompositeWorkflowEvents.class);

    private final List<WorkflowEvents> delegates;

    public CompositeWorkflowEvents(Collection<WorkflowEvents> delegates) {
        this.delegates = new ArrayList<>(Objects.requireNonNull(delegates, "delegates"));
    }

    public List<WorkflowEvents> delegates() {
        return List.copyOf(delegates);
    }

    @Override
    public void onTransitionStarted(String transition, String transitionId, String targetId) {
        fanOut("onTransitionStarted", d -> d.onTransitionStarted(transition, transitionId, targetId));
    }

    @Override
    public void onStepSuccess(String transition, String transitionId, String stepId, long latencyMs) {
        fanOut("onStepSuccess", d -> d.onStepSuccess(transition, transitionId, stepId, latencyMs));
    }

    @Override
    public void onStepFailed(String transition, String transitionId, String stepId, Throwable error, long latencyMs) {
        fanOut("onStepFailed", d -> d.onStepFailed(transition, transitionId, stepId, error, latencyMs));
    }

    @Override
    public void onCompensated(String transition, String transitionId, String stepId, Throwable error) {
        fanOut("onCompensated", d -> d.onCompensated(transition, transitionId, stepId, error));
    }

    @Override
    public void onTransitionRejected(String transition, String transitionId, WorkflowErrorKind kind, String detail) {
        fanOut("onTransitionRejected", d -> d.onTransitionRejected(transition, transitionId, kind, detail));
    }

    @Override
    public void onTransitionCompleted(String transition, String transitionId, boolean success, long latencyMs) {
        fanOut("onTransitionCompleted", d -> d.onTransitionCompleted(transition, transitionId, success, latencyMs));
    }

    @Override
    public void onNotificationScheduled(String minutesId, String senderAddress) {
        fanOut("onNotificationScheduled", d -> d.onNotificationScheduled(minutesId, senderAddress));
    }

    @Override
    public void onNotificationSkipped(String minutesId, String reason) {
        fanOut("onNotificationSkipped", d -> d.onNotificationSkipped(minutesId, reason));
    }

    @Override
    public void onNotificationFailed(String minutesId, Throwable error) {
        fanOut("onNotificationFailed", d -> d.onNotificationFailed(minutesId, error));
    }

    private void fanOut(String event, Consumer<WorkflowEvents> call) {
        for (WorkflowEvents d : delegates) {
            try {
                call.accept(d);
            } catch (RuntimeException e) {
                log.warn("Workflow events delegate {} failed on {}", d.getClass().getName(), event, e);
            }
        }
    }
}
