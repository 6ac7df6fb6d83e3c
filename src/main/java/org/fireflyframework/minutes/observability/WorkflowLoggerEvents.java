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

import static org.fireflyframework.minutes.util.JsonUtils.json;

/**
 * Default logger-based implementation of WorkflowEvents.
 * <p>
 * Every event is written as one JSON object per line so log aggregation systems can parse it.
 * <p>
 * Log levels used:
 * <ul>
 *   <li>INFO - Normal lifecycle events (started, completed, step transitions)</li>
 *   <li>WARN - Rejected transitions and skipped notifications</li>
 *   <li>ERROR - Failed steps, failed compensations and failed notifications</li>
 * </ul>
 */
public class WorkflowLoggerEvents implements WorkflowEvents {

    private static final Logger log = LoggerFactory.getLogger(WorkflowLoggerEvents.class);

    @Override
    public void onTransitionStarted(String transition, String transitionId, String targetId) {
        log.info(json(
                "workflow_event", "started",
                "transition", transition,
                "transition_id", transitionId,
                "target_id", targetId));
    }

    @Override
    public void onStepSuccess(String transition, String transitionId, String stepId, long latencyMs) {
        log.info(json(
                "workflow_event", "step_success",
                "transition", transition,
                "transition_id", transitionId,
                "step_id", stepId,
                "latency_ms", latencyMs));
    }

    @Override
    public void onStepFailed(String transition, String transitionId, String stepId, Throwable error, long latencyMs) {
        log.error(json(
                "workflow_event", "step_failed",
                "transition", transition,
                "transition_id", transitionId,
                "step_id", stepId,
                "error_class", error.getClass().getSimpleName(),
                "error_message", error.getMessage(),
                "latency_ms", latencyMs));
    }

    @Override
    public void onCompensated(String transition, String transitionId, String stepId, Throwable error) {
        if (error == null) {
            log.info(json(
                    "workflow_event", "compensated_success",
                    "transition", transition,
                    "transition_id", transitionId,
                    "step_id", stepId));
        } else {
            log.error(json(
                    "workflow_event", "compensated_failed",
                    "transition", transition,
                    "transition_id", transitionId,
                    "step_id", stepId,
                    "error_class", error.getClass().getSimpleName(),
                    "error_message", error.getMessage()));
        }
    }

    @Override
    public void onTransitionRejected(String transition, String transitionId, WorkflowErrorKind kind, String detail) {
        log.warn(json(
                "workflow_event", "rejected",
                "transition", transition,
                "transition_id", transitionId,
                "error_kind", kind,
                "detail", detail));
    }

    @Override
    public void onTransitionCompleted(String transition, String transitionId, boolean success, long latencyMs) {
        log.info(json(
                "workflow_event", "completed",
                "transition", transition,
                "transition_id", transitionId,
                "success", success,
                "latency_ms", latencyMs));
    }

    @Override
    public void onNotificationScheduled(String minutesId, String senderAddress) {
        log.info(json(
                "workflow_event", "notification_scheduled",
                "minutes_id", minutesId,
                "sender", senderAddress));
    }

    @Override
    public void onNotificationSkipped(String minutesId, String reason) {
        log.warn(json(
                "workflow_event", "notification_skipped",
                "minutes_id", minutesId,
                "reason", reason));
    }

    @Override
    public void onNotificationFailed(String minutesId, Throwable error) {
        log.error(json(
                "workflow_event", "notification_failed",
                "minutes_id", minutesId,
                "error_class", error.getClass().getSimpleName(),
                "error_message", error.getMessage()));
    }
}
