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

/**
 * Observability hook for minutes workflow transitions.
 * Provide your own Spring bean of this type to export metrics/traces/logs.
 * A default logger-based implementation is provided: {@link WorkflowLoggerEvents}.
 *
 * Notes:
 * - onCompensated is invoked for both success and error cases; a null error indicates a successful compensation.
 * - a rejected transition (authorization or precondition failure) never reaches onTransitionCompleted.
 */
public interface WorkflowEvents {
    /** Invoked when a transition starts, before authorization. */
    default void onTransitionStarted(String transition, String transitionId, String targetId) {}

    default void onStepSuccess(String transition, String transitionId, String stepId, long latencyMs) {}

    default void onStepFailed(String transition, String transitionId, String stepId, Throwable error, long latencyMs) {}

    default void onCompensated(String transition, String transitionId, String stepId, Throwable error) {}

    /** Invoked when a transition is refused before any write happened. */
    default void onTransitionRejected(String transition, String transitionId, WorkflowErrorKind kind, String detail) {}

    default void onTransitionCompleted(String transition, String transitionId, boolean success, long latencyMs) {}

    // Notification events
    default void onNotificationScheduled(String minutesId, String senderAddress) {}
    default void onNotificationSkipped(String minutesId, String reason) {}
    default void onNotificationFailed(String minutesId, Throwable error) {}
}
