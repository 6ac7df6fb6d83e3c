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

import org.fireflyframework.minutes.domain.Minutes;
import org.fireflyframework.minutes.security.CallerIdentity;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * The five workflow transitions of minutes within a meeting series.
 * <p>
 * Nothing happens until the returned {@link Mono} is subscribed. Failures are signalled as
 * {@link WorkflowException}; storage errors that are not workflow failures propagate unchanged.
 */
public interface MinutesWorkflow {

    /**
     * Adds a new draft minutes to its meeting series.
     *
     * @param minutes           the new minutes; {@code meetingSeries_id} and {@code date} are required
     * @param completionHandler receives the new id once both documents are written; may be {@code null}
     * @return Mono emitting the id of the new minutes
     */
    Mono<String> addMinutes(CallerIdentity caller, Minutes minutes, Consumer<String> completionHandler);

    /**
     * Removes a non-finalized minutes and unlinks it from its series. Absent or finalized minutes are left alone.
     */
    Mono<Void> removeMinutes(CallerIdentity caller, String minutesId);

    /**
     * Finalizes the last minutes of a series, copies its topics into the series and triggers the finalize mails.
     */
    Mono<Void> finalizeMinutes(CallerIdentity caller, String minutesId, boolean sendActionItems, boolean sendInfoItems);

    /**
     * Reopens the most recently finalized minutes and reverts the series topics.
     */
    Mono<Void> unfinalizeMinutes(CallerIdentity caller, String minutesId);

    /**
     * Removes a meeting series together with all of its minutes. An empty id is ignored.
     */
    Mono<Void> removeMeetingSeries(CallerIdentity caller, String meetingSeriesId);
}
