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

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.minutes.workflow.WorkflowErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerWorkflowEventsTest {

    private SimpleMeterRegistry registry;
    private MicrometerWorkflowEvents events;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        events = new MicrometerWorkflowEvents(registry);
    }

    @Test
    void countsTransitionsByOutcome() {
        events.onTransitionStarted("finalizeMinutes", "tx-1", "m1");
        events.onTransitionCompleted("finalizeMinutes", "tx-1", true, 25);
        events.onTransitionCompleted("finalizeMinutes", "tx-2", false, 0);

        assertThat(registry.get("minutes.workflow.transition.started").tag("transition", "finalizeMinutes")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("minutes.workflow.transition.completed").tag("outcome", "success")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("minutes.workflow.transition.completed").tag("outcome", "failure")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("minutes.workflow.transition.duration").timer().count()).isEqualTo(1L);
    }

    @Test
    void countsStepsCompensationsAndRejections() {
        events.onStepSuccess("addMinutes", "tx-1", "insertMinutes", 4);
        events.onStepFailed("addMinutes", "tx-1", "linkToMeetingSeries", new IllegalStateException("x"), 2);
        events.onCompensated("addMinutes", "tx-1", "insertMinutes", null);
        events.onTransitionRejected("addMinutes", "tx-3", WorkflowErrorKind.NOT_AUTHORIZED, "no");

        assertThat(registry.get("minutes.workflow.step.completed").tag("step.id", "linkToMeetingSeries")
                .tag("error.type", "IllegalStateException").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("minutes.workflow.compensation").tag("outcome", "success")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("minutes.workflow.transition.rejected").tag("error.kind", "NOT_AUTHORIZED")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void countsNotificationOutcomes() {
        events.onNotificationScheduled("m1", "alice@example.org");
        events.onNotificationSkipped("m2", "disabled");
        events.onNotificationSkipped("m3", "disabled");
        events.onNotificationFailed("m1", new IllegalStateException("smtp down"));

        assertThat(registry.get("minutes.workflow.notification").tag("outcome", "skipped")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("minutes.workflow.notification").tag("outcome", "failed")
                .counter().count()).isEqualTo(1.0);
    }
}
