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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.fireflyframework.minutes.workflow.WorkflowErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for WorkflowLoggerEvents implementation.
 */
class WorkflowLoggerEventsTest {

    private WorkflowLoggerEvents workflowEvents;
    private ListAppender<ILoggingEvent> listAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        workflowEvents = new WorkflowLoggerEvents();

        // Set up log capture
        logger = (Logger) LoggerFactory.getLogger(WorkflowLoggerEvents.class);
        listAppender = new ListAppender<>();
        listAppender.start();
        logger.addAppender(listAppender);
        logger.setLevel(Level.DEBUG);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(listAppender);
    }

    @Test
    void shouldLogTransitionStartedEvent() {
        // When
        workflowEvents.onTransitionStarted("finalizeMinutes", "tx-123", "m1");

        // Then
        List<ILoggingEvent> logEvents = listAppender.list;
        assertThat(logEvents).hasSize(1);

        ILoggingEvent event = logEvents.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.INFO);
        assertThat(event.getFormattedMessage()).contains("workflow_event\":\"started");
        assertThat(event.getFormattedMessage()).contains("finalizeMinutes");
        assertThat(event.getFormattedMessage()).contains("tx-123");
        assertThat(event.getFormattedMessage()).contains("\"target_id\":\"m1\"");
    }

    @Test
    void shouldLogStepFailureAsError() {
        // When
        workflowEvents.onStepFailed("addMinutes", "tx-1", "linkToMeetingSeries",
                new IllegalStateException("store offline"), 12);

        // Then
        ILoggingEvent event = listAppender.list.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.ERROR);
        assertThat(event.getFormattedMessage()).contains("step_failed");
        assertThat(event.getFormattedMessage()).contains("\"error_class\":\"IllegalStateException\"");
        assertThat(event.getFormattedMessage()).contains("store offline");
        assertThat(event.getFormattedMessage()).contains("\"latency_ms\":\"12\"");
    }

    @Test
    void shouldLogCompensationOutcomes() {
        // When
        workflowEvents.onCompensated("addMinutes", "tx-1", "insertMinutes", null);
        workflowEvents.onCompensated("addMinutes", "tx-1", "insertMinutes", new IllegalStateException("undo failed"));

        // Then
        List<ILoggingEvent> logEvents = listAppender.list;
        assertThat(logEvents).hasSize(2);
        assertThat(logEvents.get(0).getLevel()).isEqualTo(Level.INFO);
        assertThat(logEvents.get(0).getFormattedMessage()).contains("compensated_success");
        assertThat(logEvents.get(1).getLevel()).isEqualTo(Level.ERROR);
        assertThat(logEvents.get(1).getFormattedMessage()).contains("compensated_failed");
    }

    @Test
    void shouldLogRejectionAsWarning() {
        // When
        workflowEvents.onTransitionRejected("removeMinutes", "tx-9", WorkflowErrorKind.NOT_AUTHORIZED,
                "Cannot modify meeting series ms-1. You are not a moderator.");

        // Then
        ILoggingEvent event = listAppender.list.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.WARN);
        assertThat(event.getFormattedMessage()).contains("\"workflow_event\":\"rejected\"");
        assertThat(event.getFormattedMessage()).contains("NOT_AUTHORIZED");
    }

    @Test
    void shouldLogNotificationEvents() {
        // When
        workflowEvents.onNotificationScheduled("m1", "alice@example.org");
        workflowEvents.onNotificationSkipped("m1", "email delivery is not enabled");
        workflowEvents.onNotificationFailed("m1", new IllegalStateException("smtp down"));

        // Then
        List<ILoggingEvent> logEvents = listAppender.list;
        assertThat(logEvents).extracting(ILoggingEvent::getLevel)
                .containsExactly(Level.INFO, Level.WARN, Level.ERROR);
        assertThat(logEvents.get(2).getFormattedMessage()).contains("notification_failed").contains("smtp down");
    }
}
