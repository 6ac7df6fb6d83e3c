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

package org.fireflyframework.minutes.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.minutes.annotations.EnableMinutesWorkflow;
import org.fireflyframework.minutes.collection.Documents;
import org.fireflyframework.minutes.collection.ExecutionMode;
import org.fireflyframework.minutes.collection.WorkflowCollections;
import org.fireflyframework.minutes.domain.Minutes;
import org.fireflyframework.minutes.notification.FinalizeNotificationTrigger;
import org.fireflyframework.minutes.observability.CompositeWorkflowEvents;
import org.fireflyframework.minutes.observability.MicrometerWorkflowEvents;
import org.fireflyframework.minutes.observability.WorkflowEvents;
import org.fireflyframework.minutes.observability.WorkflowJournalHealthIndicator;
import org.fireflyframework.minutes.observability.WorkflowLoggerEvents;
import org.fireflyframework.minutes.persistence.TransitionRecoveryService;
import org.fireflyframework.minutes.persistence.WorkflowJournal;
import org.fireflyframework.minutes.security.CallerIdentity;
import org.fireflyframework.minutes.security.ModeratorRoleResolver;
import org.fireflyframework.minutes.workflow.MinutesWorkflow;
import org.fireflyframework.minutes.workflow.WorkflowErrorKind;
import org.fireflyframework.minutes.workflow.WorkflowException;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class MinutesWorkflowConfigurationTest {

    @Configuration
    @EnableMinutesWorkflow
    static class DefaultsConfig {
    }

    @Configuration
    @EnableMinutesWorkflow
    static class AppConfig {
        static final List<String> transitions = new ArrayList<>();

        @Bean public ModeratorRoleResolver moderatorRoleResolver() { return (caller, seriesId) -> true; }
        @Bean public MeterRegistry meterRegistry() { return new SimpleMeterRegistry(); }
        @Bean public WorkflowEvents auditEvents() {
            return new WorkflowEvents() {
                @Override
                public void onTransitionCompleted(String transition, String transitionId, boolean success, long latencyMs) {
                    transitions.add(transition + ":" + success);
                }
            };
        }
    }

    @Test
    void beansAreWired() {
        AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext(DefaultsConfig.class);
        assertNotNull(ctx.getBean(MinutesWorkflow.class));
        assertNotNull(ctx.getBean(WorkflowCollections.class));
        assertNotNull(ctx.getBean(TransitionRecoveryService.class));
        assertNotNull(ctx.getBean(WorkflowJournalHealthIndicator.class));
        assertNotNull(ctx.getBean(FinalizeNotificationTrigger.class));
        assertThat(ctx.getBean(WorkflowJournal.class).getProviderType())
                .isEqualTo(WorkflowJournal.JournalProviderType.IN_MEMORY);
        assertThat(ctx.getBean(WorkflowCollections.class).minutes().executionMode()).isEqualTo(ExecutionMode.IMMEDIATE);

        WorkflowEvents events = ctx.getBean(WorkflowEvents.class);
        assertThat(events).isInstanceOf(CompositeWorkflowEvents.class);
        assertThat(((CompositeWorkflowEvents) events).delegates())
                .hasSize(1)
                .hasOnlyElementsOfType(WorkflowLoggerEvents.class);
        ctx.close();
    }

    @Test
    void defaultRoleResolverRejectsEveryTransition() {
        AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext(DefaultsConfig.class);
        MinutesWorkflow workflow = ctx.getBean(MinutesWorkflow.class);

        assertThatThrownBy(() -> workflow.removeMeetingSeries(CallerIdentity.of("u-1", "alice"), "ms-1").block())
                .isInstanceOfSatisfying(WorkflowException.class,
                        e -> assertThat(e.getKind()).isEqualTo(WorkflowErrorKind.NOT_AUTHORIZED));
        ctx.close();
    }

    @Test
    void applicationBeansAreUsed() {
        AppConfig.transitions.clear();
        AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext(AppConfig.class);
        CompositeWorkflowEvents events = (CompositeWorkflowEvents) ctx.getBean(WorkflowEvents.class);
        assertThat(events.delegates()).hasSize(3)
                .hasAtLeastOneElementOfType(MicrometerWorkflowEvents.class)
                .hasAtLeastOneElementOfType(WorkflowLoggerEvents.class);

        WorkflowCollections collections = ctx.getBean(WorkflowCollections.class);
        collections.meetingSeries().insert(Map.of(Documents.ID, "ms-1", "minutes", List.of())).block();
        String id = ctx.getBean(MinutesWorkflow.class)
                .addMinutes(CallerIdentity.of("u-1", "alice"), new Minutes("ms-1", LocalDate.of(2024, 1, 1)), null)
                .block();

        assertThat(id).isNotBlank();
        assertThat(AppConfig.transitions).containsExactly("addMinutes:true");
        assertThat(ctx.getBean(MeterRegistry.class).get("minutes.workflow.transition.started").counter().count())
                .isEqualTo(1.0);
        ctx.close();
    }
}
