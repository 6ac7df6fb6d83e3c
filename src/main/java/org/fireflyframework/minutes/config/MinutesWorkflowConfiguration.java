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
import org.fireflyframework.minutes.collection.DeferredDocumentCollection;
import org.fireflyframework.minutes.collection.DocumentMapper;
import org.fireflyframework.minutes.collection.ExecutionMode;
import org.fireflyframework.minutes.collection.WorkflowCollections;
import org.fireflyframework.minutes.domain.WorkflowEntityLoader;
import org.fireflyframework.minutes.notification.FinalizeMailer;
import org.fireflyframework.minutes.notification.FinalizeNotificationTrigger;
import org.fireflyframework.minutes.notification.MailDeliverySettings;
import org.fireflyframework.minutes.notification.NoOpFinalizeMailer;
import org.fireflyframework.minutes.observability.CompositeWorkflowEvents;
import org.fireflyframework.minutes.observability.MicrometerWorkflowEvents;
import org.fireflyframework.minutes.observability.WorkflowEvents;
import org.fireflyframework.minutes.observability.WorkflowJournalHealthIndicator;
import org.fireflyframework.minutes.observability.WorkflowLoggerEvents;
import org.fireflyframework.minutes.persistence.TransitionRecoveryService;
import org.fireflyframework.minutes.persistence.WorkflowJournal;
import org.fireflyframework.minutes.persistence.impl.InMemoryWorkflowJournal;
import org.fireflyframework.minutes.persistence.impl.NoOpWorkflowJournal;
import org.fireflyframework.minutes.security.AuthorizationGate;
import org.fireflyframework.minutes.security.ModeratorRoleResolver;
import org.fireflyframework.minutes.workflow.DefaultMinutesWorkflow;
import org.fireflyframework.minutes.workflow.MinutesWorkflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Spring configuration that wires the minutes workflow components.
 * Users typically activate it via {@link org.fireflyframework.minutes.annotations.EnableMinutesWorkflow}.
 * <p>
 * The role resolver and mailer are looked up from the application context and fall back to
 * deny-all and logging-only defaults. Collections, mail settings and the journal are registered
 * with {@code @ConditionalOnMissingBean}.
 */
@Configuration
@EnableConfigurationProperties(MinutesWorkflowProperties.class)
public class MinutesWorkflowConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MinutesWorkflowConfiguration.class);

    static final String EVENTS_COMPOSITE_BEAN = "workflowEventsComposite";

    @Bean
    @ConditionalOnMissingBean
    public Clock minutesWorkflowClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentMapper documentMapper() {
        return new DocumentMapper();
    }

    /**
     * In-memory collections; applications with real storage declare their own {@link WorkflowCollections}.
     */
    @Bean
    @ConditionalOnMissingBean
    public WorkflowCollections workflowCollections(MinutesWorkflowProperties properties) {
        WorkflowCollections inMemory = WorkflowCollections.inMemory();
        if (properties.getCollections().getExecutionMode() == ExecutionMode.DEFERRED) {
            log.info("Configuring in-memory workflow collections completing on the bounded elastic scheduler");
            return new WorkflowCollections(
                    new DeferredDocumentCollection(inMemory.minutes(), Schedulers.boundedElastic()),
                    new DeferredDocumentCollection(inMemory.meetingSeries(), Schedulers.boundedElastic()));
        }
        log.info("Configuring in-memory workflow collections");
        return inMemory;
    }

    @Bean
    public WorkflowEntityLoader workflowEntityLoader(WorkflowCollections collections, DocumentMapper mapper) {
        return new WorkflowEntityLoader(collections, mapper);
    }

    @Bean
    public AuthorizationGate authorizationGate(ObjectProvider<ModeratorRoleResolver> roleResolver) {
        return new AuthorizationGate(roleResolver.getIfAvailable(() -> {
            log.warn("No custom ModeratorRoleResolver found. Using deny-all resolver - every transition will be rejected");
            return ModeratorRoleResolver.denyAll();
        }));
    }

    @Bean
    @ConditionalOnMissingBean
    public MailDeliverySettings mailDeliverySettings(MinutesWorkflowProperties properties) {
        MinutesWorkflowProperties.MailProperties mail = properties.getMail();
        return MailDeliverySettings.of(mail.isEnabled(), mail.getDefaultSenderAddress());
    }

    @Bean
    public FinalizeNotificationTrigger finalizeNotificationTrigger(MailDeliverySettings settings,
                                                                   ObjectProvider<FinalizeMailer> mailer,
                                                                   WorkflowEvents events) {
        FinalizeMailer resolved = mailer.getIfAvailable(() -> {
            log.info("No custom FinalizeMailer found. Using NoOpFinalizeMailer - finalize mails will only be logged");
            return new NoOpFinalizeMailer();
        });
        return new FinalizeNotificationTrigger(settings, resolved, events, Schedulers.boundedElastic());
    }

    @Bean
    @Primary
    public WorkflowEvents workflowEventsComposite(ApplicationContext applicationContext,
                                                  MinutesWorkflowProperties properties,
                                                  ObjectProvider<MeterRegistry> meterRegistry) {
        List<WorkflowEvents> sinks = new ArrayList<>();

        // Application-defined sinks first; skip the composite itself
        Map<String, WorkflowEvents> allEvents = applicationContext.getBeansOfType(WorkflowEvents.class);
        for (Map.Entry<String, WorkflowEvents> entry : allEvents.entrySet()) {
            if (!EVENTS_COMPOSITE_BEAN.equals(entry.getKey())) {
                sinks.add(entry.getValue());
            }
        }

        if (properties.getObservability().isEventLoggingEnabled()) {
            sinks.add(new WorkflowLoggerEvents());
        }

        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry != null && properties.getObservability().isMetricsEnabled()) {
            sinks.add(new MicrometerWorkflowEvents(registry));
        }

        return new CompositeWorkflowEvents(sinks);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowJournal workflowJournal(MinutesWorkflowProperties properties, Clock clock) {
        if (!properties.getJournal().isEnabled()) {
            log.info("Transition journal disabled");
            return new NoOpWorkflowJournal();
        }
        log.info("Configuring in-memory transition journal");
        return new InMemoryWorkflowJournal(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TransitionRecoveryService transitionRecoveryService(WorkflowJournal journal,
                                                               MinutesWorkflowProperties properties,
                                                               Clock clock) {
        MinutesWorkflowProperties.JournalProperties journalProperties = properties.getJournal();
        return new TransitionRecoveryService(journal, journalProperties.getMaxTransitionAge(),
                journalProperties.getRetention(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public MinutesWorkflow minutesWorkflow(WorkflowCollections collections,
                                           DocumentMapper mapper,
                                           WorkflowEntityLoader loader,
                                           AuthorizationGate gate,
                                           FinalizeNotificationTrigger notificationTrigger,
                                           WorkflowEvents events,
                                           WorkflowJournal journal,
                                           Clock clock) {
        log.info("Initializing minutes workflow with {} collections and {} journal",
                collections.minutes().executionMode(), journal.getProviderType());
        return new DefaultMinutesWorkflow(collections, mapper, loader, gate, notificationTrigger, events, journal, clock);
    }

    @Configuration
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
    static class HealthConfig {
        @Bean
        @ConditionalOnMissingBean
        public WorkflowJournalHealthIndicator workflowJournalHealthIndicator(WorkflowJournal journal) {
            return new WorkflowJournalHealthIndicator(journal);
        }
    }
}
