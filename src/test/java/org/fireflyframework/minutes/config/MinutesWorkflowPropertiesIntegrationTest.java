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

import org.fireflyframework.minutes.annotations.EnableMinutesWorkflow;
import org.fireflyframework.minutes.collection.DeferredDocumentCollection;
import org.fireflyframework.minutes.collection.ExecutionMode;
import org.fireflyframework.minutes.collection.WorkflowCollections;
import org.fireflyframework.minutes.notification.MailDeliverySettings;
import org.fireflyframework.minutes.observability.CompositeWorkflowEvents;
import org.fireflyframework.minutes.observability.WorkflowEvents;
import org.fireflyframework.minutes.persistence.WorkflowJournal;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test verifying that {@code firefly.minutes.*} properties bind and drive the wiring.
 */
@SpringBootTest(classes = MinutesWorkflowPropertiesIntegrationTest.TestConfig.class)
@TestPropertySource(properties = {
    "firefly.minutes.mail.enabled=true",
    "firefly.minutes.mail.default-sender-address=noreply@example.org",
    "firefly.minutes.collections.execution-mode=DEFERRED",
    "firefly.minutes.journal.enabled=false",
    "firefly.minutes.journal.max-transition-age=PT2M",
    "firefly.minutes.journal.redis.key-prefix=custom:",
    "firefly.minutes.observability.event-logging-enabled=false"
})
class MinutesWorkflowPropertiesIntegrationTest {

    @Configuration
    @EnableMinutesWorkflow
    static class TestConfig {
    }

    @Autowired
    private MinutesWorkflowProperties properties;

    @Autowired
    private WorkflowCollections collections;

    @Autowired
    private MailDeliverySettings mailDeliverySettings;

    @Autowired
    private WorkflowJournal journal;

    @Autowired
    private WorkflowEvents events;

    @Test
    void propertiesAreBound() {
        assertThat(properties.getMail().isEnabled()).isTrue();
        assertThat(properties.getCollections().getExecutionMode()).isEqualTo(ExecutionMode.DEFERRED);
        assertThat(properties.getJournal().getMaxTransitionAge()).isEqualTo(Duration.ofMinutes(2));
        assertThat(properties.getJournal().getRetention()).isEqualTo(Duration.ofHours(24));
        assertThat(properties.getJournal().getProvider()).isEqualTo("in-memory");
        assertThat(properties.getJournal().getRedis().getKeyPrefix()).isEqualTo("custom:");
        assertThat(properties.getJournal().getRedis().getPort()).isEqualTo(6379);
    }

    @Test
    void propertiesDriveTheWiring() {
        assertThat(collections.minutes()).isInstanceOf(DeferredDocumentCollection.class);
        assertThat(collections.meetingSeries().executionMode()).isEqualTo(ExecutionMode.DEFERRED);
        assertThat(mailDeliverySettings.isEMailDeliveryEnabled()).isTrue();
        assertThat(mailDeliverySettings.getDefaultEmailSenderAddress()).isEqualTo("noreply@example.org");
        assertThat(journal.getProviderType()).isEqualTo(WorkflowJournal.JournalProviderType.NONE);
        assertThat(((CompositeWorkflowEvents) events).delegates()).isEmpty();
    }
}
