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

package org.fireflyframework.minutes.persistence.integration;

import org.fireflyframework.minutes.annotations.EnableMinutesWorkflow;
import org.fireflyframework.minutes.collection.Documents;
import org.fireflyframework.minutes.collection.WorkflowCollections;
import org.fireflyframework.minutes.config.WorkflowJournalRedisAutoConfiguration;
import org.fireflyframework.minutes.domain.Minutes;
import org.fireflyframework.minutes.persistence.StepOutcome;
import org.fireflyframework.minutes.persistence.TransitionRecord;
import org.fireflyframework.minutes.persistence.TransitionRecoveryService;
import org.fireflyframework.minutes.persistence.TransitionStatus;
import org.fireflyframework.minutes.persistence.WorkflowJournal;
import org.fireflyframework.minutes.security.CallerIdentity;
import org.fireflyframework.minutes.security.ModeratorRoleResolver;
import org.fireflyframework.minutes.workflow.MinutesWorkflow;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test for the Redis transition journal using Testcontainers.
 * Verifies that journal entries survive in a real Redis instance running in a Docker container.
 */
@SpringBootTest(classes = RedisWorkflowJournalIntegrationTest.TestConfig.class)
@Testcontainers(disabledWithoutDocker = true)
class RedisWorkflowJournalIntegrationTest {

    @Container
    static GenericContainer<?> redis = new GenericContainer<>("redis:7-alpine")
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("firefly.minutes.journal.enabled", () -> "true");
        registry.add("firefly.minutes.journal.provider", () -> "redis");
        registry.add("firefly.minutes.journal.redis.host", redis::getHost);
        registry.add("firefly.minutes.journal.redis.port", redis::getFirstMappedPort);
        registry.add("firefly.minutes.journal.redis.key-prefix", () -> "test:minutes:");
        registry.add("firefly.minutes.journal.redis.key-ttl", () -> "PT1H");
    }

    @Configuration
    @EnableMinutesWorkflow
    @ImportAutoConfiguration(WorkflowJournalRedisAutoConfiguration.class)
    static class TestConfig {

        @Bean
        public ModeratorRoleResolver moderatorRoleResolver() {
            return (caller, meetingSeriesId) -> "u-mod".equals(caller.userId());
        }
    }

    @Autowired
    private WorkflowJournal journal;

    @Autowired
    private MinutesWorkflow workflow;

    @Autowired
    private WorkflowCollections collections;

    @Autowired
    private TransitionRecoveryService recovery;

    @Autowired
    private ReactiveRedisTemplate<String, byte[]> redisTemplate;

    @Test
    void redisJournalIsPrimary() {
        assertThat(journal.getProviderType()).isEqualTo(WorkflowJournal.JournalProviderType.REDIS);
        StepVerifier.create(journal.isHealthy()).expectNext(true).verifyComplete();
    }

    @Test
    void storesStepsAndCompletion() {
        String id = UUID.randomUUID().toString();

        StepVerifier.create(journal.begin(TransitionRecord.started(id, "finalizeMinutes", "m1", Instant.now()))
                        .then(journal.recordStep(id, "updateSeriesTopics", StepOutcome.SUCCEEDED))
                        .then(journal.recordStep(id, "markFinalized", StepOutcome.FAILED))
                        .then(journal.recordStep(id, "updateSeriesTopics", StepOutcome.COMPENSATED))
                        .then(journal.complete(id, TransitionStatus.COMPENSATED, "IllegalStateException: offline")))
                .verifyComplete();

        StepVerifier.create(journal.get(id))
                .assertNext(found -> {
                    TransitionRecord record = found.orElseThrow();
                    assertThat(record.getStatus()).isEqualTo(TransitionStatus.COMPENSATED);
                    assertThat(record.getSteps().keySet()).containsExactly("updateSeriesTopics", "markFinalized");
                    assertThat(record.getSteps()).containsEntry("updateSeriesTopics", StepOutcome.COMPENSATED);
                    assertThat(record.getFailureReason()).isEqualTo("IllegalStateException: offline");
                })
                .verifyComplete();
    }

    @Test
    void staleTransitionsAreMarkedInconsistentAndKeptByCleanup() {
        String stale = UUID.randomUUID().toString();
        journal.begin(TransitionRecord.started(stale, "addMinutes", "ms-x", Instant.now().minus(Duration.ofHours(1)))).block();

        StepVerifier.create(journal.findStale(Instant.now().minus(Duration.ofMinutes(5)))
                        .map(TransitionRecord::getTransitionId)
                        .filter(stale::equals))
                .expectNext(stale)
                .verifyComplete();

        recovery.markStaleTransitionsInconsistent().block();
        journal.cleanupCompleted(Duration.ZERO).block();

        assertThat(journal.get(stale).block().orElseThrow().getStatus()).isEqualTo(TransitionStatus.INCONSISTENT);
    }

    @Test
    void cleanupRemovesCompletedTransitions() {
        String done = UUID.randomUUID().toString();
        journal.begin(TransitionRecord.started(done, "removeMinutes", "m1", Instant.now())).block();
        journal.complete(done, TransitionStatus.COMPLETED, null).block();

        journal.cleanupCompleted(Duration.ofMillis(-1000)).block();

        assertThat(journal.get(done).block()).isEmpty();
    }

    @Test
    void completedMarkerExpiresWithTheRecord() {
        String done = UUID.randomUUID().toString();
        journal.begin(TransitionRecord.started(done, "removeMinutes", "m1", Instant.now())).block();
        journal.complete(done, TransitionStatus.COMPLETED, null).block();

        Duration markerTtl = redisTemplate.getExpire("test:minutes:completed:" + done).block();
        Duration recordTtl = redisTemplate.getExpire("test:minutes:record:" + done).block();

        assertThat(markerTtl).isPositive().isLessThanOrEqualTo(Duration.ofHours(1));
        assertThat(recordTtl).isPositive().isLessThanOrEqualTo(Duration.ofHours(1));
    }

    @Test
    void workflowTransitionsAreJournaledInRedis() {
        String seriesId = "ms-" + UUID.randomUUID();
        collections.meetingSeries().insert(Map.of(Documents.ID, seriesId, "name", "Weekly", "minutes", List.of())).block();

        String minutesId = workflow.addMinutes(CallerIdentity.of("u-mod", "alice"),
                new Minutes(seriesId, LocalDate.of(2024, 1, 1)), null).block();

        assertThat(minutesId).isNotBlank();
        StepVerifier.create(journal.findByStatus(TransitionStatus.COMPLETED)
                        .filter(record -> seriesId.equals(record.getTargetId())))
                .assertNext(record -> assertThat(record.getSteps())
                        .containsEntry("insertMinutes", StepOutcome.SUCCEEDED)
                        .containsEntry("linkToMeetingSeries", StepOutcome.SUCCEEDED))
                .verifyComplete();
    }
}
