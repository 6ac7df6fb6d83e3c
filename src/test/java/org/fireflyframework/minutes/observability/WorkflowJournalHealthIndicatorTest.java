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

import org.fireflyframework.minutes.persistence.TransitionRecord;
import org.fireflyframework.minutes.persistence.TransitionStatus;
import org.fireflyframework.minutes.persistence.WorkflowJournal;
import org.fireflyframework.minutes.persistence.impl.InMemoryWorkflowJournal;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WorkflowJournalHealthIndicatorTest {

    @Test
    void upWhenNothingNeedsRepair() {
        WorkflowJournalHealthIndicator indicator = new WorkflowJournalHealthIndicator(new InMemoryWorkflowJournal());

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails()).containsEntry("provider", "IN_MEMORY")
                            .containsEntry("inconsistent.transitions", 0L);
                })
                .verifyComplete();
    }

    @Test
    void degradedWhileInconsistentTransitionsExist() {
        InMemoryWorkflowJournal journal = new InMemoryWorkflowJournal();
        journal.begin(TransitionRecord.started("tx-1", "addMinutes", "ms-1", Instant.now())).block();
        journal.complete("tx-1", TransitionStatus.INCONSISTENT, "undo failed").block();

        StepVerifier.create(new WorkflowJournalHealthIndicator(journal).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(WorkflowJournalHealthIndicator.DEGRADED);
                    assertThat(health.getDetails()).containsEntry("inconsistent.transitions", 1L);
                })
                .verifyComplete();
    }

    @Test
    void downWhenJournalIsUnreachable() {
        WorkflowJournal journal = mock(WorkflowJournal.class);
        when(journal.getProviderType()).thenReturn(WorkflowJournal.JournalProviderType.REDIS);
        when(journal.isHealthy()).thenReturn(Mono.just(false));

        StepVerifier.create(new WorkflowJournalHealthIndicator(journal).health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }
}
