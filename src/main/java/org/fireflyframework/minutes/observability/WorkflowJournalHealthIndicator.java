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

import org.fireflyframework.minutes.persistence.TransitionStatus;
import org.fireflyframework.minutes.persistence.WorkflowJournal;
import org.springframework.boot.actuate.health.AbstractReactiveHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;

/**
 * Spring Boot Actuator health indicator for the transition journal.
 * <p>
 * DOWN when the journal backend is unreachable; DEGRADED while inconsistent transitions wait for repair.
 */
public class WorkflowJournalHealthIndicator extends AbstractReactiveHealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED");

    private final WorkflowJournal journal;

    public WorkflowJournalHealthIndicator(WorkflowJournal journal) {
        super("Workflow journal health check failed");
        this.journal = journal;
    }

    @Override
    protected Mono<Health> doHealthCheck(Health.Builder builder) {
        builder.withDetail("provider", journal.getProviderType().name());
        return journal.isHealthy()
                .flatMap(healthy -> {
                    if (!healthy) {
                        return Mono.just(builder.down().build());
                    }
                    return journal.findByStatus(TransitionStatus.INCONSISTENT).count()
                            .map(inconsistent -> builder
                                    .status(inconsistent > 0 ? DEGRADED : Status.UP)
                                    .withDetail("inconsistent.transitions", inconsistent)
                                    .build());
                });
    }
}
