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

package org.fireflyframework.minutes.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Finds journaled transitions that need attention and purges old ones.
 * <p>
 * Transitions are never replayed: a stale in-flight transition means the process stopped between
 * two writes, so it is marked {@link TransitionStatus#INCONSISTENT} and reported for manual repair.
 */
public class TransitionRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(TransitionRecoveryService.class);

    private final WorkflowJournal journal;
    private final Duration maxTransitionAge;
    private final Duration retention;
    private final Clock clock;

    public TransitionRecoveryService(WorkflowJournal journal, Duration maxTransitionAge, Duration retention, Clock clock) {
        this.journal = Objects.requireNonNull(journal, "journal");
        this.maxTransitionAge = Objects.requireNonNull(maxTransitionAge, "maxTransitionAge");
        this.retention = Objects.requireNonNull(retention, "retention");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return in-flight transitions not updated within the configured maximum age
     */
    public Flux<StaleTransition> identifyStaleTransitions() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(maxTransitionAge);
        log.debug("Identifying stale transitions older than: {}", cutoff);
        return journal.findStale(cutoff)
                .map(record -> new StaleTransition(record.getTransitionId(), record.getTransition(),
                        record.getTargetId(), record.getLastUpdatedAt(),
                        Duration.between(record.getLastUpdatedAt(), now)))
                .doOnNext(stale -> log.debug("Found stale transition: {} (age: {})", stale.transitionId(), stale.age()));
    }

    /**
     * Marks every stale transition as inconsistent.
     *
     * @return Mono containing the number of transitions marked
     */
    public Mono<Long> markStaleTransitionsInconsistent() {
        return identifyStaleTransitions()
                .concatMap(stale -> {
                    log.warn("Marking interrupted transition {} ({} on {}) as inconsistent",
                            stale.transitionId(), stale.transition(), stale.targetId());
                    return journal.complete(stale.transitionId(), TransitionStatus.INCONSISTENT,
                                    "Interrupted after " + stale.age())
                            .thenReturn(stale);
                })
                .count();
    }

    public Flux<TransitionRecord> inconsistentTransitions() {
        return journal.findByStatus(TransitionStatus.INCONSISTENT);
    }

    /**
     * Removes completed transitions older than the configured retention.
     */
    public Mono<Long> purgeCompleted() {
        return journal.cleanupCompleted(retention)
                .doOnSuccess(count -> log.info("Purged {} completed transitions", count));
    }

    /**
     * Runs a full pass: mark stale transitions, purge old ones, count what needs repair.
     */
    public Mono<RecoveryReport> runRecovery() {
        return markStaleTransitionsInconsistent()
                .zipWith(purgeCompleted())
                .flatMap(counts -> inconsistentTransitions().count()
                        .map(inconsistent -> new RecoveryReport(counts.getT1(), counts.getT2(), inconsistent)))
                .doOnSuccess(report -> {
                    if (report.inconsistent() > 0) {
                        log.warn("Transition recovery completed: {}", report);
                    } else {
                        log.info("Transition recovery completed: {}", report);
                    }
                });
    }

    public record StaleTransition(String transitionId, String transition, String targetId,
                                  Instant lastUpdatedAt, Duration age) {
    }

    public record RecoveryReport(long markedInconsistent, long purged, long inconsistent) {
    }
}
