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

package org.fireflyframework.minutes.persistence.impl;

import org.fireflyframework.minutes.config.MinutesWorkflowProperties;
import org.fireflyframework.minutes.persistence.StepOutcome;
import org.fireflyframework.minutes.persistence.TransitionRecord;
import org.fireflyframework.minutes.persistence.TransitionStatus;
import org.fireflyframework.minutes.persistence.WorkflowJournal;
import org.fireflyframework.minutes.persistence.serialization.TransitionRecordSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Redis-based implementation of WorkflowJournal.
 * <p>
 * Keeps the journal across application restarts so that transitions interrupted by a crash
 * can still be found.
 * <p>
 * Redis key structure:
 * <ul>
 *   <li>{prefix}record:{transitionId} - Complete transition record</li>
 *   <li>{prefix}metadata:{transitionId} - Lightweight metadata for scans</li>
 *   <li>{prefix}completed:{transitionId} - Completion timestamp for cleanup</li>
 * </ul>
 * Inconsistent transitions never get a completion key, so cleanup leaves them in place.
 */
public class RedisWorkflowJournal implements WorkflowJournal {

    private static final Logger log = LoggerFactory.getLogger(RedisWorkflowJournal.class);

    private static final String HEALTH_KEY_SUFFIX = "health:check";

    private final ReactiveRedisTemplate<String, byte[]> redisTemplate;
    private final TransitionRecordSerializer serializer;
    private final MinutesWorkflowProperties.RedisProperties redisProperties;
    private final Clock clock;

    private final String recordKeyPrefix;
    private final String metadataKeyPrefix;
    private final String completedKeyPrefix;
    private final String healthKey;

    public RedisWorkflowJournal(ReactiveRedisTemplate<String, byte[]> redisTemplate,
                                TransitionRecordSerializer serializer,
                                MinutesWorkflowProperties.RedisProperties redisProperties,
                                Clock clock) {
        this.redisTemplate = redisTemplate;
        this.serializer = serializer;
        this.redisProperties = redisProperties;
        this.clock = clock;

        String basePrefix = redisProperties.getKeyPrefix();
        this.recordKeyPrefix = basePrefix + "record:";
        this.metadataKeyPrefix = basePrefix + "metadata:";
        this.completedKeyPrefix = basePrefix + "completed:";
        this.healthKey = basePrefix + HEALTH_KEY_SUFFIX;

        log.info("Initialized Redis workflow journal with key prefix: {}", basePrefix);
    }

    @Override
    public Mono<Void> begin(TransitionRecord record) {
        return write(record);
    }

    @Override
    public Mono<Void> recordStep(String transitionId, String stepId, StepOutcome outcome) {
        return modify(transitionId, current -> current.withStep(stepId, outcome, clock.instant()));
    }

    @Override
    public Mono<Void> complete(String transitionId, TransitionStatus status, String reason) {
        return modify(transitionId, current -> current.completed(status, reason, clock.instant()));
    }

    private Mono<Void> modify(String transitionId, UnaryOperator<TransitionRecord> change) {
        return get(transitionId)
                .flatMap(optionalRecord -> {
                    if (optionalRecord.isEmpty()) {
                        log.warn("Attempted to update unknown transition: {}", transitionId);
                        return Mono.empty();
                    }
                    return write(change.apply(optionalRecord.get()));
                });
    }

    private Mono<Void> write(TransitionRecord record) {
        String transitionId = record.getTransitionId();
        String recordKey = recordKeyPrefix + transitionId;
        String metadataKey = metadataKeyPrefix + transitionId;

        return Mono.fromCallable(() -> {
                    try {
                        return serializer.serialize(record);
                    } catch (TransitionRecordSerializer.SerializationException e) {
                        throw new IllegalStateException("Failed to serialize transition " + transitionId, e);
                    }
                })
                .flatMap(bytes -> {
                    Mono<Boolean> recordOp = redisTemplate.opsForValue().set(recordKey, bytes);
                    Mono<Boolean> metadataOp = redisTemplate.opsForValue()
                            .set(metadataKey, TransitionMetadata.from(record).toBytes());

                    boolean markCompleted = record.getStatus().isCompleted() && !record.getStatus().requiresIntervention();
                    String completedKey = completedKeyPrefix + transitionId;
                    Mono<Boolean> completedOp = Mono.empty();
                    if (markCompleted) {
                        completedOp = redisTemplate.opsForValue().set(completedKey,
                                record.getCompletedAt().toString().getBytes(StandardCharsets.UTF_8));
                    }

                    Mono<Void> ttlOp = Mono.empty();
                    Duration keyTtl = redisProperties.getKeyTtl();
                    if (keyTtl != null) {
                        ttlOp = redisTemplate.expire(recordKey, keyTtl)
                                .then(redisTemplate.expire(metadataKey, keyTtl))
                                .then(markCompleted ? redisTemplate.expire(completedKey, keyTtl) : Mono.<Boolean>empty())
                                .then();
                    }
                    return Mono.when(recordOp, metadataOp, completedOp).then(ttlOp);
                })
                .doOnSuccess(v -> log.debug("Persisted transition {} to Redis with status {}",
                        transitionId, record.getStatus()))
                .doOnError(error -> log.error("Failed to persist transition {} to Redis", transitionId, error));
    }

    @Override
    public Mono<Optional<TransitionRecord>> get(String transitionId) {
        return redisTemplate.opsForValue().get(recordKeyPrefix + transitionId)
                .map(bytes -> {
                    try {
                        return Optional.of(serializer.deserialize(bytes));
                    } catch (TransitionRecordSerializer.SerializationException e) {
                        log.error("Failed to deserialize transition record: {}", transitionId, e);
                        return Optional.<TransitionRecord>empty();
                    }
                })
                .defaultIfEmpty(Optional.empty());
    }

    @Override
    public Flux<TransitionRecord> findInFlight() {
        return scanRecords(metadata -> metadata.status().isInFlight())
                .doOnSubscribe(subscription -> log.debug("Scanning Redis for in-flight transitions"));
    }

    @Override
    public Flux<TransitionRecord> findStale(Instant before) {
        return scanRecords(metadata -> metadata.status().isInFlight() && metadata.lastUpdated().isBefore(before))
                .doOnSubscribe(subscription -> log.debug("Scanning Redis for stale transitions before: {}", before));
    }

    @Override
    public Flux<TransitionRecord> findByStatus(TransitionStatus status) {
        return scanRecords(metadata -> metadata.status() == status);
    }

    private Flux<TransitionRecord> scanRecords(Predicate<TransitionMetadata> filter) {
        return redisTemplate.scan(ScanOptions.scanOptions().match(metadataKeyPrefix + "*").build())
                .flatMap(metadataKey -> redisTemplate.opsForValue().get(metadataKey))
                .map(TransitionMetadata::fromBytes)
                .filter(filter)
                .flatMap(metadata -> get(metadata.transitionId()))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .onErrorContinue((throwable, obj) ->
                        log.warn("Error processing transition metadata during scan", throwable));
    }

    @Override
    public Mono<Long> cleanupCompleted(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);

        return redisTemplate.scan(ScanOptions.scanOptions().match(completedKeyPrefix + "*").build())
                .flatMap(completedKey -> redisTemplate.opsForValue().get(completedKey)
                        .filter(bytes -> completedBefore(completedKey, bytes, cutoff))
                        .map(bytes -> completedKey.substring(completedKeyPrefix.length())))
                .flatMap(this::deleteKeys)
                .count()
                .doOnSuccess(count -> log.debug("Cleaned up {} completed transitions from Redis", count));
    }

    private boolean completedBefore(String completedKey, byte[] timestamp, Instant cutoff) {
        try {
            return Instant.parse(new String(timestamp, StandardCharsets.UTF_8)).isBefore(cutoff);
        } catch (RuntimeException e) {
            log.warn("Failed to parse completion timestamp for key: {}", completedKey, e);
            return false;
        }
    }

    private Mono<String> deleteKeys(String transitionId) {
        return redisTemplate.delete(recordKeyPrefix + transitionId,
                        metadataKeyPrefix + transitionId,
                        completedKeyPrefix + transitionId)
                .thenReturn(transitionId);
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return redisTemplate.opsForValue()
                .set(healthKey, "ok".getBytes(StandardCharsets.UTF_8), Duration.ofSeconds(10))
                .doOnNext(result -> log.debug("Redis health check result: {}", result))
                .onErrorResume(error -> {
                    log.warn("Redis journal health check failed", error);
                    return Mono.just(false);
                });
    }

    @Override
    public JournalProviderType getProviderType() {
        return JournalProviderType.REDIS;
    }

    /**
     * Lightweight metadata for efficient scans.
     */
    private record TransitionMetadata(String transitionId, TransitionStatus status, Instant lastUpdated) {

        static TransitionMetadata from(TransitionRecord record) {
            return new TransitionMetadata(record.getTransitionId(), record.getStatus(), record.getLastUpdatedAt());
        }

        byte[] toBytes() {
            return (transitionId + "|" + status + "|" + lastUpdated).getBytes(StandardCharsets.UTF_8);
        }

        static TransitionMetadata fromBytes(byte[] data) {
            String[] parts = new String(data, StandardCharsets.UTF_8).split("\\|");
            return new TransitionMetadata(parts[0], TransitionStatus.valueOf(parts[1]), Instant.parse(parts[2]));
        }
    }
}
