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

package org.fireflyframework.minutes.collection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory collection that completes every call on the subscribing thread.
 * <p>
 * This is the immediate-completion execution context: a failure surfaces before the subscribing call returns.
 * Documents are copied on the way in and out, so callers never share state with the store.
 * Writes to a single document are atomic; there is no multi-document atomicity.
 * <p>
 * Suitable for:
 * <ul>
 *   <li>Development and testing</li>
 *   <li>Embedding the workflow without an external store</li>
 * </ul>
 */
public class InMemoryDocumentCollection implements DocumentCollection {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentCollection.class);

    private final String name;
    private final ConcurrentMap<String, Map<String, Object>> documents = new ConcurrentHashMap<>();

    public InMemoryDocumentCollection(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ExecutionMode executionMode() {
        return ExecutionMode.IMMEDIATE;
    }

    @Override
    public Mono<String> insert(Map<String, Object> document) {
        return Mono.fromCallable(() -> {
            Objects.requireNonNull(document, "document");
            Map<String, Object> copy = Documents.deepCopy(document);
            String id = Documents.idOf(copy);
            if (id == null) {
                id = UUID.randomUUID().toString();
                copy.put(Documents.ID, id);
            }
            if (documents.putIfAbsent(id, copy) != null) {
                throw new IllegalStateException("Duplicate key " + id + " in collection " + name);
            }
            log.debug("Inserted document {} into {}", id, name);
            return id;
        });
    }

    @Override
    public Mono<Long> update(DocumentSelector selector, DocumentUpdate update) {
        return Mono.fromCallable(() -> {
            AtomicLong affected = new AtomicLong();
            for (String id : candidateIds(selector)) {
                documents.computeIfPresent(id, (key, current) -> {
                    if (!selector.matches(current)) {
                        return current;
                    }
                    Map<String, Object> updated = Documents.deepCopy(current);
                    update.applyTo(updated);
                    affected.incrementAndGet();
                    return updated;
                });
            }
            log.debug("Updated {} document(s) in {} matching {}", affected.get(), name, selector);
            return affected.get();
        });
    }

    @Override
    public Mono<Long> remove(DocumentSelector selector) {
        return Mono.fromCallable(() -> {
            long removed = 0;
            for (String id : candidateIds(selector)) {
                Map<String, Object> current = documents.get(id);
                if (current != null && selector.matches(current) && documents.remove(id, current)) {
                    removed++;
                }
            }
            log.debug("Removed {} document(s) from {} matching {}", removed, name, selector);
            return removed;
        });
    }

    @Override
    public Mono<Map<String, Object>> findOne(DocumentSelector selector) {
        return find(selector).next();
    }

    @Override
    public Flux<Map<String, Object>> find(DocumentSelector selector) {
        return Flux.defer(() -> Flux.fromIterable(candidateIds(selector))
                .mapNotNull(documents::get)
                .filter(selector::matches)
                .map(Documents::deepCopy));
    }

    /**
     * @return number of stored documents; useful for monitoring and testing
     */
    public int size() {
        return documents.size();
    }

    private List<String> candidateIds(DocumentSelector selector) {
        String id = selector.idCriterion();
        if (id != null) {
            return documents.containsKey(id) ? List.of(id) : List.of();
        }
        return new ArrayList<>(documents.keySet());
    }
}
