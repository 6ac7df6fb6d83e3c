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

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Bridges a {@link CallbackDocumentStore} into the {@link Mono}-based {@link DocumentCollection} contract.
 * Each subscription issues exactly one store call; the callback completes the sink.
 */
public class CallbackDocumentCollection implements DocumentCollection {

    private final CallbackDocumentStore store;

    public CallbackDocumentCollection(CallbackDocumentStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public String name() {
        return store.name();
    }

    @Override
    public ExecutionMode executionMode() {
        return ExecutionMode.DEFERRED;
    }

    @Override
    public Mono<String> insert(Map<String, Object> document) {
        return bridge(sink -> store.insert(document, completing(sink)));
    }

    @Override
    public Mono<Long> update(DocumentSelector selector, DocumentUpdate update) {
        return bridge(sink -> store.update(selector, update, completing(sink)));
    }

    @Override
    public Mono<Long> remove(DocumentSelector selector) {
        return bridge(sink -> store.remove(selector, completing(sink)));
    }

    @Override
    public Mono<Map<String, Object>> findOne(DocumentSelector selector) {
        return find(selector).next();
    }

    @Override
    public Flux<Map<String, Object>> find(DocumentSelector selector) {
        Mono<List<Map<String, Object>>> found = bridge(sink -> store.find(selector, completing(sink)));
        return found.flatMapIterable(documents -> documents);
    }

    private static <T> Mono<T> bridge(Consumer<MonoSink<T>> call) {
        return Mono.create(sink -> {
            try {
                call.accept(sink);
            } catch (RuntimeException e) {
                sink.error(e);
            }
        });
    }

    private static <T> CompletionCallback<T> completing(MonoSink<T> sink) {
        return (error, result) -> {
            if (error != null) {
                sink.error(error);
            } else if (result == null) {
                sink.success();
            } else {
                sink.success(result);
            }
        };
    }
}
