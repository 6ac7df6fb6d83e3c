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
import reactor.core.scheduler.Scheduler;

import java.util.Map;
import java.util.Objects;

/**
 * Decorator that moves every call of a delegate collection onto a {@link Scheduler}, so results are
 * signalled later from another thread.
 * <p>
 * This is the deferred-completion execution context. Code written against {@link DocumentCollection}
 * behaves the same here as with an immediate collection because continuations are attached to the
 * returned {@link Mono}, not executed inline after the call.
 */
public class DeferredDocumentCollection implements DocumentCollection {

    private final DocumentCollection delegate;
    private final Scheduler scheduler;

    public DeferredDocumentCollection(DocumentCollection delegate, Scheduler scheduler) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public ExecutionMode executionMode() {
        return ExecutionMode.DEFERRED;
    }

    @Override
    public Mono<String> insert(Map<String, Object> document) {
        return delegate.insert(document).subscribeOn(scheduler);
    }

    @Override
    public Mono<Long> update(DocumentSelector selector, DocumentUpdate update) {
        return delegate.update(selector, update).subscribeOn(scheduler);
    }

    @Override
    public Mono<Long> remove(DocumentSelector selector) {
        return delegate.remove(selector).subscribeOn(scheduler);
    }

    @Override
    public Mono<Map<String, Object>> findOne(DocumentSelector selector) {
        return delegate.findOne(selector).subscribeOn(scheduler);
    }

    @Override
    public Flux<Map<String, Object>> find(DocumentSelector selector) {
        return delegate.find(selector).subscribeOn(scheduler);
    }
}
