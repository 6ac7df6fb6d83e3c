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

package org.fireflyframework.minutes.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Two dependent writes to separately stored documents, with the first undone when the second fails.
 * <pre>
 * TwoPhaseWrite.first("insertMinutes", () -&gt; minutes.insert(doc))
 *         .compensateWith(id -&gt; minutes.remove(DocumentSelector.byId(id)))
 *         .then("linkToSeries", id -&gt; series.update(...))
 *         .execute(context);
 * </pre>
 * The second write and the compensation are continuations of the first write's result, so the
 * protocol is the same whether the collections complete immediately or on another thread.
 * When the second write fails the original error is always re-raised; a failing compensation is
 * logged and attached to it as suppressed.
 */
public final class TwoPhaseWrite<A, B> {

    private static final Logger log = LoggerFactory.getLogger(TwoPhaseWrite.class);

    private final String firstStepId;
    private final Supplier<Mono<A>> firstWrite;
    private final Function<A, Mono<?>> compensation;
    private final String secondStepId;
    private final Function<A, Mono<B>> secondWrite;

    private TwoPhaseWrite(String firstStepId, Supplier<Mono<A>> firstWrite, Function<A, Mono<?>> compensation,
                          String secondStepId, Function<A, Mono<B>> secondWrite) {
        this.firstStepId = firstStepId;
        this.firstWrite = firstWrite;
        this.compensation = compensation;
        this.secondStepId = secondStepId;
        this.secondWrite = secondWrite;
    }

    public static <A> FirstStep<A> first(String stepId, Supplier<Mono<A>> write) {
        return new FirstStep<>(Objects.requireNonNull(stepId, "stepId"), Objects.requireNonNull(write, "write"));
    }

    public Mono<Result<A, B>> execute(TransitionContext context) {
        return context.markStarted()
                .then(context.step(firstStepId, firstWrite))
                .flatMap(first -> context.step(secondStepId, () -> secondWrite.apply(first))
                        .map(second -> new Result<>(first, second))
                        .onErrorResume(error -> compensate(context, first, error)));
    }

    private Mono<Result<A, B>> compensate(TransitionContext context, A first, Throwable error) {
        return Mono.defer(() -> compensation.apply(first))
                .then(Mono.defer(() -> context.compensated(firstStepId, null)))
                .onErrorResume(compensationError -> {
                    log.error("Compensation of step {} failed for transition {}; documents may be inconsistent",
                            firstStepId, context.transitionId(), compensationError);
                    error.addSuppressed(compensationError);
                    return context.compensated(firstStepId, compensationError);
                })
                .then(Mono.<Result<A, B>>error(error));
    }

    public static final class FirstStep<A> {
        private final String stepId;
        private final Supplier<Mono<A>> write;

        private FirstStep(String stepId, Supplier<Mono<A>> write) {
            this.stepId = stepId;
            this.write = write;
        }

        public CompensableStep<A> compensateWith(Function<A, Mono<?>> compensation) {
            return new CompensableStep<>(stepId, write, Objects.requireNonNull(compensation, "compensation"));
        }
    }

    public static final class CompensableStep<A> {
        private final String stepId;
        private final Supplier<Mono<A>> write;
        private final Function<A, Mono<?>> compensation;

        private CompensableStep(String stepId, Supplier<Mono<A>> write, Function<A, Mono<?>> compensation) {
            this.stepId = stepId;
            this.write = write;
            this.compensation = compensation;
        }

        public <B> TwoPhaseWrite<A, B> then(String secondStepId, Function<A, Mono<B>> secondWrite) {
            return new TwoPhaseWrite<>(stepId, write, compensation,
                    Objects.requireNonNull(secondStepId, "secondStepId"),
                    Objects.requireNonNull(secondWrite, "secondWrite"));
        }
    }

    /**
     * Results of both writes.
     */
    public record Result<A, B>(A first, B second) {
    }
}
