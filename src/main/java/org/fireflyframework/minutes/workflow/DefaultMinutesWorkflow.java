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

import org.fireflyframework.minutes.collection.DocumentMapper;
import org.fireflyframework.minutes.collection.DocumentSelector;
import org.fireflyframework.minutes.collection.DocumentUpdate;
import org.fireflyframework.minutes.collection.WorkflowCollections;
import org.fireflyframework.minutes.domain.MeetingSeries;
import org.fireflyframework.minutes.domain.Minutes;
import org.fireflyframework.minutes.domain.Topic;
import org.fireflyframework.minutes.domain.WorkflowEntityLoader;
import org.fireflyframework.minutes.notification.FinalizeNotificationTrigger;
import org.fireflyframework.minutes.observability.WorkflowEvents;
import org.fireflyframework.minutes.persistence.WorkflowJournal;
import org.fireflyframework.minutes.security.AuthorizationGate;
import org.fireflyframework.minutes.security.CallerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Coordinates the minutes transitions across the minutes and meeting series collections.
 * <p>
 * Every transition authorizes the caller and validates the entity predicates before its first write.
 * Transitions touching both collections go through {@link TwoPhaseWrite}, so a failed second write
 * undoes the first one.
 */
public class DefaultMinutesWorkflow implements MinutesWorkflow {

    private static final Logger log = LoggerFactory.getLogger(DefaultMinutesWorkflow.class);

    static final String ADD_MINUTES = "addMinutes";
    static final String REMOVE_MINUTES = "removeMinutes";
    static final String FINALIZE_MINUTES = "finalizeMinutes";
    static final String UNFINALIZE_MINUTES = "unfinalizeMinutes";
    static final String REMOVE_MEETING_SERIES = "removeMeetingSeries";

    private final WorkflowCollections collections;
    private final DocumentMapper mapper;
    private final WorkflowEntityLoader loader;
    private final AuthorizationGate gate;
    private final FinalizeNotificationTrigger notificationTrigger;
    private final WorkflowEvents events;
    private final WorkflowJournal journal;
    private final Clock clock;

    public DefaultMinutesWorkflow(WorkflowCollections collections,
                                  DocumentMapper mapper,
                                  WorkflowEntityLoader loader,
                                  AuthorizationGate gate,
                                  FinalizeNotificationTrigger notificationTrigger,
                                  WorkflowEvents events,
                                  WorkflowJournal journal,
                                  Clock clock) {
        this.collections = Objects.requireNonNull(collections, "collections");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.notificationTrigger = Objects.requireNonNull(notificationTrigger, "notificationTrigger");
        this.events = Objects.requireNonNull(events, "events");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Mono<String> addMinutes(CallerIdentity caller, Minutes minutes, Consumer<String> completionHandler) {
        String meetingSeriesId = minutes != null ? minutes.getMeetingSeriesId() : null;
        return transition(ADD_MINUTES, meetingSeriesId, context -> {
            if (isBlank(meetingSeriesId)) {
                return Mono.error(invalidArgument("meetingSeries_id is required"));
            }
            if (minutes.getDate() == null) {
                return Mono.error(invalidArgument("date is required"));
            }
            gate.authorize(caller, meetingSeriesId);

            return loader.loadMeetingSeries(meetingSeriesId)
                    .switchIfEmpty(Mono.error(() -> notFound("Meeting series " + meetingSeriesId + " does not exist")))
                    .flatMap(series -> {
                        if (!series.addNewMinutesAllowed()) {
                            return Mono.error(notAllowed("Cannot create new minutes: the last minutes must be finalized first"));
                        }
                        if (!series.isMinutesDateAllowed(null, minutes.getDate())) {
                            return Mono.error(notAllowed("Cannot create new minutes: the date " + minutes.getDate()
                                    + " is not after the last finalized minutes"));
                        }
                        Map<String, Object> document = mapper.toDocument(minutes);
                        document.put(Minutes.FIELD_IS_FINALIZED, false);
                        document.put(Minutes.FIELD_IS_UNFINALIZED, false);

                        return TwoPhaseWrite.first("insertMinutes", () -> collections.minutes().insert(document))
                                .compensateWith(id -> collections.minutes().remove(DocumentSelector.byId(id)))
                                .then("linkToMeetingSeries", id -> collections.meetingSeries()
                                        .update(DocumentSelector.byId(meetingSeriesId),
                                                DocumentUpdate.push(MeetingSeries.FIELD_MINUTES, id))
                                        .flatMap(expectOne("meeting series", meetingSeriesId)))
                                .execute(context)
                                .map(TwoPhaseWrite.Result::first);
                    })
                    .doOnNext(id -> {
                        log.debug("Added minutes {} to meeting series {}", id, meetingSeriesId);
                        if (completionHandler != null) {
                            notifyCompletionHandler(completionHandler, id);
                        }
                    });
        });
    }

    @Override
    public Mono<Void> removeMinutes(CallerIdentity caller, String minutesId) {
        return transition(REMOVE_MINUTES, minutesId, context -> {
            if (isBlank(minutesId)) {
                return Mono.error(invalidArgument("minutes id is required"));
            }
            gate.requireAuthenticated(caller);

            return collections.minutes().findOne(DocumentSelector.byId(minutesId))
                    .flatMap(original -> {
                        String meetingSeriesId = mapper.fromDocument(original, Minutes.class).parentMeetingSeriesId();
                        gate.authorize(caller, meetingSeriesId);

                        return TwoPhaseWrite.first("removeMinutes", () -> collections.minutes()
                                        .remove(DocumentSelector.byId(minutesId).and(Minutes.FIELD_IS_FINALIZED, false)))
                                .compensateWith(removed -> removed > 0
                                        ? collections.minutes().insert(original)
                                        : Mono.empty())
                                .then("unlinkFromMeetingSeries", removed -> {
                                    if (removed == 0) {
                                        log.debug("Minutes {} is finalized; nothing removed", minutesId);
                                        return Mono.just(0L);
                                    }
                                    return collections.meetingSeries().update(DocumentSelector.byId(meetingSeriesId),
                                            DocumentUpdate.pull(MeetingSeries.FIELD_MINUTES, minutesId));
                                })
                                .execute(context);
                    })
                    .then();
        });
    }

    @Override
    public Mono<Void> finalizeMinutes(CallerIdentity caller, String minutesId, boolean sendActionItems, boolean sendInfoItems) {
        return transition(FINALIZE_MINUTES, minutesId, context -> loadForTransition(caller, minutesId)
                .flatMap(loaded -> {
                    Minutes minutes = loaded.minutes();
                    MeetingSeries series = loaded.series();
                    if (!series.isLastMinutes(minutesId)) {
                        return Mono.error(notAllowed("Only the last minutes of a meeting series can be finalized"));
                    }
                    if (minutes.isFinalized()) {
                        return Mono.error(notAllowed("Minutes " + minutesId + " are already finalized"));
                    }
                    List<Topic> previousTopics = copyOf(series.getTopics());
                    List<Topic> previousOpenTopics = copyOf(series.getOpenTopics());
                    series.finalizeLastMinutes();

                    String finalizedBy = caller.username();
                    Instant finalizedAtInstant = clock.instant();
                    Object finalizedAt = mapper.toValue(finalizedAtInstant);
                    DocumentUpdate markFinalized = DocumentUpdate.set(Minutes.FIELD_IS_FINALIZED, true)
                            .andSet(Minutes.FIELD_IS_UNFINALIZED, false)
                            .andSet(Minutes.FIELD_FINALIZED_AT, finalizedAt)
                            .andSet(Minutes.FIELD_FINALIZED_BY, finalizedBy);

                    return TwoPhaseWrite.first("updateSeriesTopics",
                                    () -> writeTopics(series.getId(), series.getTopics(), series.getOpenTopics()))
                            .compensateWith(updated -> writeTopics(series.getId(), previousTopics, previousOpenTopics))
                            .then("markFinalized", updated -> collections.minutes()
                                    .update(DocumentSelector.byId(minutesId), markFinalized)
                                    .flatMap(expectOne("minutes", minutesId)))
                            .execute(context)
                            .doOnNext(result -> {
                                minutes.setFinalized(true);
                                minutes.setUnfinalized(false);
                                minutes.setFinalizedBy(finalizedBy);
                                minutes.setFinalizedAt(finalizedAtInstant);
                                scheduleNotification(caller, minutes, sendActionItems, sendInfoItems);
                            })
                            .then();
                }));
    }

    @Override
    public Mono<Void> unfinalizeMinutes(CallerIdentity caller, String minutesId) {
        return transition(UNFINALIZE_MINUTES, minutesId, context -> loadForTransition(caller, minutesId)
                .flatMap(loaded -> {
                    MeetingSeries series = loaded.series();
                    // a newer draft must be removed before an older minutes can be reopened
                    if (!series.isUnfinalizeMinutesAllowed(minutesId) || !series.isLastMinutes(minutesId)) {
                        return Mono.error(notAllowed("The minutes " + minutesId + " can not be un-finalized"));
                    }
                    List<Topic> previousTopics = copyOf(series.getTopics());
                    List<Topic> previousOpenTopics = copyOf(series.getOpenTopics());
                    series.unfinalizeLastMinutes();

                    return TwoPhaseWrite.first("updateSeriesTopics",
                                    () -> writeTopics(series.getId(), series.getTopics(), series.getOpenTopics()))
                            .compensateWith(updated -> writeTopics(series.getId(), previousTopics, previousOpenTopics))
                            .then("markUnfinalized", updated -> collections.minutes()
                                    .update(DocumentSelector.byId(minutesId),
                                            DocumentUpdate.set(Minutes.FIELD_IS_FINALIZED, false)
                                                    .andSet(Minutes.FIELD_IS_UNFINALIZED, true))
                                    .flatMap(expectOne("minutes", minutesId)))
                            .execute(context)
                            .then();
                }));
    }

    @Override
    public Mono<Void> removeMeetingSeries(CallerIdentity caller, String meetingSeriesId) {
        if (isBlank(meetingSeriesId)) {
            return Mono.empty();
        }
        return transition(REMOVE_MEETING_SERIES, meetingSeriesId, context -> {
            gate.authorize(caller, meetingSeriesId);
            return context.markStarted()
                    .then(context.step("removeMinutes", () -> collections.minutes()
                            .remove(DocumentSelector.where(Minutes.FIELD_MEETING_SERIES_ID, meetingSeriesId))))
                    .flatMap(removedMinutes -> context.step("removeMeetingSeries", () -> collections.meetingSeries()
                                    .remove(DocumentSelector.byId(meetingSeriesId)))
                            .doOnNext(removedSeries -> log.debug("Removed meeting series {} ({} document(s)) and {} minutes",
                                    meetingSeriesId, removedSeries, removedMinutes)))
                    .then();
        });
    }

    /**
     * Wraps a transition body with its events and journal bookkeeping. The body runs on subscription;
     * exceptions it throws become error signals.
     */
    private <T> Mono<T> transition(String name, String targetId, Function<TransitionContext, Mono<T>> body) {
        return Mono.defer(() -> {
            TransitionContext context = new TransitionContext(name, UUID.randomUUID().toString(), targetId,
                    events, journal, clock);
            events.onTransitionStarted(name, context.transitionId(), targetId);
            return Mono.defer(() -> body.apply(context))
                    .onErrorResume(error -> context.failed(error).then(Mono.<T>error(error)))
                    .flatMap(value -> context.succeeded().thenReturn(value))
                    .switchIfEmpty(Mono.defer(() -> context.succeeded().then(Mono.<T>empty())));
        });
    }

    // both writes are committed when these run; their failures are logged only
    private void notifyCompletionHandler(Consumer<String> completionHandler, String minutesId) {
        try {
            completionHandler.accept(minutesId);
        } catch (RuntimeException e) {
            log.warn("Completion handler failed for added minutes {}", minutesId, e);
        }
    }

    private void scheduleNotification(CallerIdentity caller, Minutes minutes, boolean sendActionItems, boolean sendInfoItems) {
        try {
            notificationTrigger.onFinalized(caller, minutes, sendActionItems, sendInfoItems);
        } catch (RuntimeException e) {
            log.error("Scheduling finalize mails for minutes {} failed", minutes.getId(), e);
        }
    }

    private Mono<LoadedTransition> loadForTransition(CallerIdentity caller, String minutesId) {
        if (isBlank(minutesId)) {
            return Mono.error(invalidArgument("minutes id is required"));
        }
        gate.requireAuthenticated(caller);
        return loader.loadMinutes(minutesId)
                .switchIfEmpty(Mono.error(() -> notFound("Minutes " + minutesId + " do not exist")))
                .flatMap(minutes -> {
                    gate.authorize(caller, minutes.parentMeetingSeriesId());
                    return minutes.parentMeetingSeries(loader)
                            .switchIfEmpty(Mono.error(() -> notFound("Meeting series "
                                    + minutes.parentMeetingSeriesId() + " does not exist")))
                            .map(series -> new LoadedTransition(minutes, series));
                });
    }

    private Mono<Long> writeTopics(String meetingSeriesId, List<Topic> topics, List<Topic> openTopics) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(MeetingSeries.FIELD_TOPICS, mapper.toValue(topics));
        fields.put(MeetingSeries.FIELD_OPEN_TOPICS, mapper.toValue(openTopics));
        return collections.meetingSeries()
                .update(DocumentSelector.byId(meetingSeriesId), DocumentUpdate.setAll(fields))
                .flatMap(expectOne("meeting series", meetingSeriesId));
    }

    private static Function<Long, Mono<Long>> expectOne(String what, String id) {
        return affected -> affected == 1
                ? Mono.just(affected)
                : Mono.error(new WorkflowException(WorkflowErrorKind.RUNTIME_ERROR,
                        "Updating " + what + " " + id + " affected " + affected + " documents instead of one"));
    }

    private static List<Topic> copyOf(List<Topic> topics) {
        List<Topic> copy = new ArrayList<>(topics.size());
        for (Topic topic : topics) {
            copy.add(topic.copy());
        }
        return copy;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static WorkflowException invalidArgument(String detail) {
        return new WorkflowException(WorkflowErrorKind.INVALID_ARGUMENT, detail);
    }

    private static WorkflowException notAllowed(String detail) {
        return new WorkflowException(WorkflowErrorKind.NOT_ALLOWED, detail);
    }

    private static WorkflowException notFound(String detail) {
        return new WorkflowException(WorkflowErrorKind.NOT_FOUND, detail);
    }

    private record LoadedTransition(Minutes minutes, MeetingSeries series) {
    }
}
