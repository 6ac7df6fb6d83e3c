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

package org.fireflyframework.minutes.notification;

import org.fireflyframework.minutes.domain.Minutes;
import org.fireflyframework.minutes.observability.WorkflowEvents;
import org.fireflyframework.minutes.security.CallerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Objects;

/**
 * Schedules finalize mails as a detached task.
 * <p>
 * The task runs on its own scheduler after the finalize has already completed; its failures are
 * logged and reported as events but never reach the caller of the finalize.
 */
public class FinalizeNotificationTrigger {

    private static final Logger log = LoggerFactory.getLogger(FinalizeNotificationTrigger.class);

    private final MailDeliverySettings settings;
    private final FinalizeMailer mailer;
    private final WorkflowEvents events;
    private final Scheduler scheduler;

    public FinalizeNotificationTrigger(MailDeliverySettings settings, FinalizeMailer mailer,
                                       WorkflowEvents events, Scheduler scheduler) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.mailer = Objects.requireNonNull(mailer, "mailer");
        this.events = Objects.requireNonNull(events, "events");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Sends the finalize mails for {@code minutes} unless mail delivery is disabled.
     * <p>
     * Reading the settings, resolving the sender, reporting events and sending all happen inside the
     * detached task, so nothing this method does can fail its caller.
     *
     * @return handle of the detached task
     */
    public Disposable onFinalized(CallerIdentity caller, Minutes minutes, boolean sendActionItems, boolean sendInfoItems) {
        return Mono.fromRunnable(() -> deliver(caller, minutes, sendActionItems, sendInfoItems))
                .subscribeOn(scheduler)
                .onErrorResume(error -> {
                    log.error("Sending finalize mails for minutes {} failed", minutes.getId(), error);
                    reportFailure(minutes.getId(), error);
                    return Mono.empty();
                })
                .subscribe();
    }

    private void deliver(CallerIdentity caller, Minutes minutes, boolean sendActionItems, boolean sendInfoItems) {
        if (!settings.isEMailDeliveryEnabled()) {
            log.info("Skip sending mails because email delivery is not enabled");
            events.onNotificationSkipped(minutes.getId(), "email delivery is not enabled");
            return;
        }
        String sender = resolveSender(caller);
        if (sender == null) {
            log.warn("Skip sending mails for minutes {}: no sender address available", minutes.getId());
            events.onNotificationSkipped(minutes.getId(), "no sender address");
            return;
        }

        events.onNotificationScheduled(minutes.getId(), sender);
        mailer.sendMails(minutes, sender, sendActionItems, sendInfoItems);
        log.debug("Sent finalize mails for minutes {}", minutes.getId());
    }

    private void reportFailure(String minutesId, Throwable error) {
        try {
            events.onNotificationFailed(minutesId, error);
        } catch (RuntimeException e) {
            log.warn("Reporting the failed finalize mails for minutes {} failed", minutesId, e);
        }
    }

    /**
     * The caller's first mail address, else the configured default sender.
     */
    String resolveSender(CallerIdentity caller) {
        String first = caller != null ? caller.firstEmail() : null;
        if (first != null && !first.isBlank()) {
            return first;
        }
        return settings.getDefaultEmailSenderAddress();
    }
}
