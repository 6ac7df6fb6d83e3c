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

/**
 * Global mail settings consulted after a successful finalize.
 */
public interface MailDeliverySettings {

    boolean isEMailDeliveryEnabled();

    /**
     * Sender used when the finalizing user has no mail address; may be {@code null}.
     */
    String getDefaultEmailSenderAddress();

    static MailDeliverySettings of(boolean enabled, String defaultSenderAddress) {
        return new MailDeliverySettings() {
            @Override
            public boolean isEMailDeliveryEnabled() {
                return enabled;
            }

            @Override
            public String getDefaultEmailSenderAddress() {
                return defaultSenderAddress;
            }
        };
    }
}
