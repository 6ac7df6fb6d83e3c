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

package org.fireflyframework.minutes.security;

import java.util.List;

/**
 * The established identity of the caller of a workflow operation.
 *
 * @param userId   stable user id; blank means the caller is not authenticated
 * @param username name recorded as {@code finalizedBy}
 * @param emails   verified mail addresses, first one preferred as sender
 */
public record CallerIdentity(String userId, String username, List<String> emails) {

    public CallerIdentity {
        emails = emails != null ? List.copyOf(emails) : List.of();
    }

    public static CallerIdentity of(String userId, String username, String... emails) {
        return new CallerIdentity(userId, username, List.of(emails));
    }

    public boolean isAuthenticated() {
        return userId != null && !userId.isBlank();
    }

    /**
     * @return the first mail address, or {@code null} when the caller has none
     */
    public String firstEmail() {
        return emails.isEmpty() ? null : emails.get(0);
    }
}
