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

import org.fireflyframework.minutes.workflow.WorkflowErrorKind;
import org.fireflyframework.minutes.workflow.WorkflowException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthorizationGateTest {

    @Mock
    private ModeratorRoleResolver roleResolver;

    private static final CallerIdentity ALICE = CallerIdentity.of("u-1", "alice", "alice@example.org");

    @Test
    void moderatorPasses() {
        when(roleResolver.isModeratorOf(ALICE, "ms-1")).thenReturn(true);

        assertThatCode(() -> new AuthorizationGate(roleResolver).authorize(ALICE, "ms-1"))
                .doesNotThrowAnyException();
        verify(roleResolver).isModeratorOf(ALICE, "ms-1");
    }

    @Test
    void nonModeratorIsRejected() {
        when(roleResolver.isModeratorOf(any(), any())).thenReturn(false);

        assertThatThrownBy(() -> new AuthorizationGate(roleResolver).authorize(ALICE, "ms-1"))
                .isInstanceOfSatisfying(WorkflowException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(WorkflowErrorKind.NOT_AUTHORIZED);
                    assertThat(e.getDetail()).isEqualTo("Cannot modify meeting series ms-1. You are not a moderator.");
                    assertThat(e.getMessage()).startsWith("not-authorized: ");
                });
    }

    @Test
    void anonymousCallerIsNotAuthenticated() {
        AuthorizationGate gate = new AuthorizationGate(roleResolver);

        assertThatThrownBy(() -> gate.authorize(null, "ms-1"))
                .isInstanceOfSatisfying(WorkflowException.class,
                        e -> assertThat(e.getKind()).isEqualTo(WorkflowErrorKind.NOT_AUTHENTICATED));
        assertThatThrownBy(() -> gate.requireAuthenticated(CallerIdentity.of(" ", "nobody")))
                .isInstanceOfSatisfying(WorkflowException.class,
                        e -> assertThat(e.getKind().code()).isEqualTo("illegal-state"));
        verifyNoInteractions(roleResolver);
    }

    @Test
    void denyAllRejectsEveryone() {
        AuthorizationGate gate = new AuthorizationGate(ModeratorRoleResolver.denyAll());

        assertThatThrownBy(() -> gate.authorize(ALICE, "ms-1"))
                .isInstanceOf(WorkflowException.class);
    }

    @Test
    void callerIdentityPrefersFirstEmail() {
        assertThat(ALICE.firstEmail()).isEqualTo("alice@example.org");
        assertThat(CallerIdentity.of("u-2", "bob").firstEmail()).isNull();
        assertThat(new CallerIdentity("u-3", "carol", null).emails()).isEmpty();
    }
}
