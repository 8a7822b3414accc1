/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.gorgon.workflow.executor;

import dev.mars.gorgon.ratelimit.Permit;
import dev.mars.gorgon.ratelimit.RateLimitExceededException;
import dev.mars.gorgon.ratelimit.RateLimiter;
import dev.mars.gorgon.workflow.StepDefinition;
import dev.mars.gorgon.workflow.StepKind;
import dev.mars.gorgon.workflow.engine.StepErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ToolCallStepHandlerTest {

    @Mock
    private StepInvoker invoker;

    @Mock
    private RateLimiter rateLimiter;

    private ToolCallStepHandler handler;
    private StepContext context;
    private Permit permit;

    @BeforeEach
    void setUp() {
        handler = new ToolCallStepHandler(invoker, rateLimiter);
        permit = new Permit("anthropic", Instant.now());
        StepDefinition step = StepDefinition.builder("summarize", StepKind.TOOL_CALL)
                .provider("anthropic")
                .param("prompt", "Summarise the diff")
                .build();
        context = StepContext.builder()
                .executionId("exec-1")
                .workflowId("wf")
                .step(step)
                .params(step.getParams())
                .variables(Map.of())
                .timeout(Duration.ofSeconds(5))
                .build();
    }

    @Test
    void successfulCallReleasesPermitAndReportsTokens() throws Exception {
        when(rateLimiter.acquire("anthropic", Duration.ofSeconds(5))).thenReturn(permit);
        when(invoker.invoke(any())).thenReturn(InvocationResult.success("summary", Map.of("model", "m"), 120));

        StepOutcome outcome = handler.execute(context);

        assertThat(outcome.getPrimary()).isEqualTo("summary");
        assertThat(outcome.getOutputs()).containsEntry("model", "m");
        assertThat(outcome.getTokensUsed()).isEqualTo(120);
        verify(rateLimiter).release(permit);

        ArgumentCaptor<Invocation> invocation = ArgumentCaptor.forClass(Invocation.class);
        verify(invoker).invoke(invocation.capture());
        assertThat(invocation.getValue().getProvider()).isEqualTo("anthropic");
        assertThat(invocation.getValue().getParams()).containsEntry("prompt", "Summarise the diff");
    }

    @Test
    void providerThrottleIsReportedAndFailsAsRateLimited() throws Exception {
        when(rateLimiter.acquire(anyString(), any())).thenReturn(permit);
        when(invoker.invoke(any())).thenReturn(InvocationResult.rateLimited("429 Too Many Requests"));

        assertThatThrownBy(() -> handler.execute(context))
                .isInstanceOf(StepFailureException.class)
                .satisfies(e -> assertThat(((StepFailureException) e).getKind()).isEqualTo(StepErrorKind.RATE_LIMITED))
                .hasMessageContaining("429");
        verify(rateLimiter).reportThrottled("anthropic");
        verify(rateLimiter).release(permit);
    }

    @Test
    void permitTimeoutFailsWithoutInvoking() throws Exception {
        when(rateLimiter.acquire(anyString(), any()))
                .thenThrow(new RateLimitExceededException("anthropic", "no permit within 5s"));

        assertThatThrownBy(() -> handler.execute(context))
                .isInstanceOf(StepFailureException.class)
                .satisfies(e -> assertThat(((StepFailureException) e).getKind()).isEqualTo(StepErrorKind.RATE_LIMITED));
        verify(invoker, never()).invoke(any());
    }

    @Test
    void invokerFailureIsToolInvocationFailure() throws Exception {
        when(rateLimiter.acquire(anyString(), any())).thenReturn(permit);
        when(invoker.invoke(any())).thenReturn(InvocationResult.failure("bad request"));

        assertThatThrownBy(() -> handler.execute(context))
                .isInstanceOf(StepFailureException.class)
                .satisfies(e -> assertThat(((StepFailureException) e).getKind())
                        .isEqualTo(StepErrorKind.TOOL_INVOCATION_FAILED))
                .hasMessage("bad request");
        verify(rateLimiter).release(permit);
    }

    @Test
    void worksWithoutRateLimiter() throws Exception {
        ToolCallStepHandler unlimited = new ToolCallStepHandler(invoker, null);
        when(invoker.invoke(any())).thenReturn(InvocationResult.success("ok"));

        assertThat(unlimited.execute(context).getPrimary()).isEqualTo("ok");
    }

    @Test
    void defaultProviderWhenStepNamesNone() throws Exception {
        ToolCallStepHandler unlimited = new ToolCallStepHandler(invoker, null);
        StepDefinition step = StepDefinition.builder("plain", StepKind.TOOL_CALL).build();
        when(invoker.invoke(any())).thenReturn(InvocationResult.success("ok"));

        unlimited.execute(context.toBuilder().step(step).build());

        ArgumentCaptor<Invocation> invocation = ArgumentCaptor.forClass(Invocation.class);
        verify(invoker).invoke(invocation.capture());
        assertThat(invocation.getValue().getProvider()).isEqualTo(ToolCallStepHandler.DEFAULT_PROVIDER);
    }
}
