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
import dev.mars.gorgon.workflow.engine.StepErrorKind;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Handler for {@code tool_call} steps. Each call holds a rate limiter permit for the
 * step's provider; provider-side throttling is reported back to the limiter and surfaces
 * as a retryable {@link StepErrorKind#RATE_LIMITED} failure.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-06
 * @version 1.0
 */
public class ToolCallStepHandler implements StepHandler {

    private static final Logger logger = Logger.getLogger(ToolCallStepHandler.class.getName());

    public static final String DEFAULT_PROVIDER = "default";

    private final StepInvoker invoker;
    private final RateLimiter rateLimiter;

    /**
     * @param rateLimiter may be null to call the provider without limiting
     */
    public ToolCallStepHandler(StepInvoker invoker, RateLimiter rateLimiter) {
        this.invoker = Objects.requireNonNull(invoker, "Invoker cannot be null");
        this.rateLimiter = rateLimiter;
    }

    @Override
    public StepOutcome execute(StepContext context) throws InterruptedException {
        String provider = context.getStep().getProvider().orElse(DEFAULT_PROVIDER);
        Permit permit = null;
        if (rateLimiter != null) {
            try {
                permit = rateLimiter.acquire(provider, context.getTimeout());
            } catch (RateLimitExceededException e) {
                throw new StepFailureException(StepErrorKind.RATE_LIMITED, e.getMessage(), e);
            }
        }

        InvocationResult result;
        try {
            result = invoker.invoke(Invocation.from(context, provider));
        } finally {
            if (permit != null) {
                rateLimiter.release(permit);
            }
        }

        if (result.isRateLimited()) {
            logger.warning("Provider " + provider + " throttled step " + context.getStepId());
            if (rateLimiter != null) {
                rateLimiter.reportThrottled(provider);
            }
            throw new StepFailureException(StepErrorKind.RATE_LIMITED,
                    result.getError().orElse("Provider " + provider + " rate limited the request"));
        }
        if (!result.isSuccessful()) {
            throw new StepFailureException(StepErrorKind.TOOL_INVOCATION_FAILED,
                    result.getError().orElse("Tool call failed"));
        }
        return StepOutcome.builder()
                .primary(result.getRaw())
                .outputs(result.getOutputs())
                .tokensUsed(result.getTokensUsed())
                .build();
    }
}
