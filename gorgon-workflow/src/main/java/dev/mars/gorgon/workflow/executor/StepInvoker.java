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

/**
 * External capability that performs the actual work of a tool or shell step.
 * <p>
 * Implementations must be safe to call concurrently and must honour the invocation's
 * timeout. Provider rate-limit rejections are returned as
 * {@link InvocationResult#rateLimited(String)}, not thrown.
 */
@FunctionalInterface
public interface StepInvoker {

    InvocationResult invoke(Invocation invocation) throws InterruptedException;
}
