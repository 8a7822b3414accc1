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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handler for {@code map_reduce} steps: a fan-out over {@code items} followed by one fan-in.
 * <p>
 * Map parameters are those of {@code fan_out}. The {@code reduce} parameter is a map of
 * {@code fan_in} parameters ({@code method}, {@code prompt}, {@code separator},
 * {@code provider}); without it the mapped values are concatenated. Outputs are
 * {@code mapped} (ordered per-item values) and {@code result}.
 */
public class MapReduceStepHandler implements StepHandler {

    @Override
    public StepOutcome execute(StepContext context) throws InterruptedException {
        FanOutStepHandler.Scatter scatter = FanOutStepHandler.scatter(context);
        List<Object> mapped = scatter.values();

        Map<String, Object> reduceParams = new LinkedHashMap<>();
        Object reduce = context.getParams().get("reduce");
        if (reduce instanceof Map) {
            ((Map<?, ?>) reduce).forEach((key, value) -> reduceParams.put(String.valueOf(key), value));
        }
        StepOutcome reduced = FanInStepHandler.aggregate(context, mapped, reduceParams);

        return StepOutcome.builder()
                .primary(reduced.getPrimary())
                .output("mapped", mapped)
                .output("result", reduced.getPrimary())
                .tokensUsed(scatter.tokensUsed() + reduced.getTokensUsed())
                .children(scatter.instances)
                .build();
    }
}
