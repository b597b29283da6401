package io.nosqlbench.cea.psa;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.cea.economics.EconomicAggregator;
import io.nosqlbench.cea.economics.StrategyOutcome;
import io.nosqlbench.cea.model.SampledParameters;
import io.nosqlbench.cea.model.strategy.StrategyRegistry;

/// Evaluates every strategy for one parameter draw.
///
/// Implementations must be safe to call from several worker threads at
/// once, and must return outcomes in strategy registry order.
@FunctionalInterface
public interface IterationEvaluator {

    StrategyOutcome[] evaluate(SampledParameters parameters);

    /// Evaluator that simulates each registered strategy in turn.
    ///
    /// @throws io.nosqlbench.cea.model.errors.ValidationException if a one-time
    ///         cost lies outside the simulated horizon
    static IterationEvaluator of(EconomicAggregator aggregator, StrategyRegistry registry) {
        aggregator.checkHorizon(registry);
        return parameters -> aggregator.evaluateAll(registry, parameters);
    }
}
