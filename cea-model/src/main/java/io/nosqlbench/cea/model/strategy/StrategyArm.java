package io.nosqlbench.cea.model.strategy;

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

import io.nosqlbench.cea.model.errors.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// One competing treatment strategy: how its cohort transitions between
/// health states, and what each state costs and is worth.
///
/// ## Usage
///
/// ```java
/// StrategyArm ect = StrategyArm.builder("ECT")
///     .transitions(new DepressionTransitionModel(...))
///     .costs(StateValueModel.byState(space, stateCosts))
///     .utilities(StateValueModel.byState(space, stateUtilities))
///     .oneTimeCost(new OneTimeCost("acute course", 0, ValueRef.parameter("ect_acute_cost")))
///     .build();
/// ```
public final class StrategyArm {

    private final String id;
    private final TransitionModel transitions;
    private final StateValueModel costs;
    private final StateValueModel utilities;
    private final List<OneTimeCost> oneTimeCosts;
    private final ValueRef acuteDisutility;
    private final int acuteCycles;
    private final List<String> requiredParameters;

    private StrategyArm(Builder builder) {
        this.id = builder.id;
        this.transitions = builder.transitions;
        this.costs = builder.costs;
        this.utilities = builder.utilities;
        this.oneTimeCosts = List.copyOf(builder.oneTimeCosts);
        this.acuteDisutility = builder.acuteDisutility;
        this.acuteCycles = builder.acuteCycles;
        this.requiredParameters = List.copyOf(collectRequired());
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() {
        return id;
    }

    public StateSpace stateSpace() {
        return transitions.stateSpace();
    }

    public TransitionModel transitions() {
        return transitions;
    }

    /// Per-cycle cost of occupying each state.
    public StateValueModel costs() {
        return costs;
    }

    /// Annual utility weight of occupying each state.
    public StateValueModel utilities() {
        return utilities;
    }

    public List<OneTimeCost> oneTimeCosts() {
        return oneTimeCosts;
    }

    /// Utility decrement applied during the acute treatment phase.
    public ValueRef acuteDisutility() {
        return acuteDisutility;
    }

    /// Number of leading cycles the acute decrement applies to.
    public int acuteCycles() {
        return acuteCycles;
    }

    /// Returns every parameter this strategy reads, in first-use order.
    public List<String> requiredParameters() {
        return requiredParameters;
    }

    private List<String> collectRequired() {
        List<String> names = new ArrayList<>();
        addAll(names, transitions.requiredParameters());
        addAll(names, costs.requiredParameters());
        addAll(names, utilities.requiredParameters());
        for (OneTimeCost cost : oneTimeCosts) {
            cost.amount().parameterName().ifPresent(n -> addAll(names, List.of(n)));
        }
        acuteDisutility.parameterName().ifPresent(n -> addAll(names, List.of(n)));
        return names;
    }

    private static void addAll(List<String> target, List<String> names) {
        for (String name : names) {
            if (!target.contains(name)) {
                target.add(name);
            }
        }
    }

    @Override
    public String toString() {
        return "StrategyArm[" + id + "]";
    }

    public static final class Builder {
        private final String id;
        private TransitionModel transitions;
        private StateValueModel costs;
        private StateValueModel utilities;
        private final List<OneTimeCost> oneTimeCosts = new ArrayList<>();
        private ValueRef acuteDisutility = ValueRef.ZERO;
        private int acuteCycles;

        private Builder(String id) {
            if (id == null || id.isBlank()) {
                throw new ValidationException("strategy", "strategy id must not be blank");
            }
            this.id = id;
        }

        public Builder transitions(TransitionModel transitions) {
            this.transitions = transitions;
            return this;
        }

        public Builder costs(StateValueModel costs) {
            this.costs = costs;
            return this;
        }

        public Builder utilities(StateValueModel utilities) {
            this.utilities = utilities;
            return this;
        }

        public Builder oneTimeCost(OneTimeCost cost) {
            this.oneTimeCosts.add(Objects.requireNonNull(cost));
            return this;
        }

        /// Sets a utility decrement for the first `cycles` cycles.
        public Builder acutePhase(int cycles, ValueRef disutility) {
            if (cycles < 0) {
                throw new ValidationException(id, "acute cycles must be non-negative, got " + cycles);
            }
            this.acuteCycles = cycles;
            this.acuteDisutility = Objects.requireNonNull(disutility);
            return this;
        }

        public StrategyArm build() {
            if (transitions == null) {
                throw new ValidationException(id, "strategy has no transition definition");
            }
            if (costs == null) {
                throw new ValidationException(id, "strategy has no cost definition");
            }
            if (utilities == null) {
                throw new ValidationException(id, "strategy has no utility definition");
            }
            return new StrategyArm(this);
        }
    }
}
