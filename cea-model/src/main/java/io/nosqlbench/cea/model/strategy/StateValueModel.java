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

import io.nosqlbench.cea.model.SampledParameters;
import io.nosqlbench.cea.model.errors.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Per-state value a strategy attaches to cohort occupancy: a per-cycle
/// cost, or an annual utility weight.
@FunctionalInterface
public interface StateValueModel {

    /// @param state index into the strategy's [StateSpace]
    /// @param cycle zero-based cycle index
    /// @param parameters the iteration's realised parameter values
    /// @return the value for one cohort member occupying the state in this cycle
    double valueFor(int state, int cycle, SampledParameters parameters);

    /// Returns the parameter names this model reads.
    default List<String> requiredParameters() {
        return List.of();
    }

    /// Builds a table-driven model keyed by base state name.
    ///
    /// Tunnel sub-states resolve through their base state. The death state
    /// is worth 0 unless listed. Any other state missing from the table is a
    /// configuration error.
    ///
    /// @param space the strategy's state space
    /// @param byBaseState values keyed by base state name
    /// @return the model
    static StateValueModel byState(StateSpace space, Map<String, ValueRef> byBaseState) {
        Map<String, ValueRef> table = new LinkedHashMap<>(byBaseState);
        for (String key : table.keySet()) {
            if (!space.baseStates().contains(key)) {
                throw new ValidationException(key, "not a health state of " + space);
            }
        }
        ValueRef[] resolved = new ValueRef[space.size()];
        for (int i = 0; i < space.size(); i++) {
            ValueRef ref = table.get(space.baseState(i));
            if (ref == null) {
                if (i != space.deathState()) {
                    throw new ValidationException(space.name(i), "no value is defined for this health state");
                }
                ref = ValueRef.ZERO;
            }
            resolved[i] = ref;
        }
        List<String> required = new ArrayList<>();
        for (ValueRef ref : table.values()) {
            ref.parameterName().filter(n -> !required.contains(n)).ifPresent(required::add);
        }
        List<String> requiredView = List.copyOf(required);

        return new StateValueModel() {
            @Override
            public double valueFor(int state, int cycle, SampledParameters parameters) {
                return resolved[state].resolve(parameters);
            }

            @Override
            public List<String> requiredParameters() {
                return requiredView;
            }
        };
    }
}
