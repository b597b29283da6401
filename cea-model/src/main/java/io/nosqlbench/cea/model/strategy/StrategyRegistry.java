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

import io.nosqlbench.cea.model.Parameter;
import io.nosqlbench.cea.model.ParameterTable;
import io.nosqlbench.cea.model.errors.ValidationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/// Typed registry of the strategies under comparison, built once at
/// configuration time and validated for completeness before any
/// simulation runs.
///
/// Registration order fixes each strategy's index. Indexes break exact
/// ties between strategies: the lowest index wins.
public final class StrategyRegistry {

    private final List<StrategyArm> strategies;
    private final Map<String, Integer> indexById;
    private final int referenceIndex;

    private StrategyRegistry(List<StrategyArm> strategies, Map<String, Integer> indexById, int referenceIndex) {
        this.strategies = strategies;
        this.indexById = indexById;
        this.referenceIndex = referenceIndex;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return strategies.size();
    }

    public List<StrategyArm> strategies() {
        return strategies;
    }

    public StrategyArm get(int index) {
        return strategies.get(index);
    }

    public StrategyArm get(String id) {
        return strategies.get(indexOf(id));
    }

    public int indexOf(String id) {
        Integer index = indexById.get(id);
        if (index == null) {
            throw new ValidationException(id, "no such strategy");
        }
        return index;
    }

    public List<String> ids() {
        List<String> ids = new ArrayList<>(strategies.size());
        for (StrategyArm arm : strategies) {
            ids.add(arm.id());
        }
        return ids;
    }

    public StrategyArm reference() {
        return strategies.get(referenceIndex);
    }

    public int referenceIndex() {
        return referenceIndex;
    }

    public static final class Builder {
        private final List<StrategyArm> strategies = new ArrayList<>();
        private String referenceId;

        public Builder register(StrategyArm arm) {
            strategies.add(arm);
            return this;
        }

        public Builder reference(String referenceId) {
            this.referenceId = referenceId;
            return this;
        }

        /// Validates the registry against the declared parameters.
        ///
        /// @param parameters the resolved parameter table
        /// @return the registry
        /// @throws ValidationException if ids repeat, fewer than two strategies
        ///         are registered, the reference is unknown, or a strategy reads
        ///         an undeclared parameter or one owned by another strategy
        public StrategyRegistry build(ParameterTable parameters) {
            if (strategies.size() < 2) {
                throw new ValidationException("strategies",
                    "at least two strategies are required, got " + strategies.size());
            }
            Map<String, Integer> index = new HashMap<>();
            for (int i = 0; i < strategies.size(); i++) {
                if (index.putIfAbsent(strategies.get(i).id(), i) != null) {
                    throw new ValidationException(strategies.get(i).id(), "strategy is registered more than once");
                }
            }
            if (referenceId == null || !index.containsKey(referenceId)) {
                throw new ValidationException(String.valueOf(referenceId), "reference strategy is not registered");
            }
            for (Parameter p : parameters.parameters()) {
                if (!p.isShared() && !index.containsKey(p.owner())) {
                    throw new ValidationException(p.name(), "owned by unknown strategy " + p.owner());
                }
            }
            for (StrategyArm arm : strategies) {
                for (String name : arm.requiredParameters()) {
                    if (!parameters.contains(name)) {
                        throw new ValidationException(arm.id(), "required parameter '" + name + "' is not declared");
                    }
                    Parameter p = parameters.get(name);
                    if (!p.isShared() && !p.owner().equals(arm.id())) {
                        throw new ValidationException(arm.id(),
                            "parameter '" + name + "' belongs to strategy " + p.owner());
                    }
                }
            }
            return new StrategyRegistry(List.copyOf(strategies), Map.copyOf(index), index.get(referenceId));
        }
    }
}
