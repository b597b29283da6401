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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Ordered set of health states a cohort moves through.
///
/// ## Layout
///
/// ```text
///  simple():            Depressed ─► Remission ─► Death
///
///  withRemissionTunnels(3):
///                       Depressed ─► Remission_m1 ─► Remission_m2 ─► Remission_m3 ─► Remission_late
///                           ▲              │               │               │               │
///                           └──── relapse ─┴───────────────┴───────────────┴───────────────┘
///                       every state ─► Death (absorbing)
/// ```
///
/// Tunnel sub-states record months since remission. They share the costs
/// and utilities of their base state, which [#baseState(int)] reports.
public final class StateSpace {

    public static final String DEPRESSED = "Depressed";
    public static final String REMISSION = "Remission";
    public static final String DEATH = "Death";

    private final List<String> names;
    private final List<String> baseStates;
    private final Map<String, Integer> indexByName;
    private final int initialState;
    private final int deathState;

    /// Creates a state space.
    ///
    /// @param names state names, in matrix order
    /// @param baseStates the cost/utility base state for each entry of names
    /// @param initialState the name of the state the whole cohort starts in
    /// @param deathState the name of the absorbing death state
    public StateSpace(List<String> names, List<String> baseStates, String initialState, String deathState) {
        if (names.size() < 3) {
            throw new ValidationException("states", "at least 3 health states are required, got " + names.size());
        }
        if (baseStates.size() != names.size()) {
            throw new ValidationException("states", "every state needs a base state");
        }
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            if (index.putIfAbsent(names.get(i), i) != null) {
                throw new ValidationException(names.get(i), "health state is declared more than once");
            }
        }
        if (!index.containsKey(initialState)) {
            throw new ValidationException(initialState, "initial state is not a declared health state");
        }
        if (!index.containsKey(deathState)) {
            throw new ValidationException(deathState, "death state is not a declared health state");
        }
        if (initialState.equals(deathState)) {
            throw new ValidationException(initialState, "the cohort cannot start in the absorbing state");
        }
        this.names = List.copyOf(names);
        this.baseStates = List.copyOf(baseStates);
        this.indexByName = Collections.unmodifiableMap(index);
        this.initialState = index.get(initialState);
        this.deathState = index.get(deathState);
    }

    /// Depressed, Remission, Death.
    public static StateSpace simple() {
        List<String> names = List.of(DEPRESSED, REMISSION, DEATH);
        return new StateSpace(names, names, DEPRESSED, DEATH);
    }

    /// Depressed, one tunnel state per month of early remission, a late
    /// remission state, and Death.
    ///
    /// @param tunnelMonths number of monthly tunnel states; must be positive
    public static StateSpace withRemissionTunnels(int tunnelMonths) {
        if (tunnelMonths < 1) {
            throw new ValidationException("tunnel_months", "must be positive, got " + tunnelMonths);
        }
        List<String> names = new ArrayList<>();
        List<String> bases = new ArrayList<>();
        names.add(DEPRESSED);
        bases.add(DEPRESSED);
        for (int m = 1; m <= tunnelMonths; m++) {
            names.add(tunnelName(m));
            bases.add(REMISSION);
        }
        names.add(REMISSION + "_late");
        bases.add(REMISSION);
        names.add(DEATH);
        bases.add(DEATH);
        return new StateSpace(names, bases, DEPRESSED, DEATH);
    }

    public static String tunnelName(int month) {
        return REMISSION + "_m" + month;
    }

    public int size() {
        return names.size();
    }

    public List<String> names() {
        return names;
    }

    public String name(int index) {
        return names.get(index);
    }

    public String baseState(int index) {
        return baseStates.get(index);
    }

    public int indexOf(String name) {
        Integer index = indexByName.get(name);
        if (index == null) {
            throw new ValidationException(name, "not a declared health state");
        }
        return index;
    }

    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    public int initialState() {
        return initialState;
    }

    public int deathState() {
        return deathState;
    }

    /// Returns the distinct base states, in first-appearance order.
    public List<String> baseStates() {
        List<String> distinct = new ArrayList<>();
        for (String base : baseStates) {
            if (!distinct.contains(base)) {
                distinct.add(base);
            }
        }
        return distinct;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateSpace)) return false;
        StateSpace that = (StateSpace) o;
        return initialState == that.initialState && deathState == that.deathState
            && names.equals(that.names) && baseStates.equals(that.baseStates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(names, baseStates, initialState, deathState);
    }

    @Override
    public String toString() {
        return "StateSpace" + names;
    }
}
