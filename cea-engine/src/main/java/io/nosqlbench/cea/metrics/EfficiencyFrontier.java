package io.nosqlbench.cea.metrics;

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/// Efficiency frontier of a set of strategies on the cost-effectiveness plane.
///
/// ## Construction
///
/// ```text
///   1. strict dominance   drop s when some t has cost_t ≤ cost_s and
///                         qaly_t ≥ qaly_s, better on at least one;
///                         exact duplicates keep the lowest index
///   2. order              QALY ascending, then cost, then index
///   3. extended dominance while some point's ICER vs. its predecessor is
///                         below the predecessor's own ICER, drop the
///                         predecessor and recompute
/// ```
///
/// The survivors have strictly increasing cost, QALYs and sequential
/// ICERs. Rebuilding a frontier from its own members yields the same
/// frontier.
public final class EfficiencyFrontier {

    private final List<String> strategyIds;
    private final Dominance[] dominance;
    private final List<Integer> members;
    private final double[] sequentialIcers;

    private EfficiencyFrontier(List<String> strategyIds, Dominance[] dominance, List<Integer> members,
                               double[] sequentialIcers) {
        this.strategyIds = strategyIds;
        this.dominance = dominance;
        this.members = members;
        this.sequentialIcers = sequentialIcers;
    }

    /// Builds the frontier.
    ///
    /// @param strategyIds ids in strategy index order
    /// @param costs cost per strategy index
    /// @param qalys QALYs per strategy index
    public static EfficiencyFrontier of(List<String> strategyIds, double[] costs, double[] qalys) {
        int n = strategyIds.size();
        if (n == 0) {
            throw new IllegalArgumentException("frontier needs at least one strategy");
        }
        if (costs.length != n || qalys.length != n) {
            throw new IllegalArgumentException("expected " + n + " costs and QALYs");
        }
        Dominance[] dominance = new Dominance[n];
        Arrays.fill(dominance, Dominance.NONE);
        for (int s = 0; s < n; s++) {
            for (int t = 0; t < n; t++) {
                if (t != s && dominates(t, s, costs, qalys)) {
                    dominance[s] = Dominance.STRICT;
                    break;
                }
            }
        }

        List<Integer> frontier = new ArrayList<>();
        for (int s = 0; s < n; s++) {
            if (dominance[s] == Dominance.NONE) {
                frontier.add(s);
            }
        }
        frontier.sort(Comparator.<Integer>comparingDouble(s -> qalys[s])
            .thenComparingDouble(s -> costs[s])
            .thenComparingInt(s -> s));

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int k = 2; k < frontier.size(); k++) {
                double previous = icer(frontier.get(k - 2), frontier.get(k - 1), costs, qalys);
                double current = icer(frontier.get(k - 1), frontier.get(k), costs, qalys);
                if (current < previous) {
                    dominance[frontier.get(k - 1)] = Dominance.EXTENDED;
                    frontier.remove(k - 1);
                    changed = true;
                    break;
                }
            }
        }

        double[] icers = new double[frontier.size()];
        icers[0] = Double.NaN;
        for (int k = 1; k < frontier.size(); k++) {
            icers[k] = icer(frontier.get(k - 1), frontier.get(k), costs, qalys);
        }
        return new EfficiencyFrontier(List.copyOf(strategyIds), dominance,
            Collections.unmodifiableList(frontier), icers);
    }

    private static boolean dominates(int t, int s, double[] costs, double[] qalys) {
        if (costs[t] <= costs[s] && qalys[t] >= qalys[s]) {
            if (costs[t] < costs[s] || qalys[t] > qalys[s]) {
                return true;
            }
            return t < s;
        }
        return false;
    }

    private static double icer(int from, int to, double[] costs, double[] qalys) {
        return (costs[to] - costs[from]) / (qalys[to] - qalys[from]);
    }

    /// Strategy indexes on the frontier, in ascending QALY order.
    public List<Integer> members() {
        return members;
    }

    public List<String> memberIds() {
        List<String> ids = new ArrayList<>(members.size());
        for (int s : members) {
            ids.add(strategyIds.get(s));
        }
        return ids;
    }

    public boolean contains(int strategy) {
        return dominance[strategy] == Dominance.NONE;
    }

    public Dominance dominance(int strategy) {
        return dominance[strategy];
    }

    /// ICER of a frontier member against the previous member; empty for the
    /// first member and for strategies off the frontier.
    public OptionalDouble sequentialIcer(int strategy) {
        int position = members.indexOf(strategy);
        if (position <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(sequentialIcers[position]);
    }

    @Override
    public String toString() {
        return "EfficiencyFrontier" + memberIds();
    }
}
