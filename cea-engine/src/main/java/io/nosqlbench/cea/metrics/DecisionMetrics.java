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

import io.nosqlbench.cea.economics.StrategyOutcome;

import java.util.List;

/// Decision metrics of one analysis. Immutable; recomputed wholesale from
/// the draws whenever they change.
public final class DecisionMetrics {

    private final List<StrategyOutcome> deterministic;
    private final List<IncrementalResult> incremental;
    private final EfficiencyFrontier frontier;
    private final NetMonetaryBenefit netMonetaryBenefit;
    private final CeacTable ceac;
    private final CeafTable ceaf;
    private final List<CePlanePoint> cePlane;

    public DecisionMetrics(List<StrategyOutcome> deterministic, List<IncrementalResult> incremental,
                           EfficiencyFrontier frontier, NetMonetaryBenefit netMonetaryBenefit,
                           CeacTable ceac, CeafTable ceaf, List<CePlanePoint> cePlane) {
        this.deterministic = List.copyOf(deterministic);
        this.incremental = List.copyOf(incremental);
        this.frontier = frontier;
        this.netMonetaryBenefit = netMonetaryBenefit;
        this.ceac = ceac;
        this.ceaf = ceaf;
        this.cePlane = List.copyOf(cePlane);
    }

    public List<StrategyOutcome> deterministic() {
        return deterministic;
    }

    public List<IncrementalResult> incremental() {
        return incremental;
    }

    public EfficiencyFrontier frontier() {
        return frontier;
    }

    public NetMonetaryBenefit netMonetaryBenefit() {
        return netMonetaryBenefit;
    }

    public CeacTable ceac() {
        return ceac;
    }

    public CeafTable ceaf() {
        return ceaf;
    }

    public List<CePlanePoint> cePlane() {
        return cePlane;
    }
}
