package io.nosqlbench.cea.dsa;

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
import java.util.Comparator;
import java.util.List;

/// One-way results of a comparator against the reference, ranked by range.
///
/// Rows are sorted by [OneWayResult#range()] descending; equal ranges keep
/// parameter table order.
public final class TornadoResult {

    private final String comparator;
    private final String reference;
    private final double wtp;
    private final double baseOutcome;
    private final List<OneWayResult> rows;

    public TornadoResult(String comparator, String reference, double wtp, double baseOutcome,
                         List<OneWayResult> rows) {
        this.comparator = comparator;
        this.reference = reference;
        this.wtp = wtp;
        this.baseOutcome = baseOutcome;
        List<OneWayResult> ranked = new ArrayList<>(rows);
        ranked.sort(Comparator.comparingDouble(OneWayResult::range).reversed());
        this.rows = List.copyOf(ranked);
    }

    public String comparator() {
        return comparator;
    }

    public String reference() {
        return reference;
    }

    public double wtp() {
        return wtp;
    }

    /// Incremental net monetary benefit with every parameter at its mean.
    public double baseOutcome() {
        return baseOutcome;
    }

    public List<OneWayResult> rows() {
        return rows;
    }

    public List<String> rankedParameters() {
        List<String> names = new ArrayList<>(rows.size());
        for (OneWayResult r : rows) {
            names.add(r.parameter());
        }
        return names;
    }
}
