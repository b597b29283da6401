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

/// Incremental net monetary benefit of a comparator over a grid of values
/// of two parameters.
public final class TwoWayResult {

    private final String comparator;
    private final String first;
    private final String second;
    private final double[] firstValues;
    private final double[] secondValues;
    private final double[][] outcomes;

    public TwoWayResult(String comparator, String first, double[] firstValues, String second,
                        double[] secondValues, double[][] outcomes) {
        this.comparator = comparator;
        this.first = first;
        this.second = second;
        this.firstValues = firstValues.clone();
        this.secondValues = secondValues.clone();
        this.outcomes = new double[outcomes.length][];
        for (int i = 0; i < outcomes.length; i++) {
            this.outcomes[i] = outcomes[i].clone();
        }
    }

    public String comparator() {
        return comparator;
    }

    public String first() {
        return first;
    }

    public String second() {
        return second;
    }

    public double[] firstValues() {
        return firstValues.clone();
    }

    public double[] secondValues() {
        return secondValues.clone();
    }

    /// @param i index into [#firstValues()]
    /// @param j index into [#secondValues()]
    public double outcome(int i, int j) {
        return outcomes[i][j];
    }
}
