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

import java.util.List;

/// Cost-effectiveness acceptability frontier: at each threshold, the
/// strategy with the highest expected NMB, its expected NMB, and its
/// probability of being optimal.
public final class CeafTable {

    /// One threshold of the frontier.
    public record Row(double wtp, int strategyIndex, String strategyId, double expectedNmb, double probability) {
    }

    private final List<Row> rows;

    CeafTable(List<Row> rows) {
        this.rows = List.copyOf(rows);
    }

    public List<Row> rows() {
        return rows;
    }

    public Row get(int wtpIndex) {
        return rows.get(wtpIndex);
    }

    public int size() {
        return rows.size();
    }
}
