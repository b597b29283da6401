package io.nosqlbench.cea.sampling;

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

import io.nosqlbench.cea.model.ParameterTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Audit trail of realised parameter values, one row per iteration and
/// parameter, ordered by iteration then table order.
public final class ParameterSnapshot {

    /// One realised value.
    public record Row(long iteration, String parameter, double value) {
    }

    private final List<Row> rows;

    private ParameterSnapshot(List<Row> rows) {
        this.rows = Collections.unmodifiableList(rows);
    }

    /// Builds a snapshot from per-iteration value vectors.
    ///
    /// @param table the table the values are aligned with
    /// @param iterations iteration index of each vector
    /// @param values value vectors in table order
    public static ParameterSnapshot of(ParameterTable table, long[] iterations, List<double[]> values) {
        if (iterations.length != values.size()) {
            throw new IllegalArgumentException(
                iterations.length + " iteration indexes for " + values.size() + " value vectors");
        }
        List<Row> rows = new ArrayList<>(iterations.length * table.size());
        for (int k = 0; k < iterations.length; k++) {
            double[] v = values.get(k);
            for (int i = 0; i < table.size(); i++) {
                rows.add(new Row(iterations[k], table.get(i).name(), v[i]));
            }
        }
        return new ParameterSnapshot(rows);
    }

    public List<Row> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }
}
