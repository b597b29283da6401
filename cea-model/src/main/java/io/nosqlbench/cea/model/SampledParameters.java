package io.nosqlbench.cea.model;

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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/// Realised values of every declared parameter for one Monte-Carlo iteration.
///
/// Instances are immutable and belong to a single iteration; values are
/// positionally aligned with the [ParameterTable] they were drawn from.
public final class SampledParameters {

    /// Iteration index used for the deterministic base case.
    public static final int BASE_CASE = -1;

    private final ParameterTable table;
    private final long iteration;
    private final double[] values;

    public SampledParameters(ParameterTable table, long iteration, double[] values) {
        if (values.length != table.size()) {
            throw new IllegalArgumentException(
                "expected " + table.size() + " values, got " + values.length);
        }
        this.table = table;
        this.iteration = iteration;
        this.values = values.clone();
    }

    /// Builds the base case, with every parameter at its distribution mean.
    public static SampledParameters deterministic(ParameterTable table) {
        double[] means = new double[table.size()];
        for (int i = 0; i < means.length; i++) {
            means[i] = table.get(i).distribution().mean();
        }
        return new SampledParameters(table, BASE_CASE, means);
    }

    public long iteration() {
        return iteration;
    }

    public ParameterTable table() {
        return table;
    }

    /// Returns the value of a named parameter.
    ///
    /// @throws ValidationException if the name is not declared
    public double get(String name) {
        int index = table.indexOf(name);
        if (index < 0) {
            throw new ValidationException(name, "parameter is not declared");
        }
        return values[index];
    }

    public double get(int index) {
        return values[index];
    }

    public int size() {
        return values.length;
    }

    /// Returns a copy of the values in table order.
    public double[] values() {
        return values.clone();
    }

    /// Returns a copy of this sample with some values replaced.
    public SampledParameters withOverrides(Map<String, Double> overrides) {
        double[] copy = values.clone();
        for (Map.Entry<String, Double> entry : overrides.entrySet()) {
            int index = table.indexOf(entry.getKey());
            if (index < 0) {
                throw new ValidationException(entry.getKey(), "parameter is not declared");
            }
            copy[index] = entry.getValue();
        }
        return new SampledParameters(table, iteration, copy);
    }

    /// Returns the values keyed by parameter name, in table order.
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(table.get(i).name(), values[i]);
        }
        return map;
    }

    @Override
    public String toString() {
        return "SampledParameters[iteration=" + iteration + ", values=" + Arrays.toString(values) + "]";
    }
}
