package io.nosqlbench.cea.model.config;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Settings of the deterministic sensitivity analysis.
///
/// One-way analysis moves each parameter to a low and a high value while
/// every other parameter stays at its mean. An explicit [Range] sets those
/// values; otherwise they are the distribution's quantiles at
/// [#lowerPercentile()] and [#upperPercentile()]. A fixed parameter is only
/// varied when it has an explicit range.
///
/// | Setting | Default |
/// |---------|---------|
/// | lowerPercentile | 0.05 |
/// | upperPercentile | 0.95 |
/// | ranges | none |
/// | scenarios | none |
/// | twoWay | none |
public final class SensitivityConfig {

    /// Explicit low and high values of one parameter.
    public record Range(String parameter, double low, double high) {
        public Range {
            Objects.requireNonNull(parameter, "parameter");
            if (!Double.isFinite(low) || !Double.isFinite(high)) {
                throw new ValidationException(parameter, "sensitivity range must be finite, got [" + low + ", "
                    + high + "]");
            }
            if (low > high) {
                throw new ValidationException(parameter, "sensitivity range low " + low + " exceeds high " + high);
            }
        }
    }

    /// A named set of parameter values applied together.
    public record Scenario(String name, Map<String, Double> overrides) {
        public Scenario {
            if (name == null || name.isBlank()) {
                throw new ValidationException("scenarios", "scenario name must not be blank");
            }
            for (Map.Entry<String, Double> entry : overrides.entrySet()) {
                if (entry.getValue() == null || !Double.isFinite(entry.getValue())) {
                    throw new ValidationException(name, "value of " + entry.getKey() + " must be finite");
                }
            }
            overrides = Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
        }
    }

    /// Two parameters varied together over evenly spaced points of their ranges.
    public record TwoWay(String first, String second, int steps) {
        public TwoWay {
            Objects.requireNonNull(first, "first");
            Objects.requireNonNull(second, "second");
            if (first.equals(second)) {
                throw new ValidationException(first, "two-way analysis needs two different parameters");
            }
            if (steps < 2) {
                throw new ValidationException(first + "," + second, "two-way analysis needs at least 2 steps, got "
                    + steps);
            }
        }
    }

    private final double lowerPercentile;
    private final double upperPercentile;
    private final Map<String, Range> ranges;
    private final List<Scenario> scenarios;
    private final List<TwoWay> twoWay;

    private SensitivityConfig(Builder builder) {
        this.lowerPercentile = builder.lowerPercentile;
        this.upperPercentile = builder.upperPercentile;
        this.ranges = Collections.unmodifiableMap(new LinkedHashMap<>(builder.ranges));
        this.scenarios = List.copyOf(builder.scenarios);
        this.twoWay = List.copyOf(builder.twoWay);
    }

    public static SensitivityConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double lowerPercentile() {
        return lowerPercentile;
    }

    public double upperPercentile() {
        return upperPercentile;
    }

    public Optional<Range> range(String parameter) {
        return Optional.ofNullable(ranges.get(parameter));
    }

    public Map<String, Range> ranges() {
        return ranges;
    }

    public List<Scenario> scenarios() {
        return scenarios;
    }

    public List<TwoWay> twoWay() {
        return twoWay;
    }

    /// Every parameter name this configuration refers to.
    public List<String> referencedParameters() {
        List<String> names = new ArrayList<>(ranges.keySet());
        for (Scenario s : scenarios) {
            names.addAll(s.overrides().keySet());
        }
        for (TwoWay t : twoWay) {
            names.add(t.first());
            names.add(t.second());
        }
        return names;
    }

    public static final class Builder {
        private double lowerPercentile = 0.05;
        private double upperPercentile = 0.95;
        private final Map<String, Range> ranges = new LinkedHashMap<>();
        private final List<Scenario> scenarios = new ArrayList<>();
        private final List<TwoWay> twoWay = new ArrayList<>();

        public Builder percentiles(double lower, double upper) {
            if (!(lower > 0.0 && lower < upper && upper < 1.0)) {
                throw new ValidationException("sensitivity.percentiles",
                    "must satisfy 0 < lower < upper < 1, got [" + lower + ", " + upper + "]");
            }
            this.lowerPercentile = lower;
            this.upperPercentile = upper;
            return this;
        }

        public Builder range(String parameter, double low, double high) {
            Range range = new Range(parameter, low, high);
            if (ranges.putIfAbsent(parameter, range) != null) {
                throw new ValidationException(parameter, "sensitivity range is declared more than once");
            }
            return this;
        }

        public Builder scenario(String name, Map<String, Double> overrides) {
            for (Scenario s : scenarios) {
                if (s.name().equals(name)) {
                    throw new ValidationException(name, "scenario is declared more than once");
                }
            }
            scenarios.add(new Scenario(name, overrides));
            return this;
        }

        public Builder twoWay(String first, String second, int steps) {
            twoWay.add(new TwoWay(first, second, steps));
            return this;
        }

        public SensitivityConfig build() {
            return new SensitivityConfig(this);
        }
    }
}
