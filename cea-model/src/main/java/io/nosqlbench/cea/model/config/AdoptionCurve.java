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

import io.nosqlbench.cea.model.errors.AdoptionOverflowException;
import io.nosqlbench.cea.model.errors.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/// Market share of each strategy in each projection year.
///
/// Years are numbered from 1. Construction checks that every share lies in
/// [0, 1] and that the shares of any one year sum to at most 1.
public final class AdoptionCurve {

    public static final double SHARE_TOLERANCE = 1e-9;

    /// How shares move from their initial to their final values.
    public enum Shape {
        /// Fraction of the move completed by year y is y / years.
        LINEAR,
        /// Logistic with midpoint years / 2 and steepness 0.5.
        S_CURVE
    }

    private final int years;
    private final Map<String, double[]> shares;

    /// @param years number of projection years
    /// @param shares share per year for each strategy; each array has one entry per year
    /// @throws AdoptionOverflowException if any year's shares sum above 1
    public AdoptionCurve(int years, Map<String, double[]> shares) {
        if (years < 1) {
            throw new ValidationException("adoption.years", "must be positive, got " + years);
        }
        Map<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : shares.entrySet()) {
            double[] series = entry.getValue();
            if (series.length != years) {
                throw new ValidationException(entry.getKey(),
                    "adoption series has " + series.length + " years, expected " + years);
            }
            for (int y = 0; y < years; y++) {
                if (!(series[y] >= 0.0 && series[y] <= 1.0)) {
                    throw new ValidationException(entry.getKey(),
                        "adoption share in year " + (y + 1) + " must be in [0, 1], got " + series[y]);
                }
            }
            copy.put(entry.getKey(), series.clone());
        }
        for (int y = 0; y < years; y++) {
            double total = 0.0;
            for (double[] series : copy.values()) {
                total += series[y];
            }
            if (total > 1.0 + SHARE_TOLERANCE) {
                throw new AdoptionOverflowException(y + 1, total);
            }
        }
        this.years = years;
        this.shares = Collections.unmodifiableMap(copy);
    }

    /// Builds a curve that moves each strategy from an initial to a final share.
    ///
    /// @param initial shares before adoption starts
    /// @param target shares reached at the end of the horizon
    /// @param years number of projection years
    /// @param shape interpolation shape
    /// @return the curve
    public static AdoptionCurve interpolate(Map<String, Double> initial, Map<String, Double> target,
                                            int years, Shape shape) {
        Map<String, double[]> series = new LinkedHashMap<>();
        for (String strategy : union(initial.keySet(), target.keySet())) {
            double from = initial.getOrDefault(strategy, 0.0);
            double to = target.getOrDefault(strategy, 0.0);
            double[] values = new double[years];
            for (int y = 1; y <= years; y++) {
                values[y - 1] = from + (to - from) * fraction(y, years, shape);
            }
            series.put(strategy, values);
        }
        return new AdoptionCurve(years, series);
    }

    private static double fraction(int year, int years, Shape shape) {
        switch (shape) {
            case S_CURVE:
                return 1.0 / (1.0 + Math.exp(-0.5 * (year - years / 2.0)));
            case LINEAR:
            default:
                return (double) year / years;
        }
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> all = new LinkedHashSet<>(a);
        all.addAll(b);
        return all;
    }

    public int years() {
        return years;
    }

    public Set<String> strategies() {
        return shares.keySet();
    }

    /// Returns the share of a strategy in a year, 0 when the strategy has no series.
    ///
    /// @param strategy strategy id
    /// @param year projection year, from 1
    public double share(String strategy, int year) {
        if (year < 1 || year > years) {
            throw new IndexOutOfBoundsException("year " + year + " outside 1.." + years);
        }
        double[] series = shares.get(strategy);
        return series == null ? 0.0 : series[year - 1];
    }

    public double totalShare(int year) {
        double total = 0.0;
        for (String strategy : shares.keySet()) {
            total += share(strategy, year);
        }
        return total;
    }
}
