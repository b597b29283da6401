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

import java.util.Arrays;

/// Ordered, immutable willingness-to-pay thresholds shared read-only by
/// every metric computation.
public final class WtpGrid {

    private final double[] points;

    private WtpGrid(double[] points) {
        this.points = points;
    }

    /// Builds `lower, lower + step, ...` up to and including upper when upper
    /// lies on the grid.
    public static WtpGrid range(double lower, double upper, double step) {
        if (!Double.isFinite(lower) || !Double.isFinite(upper) || lower < 0) {
            throw new ValidationException("wtp_grid", "bounds must be finite and non-negative");
        }
        if (upper < lower) {
            throw new ValidationException("wtp_grid", "upper " + upper + " is below lower " + lower);
        }
        if (!(step > 0) || !Double.isFinite(step)) {
            throw new ValidationException("wtp_grid", "step must be positive, got " + step);
        }
        int count = (int) Math.floor((upper - lower) / step + 1e-9) + 1;
        double[] points = new double[count];
        for (int i = 0; i < count; i++) {
            points[i] = lower + i * step;
        }
        return new WtpGrid(points);
    }

    /// Builds a grid from explicit, strictly increasing thresholds.
    public static WtpGrid of(double... thresholds) {
        if (thresholds.length == 0) {
            throw new ValidationException("wtp_grid", "grid must contain at least one threshold");
        }
        for (int i = 0; i < thresholds.length; i++) {
            if (!Double.isFinite(thresholds[i]) || thresholds[i] < 0) {
                throw new ValidationException("wtp_grid", "threshold must be finite and non-negative: " + thresholds[i]);
            }
            if (i > 0 && thresholds[i] <= thresholds[i - 1]) {
                throw new ValidationException("wtp_grid", "thresholds must be strictly increasing");
            }
        }
        return new WtpGrid(thresholds.clone());
    }

    public int size() {
        return points.length;
    }

    public double get(int index) {
        return points[index];
    }

    public double[] points() {
        return points.clone();
    }

    /// Returns the index of a threshold on the grid, or -1.
    public int indexOf(double threshold) {
        for (int i = 0; i < points.length; i++) {
            if (Math.abs(points[i] - threshold) < 1e-9) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "WtpGrid" + Arrays.toString(points);
    }
}
