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

import java.util.Locale;
import java.util.OptionalDouble;

/// Incremental cost-effectiveness ratio of one strategy against another.
///
/// | Quadrant | ΔQALY | ΔCost | Status | Value |
/// |----------|-------|-------|--------|-------|
/// | any | \|ΔQALY\| < 1e-9 | any | UNDEFINED | none |
/// | north-east | > 0 | > 0 | DEFINED | ΔCost/ΔQALY |
/// | south-east | > 0 | ≤ 0 | DOMINANT | ΔCost/ΔQALY (≤ 0) |
/// | north-west | < 0 | ≥ 0 | DOMINATED | none |
/// | south-west | < 0 | < 0 | DEFINED | ΔCost/ΔQALY, savings per QALY forgone |
///
/// The value is never NaN or infinite; statuses without a value report an
/// empty [OptionalDouble].
public final class Icer {

    /// Smallest |ΔQALY| treated as a non-zero denominator.
    public static final double QALY_EPSILON = 1e-9;

    public enum Status {
        DEFINED,
        DOMINANT,
        DOMINATED,
        UNDEFINED
    }

    private static final Icer UNDEFINED = new Icer(Status.UNDEFINED, 0.0);
    private static final Icer DOMINATED = new Icer(Status.DOMINATED, 0.0);

    private final Status status;
    private final double value;

    private Icer(Status status, double value) {
        this.status = status;
        this.value = value;
    }

    /// Classifies a pair of increments.
    ///
    /// @param deltaCost cost of the strategy minus cost of the comparator
    /// @param deltaQaly QALYs of the strategy minus QALYs of the comparator
    public static Icer of(double deltaCost, double deltaQaly) {
        if (Math.abs(deltaQaly) < QALY_EPSILON) {
            return UNDEFINED;
        }
        if (deltaQaly > 0) {
            double ratio = deltaCost / deltaQaly;
            return new Icer(deltaCost <= 0 ? Status.DOMINANT : Status.DEFINED, ratio);
        }
        if (deltaCost >= 0) {
            return DOMINATED;
        }
        return new Icer(Status.DEFINED, deltaCost / deltaQaly);
    }

    /// An ICER whose comparator could not be formed, such as the reference
    /// against itself.
    public static Icer undefined() {
        return UNDEFINED;
    }

    public Status status() {
        return status;
    }

    /// Returns the ratio for DEFINED and DOMINANT results.
    public OptionalDouble value() {
        return hasValue() ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    public boolean hasValue() {
        return status == Status.DEFINED || status == Status.DOMINANT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Icer)) return false;
        Icer that = (Icer) o;
        return status == that.status && (!hasValue() || Double.compare(value, that.value) == 0);
    }

    @Override
    public int hashCode() {
        return hasValue() ? 31 * status.hashCode() + Double.hashCode(value) : status.hashCode();
    }

    @Override
    public String toString() {
        return hasValue() ? String.format(Locale.ROOT, "%s(%.2f)", status, value) : status.name();
    }
}
