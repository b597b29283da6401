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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.cea.model.errors.DistributionException;

import java.util.Objects;

/// A parameter known without uncertainty.
@DistributionType(FixedDistributionModel.DISTRIBUTION_TYPE)
public final class FixedDistributionModel implements DistributionModel {

    public static final String DISTRIBUTION_TYPE = "fixed";

    @SerializedName("value")
    private final double value;

    public FixedDistributionModel(double value) {
        if (!Double.isFinite(value)) {
            throw new DistributionException(DISTRIBUTION_TYPE, "value must be finite, got: " + value);
        }
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String getDistributionType() {
        return DISTRIBUTION_TYPE;
    }

    @Override
    public double mean() {
        return value;
    }

    @Override
    public double lowerBound() {
        return value;
    }

    @Override
    public double upperBound() {
        return value;
    }

    @Override
    public boolean isDegenerate() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FixedDistributionModel)) return false;
        FixedDistributionModel that = (FixedDistributionModel) o;
        return Double.compare(that.value, value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return "Fixed[" + value + "]";
    }
}
