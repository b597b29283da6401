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

/**
 * Gamma distribution for non-negative, right-skewed quantities such as costs.
 *
 * <h2>Parameters</h2>
 *
 * <ul>
 *   <li><b>shape (k)</b>: k &gt; 0</li>
 *   <li><b>scale (θ)</b>: θ &gt; 0. Mean = kθ.</li>
 * </ul>
 *
 * <h2>Moments</h2>
 *
 * <pre>{@code
 * Mean = kθ
 * Variance = kθ²
 * }</pre>
 *
 * <p>From a mean m and standard error se: {@code k = m²/se²}, {@code θ = se²/m}.
 */
@DistributionType(GammaDistributionModel.DISTRIBUTION_TYPE)
public final class GammaDistributionModel implements DistributionModel {

    public static final String DISTRIBUTION_TYPE = "gamma";

    @SerializedName("shape")
    private final double shape;     // k

    @SerializedName("scale")
    private final double scale;     // θ

    /**
     * Constructs a gamma model.
     *
     * @param shape the shape parameter (k); must be positive
     * @param scale the scale parameter (θ); must be positive
     * @throws DistributionException if shape or scale is not positive
     */
    public GammaDistributionModel(double shape, double scale) {
        if (!(shape > 0) || !Double.isFinite(shape)) {
            throw new DistributionException(DISTRIBUTION_TYPE, "shape must be positive, got: " + shape);
        }
        if (!(scale > 0) || !Double.isFinite(scale)) {
            throw new DistributionException(DISTRIBUTION_TYPE, "scale must be positive, got: " + scale);
        }
        this.shape = shape;
        this.scale = scale;
    }

    /**
     * Builds a gamma model matching a mean and standard error.
     *
     * @param mean the mean; must be positive
     * @param standardError the standard error; must be positive
     * @return the matching model
     */
    public static GammaDistributionModel fromMeanAndSe(double mean, double standardError) {
        if (!(mean > 0)) {
            throw new DistributionException(DISTRIBUTION_TYPE, "mean must be positive, got: " + mean);
        }
        if (!(standardError > 0)) {
            throw new DistributionException(DISTRIBUTION_TYPE,
                "standard error must be positive, got: " + standardError);
        }
        double variance = standardError * standardError;
        return new GammaDistributionModel(mean * mean / variance, variance / mean);
    }

    public double getShape() {
        return shape;
    }

    public double getScale() {
        return scale;
    }

    @Override
    public String getDistributionType() {
        return DISTRIBUTION_TYPE;
    }

    @Override
    public double mean() {
        return shape * scale;
    }

    public double variance() {
        return shape * scale * scale;
    }

    @Override
    public double lowerBound() {
        return 0.0;
    }

    @Override
    public double upperBound() {
        return Double.POSITIVE_INFINITY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GammaDistributionModel)) return false;
        GammaDistributionModel that = (GammaDistributionModel) o;
        return Double.compare(that.shape, shape) == 0 && Double.compare(that.scale, scale) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, scale);
    }

    @Override
    public String toString() {
        return "Gamma[k=" + shape + ", θ=" + scale + "]";
    }
}
