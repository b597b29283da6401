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
 * Beta distribution for probabilities and utilities.
 *
 * <h2>Parameters</h2>
 *
 * <ul>
 *   <li><b>alpha (α)</b>: first shape parameter; α &gt; 0</li>
 *   <li><b>beta (β)</b>: second shape parameter; β &gt; 0</li>
 * </ul>
 *
 * <p>Support is [0, 1], so every draw is a valid probability.
 *
 * <h2>Method of Moments</h2>
 *
 * <p>Published inputs usually arrive as a mean and a standard error. With
 * {@code c = m(1 - m)/se² - 1}, the shapes are {@code α = m·c} and
 * {@code β = (1 - m)·c}, which requires {@code se² < m(1 - m)}.
 *
 * <pre>{@code
 * BetaDistributionModel remission = BetaDistributionModel.fromMeanAndSe(0.30, 0.05);
 * }</pre>
 */
@DistributionType(BetaDistributionModel.DISTRIBUTION_TYPE)
public final class BetaDistributionModel implements DistributionModel {

    public static final String DISTRIBUTION_TYPE = "beta";

    @SerializedName("alpha")
    private final double alpha;

    @SerializedName("beta")
    private final double beta;

    /**
     * Constructs a beta model.
     *
     * @param alpha the first shape parameter; must be positive and finite
     * @param beta the second shape parameter; must be positive and finite
     * @throws DistributionException if either shape is out of domain
     */
    public BetaDistributionModel(double alpha, double beta) {
        if (!(alpha > 0) || !Double.isFinite(alpha)) {
            throw new DistributionException(DISTRIBUTION_TYPE, "alpha must be positive, got: " + alpha);
        }
        if (!(beta > 0) || !Double.isFinite(beta)) {
            throw new DistributionException(DISTRIBUTION_TYPE, "beta must be positive, got: " + beta);
        }
        this.alpha = alpha;
        this.beta = beta;
    }

    /**
     * Builds a beta model matching a mean and standard error.
     *
     * @param mean the mean, strictly inside (0, 1)
     * @param standardError the standard error; must be positive
     * @return the matching model
     * @throws DistributionException if no beta distribution has these moments
     */
    public static BetaDistributionModel fromMeanAndSe(double mean, double standardError) {
        if (!(mean > 0 && mean < 1)) {
            throw new DistributionException(DISTRIBUTION_TYPE, "mean must be in (0, 1), got: " + mean);
        }
        double variance = standardError * standardError;
        if (!(standardError > 0) || variance >= mean * (1 - mean)) {
            throw new DistributionException(DISTRIBUTION_TYPE,
                "standard error " + standardError + " is incompatible with mean " + mean);
        }
        double common = mean * (1 - mean) / variance - 1;
        return new BetaDistributionModel(mean * common, (1 - mean) * common);
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }

    @Override
    public String getDistributionType() {
        return DISTRIBUTION_TYPE;
    }

    @Override
    public double mean() {
        return alpha / (alpha + beta);
    }

    /**
     * Variance = αβ / ((α+β)²(α+β+1))
     *
     * @return the variance
     */
    public double variance() {
        double sum = alpha + beta;
        return alpha * beta / (sum * sum * (sum + 1));
    }

    @Override
    public double lowerBound() {
        return 0.0;
    }

    @Override
    public double upperBound() {
        return 1.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BetaDistributionModel)) return false;
        BetaDistributionModel that = (BetaDistributionModel) o;
        return Double.compare(that.alpha, alpha) == 0 && Double.compare(that.beta, beta) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(alpha, beta);
    }

    @Override
    public String toString() {
        return "Beta[α=" + alpha + ", β=" + beta + "]";
    }
}
