package io.nosqlbench.cea.voi;

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

import io.nosqlbench.cea.economics.StrategyOutcome;
import io.nosqlbench.cea.metrics.NetMonetaryBenefit;
import io.nosqlbench.cea.model.ParameterTable;
import io.nosqlbench.cea.model.SampledParameters;
import io.nosqlbench.cea.model.config.EvppiMethod;
import io.nosqlbench.cea.model.config.WtpGrid;
import io.nosqlbench.cea.psa.IterationEvaluator;
import io.nosqlbench.cea.psa.PsaResult;
import io.nosqlbench.cea.psa.SimulationDraw;
import io.nosqlbench.cea.sampling.ParameterSampler;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expected value of perfect and partial perfect information.
 *
 * <h2>EVPI</h2>
 *
 * <p>For each draw i the opportunity loss at threshold w is
 * {@code max_s NMB_i(s, w) - NMB_i(s*, w)}, where s* has the highest
 * expected NMB. EVPI is the mean loss, which equals
 * {@code E[max_s NMB] - max_s E[NMB]} and is never negative. No
 * re-simulation is needed.
 *
 * <h2>EVPPI</h2>
 *
 * <p>Two estimators, selected by {@link EvppiMethod}:
 *
 * <ul>
 *   <li>{@code REGRESSION} regresses each strategy's cost and QALYs on the
 *   group's standardized parameters and their squares (ordinary least
 *   squares with intercept). The fitted NMB ĝ_s(i) replaces the inner
 *   expectation: {@code EVPPI = mean_i max_s ĝ_s(i) - max_s mean_i ĝ_s(i)}.
 *   It reuses the PSA draws, and overfitting noise biases it upward when
 *   draws are few relative to the basis size.</li>
 *   <li>{@code NESTED_MONTE_CARLO} draws K outer values of the group and, for
 *   each, J inner draws of everything else, re-simulating every strategy:
 *   {@code EVPPI = mean_k max_s mean_j NMB - max_s mean_k mean_j NMB}. The
 *   upward bias shrinks as J grows, at the cost of K × J simulations.</li>
 * </ul>
 *
 * <h2>Precision</h2>
 *
 * <p>Every estimate carries the standard error of its mean loss. It is
 * flagged low precision when fewer than two samples exist, when the
 * coefficient of variation exceeds the configured threshold, or, for the
 * regression, when there are fewer than (coefficients + 1) draws.
 */
public final class ValueOfInformationEngine {

    private static final Logger logger = LogManager.getLogger(ValueOfInformationEngine.class);

    private final List<String> strategyIds;
    private final double cvThreshold;

    /**
     * @param strategyIds ids in strategy index order
     * @param cvThreshold largest acceptable coefficient of variation
     */
    public ValueOfInformationEngine(List<String> strategyIds, double cvThreshold) {
        this.strategyIds = List.copyOf(strategyIds);
        this.cvThreshold = cvThreshold;
    }

    /**
     * Computes EVPI at every grid threshold and at the policy threshold.
     */
    public EvpiResult evpi(List<SimulationDraw> draws, WtpGrid grid, double eligiblePopulation, double policyWtp) {
        List<VoiEstimate> estimates = new ArrayList<>(grid.size());
        for (int w = 0; w < grid.size(); w++) {
            estimates.add(evpiAt(draws, grid.get(w), eligiblePopulation));
        }
        VoiEstimate policy = evpiAt(draws, policyWtp, eligiblePopulation);
        if (policy.lowPrecision()) {
            logger.warn("EVPI at policy threshold {} is imprecise (n={}, cv={})",
                policyWtp, draws.size(), policy.coefficientOfVariation());
        }
        return new EvpiResult(estimates, policy, draws.size());
    }

    private VoiEstimate evpiAt(List<SimulationDraw> draws, double wtp, double eligiblePopulation) {
        int strategies = strategyIds.size();
        double[][] nmb = new double[draws.size()][strategies];
        for (int i = 0; i < draws.size(); i++) {
            for (int s = 0; s < strategies; s++) {
                nmb[i][s] = draws.get(i).nmb(s, wtp);
            }
        }
        return VoiEstimate.fromLosses(wtp, opportunityLosses(nmb), eligiblePopulation, cvThreshold, false);
    }

    /**
     * Regression EVPPI for every labelled parameter group.
     *
     * @param result PSA draws with their parameter values
     * @param grid thresholds
     * @param eligiblePopulation population multiplier
     * @return one result per group, in first-appearance order
     */
    public List<EvppiResult> evppiRegression(PsaResult result, WtpGrid grid, double eligiblePopulation) {
        List<EvppiResult> results = new ArrayList<>();
        for (Map.Entry<String, List<String>> group : result.parameters().evppiGroups().entrySet()) {
            results.add(evppiRegression(result, group.getKey(), group.getValue(), grid, eligiblePopulation));
        }
        return results;
    }

    /**
     * Regression EVPPI for one parameter group.
     */
    public EvppiResult evppiRegression(PsaResult result, String group, List<String> parameters, WtpGrid grid,
                                       double eligiblePopulation) {
        List<SimulationDraw> draws = result.draws();
        int n = draws.size();
        int strategies = strategyIds.size();

        List<double[]> columns = new ArrayList<>();
        for (String name : parameters) {
            double[] z = standardize(result.parameterColumn(name));
            if (z != null) {
                double[] squared = new double[n];
                for (int i = 0; i < n; i++) {
                    squared[i] = z[i] * z[i];
                }
                columns.add(z);
                columns.add(squared);
            }
        }

        double[][] fittedCost = new double[strategies][];
        double[][] fittedQaly = new double[strategies][];
        boolean insufficient = !columns.isEmpty() && n < columns.size() + 2;
        boolean failed = false;
        for (int s = 0; s < strategies; s++) {
            double[] cost = new double[n];
            double[] qaly = new double[n];
            for (int i = 0; i < n; i++) {
                cost[i] = draws.get(i).cost(s);
                qaly[i] = draws.get(i).qalys(s);
            }
            if (columns.isEmpty() || insufficient) {
                fittedCost[s] = constant(cost);
                fittedQaly[s] = constant(qaly);
                continue;
            }
            double[][] design = design(columns, n);
            try {
                fittedCost[s] = fit(design, cost);
                fittedQaly[s] = fit(design, qaly);
            } catch (MathIllegalArgumentException e) {
                logger.warn("EVPPI regression for group {} is singular, falling back to the mean: {}",
                    group, e.getMessage());
                failed = true;
                fittedCost[s] = constant(cost);
                fittedQaly[s] = constant(qaly);
            }
        }
        if (insufficient) {
            logger.warn("EVPPI group {} has {} draws for {} regression coefficients", group, n, columns.size() + 1);
        }

        List<VoiEstimate> estimates = new ArrayList<>(grid.size());
        for (int w = 0; w < grid.size(); w++) {
            double wtp = grid.get(w);
            double[][] nmb = new double[n][strategies];
            for (int i = 0; i < n; i++) {
                for (int s = 0; s < strategies; s++) {
                    nmb[i][s] = NetMonetaryBenefit.nmb(fittedCost[s][i], fittedQaly[s][i], wtp);
                }
            }
            estimates.add(VoiEstimate.fromLosses(wtp, opportunityLosses(nmb), eligiblePopulation, cvThreshold,
                insufficient || failed));
        }
        return new EvppiResult(group, parameters, EvppiMethod.REGRESSION, estimates);
    }

    /**
     * Nested Monte-Carlo EVPPI for every labelled parameter group.
     *
     * @param sampler sampler over the run's parameter table
     * @param evaluator evaluates every strategy for one draw
     * @param grid thresholds
     * @param eligiblePopulation population multiplier
     * @param outerSamples K, draws of the group
     * @param innerSamples J, draws of the other parameters per outer draw
     * @param seed base seed; outer draw k of group g uses the seed vector {seed, g, k}
     */
    public List<EvppiResult> evppiNested(ParameterSampler sampler, IterationEvaluator evaluator, WtpGrid grid,
                                         double eligiblePopulation, int outerSamples, int innerSamples, long seed) {
        ParameterTable table = sampler.table();
        List<EvppiResult> results = new ArrayList<>();
        int groupIndex = 0;
        for (Map.Entry<String, List<String>> group : table.evppiGroups().entrySet()) {
            logger.info("Nested EVPPI for group {}: {} outer x {} inner draws",
                group.getKey(), outerSamples, innerSamples);
            results.add(evppiNested(sampler, evaluator, group.getKey(), group.getValue(), grid, eligiblePopulation,
                outerSamples, innerSamples, seed, groupIndex++));
        }
        return results;
    }

    private EvppiResult evppiNested(ParameterSampler sampler, IterationEvaluator evaluator, String group,
                                    List<String> parameters, WtpGrid grid, double eligiblePopulation,
                                    int outerSamples, int innerSamples, long seed, int groupIndex) {
        int strategies = strategyIds.size();
        Set<String> kept = new HashSet<>(parameters);
        // conditional means of cost and QALYs per outer draw
        double[][] meanCost = new double[outerSamples][strategies];
        double[][] meanQaly = new double[outerSamples][strategies];
        for (int k = 0; k < outerSamples; k++) {
            UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(new long[]{seed, groupIndex, k});
            SampledParameters outer = sampler.sample(rng, k);
            for (int j = 0; j < innerSamples; j++) {
                SampledParameters inner = sampler.resampleExcept(outer, kept, rng);
                StrategyOutcome[] outcomes = evaluator.evaluate(inner);
                for (int s = 0; s < strategies; s++) {
                    meanCost[k][s] += outcomes[s].cost() / innerSamples;
                    meanQaly[k][s] += outcomes[s].qalys() / innerSamples;
                }
            }
        }
        List<VoiEstimate> estimates = new ArrayList<>(grid.size());
        for (int w = 0; w < grid.size(); w++) {
            double wtp = grid.get(w);
            double[][] nmb = new double[outerSamples][strategies];
            for (int k = 0; k < outerSamples; k++) {
                for (int s = 0; s < strategies; s++) {
                    nmb[k][s] = NetMonetaryBenefit.nmb(meanCost[k][s], meanQaly[k][s], wtp);
                }
            }
            estimates.add(VoiEstimate.fromLosses(wtp, opportunityLosses(nmb), eligiblePopulation, cvThreshold, false));
        }
        return new EvppiResult(group, parameters, EvppiMethod.NESTED_MONTE_CARLO, estimates);
    }

    /**
     * Per-sample loss of committing to the strategy with the highest mean NMB.
     *
     * @param nmb NMB indexed by sample, then strategy
     * @return one non-negative loss per sample
     */
    static double[] opportunityLosses(double[][] nmb) {
        int n = nmb.length;
        double[] losses = new double[n];
        if (n == 0) {
            return losses;
        }
        int strategies = nmb[0].length;
        double[] mean = new double[strategies];
        for (double[] row : nmb) {
            for (int s = 0; s < strategies; s++) {
                mean[s] += row[s] / n;
            }
        }
        int chosen = NetMonetaryBenefit.argmax(mean);
        for (int i = 0; i < n; i++) {
            double best = nmb[i][NetMonetaryBenefit.argmax(nmb[i])];
            losses[i] = best - nmb[i][chosen];
        }
        return losses;
    }

    private static double[] fit(double[][] design, double[] y) {
        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
        regression.newSampleData(y, design);
        double[] beta = regression.estimateRegressionParameters();
        double[] fitted = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            double value = beta[0];
            for (int c = 0; c < design[i].length; c++) {
                value += beta[c + 1] * design[i][c];
            }
            fitted[i] = value;
        }
        return fitted;
    }

    private static double[][] design(List<double[]> columns, int n) {
        double[][] design = new double[n][columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            double[] column = columns.get(c);
            for (int i = 0; i < n; i++) {
                design[i][c] = column[i];
            }
        }
        return design;
    }

    private static double[] constant(double[] values) {
        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean = values.length == 0 ? 0.0 : mean / values.length;
        double[] fitted = new double[values.length];
        Arrays.fill(fitted, mean);
        return fitted;
    }

    /**
     * Centers and scales a column; returns null when it does not vary.
     */
    private static double[] standardize(double[] column) {
        int n = column.length;
        if (n < 2) {
            return null;
        }
        double mean = 0.0;
        for (double v : column) {
            mean += v;
        }
        mean /= n;
        double sumSq = 0.0;
        for (double v : column) {
            sumSq += (v - mean) * (v - mean);
        }
        double sd = Math.sqrt(sumSq / (n - 1));
        if (sd < 1e-12 * Math.max(1.0, Math.abs(mean))) {
            return null;
        }
        double[] z = new double[n];
        for (int i = 0; i < n; i++) {
            z[i] = (column[i] - mean) / sd;
        }
        return z;
    }
}
