package io.nosqlbench.cea.io;

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

import io.nosqlbench.cea.budget.BudgetImpactResult;
import io.nosqlbench.cea.budget.BudgetImpactRow;
import io.nosqlbench.cea.dsa.OneWayResult;
import io.nosqlbench.cea.dsa.ParameterBounds;
import io.nosqlbench.cea.dsa.ScenarioResult;
import io.nosqlbench.cea.dsa.TornadoResult;
import io.nosqlbench.cea.dsa.TwoWayResult;
import io.nosqlbench.cea.economics.StrategyOutcome;
import io.nosqlbench.cea.metrics.CePlanePoint;
import io.nosqlbench.cea.metrics.CeacTable;
import io.nosqlbench.cea.metrics.CeafTable;
import io.nosqlbench.cea.metrics.EfficiencyFrontier;
import io.nosqlbench.cea.metrics.IncrementalResult;
import io.nosqlbench.cea.sampling.ParameterSnapshot;
import io.nosqlbench.cea.voi.EvpiResult;
import io.nosqlbench.cea.voi.EvppiResult;
import io.nosqlbench.cea.voi.VoiEstimate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Writes result tables as CSV files, one per concern, into a directory.
 *
 * <p>Numbers are formatted with {@link Locale#ROOT} at fixed precision and
 * lines end with a bare line feed, so two runs with the same inputs produce
 * byte-identical files. Values that are undefined are written as {@value #NA}
 * next to a status column that says why.</p>
 */
public final class ResultTableWriter {

    private static final Logger logger = LogManager.getLogger(ResultTableWriter.class);

    public static final String NA = "NA";

    public static final String DETERMINISTIC = "deterministic.csv";
    public static final String INCREMENTAL = "incremental.csv";
    public static final String CEAC = "ceac.csv";
    public static final String CEAF = "ceaf.csv";
    public static final String EVPI = "evpi.csv";
    public static final String EVPPI = "evppi.csv";
    public static final String CE_PLANE = "ce_plane.csv";
    public static final String BUDGET_IMPACT = "budget_impact.csv";
    public static final String PARAMETER_SNAPSHOT = "parameter_snapshot.csv";
    public static final String DSA = "dsa.csv";
    public static final String DSA_TWO_WAY = "dsa_two_way.csv";
    public static final String SCENARIOS = "scenarios.csv";

    private final Path directory;

    public ResultTableWriter(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    public Path writeDeterministic(List<StrategyOutcome> outcomes) throws IOException {
        List<String> rows = new ArrayList<>();
        for (StrategyOutcome o : outcomes) {
            rows.add(join(quote(o.strategyId()), money(o.cost()), value(o.qalys()), value(o.lifeYears())));
        }
        return writeTable(DETERMINISTIC, "strategy,cost,qalys,life_years", rows);
    }

    /**
     * Incremental results against the reference strategy, with frontier
     * membership and the sequential ICER of each frontier member.
     */
    public Path writeIncremental(List<IncrementalResult> results, EfficiencyFrontier frontier) throws IOException {
        List<String> rows = new ArrayList<>();
        for (int s = 0; s < results.size(); s++) {
            IncrementalResult r = results.get(s);
            OptionalDouble sequential = frontier.sequentialIcer(s);
            rows.add(join(quote(r.strategyId()), money(r.cost()), value(r.qalys()),
                money(r.deltaCost()), value(r.deltaQaly()),
                optional(r.icer().value()), r.icer().status().name(),
                frontier.dominance(s).name(), Boolean.toString(frontier.contains(s)),
                optional(sequential)));
        }
        return writeTable(INCREMENTAL,
            "strategy,cost,qalys,delta_cost,delta_qaly,icer,icer_status,dominance,on_frontier,sequential_icer", rows);
    }

    /** One row per threshold, one probability column per strategy in strategy order. */
    public Path writeCeac(CeacTable ceac) throws IOException {
        StringBuilder header = new StringBuilder("wtp");
        for (String id : ceac.strategyIds()) {
            header.append(',').append(quote(id));
        }
        List<String> rows = new ArrayList<>();
        for (int w = 0; w < ceac.grid().size(); w++) {
            StringBuilder row = new StringBuilder(money(ceac.grid().get(w)));
            for (int s = 0; s < ceac.strategyIds().size(); s++) {
                row.append(',').append(value(ceac.probability(w, s)));
            }
            rows.add(row.toString());
        }
        return writeTable(CEAC, header.toString(), rows);
    }

    public Path writeCeaf(CeafTable ceaf) throws IOException {
        List<String> rows = new ArrayList<>();
        for (CeafTable.Row r : ceaf.rows()) {
            rows.add(join(money(r.wtp()), quote(r.strategyId()), money(r.expectedNmb()), value(r.probability())));
        }
        return writeTable(CEAF, "wtp,strategy,expected_nmb,probability", rows);
    }

    public Path writeEvpi(EvpiResult evpi) throws IOException {
        List<String> rows = new ArrayList<>();
        for (VoiEstimate e : evpi.estimates()) {
            rows.add(estimate(e));
        }
        return writeTable(EVPI, "wtp,per_patient,population,standard_error,cv,precision", rows);
    }

    public Path writeEvppi(List<EvppiResult> results) throws IOException {
        List<String> rows = new ArrayList<>();
        for (EvppiResult r : results) {
            String prefix = join(quote(r.group()), quote(String.join(";", r.parameters())),
                r.method().name().toLowerCase(Locale.ROOT));
            for (VoiEstimate e : r.estimates()) {
                rows.add(prefix + "," + estimate(e));
            }
        }
        return writeTable(EVPPI, "group,parameters,method,wtp,per_patient,population,standard_error,cv,precision",
            rows);
    }

    public Path writeCePlane(List<CePlanePoint> points) throws IOException {
        List<String> rows = new ArrayList<>(points.size());
        for (CePlanePoint p : points) {
            rows.add(join(Long.toString(p.iteration()), quote(p.strategyId()), money(p.deltaCost()),
                value(p.deltaQaly())));
        }
        return writeTable(CE_PLANE, "iteration,strategy,delta_cost,delta_qaly", rows);
    }

    /** One column of population cost per strategy, in strategy order. */
    public Path writeBudgetImpact(BudgetImpactResult result) throws IOException {
        StringBuilder header = new StringBuilder("year,eligible_population");
        for (String id : result.strategyIds()) {
            header.append(",cost_").append(id);
        }
        header.append(",unadopted_cost,implementation_cost,total_cost,baseline_cost,budget_impact,cumulative_impact");
        List<String> rows = new ArrayList<>();
        for (BudgetImpactRow r : result.rows()) {
            StringBuilder row = new StringBuilder();
            row.append(r.year()).append(',').append(value(r.eligiblePopulation()));
            for (String id : result.strategyIds()) {
                row.append(',').append(money(r.populationCost(id)));
            }
            row.append(',').append(join(money(r.unadoptedCost()), money(r.implementationCost()),
                money(r.totalCost()), money(r.baselineCost()), money(r.budgetImpact()), money(r.cumulativeImpact())));
            rows.add(row.toString());
        }
        return writeTable(BUDGET_IMPACT, header.toString(), rows);
    }

    public Path writeParameterSnapshot(ParameterSnapshot snapshot) throws IOException {
        List<String> rows = new ArrayList<>(snapshot.size());
        for (ParameterSnapshot.Row r : snapshot.rows()) {
            rows.add(join(Long.toString(r.iteration()), quote(r.parameter()), value(r.value())));
        }
        return writeTable(PARAMETER_SNAPSHOT, "iteration,parameter,value", rows);
    }

    /** One-way results, each comparator's rows in tornado order. */
    public Path writeDsa(List<TornadoResult> tornadoes) throws IOException {
        List<String> rows = new ArrayList<>();
        for (TornadoResult t : tornadoes) {
            for (OneWayResult r : t.rows()) {
                ParameterBounds b = r.bounds();
                rows.add(join(quote(t.comparator()), quote(r.parameter()), value(b.base()), value(b.low()),
                    value(b.high()), b.explicit() ? "range" : "percentile", money(r.baseOutcome()),
                    money(r.lowOutcome()), money(r.highOutcome()), money(r.range())));
            }
        }
        return writeTable(DSA,
            "strategy,parameter,base_value,low_value,high_value,bounds,base_inmb,low_inmb,high_inmb,range", rows);
    }

    public Path writeTwoWayDsa(List<TwoWayResult> grids) throws IOException {
        List<String> rows = new ArrayList<>();
        for (TwoWayResult g : grids) {
            double[] first = g.firstValues();
            double[] second = g.secondValues();
            for (int i = 0; i < first.length; i++) {
                for (int j = 0; j < second.length; j++) {
                    rows.add(join(quote(g.comparator()), quote(g.first()), value(first[i]), quote(g.second()),
                        value(second[j]), money(g.outcome(i, j))));
                }
            }
        }
        return writeTable(DSA_TWO_WAY,
            "strategy,first_parameter,first_value,second_parameter,second_value,incremental_nmb", rows);
    }

    public Path writeScenarios(List<ScenarioResult> scenarios) throws IOException {
        List<String> rows = new ArrayList<>();
        for (ScenarioResult sc : scenarios) {
            for (int s = 0; s < sc.outcomes().size(); s++) {
                StrategyOutcome o = sc.outcomes().get(s);
                rows.add(join(quote(sc.name()), quote(o.strategyId()), money(o.cost()), value(o.qalys()),
                    money(sc.incrementalNmb(s))));
            }
        }
        return writeTable(SCENARIOS, "scenario,strategy,cost,qalys,incremental_nmb", rows);
    }

    private Path writeTable(String fileName, String header, List<String> rows) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(fileName);
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writer.write(header);
            writer.write('\n');
            for (String row : rows) {
                writer.write(row);
                writer.write('\n');
            }
        }
        logger.debug("Wrote {} rows to {}", rows.size(), target);
        return target;
    }

    private static String estimate(VoiEstimate e) {
        return join(money(e.wtp()), money(e.perPatient()), money(e.population()), money(e.standardError()),
            value(e.coefficientOfVariation()), e.lowPrecision() ? "low" : "ok");
    }

    static String money(double v) {
        return format("%.2f", v);
    }

    static String value(double v) {
        return format("%.6f", v);
    }

    private static String optional(OptionalDouble v) {
        return v.isPresent() ? money(v.getAsDouble()) : NA;
    }

    private static String format(String pattern, double v) {
        if (!Double.isFinite(v)) {
            return NA;
        }
        String text = String.format(Locale.ROOT, pattern, v);
        // avoid "-0.00" for values that round to zero
        return text.matches("-0\\.0+") ? text.substring(1) : text;
    }

    static String quote(String text) {
        if (text.indexOf(',') < 0 && text.indexOf('"') < 0 && text.indexOf('\n') < 0) {
            return text;
        }
        return '"' + text.replace("\"", "\"\"") + '"';
    }

    private static String join(String... fields) {
        return String.join(",", fields);
    }
}
