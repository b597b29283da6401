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

import io.nosqlbench.cea.markov.BackgroundMortality;
import io.nosqlbench.cea.markov.DepressionTransitionModel;
import io.nosqlbench.cea.model.BetaDistributionModel;
import io.nosqlbench.cea.model.DistributionModel;
import io.nosqlbench.cea.model.FixedDistributionModel;
import io.nosqlbench.cea.model.GammaDistributionModel;
import io.nosqlbench.cea.model.LogNormalDistributionModel;
import io.nosqlbench.cea.model.Parameter;
import io.nosqlbench.cea.model.ParameterTable;
import io.nosqlbench.cea.model.config.AdoptionCurve;
import io.nosqlbench.cea.model.config.BudgetImpactConfig;
import io.nosqlbench.cea.model.config.DiscountRates;
import io.nosqlbench.cea.model.config.EvppiMethod;
import io.nosqlbench.cea.model.config.FailurePolicy;
import io.nosqlbench.cea.model.config.RunConfig;
import io.nosqlbench.cea.model.config.SensitivityConfig;
import io.nosqlbench.cea.model.config.WtpGrid;
import io.nosqlbench.cea.model.errors.ValidationException;
import io.nosqlbench.cea.model.strategy.OneTimeCost;
import io.nosqlbench.cea.model.strategy.StateSpace;
import io.nosqlbench.cea.model.strategy.StateValueModel;
import io.nosqlbench.cea.model.strategy.StrategyArm;
import io.nosqlbench.cea.model.strategy.StrategyRegistry;
import io.nosqlbench.cea.model.strategy.ValueRef;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Reads a YAML model definition.
///
/// ```yaml
/// run:
///   iterations: 1000
///   seed: 42
///   jurisdiction: AU
///   reference: usual_care
///   discount_rates:
///     AU: {costs: 0.05, qalys: 0.05}
/// wtp_grid: {lower: 0, upper: 100000, step: 5000}
/// states: {tunnel_months: 0, relapse_window_months: 6}
/// background_mortality:
///   smr: 1.7
///   life_table: {40: 0.0012, 60: 0.0071}
/// parameters:
///   - name: p_remit_ket
///     owner: ketamine
///     distribution: {type: beta, mean: 0.4, se: 0.05}
///     evppi_group: efficacy
/// strategies:
///   - id: ketamine
///     transitions: {remission: p_remit_ket, relapse: p_relapse}
///     costs: {Depressed: c_dep, Remission: c_rem}
///     utilities: {Depressed: u_dep, Remission: u_rem}
///     one_time_costs: [{label: induction, cycle: 0, amount: c_induction}]
///     acute_phase: {cycles: 1, disutility: 0.05}
/// adoption:
///   years: 5
///   population: 10000
///   shape: linear
///   initial: {ketamine: 0.0}
///   target: {ketamine: 0.3}
/// sensitivity:
///   percentiles: [0.05, 0.95]
///   ranges: {c_session: [200, 400]}
///   two_way: [{parameters: [p_remit_ket, c_session], steps: 5}]
///   scenarios: [{name: cheap_sessions, values: {c_session: 150}}]
/// ```
///
/// Numbers anywhere a transition, cost or utility is expected may be
/// replaced by a parameter name. Every structural problem is reported as a
/// [ValidationException] whose subject is the dotted path of the offending
/// key.
public final class ModelDefinitionLoader {

    private static final Logger logger = LogManager.getLogger(ModelDefinitionLoader.class);

    private final LoadSettings loadSettings;

    public ModelDefinitionLoader() {
        this.loadSettings = LoadSettings.builder().setLabel("model definition").build();
    }

    /// Loads and validates a model definition file.
    ///
    /// @param path the YAML file
    /// @return the model
    /// @throws IOException if the file cannot be read
    /// @throws ValidationException if the definition is invalid
    public ModelDefinition load(Path path) throws IOException {
        logger.debug("Loading model definition from {}", path);
        return loadFromString(Files.readString(path));
    }

    /// Parses and validates a model definition held in memory.
    public ModelDefinition loadFromString(String yaml) {
        Object document;
        try {
            document = new Load(loadSettings).loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new ValidationException("model", "malformed YAML: " + e.getMessage(), e);
        }
        if (!(document instanceof Map<?, ?>)) {
            throw new ValidationException("model", "the document must be a mapping of sections");
        }
        return parse(new Section("", (Map<?, ?>) document));
    }

    private ModelDefinition parse(Section root) {
        List<String> strategyIds = new ArrayList<>();
        for (Section s : root.sectionList("strategies")) {
            strategyIds.add(s.string("id"));
        }
        if (strategyIds.size() < 2) {
            throw new ValidationException("strategies",
                "at least two strategies are required, got " + strategyIds.size());
        }

        RunConfig runConfig = parseRun(root.optionalSection("run"), strategyIds.get(0));
        WtpGrid grid = parseGrid(root);
        BackgroundMortality mortality = parseMortality(root.optionalSection("background_mortality"));

        List<Parameter> declared = new ArrayList<>();
        for (Section p : root.sectionList("parameters")) {
            declared.add(parseParameter(p));
        }
        ParameterTable table = ParameterTable.forJurisdiction(declared, runConfig.jurisdiction());
        logger.debug("Resolved {} of {} parameter rows for jurisdiction {}",
            table.size(), declared.size(), runConfig.jurisdiction());

        Section states = root.optionalSection("states");
        int tunnelMonths = states.integer("tunnel_months", 0);
        int relapseWindow = states.integer("relapse_window_months", 6);

        StrategyRegistry.Builder registry = StrategyRegistry.builder().reference(runConfig.referenceStrategy());
        for (Section s : root.sectionList("strategies")) {
            registry.register(parseStrategy(s, tunnelMonths, relapseWindow));
        }
        StrategyRegistry strategies = registry.build(table);

        BudgetImpactConfig budget = root.has("adoption")
            ? parseAdoption(root.section("adoption"), runConfig) : null;

        SensitivityConfig sensitivity = parseSensitivity(root.optionalSection("sensitivity"), table);

        logger.debug("Loaded model with {} strategies, {} parameters, {} thresholds, budget impact {}",
            strategies.size(), table.size(), grid.size(), budget == null ? "off" : "on");
        return new ModelDefinition(runConfig, grid, declared, table, strategies, mortality, budget, sensitivity);
    }

    private RunConfig parseRun(Section run, String firstStrategy) {
        RunConfig.Builder b = RunConfig.builder()
            .referenceStrategy(run.string("reference", firstStrategy))
            .jurisdiction(run.string("jurisdiction", null));
        if (run.has("iterations")) b.iterations(run.integer("iterations"));
        if (run.has("seed")) b.seed(run.longValue("seed"));
        if (run.has("horizon_cycles")) b.horizonCycles(run.integer("horizon_cycles"));
        if (run.has("cycle_length_months")) b.cycleLengthMonths(run.integer("cycle_length_months"));
        if (run.has("policy_wtp")) b.policyWtp(run.number("policy_wtp"));
        if (run.has("eligible_population")) b.eligiblePopulation(run.number("eligible_population"));
        if (run.has("batch_size")) b.batchSize(run.integer("batch_size"));
        if (run.has("threads")) b.threads(run.integer("threads"));
        if (run.has("failure_policy")) b.failurePolicy(run.enumValue("failure_policy", FailurePolicy.class));
        if (run.has("failure_tolerance")) b.failureTolerance(run.number("failure_tolerance"));
        if (run.has("evpi_cv_threshold")) b.evpiCvThreshold(run.number("evpi_cv_threshold"));
        if (run.has("evppi_method")) b.evppiMethod(run.enumValue("evppi_method", EvppiMethod.class));
        if (run.has("evppi_outer_samples") || run.has("evppi_inner_samples")) {
            b.evppiSamples(run.integer("evppi_outer_samples", 100), run.integer("evppi_inner_samples", 100));
        }
        if (run.has("start_age")) b.startAge(run.number("start_age"));
        if (run.has("checkpoint")) b.checkpointPath(Path.of(run.string("checkpoint")));
        if (run.has("discount_rate")) b.defaultDiscountRates(DiscountRates.uniform(run.number("discount_rate")));

        if (run.has("discount_rates")) {
            Section rates = run.section("discount_rates");
            for (String jurisdiction : rates.keys()) {
                Section r = rates.section(jurisdiction);
                b.discountRates(jurisdiction, new DiscountRates(r.number("costs"), r.number("qalys")));
            }
        }
        return b.build();
    }

    private WtpGrid parseGrid(Section root) {
        if (!root.has("wtp_grid")) {
            return WtpGrid.range(0, 100_000, 1_000);
        }
        Object raw = root.raw("wtp_grid");
        if (raw instanceof List<?> list) {
            double[] points = new double[list.size()];
            for (int i = 0; i < points.length; i++) {
                points[i] = toDouble("wtp_grid[" + i + "]", list.get(i));
            }
            return WtpGrid.of(points);
        }
        Section grid = root.section("wtp_grid");
        return WtpGrid.range(grid.number("lower"), grid.number("upper"), grid.number("step"));
    }

    private BackgroundMortality parseMortality(Section section) {
        if (!section.has("life_table")) {
            return BackgroundMortality.none();
        }
        Section rows = section.section("life_table");
        Map<Double, Double> table = new LinkedHashMap<>();
        for (String age : rows.keys()) {
            table.put(toDouble(rows.path(age), age), rows.number(age));
        }
        return BackgroundMortality.lifeTable(table, section.number("smr", 1.0));
    }

    private Parameter parseParameter(Section p) {
        String name = p.string("name");
        DistributionModel distribution = p.has("distribution")
            ? parseDistribution(p.section("distribution"))
            : new FixedDistributionModel(p.number("value"));
        return new Parameter(name, p.string("owner", Parameter.SHARED), distribution,
            p.string("correlation_group", null), p.string("jurisdiction", null), p.string("evppi_group", null));
    }

    private DistributionModel parseDistribution(Section d) {
        String type = d.string("type").toLowerCase(Locale.ROOT);
        boolean moments = d.has("mean") && d.has("se");
        switch (type) {
            case FixedDistributionModel.DISTRIBUTION_TYPE:
                return new FixedDistributionModel(d.has("value") ? d.number("value") : d.number("mean"));
            case BetaDistributionModel.DISTRIBUTION_TYPE:
                return moments
                    ? BetaDistributionModel.fromMeanAndSe(d.number("mean"), d.number("se"))
                    : new BetaDistributionModel(d.number("alpha"), d.number("beta"));
            case GammaDistributionModel.DISTRIBUTION_TYPE:
                return moments
                    ? GammaDistributionModel.fromMeanAndSe(d.number("mean"), d.number("se"))
                    : new GammaDistributionModel(d.number("shape"), d.number("scale"));
            case LogNormalDistributionModel.DISTRIBUTION_TYPE:
                return moments
                    ? LogNormalDistributionModel.fromMeanAndSe(d.number("mean"), d.number("se"))
                    : new LogNormalDistributionModel(d.number("mu"), d.number("sigma"));
            default:
                throw new ValidationException(d.path("type"), "unknown distribution type '" + type + "'");
        }
    }

    private StrategyArm parseStrategy(Section s, int tunnelMonths, int relapseWindow) {
        String id = s.string("id");
        Section t = s.section("transitions");
        DepressionTransitionModel.Builder transitions = DepressionTransitionModel.builder()
            .tunnelMonths(tunnelMonths)
            .relapseWindowMonths(t.integer("relapse_window_months", relapseWindow))
            .remission(t.ref("remission"));
        if (t.has("relapse")) {
            transitions.relapse(t.ref("relapse"));
        } else {
            transitions.earlyRelapse(t.ref("early_relapse")).lateRelapse(t.ref("late_relapse"));
        }
        if (t.has("excess_mortality")) {
            transitions.excessMortality(t.ref("excess_mortality"));
        }
        DepressionTransitionModel model = transitions.build();
        StateSpace space = model.stateSpace();

        StrategyArm.Builder arm = StrategyArm.builder(id)
            .transitions(model)
            .costs(StateValueModel.byState(space, s.section("costs").refs()))
            .utilities(StateValueModel.byState(space, s.section("utilities").refs()));
        for (Section c : s.sectionList("one_time_costs")) {
            arm.oneTimeCost(new OneTimeCost(c.string("label", "one-time"), c.integer("cycle", 0), c.ref("amount")));
        }
        if (s.has("acute_phase")) {
            Section acute = s.section("acute_phase");
            arm.acutePhase(acute.integer("cycles"), acute.ref("disutility"));
        }
        return arm.build();
    }

    private BudgetImpactConfig parseAdoption(Section a, RunConfig run) {
        int years = a.integer("years");
        AdoptionCurve curve;
        if (a.has("shares")) {
            Section shares = a.section("shares");
            Map<String, double[]> series = new LinkedHashMap<>();
            for (String strategy : shares.keys()) {
                List<?> values = shares.list(strategy);
                if (values.size() != years) {
                    throw new ValidationException(shares.path(strategy),
                        "expected " + years + " yearly shares, got " + values.size());
                }
                double[] row = new double[years];
                for (int y = 0; y < years; y++) {
                    row[y] = toDouble(shares.path(strategy) + "[" + y + "]", values.get(y));
                }
                series.put(strategy, row);
            }
            curve = new AdoptionCurve(years, series);
        } else {
            curve = AdoptionCurve.interpolate(a.section("initial").numbers(), a.section("target").numbers(), years,
                a.enumValue("shape", AdoptionCurve.Shape.class, AdoptionCurve.Shape.LINEAR));
        }

        BudgetImpactConfig.Builder b = BudgetImpactConfig.builder()
            .adoption(curve)
            .basePopulation(a.number("population", run.eligiblePopulation()))
            .populationGrowth(a.number("population_growth", 0.0));
        a.optionalSection("baseline").numbers().forEach(b::baselineShare);
        a.optionalSection("implementation_costs").numbers().forEach(b::implementationCost);
        return b.build();
    }

    private SensitivityConfig parseSensitivity(Section s, ParameterTable table) {
        SensitivityConfig.Builder b = SensitivityConfig.builder();
        if (s.has("percentiles")) {
            double[] bounds = pair(s, "percentiles");
            b.percentiles(bounds[0], bounds[1]);
        }
        Section ranges = s.optionalSection("ranges");
        for (String name : ranges.keys()) {
            requireDeclared(table, ranges.path(name), name);
            double[] bounds = pair(ranges, name);
            b.range(name, bounds[0], bounds[1]);
        }
        for (Section t : s.sectionList("two_way")) {
            List<?> names = t.list("parameters");
            if (names.size() != 2) {
                throw new ValidationException(t.path("parameters"), "expected two parameter names, got "
                    + names.size());
            }
            String first = String.valueOf(names.get(0)).trim();
            String second = String.valueOf(names.get(1)).trim();
            requireDeclared(table, t.path("parameters") + "[0]", first);
            requireDeclared(table, t.path("parameters") + "[1]", second);
            b.twoWay(first, second, t.integer("steps", 5));
        }
        for (Section c : s.sectionList("scenarios")) {
            Section values = c.section("values");
            for (String name : values.keys()) {
                requireDeclared(table, values.path(name), name);
            }
            b.scenario(c.string("name"), values.numbers());
        }
        return b.build();
    }

    private static double[] pair(Section s, String key) {
        List<?> values = s.list(key);
        if (values.size() != 2) {
            throw new ValidationException(s.path(key), "expected [low, high], got " + values.size() + " values");
        }
        return new double[] {
            toDouble(s.path(key) + "[0]", values.get(0)),
            toDouble(s.path(key) + "[1]", values.get(1))
        };
    }

    private static void requireDeclared(ParameterTable table, String path, String name) {
        if (!table.contains(name)) {
            throw new ValidationException(path, "parameter '" + name + "' is not declared");
        }
    }

    private static double toDouble(String path, Object raw) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(path, "expected a number, got '" + text + "'");
            }
        }
        throw new ValidationException(path, "expected a number, got " + raw);
    }

    /// A mapping within the document, addressed by its dotted path.
    private static final class Section {
        private final String path;
        private final Map<?, ?> values;

        Section(String path, Map<?, ?> values) {
            this.path = path;
            this.values = values;
        }

        String path(String key) {
            return path.isEmpty() ? key : path + "." + key;
        }

        boolean has(String key) {
            return values.get(key) != null;
        }

        Object raw(String key) {
            return values.get(key);
        }

        List<String> keys() {
            List<String> keys = new ArrayList<>();
            for (Object key : values.keySet()) {
                keys.add(String.valueOf(key));
            }
            return keys;
        }

        private Object lookup(String key) {
            // YAML reads numeric keys such as ages as numbers
            for (Map.Entry<?, ?> e : values.entrySet()) {
                if (String.valueOf(e.getKey()).equals(key)) {
                    return e.getValue();
                }
            }
            return null;
        }

        private Object required(String key) {
            Object value = lookup(key);
            if (value == null) {
                throw new ValidationException(path(key), "is required");
            }
            return value;
        }

        Section section(String key) {
            Object value = required(key);
            if (!(value instanceof Map<?, ?> map)) {
                throw new ValidationException(path(key), "must be a mapping");
            }
            return new Section(path(key), map);
        }

        Section optionalSection(String key) {
            return has(key) ? section(key) : new Section(path(key), Map.of());
        }

        List<?> list(String key) {
            Object value = required(key);
            if (!(value instanceof List<?> list)) {
                throw new ValidationException(path(key), "must be a list");
            }
            return list;
        }

        List<Section> sectionList(String key) {
            if (!has(key)) {
                return List.of();
            }
            List<?> items = list(key);
            List<Section> sections = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                String itemPath = path(key) + "[" + i + "]";
                if (!(items.get(i) instanceof Map<?, ?> map)) {
                    throw new ValidationException(itemPath, "must be a mapping");
                }
                sections.add(new Section(itemPath, map));
            }
            return sections;
        }

        String string(String key) {
            return String.valueOf(required(key)).trim();
        }

        String string(String key, String fallback) {
            Object value = lookup(key);
            return value == null ? fallback : String.valueOf(value).trim();
        }

        double number(String key) {
            return toDouble(path(key), required(key));
        }

        double number(String key, double fallback) {
            Object value = lookup(key);
            return value == null ? fallback : toDouble(path(key), value);
        }

        long longValue(String key) {
            Object value = required(key);
            if (value instanceof Number n && Math.rint(n.doubleValue()) == n.doubleValue()) {
                return n.longValue();
            }
            throw new ValidationException(path(key), "expected a whole number, got " + value);
        }

        int integer(String key) {
            long value = longValue(key);
            if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                throw new ValidationException(path(key), "out of range: " + value);
            }
            return (int) value;
        }

        int integer(String key, int fallback) {
            return lookup(key) == null ? fallback : integer(key);
        }

        ValueRef ref(String key) {
            try {
                return ValueRef.parse(required(key));
            } catch (ValidationException e) {
                throw new ValidationException(path(key), e.getMessage(), e);
            }
        }

        Map<String, ValueRef> refs() {
            Map<String, ValueRef> refs = new LinkedHashMap<>();
            for (String key : keys()) {
                refs.put(key, ref(key));
            }
            return refs;
        }

        Map<String, Double> numbers() {
            Map<String, Double> numbers = new LinkedHashMap<>();
            for (String key : keys()) {
                numbers.put(key, number(key));
            }
            return numbers;
        }

        <E extends Enum<E>> E enumValue(String key, Class<E> type) {
            String name = string(key).toUpperCase(Locale.ROOT).replace('-', '_');
            try {
                return Enum.valueOf(type, name);
            } catch (IllegalArgumentException e) {
                throw new ValidationException(path(key), "unknown value '" + string(key) + "'", e);
            }
        }

        <E extends Enum<E>> E enumValue(String key, Class<E> type, E fallback) {
            return has(key) ? enumValue(key, type) : fallback;
        }
    }
}
