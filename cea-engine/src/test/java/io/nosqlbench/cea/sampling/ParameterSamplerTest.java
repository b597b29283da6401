package io.nosqlbench.cea.sampling;

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

import io.nosqlbench.cea.TrdFixtures;
import io.nosqlbench.cea.model.BetaDistributionModel;
import io.nosqlbench.cea.model.FixedDistributionModel;
import io.nosqlbench.cea.model.GammaDistributionModel;
import io.nosqlbench.cea.model.LogNormalDistributionModel;
import io.nosqlbench.cea.model.Parameter;
import io.nosqlbench.cea.model.ParameterTable;
import io.nosqlbench.cea.model.SampledParameters;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ParameterSamplerTest {

    @Test
    void sameSeedGivesSameDraw() {
        ParameterSampler sampler = new ParameterSampler(TrdFixtures.parameters());
        SampledParameters a = sampler.sample(3, 1234L);
        SampledParameters b = sampler.sample(3, 1234L);
        assertArrayEquals(a.values(), b.values());
        assertEquals(3, a.iteration());
        assertFalse(Arrays.equals(a.values(), sampler.sample(3, 1235L).values()));
    }

    @Test
    void correlationGroupSharesOneUniform() {
        ParameterSampler sampler = new ParameterSampler(TrdFixtures.parameters());
        // eight parameters, two of them sharing a slot
        assertEquals(7, sampler.uniformCount());
    }

    @Test
    void correlatedParametersShareRanks() {
        ParameterTable table = new ParameterTable(List.of(
            Parameter.of("u_dep", new BetaDistributionModel(55, 45)).withCorrelationGroup("u"),
            Parameter.of("u_rem", new BetaDistributionModel(80, 20)).withCorrelationGroup("u"),
            Parameter.of("c_dep", new GammaDistributionModel(100, 4))));
        ParameterSampler sampler = new ParameterSampler(table);
        UniformRandomProvider rng = ParameterSampler.generator(99);
        double[][] draws = new double[200][];
        for (int i = 0; i < draws.length; i++) {
            draws[i] = sampler.sample(rng, i).values();
        }
        for (int i = 0; i < draws.length; i++) {
            for (int j = 0; j < draws.length; j++) {
                if (draws[i][0] < draws[j][0]) {
                    assertTrue(draws[i][1] <= draws[j][1], "rank order of correlated parameters differs");
                }
            }
        }
    }

    @Test
    void fixedParametersConsumeNoVariates() {
        ParameterTable withFixed = new ParameterTable(List.of(
            Parameter.of("a", new FixedDistributionModel(2.5)),
            Parameter.of("b", new BetaDistributionModel(2, 2))));
        ParameterTable without = new ParameterTable(List.of(
            Parameter.of("b", new BetaDistributionModel(2, 2))));
        ParameterSampler sampler = new ParameterSampler(withFixed);
        assertEquals(1, sampler.uniformCount());
        SampledParameters drawn = sampler.sample(0, 11L);
        assertEquals(2.5, drawn.get("a"));
        assertEquals(new ParameterSampler(without).sample(0, 11L).get("b"), drawn.get("b"));
    }

    @Test
    void valuesStayInSupport() {
        ParameterTable table = new ParameterTable(List.of(
            Parameter.of("p", new BetaDistributionModel(0.5, 0.5)),
            Parameter.of("c", new GammaDistributionModel(0.8, 100)),
            Parameter.of("r", new LogNormalDistributionModel(0, 1))));
        ParameterSampler sampler = new ParameterSampler(table);
        UniformRandomProvider rng = ParameterSampler.generator(5);
        for (int i = 0; i < 500; i++) {
            SampledParameters s = sampler.sample(rng, i);
            assertTrue(s.get("p") >= 0 && s.get("p") <= 1);
            assertTrue(s.get("c") >= 0);
            assertTrue(s.get("r") > 0);
        }
    }

    @Test
    void samplesAreCloseToTheMean() {
        ParameterTable table = new ParameterTable(List.of(
            Parameter.of("c", GammaDistributionModel.fromMeanAndSe(400, 40))));
        ParameterSampler sampler = new ParameterSampler(table);
        UniformRandomProvider rng = ParameterSampler.generator(17);
        double sum = 0;
        int n = 4000;
        for (int i = 0; i < n; i++) {
            sum += sampler.sample(rng, i).get("c");
        }
        assertEquals(400, sum / n, 4.0);
    }

    @Test
    void resampleKeepsOnlyTheNamedParameters() {
        ParameterSampler sampler = new ParameterSampler(TrdFixtures.parameters());
        SampledParameters base = sampler.sample(4, 100L);
        SampledParameters inner = sampler.resampleExcept(base, Set.of("p_remit_uc", "p_remit_ket"),
            ParameterSampler.generator(200L));
        assertEquals(base.get("p_remit_uc"), inner.get("p_remit_uc"));
        assertEquals(base.get("p_remit_ket"), inner.get("p_remit_ket"));
        assertNotEquals(base.get("c_dep"), inner.get("c_dep"));
        assertEquals(4, inner.iteration());
    }

    @Test
    void snapshotListsEveryValue() {
        ParameterTable table = TrdFixtures.parameters();
        ParameterSampler sampler = new ParameterSampler(table);
        ParameterSnapshot snapshot = ParameterSnapshot.of(table, new long[]{0, 1},
            List.of(sampler.sample(0, 7).values(), sampler.sample(1, 8).values()));
        assertEquals(2 * table.size(), snapshot.size());
        assertEquals("p_remit_uc", snapshot.rows().get(0).parameter());
        assertEquals(1, snapshot.rows().get(table.size()).iteration());
    }
}
