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

import io.nosqlbench.cea.model.Parameter;
import io.nosqlbench.cea.model.ParameterTable;
import io.nosqlbench.cea.model.SampledParameters;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/// Draws one value per declared parameter for a Monte-Carlo iteration.
///
/// ## Uniform Slots
///
/// Each non-fixed parameter is assigned a uniform slot at construction.
/// Independent parameters get a slot of their own. Parameters that share a
/// correlation group reuse the slot of the group's first member, so they
/// are driven by one uniform variate and keep identical ranks across
/// iterations. Fixed parameters get no slot.
///
/// ```text
///  table:   p_remit   c_drug   u_remit   p_relapse   c_visit
///  group:   trialA    -        -         trialA      -
///  dist:    beta      fixed    beta      beta        gamma
///  slot:    0         -        1         0           2
/// ```
///
/// Per call, exactly `uniformCount()` values are taken from the generator,
/// in slot order.
///
/// ## Reproducibility
///
/// Iteration i uses a fresh XO_SHI_RO_256_PP generator seeded with
/// `baseSeed + i`, so a draw depends only on the base seed and the
/// iteration index, never on which thread runs it.
///
/// ## Thread Safety
///
/// Instances are immutable after construction; concurrent calls must
/// supply their own generators.
public final class ParameterSampler {

    private final ParameterTable table;
    private final DistributionSampler[] samplers;
    private final int[] slots;
    private final int uniformCount;

    public ParameterSampler(ParameterTable table) {
        this.table = table;
        this.samplers = new DistributionSampler[table.size()];
        this.slots = new int[table.size()];
        Map<String, Integer> groupSlots = new HashMap<>();
        int next = 0;
        for (int i = 0; i < table.size(); i++) {
            Parameter p = table.get(i);
            samplers[i] = DistributionSamplerFactory.forModel(p.distribution());
            if (!samplers[i].consumesUniform()) {
                slots[i] = -1;
            } else if (p.correlationGroup() == null) {
                slots[i] = next++;
            } else {
                Integer shared = groupSlots.get(p.correlationGroup());
                if (shared == null) {
                    shared = next++;
                    groupSlots.put(p.correlationGroup(), shared);
                }
                slots[i] = shared;
            }
        }
        this.uniformCount = next;
    }

    /// Creates the generator for one seed.
    public static UniformRandomProvider generator(long seed) {
        return RandomSource.XO_SHI_RO_256_PP.create(seed);
    }

    public ParameterTable table() {
        return table;
    }

    /// Number of uniform variates consumed per draw.
    public int uniformCount() {
        return uniformCount;
    }

    /// Draws with a generator seeded for the given seed.
    public SampledParameters sample(long iteration, long seed) {
        return sample(generator(seed), iteration);
    }

    /// Draws one value per parameter, in table order.
    ///
    /// @param rng the generator to consume
    /// @param iteration iteration index recorded on the result
    /// @return the realised values
    public SampledParameters sample(UniformRandomProvider rng, long iteration) {
        double[] uniforms = new double[uniformCount];
        for (int s = 0; s < uniformCount; s++) {
            uniforms[s] = rng.nextDouble();
        }
        double[] values = new double[samplers.length];
        for (int i = 0; i < samplers.length; i++) {
            values[i] = slots[i] < 0 ? samplers[i].sample(0.5) : samplers[i].sample(uniforms[slots[i]]);
        }
        return new SampledParameters(table, iteration, values);
    }

    /// Draws fresh values for every parameter except the kept ones, which
    /// retain their values from `base`.
    ///
    /// Used for the inner loop of nested EVPPI estimation. When a correlation
    /// group straddles the kept set, the kept members hold their values and
    /// the others are redrawn, so the within-group rank link is not preserved.
    ///
    /// @param base the outer draw
    /// @param kept names of the parameters to hold fixed
    /// @param rng the generator to consume
    /// @return a new sample carrying the base iteration index
    public SampledParameters resampleExcept(SampledParameters base, Set<String> kept, UniformRandomProvider rng) {
        SampledParameters fresh = sample(rng, base.iteration());
        double[] values = fresh.values();
        for (String name : kept) {
            int index = table.indexOf(name);
            if (index >= 0) {
                values[index] = base.get(index);
            }
        }
        return new SampledParameters(table, base.iteration(), values);
    }
}
