package io.nosqlbench.cea.markov;

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

import io.nosqlbench.cea.model.SampledParameters;
import io.nosqlbench.cea.model.errors.ValidationException;
import io.nosqlbench.cea.model.strategy.StateSpace;
import io.nosqlbench.cea.model.strategy.TransitionMatrix;
import io.nosqlbench.cea.model.strategy.TransitionModel;
import io.nosqlbench.cea.model.strategy.ValueRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Monthly depression course: remission from the depressed state, and
/// relapse from remission at a hazard that is higher soon after remission.
///
/// ## Without Tunnels
///
/// Three states. The early relapse probability applies while
/// `cycle < relapseWindowMonths`, the late one afterwards:
///
/// ```text
///              remission
///   Depressed ───────────► Remission
///       ▲ │                    │
///       │ │ excess             │ relapse(cycle)
///       │ ▼                    │
///       │ Death                │
///       └──────────────────────┘
/// ```
///
/// ## With Tunnels
///
/// Remission is split into `Remission_m1 .. Remission_m{k}` and
/// `Remission_late`. The cohort enters `Remission_m1`, moves one tunnel
/// per month, and reaches `Remission_late` after k months. Early relapse
/// applies inside the tunnels and late relapse afterwards, so the hazard
/// tracks months since remission rather than calendar time.
///
/// All probabilities are monthly. The matrix is built exactly as the
/// parameters dictate; out-of-range inputs give rows that fail validation.
public final class DepressionTransitionModel implements TransitionModel {

    private final StateSpace space;
    private final ValueRef remission;
    private final ValueRef earlyRelapse;
    private final ValueRef lateRelapse;
    private final ValueRef excessMortality;
    private final int relapseWindowMonths;
    private final int tunnelMonths;

    private DepressionTransitionModel(Builder builder) {
        this.remission = builder.remission;
        this.earlyRelapse = builder.earlyRelapse;
        this.lateRelapse = builder.lateRelapse;
        this.excessMortality = builder.excessMortality;
        this.relapseWindowMonths = builder.relapseWindowMonths;
        this.tunnelMonths = builder.tunnelMonths;
        this.space = tunnelMonths == 0 ? StateSpace.simple() : StateSpace.withRemissionTunnels(tunnelMonths);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public StateSpace stateSpace() {
        return space;
    }

    public int tunnelMonths() {
        return tunnelMonths;
    }

    public int relapseWindowMonths() {
        return relapseWindowMonths;
    }

    @Override
    public TransitionMatrix matrixFor(int cycle, SampledParameters parameters) {
        double pRemit = remission.resolve(parameters);
        double pEarly = earlyRelapse.resolve(parameters);
        double pLate = lateRelapse.resolve(parameters);
        double pExcess = excessMortality.resolve(parameters);

        int n = space.size();
        int depressed = space.indexOf(StateSpace.DEPRESSED);
        int death = space.deathState();
        double[][] p = new double[n][n];

        p[depressed][death] = pExcess;
        p[depressed][depressed] = 1.0 - pRemit - pExcess;
        p[death][death] = 1.0;

        if (tunnelMonths == 0) {
            int remitted = space.indexOf(StateSpace.REMISSION);
            double relapse = cycle < relapseWindowMonths ? pEarly : pLate;
            p[depressed][remitted] = pRemit;
            p[remitted][depressed] = relapse;
            p[remitted][remitted] = 1.0 - relapse;
        } else {
            p[depressed][space.indexOf(StateSpace.tunnelName(1))] = pRemit;
            int late = space.indexOf(StateSpace.REMISSION + "_late");
            for (int m = 1; m <= tunnelMonths; m++) {
                int tunnel = space.indexOf(StateSpace.tunnelName(m));
                int next = m < tunnelMonths ? space.indexOf(StateSpace.tunnelName(m + 1)) : late;
                p[tunnel][depressed] = pEarly;
                p[tunnel][next] = 1.0 - pEarly;
            }
            p[late][depressed] = pLate;
            p[late][late] = 1.0 - pLate;
        }
        return new TransitionMatrix(p);
    }

    @Override
    public List<String> requiredParameters() {
        List<String> names = new ArrayList<>();
        for (ValueRef ref : List.of(remission, earlyRelapse, lateRelapse, excessMortality)) {
            ref.parameterName().filter(name -> !names.contains(name)).ifPresent(names::add);
        }
        return names;
    }

    public static final class Builder {
        private ValueRef remission;
        private ValueRef earlyRelapse;
        private ValueRef lateRelapse;
        private ValueRef excessMortality = ValueRef.ZERO;
        private int relapseWindowMonths = 6;
        private int tunnelMonths;

        public Builder remission(ValueRef remission) {
            this.remission = Objects.requireNonNull(remission);
            return this;
        }

        public Builder earlyRelapse(ValueRef earlyRelapse) {
            this.earlyRelapse = Objects.requireNonNull(earlyRelapse);
            return this;
        }

        public Builder lateRelapse(ValueRef lateRelapse) {
            this.lateRelapse = Objects.requireNonNull(lateRelapse);
            return this;
        }

        /// Uses one relapse probability for the whole horizon.
        public Builder relapse(ValueRef relapse) {
            return earlyRelapse(relapse).lateRelapse(relapse);
        }

        public Builder excessMortality(ValueRef excessMortality) {
            this.excessMortality = Objects.requireNonNull(excessMortality);
            return this;
        }

        public Builder relapseWindowMonths(int relapseWindowMonths) {
            if (relapseWindowMonths < 0) {
                throw new ValidationException("relapse_window_months", "must be non-negative, got " + relapseWindowMonths);
            }
            this.relapseWindowMonths = relapseWindowMonths;
            return this;
        }

        public Builder tunnelMonths(int tunnelMonths) {
            if (tunnelMonths < 0) {
                throw new ValidationException("tunnel_months", "must be non-negative, got " + tunnelMonths);
            }
            this.tunnelMonths = tunnelMonths;
            return this;
        }

        public DepressionTransitionModel build() {
            if (remission == null) {
                throw new ValidationException("transitions", "no remission probability is defined");
            }
            if (earlyRelapse == null || lateRelapse == null) {
                throw new ValidationException("transitions", "no relapse probability is defined");
            }
            return new DepressionTransitionModel(this);
        }
    }
}
