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
import io.nosqlbench.cea.model.errors.ValidationException;

import java.util.Objects;

/// Declaration of one uncertain model input.
///
/// A Parameter is immutable and holds no realised value. Values drawn for
/// a Monte-Carlo iteration live in [SampledParameters], so iterations can
/// run concurrently against one shared, read-only parameter table.
///
/// ## Correlation
///
/// Parameters that name the same `correlationGroup` (for example an
/// efficacy rate and its relapse rate taken from one clinical study) are
/// drawn from one shared uniform variate, which preserves their rank
/// correlation exactly. Correlation is opt-in: a parameter with no group is
/// drawn independently.
///
/// ## EVPPI Groups
///
/// `evppiGroup` labels the parameter group whose partial value of
/// information is reported. Parameters without a label are not part of
/// any EVPPI group.
public final class Parameter {

    /// Owner label for parameters used by more than one strategy.
    public static final String SHARED = "shared";

    @SerializedName("name")
    private final String name;

    @SerializedName("owner")
    private final String owner;

    @SerializedName("distribution")
    private final DistributionModel distribution;

    @SerializedName("correlation_group")
    private final String correlationGroup;

    @SerializedName("jurisdiction")
    private final String jurisdiction;

    @SerializedName("evppi_group")
    private final String evppiGroup;

    public Parameter(String name, String owner, DistributionModel distribution,
                     String correlationGroup, String jurisdiction, String evppiGroup) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("parameter", "parameter name must not be blank");
        }
        if (distribution == null) {
            throw new ValidationException(name, "parameter has no distribution");
        }
        this.name = name;
        this.owner = owner == null || owner.isBlank() ? SHARED : owner;
        this.distribution = distribution;
        this.correlationGroup = blankToNull(correlationGroup);
        this.jurisdiction = blankToNull(jurisdiction);
        this.evppiGroup = blankToNull(evppiGroup);
    }

    /// Creates an independent, shared parameter with no jurisdiction.
    public static Parameter of(String name, DistributionModel distribution) {
        return new Parameter(name, SHARED, distribution, null, null, null);
    }

    /// Creates an independent parameter owned by one strategy.
    public static Parameter owned(String name, String owner, DistributionModel distribution) {
        return new Parameter(name, owner, distribution, null, null, null);
    }

    public Parameter withCorrelationGroup(String group) {
        return new Parameter(name, owner, distribution, group, jurisdiction, evppiGroup);
    }

    public Parameter withEvppiGroup(String group) {
        return new Parameter(name, owner, distribution, correlationGroup, jurisdiction, group);
    }

    public Parameter withJurisdiction(String value) {
        return new Parameter(name, owner, distribution, correlationGroup, value, evppiGroup);
    }

    public String name() {
        return name;
    }

    public String owner() {
        return owner;
    }

    public boolean isShared() {
        return SHARED.equals(owner);
    }

    public DistributionModel distribution() {
        return distribution;
    }

    /// Returns the correlation group, or null when drawn independently.
    public String correlationGroup() {
        return correlationGroup;
    }

    /// Returns the jurisdiction this value applies to, or null for all.
    public String jurisdiction() {
        return jurisdiction;
    }

    /// Returns the EVPPI group label, or null.
    public String evppiGroup() {
        return evppiGroup;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Parameter)) return false;
        Parameter that = (Parameter) o;
        return name.equals(that.name)
            && owner.equals(that.owner)
            && distribution.equals(that.distribution)
            && Objects.equals(correlationGroup, that.correlationGroup)
            && Objects.equals(jurisdiction, that.jurisdiction)
            && Objects.equals(evppiGroup, that.evppiGroup);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, owner, distribution, correlationGroup, jurisdiction, evppiGroup);
    }

    @Override
    public String toString() {
        return name + "(" + owner + ")~" + distribution;
    }
}
