package io.nosqlbench.cea.model.strategy;

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

import java.util.Objects;
import java.util.Optional;

/// A model input given either as a literal number or as the name of a
/// declared parameter, resolved per iteration.
public final class ValueRef {

    public static final ValueRef ZERO = constant(0.0);

    private final double constant;
    private final String parameterName;

    private ValueRef(double constant, String parameterName) {
        this.constant = constant;
        this.parameterName = parameterName;
    }

    public static ValueRef constant(double value) {
        if (!Double.isFinite(value)) {
            throw new ValidationException("value", "literal must be finite, got " + value);
        }
        return new ValueRef(value, null);
    }

    public static ValueRef parameter(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("value", "parameter reference must not be blank");
        }
        return new ValueRef(Double.NaN, name);
    }

    /// Interprets a configuration value: numbers and numeric strings are
    /// literals, any other string names a parameter.
    public static ValueRef parse(Object raw) {
        if (raw instanceof Number number) {
            return constant(number.doubleValue());
        }
        if (raw instanceof String text) {
            String trimmed = text.trim();
            try {
                return constant(Double.parseDouble(trimmed));
            } catch (NumberFormatException notANumber) {
                return parameter(trimmed);
            }
        }
        throw new ValidationException(String.valueOf(raw), "expected a number or a parameter name");
    }

    public double resolve(SampledParameters parameters) {
        return parameterName == null ? constant : parameters.get(parameterName);
    }

    /// Returns the referenced parameter name, if this is a reference.
    public Optional<String> parameterName() {
        return Optional.ofNullable(parameterName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValueRef)) return false;
        ValueRef that = (ValueRef) o;
        return Objects.equals(parameterName, that.parameterName)
            && (parameterName != null || Double.compare(constant, that.constant) == 0);
    }

    @Override
    public int hashCode() {
        return parameterName != null ? parameterName.hashCode() : Double.hashCode(constant);
    }

    @Override
    public String toString() {
        return parameterName != null ? "$" + parameterName : Double.toString(constant);
    }
}
