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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the serialization type name for a {@link DistributionModel} variant.
 *
 * <p>The name appears as the {@code "type"} field of serialized JSON and as
 * the {@code distribution} column of the parameter table:
 *
 * <pre>{@code
 * {
 *   "type": "beta",
 *   "alpha": 30.0,
 *   "beta": 70.0
 * }
 * }</pre>
 *
 * @see DistributionTypeAdapterFactory
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface DistributionType {
    /**
     * The lowercase type name, unique across all distribution variants.
     *
     * @return the type name
     */
    String value();
}
