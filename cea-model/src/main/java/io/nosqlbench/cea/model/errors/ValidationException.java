package io.nosqlbench.cea.model.errors;

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

/// Malformed or out-of-domain configuration, detected before any
/// simulation work starts. Always fatal to the run.
public class ValidationException extends CeaException {

    public ValidationException(String subject, String message) {
        super(subject, message);
    }

    public ValidationException(String subject, String message, Throwable cause) {
        super(subject, message, cause);
    }
}
