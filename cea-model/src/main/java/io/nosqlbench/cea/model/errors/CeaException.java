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

/// Base type for all failures raised by the cost-effectiveness engine.
///
/// Every failure names the subject it concerns (a parameter name, a
/// strategy id, an iteration index, or a configuration key) so that the
/// offending input can be located without reading a stack trace.
public class CeaException extends RuntimeException {

    private final String subject;

    public CeaException(String subject, String message) {
        super(format(subject, message));
        this.subject = subject;
    }

    public CeaException(String subject, String message, Throwable cause) {
        super(format(subject, message), cause);
        this.subject = subject;
    }

    /// Returns the identifier of the parameter, strategy, iteration or
    /// configuration key this failure concerns.
    public String subject() {
        return subject;
    }

    private static String format(String subject, String message) {
        return subject == null ? message : "[" + subject + "] " + message;
    }
}
