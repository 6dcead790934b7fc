/*
 * Copyright (c) 2026, AnalogWright contributors.
 * All rights reserved.
 *
 * This file is part of AnalogWright.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */
package com.analogwright.check;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Verdict of a {@link CircuitChecker}: valid, or the list of reasons why not.
 */
public class CheckResult {

    private static final CheckResult VALID = new CheckResult(Collections.<String>emptyList());

    private final List<String> violations;

    private CheckResult(List<String> violations) {
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public static CheckResult valid() {
        return VALID;
    }

    public static CheckResult of(List<String> violations) {
        return violations.isEmpty() ? VALID : new CheckResult(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public String toString() {
        return isValid() ? "VALID" : "INVALID " + violations;
    }
}
