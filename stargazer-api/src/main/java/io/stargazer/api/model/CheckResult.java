/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.List;

/**
 * The outcome of one best-practice check.
 */
public record CheckResult(String id,
                          String name,
                          boolean passed,
                          List<Recommendation> findings) {

    public CheckResult {
        findings = List.copyOf(findings);
    }

    public static CheckResult pass(String id, String name) {
        return new CheckResult(id, name, true, List.of());
    }
}
