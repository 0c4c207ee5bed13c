/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every check's outcome, from which both the recommendations and the score derive.
 */
public record ComplianceReport(List<CheckResult> checks) {

    public ComplianceReport {
        checks = List.copyOf(checks);
    }

    public int passed() {
        return (int) checks.stream().filter(CheckResult::passed).count();
    }

    public int total() {
        return checks.size();
    }

    /**
     * @return {@code 100 * passed / total} rounded down, 100 when there are no checks
     */
    public int score() {
        return total() == 0 ? 100 : passed() * 100 / total();
    }

    public List<Recommendation> recommendations() {
        return checks.stream().flatMap(check -> check.findings().stream()).toList();
    }

    public Map<String, Object> details() {
        var checkDetails = new LinkedHashMap<String, Boolean>();
        checks.forEach(check -> checkDetails.put(check.id(), check.passed()));
        var details = new LinkedHashMap<String, Object>();
        details.put("score", score());
        details.put("passed", passed());
        details.put("total", total());
        details.put("check_details", checkDetails);
        details.put("recommendations_count", recommendations().size());
        return details;
    }
}
