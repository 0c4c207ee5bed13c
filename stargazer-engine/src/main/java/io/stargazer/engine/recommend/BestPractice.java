/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.recommend;

import io.stargazer.api.model.Category;
import io.stargazer.api.model.CheckResult;
import io.stargazer.api.model.Severity;
import io.stargazer.api.model.TopologyData;

/**
 * One networking best practice, evaluated against a finished topology.
 * Implementations must be pure: the same topology always yields the same result.
 */
public interface BestPractice {

    String id();

    String name();

    Category category();

    Severity severity();

    /**
     * Evaluates this practice.
     * @param topology topology to evaluate
     * @return whether it passed, with the findings that explain a failure
     */
    CheckResult check(TopologyData topology);
}
