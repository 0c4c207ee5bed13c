/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.policy;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.stargazer.api.model.ConnectivityEdge;
import io.stargazer.api.model.MeshType;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Accumulates the rules blocking one edge while the evaluator walks the rule set.
 */
final class Verdict {

    private final String defaultReason;
    private final Set<String> blockingPolicies = new LinkedHashSet<>();
    private final List<String> reasons = new ArrayList<>();
    private boolean heuristic;

    Verdict(String defaultReason) {
        this.defaultReason = defaultReason;
    }

    void block(String policy, String reason, boolean byHeuristic) {
        if (blockingPolicies.add(policy)) {
            reasons.add(reason);
        }
        heuristic |= byHeuristic;
    }

    boolean blocked() {
        return !blockingPolicies.isEmpty();
    }

    ConnectivityEdge toEdge(String from, String to, boolean viaServiceMesh, MeshType meshType, @Nullable String port) {
        return new ConnectivityEdge(from,
                to,
                !blocked(),
                blocked() ? String.join("; ", reasons) : defaultReason,
                List.copyOf(blockingPolicies),
                viaServiceMesh,
                meshType,
                port,
                heuristic);
    }
}
