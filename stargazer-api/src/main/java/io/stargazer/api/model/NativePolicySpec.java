/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.Objects;
import java.util.Set;

import io.stargazer.api.selector.Selector;

/**
 * The parts of a Kubernetes {@code NetworkPolicy} the evaluator uses.
 * @param podSelector which pods in the policy's namespace the policy applies to
 * @param policyTypes the declared policy types
 * @param ingressRuleCount number of entries under {@code spec.ingress}
 * @param egressRuleCount number of entries under {@code spec.egress}
 */
public record NativePolicySpec(Selector podSelector,
                               Set<Direction> policyTypes,
                               int ingressRuleCount,
                               int egressRuleCount) {

    public NativePolicySpec {
        Objects.requireNonNull(podSelector);
        policyTypes = Set.copyOf(policyTypes);
    }

    /**
     * @return true if this policy declares {@code direction} but allows nothing in it.
     */
    public boolean deniesAll(Direction direction) {
        if (!policyTypes.contains(direction)) {
            return false;
        }
        return (direction == Direction.INGRESS ? ingressRuleCount : egressRuleCount) == 0;
    }
}
