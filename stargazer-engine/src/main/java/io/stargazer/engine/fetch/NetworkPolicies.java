/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.fetch;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicy;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicySpec;

import io.stargazer.api.model.Direction;
import io.stargazer.api.model.NativePolicySpec;
import io.stargazer.api.model.PolicyRule;
import io.stargazer.api.selector.MatchExpression;
import io.stargazer.api.selector.MatchOperator;
import io.stargazer.api.selector.Selector;

/**
 * Converts Kubernetes network policies into {@link PolicyRule}s.
 */
public final class NetworkPolicies {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkPolicies.class);

    private NetworkPolicies() {
    }

    public static PolicyRule toRule(NetworkPolicy policy) {
        var name = policy.getMetadata().getName();
        var namespace = GenericResources.namespace(policy);
        NativePolicySpec spec;
        try {
            spec = toSpec(policy.getSpec());
        }
        catch (IllegalArgumentException e) {
            LOGGER.atWarn()
                    .setMessage("NetworkPolicy {}/{} could not be interpreted, falling back to its name: {}")
                    .addArgument(namespace)
                    .addArgument(name)
                    .addArgument(e.getMessage())
                    .log();
            spec = null;
        }
        return PolicyRule.nativePolicy(name, namespace, spec);
    }

    static NativePolicySpec toSpec(NetworkPolicySpec spec) {
        if (spec == null) {
            throw new IllegalArgumentException("policy has no spec");
        }
        int ingressRules = Optional.ofNullable(spec.getIngress()).map(List::size).orElse(0);
        int egressRules = Optional.ofNullable(spec.getEgress()).map(List::size).orElse(0);
        return new NativePolicySpec(selector(spec.getPodSelector()), policyTypes(spec.getPolicyTypes(), egressRules), ingressRules, egressRules);
    }

    /**
     * Kubernetes defaults the policy types to Ingress, plus Egress when egress rules are present.
     */
    private static Set<Direction> policyTypes(List<String> declared, int egressRules) {
        var types = EnumSet.noneOf(Direction.class);
        if (declared == null || declared.isEmpty()) {
            types.add(Direction.INGRESS);
            if (egressRules > 0) {
                types.add(Direction.EGRESS);
            }
            return types;
        }
        for (String type : declared) {
            types.add(Direction.valueOf(type.toUpperCase(Locale.ROOT)));
        }
        return types;
    }

    /**
     * @param labelSelector a Kubernetes label selector, null meaning everything
     * @return the equivalent selector
     * @throws IllegalArgumentException if the selector uses an unknown operator
     */
    public static Selector selector(LabelSelector labelSelector) {
        if (labelSelector == null) {
            return Selector.ALL;
        }
        var expressions = Optional.ofNullable(labelSelector.getMatchExpressions()).orElse(List.of()).stream()
                .map(NetworkPolicies::expression)
                .toList();
        return Selector.compile(labelSelector.getMatchLabels(), expressions);
    }

    private static MatchExpression expression(LabelSelectorRequirement requirement) {
        var operator = MatchOperator.fromKubernetesName(requirement.getOperator());
        return switch (operator) {
            case EXISTS, NOT_EXISTS -> new MatchExpression(requirement.getKey(), operator, null);
            case IN, NOT_IN -> new MatchExpression(requirement.getKey(), operator,
                    Set.copyOf(Optional.ofNullable(requirement.getValues()).orElse(List.of())));
        };
    }
}
