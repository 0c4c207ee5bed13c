/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.policy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.stargazer.api.model.ConnectivityEdge;
import io.stargazer.api.model.Direction;
import io.stargazer.api.model.MeshType;
import io.stargazer.api.model.PolicyEngine;
import io.stargazer.api.model.PolicyRule;
import io.stargazer.api.model.ServiceNode;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Decides allow/block for edges of the service graph from the native, mesh and eBPF rule sets.
 * <p>The evaluation is a conservative approximation rather than an interpreter of each policy language:</p>
 * <ul>
 *     <li>A native policy declaring a direction with no rules for it denies that direction to the pods it selects:
 *     ingress for the target of an edge, egress for its source.</li>
 *     <li>A native policy whose structure could not be read, and every mesh or eBPF policy, blocks when its name
 *     contains {@code deny} or {@code block}. Such verdicts are flagged as heuristic.</li>
 *     <li>Everything else is allowed.</li>
 * </ul>
 * <p>Policy-as-code (admission) rules never affect connectivity. Every block names the rules responsible.</p>
 */
public class PolicyEvaluator {

    static final String NO_POLICIES = "No policies in namespace %s";
    static final String NO_POLICY_BLOCKING = "No policy blocking";

    /**
     * Evaluates every ordered pair of distinct services within the same namespace.
     * @return outgoing edges by source service key, containing an entry for every service
     */
    public Map<String, List<ConnectivityEdge>> evaluate(Map<String, ServiceNode> services, List<PolicyRule> rules) {
        var edges = new LinkedHashMap<String, List<ConnectivityEdge>>();
        for (ServiceNode source : services.values()) {
            var outgoing = new ArrayList<ConnectivityEdge>();
            for (ServiceNode target : services.values()) {
                if (source != target && source.namespace().equals(target.namespace())) {
                    outgoing.add(evaluate(source, target, rules));
                }
            }
            edges.put(source.key(), outgoing);
        }
        return edges;
    }

    public ConnectivityEdge evaluate(ServiceNode source, ServiceNode target, List<PolicyRule> rules) {
        var verdict = judge(source, target, target.namespace(), rules);
        return verdict.toEdge(source.key(), target.key(), source.hasServiceMesh(), source.meshType(), firstPort(target));
    }

    /**
     * Evaluates a call from a gateway (or any caller outside the graph) to {@code target}.
     */
    public ConnectivityEdge evaluateFrom(String callerKey, ServiceNode target, List<PolicyRule> rules) {
        var verdict = judge(null, target, target.namespace(), rules);
        return verdict.toEdge(callerKey, target.key(), false, MeshType.NONE, firstPort(target));
    }

    /**
     * Evaluates a call from {@code source} to a destination outside the graph.
     */
    public ConnectivityEdge evaluateTo(ServiceNode source, String destinationKey, List<PolicyRule> rules, boolean viaServiceMesh, MeshType meshType,
                                       String allowedReason) {
        var verdict = judge(source, null, source.namespace(), rules);
        if (verdict.blocked()) {
            return verdict.toEdge(source.key(), destinationKey, viaServiceMesh, meshType, null);
        }
        return new ConnectivityEdge(source.key(), destinationKey, true, allowedReason, List.of(), viaServiceMesh, meshType, null, false);
    }

    /**
     * @return the services with their policy coverage flag set: a service is covered when a native
     * policy in its namespace selects its pods.
     */
    public Map<String, ServiceNode> applyCoverage(Map<String, ServiceNode> services, List<PolicyRule> rules) {
        var covered = new LinkedHashMap<String, ServiceNode>();
        services.forEach((key, service) -> covered.put(key, service.withPolicyCoverage(isCovered(service, rules))));
        return covered;
    }

    static boolean isCovered(ServiceNode service, List<PolicyRule> rules) {
        return rules.stream()
                .filter(rule -> rule.engine() == PolicyEngine.NATIVE && rule.namespace().equals(service.namespace()))
                .anyMatch(rule -> rule.nativeSpec() == null || rule.nativeSpec().podSelector().test(service.workloadLabels()));
    }

    private static Verdict judge(@Nullable ServiceNode source, @Nullable ServiceNode target, String namespace, List<PolicyRule> rules) {
        var inScope = rules.stream().filter(rule -> inScope(rule, namespace)).toList();
        if (inScope.isEmpty()) {
            return new Verdict(String.format(NO_POLICIES, namespace));
        }
        var verdict = new Verdict(NO_POLICY_BLOCKING);
        for (PolicyRule rule : inScope) {
            if (rule.engine() == PolicyEngine.NATIVE && rule.nativeSpec() != null) {
                var spec = rule.nativeSpec();
                if (target != null && spec.deniesAll(Direction.INGRESS) && spec.podSelector().test(target.workloadLabels())) {
                    verdict.block(rule.name(), String.format("Blocked by default-deny NetworkPolicy %s (no ingress rules)", rule.name()), false);
                }
                if (source != null && spec.deniesAll(Direction.EGRESS) && spec.podSelector().test(source.workloadLabels())) {
                    verdict.block(rule.name(), String.format("Blocked by default-deny NetworkPolicy %s (no egress rules)", rule.name()), false);
                }
            }
            else if (rule.nameSuggestsBlocking()) {
                verdict.block(rule.name(), String.format("Potentially blocked by %s %s", describe(rule), rule.name()), true);
            }
        }
        return verdict;
    }

    /**
     * Native and mesh rules apply within their namespace; eBPF rules also apply cluster-wide when cluster-scoped.
     */
    private static boolean inScope(PolicyRule rule, String namespace) {
        return switch (rule.engine()) {
            case NATIVE, MESH -> rule.namespace().equals(namespace);
            case EBPF -> rule.appliesToNamespace(namespace);
            case ADMISSION -> false;
        };
    }

    private static String describe(PolicyRule rule) {
        if (!rule.kind().isEmpty()) {
            return rule.kind();
        }
        return switch (rule.engine()) {
            case NATIVE -> "NetworkPolicy";
            case MESH -> "mesh policy";
            case EBPF -> "eBPF policy";
            case ADMISSION -> "admission policy";
        };
    }

    @Nullable
    private static String firstPort(ServiceNode target) {
        if (target.ports().isEmpty()) {
            return null;
        }
        var port = target.ports().get(0);
        int colon = port.indexOf(':');
        return colon < 0 ? port : port.substring(colon + 1);
    }
}
