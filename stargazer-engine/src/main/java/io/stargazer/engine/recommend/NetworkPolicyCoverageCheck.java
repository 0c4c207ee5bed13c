/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.recommend;

import java.util.ArrayList;
import java.util.Set;

import io.stargazer.api.model.Category;
import io.stargazer.api.model.CheckResult;
import io.stargazer.api.model.ConnectivityEdge;
import io.stargazer.api.model.Fix;
import io.stargazer.api.model.PolicyEngine;
import io.stargazer.api.model.Recommendation;
import io.stargazer.api.model.RouteKind;
import io.stargazer.api.model.ServiceNode;
import io.stargazer.api.model.Severity;
import io.stargazer.api.model.TopologyData;

/**
 * Every service outside the system namespaces should be covered by a NetworkPolicy in its namespace,
 * or by a Cilium policy when Cilium is the CNI.
 */
class NetworkPolicyCoverageCheck extends AbstractBestPractice {

    static final Set<String> SYSTEM_NAMESPACES = Set.of("kube-system", "kube-public", "kube-node-lease", "istio-system");

    NetworkPolicyCoverageCheck() {
        super("np-001", "Services Should Have Network Policies", Category.SECURITY, Severity.HIGH);
    }

    @Override
    public CheckResult check(TopologyData topology) {
        var cilium = topology.infrastructure().ciliumEnabled();
        var findings = new ArrayList<Recommendation>();
        for (ServiceNode service : topology.services().values()) {
            if (isSystemNamespace(service.namespace()) || hasNativePolicy(topology, service) || (cilium && hasCiliumPolicy(topology, service))) {
                continue;
            }
            var fixType = cilium ? "CiliumNetworkPolicy" : "NetworkPolicy";
            var template = cilium ? PolicyTemplates.ciliumNetworkPolicy(service) : PolicyTemplates.networkPolicy(service, isIngressBackend(topology, service));
            var edges = topology.edgesFrom(service.key());
            var allowed = edges.stream().filter(ConnectivityEdge::allowed).count();
            var description = new StringBuilder("Service %s/%s has no %s".formatted(service.namespace(), service.name(), fixType));
            if (edges.isEmpty()) {
                description.append(". Consider adding one for defense in depth.");
            }
            else {
                description.append(". This service has %d connections (%d allowed) that should be protected by policy.".formatted(edges.size(), allowed));
            }
            if (topology.infrastructure().istioEnabled()) {
                description.append(" This works alongside Istio AuthorizationPolicies for defense in depth.");
            }
            findings.add(finding(id() + "-" + service.key(),
                    "Service %s/%s lacks network policy".formatted(service.namespace(), service.name()),
                    description.toString(),
                    service.key(),
                    service.namespace(),
                    Fix.ofTemplate(template),
                    "Protects %d active connections and adds defense in depth".formatted(allowed)));
        }
        return result(findings);
    }

    static boolean isSystemNamespace(String namespace) {
        return SYSTEM_NAMESPACES.contains(namespace) || namespace.startsWith("kube-") || namespace.startsWith("istio-");
    }

    private static boolean hasNativePolicy(TopologyData topology, ServiceNode service) {
        return topology.policies(PolicyEngine.NATIVE).stream().anyMatch(rule -> rule.namespace().equals(service.namespace()));
    }

    private static boolean hasCiliumPolicy(TopologyData topology, ServiceNode service) {
        return topology.policies(PolicyEngine.EBPF).stream().anyMatch(rule -> rule.appliesToNamespace(service.namespace()));
    }

    private static boolean isIngressBackend(TopologyData topology, ServiceNode service) {
        return topology.ingress().gateway().routes().stream()
                .anyMatch(route -> route.kind() == RouteKind.KUBERNETES_INGRESS && route.target().equals(service.key()));
    }
}
