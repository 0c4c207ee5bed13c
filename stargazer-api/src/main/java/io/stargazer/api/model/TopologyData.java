/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A complete, immutable snapshot of the service graph of one namespace (or all of them).
 * The connectivity map is an adjacency map keyed by vertex identity: service keys plus the
 * synthetic gateway keys.
 *
 * @param namespace the namespace filter the topology was computed for, empty for all namespaces
 * @param services services by key
 * @param policies every policy object read, across engines
 * @param connectivity outgoing edges by source key
 * @param ingress ingress routes
 * @param egress egress routes
 * @param infrastructure detected infrastructure
 * @param rbac RBAC bindings
 * @param drift GitOps applications
 * @param summary headline numbers
 * @param warnings soft failures that occurred while reading the cluster
 * @param timestamp when the topology was computed
 */
public record TopologyData(String namespace,
                           Map<String, ServiceNode> services,
                           List<PolicyRule> policies,
                           Map<String, List<ConnectivityEdge>> connectivity,
                           IngressInfo ingress,
                           EgressInfo egress,
                           InfrastructureInfo infrastructure,
                           RbacInfo rbac,
                           List<DriftApplication> drift,
                           TopologySummary summary,
                           List<String> warnings,
                           Instant timestamp) {

    public TopologyData {
        namespace = namespace == null ? "" : namespace;
        services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
        policies = List.copyOf(policies);
        var copy = new LinkedHashMap<String, List<ConnectivityEdge>>();
        connectivity.forEach((key, edges) -> copy.put(key, List.copyOf(edges)));
        connectivity = Collections.unmodifiableMap(copy);
        drift = List.copyOf(drift);
        warnings = List.copyOf(warnings);
    }

    public List<ConnectivityEdge> edgesFrom(String key) {
        return connectivity.getOrDefault(key, List.of());
    }

    public Optional<ConnectivityEdge> edge(String from, String to) {
        return edgesFrom(from).stream().filter(edge -> edge.to().equals(to)).findFirst();
    }

    @JsonIgnore
    public List<ConnectivityEdge> allEdges() {
        return connectivity.values().stream().flatMap(List::stream).toList();
    }

    public List<PolicyRule> policies(PolicyEngine engine) {
        return policies.stream().filter(rule -> rule.engine() == engine).toList();
    }
}
