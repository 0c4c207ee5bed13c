/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A service in the connectivity graph together with what was learned about its backing pods.
 * Instances are immutable; the policy coverage flag is set by producing a copy with {@link #withPolicyCoverage(boolean)}.
 *
 * @param name service name
 * @param namespace service namespace, empty when namespace-less
 * @param type service type, e.g. {@code ClusterIP}
 * @param clusterIp cluster IP, may be empty
 * @param ports rendered ports, {@code name:port/PROTOCOL} or {@code port/PROTOCOL}
 * @param labels the service's own labels
 * @param selector the service's pod selector
 * @param pods names of the matching pods
 * @param healthyPods number of matching pods in phase {@code Running}
 * @param deployment value of the {@code app} label of the first matching pod
 * @param meshType the mesh the service's pods are enrolled in
 * @param ciliumProxy whether a Cilium L7 proxy policy is attached to the pods
 * @param podSecurity pod security tier of the backing pods
 * @param driftStatus GitOps sync status, {@code Unknown} when no application manages the service
 * @param hasPolicy whether a native policy in the namespace selects the service's pods
 * @param costSignal traffic/cost signal, absent when metrics were unavailable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceNode(String name,
                          String namespace,
                          String type,
                          String clusterIp,
                          List<String> ports,
                          Map<String, String> labels,
                          Map<String, String> selector,
                          List<String> pods,
                          int healthyPods,
                          @Nullable String deployment,
                          MeshType meshType,
                          boolean ciliumProxy,
                          PodSecurityTier podSecurity,
                          String driftStatus,
                          boolean hasPolicy,
                          @Nullable CostSignal costSignal) {

    public ServiceNode {
        Objects.requireNonNull(name);
        namespace = namespace == null ? "" : namespace;
        type = type == null ? "" : type;
        clusterIp = clusterIp == null ? "" : clusterIp;
        ports = ports == null ? List.of() : List.copyOf(ports);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        selector = selector == null ? Map.of() : Map.copyOf(selector);
        pods = pods == null ? List.of() : List.copyOf(pods);
        meshType = meshType == null ? MeshType.NONE : meshType;
        podSecurity = podSecurity == null ? PodSecurityTier.BASELINE : podSecurity;
        driftStatus = driftStatus == null ? "Unknown" : driftStatus;
    }

    @JsonIgnore
    public String key() {
        return ServiceKeys.of(namespace, name);
    }

    public int podCount() {
        return pods.size();
    }

    public boolean hasServiceMesh() {
        return meshType != MeshType.NONE;
    }

    /**
     * The labels a network policy's pod selector is matched against: the service's selector,
     * which every backing pod carries, overlaid on the service's own labels.
     */
    @JsonIgnore
    public Map<String, String> workloadLabels() {
        if (selector.isEmpty()) {
            return labels;
        }
        var merged = new HashMap<>(labels);
        merged.putAll(selector);
        return merged;
    }

    public ServiceNode withPolicyCoverage(boolean covered) {
        if (covered == hasPolicy) {
            return this;
        }
        return new ServiceNode(name, namespace, type, clusterIp, ports, labels, selector, pods, healthyPods, deployment,
                meshType, ciliumProxy, podSecurity, driftStatus, covered, costSignal);
    }
}
