/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.topology;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodStatus;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.ServiceSpec;

import io.stargazer.api.model.DriftApplication;
import io.stargazer.api.model.InfrastructureInfo;
import io.stargazer.api.model.ServiceKeys;
import io.stargazer.api.model.ServiceNode;
import io.stargazer.api.selector.Selector;
import io.stargazer.engine.fetch.GenericResources;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Combines services, pods and detected infrastructure into the nodes of the service graph.
 * <p>Pods are indexed by namespace before selector matching, so each service only scans the pods of
 * its own namespace. A service without a selector has no backing pods.</p>
 */
public class TopologyBuilder {

    static final String RUNNING = "Running";
    static final String APP_LABEL = "app";
    static final String UNKNOWN_DRIFT = "Unknown";

    private final CostEstimator costEstimator;

    public TopologyBuilder(CostEstimator costEstimator) {
        this.costEstimator = costEstimator;
    }

    /**
     * @param services services to turn into nodes
     * @param pods candidate backing pods
     * @param infrastructure detected infrastructure, deciding which mesh signals count
     * @param drift GitOps applications used to annotate services
     * @param requestRates request rates by service key, or null when metrics were unavailable
     * @return nodes by service key, in key order
     */
    public Map<String, ServiceNode> build(List<Service> services,
                                          List<Pod> pods,
                                          InfrastructureInfo infrastructure,
                                          List<DriftApplication> drift,
                                          @Nullable Map<String, Double> requestRates) {
        var podsByNamespace = indexByNamespace(pods);
        var nodes = new TreeMap<String, ServiceNode>();
        for (Service service : services) {
            var node = buildNode(service, podsByNamespace, infrastructure, drift, requestRates);
            nodes.put(node.key(), node);
        }
        return new LinkedHashMap<>(nodes);
    }

    static Map<String, List<Pod>> indexByNamespace(List<Pod> pods) {
        var index = new HashMap<String, List<Pod>>();
        for (Pod pod : pods) {
            index.computeIfAbsent(GenericResources.namespace(pod), ns -> new ArrayList<>()).add(pod);
        }
        return index;
    }

    private ServiceNode buildNode(Service service,
                                  Map<String, List<Pod>> podsByNamespace,
                                  InfrastructureInfo infrastructure,
                                  List<DriftApplication> drift,
                                  @Nullable Map<String, Double> requestRates) {
        var name = service.getMetadata().getName();
        var namespace = GenericResources.namespace(service);
        var spec = Optional.ofNullable(service.getSpec()).orElseGet(ServiceSpec::new);
        var selector = Optional.ofNullable(spec.getSelector()).orElse(Map.of());
        var matching = matchingPods(selector, podsByNamespace.getOrDefault(namespace, List.of()));
        var healthy = (int) matching.stream()
                .filter(pod -> RUNNING.equals(Optional.ofNullable(pod.getStatus()).map(PodStatus::getPhase).orElse("")))
                .count();
        var deployment = matching.stream()
                .map(pod -> GenericResources.labels(pod).get(APP_LABEL))
                .filter(app -> app != null && !app.isEmpty())
                .findFirst()
                .orElse(null);
        var key = ServiceKeys.of(namespace, name);
        var costSignal = requestRates != null && requestRates.containsKey(key)
                ? costEstimator.estimate(requestRates.get(key), matching)
                : null;
        return new ServiceNode(name,
                namespace,
                spec.getType(),
                spec.getClusterIP(),
                ports(spec.getPorts()),
                GenericResources.labels(service),
                selector,
                matching.stream().map(pod -> pod.getMetadata().getName()).toList(),
                healthy,
                deployment,
                MeshMembership.meshOf(matching, infrastructure),
                matching.stream().anyMatch(pod -> MeshMembership.hasCiliumProxy(pod, infrastructure)),
                PodSecurityClassifier.classify(matching),
                driftStatus(name, namespace, drift),
                false,
                costSignal);
    }

    private static List<Pod> matchingPods(Map<String, String> selector, List<Pod> candidates) {
        if (selector.isEmpty()) {
            return List.of();
        }
        var compiled = Selector.compile(selector, null);
        return candidates.stream()
                .filter(pod -> compiled.test(GenericResources.labels(pod)))
                .toList();
    }

    static List<String> ports(@Nullable List<ServicePort> ports) {
        return Optional.ofNullable(ports).orElse(List.of()).stream()
                .map(TopologyBuilder::port)
                .toList();
    }

    private static String port(ServicePort port) {
        var protocol = Optional.ofNullable(port.getProtocol()).orElse("TCP");
        var number = port.getPort() + "/" + protocol;
        return port.getName() == null || port.getName().isEmpty() ? number : port.getName() + ":" + number;
    }

    /**
     * The sync status of the application whose name contains the service's name,
     * else of the first application in the service's namespace whose name contains {@code app}.
     */
    static String driftStatus(String name, String namespace, List<DriftApplication> drift) {
        var lowerName = name.toLowerCase(Locale.ROOT);
        return drift.stream()
                .filter(app -> app.name().toLowerCase(Locale.ROOT).contains(lowerName))
                .findFirst()
                .or(() -> drift.stream()
                        .filter(app -> app.namespace().equals(namespace) && app.name().toLowerCase(Locale.ROOT).contains(APP_LABEL))
                        .findFirst())
                .map(DriftApplication::syncStatus)
                .orElse(UNKNOWN_DRIFT);
    }
}
