/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressPathBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressRuleBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressTLSBuilder;

import io.stargazer.api.model.Direction;
import io.stargazer.api.model.InfrastructureInfo;
import io.stargazer.api.model.MeshType;
import io.stargazer.api.model.NativePolicySpec;
import io.stargazer.api.model.PodSecurityTier;
import io.stargazer.api.model.PolicyRule;
import io.stargazer.api.model.RbacInfo;
import io.stargazer.api.model.ServiceNode;
import io.stargazer.api.model.TopologyData;
import io.stargazer.api.selector.Selector;
import io.stargazer.engine.gateway.GatewayResolver;
import io.stargazer.engine.policy.PolicyEvaluator;

/**
 * Builders for the cluster objects and graph nodes used across tests.
 */
public final class TestTopologies {

    private TestTopologies() {
    }

    public static Service service(String namespace, String name) {
        return new ServiceBuilder()
                .withNewMetadata().withName(name).withNamespace(namespace).endMetadata()
                .withNewSpec()
                .withType("ClusterIP")
                .addToSelector("app", name)
                .addNewPort().withName("http").withPort(8080).withProtocol("TCP").endPort()
                .endSpec()
                .build();
    }

    public static Pod pod(String namespace, String name, String app) {
        return new PodBuilder()
                .withNewMetadata().withName(name).withNamespace(namespace).addToLabels("app", app).endMetadata()
                .withNewSpec().addNewContainer().withName("main").withImage(app + ":latest").endContainer().endSpec()
                .withNewStatus().withPhase("Running").endStatus()
                .build();
    }

    public static ServiceNode node(String namespace, String name) {
        return node(namespace, name, MeshType.NONE);
    }

    public static ServiceNode node(String namespace, String name, MeshType meshType) {
        return new ServiceNode(name, namespace, "ClusterIP", "10.0.0.1", List.of("http:8080/TCP"), Map.of(), Map.of("app", name),
                List.of(name + "-0"), 1, name, meshType, false, PodSecurityTier.BASELINE, "Unknown", false, null);
    }

    /**
     * A native policy with structured rules.
     * @param podSelector the {@code app} label the policy selects, null selecting every pod
     */
    public static PolicyRule nativePolicy(String namespace, String name, String podSelector, Set<Direction> types, int ingressRules, int egressRules) {
        var selector = podSelector == null ? Selector.ALL : Selector.compile(Map.of("app", podSelector), null);
        return PolicyRule.nativePolicy(name, namespace, new NativePolicySpec(selector, types, ingressRules, egressRules));
    }

    public static PolicyRule defaultDenyIngress(String namespace) {
        return nativePolicy(namespace, "default-deny", null, Set.of(Direction.INGRESS), 0, 0);
    }

    public static Map<String, ServiceNode> services(ServiceNode... nodes) {
        var map = new LinkedHashMap<String, ServiceNode>();
        for (ServiceNode n : nodes) {
            map.put(n.key(), n);
        }
        return map;
    }

    /**
     * An ingress in {@code namespace} routing {@code host/} to {@code backend}.
     */
    public static Ingress ingress(String namespace, String name, String host, String backend, boolean tls) {
        var builder = new IngressBuilder()
                .withNewMetadata().withName(name).withNamespace(namespace).endMetadata()
                .withNewSpec()
                .withIngressClassName("nginx")
                .withRules(new IngressRuleBuilder()
                        .withHost(host)
                        .withNewHttp()
                        .withPaths(new HTTPIngressPathBuilder()
                                .withPath("/")
                                .withPathType("Prefix")
                                .withNewBackend().withNewService().withName(backend).withNewPort().withNumber(8080).endPort().endService().endBackend()
                                .build())
                        .endHttp()
                        .build())
                .endSpec();
        if (tls) {
            builder.editSpec().withTls(new IngressTLSBuilder().withHosts(host).withSecretName(name + "-tls").build()).endSpec();
        }
        return builder.build();
    }

    /**
     * Computes a topology the way the engine does, from nodes and rules already in hand.
     */
    public static TopologyData topology(String namespace, Map<String, ServiceNode> nodes, List<PolicyRule> rules, List<Ingress> ingresses,
                                        InfrastructureInfo infrastructure) {
        var evaluator = new PolicyEvaluator();
        var resolver = new GatewayResolver(evaluator);
        var covered = evaluator.applyCoverage(nodes, rules);
        var ingress = resolver.resolveIngress(covered, rules, ingresses, List.of(), List.of());
        var egress = resolver.resolveEgress(covered, rules, List.of(), List.of());
        var connectivity = TopologyEngine.assemble(evaluator.evaluate(covered, rules), ingress, egress);
        return new TopologyData(namespace, covered, rules, connectivity, ingress, egress, infrastructure, RbacInfo.empty(), List.of(),
                TopologyEngine.summarize(covered, connectivity), List.of(), Instant.EPOCH);
    }
}
