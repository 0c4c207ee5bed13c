/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.recommend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceBuilder;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressPathBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressRuleValueBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBackendBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressRuleBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressServiceBackendBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressTLSBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyEgressRule;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyEgressRuleBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyIngressRuleBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyPeerBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyPort;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyPortBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.ServiceBackendPortBuilder;

import io.stargazer.api.model.GatewayObject;
import io.stargazer.api.model.ServiceNode;

/**
 * Remediation manifests, built with the fabric8 model builders and rendered as YAML.
 */
final class PolicyTemplates {

    static final String NAMESPACE_PLACEHOLDER = "<namespace>";
    static final String APP_PLACEHOLDER = "<app-name>";
    static final String NAMESPACE_NAME_LABEL = "kubernetes.io/metadata.name";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES))
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private PolicyTemplates() {
    }

    /**
     * A NetworkPolicy selecting the service's pods, allowing ingress from its own namespace
     * (and from the ingress controller when it backs an ingress route) and egress to DNS and its own namespace.
     */
    static String networkPolicy(ServiceNode service, boolean ingressBackend) {
        var ingress = new NetworkPolicyIngressRuleBuilder()
                .withFrom(new NetworkPolicyPeerBuilder().withNewPodSelector().endPodSelector().build());
        var ingressRules = new ArrayList<>(List.of(ingress.build()));
        if (ingressBackend) {
            ingressRules.add(new NetworkPolicyIngressRuleBuilder()
                    .withFrom(new NetworkPolicyPeerBuilder()
                            .withNewNamespaceSelector().addToMatchLabels(NAMESPACE_NAME_LABEL, "ingress-nginx").endNamespaceSelector()
                            .build())
                    .withPorts(tcp(80), tcp(443))
                    .build());
        }
        // @formatter:off
        var policy = new NetworkPolicyBuilder()
                .withNewMetadata()
                    .withName(service.name() + "-network-policy")
                    .withNamespace(service.namespace())
                .endMetadata()
                .withNewSpec()
                    .withNewPodSelector()
                        .withMatchLabels(podLabels(service))
                    .endPodSelector()
                    .withPolicyTypes("Ingress", "Egress")
                    .withIngress(ingressRules)
                    .withEgress(dnsEgress(), new NetworkPolicyEgressRuleBuilder()
                            .withTo(new NetworkPolicyPeerBuilder()
                                    .withNewNamespaceSelector().addToMatchLabels(NAMESPACE_NAME_LABEL, service.namespace()).endNamespaceSelector()
                                    .build())
                            .build())
                .endSpec()
                .build();
        // @formatter:on
        return render(policy);
    }

    static String ciliumNetworkPolicy(ServiceNode service) {
        var spec = map(
                "endpointSelector", map("matchLabels", podLabels(service)),
                "ingress", List.of(map("fromEndpoints", List.of(map("matchLabels", map(NAMESPACE_NAME_LABEL, service.namespace()))))),
                "egress", List.of(
                        map("toEndpoints", List.of(map("matchLabels", map("k8s-app", "kube-dns"))),
                                "toPorts", List.of(map("ports", List.of(map("port", "53", "protocol", "UDP"), map("port", "53", "protocol", "TCP"))))),
                        map("toEndpoints", List.of(map("matchLabels", map(NAMESPACE_NAME_LABEL, service.namespace()))))));
        return render(custom("cilium.io/v2", "CiliumNetworkPolicy", service.name() + "-cnp", service.namespace(), spec));
    }

    /**
     * Allows one blocked connection, written as an ingress rule on the target's pods.
     */
    static String allowConnection(ServiceNode source, String targetNamespace, String targetName, List<String> ports, boolean cilium) {
        var name = "allow-" + source.name() + "-to-" + targetName;
        if (cilium) {
            var from = map("matchLabels", map("app", source.name(), "k8s:io.kubernetes.pod.namespace", source.namespace()));
            var rule = map("fromEndpoints", List.of(from));
            if (!ports.isEmpty()) {
                rule.put("toPorts", List.of(map("ports", ports.stream().map(p -> map("port", p, "protocol", "TCP")).toList())));
            }
            var spec = map("endpointSelector", map("matchLabels", map("app", targetName)), "ingress", List.of(rule));
            return render(custom("cilium.io/v2", "CiliumNetworkPolicy", name, targetNamespace, spec));
        }
        var peer = new NetworkPolicyPeerBuilder().withNewPodSelector().addToMatchLabels("app", source.name()).endPodSelector();
        if (!targetNamespace.equals(source.namespace())) {
            peer.withNewNamespaceSelector().addToMatchLabels(NAMESPACE_NAME_LABEL, source.namespace()).endNamespaceSelector();
        }
        // @formatter:off
        var policy = new NetworkPolicyBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(targetNamespace)
                .endMetadata()
                .withNewSpec()
                    .withNewPodSelector()
                        .addToMatchLabels("app", targetName)
                    .endPodSelector()
                    .withPolicyTypes("Ingress")
                    .withIngress(new NetworkPolicyIngressRuleBuilder()
                            .withFrom(peer.build())
                            .withPorts(ports.stream().map(PolicyTemplates::tcp).toList())
                            .build())
                .endSpec()
                .build();
        // @formatter:on
        return render(policy);
    }

    static String tlsIngress(GatewayObject ingress, String backend, boolean certManager) {
        var hosts = ingress.hosts().stream().filter(h -> !"*".equals(h)).toList();
        if (hosts.isEmpty()) {
            hosts = List.of("example.com");
        }
        // @formatter:off
        var builder = new IngressBuilder()
                .withNewMetadata()
                    .withName(ingress.name())
                    .withNamespace(ingress.namespace())
                .endMetadata()
                .withNewSpec()
                    .withTls(new IngressTLSBuilder()
                            .withHosts(hosts)
                            .withSecretName(ingress.name() + "-tls")
                            .build())
                    .withRules(new IngressRuleBuilder()
                            .withHost(hosts.get(0))
                            .withHttp(new HTTPIngressRuleValueBuilder()
                                    .withPaths(new HTTPIngressPathBuilder()
                                            .withPath("/")
                                            .withPathType("Prefix")
                                            .withBackend(new IngressBackendBuilder()
                                                    .withService(new IngressServiceBackendBuilder()
                                                            .withName(backend)
                                                            .withPort(new ServiceBackendPortBuilder().withNumber(80).build())
                                                            .build())
                                                    .build())
                                            .build())
                                    .build())
                            .build())
                .endSpec();
        // @formatter:on
        if (certManager) {
            builder.editMetadata().addToAnnotations("cert-manager.io/cluster-issuer", "letsencrypt-prod").endMetadata();
        }
        return render(builder.build());
    }

    static String strictPeerAuthentication() {
        return render(custom("security.istio.io/v1beta1", "PeerAuthentication", "default", "istio-system",
                map("mtls", map("mode", "STRICT"))));
    }

    static String namespaceAuthorizationPolicy() {
        var spec = map("action", "ALLOW",
                "rules", List.of(
                        map("from", List.of(map("source", map("namespaces", List.of(NAMESPACE_PLACEHOLDER))))),
                        map("from", List.of(map("source", map("principals",
                                List.of("cluster.local/ns/istio-system/sa/istio-ingressgateway-service-account")))))));
        return render(custom("security.istio.io/v1beta1", "AuthorizationPolicy", "allow-namespace-communication", NAMESPACE_PLACEHOLDER, spec));
    }

    static String egressServiceEntry() {
        var spec = map("hosts", List.of("api.example.com"),
                "ports", List.of(map("number", 443, "name", "https", "protocol", "HTTPS")),
                "resolution", "DNS",
                "location", "MESH_EXTERNAL");
        return render(custom("networking.istio.io/v1beta1", "ServiceEntry", "external-api", NAMESPACE_PLACEHOLDER, spec));
    }

    static String ciliumL7Policy() {
        var spec = map(
                "endpointSelector", map("matchLabels", map("app", APP_PLACEHOLDER)),
                "ingress", List.of(map(
                        "fromEndpoints", List.of(map("matchLabels", map("app", "frontend"))),
                        "toPorts", List.of(map(
                                "ports", List.of(map("port", "8080", "protocol", "TCP")),
                                "rules", map("http", List.of(map("method", "GET", "path", "/api/v1/*"))))))),
                "egress", List.of(map(
                        "toFQDNs", List.of(map("matchName", "api.example.com")),
                        "toPorts", List.of(map("ports", List.of(map("port", "443", "protocol", "TCP")))))));
        return render(custom("cilium.io/v2", "CiliumNetworkPolicy", "example-l7-policy", NAMESPACE_PLACEHOLDER, spec));
    }

    static String requireNetworkPolicyClusterPolicy() {
        var spec = map("validationFailureAction", "Audit",
                "background", true,
                "rules", List.of(map(
                        "name", "check-network-policy",
                        "match", map("any", List.of(map("resources", map("kinds", List.of("Namespace"))))),
                        "validate", map("message", "Namespace must have at least one NetworkPolicy",
                                "deny", map("conditions", List.of(map("key", "{{count(NetworkPolicy)}}", "operator", "LessThan", "value", 1)))))));
        return render(custom("kyverno.io/v1", "ClusterPolicy", "require-network-policy", null, spec));
    }

    static String sidecarInjectionNamespace(String namespace) {
        return render(new NamespaceBuilder()
                .withNewMetadata().withName(namespace).addToLabels("istio-injection", "enabled").endMetadata()
                .build());
    }

    private static Map<String, String> podLabels(ServiceNode service) {
        return service.selector().isEmpty() ? Map.of("app", service.name()) : service.selector();
    }

    private static NetworkPolicyEgressRule dnsEgress() {
        return new NetworkPolicyEgressRuleBuilder()
                .withTo(new NetworkPolicyPeerBuilder()
                        .withNewNamespaceSelector().addToMatchLabels(NAMESPACE_NAME_LABEL, "kube-system").endNamespaceSelector()
                        .withNewPodSelector().addToMatchLabels("k8s-app", "kube-dns").endPodSelector()
                        .build())
                .withPorts(new NetworkPolicyPortBuilder().withProtocol("UDP").withPort(new IntOrString(53)).build(), tcp(53))
                .build();
    }

    private static NetworkPolicyPort tcp(int port) {
        return new NetworkPolicyPortBuilder().withProtocol("TCP").withPort(new IntOrString(port)).build();
    }

    private static NetworkPolicyPort tcp(String port) {
        IntOrString value = port.chars().allMatch(Character::isDigit) ? new IntOrString(Integer.parseInt(port)) : new IntOrString(port);
        return new NetworkPolicyPortBuilder().withProtocol("TCP").withPort(value).build();
    }

    private static GenericKubernetesResource custom(String apiVersion, String kind, String name, String namespace, Map<String, Object> spec) {
        // @formatter:off
        return new GenericKubernetesResourceBuilder()
                .withApiVersion(apiVersion)
                .withKind(kind)
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                .endMetadata()
                .addToAdditionalProperties("spec", spec)
                .build();
        // @formatter:on
    }

    /**
     * An insertion ordered map from alternating keys and values, so rendered manifests are stable.
     */
    static Map<String, Object> map(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected key value pairs, got " + Arrays.toString(keysAndValues));
        }
        var result = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            result.put(keysAndValues[i].toString(), keysAndValues[i + 1]);
        }
        return result;
    }

    static String render(Object manifest) {
        try {
            return YAML.writeValueAsString(manifest);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Couldn't render manifest", e);
        }
    }
}
