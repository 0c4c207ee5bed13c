/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.gateway;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressPath;
import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressRuleValue;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBackend;
import io.fabric8.kubernetes.api.model.networking.v1.IngressRule;
import io.fabric8.kubernetes.api.model.networking.v1.IngressServiceBackend;
import io.fabric8.kubernetes.api.model.networking.v1.IngressSpec;
import io.fabric8.kubernetes.api.model.networking.v1.ServiceBackendPort;

import io.stargazer.api.model.ConnectivityEdge;
import io.stargazer.api.model.EgressInfo;
import io.stargazer.api.model.ExternalService;
import io.stargazer.api.model.GatewayNode;
import io.stargazer.api.model.GatewayObject;
import io.stargazer.api.model.GatewayRoute;
import io.stargazer.api.model.IngressInfo;
import io.stargazer.api.model.MeshType;
import io.stargazer.api.model.PolicyRule;
import io.stargazer.api.model.RouteKind;
import io.stargazer.api.model.ServiceKeys;
import io.stargazer.api.model.ServiceNode;
import io.stargazer.engine.fetch.GenericResources;
import io.stargazer.engine.policy.PolicyEvaluator;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Extends the service graph with the synthetic ingress and egress gateway vertices.
 * <p>Ingress routes come from Kubernetes {@code Ingress} objects and from Istio {@code VirtualService}s bound to a gateway.
 * Each route's verdict is computed by the {@link PolicyEvaluator} with the ingress gateway as the caller.</p>
 * <p>Every service gets one egress edge. It goes through the mesh egress gateway when one is deployed and is
 * direct otherwise.</p>
 */
public class GatewayResolver {

    static final String INGRESS_CLASS_ANNOTATION = "kubernetes.io/ingress.class";
    static final String MESH_GATEWAY = "mesh";

    private final PolicyEvaluator evaluator;

    public GatewayResolver(PolicyEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public IngressInfo resolveIngress(Map<String, ServiceNode> services,
                                      List<PolicyRule> rules,
                                      List<Ingress> ingresses,
                                      List<GenericKubernetesResource> istioGateways,
                                      List<GenericKubernetesResource> virtualServices) {
        var objects = new ArrayList<GatewayObject>();
        var routes = new ArrayList<GatewayRoute>();
        for (Ingress ingress : ingresses) {
            var ingressClass = ingressClass(ingress);
            if (!isSupportedClass(ingressClass)) {
                continue;
            }
            resolveIngressObject(ingress, ingressClass, services, rules, objects, routes);
        }
        var tlsGateways = new LinkedHashSet<String>();
        for (GenericKubernetesResource gateway : istioGateways) {
            var object = istioGateway(gateway);
            objects.add(object);
            if (object.tls()) {
                tlsGateways.add(ServiceKeys.of(object.namespace(), object.name()));
            }
        }
        for (GenericKubernetesResource virtualService : virtualServices) {
            resolveVirtualService(virtualService, tlsGateways, services, rules, routes);
        }
        return new IngressInfo(new GatewayNode(ServiceKeys.INGRESS_GATEWAY, routes), objects);
    }

    public EgressInfo resolveEgress(Map<String, ServiceNode> services,
                                    List<PolicyRule> rules,
                                    List<GenericKubernetesResource> serviceEntries,
                                    List<Deployment> egressGateways) {
        var externalServices = serviceEntries.stream().map(GatewayResolver::externalService).toList();
        var hasGateway = !egressGateways.isEmpty();
        var edges = new ArrayList<ConnectivityEdge>();
        for (ServiceNode service : services.values()) {
            if (hasGateway) {
                edges.add(evaluator.evaluateTo(service, ServiceKeys.EGRESS_GATEWAY, rules, true, MeshType.ISTIO, "Routed through mesh egress gateway"));
            }
            else {
                var reason = externalServices.isEmpty() ? "Direct egress (no egress control)" : "Direct egress to declared external services";
                edges.add(evaluator.evaluateTo(service, ServiceKeys.EGRESS_GATEWAY, rules, service.hasServiceMesh(), service.meshType(), reason));
            }
        }
        var routes = new ArrayList<GatewayRoute>();
        for (ExternalService external : externalServices) {
            for (String host : external.hosts()) {
                var edge = new ConnectivityEdge(ServiceKeys.EGRESS_GATEWAY, host, true, "Declared external service " + external.name(), List.of(),
                        hasGateway, hasGateway ? MeshType.ISTIO : MeshType.NONE, external.ports().isEmpty() ? null : external.ports().get(0), false);
                routes.add(new GatewayRoute(external.name(), external.namespace(), RouteKind.SERVICE_ENTRY, host, "/", false, edge));
            }
        }
        return new EgressInfo(new GatewayNode(ServiceKeys.EGRESS_GATEWAY, routes), externalServices, edges, hasGateway, !hasGateway);
    }

    private void resolveIngressObject(Ingress ingress,
                                      String ingressClass,
                                      Map<String, ServiceNode> services,
                                      List<PolicyRule> rules,
                                      List<GatewayObject> objects,
                                      List<GatewayRoute> routes) {
        var name = ingress.getMetadata().getName();
        var namespace = GenericResources.namespace(ingress);
        var spec = Optional.ofNullable(ingress.getSpec()).orElseGet(IngressSpec::new);
        var tls = spec.getTls() != null && !spec.getTls().isEmpty();
        var hosts = new ArrayList<String>();
        var ports = new LinkedHashSet<String>();
        Optional.ofNullable(spec.getDefaultBackend()).map(IngressBackend::getService).ifPresent(backend -> {
            ports.add(port(backend.getPort()));
            routes.add(route(name, namespace, RouteKind.KUBERNETES_INGRESS, "*", "/", tls, ServiceKeys.of(namespace, backend.getName()), services, rules));
        });
        for (IngressRule rule : Optional.ofNullable(spec.getRules()).orElse(List.of())) {
            var host = Optional.ofNullable(rule.getHost()).filter(h -> !h.isEmpty()).orElse("*");
            hosts.add(host);
            var paths = Optional.ofNullable(rule.getHttp()).map(HTTPIngressRuleValue::getPaths).orElse(List.of());
            for (HTTPIngressPath path : paths) {
                IngressServiceBackend backend = Optional.ofNullable(path.getBackend()).map(IngressBackend::getService).orElse(null);
                if (backend == null) {
                    continue;
                }
                ports.add(port(backend.getPort()));
                routes.add(route(name, namespace, RouteKind.KUBERNETES_INGRESS, host, path.getPath(), tls, ServiceKeys.of(namespace, backend.getName()),
                        services, rules));
            }
        }
        objects.add(new GatewayObject(name, namespace, "Ingress", hosts, List.copyOf(ports), Map.of(), tls, ingressClass));
    }

    private void resolveVirtualService(GenericKubernetesResource virtualService,
                                       Set<String> tlsGateways,
                                       Map<String, ServiceNode> services,
                                       List<PolicyRule> rules,
                                       List<GatewayRoute> routes) {
        var name = virtualService.getMetadata().getName();
        var namespace = GenericResources.namespace(virtualService);
        var gateways = GenericResources.list(virtualService, "spec", "gateways").stream()
                .map(Object::toString)
                .filter(gateway -> !MESH_GATEWAY.equals(gateway))
                .map(gateway -> ServiceKeys.qualify(gateway, namespace))
                .toList();
        if (gateways.isEmpty()) {
            // bound only to sidecars, not an ingress route
            return;
        }
        var tls = gateways.stream().anyMatch(tlsGateways::contains);
        var hosts = GenericResources.list(virtualService, "spec", "hosts").stream().map(Object::toString).toList();
        for (Object http : GenericResources.list(virtualService, "spec", "http")) {
            var destinations = GenericResources.list(http, "route");
            if (destinations.isEmpty()) {
                continue;
            }
            var destinationHost = GenericResources.string(destinations.get(0), "destination", "host");
            if (destinationHost.isEmpty()) {
                continue;
            }
            var path = firstMatchPath(http);
            var target = destinationKey(destinationHost, namespace);
            for (String host : hosts.isEmpty() ? List.of("*") : hosts) {
                routes.add(route(name, namespace, RouteKind.ISTIO_VIRTUAL_SERVICE, host, path, tls, target, services, rules));
            }
        }
    }

    private GatewayRoute route(String source,
                               String namespace,
                               RouteKind kind,
                               String host,
                               @Nullable String path,
                               boolean tls,
                               String targetKey,
                               Map<String, ServiceNode> services,
                               List<PolicyRule> rules) {
        var target = services.get(targetKey);
        ConnectivityEdge edge;
        if (target == null) {
            edge = new ConnectivityEdge(ServiceKeys.INGRESS_GATEWAY, targetKey, false, "Backend service " + targetKey + " not found",
                    List.of(), false, MeshType.NONE, null, false);
        }
        else {
            edge = evaluator.evaluateFrom(ServiceKeys.INGRESS_GATEWAY, target, rules);
        }
        return new GatewayRoute(source, namespace, kind, host, path, tls, edge);
    }

    static String ingressClass(Ingress ingress) {
        var fromSpec = Optional.ofNullable(ingress.getSpec()).map(IngressSpec::getIngressClassName).orElse(null);
        if (fromSpec != null && !fromSpec.isEmpty()) {
            return fromSpec;
        }
        return GenericResources.annotations(ingress).getOrDefault(INGRESS_CLASS_ANNOTATION, "");
    }

    static boolean isSupportedClass(String ingressClass) {
        var lower = ingressClass.toLowerCase(Locale.ROOT);
        return lower.isEmpty() || lower.contains("nginx") || lower.contains("istio");
    }

    private static GatewayObject istioGateway(GenericKubernetesResource gateway) {
        var hosts = new ArrayList<String>();
        var ports = new ArrayList<String>();
        var tls = false;
        for (Object server : GenericResources.list(gateway, "spec", "servers")) {
            GenericResources.list(server, "hosts").forEach(host -> hosts.add(host.toString()));
            var number = GenericResources.string(server, "port", "number");
            var protocol = GenericResources.string(server, "port", "protocol");
            if (!number.isEmpty()) {
                ports.add(protocol.isEmpty() ? number : number + "/" + protocol);
            }
            tls |= GenericResources.nested(server, "tls").isPresent() || "HTTPS".equalsIgnoreCase(protocol);
        }
        return new GatewayObject(gateway.getMetadata().getName(), GenericResources.namespace(gateway), "Gateway", hosts, ports,
                GenericResources.stringMap(gateway.getAdditionalProperties(), "spec", "selector"), tls, null);
    }

    private static String firstMatchPath(Object http) {
        var matches = GenericResources.list(http, "match");
        if (matches.isEmpty()) {
            return "/";
        }
        var prefix = GenericResources.string(matches.get(0), "uri", "prefix");
        if (!prefix.isEmpty()) {
            return prefix;
        }
        var exact = GenericResources.string(matches.get(0), "uri", "exact");
        return exact.isEmpty() ? "/" : exact;
    }

    /**
     * Resolves an Istio destination host ({@code svc}, {@code svc.ns} or {@code svc.ns.svc.cluster.local})
     * to a service key, defaulting to the namespace of the declaring object.
     */
    static String destinationKey(String host, String defaultNamespace) {
        var labels = host.split("\\.");
        var namespace = labels.length > 1 && !"svc".equals(labels[1]) ? labels[1] : defaultNamespace;
        return ServiceKeys.of(namespace, labels[0]);
    }

    private static String port(@Nullable ServiceBackendPort port) {
        if (port == null) {
            return "";
        }
        return port.getNumber() != null ? String.valueOf(port.getNumber()) : Optional.ofNullable(port.getName()).orElse("");
    }

    private static ExternalService externalService(GenericKubernetesResource serviceEntry) {
        var hosts = GenericResources.list(serviceEntry, "spec", "hosts").stream().map(Object::toString).toList();
        var ports = new ArrayList<String>();
        for (Object port : GenericResources.list(serviceEntry, "spec", "ports")) {
            var number = GenericResources.string(port, "number");
            var protocol = GenericResources.string(port, "protocol");
            if (!number.isEmpty()) {
                ports.add(protocol.isEmpty() ? number : number + "/" + protocol);
            }
        }
        var location = GenericResources.string(serviceEntry, "spec", "location");
        var resolution = GenericResources.string(serviceEntry, "spec", "resolution");
        return new ExternalService(serviceEntry.getMetadata().getName(), GenericResources.namespace(serviceEntry), hosts, ports,
                location.isEmpty() ? "MESH_EXTERNAL" : location, resolution.isEmpty() ? "NONE" : resolution);
    }
}
