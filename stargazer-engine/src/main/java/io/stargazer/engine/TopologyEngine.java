/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;

import io.stargazer.api.FatalFetchException;
import io.stargazer.api.model.ComplianceReport;
import io.stargazer.api.model.ConnectivityEdge;
import io.stargazer.api.model.DriftApplication;
import io.stargazer.api.model.EgressInfo;
import io.stargazer.api.model.GatewayRoute;
import io.stargazer.api.model.InfrastructureInfo;
import io.stargazer.api.model.IngressInfo;
import io.stargazer.api.model.MeshType;
import io.stargazer.api.model.PathTrace;
import io.stargazer.api.model.PolicyRule;
import io.stargazer.api.model.RbacInfo;
import io.stargazer.api.model.Recommendation;
import io.stargazer.api.model.ResourceKind;
import io.stargazer.api.model.ServiceKeys;
import io.stargazer.api.model.ServiceNode;
import io.stargazer.api.model.TopologyData;
import io.stargazer.api.model.TopologySummary;
import io.stargazer.engine.cache.CacheKeys;
import io.stargazer.engine.cache.TtlCache;
import io.stargazer.engine.config.EngineConfig;
import io.stargazer.engine.fetch.ClusterResources;
import io.stargazer.engine.gateway.GatewayResolver;
import io.stargazer.engine.infra.InfrastructureDetector;
import io.stargazer.engine.metrics.PrometheusTrafficMetrics;
import io.stargazer.engine.metrics.TrafficMetrics;
import io.stargazer.engine.policy.PolicyEvaluator;
import io.stargazer.engine.recommend.RecommendationsEngine;
import io.stargazer.engine.topology.CostEstimator;
import io.stargazer.engine.topology.TopologyBuilder;
import io.stargazer.engine.trace.PathTracer;
import io.stargazer.engine.watch.PolicyChangeListener;
import io.stargazer.engine.watch.PolicyWatcher;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Entry point of the engine: computes the topology of a namespace and answers path, recommendation and
 * compliance questions about it.
 * <p>Every operation is read-only and safe to call concurrently. Topologies are cached for the configured TTL,
 * as are the individual resource reads they are built from.</p>
 */
public class TopologyEngine implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TopologyEngine.class);

    /** Namespace argument meaning every namespace. */
    public static final String ALL_NAMESPACES = "all";

    private final KubernetesClient client;
    private final EngineConfig config;
    private final TrafficMetrics trafficMetrics;
    private final ExecutorService executor;
    private final Clock clock;
    private final TtlCache resourceCache;
    private final TtlCache topologyCache;
    private final ClusterResources resources;
    private final InfrastructureDetector infrastructureDetector;
    private final TopologyBuilder topologyBuilder;
    private final PolicyEvaluator policyEvaluator;
    private final GatewayResolver gatewayResolver;
    private final PathTracer pathTracer;
    private final RecommendationsEngine recommendationsEngine;
    private final List<PolicyWatcher> watchers = new ArrayList<>();

    public TopologyEngine(KubernetesClient client, EngineConfig config) {
        this(client, config, config.metrics().enabled() ? new PrometheusTrafficMetrics(config.metrics()) : TrafficMetrics.NONE,
                Executors.newCachedThreadPool(daemonThreads()), Clock.systemUTC(), Metrics.globalRegistry, new InfrastructureDetector(client));
    }

    TopologyEngine(KubernetesClient client, EngineConfig config, TrafficMetrics trafficMetrics, ExecutorService executor, Clock clock,
                   MeterRegistry registry, InfrastructureDetector infrastructureDetector) {
        this.client = Objects.requireNonNull(client);
        this.config = Objects.requireNonNull(config);
        this.trafficMetrics = Objects.requireNonNull(trafficMetrics);
        this.executor = Objects.requireNonNull(executor);
        this.clock = Objects.requireNonNull(clock);
        this.resourceCache = new TtlCache("resources", config.cacheTtl(), registry);
        this.topologyCache = new TtlCache("topology", config.cacheTtl(), registry);
        this.resources = new ClusterResources(client, resourceCache);
        this.infrastructureDetector = Objects.requireNonNull(infrastructureDetector);
        this.topologyBuilder = new TopologyBuilder(new CostEstimator(config.cost()));
        this.policyEvaluator = new PolicyEvaluator();
        this.gatewayResolver = new GatewayResolver(policyEvaluator);
        this.pathTracer = new PathTracer();
        this.recommendationsEngine = new RecommendationsEngine(config.maxFindingsPerCheck());
    }

    /**
     * Returns the topology of a namespace, from cache when fresh.
     * @param namespace namespace to inspect, {@code "all"} or empty for every namespace
     * @return the topology
     * @throws FatalFetchException if services or pods could not be read
     */
    public TopologyData getTopology(@Nullable String namespace) {
        var ns = normalize(namespace);
        var key = CacheKeys.topology(ns);
        var cached = topologyCache.get(key, TopologyData.class);
        if (cached.isPresent()) {
            return cached.get();
        }
        var topology = compute(ns);
        topologyCache.set(key, topology);
        return topology;
    }

    public PathTrace tracePath(String source, String destination, @Nullable String namespace, TopologyData topology) {
        return pathTracer.tracePath(source, destination, namespace, topology);
    }

    public List<Recommendation> getRecommendations(TopologyData topology) {
        return recommendationsEngine.getRecommendations(topology);
    }

    /**
     * @return score, passed, total, per-check results and recommendation count
     */
    public Map<String, Object> getComplianceScore(TopologyData topology) {
        return recommendationsEngine.getComplianceScore(topology);
    }

    public ComplianceReport getComplianceReport(TopologyData topology) {
        return recommendationsEngine.evaluate(topology);
    }

    /**
     * Drops the cached topology of a namespace and every cached resource read, so the next request reads the cluster again.
     */
    public void invalidate(@Nullable String namespace) {
        var ns = normalize(namespace);
        topologyCache.invalidate(CacheKeys.topology(ns));
        resourceCache.clear();
    }

    public void invalidateAll() {
        topologyCache.clear();
        resourceCache.clear();
    }

    /**
     * Starts watching the policy resources of the detected engines. Any change invalidates every cached
     * topology before {@code listener} is notified.
     * @param namespace namespace to watch, {@code "all"} or empty for every namespace
     */
    public PolicyWatcher watchPolicies(@Nullable String namespace, PolicyChangeListener listener) {
        var watcher = new PolicyWatcher(client, infrastructureDetector.detect(), config.cacheTtl());
        watcher.addListener(event -> {
            topologyCache.invalidatePrefix(CacheKeys.TOPOLOGY_PREFIX);
            resourceCache.clear();
        });
        watcher.addListener(listener);
        watcher.start(normalize(namespace));
        synchronized (watchers) {
            watchers.add(watcher);
        }
        return watcher;
    }

    @Override
    public void close() {
        synchronized (watchers) {
            watchers.forEach(PolicyWatcher::close);
            watchers.clear();
        }
        executor.shutdownNow();
        topologyCache.close();
        resourceCache.close();
    }

    TopologyData compute(String namespace) {
        var group = new FetchGroup(executor, namespace, config.fetchTimeout());

        var infrastructureFetch = group.optional(ResourceKind.INFRASTRUCTURE, infrastructureDetector::detect, InfrastructureInfo.none());
        var servicesFetch = group.essential(ResourceKind.SERVICES, () -> resources.services(namespace));
        var podsFetch = group.essential(ResourceKind.PODS, () -> resources.pods(namespace));
        var nativeFetch = group.optional(ResourceKind.NETWORK_POLICIES, () -> resources.networkPolicies(namespace), List.<PolicyRule> of());
        var rbacFetch = group.optional(ResourceKind.RBAC, () -> resources.rbac(namespace), RbacInfo.empty());
        var driftFetch = group.optional(ResourceKind.DRIFT, resources::driftApplications, List.<DriftApplication> of());
        var ingressFetch = group.optional(ResourceKind.INGRESSES, () -> resources.ingresses(namespace), List.<Ingress> of());
        var metricsFetch = trafficMetrics == TrafficMetrics.NONE
                ? null
                : group.optional(ResourceKind.METRICS, () -> Optional.of(trafficMetrics.requestRates(namespace)), Optional.<Map<String, Double>> empty());

        // engine specific reads wait for detection, under the same deadline
        var infrastructure = infrastructureFetch.get();
        var ciliumFetch = infrastructure.ciliumEnabled()
                ? group.optional(ResourceKind.CILIUM_POLICIES, () -> resources.ciliumPolicies(namespace), List.<PolicyRule> of())
                : null;
        var istioFetch = infrastructure.istioEnabled()
                ? group.optional(ResourceKind.ISTIO_POLICIES, () -> resources.istioPolicies(namespace), List.<PolicyRule> of())
                : null;
        var kyvernoFetch = infrastructure.kyvernoEnabled()
                ? group.optional(ResourceKind.KYVERNO_POLICIES, () -> resources.kyvernoPolicies(namespace), List.<PolicyRule> of())
                : null;
        var istioVersion = infrastructure.istioApiVersion();
        var gatewaysFetch = infrastructure.istioEnabled()
                ? group.optional(ResourceKind.MESH_GATEWAYS, () -> resources.istioGateways(namespace, istioVersion), List.<GenericKubernetesResource> of())
                : null;
        var virtualServicesFetch = infrastructure.istioEnabled()
                ? group.optional(ResourceKind.MESH_GATEWAYS, () -> resources.istioVirtualServices(namespace, istioVersion),
                        List.<GenericKubernetesResource> of())
                : null;
        var serviceEntriesFetch = infrastructure.istioEnabled()
                ? group.optional(ResourceKind.SERVICE_ENTRIES, () -> resources.istioServiceEntries(namespace, istioVersion),
                        List.<GenericKubernetesResource> of())
                : null;
        var egressGatewaysFetch = infrastructure.istioEnabled()
                ? group.optional(ResourceKind.DEPLOYMENTS, resources::egressGateways, List.<Deployment> of())
                : null;

        List<Service> services = servicesFetch.get();
        List<Pod> pods = podsFetch.get();
        var nativeRules = nativeFetch.get();
        var ciliumRules = ciliumFetch == null ? List.<PolicyRule> of() : ciliumFetch.get();
        var istioRules = istioFetch == null ? List.<PolicyRule> of() : istioFetch.get();
        var kyvernoRules = kyvernoFetch == null ? List.<PolicyRule> of() : kyvernoFetch.get();
        var rbac = rbacFetch.get();
        var drift = driftFetch.get();
        var ingresses = ingressFetch.get();
        var gateways = gatewaysFetch == null ? List.<GenericKubernetesResource> of() : gatewaysFetch.get();
        var virtualServices = virtualServicesFetch == null ? List.<GenericKubernetesResource> of() : virtualServicesFetch.get();
        var serviceEntries = serviceEntriesFetch == null ? List.<GenericKubernetesResource> of() : serviceEntriesFetch.get();
        var egressGateways = egressGatewaysFetch == null ? List.<Deployment> of() : egressGatewaysFetch.get();
        // no rates at all leaves cost signals off rather than flagging everything unused
        var requestRates = metricsFetch == null ? null : metricsFetch.get().orElse(null);
        var warnings = group.warnings();

        var rules = new ArrayList<PolicyRule>(nativeRules);
        rules.addAll(ciliumRules);
        rules.addAll(istioRules);
        rules.addAll(kyvernoRules);

        var nodes = policyEvaluator.applyCoverage(topologyBuilder.build(services, pods, infrastructure, drift, requestRates), rules);
        var connectivity = policyEvaluator.evaluate(nodes, rules);
        var ingress = gatewayResolver.resolveIngress(nodes, rules, ingresses, gateways, virtualServices);
        var egress = gatewayResolver.resolveEgress(nodes, rules, serviceEntries, egressGateways);
        var assembled = assemble(connectivity, ingress, egress);

        var topology = new TopologyData(namespace,
                nodes,
                rules,
                assembled,
                ingress,
                egress,
                infrastructure.withPolicyCounts(ciliumRules.size(), istioRules.size(), kyvernoRules.size()),
                rbac,
                drift,
                summarize(nodes, assembled),
                warnings,
                clock.instant());
        LOGGER.atInfo()
                .setMessage("Computed topology for {}: {} services, {} connections ({} blocked), {} warnings")
                .addArgument(() -> namespace.isEmpty() ? "all namespaces" : "namespace '" + namespace + "'")
                .addArgument(topology.summary().totalServices())
                .addArgument(topology.summary().totalConnections())
                .addArgument(topology.summary().blockedConnections())
                .addArgument(warnings.size())
                .log();
        return topology;
    }

    /**
     * Joins service edges with the gateway edges: one entry per service, then the ingress gateway's routes,
     * with each service's egress edge appended to its own list, then the egress gateway's routes.
     */
    static Map<String, List<ConnectivityEdge>> assemble(Map<String, List<ConnectivityEdge>> serviceEdges, IngressInfo ingress, EgressInfo egress) {
        var assembled = new LinkedHashMap<String, List<ConnectivityEdge>>();
        serviceEdges.forEach((key, edges) -> assembled.put(key, new ArrayList<>(edges)));
        assembled.put(ServiceKeys.INGRESS_GATEWAY, ingress.gateway().routes().stream().map(GatewayRoute::edge).toList());
        for (ConnectivityEdge edge : egress.edges()) {
            assembled.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
        }
        assembled.put(ServiceKeys.EGRESS_GATEWAY, egress.gateway().routes().stream().map(GatewayRoute::edge).toList());
        return assembled;
    }

    static TopologySummary summarize(Map<String, ServiceNode> services, Map<String, List<ConnectivityEdge>> connectivity) {
        int total = services.size();
        var edges = connectivity.values().stream().flatMap(List::stream).toList();
        int allowed = (int) edges.stream().filter(ConnectivityEdge::allowed).count();
        return new TopologySummary(total,
                count(services, ServiceNode::hasServiceMesh),
                edges.size(),
                allowed,
                edges.size() - allowed,
                percent(count(services, ServiceNode::hasServiceMesh), total),
                percent(count(services, ServiceNode::ciliumProxy), total),
                percent(count(services, service -> service.meshType() == MeshType.ISTIO), total));
    }

    private static int count(Map<String, ServiceNode> services, Predicate<ServiceNode> predicate) {
        return (int) services.values().stream().filter(predicate).count();
    }

    private static String percent(int part, int total) {
        return String.format(Locale.ROOT, "%.0f%%", total == 0 ? 0.0 : part * 100.0 / total);
    }

    static String normalize(@Nullable String namespace) {
        if (namespace == null || ALL_NAMESPACES.equals(namespace)) {
            return "";
        }
        return namespace;
    }

    private static ThreadFactory daemonThreads() {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "stargazer-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
