/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.trace;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stargazer.api.model.GatewayRoute;
import io.stargazer.api.model.HopKind;
import io.stargazer.api.model.PathHop;
import io.stargazer.api.model.PathTrace;
import io.stargazer.api.model.ServiceKeys;
import io.stargazer.api.model.ServiceNode;
import io.stargazer.api.model.TopologyData;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Walks a finished {@link TopologyData} hop by hop from a source endpoint to a destination.
 * <p>The walk stops at the first blocked hop. Unknown endpoints and missing edges produce a
 * blocked trace with an explanatory reason rather than an exception.</p>
 */
public class PathTracer {

    private static final Logger LOGGER = LoggerFactory.getLogger(PathTracer.class);

    static final String NO_PATH = "No connection path found";
    static final String ALL_NAMESPACES = "all";

    enum State {
        INGRESS,
        SERVICE,
        EGRESS
    }

    record Endpoint(State state, String key) {}

    public PathTrace tracePath(String source, String destination, @Nullable String namespace, TopologyData topology) {
        Objects.requireNonNull(topology, "topology");
        var src = parse(source, namespace, topology);
        var dst = parse(destination, namespace, topology);
        var trace = PathTrace.builder(src.key(), dst.key());

        if (src.state() == State.SERVICE && !topology.services().containsKey(src.key())) {
            trace.append(notFound(src.key(), dst.key(), HopKind.SERVICE, "Source service not found: " + source));
            return trace.build();
        }
        if (dst.state() == State.SERVICE && !topology.services().containsKey(dst.key())) {
            trace.append(notFound(src.key(), dst.key(), HopKind.SERVICE, "Destination service not found"));
            return trace.build();
        }

        String current = src.key();
        State state = src.state();
        if (state == State.INGRESS) {
            var route = ingressRoute(topology, dst.key());
            if (route.isEmpty()) {
                trace.append(notFound(current, dst.key(), HopKind.INGRESS, NO_PATH));
                return trace.build();
            }
            var edge = route.get().edge();
            if (!trace.append(PathHop.fromEdge(HopKind.INGRESS, edge)) || edge.to().equals(dst.key())) {
                return trace.build();
            }
            current = edge.to();
            state = State.SERVICE;
        }

        String from = current;
        if (state == State.EGRESS) {
            var edge = topology.edge(from, dst.key());
            trace.append(edge.map(e -> PathHop.fromEdge(HopKind.EGRESS, e))
                    .orElseGet(() -> notFound(from, dst.key(), HopKind.EGRESS, NO_PATH)));
            return trace.build();
        }

        switch (dst.state()) {
            case EGRESS -> trace.append(egressHop(topology, from));
            case INGRESS -> trace.append(notFound(from, dst.key(), HopKind.SERVICE, NO_PATH));
            default -> trace.append(topology.edge(from, dst.key())
                    .map(e -> PathHop.fromEdge(HopKind.SERVICE, e))
                    .orElseGet(() -> notFound(from, dst.key(), HopKind.SERVICE, NO_PATH)));
        }
        var result = trace.build();
        LOGGER.atDebug()
                .setMessage("Traced {} -> {}: {}")
                .addArgument(result.source())
                .addArgument(result.destination())
                .addArgument(result.reason())
                .log();
        return result;
    }

    private static PathHop egressHop(TopologyData topology, String from) {
        return topology.edge(from, ServiceKeys.EGRESS_GATEWAY)
                .map(edge -> {
                    var hop = PathHop.fromEdge(HopKind.EGRESS, edge);
                    if (edge.allowed()) {
                        return hop;
                    }
                    return new PathHop(hop.from(), hop.to(), hop.kind(), false, "Blocked at egress: " + edge.reason(), hop.policies(), hop.meshType());
                })
                .orElseGet(() -> notFound(from, ServiceKeys.EGRESS_GATEWAY, HopKind.EGRESS, NO_PATH));
    }

    /**
     * Picks the ingress route for a destination: an allowed route to it, any route to it,
     * then the first allowed route, then the first route.
     */
    static Optional<GatewayRoute> ingressRoute(TopologyData topology, String destination) {
        List<GatewayRoute> routes = topology.ingress().gateway().routes();
        return routes.stream().filter(r -> r.target().equals(destination) && r.allowed()).findFirst()
                .or(() -> routes.stream().filter(r -> r.target().equals(destination)).findFirst())
                .or(() -> routes.stream().filter(GatewayRoute::allowed).findFirst())
                .or(() -> routes.stream().findFirst());
    }

    static Endpoint parse(String endpoint, @Nullable String namespace, TopologyData topology) {
        if (ServiceKeys.INGRESS_GATEWAY.equals(endpoint)) {
            return new Endpoint(State.INGRESS, ServiceKeys.INGRESS_GATEWAY);
        }
        if (ServiceKeys.EGRESS_GATEWAY.equals(endpoint) || ServiceKeys.EXTERNAL.equals(endpoint)) {
            return new Endpoint(State.EGRESS, ServiceKeys.EGRESS_GATEWAY);
        }
        if (endpoint.contains("/") || (namespace != null && !namespace.isEmpty() && !ALL_NAMESPACES.equals(namespace))) {
            return new Endpoint(State.SERVICE, ServiceKeys.qualify(endpoint, namespace));
        }
        // bare name across all namespaces resolves only when unambiguous
        var matches = topology.services().values().stream()
                .filter(service -> service.name().equals(endpoint))
                .map(ServiceNode::key)
                .limit(2)
                .toList();
        return new Endpoint(State.SERVICE, matches.size() == 1 ? matches.get(0) : endpoint);
    }

    private static PathHop notFound(String from, String to, HopKind kind, String reason) {
        return new PathHop(from, to, kind, false, reason, List.of(), null);
    }
}
