/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.Objects;

/**
 * A host/path route declared on a gateway, with the verdict for the gateway reaching its backend.
 *
 * @param source name of the object declaring the route
 * @param namespace namespace of the object declaring the route
 * @param kind kind of the declaring object
 * @param host the matched host, {@code *} when any
 * @param path the matched path prefix
 * @param tls whether the route terminates TLS
 * @param edge the verdict from the gateway to the backend
 */
public record GatewayRoute(String source,
                           String namespace,
                           RouteKind kind,
                           String host,
                           String path,
                           boolean tls,
                           ConnectivityEdge edge) {

    public GatewayRoute {
        Objects.requireNonNull(edge);
        host = host == null || host.isEmpty() ? "*" : host;
        path = path == null || path.isEmpty() ? "/" : path;
    }

    public String target() {
        return edge.to();
    }

    public boolean allowed() {
        return edge.allowed();
    }
}
