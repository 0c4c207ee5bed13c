/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.List;

/**
 * A synthetic graph vertex standing for cluster-external ingress or egress.
 * @param key {@link ServiceKeys#INGRESS_GATEWAY} or {@link ServiceKeys#EGRESS_GATEWAY}
 * @param routes the routes through the gateway, in declaration order
 */
public record GatewayNode(String key, List<GatewayRoute> routes) {

    public GatewayNode {
        routes = List.copyOf(routes);
    }

    public static GatewayNode empty(String key) {
        return new GatewayNode(key, List.of());
    }
}
