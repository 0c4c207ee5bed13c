/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.List;

/**
 * @param gateway the synthetic egress vertex, with one route per declared external host
 * @param externalServices declared external destinations
 * @param edges one edge per service towards {@link ServiceKeys#EGRESS_GATEWAY}
 * @param hasEgressGateway whether a mesh egress gateway is deployed
 * @param directEgress whether services reach the outside without any egress control
 */
public record EgressInfo(GatewayNode gateway,
                         List<ExternalService> externalServices,
                         List<ConnectivityEdge> edges,
                         boolean hasEgressGateway,
                         boolean directEgress) {

    public EgressInfo {
        externalServices = List.copyOf(externalServices);
        edges = List.copyOf(edges);
    }

    public static EgressInfo empty() {
        return new EgressInfo(GatewayNode.empty(ServiceKeys.EGRESS_GATEWAY), List.of(), List.of(), false, true);
    }
}
