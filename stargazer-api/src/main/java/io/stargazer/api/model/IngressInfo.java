/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.List;

/**
 * @param gateway the synthetic ingress vertex and its routes
 * @param gateways the ingress objects the routes were derived from
 */
public record IngressInfo(GatewayNode gateway, List<GatewayObject> gateways) {

    public IngressInfo {
        gateways = List.copyOf(gateways);
    }

    public static IngressInfo empty() {
        return new IngressInfo(GatewayNode.empty(ServiceKeys.INGRESS_GATEWAY), List.of());
    }
}
