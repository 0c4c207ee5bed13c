/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A real ingress object found in the cluster: a Kubernetes {@code Ingress} or an Istio {@code Gateway}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GatewayObject(String name,
                            String namespace,
                            String kind,
                            List<String> hosts,
                            List<String> ports,
                            Map<String, String> selector,
                            boolean tls,
                            @Nullable String ingressClass) {

    public GatewayObject {
        hosts = List.copyOf(hosts);
        ports = List.copyOf(ports);
        selector = selector == null ? Map.of() : Map.copyOf(selector);
    }
}
