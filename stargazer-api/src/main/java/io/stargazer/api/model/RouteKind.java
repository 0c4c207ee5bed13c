/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The kind of object that declared a gateway route.
 */
public enum RouteKind {
    KUBERNETES_INGRESS("k8s-ingress"),
    ISTIO_VIRTUAL_SERVICE("istio-virtualservice"),
    SERVICE_ENTRY("istio-serviceentry"),
    DIRECT("direct");

    private final String label;

    RouteKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
