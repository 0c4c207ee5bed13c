/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The service mesh, if any, that a workload's traffic is routed through.
 */
public enum MeshType {
    NONE("none"),
    ISTIO("istio"),
    CILIUM("cilium");

    private final String label;

    MeshType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
