/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

/**
 * The kinds of cluster resource read while computing a topology.
 * Failing to read an {@linkplain #isEssential() essential} kind aborts the computation;
 * any other kind degrades to an empty result.
 */
public enum ResourceKind {
    SERVICES(true),
    PODS(true),
    NETWORK_POLICIES(false),
    CILIUM_POLICIES(false),
    ISTIO_POLICIES(false),
    KYVERNO_POLICIES(false),
    RBAC(false),
    DRIFT(false),
    INGRESSES(false),
    MESH_GATEWAYS(false),
    SERVICE_ENTRIES(false),
    DEPLOYMENTS(false),
    METRICS(false),
    INFRASTRUCTURE(false);

    private final boolean essential;

    ResourceKind(boolean essential) {
        this.essential = essential;
    }

    public boolean isEssential() {
        return essential;
    }
}
