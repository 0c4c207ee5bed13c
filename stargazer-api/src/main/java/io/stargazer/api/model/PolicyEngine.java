/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The policy engine a {@link PolicyRule} belongs to.
 */
public enum PolicyEngine {
    /** Kubernetes {@code NetworkPolicy}. */
    NATIVE,
    /** Service mesh authorization and routing objects (Istio). */
    MESH,
    /** eBPF CNI policy objects (Cilium). */
    EBPF,
    /** Policy-as-code admission objects (Kyverno). These never affect connectivity. */
    ADMISSION;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
