/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

/**
 * What networking technology the cluster runs.
 *
 * @param cni container network interface, {@code cilium}, {@code calico}, {@code flannel} or {@code unknown}
 * @param ciliumEnabled whether the eBPF policy engine is present
 * @param istioEnabled whether the service mesh is present
 * @param istioApiVersion networking API version served by the mesh
 * @param kyvernoEnabled whether the policy-as-code engine is present
 * @param hubbleEnabled whether Hubble flow observability is deployed
 * @param ciliumPolicyCount number of eBPF policy objects
 * @param istioPolicyCount number of mesh policy objects
 * @param kyvernoPolicyCount number of policy-as-code objects
 */
public record InfrastructureInfo(String cni,
                                 boolean ciliumEnabled,
                                 boolean istioEnabled,
                                 String istioApiVersion,
                                 boolean kyvernoEnabled,
                                 boolean hubbleEnabled,
                                 int ciliumPolicyCount,
                                 int istioPolicyCount,
                                 int kyvernoPolicyCount) {

    public static final String UNKNOWN_CNI = "unknown";
    public static final String DEFAULT_ISTIO_API_VERSION = "v1beta1";

    public static InfrastructureInfo none() {
        return new InfrastructureInfo(UNKNOWN_CNI, false, false, DEFAULT_ISTIO_API_VERSION, false, false, 0, 0, 0);
    }

    public boolean meshEnabled() {
        return istioEnabled || ciliumEnabled;
    }

    public InfrastructureInfo withPolicyCounts(int cilium, int istio, int kyverno) {
        return new InfrastructureInfo(cni, ciliumEnabled, istioEnabled, istioApiVersion, kyvernoEnabled, hubbleEnabled, cilium, istio, kyverno);
    }
}
