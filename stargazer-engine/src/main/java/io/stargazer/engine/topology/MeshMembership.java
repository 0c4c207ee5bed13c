/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.topology;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodSpec;

import io.stargazer.api.model.InfrastructureInfo;
import io.stargazer.api.model.MeshType;
import io.stargazer.engine.fetch.GenericResources;

/**
 * Decides whether a pod is enrolled in a mesh.
 */
final class MeshMembership {

    static final String ISTIO_SIDECAR_STATUS = "sidecar.istio.io/status";
    static final String CILIUM_POLICY_NAME = "io.cilium.k8s.policy.name";

    private MeshMembership() {
    }

    static boolean inIstio(Pod pod, InfrastructureInfo infrastructure) {
        if (!infrastructure.istioEnabled()) {
            return false;
        }
        if (GenericResources.annotations(pod).containsKey(ISTIO_SIDECAR_STATUS)) {
            return true;
        }
        return containers(pod).stream()
                .map(Container::getImage)
                .anyMatch(image -> image != null && image.toLowerCase(Locale.ROOT).contains("istio"));
    }

    static boolean hasCiliumProxy(Pod pod, InfrastructureInfo infrastructure) {
        if (!infrastructure.ciliumEnabled()) {
            return false;
        }
        var policy = GenericResources.annotations(pod).get(CILIUM_POLICY_NAME);
        return policy != null && !policy.isEmpty();
    }

    /**
     * Istio takes precedence when a pod is enrolled in both.
     */
    static MeshType meshOf(List<Pod> pods, InfrastructureInfo infrastructure) {
        if (pods.stream().anyMatch(pod -> inIstio(pod, infrastructure))) {
            return MeshType.ISTIO;
        }
        if (pods.stream().anyMatch(pod -> hasCiliumProxy(pod, infrastructure))) {
            return MeshType.CILIUM;
        }
        return MeshType.NONE;
    }

    private static List<Container> containers(Pod pod) {
        return Optional.ofNullable(pod.getSpec()).map(PodSpec::getContainers).orElse(List.of());
    }
}
