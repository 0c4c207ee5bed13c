/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.topology;

import java.util.List;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodSecurityContext;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.SecurityContext;

import io.stargazer.api.model.PodSecurityTier;

/**
 * Classifies pods into the three pod security standard tiers.
 */
public final class PodSecurityClassifier {

    private PodSecurityClassifier() {
    }

    /**
     * Any privileged pod makes the service privileged; the service is restricted only if all of its pods are.
     */
    public static PodSecurityTier classify(List<Pod> pods) {
        if (pods.isEmpty()) {
            return PodSecurityTier.BASELINE;
        }
        var restricted = true;
        for (Pod pod : pods) {
            var tier = classify(pod);
            if (tier == PodSecurityTier.PRIVILEGED) {
                return PodSecurityTier.PRIVILEGED;
            }
            restricted &= tier == PodSecurityTier.RESTRICTED;
        }
        return restricted ? PodSecurityTier.RESTRICTED : PodSecurityTier.BASELINE;
    }

    public static PodSecurityTier classify(Pod pod) {
        var spec = pod.getSpec();
        if (spec == null) {
            return PodSecurityTier.BASELINE;
        }
        var containers = Optional.ofNullable(spec.getContainers()).orElse(List.of());
        if (usesHostNamespaces(spec) || containers.stream().anyMatch(PodSecurityClassifier::isPrivileged)) {
            return PodSecurityTier.PRIVILEGED;
        }
        var podRunsAsNonRoot = Optional.ofNullable(spec.getSecurityContext())
                .map(PodSecurityContext::getRunAsNonRoot)
                .orElse(false);
        if (!containers.isEmpty() && containers.stream().allMatch(c -> isRestricted(c, podRunsAsNonRoot))) {
            return PodSecurityTier.RESTRICTED;
        }
        return PodSecurityTier.BASELINE;
    }

    private static boolean usesHostNamespaces(PodSpec spec) {
        return Boolean.TRUE.equals(spec.getHostNetwork())
                || Boolean.TRUE.equals(spec.getHostPID())
                || Boolean.TRUE.equals(spec.getHostIPC());
    }

    private static boolean isPrivileged(Container container) {
        var securityContext = container.getSecurityContext();
        return securityContext != null && Boolean.TRUE.equals(securityContext.getPrivileged());
    }

    private static boolean isRestricted(Container container, boolean podRunsAsNonRoot) {
        SecurityContext securityContext = container.getSecurityContext();
        if (securityContext == null) {
            return false;
        }
        var runAsNonRoot = securityContext.getRunAsNonRoot() != null ? securityContext.getRunAsNonRoot() : podRunsAsNonRoot;
        return Boolean.FALSE.equals(securityContext.getAllowPrivilegeEscalation()) && runAsNonRoot;
    }
}
