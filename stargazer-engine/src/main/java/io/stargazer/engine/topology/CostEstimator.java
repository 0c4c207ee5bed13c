/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.topology;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;

import io.stargazer.api.model.CostSignal;
import io.stargazer.engine.config.CostConfiguration;

/**
 * Turns a request rate and the resource requests of a service's pods into a {@link CostSignal}.
 * Requests are summed over every backing pod, so heterogeneous replicas are accounted for.
 */
public class CostEstimator {

    static final String NO_SAVING = "$0.00/mo";
    private static final BigDecimal MEBIBYTE = BigDecimal.valueOf(1024L * 1024L);

    private final CostConfiguration configuration;

    public CostEstimator(CostConfiguration configuration) {
        this.configuration = configuration;
    }

    public CostSignal estimate(double requestsPerSecond, List<Pod> pods) {
        long cpuMillicores = 0;
        long memoryMiB = 0;
        for (Pod pod : pods) {
            for (Container container : containers(pod)) {
                var requests = Optional.ofNullable(container.getResources()).map(ResourceRequirements::getRequests).orElse(Map.of());
                cpuMillicores += amount(requests.get("cpu")).multiply(BigDecimal.valueOf(1000)).longValue();
                memoryMiB += amount(requests.get("memory")).divide(MEBIBYTE, RoundingMode.DOWN).longValue();
            }
        }
        var unused = requestsPerSecond < configuration.unusedRpsThreshold();
        var saving = unused ? monthlySaving(cpuMillicores, memoryMiB) : NO_SAVING;
        return new CostSignal(requestsPerSecond, cpuMillicores, memoryMiB, unused, saving);
    }

    String monthlySaving(long cpuMillicores, long memoryMiB) {
        double cost = cpuMillicores / 1000.0 * configuration.cpuPerCoreMonth()
                + memoryMiB / 1024.0 * configuration.memoryPerGiBMonth();
        return String.format(Locale.ROOT, "$%.2f/mo", cost);
    }

    private static BigDecimal amount(Quantity quantity) {
        return quantity == null ? BigDecimal.ZERO : quantity.getNumericalAmount();
    }

    private static List<Container> containers(Pod pod) {
        return Optional.ofNullable(pod.getSpec()).map(PodSpec::getContainers).orElse(List.of());
    }
}
