/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

/**
 * Traffic and cost signal attached to a service from the metrics endpoint.
 * @param requestsPerSecond rolling request rate
 * @param cpuMillicores CPU requested across all backing pods
 * @param memoryMiB memory requested across all backing pods
 * @param likelyUnused whether the request rate is below the unused threshold
 * @param potentialSaving estimated monthly saving if the service were removed, e.g. {@code $1.23/mo}
 */
public record CostSignal(double requestsPerSecond,
                         long cpuMillicores,
                         long memoryMiB,
                         boolean likelyUnused,
                         String potentialSaving) {}
