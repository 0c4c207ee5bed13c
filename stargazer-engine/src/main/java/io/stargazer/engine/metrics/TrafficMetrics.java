/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.metrics;

import java.util.Map;

import io.stargazer.api.SoftFetchException;

/**
 * Source of per-service request rates.
 */
@FunctionalInterface
public interface TrafficMetrics {

    /**
     * @param namespace namespace filter, empty for all namespaces
     * @return rolling requests per second by service key, containing only services the source has data for
     * @throws SoftFetchException if the source could not be queried
     */
    Map<String, Double> requestRates(String namespace);

    /**
     * A source that never has data.
     */
    TrafficMetrics NONE = namespace -> Map.of();
}
