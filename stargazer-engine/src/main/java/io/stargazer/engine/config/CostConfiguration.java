/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.config;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Prices used to estimate what an unused service costs.
 * @param cpuPerCoreMonth USD per requested core per month, default 30
 * @param memoryPerGiBMonth USD per requested GiB per month, default 4
 * @param unusedRpsThreshold request rate under which a service is considered unused, default 0.001
 */
public record CostConfiguration(@Nullable Double cpuPerCoreMonth,
                                @Nullable Double memoryPerGiBMonth,
                                @Nullable Double unusedRpsThreshold) {

    public static final CostConfiguration DEFAULT = new CostConfiguration(null, null, null);

    public CostConfiguration {
        requireNonNegative("cpuPerCoreMonth", cpuPerCoreMonth);
        requireNonNegative("memoryPerGiBMonth", memoryPerGiBMonth);
        requireNonNegative("unusedRpsThreshold", unusedRpsThreshold);
    }

    private static void requireNonNegative(String name, @Nullable Double value) {
        if (value != null && value < 0) {
            throw new IllegalConfigurationException("'" + name + "' must not be negative, was " + value);
        }
    }

    @Override
    public Double cpuPerCoreMonth() {
        return cpuPerCoreMonth == null ? 30.0 : cpuPerCoreMonth;
    }

    @Override
    public Double memoryPerGiBMonth() {
        return memoryPerGiBMonth == null ? 4.0 : memoryPerGiBMonth;
    }

    @Override
    public Double unusedRpsThreshold() {
        return unusedRpsThreshold == null ? 0.001 : unusedRpsThreshold;
    }
}
