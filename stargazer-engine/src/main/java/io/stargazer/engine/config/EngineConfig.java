/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.config;

import java.time.Duration;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Engine configuration.
 * @param cacheTtl how long fetched resources and computed topologies stay fresh; defaults to
 * the {@code CACHE_TTL} environment variable (seconds) or 30s
 * @param fetchTimeout deadline for all cluster reads of one topology computation, default 20s
 * @param maxFindingsPerCheck cap on the findings a single best-practice check emits, default 10
 * @param metrics traffic metrics source
 * @param cost cost estimation
 */
public record EngineConfig(@JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration cacheTtl,
                           @JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration fetchTimeout,
                           @Nullable Integer maxFindingsPerCheck,
                           @Nullable MetricsConfiguration metrics,
                           @Nullable CostConfiguration cost) {

    public static final String CACHE_TTL_ENV = "CACHE_TTL";
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(30);

    public static final EngineConfig DEFAULT = new EngineConfig(null, null, null, null, null);

    public EngineConfig {
        if (fetchTimeout != null && (fetchTimeout.isNegative() || fetchTimeout.isZero())) {
            throw new IllegalConfigurationException("'fetchTimeout' must be positive, was " + fetchTimeout);
        }
        if (maxFindingsPerCheck != null && maxFindingsPerCheck < 1) {
            throw new IllegalConfigurationException("'maxFindingsPerCheck' must be at least 1, was " + maxFindingsPerCheck);
        }
    }

    @Override
    public Duration cacheTtl() {
        return cacheTtl(System::getenv);
    }

    Duration cacheTtl(UnaryOperator<String> environment) {
        if (cacheTtl != null) {
            return cacheTtl;
        }
        String fromEnv = environment.apply(CACHE_TTL_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            try {
                long seconds = Long.parseLong(fromEnv.trim());
                if (seconds > 0) {
                    return Duration.ofSeconds(seconds);
                }
            }
            catch (NumberFormatException e) {
                throw new IllegalConfigurationException(CACHE_TTL_ENV + " must be a number of seconds, was '" + fromEnv + "'");
            }
        }
        return DEFAULT_CACHE_TTL;
    }

    @Override
    public Duration fetchTimeout() {
        return fetchTimeout == null ? Duration.ofSeconds(20) : fetchTimeout;
    }

    @Override
    public Integer maxFindingsPerCheck() {
        return maxFindingsPerCheck == null ? 10 : maxFindingsPerCheck;
    }

    @Override
    public MetricsConfiguration metrics() {
        return metrics == null ? MetricsConfiguration.DEFAULT : metrics;
    }

    @Override
    public CostConfiguration cost() {
        return cost == null ? CostConfiguration.DEFAULT : cost;
    }
}
