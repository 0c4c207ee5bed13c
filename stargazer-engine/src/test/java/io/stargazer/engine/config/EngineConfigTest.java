/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.config;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @Test
    void cacheTtlDefaultsToThirtySeconds() {
        assertThat(EngineConfig.DEFAULT.cacheTtl(name -> null)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void cacheTtlFromEnvironment() {
        var env = Map.of(EngineConfig.CACHE_TTL_ENV, "120");

        assertThat(EngineConfig.DEFAULT.cacheTtl(env::get)).isEqualTo(Duration.ofSeconds(120));
    }

    @Test
    void explicitCacheTtlWinsOverEnvironment() {
        var config = new EngineConfig(Duration.ofSeconds(5), null, null, null, null);

        assertThat(config.cacheTtl(Map.of(EngineConfig.CACHE_TTL_ENV, "120")::get)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void nonPositiveEnvironmentValueFallsBackToDefault() {
        assertThat(EngineConfig.DEFAULT.cacheTtl(Map.of(EngineConfig.CACHE_TTL_ENV, "0")::get)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void malformedEnvironmentValueIsRejected() {
        var env = Map.of(EngineConfig.CACHE_TTL_ENV, "thirty");

        assertThatThrownBy(() -> EngineConfig.DEFAULT.cacheTtl(env::get))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining("'thirty'");
    }

    @Test
    void rejectsNonPositiveFetchTimeout() {
        assertThatThrownBy(() -> new EngineConfig(null, Duration.ZERO, null, null, null))
                .isInstanceOf(IllegalConfigurationException.class);
    }

    @Test
    void rejectsNegativePrices() {
        assertThatThrownBy(() -> new CostConfiguration(-1.0, null, null))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining("cpuPerCoreMonth");
    }
}
