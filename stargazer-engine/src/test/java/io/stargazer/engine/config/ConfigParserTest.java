/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.config;

import java.net.URI;
import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigParserTest {

    private final ConfigParser configParser = new ConfigParser();

    @Test
    void shouldParseEmptyConfigurationAsDefaults() {
        // When
        var config = configParser.parseConfiguration("{}");

        // Then
        assertThat(config.fetchTimeout()).isEqualTo(Duration.ofSeconds(20));
        assertThat(config.maxFindingsPerCheck()).isEqualTo(10);
        assertThat(config.metrics().enabled()).isTrue();
        assertThat(config.metrics().url()).isEqualTo(MetricsConfiguration.DEFAULT_URL);
        assertThat(config.cost().cpuPerCoreMonth()).isEqualTo(30.0);
        assertThat(config.cost().memoryPerGiBMonth()).isEqualTo(4.0);
    }

    @Test
    void shouldParseFullConfiguration() {
        // @formatter:off
        var yaml = """
                cacheTtl: 1m30s
                fetchTimeout: 5s
                maxFindingsPerCheck: 3
                metrics:
                  enabled: false
                  url: http://prometheus:9090/api/v1/query
                  timeout: 500ms
                cost:
                  cpuPerCoreMonth: 25.5
                  unusedRpsThreshold: 0.01
                """;
        // @formatter:on

        var config = configParser.parseConfiguration(yaml);

        assertThat(config.cacheTtl()).isEqualTo(Duration.ofSeconds(90));
        assertThat(config.fetchTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.maxFindingsPerCheck()).isEqualTo(3);
        assertThat(config.metrics().enabled()).isFalse();
        assertThat(config.metrics().url()).isEqualTo(URI.create("http://prometheus:9090/api/v1/query"));
        assertThat(config.metrics().timeout()).isEqualTo(Duration.ofMillis(500));
        assertThat(config.cost().cpuPerCoreMonth()).isEqualTo(25.5);
        assertThat(config.cost().memoryPerGiBMonth()).isEqualTo(4.0);
        assertThat(config.cost().unusedRpsThreshold()).isEqualTo(0.01);
    }

    @Test
    void shouldRejectUnknownProperty() {
        assertThatThrownBy(() -> configParser.parseConfiguration("cacheTTL: 30s"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Couldn't parse configuration");
    }

    @Test
    void shouldRejectMalformedDuration() {
        assertThatThrownBy(() -> configParser.parseConfiguration("fetchTimeout: soon"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasStackTraceContaining("Invalid duration string: 'soon'");
    }

    @Test
    void shouldRejectSemanticallyInvalidValues() {
        assertThatThrownBy(() -> configParser.parseConfiguration("maxFindingsPerCheck: 0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasRootCauseInstanceOf(IllegalConfigurationException.class)
                .hasRootCauseMessage("'maxFindingsPerCheck' must be at least 1, was 0");
    }

    @Test
    void shouldRoundTripDurationsInCompactForm() {
        var config = new EngineConfig(Duration.ofMinutes(90), Duration.ofMillis(1500), null, null, null);

        var yaml = configParser.toYaml(config);

        assertThat(yaml).contains("cacheTtl: \"1h30m\"").contains("fetchTimeout: \"1s500ms\"");
        assertThat(configParser.parseConfiguration(yaml)).isEqualTo(config);
    }
}
