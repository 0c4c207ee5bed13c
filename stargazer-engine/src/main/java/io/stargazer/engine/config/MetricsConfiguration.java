/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.config;

import java.net.URI;
import java.time.Duration;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Where traffic metrics are queried from.
 * @param enabled whether to query metrics at all, default true
 * @param url the Prometheus instant query endpoint
 * @param timeout per-query timeout, default 10s
 */
public record MetricsConfiguration(@Nullable Boolean enabled,
                                   @Nullable URI url,
                                   @JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration timeout) {

    public static final URI DEFAULT_URL = URI.create("http://kube-prometheus-stack-prometheus.monitoring.svc.cluster.local:9090/api/v1/query");
    public static final MetricsConfiguration DEFAULT = new MetricsConfiguration(null, null, null);

    @Override
    public Boolean enabled() {
        return enabled == null || enabled;
    }

    @Override
    public URI url() {
        return url == null ? DEFAULT_URL : url;
    }

    @Override
    public Duration timeout() {
        return timeout == null ? Duration.ofSeconds(10) : timeout;
    }
}
