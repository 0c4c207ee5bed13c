/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.metrics;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.stargazer.api.SoftFetchException;
import io.stargazer.api.model.ResourceKind;
import io.stargazer.api.model.ServiceKeys;
import io.stargazer.engine.config.MetricsConfiguration;

/**
 * Reads Istio request rates over the last 24 hours from a Prometheus instant query endpoint.
 */
public class PrometheusTrafficMetrics implements TrafficMetrics {

    private static final Logger LOGGER = LoggerFactory.getLogger(PrometheusTrafficMetrics.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String ALL_NAMESPACES_QUERY = "sum(rate(istio_requests_total[24h])) by (destination_service_name, destination_service_namespace)";
    static final String NAMESPACE_QUERY = "sum(rate(istio_requests_total{destination_service_namespace=\"%s\"}[24h])) "
            + "by (destination_service_name, destination_service_namespace)";

    private final HttpClient httpClient;
    private final MetricsConfiguration configuration;

    public PrometheusTrafficMetrics(MetricsConfiguration configuration) {
        this(HttpClient.newBuilder().connectTimeout(configuration.timeout()).build(), configuration);
    }

    PrometheusTrafficMetrics(HttpClient httpClient, MetricsConfiguration configuration) {
        this.httpClient = httpClient;
        this.configuration = configuration;
    }

    @Override
    public Map<String, Double> requestRates(String namespace) {
        var query = namespace.isEmpty() ? ALL_NAMESPACES_QUERY : NAMESPACE_QUERY.formatted(namespace);
        var request = HttpRequest.newBuilder(queryUri(query))
                .timeout(configuration.timeout())
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new SoftFetchException(ResourceKind.METRICS, "Prometheus returned HTTP " + response.statusCode(), null);
            }
            return parse(response.body());
        }
        catch (IOException e) {
            throw new SoftFetchException(ResourceKind.METRICS, "Prometheus query failed: " + e.getMessage(), e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SoftFetchException(ResourceKind.METRICS, "Interrupted querying Prometheus", e);
        }
    }

    URI queryUri(String query) {
        return URI.create(configuration.url() + "?query=" + URLEncoder.encode(query, StandardCharsets.UTF_8));
    }

    static Map<String, Double> parse(String body) throws IOException {
        JsonNode root = MAPPER.readTree(body);
        if (!"success".equals(root.path("status").asText())) {
            throw new IOException("query status was '" + root.path("status").asText() + "'");
        }
        var rates = new HashMap<String, Double>();
        for (JsonNode sample : root.path("data").path("result")) {
            var metric = sample.path("metric");
            var name = metric.path("destination_service_name").asText("");
            if (name.isEmpty()) {
                continue;
            }
            var key = ServiceKeys.of(metric.path("destination_service_namespace").asText(""), name);
            var value = sample.path("value").path(1).asText("");
            try {
                rates.put(key, Double.parseDouble(value));
            }
            catch (NumberFormatException e) {
                LOGGER.debug("Ignoring unparseable rate '{}' for {}", value, key);
            }
        }
        return rates;
    }
}
