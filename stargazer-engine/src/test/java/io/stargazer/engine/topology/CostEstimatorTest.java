/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.topology;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Quantity;

import io.stargazer.engine.config.CostConfiguration;

import static org.assertj.core.api.Assertions.assertThat;

class CostEstimatorTest {

    private final CostEstimator estimator = new CostEstimator(CostConfiguration.DEFAULT);

    @Test
    void sumsRequestsOverAllPods() {
        // Given
        var pods = List.of(pod("500m", "512Mi"), pod("1", "1Gi"));

        // When
        var signal = estimator.estimate(5.0, pods);

        // Then
        assertThat(signal.cpuMillicores()).isEqualTo(1500);
        assertThat(signal.memoryMiB()).isEqualTo(1536);
        assertThat(signal.likelyUnused()).isFalse();
        assertThat(signal.potentialSaving()).isEqualTo(CostEstimator.NO_SAVING);
    }

    @Test
    void idleServiceHasSaving() {
        var signal = estimator.estimate(0.0, List.of(pod("1", "1Gi")));

        assertThat(signal.likelyUnused()).isTrue();
        assertThat(signal.potentialSaving()).isEqualTo("$34.00/mo");
    }

    @Test
    void podsWithoutRequestsCostNothing() {
        var signal = estimator.estimate(0.0, List.of(new PodBuilder().withNewSpec().addNewContainer().withName("c").endContainer().endSpec().build()));

        assertThat(signal.cpuMillicores()).isZero();
        assertThat(signal.memoryMiB()).isZero();
        assertThat(signal.potentialSaving()).isEqualTo(CostEstimator.NO_SAVING);
    }

    @Test
    void configuredPricesAndThreshold() {
        var custom = new CostEstimator(new CostConfiguration(10.0, 2.0, 1.0));

        var signal = custom.estimate(0.5, List.of(pod("2", "2Gi")));

        assertThat(signal.likelyUnused()).isTrue();
        assertThat(signal.potentialSaving()).isEqualTo("$24.00/mo");
    }

    private static Pod pod(String cpu, String memory) {
        return new PodBuilder().withNewSpec()
                .addNewContainer().withName("c")
                .withNewResources().addToRequests("cpu", new Quantity(cpu)).addToRequests("memory", new Quantity(memory)).endResources()
                .endContainer()
                .endSpec().build();
    }
}
