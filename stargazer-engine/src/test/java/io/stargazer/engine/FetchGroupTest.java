/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.stargazer.api.FatalFetchException;
import io.stargazer.api.SoftFetchException;
import io.stargazer.api.model.ResourceKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class FetchGroupTest {

    private ExecutorService executor;
    private final CountDownLatch release = new CountDownLatch(1);
    private final CountDownLatch started = new CountDownLatch(1);
    private final AtomicBoolean interrupted = new AtomicBoolean();

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    @Test
    void shouldReturnValuesWithoutWarnings() {
        // Given
        var group = new FetchGroup(executor, "ns1", Duration.ofSeconds(5));
        var services = group.essential(ResourceKind.SERVICES, () -> List.of("web"));
        var policies = group.optional(ResourceKind.NETWORK_POLICIES, () -> List.of("deny"), List.<String> of());

        // When/Then
        assertThat(services.get()).containsExactly("web");
        assertThat(policies.get()).containsExactly("deny");
        assertThat(group.warnings()).isEmpty();
    }

    @Test
    void shouldFallBackAndWarnWhenOptionalFetchFails() {
        // Given
        var group = new FetchGroup(executor, "ns1", Duration.ofSeconds(5));
        var policies = group.optional(ResourceKind.NETWORK_POLICIES, () -> {
            throw new SoftFetchException(ResourceKind.NETWORK_POLICIES, "forbidden", null);
        }, List.<String> of());

        // When
        var result = policies.get();

        // Then
        assertThat(result).isEmpty();
        assertThat(group.warnings()).containsExactly("NETWORK_POLICIES: forbidden");
    }

    @Test
    void shouldTurnUnexpectedOptionalFailureIntoWarning() {
        // Given
        var group = new FetchGroup(executor, "ns1", Duration.ofSeconds(5));
        var rbac = group.optional(ResourceKind.RBAC, () -> {
            throw new IllegalStateException("boom");
        }, "none");

        // When/Then
        assertThat(rbac.get()).isEqualTo("none");
        assertThat(group.warnings()).containsExactly("RBAC: boom");
    }

    @Test
    void shouldFallBackWhenOptionalFetchMissesDeadline() throws InterruptedException {
        // Given
        var group = new FetchGroup(executor, "ns1", Duration.ofMillis(50));
        var metrics = group.optional(ResourceKind.METRICS, this::blockUntilReleased, "fallback");
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        // When/Then
        assertThat(metrics.get()).isEqualTo("fallback");
        assertThat(group.warnings()).containsExactly("METRICS: timed out");
        await().atMost(Duration.ofSeconds(5)).untilTrue(interrupted);
    }

    @Test
    void shouldFailFatallyWhenEssentialFetchFails() {
        // Given
        var group = new FetchGroup(executor, "ns1", Duration.ofSeconds(5));
        var services = group.essential(ResourceKind.SERVICES, () -> {
            throw new IllegalStateException("forbidden");
        });

        // When/Then
        assertThatThrownBy(services::get)
                .isInstanceOf(FatalFetchException.class)
                .hasMessageStartingWith("Failed to fetch SERVICES in namespace 'ns1'")
                .extracting(e -> ((FatalFetchException) e).kind())
                .isEqualTo(ResourceKind.SERVICES);
    }

    @Test
    void shouldCancelRemainingFetchesAndReportFirstFatalFailure() throws InterruptedException {
        // Given
        var group = new FetchGroup(executor, "", Duration.ofSeconds(5));
        var pods = group.essential(ResourceKind.PODS, this::blockUntilReleased);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        var services = group.essential(ResourceKind.SERVICES, () -> {
            throw new IllegalStateException("forbidden");
        });
        assertThatThrownBy(services::get).isInstanceOf(FatalFetchException.class);

        // When/Then
        await().atMost(Duration.ofSeconds(5)).untilTrue(interrupted);
        assertThatThrownBy(pods::get)
                .isInstanceOf(FatalFetchException.class)
                .hasMessageStartingWith("Failed to fetch SERVICES in all namespaces")
                .extracting(e -> ((FatalFetchException) e).kind())
                .isEqualTo(ResourceKind.SERVICES);
    }

    @Test
    void shouldCancelFetchesSubmittedAfterFatalFailure() {
        // Given
        var group = new FetchGroup(executor, "ns1", Duration.ofSeconds(5));
        var services = group.essential(ResourceKind.SERVICES, () -> {
            throw new IllegalStateException("forbidden");
        });
        assertThatThrownBy(services::get).isInstanceOf(FatalFetchException.class);
        var ran = new AtomicBoolean();

        // When
        var rbac = group.optional(ResourceKind.RBAC, () -> ran.getAndSet(true), false);

        // Then
        assertThat(rbac.get()).isFalse();
        assertThat(ran).isFalse();
        assertThat(group.warnings()).containsExactly("RBAC: cancelled");
    }

    @Test
    void shouldFailFatallyWhenEssentialFetchMissesDeadline() {
        // Given
        var group = new FetchGroup(executor, "ns1", Duration.ofMillis(50));
        var pods = group.essential(ResourceKind.PODS, this::blockUntilReleased);

        // When/Then
        assertThatThrownBy(pods::get)
                .isInstanceOf(FatalFetchException.class)
                .extracting(e -> ((FatalFetchException) e).kind())
                .isEqualTo(ResourceKind.PODS);
    }

    private String blockUntilReleased() {
        started.countDown();
        try {
            release.await();
        }
        catch (InterruptedException e) {
            interrupted.set(true);
            Thread.currentThread().interrupt();
        }
        return "late";
    }
}
