/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathTraceTest {

    private static final PathHop ALLOWED = new PathHop("ingress-gateway", "ns1/web", HopKind.INGRESS, true, "No policy blocking", List.of(), null);
    private static final PathHop BLOCKED = new PathHop("ns1/web", "ns1/api", HopKind.SERVICE, false, "Blocked by deny-all", List.of("deny-all"), null);

    @Test
    void allowedWhenEveryHopIsAllowed() {
        // Given
        var builder = PathTrace.builder("ingress-gateway", "ns1/web");

        // When
        var more = builder.append(ALLOWED);
        var trace = builder.build();

        // Then
        assertThat(more).isTrue();
        assertThat(trace.allowed()).isTrue();
        assertThat(trace.blockedAt()).isNull();
        assertThat(trace.reason()).isEqualTo("Path allowed");
    }

    @Test
    void stopsAtFirstBlockedHop() {
        // Given
        var builder = PathTrace.builder("ingress-gateway", "ns1/api");
        builder.append(ALLOWED);

        // When
        var more = builder.append(BLOCKED);

        // Then
        assertThat(more).isFalse();
        assertThat(builder.isBlocked()).isTrue();
        assertThatThrownBy(() -> builder.append(ALLOWED)).isInstanceOf(IllegalStateException.class);
        var trace = builder.build();
        assertThat(trace.hops()).containsExactly(ALLOWED, BLOCKED);
        assertThat(trace.allowed()).isFalse();
        assertThat(trace.blockedAt()).isEqualTo(BLOCKED);
        assertThat(trace.reason()).isEqualTo("Blocked by deny-all");
    }

    @Test
    void emptyTraceIsNotAllowed() {
        var trace = PathTrace.builder("a", "b").build();

        assertThat(trace.allowed()).isFalse();
        assertThat(trace.reason()).isEqualTo("No connection path found");
    }

    @Test
    void rejectsVerdictThatDisagreesWithHops() {
        var hops = List.of(ALLOWED, BLOCKED);
        assertThatThrownBy(() -> new PathTrace("a", "b", hops, true, null, "x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PathTrace("a", "b", hops, false, ALLOWED, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void hopFromEdgeKeepsMeshOnlyWhenRoutedThroughIt() {
        var viaMesh = new ConnectivityEdge("ns1/a", "ns1/b", true, "ok", List.of(), true, MeshType.ISTIO, null, false);
        var direct = new ConnectivityEdge("ns1/a", "ns1/b", true, "ok", List.of(), false, MeshType.ISTIO, null, false);

        assertThat(PathHop.fromEdge(HopKind.SERVICE, viaMesh).meshType()).isEqualTo(MeshType.ISTIO);
        assertThat(PathHop.fromEdge(HopKind.SERVICE, direct).meshType()).isNull();
    }
}
