/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * One step of a {@link PathTrace}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PathHop(String from,
                      String to,
                      HopKind kind,
                      boolean allowed,
                      String reason,
                      List<String> policies,
                      @Nullable MeshType meshType) {

    public PathHop {
        policies = policies == null ? List.of() : List.copyOf(policies);
    }

    public static PathHop fromEdge(HopKind kind, ConnectivityEdge edge) {
        return new PathHop(edge.from(), edge.to(), kind, edge.allowed(), edge.reason(), edge.blockingPolicies(),
                edge.viaServiceMesh() ? edge.meshType() : null);
    }
}
