/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A directed allow/block verdict between two graph vertices.
 *
 * @param from source key
 * @param to target key
 * @param allowed the verdict
 * @param reason human readable explanation
 * @param blockingPolicies names of the rules responsible for a block
 * @param viaServiceMesh whether the source routes its calls through a mesh
 * @param meshType which mesh
 * @param port {@code port/PROTOCOL} of the target, when known
 * @param heuristic whether the verdict relied on the policy name heuristic rather than structured rules
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectivityEdge(String from,
                               String to,
                               boolean allowed,
                               String reason,
                               List<String> blockingPolicies,
                               boolean viaServiceMesh,
                               MeshType meshType,
                               @Nullable String port,
                               boolean heuristic) {

    public ConnectivityEdge {
        Objects.requireNonNull(from);
        Objects.requireNonNull(to);
        reason = reason == null ? "" : reason;
        blockingPolicies = blockingPolicies == null ? List.of() : List.copyOf(blockingPolicies);
        meshType = meshType == null ? MeshType.NONE : meshType;
        if (allowed && !blockingPolicies.isEmpty()) {
            throw new IllegalArgumentException("an allowed edge cannot have blocking policies");
        }
    }

    public boolean blocked() {
        return !allowed;
    }
}
