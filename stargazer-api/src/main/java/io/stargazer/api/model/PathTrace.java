/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The hop-by-hop result of tracing a path between two endpoints.
 * A trace is allowed iff it has hops and every hop is allowed; when it is blocked the last hop is the
 * first blocked one and {@link #blockedAt()} points at it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PathTrace(String source,
                        String destination,
                        List<PathHop> hops,
                        boolean allowed,
                        @Nullable PathHop blockedAt,
                        String reason) {

    public PathTrace {
        hops = List.copyOf(hops);
        boolean allAllowed = !hops.isEmpty() && hops.stream().allMatch(PathHop::allowed);
        if (allowed != allAllowed) {
            throw new IllegalArgumentException("trace verdict " + allowed + " disagrees with its hops");
        }
        if (blockedAt != null && !blockedAt.equals(hops.get(hops.size() - 1))) {
            throw new IllegalArgumentException("a blocked trace must end at its blocking hop");
        }
    }

    public static Builder builder(String source, String destination) {
        return new Builder(source, destination);
    }

    /**
     * Accumulates hops, refusing to extend a trace past its first blocked hop.
     */
    public static final class Builder {
        private final String source;
        private final String destination;
        private final List<PathHop> hops = new ArrayList<>();
        private PathHop blockedAt;

        private Builder(String source, String destination) {
            this.source = Objects.requireNonNull(source);
            this.destination = Objects.requireNonNull(destination);
        }

        /**
         * @return true if the trace may continue after this hop
         */
        public boolean append(PathHop hop) {
            if (blockedAt != null) {
                throw new IllegalStateException("trace already blocked at " + blockedAt.from() + " -> " + blockedAt.to());
            }
            hops.add(hop);
            if (!hop.allowed()) {
                blockedAt = hop;
            }
            return blockedAt == null;
        }

        public boolean isBlocked() {
            return blockedAt != null;
        }

        public PathTrace build() {
            boolean allowed = !hops.isEmpty() && blockedAt == null;
            String reason;
            if (blockedAt != null) {
                reason = blockedAt.reason();
            }
            else if (allowed) {
                reason = "Path allowed";
            }
            else {
                reason = "No connection path found";
            }
            return new PathTrace(source, destination, hops, allowed, blockedAt, reason);
        }
    }
}
