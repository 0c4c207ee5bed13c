/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api;

import io.stargazer.api.model.ResourceKind;

/**
 * Thrown when a resource the topology cannot be computed without could not be read.
 */
public class FatalFetchException extends StargazerException {

    private final ResourceKind kind;

    public FatalFetchException(ResourceKind kind, String namespace, Throwable cause) {
        super("Failed to fetch " + kind + " in " + (namespace.isEmpty() ? "all namespaces" : "namespace '" + namespace + "'")
                + ": " + cause.getMessage(), cause);
        this.kind = kind;
    }

    public ResourceKind kind() {
        return kind;
    }
}
