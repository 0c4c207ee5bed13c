/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api;

import io.stargazer.api.model.ResourceKind;

/**
 * A resource the topology can do without could not be read.
 * This never reaches callers of the engine: it is turned into a warning on the topology.
 */
public class SoftFetchException extends StargazerException {

    private final ResourceKind kind;

    public SoftFetchException(ResourceKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ResourceKind kind() {
        return kind;
    }

    /**
     * @return the warning recorded on the topology for this failure
     */
    public String warning() {
        return kind + ": " + getMessage();
    }
}
