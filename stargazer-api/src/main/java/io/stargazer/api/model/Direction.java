/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

/**
 * A traffic direction relative to the workloads a policy selects.
 */
public enum Direction {
    INGRESS,
    EGRESS
}
