/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

/**
 * A GitOps application and its reconciliation state, used only to annotate services.
 */
public record DriftApplication(String name,
                               String namespace,
                               String syncStatus,
                               String healthStatus,
                               String repoUrl,
                               String targetRevision) {}
