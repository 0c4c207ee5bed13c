/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

/**
 * Headline numbers of a topology. Coverage figures are rendered as whole percentages, e.g. {@code 75%}.
 */
public record TopologySummary(int totalServices,
                              int servicesWithMesh,
                              int totalConnections,
                              int allowedConnections,
                              int blockedConnections,
                              String meshCoverage,
                              String ciliumCoverage,
                              String istioCoverage) {}
