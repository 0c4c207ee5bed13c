/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A finding emitted by a best-practice check.
 * The {@code id} starts with the id of the check that produced it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Recommendation(String id,
                             String title,
                             String description,
                             Category category,
                             Severity severity,
                             @Nullable String targetService,
                             @Nullable String targetNamespace,
                             Fix fix,
                             String impact) {

    public Recommendation {
        Objects.requireNonNull(id);
        Objects.requireNonNull(category);
        Objects.requireNonNull(severity);
        fix = fix == null ? Fix.manual() : fix;
    }
}
