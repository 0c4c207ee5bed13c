/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The pod security standard a service's backing pods satisfy.
 */
public enum PodSecurityTier {
    PRIVILEGED,
    BASELINE,
    RESTRICTED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
