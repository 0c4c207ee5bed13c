/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HopKind {
    INGRESS,
    SERVICE,
    EGRESS;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
