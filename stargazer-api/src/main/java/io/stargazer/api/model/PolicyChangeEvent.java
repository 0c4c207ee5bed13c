/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

/**
 * Emitted whenever a watched policy object changes.
 */
public record PolicyChangeEvent(EventType eventType,
                                PolicyEngine engine,
                                String kind,
                                String name,
                                String namespace) {

    public enum EventType {
        ADDED,
        MODIFIED,
        DELETED
    }
}
