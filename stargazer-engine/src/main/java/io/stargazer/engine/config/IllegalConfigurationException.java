/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.config;

import io.stargazer.api.StargazerException;

/**
 * Thrown when the engine configuration is syntactically valid but semantically wrong.
 */
public class IllegalConfigurationException extends StargazerException {

    public IllegalConfigurationException(String message) {
        super(message);
    }
}
