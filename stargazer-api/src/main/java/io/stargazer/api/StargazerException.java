/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api;

/**
 * Base class of the exceptions thrown by the engine.
 */
public class StargazerException extends RuntimeException {

    public StargazerException(String message) {
        super(message);
    }

    public StargazerException(String message, Throwable cause) {
        super(message, cause);
    }
}
