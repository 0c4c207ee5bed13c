/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.watch;

import io.stargazer.api.model.PolicyChangeEvent;

/**
 * Receives a notification whenever a watched policy resource is added, modified or deleted.
 * Called from informer threads.
 */
@FunctionalInterface
public interface PolicyChangeListener {

    void onPolicyChange(PolicyChangeEvent event);
}
