/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Provides {@linkplain io.stargazer.api.selector.Selector selectors} used to decide which workloads a
 * network policy applies to.
 * The semantics are exactly those of Kubernetes' label selectors.
 */
package io.stargazer.api.selector;
