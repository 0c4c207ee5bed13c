/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.cache;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import io.stargazer.api.model.ResourceKind;

/**
 * Keys under which fetched resources and computed topologies are cached.
 */
public final class CacheKeys {

    public static final String TOPOLOGY_PREFIX = "topology:";

    private CacheKeys() {
    }

    public static String topology(String namespace) {
        return TOPOLOGY_PREFIX + namespace;
    }

    /**
     * @param flags inclusion flags that change what the fetch returns, e.g. the probed API version
     */
    public static String resource(ResourceKind kind, String namespace, String... flags) {
        var key = kind.name().toLowerCase(Locale.ROOT) + ":" + namespace;
        if (flags.length == 0) {
            return key;
        }
        return key + Arrays.stream(flags).collect(Collectors.joining(",", ":", ""));
    }
}
