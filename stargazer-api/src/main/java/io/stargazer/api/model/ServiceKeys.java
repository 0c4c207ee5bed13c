/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Identities of the vertices of the connectivity graph.
 * Services are keyed {@code namespace/name} (or bare {@code name} when namespace-less),
 * gateways by their fixed synthetic names.
 */
public final class ServiceKeys {

    public static final String INGRESS_GATEWAY = "ingress-gateway";
    public static final String EGRESS_GATEWAY = "egress-gateway";
    public static final String EXTERNAL = "external";

    private ServiceKeys() {
    }

    public static String of(@Nullable String namespace, String name) {
        if (namespace == null || namespace.isEmpty()) {
            return name;
        }
        return namespace + "/" + name;
    }

    /**
     * Qualifies a possibly bare service name with the given namespace.
     * @param nameOrKey {@code name} or {@code namespace/name}
     * @param namespace namespace to apply to a bare name, may be empty
     * @return the key
     */
    public static String qualify(String nameOrKey, @Nullable String namespace) {
        if (nameOrKey.contains("/")) {
            return nameOrKey;
        }
        return of(namespace, nameOrKey);
    }

    public static boolean isGateway(String key) {
        return INGRESS_GATEWAY.equals(key) || EGRESS_GATEWAY.equals(key) || EXTERNAL.equals(key);
    }

    public static String namespaceOf(String key) {
        int slash = key.indexOf('/');
        return slash < 0 ? "" : key.substring(0, slash);
    }

    public static String nameOf(String key) {
        int slash = key.indexOf('/');
        return slash < 0 ? key : key.substring(slash + 1);
    }
}
