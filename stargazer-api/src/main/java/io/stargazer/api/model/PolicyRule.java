/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * One policy object, normalized across engines.
 * Only native policies retain structure ({@link #nativeSpec()}); other engines are known by
 * identity alone and judged by the name heuristic {@link #nameSuggestsBlocking()}.
 *
 * @param engine the engine the object belongs to
 * @param kind the resource kind, e.g. {@code NetworkPolicy}, {@code AuthorizationPolicy}
 * @param name object name
 * @param namespace object namespace, empty for cluster-scoped objects
 * @param nativeSpec retained structure, present only for {@link PolicyEngine#NATIVE} rules and only when readable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyRule(PolicyEngine engine,
                         String kind,
                         String name,
                         String namespace,
                         @Nullable NativePolicySpec nativeSpec) {

    public PolicyRule {
        Objects.requireNonNull(engine);
        Objects.requireNonNull(name);
        kind = kind == null ? "" : kind;
        namespace = namespace == null ? "" : namespace;
        if (nativeSpec != null && engine != PolicyEngine.NATIVE) {
            throw new IllegalArgumentException("only native policies carry structured rules, got " + engine);
        }
    }

    public static PolicyRule nativePolicy(String name, String namespace, @Nullable NativePolicySpec spec) {
        return new PolicyRule(PolicyEngine.NATIVE, "NetworkPolicy", name, namespace, spec);
    }

    @JsonIgnore
    public boolean isClusterScoped() {
        return namespace.isEmpty();
    }

    /**
     * @return true if this rule is in the given namespace or is cluster-scoped.
     */
    public boolean appliesToNamespace(String ns) {
        return isClusterScoped() || namespace.equals(ns);
    }

    /**
     * The name heuristic used whenever structured rules are unavailable.
     */
    @JsonIgnore
    public boolean nameSuggestsBlocking() {
        var lower = name.toLowerCase(Locale.ROOT);
        return lower.contains("deny") || lower.contains("block");
    }
}
