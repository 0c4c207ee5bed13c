/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.fetch;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Null-safe navigation of the untyped content of custom resources.
 * Any missing or mistyped step yields the empty default instead of throwing.
 */
public final class GenericResources {

    private GenericResources() {
    }

    public static Optional<Object> nested(GenericKubernetesResource resource, String... path) {
        Object current = resource.getAdditionalProperties();
        return nested(current, path);
    }

    public static Optional<Object> nested(Object root, String... path) {
        Object current = root;
        for (String step : path) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(step);
        }
        return Optional.ofNullable(current);
    }

    public static String string(Object root, String... path) {
        return nested(root, path).map(Object::toString).orElse("");
    }

    public static String string(GenericKubernetesResource resource, String... path) {
        return string((Object) resource.getAdditionalProperties(), path);
    }

    public static List<Object> list(Object root, String... path) {
        return nested(root, path)
                .filter(List.class::isInstance)
                .<List<Object>> map(GenericResources::uncheckedList)
                .orElse(List.of());
    }

    public static List<Object> list(GenericKubernetesResource resource, String... path) {
        return list((Object) resource.getAdditionalProperties(), path);
    }

    public static Map<String, String> stringMap(Object root, String... path) {
        return nested(root, path)
                .filter(Map.class::isInstance)
                .map(value -> {
                    var result = new TreeMap<String, String>();
                    ((Map<?, ?>) value).forEach((k, v) -> result.put(String.valueOf(k), String.valueOf(v)));
                    return (Map<String, String>) result;
                })
                .orElse(Map.of());
    }

    public static String namespace(HasMetadata resource) {
        return Optional.ofNullable(resource.getMetadata().getNamespace()).orElse("");
    }

    public static Map<String, String> labels(HasMetadata resource) {
        return Optional.ofNullable(resource.getMetadata().getLabels()).orElse(Map.of());
    }

    public static Map<String, String> annotations(HasMetadata resource) {
        return Optional.ofNullable(resource.getMetadata().getAnnotations()).orElse(Map.of());
    }

    @SuppressWarnings("unchecked")
    private static List<Object> uncheckedList(Object value) {
        return (List<Object>) value;
    }
}
