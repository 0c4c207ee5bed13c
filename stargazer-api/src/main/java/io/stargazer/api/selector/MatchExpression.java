/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.selector;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * An expression involving a single label key within a {@link Selector}.
 * @param key The label key
 * @param operator The operator
 * @param values The values for the operator. This must be null iff the operator is
 * {@link MatchOperator#EXISTS} or {@link MatchOperator#NOT_EXISTS}.
 */
@JsonPropertyOrder({ "key", "operator", "values" })
public record MatchExpression(
                              @JsonProperty(value = "key", required = true) @NonNull String key,
                              @JsonProperty(value = "operator", required = true) @NonNull MatchOperator operator,
                              @JsonProperty("values") @Nullable Set<String> values)
        implements Predicate<Map<String, String>> {

    @NonNull
    public static MatchExpression exists(@NonNull String key) {
        return new MatchExpression(key, MatchOperator.EXISTS, null);
    }

    @NonNull
    public static MatchExpression notExists(@NonNull String key) {
        return new MatchExpression(key, MatchOperator.NOT_EXISTS, null);
    }

    @NonNull
    public static MatchExpression in(@NonNull String key, @NonNull Set<String> values) {
        return new MatchExpression(key, MatchOperator.IN, values);
    }

    @NonNull
    public static MatchExpression notIn(@NonNull String key, @NonNull Set<String> values) {
        return new MatchExpression(key, MatchOperator.NOT_IN, values);
    }

    public MatchExpression {
        Objects.requireNonNull(key);
        Objects.requireNonNull(operator);
        if ((operator == MatchOperator.EXISTS
                || operator == MatchOperator.NOT_EXISTS) && values != null) {
            throw new IllegalArgumentException("operator " + operator + " does not take values");
        }
        if (operator == MatchOperator.IN
                || operator == MatchOperator.NOT_IN) {
            values = Set.copyOf(Objects.requireNonNull(values));
        }
    }

    Set<String> nonNullValues() {
        return values == null ? Set.of() : values;
    }

    /**
     * Returns the string form of this expression, for example "foo in (x,y)", "foo==x" (for an {@link MatchOperator#IN}
     * expression with a single value) or "foo" (for an {@link MatchOperator#EXISTS} expression).
     * @return the string form of this expression.
     */
    @Override
    public String toString() {
        return switch (operator()) {
            case EXISTS -> key();
            case NOT_EXISTS -> "!" + key();
            case IN -> values().size() == 1 ? key() + "==" + values().iterator().next()
                    : key() + " in " + values().stream().sorted().collect(Collectors.joining(",", "(", ")"));
            case NOT_IN -> values().size() == 1 ? key() + "!=" + values().iterator().next()
                    : key() + " notin " + values().stream().sorted().collect(Collectors.joining(",", "(", ")"));
        };
    }

    /**
     * Test whether this expression matches the given labels.
     * @param labels the labels of a workload
     * @return true iff this expression matches the given labels
     */
    @Override
    public boolean test(Map<String, String> labels) {
        return switch (operator) {
            case EXISTS -> labels.containsKey(key());
            case NOT_EXISTS -> !labels.containsKey(key());
            case IN -> labels.containsKey(key()) && nonNullValues().contains(labels.get(key()));
            case NOT_IN -> !labels.containsKey(key()) || !nonNullValues().contains(labels.get(key()));
        };
    }
}
