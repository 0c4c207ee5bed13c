/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.selector;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>A predicate on labels (string-to-string maps), consisting of a number of {@linkplain MatchExpression expressions}
 * that must all match in order for the selector to match.
 * This is exactly the same as Kubernetes' selector: in particular an empty selector selects every workload.</p>
 */
public final class Selector implements Predicate<Map<String, String>> {

    public static final Selector ALL = new Selector(List.of());
    private static final Selector NONE = new Selector(List.of(
            new MatchExpression("x", MatchOperator.EXISTS, null),
            new MatchExpression("x", MatchOperator.NOT_EXISTS, null)));

    private final List<MatchExpression> matchExpressions;

    private Selector(List<MatchExpression> matchExpressions) {
        this.matchExpressions = matchExpressions;
    }

    public static Selector compile(List<MatchExpression> matchExpressions) {
        if (matchExpressions.isEmpty()) {
            return ALL;
        }
        return canonicalize(matchExpressions);
    }

    /**
     * Builds a selector from the two halves of a Kubernetes {@code LabelSelector}.
     * Either argument may be null, which is treated as empty.
     */
    @JsonCreator
    public static Selector compile(
                                   @JsonProperty("matchLabels") @Nullable Map<String, String> matchLabels,
                                   @JsonProperty("matchExpressions") @Nullable List<MatchExpression> matchExpressions) {
        return compile(Stream.concat(
                matchExpressions != null ? matchExpressions.stream() : Stream.empty(),
                (matchLabels != null ? matchLabels.entrySet().stream() : Stream.<Map.Entry<String, String>> empty())
                        .map(entry -> MatchExpression.in(entry.getKey(), Set.of(entry.getValue()))))
                .toList());
    }

    /**
     * Canonicalizes the given {@code matchExpressions} returning a Selector that will match the same labels.
     * Expressions end up in alphabetic order by key with at most one expression per operator, so
     * two equal selectors match exactly the same labels and render the same {@link #toString()}.
     */
    private static Selector canonicalize(List<MatchExpression> matchExpressions) {
        var canonical = new ArrayList<MatchExpression>();
        var groupedByKey = matchExpressions.stream()
                .collect(Collectors.groupingBy(MatchExpression::key, TreeMap::new, Collectors.toList()));
        for (var entry : groupedByKey.entrySet()) {
            var key = entry.getKey();
            var exprByOperator = entry.getValue().stream().collect(Collectors.groupingBy(MatchExpression::operator));
            boolean exists = exprByOperator.containsKey(MatchOperator.EXISTS);
            boolean notExists = exprByOperator.containsKey(MatchOperator.NOT_EXISTS);
            Set<String> in = exprByOperator.getOrDefault(MatchOperator.IN, List.of()).stream()
                    .map(MatchExpression::nonNullValues)
                    .reduce(Selector::intersection)
                    .orElse(null);
            Set<String> notIn = exprByOperator.getOrDefault(MatchOperator.NOT_IN, List.of()).stream()
                    .map(MatchExpression::nonNullValues)
                    .reduce(Selector::union)
                    .orElse(null);

            if (notExists && (exists || in != null)) {
                // "!foo" can't be combined with anything requiring foo
                return NONE;
            }
            if (in != null && notIn != null) {
                in = difference(in, notIn);
                notIn = null;
            }
            if (in != null && in.isEmpty()) {
                return NONE;
            }
            if (exists && in == null) {
                canonical.add(MatchExpression.exists(key));
            }
            if (notExists) {
                canonical.add(MatchExpression.notExists(key));
            }
            else if (notIn != null) {
                canonical.add(MatchExpression.notIn(key, notIn));
            }
            if (in != null) {
                canonical.add(MatchExpression.in(key, in));
            }
        }
        return canonical.isEmpty() ? ALL : new Selector(List.copyOf(canonical));
    }

    private static <T> Set<T> union(Set<T> s1, Set<T> s2) {
        var result = new HashSet<T>(s1);
        result.addAll(s2);
        return result;
    }

    private static <T> Set<T> intersection(Set<T> s1, Set<T> s2) {
        var result = new HashSet<T>(s1);
        result.retainAll(s2);
        return result;
    }

    private static <T> Set<T> difference(Set<T> s1, Set<T> s2) {
        var result = new HashSet<T>(s1);
        result.removeAll(s2);
        return result;
    }

    /**
     * @param labels The labels to test against, null meaning no labels.
     * @return true if and only if this selector matches the given labels.
     */
    @Override
    public boolean test(@Nullable Map<String, String> labels) {
        var safe = labels == null ? Map.<String, String> of() : labels;
        for (var expr : matchExpressions) {
            if (!expr.test(safe)) {
                return false;
            }
        }
        return true;
    }

    public List<MatchExpression> matchExpressions() {
        return matchExpressions;
    }

    @Override
    public String toString() {
        return matchExpressions.stream().map(MatchExpression::toString).collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        var that = (Selector) obj;
        return Objects.equals(this.matchExpressions, that.matchExpressions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(matchExpressions);
    }
}
