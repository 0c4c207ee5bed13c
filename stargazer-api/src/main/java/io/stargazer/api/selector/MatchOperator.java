/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.selector;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The operator in a {@link MatchExpression}.
 */
public enum MatchOperator {
    @JsonProperty("Exists")
    EXISTS("Exists"),
    @JsonProperty("DoesNotExist")
    NOT_EXISTS("DoesNotExist"),
    @JsonProperty("In")
    IN("In"),
    @JsonProperty("NotIn")
    NOT_IN("NotIn");

    private final String kubernetesName;

    MatchOperator(String kubernetesName) {
        this.kubernetesName = kubernetesName;
    }

    /**
     * Looks up an operator by the name used in a Kubernetes {@code LabelSelectorRequirement}.
     * @param kubernetesName e.g. {@code NotIn}
     * @return the operator
     * @throws IllegalArgumentException if the name is not a known operator
     */
    public static MatchOperator fromKubernetesName(String kubernetesName) {
        return Arrays.stream(values())
                .filter(op -> op.kubernetesName.equals(kubernetesName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown selector operator '" + kubernetesName + "'"));
    }
}
