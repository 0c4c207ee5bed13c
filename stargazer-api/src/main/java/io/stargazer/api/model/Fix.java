/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A machine usable remediation.
 * @param template YAML of a resource that would fix the finding
 * @param applyCommand shell command applying {@code template}
 * @param manualSteps steps for an operator when no template applies
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Fix(@Nullable String template,
                  @Nullable String applyCommand,
                  List<String> manualSteps) {

    public Fix {
        manualSteps = manualSteps == null ? List.of() : List.copyOf(manualSteps);
    }

    public static Fix ofTemplate(String template) {
        return new Fix(template, "kubectl apply -f - <<EOF\n" + template + "EOF", List.of());
    }

    public static Fix manual(String... steps) {
        return new Fix(null, null, List.of(steps));
    }
}
