/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.List;

/**
 * A role binding or cluster role binding. {@code namespace} is empty for the latter.
 */
public record RoleBindingInfo(String name,
                              String namespace,
                              String roleKind,
                              String roleName,
                              List<SubjectInfo> subjects) {

    public RoleBindingInfo {
        subjects = List.copyOf(subjects);
    }
}
