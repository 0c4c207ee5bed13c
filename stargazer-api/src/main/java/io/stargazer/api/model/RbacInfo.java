/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.List;

public record RbacInfo(List<RoleBindingInfo> roleBindings,
                       List<RoleBindingInfo> clusterRoleBindings,
                       List<ServiceAccountInfo> serviceAccounts) {

    public RbacInfo {
        roleBindings = List.copyOf(roleBindings);
        clusterRoleBindings = List.copyOf(clusterRoleBindings);
        serviceAccounts = List.copyOf(serviceAccounts);
    }

    public static RbacInfo empty() {
        return new RbacInfo(List.of(), List.of(), List.of());
    }
}
