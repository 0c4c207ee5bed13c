/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.recommend;

import java.util.List;
import java.util.Locale;

import io.stargazer.api.model.Category;
import io.stargazer.api.model.CheckResult;
import io.stargazer.api.model.Fix;
import io.stargazer.api.model.PolicyEngine;
import io.stargazer.api.model.PolicyRule;
import io.stargazer.api.model.Severity;
import io.stargazer.api.model.TopologyData;

/**
 * With Istio present, no AuthorizationPolicy should simply allow everything.
 */
class MeshAuthorizationCheck extends AbstractBestPractice {

    static final String AUTHORIZATION_POLICY = "AuthorizationPolicy";

    MeshAuthorizationCheck() {
        super("istio-authz-001", "Istio AuthorizationPolicies Should Be Restrictive", Category.SECURITY, Severity.HIGH);
    }

    @Override
    public CheckResult check(TopologyData topology) {
        if (!topology.infrastructure().istioEnabled()) {
            return passed();
        }
        var allowAll = topology.policies(PolicyEngine.MESH).stream()
                .filter(rule -> AUTHORIZATION_POLICY.equals(rule.kind()))
                .map(PolicyRule::name)
                .filter(name -> name.toLowerCase(Locale.ROOT).contains("allow-all"))
                .findFirst();
        if (allowAll.isEmpty()) {
            return passed();
        }
        return failed(finding(id(),
                "Replace allow-all AuthorizationPolicy with restrictive policies",
                "AuthorizationPolicy %s allows all traffic. Replace it with namespace or service specific policies.".formatted(allowAll.get()),
                new Fix(PolicyTemplates.namespaceAuthorizationPolicy(), null, List.of(
                        "1. Identify which services need to communicate",
                        "2. Create namespace-specific AuthorizationPolicies",
                        "3. Remove the allow-all policy",
                        "4. Test connectivity after changes")),
                "Restricts service-to-service communication to only necessary paths, reducing attack surface"));
    }
}
