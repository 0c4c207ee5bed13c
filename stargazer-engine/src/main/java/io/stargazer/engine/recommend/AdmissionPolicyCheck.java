/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.recommend;

import java.util.List;

import io.stargazer.api.model.Category;
import io.stargazer.api.model.CheckResult;
import io.stargazer.api.model.Fix;
import io.stargazer.api.model.PolicyEngine;
import io.stargazer.api.model.Severity;
import io.stargazer.api.model.TopologyData;

/**
 * An installed Kyverno should enforce at least one policy.
 */
class AdmissionPolicyCheck extends AbstractBestPractice {

    AdmissionPolicyCheck() {
        super("kyverno-001", "Use Kyverno for Policy-as-Code", Category.SECURITY, Severity.MEDIUM);
    }

    @Override
    public CheckResult check(TopologyData topology) {
        if (!topology.infrastructure().kyvernoEnabled() || !topology.policies(PolicyEngine.ADMISSION).isEmpty()) {
            return passed();
        }
        return failed(finding(id(),
                "Use Kyverno to enforce network policy standards",
                "Kyverno is installed but no policies detected. Use a ClusterPolicy to require NetworkPolicies in every namespace.",
                new Fix(PolicyTemplates.requireNetworkPolicyClusterPolicy(), null, List.of(
                        "1. Create a Kyverno ClusterPolicy to require NetworkPolicies",
                        "2. Start in Audit mode and review policy reports",
                        "3. Switch to Enforce once namespaces comply")),
                "Prevents services from being deployed without network isolation"));
    }
}
