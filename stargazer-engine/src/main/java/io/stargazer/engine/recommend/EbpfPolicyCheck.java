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
 * With Cilium as the CNI, connectivity should not rely on NetworkPolicies alone.
 */
class EbpfPolicyCheck extends AbstractBestPractice {

    EbpfPolicyCheck() {
        super("cilium-cnp-001", "Use Cilium Network Policies for Advanced Features", Category.SECURITY, Severity.MEDIUM);
    }

    @Override
    public CheckResult check(TopologyData topology) {
        if (!topology.infrastructure().ciliumEnabled()
                || !topology.policies(PolicyEngine.EBPF).isEmpty()
                || topology.policies(PolicyEngine.NATIVE).isEmpty()) {
            return passed();
        }
        return failed(finding(id(),
                "Consider using CiliumNetworkPolicies for advanced features",
                "Cilium is detected but only Kubernetes NetworkPolicies are in use. CiliumNetworkPolicies offer L7 filtering and DNS-based rules.",
                new Fix(PolicyTemplates.ciliumL7Policy(), null, List.of(
                        "1. Review existing NetworkPolicies",
                        "2. Convert to CiliumNetworkPolicy for L7 features",
                        "3. Test connectivity after migration",
                        "4. Consider CiliumClusterwideNetworkPolicy for cluster-wide rules")),
                "Enables L7-aware policies, DNS-based rules, and better observability with Hubble"));
    }
}
