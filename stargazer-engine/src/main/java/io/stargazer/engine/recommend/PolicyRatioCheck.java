/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.recommend;

import io.stargazer.api.model.Category;
import io.stargazer.api.model.CheckResult;
import io.stargazer.api.model.Fix;
import io.stargazer.api.model.PolicyEngine;
import io.stargazer.api.model.Severity;
import io.stargazer.api.model.TopologyData;

/**
 * Fewer than one connectivity policy per two services suggests most traffic is unrestricted.
 */
class PolicyRatioCheck extends AbstractBestPractice {

    PolicyRatioCheck() {
        super("np-002", "Policy To Service Ratio", Category.SECURITY, Severity.MEDIUM);
    }

    @Override
    public CheckResult check(TopologyData topology) {
        int services = topology.services().size();
        int policies = topology.policies(PolicyEngine.NATIVE).size() + topology.policies(PolicyEngine.EBPF).size();
        if (services == 0 || policies * 2 >= services) {
            return passed();
        }
        return failed(finding(id(),
                "Low policy to service ratio",
                "Only %d connectivity policies cover %d services (target: at least one policy per two services).".formatted(policies, services),
                Fix.manual("1. List services without coverage: stargazer recommendations",
                        "2. Start with a default-deny NetworkPolicy per namespace",
                        "3. Add allow rules for the connections each service needs"),
                "Reduces the number of services reachable without any policy check"));
    }
}
