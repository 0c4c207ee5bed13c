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
import io.stargazer.api.model.Severity;
import io.stargazer.api.model.TopologyData;

/**
 * With Istio present, external traffic should leave through an egress gateway.
 */
class EgressGatewayCheck extends AbstractBestPractice {

    EgressGatewayCheck() {
        super("egress-001", "Egress Should Route Through Gateway", Category.SECURITY, Severity.MEDIUM);
    }

    @Override
    public CheckResult check(TopologyData topology) {
        if (!topology.infrastructure().istioEnabled() || topology.egress().hasEgressGateway()) {
            return passed();
        }
        return failed(finding(id(),
                "Consider routing egress through Istio EgressGateway",
                "Services are accessing external resources directly. Routing through EgressGateway provides better control, monitoring, and policy enforcement.",
                new Fix(PolicyTemplates.egressServiceEntry(), null, List.of(
                        "1. Deploy Istio EgressGateway (if not already deployed)",
                        "2. Create ServiceEntry for external services that need access",
                        "3. Create VirtualService to route traffic through gateway",
                        "4. Update DestinationRule for egress traffic",
                        "5. Test external connectivity")),
                "Provides centralized control, monitoring, and policy enforcement for external traffic"));
    }
}
