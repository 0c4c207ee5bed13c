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
 * With Istio present, a mesh-wide PeerAuthentication in the root namespace should enforce mTLS.
 */
class MeshMtlsCheck extends AbstractBestPractice {

    static final String PEER_AUTHENTICATION = "PeerAuthentication";
    static final String MESH_ROOT_NAMESPACE = "istio-system";

    MeshMtlsCheck() {
        super("istio-mtls-001", "Istio mTLS Should Be STRICT", Category.SECURITY, Severity.HIGH);
    }

    @Override
    public CheckResult check(TopologyData topology) {
        if (!topology.infrastructure().istioEnabled()) {
            return passed();
        }
        var meshWide = topology.policies(PolicyEngine.MESH).stream()
                .anyMatch(rule -> PEER_AUTHENTICATION.equals(rule.kind()) && MESH_ROOT_NAMESPACE.equals(rule.namespace()));
        if (meshWide) {
            return passed();
        }
        return failed(finding(id(),
                "Enable STRICT mTLS mode in Istio",
                "Istio is detected but no mesh-wide PeerAuthentication found. Create one with STRICT mTLS mode.",
                new Fix(PolicyTemplates.strictPeerAuthentication(), null, List.of(
                        "1. Start with PERMISSIVE mode to verify all services work",
                        "2. Monitor for any connection issues",
                        "3. Gradually migrate namespaces to STRICT mode",
                        "4. Update PeerAuthentication to STRICT once verified")),
                "Enforces mutual TLS between all services, preventing unauthorized access even if network policies are bypassed"));
    }
}
