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
 * When a mesh is present at least 80% of services should be part of it.
 */
class MeshCoverageCheck extends AbstractBestPractice {

    static final int TARGET_PERCENT = 80;

    MeshCoverageCheck() {
        super("mesh-001", "Service Mesh Coverage", Category.OBSERVABILITY, Severity.MEDIUM);
    }

    @Override
    public CheckResult check(TopologyData topology) {
        var summary = topology.summary();
        if (!topology.infrastructure().meshEnabled() || summary.totalServices() == 0) {
            return passed();
        }
        int coverage = summary.servicesWithMesh() * 100 / summary.totalServices();
        if (coverage >= TARGET_PERCENT) {
            return passed();
        }
        return failed(finding(id(),
                "Low service mesh coverage",
                "Only %d%% of services are in the mesh (target: %d%%). Services outside the mesh miss mTLS, observability, and traffic management."
                        .formatted(coverage, TARGET_PERCENT),
                new Fix(PolicyTemplates.sidecarInjectionNamespace(PolicyTemplates.NAMESPACE_PLACEHOLDER), null, List.of(
                        "1. Label namespaces: kubectl label namespace <ns> istio-injection=enabled",
                        "2. Or annotate pod templates with sidecar.istio.io/inject: \"true\"",
                        "3. Restart pods to inject sidecars",
                        "4. Verify the sidecar container is present in each pod")),
                "Improves observability, security (mTLS), and traffic management capabilities"));
    }
}
