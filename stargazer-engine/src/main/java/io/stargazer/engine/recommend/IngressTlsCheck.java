/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.recommend;

import java.util.ArrayList;
import java.util.List;

import io.stargazer.api.model.Category;
import io.stargazer.api.model.CheckResult;
import io.stargazer.api.model.Fix;
import io.stargazer.api.model.GatewayObject;
import io.stargazer.api.model.GatewayRoute;
import io.stargazer.api.model.Recommendation;
import io.stargazer.api.model.RouteKind;
import io.stargazer.api.model.ServiceKeys;
import io.stargazer.api.model.Severity;
import io.stargazer.api.model.TopologyData;

/**
 * Every Kubernetes Ingress should terminate TLS.
 */
class IngressTlsCheck extends AbstractBestPractice {

    static final String INGRESS_KIND = "Ingress";

    IngressTlsCheck() {
        super("ingress-001", "Ingress Should Use TLS", Category.SECURITY, Severity.CRITICAL);
    }

    @Override
    public CheckResult check(TopologyData topology) {
        var certManager = topology.services().values().stream().anyMatch(service -> service.namespace().contains("cert-manager"));
        var findings = new ArrayList<Recommendation>();
        for (GatewayObject ingress : topology.ingress().gateways()) {
            if (!INGRESS_KIND.equals(ingress.kind()) || ingress.tls()) {
                continue;
            }
            var template = PolicyTemplates.tlsIngress(ingress, backend(topology.ingress().gateway().routes(), ingress), certManager);
            findings.add(finding(id() + "-" + ingress.name(),
                    "Ingress %s/%s missing TLS configuration".formatted(ingress.namespace(), ingress.name()),
                    "This ingress route does not have TLS configured, exposing traffic in plaintext",
                    null,
                    ingress.namespace(),
                    new Fix(template, null, List.of(
                            "1. Ensure cert-manager is installed (check cert-manager namespace)",
                            "2. Verify ClusterIssuer exists: kubectl get clusterissuer",
                            "3. Add TLS section to ingress spec with cert-manager annotation",
                            "4. Wait for certificate to be issued")),
                    "Encrypts traffic between clients and services, preventing man-in-the-middle attacks"));
        }
        return result(findings);
    }

    private static String backend(List<GatewayRoute> routes, GatewayObject ingress) {
        return routes.stream()
                .filter(route -> route.kind() == RouteKind.KUBERNETES_INGRESS)
                .filter(route -> route.source().equals(ingress.name()) && route.namespace().equals(ingress.namespace()))
                .map(route -> ServiceKeys.nameOf(route.target()))
                .findFirst()
                .orElse(PolicyTemplates.APP_PLACEHOLDER);
    }
}
