/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.recommend;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import io.stargazer.api.model.Category;
import io.stargazer.api.model.CheckResult;
import io.stargazer.api.model.ConnectivityEdge;
import io.stargazer.api.model.Fix;
import io.stargazer.api.model.Recommendation;
import io.stargazer.api.model.ServiceKeys;
import io.stargazer.api.model.Severity;
import io.stargazer.api.model.TopologyData;

/**
 * More than 10% of edges being blocked suggests misconfiguration rather than intentional lockdown.
 * Each blocked service-to-service edge is reported with an allow policy as its fix.
 */
class BlockedConnectionsCheck extends AbstractBestPractice {

    static final double MAX_BLOCKED_RATIO = 0.10;

    BlockedConnectionsCheck() {
        super("blocked-001", "Resolve Blocked Connections", Category.RESILIENCE, Severity.HIGH);
    }

    @Override
    public CheckResult check(TopologyData topology) {
        var summary = topology.summary();
        var ratioOk = summary.totalConnections() == 0 || (double) summary.blockedConnections() / summary.totalConnections() <= MAX_BLOCKED_RATIO;
        var cilium = topology.infrastructure().ciliumEnabled();
        var findings = new ArrayList<Recommendation>();
        for (ConnectivityEdge edge : topology.allEdges()) {
            var source = topology.services().get(edge.from());
            if (edge.allowed() || source == null || ServiceKeys.isGateway(edge.to())) {
                continue;
            }
            var targetNamespace = ServiceKeys.namespaceOf(edge.to());
            var targetName = ServiceKeys.nameOf(edge.to());
            var policies = List.copyOf(new LinkedHashSet<>(edge.blockingPolicies()));
            var ports = edge.port() == null ? List.<String> of() : List.of(portNumber(edge.port()));
            var description = new StringBuilder("Connection from %s to %s is blocked".formatted(source.key(), edge.to()));
            if (!policies.isEmpty()) {
                description.append(" by policy(ies): ").append(String.join(", ", policies));
            }
            if (!ports.isEmpty()) {
                description.append(" on port(s): ").append(String.join(", ", ports));
            }
            if (edge.heuristic()) {
                description.append(" (inferred from policy names)");
            }
            var template = PolicyTemplates.allowConnection(source, targetNamespace.isEmpty() ? source.namespace() : targetNamespace, targetName, ports,
                    cilium);
            var fix = Fix.ofTemplate(template);
            findings.add(finding(id() + "-" + source.key() + "-to-" + edge.to(),
                    "Blocked connection: %s -> %s".formatted(source.key(), edge.to()),
                    description.toString(),
                    source.key(),
                    source.namespace(),
                    new Fix(fix.template(), fix.applyCommand(), List.of(
                            "1. Review blocking policy(ies): " + String.join(", ", policies),
                            "2. Update policy to allow connection from %s to %s".formatted(source.key(), edge.to()),
                            "3. Verify connection works after policy update",
                            "4. Use the path tracer to verify end-to-end connectivity")),
                    "Restores connectivity between %s and %s".formatted(source.key(), edge.to())));
        }
        return new CheckResult(id(), name(), ratioOk, findings);
    }

    /**
     * Strips the name and protocol from a port written as {@code name:port/PROTO} or {@code port/PROTO}.
     */
    static String portNumber(String port) {
        var withoutProtocol = port.contains("/") ? port.substring(0, port.indexOf('/')) : port;
        return withoutProtocol.substring(withoutProtocol.lastIndexOf(':') + 1);
    }
}
