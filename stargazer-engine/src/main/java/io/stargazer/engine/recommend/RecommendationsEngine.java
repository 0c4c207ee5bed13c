/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.recommend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stargazer.api.model.CheckResult;
import io.stargazer.api.model.ComplianceReport;
import io.stargazer.api.model.Recommendation;
import io.stargazer.api.model.TopologyData;

/**
 * Scores a topology against a fixed, ordered set of networking best practices.
 * <p>Recommendations and the compliance score are both derived from one {@link ComplianceReport},
 * so they can never disagree.</p>
 */
public class RecommendationsEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecommendationsEngine.class);

    private final List<BestPractice> practices;
    private final int maxFindingsPerCheck;

    public RecommendationsEngine(int maxFindingsPerCheck) {
        this(defaultPractices(), maxFindingsPerCheck);
    }

    RecommendationsEngine(List<BestPractice> practices, int maxFindingsPerCheck) {
        if (maxFindingsPerCheck < 1) {
            throw new IllegalArgumentException("maxFindingsPerCheck must be at least 1, was " + maxFindingsPerCheck);
        }
        this.practices = List.copyOf(practices);
        this.maxFindingsPerCheck = maxFindingsPerCheck;
    }

    public static List<BestPractice> defaultPractices() {
        return List.of(
                new NetworkPolicyCoverageCheck(),
                new PolicyRatioCheck(),
                new IngressTlsCheck(),
                new EgressGatewayCheck(),
                new MeshMtlsCheck(),
                new MeshAuthorizationCheck(),
                new EbpfPolicyCheck(),
                new AdmissionPolicyCheck(),
                new MeshCoverageCheck(),
                new BlockedConnectionsCheck());
    }

    public List<BestPractice> practices() {
        return practices;
    }

    public ComplianceReport evaluate(TopologyData topology) {
        Objects.requireNonNull(topology, "topology");
        var results = new ArrayList<CheckResult>(practices.size());
        for (BestPractice practice : practices) {
            var result = practice.check(topology);
            if (result.findings().size() > maxFindingsPerCheck) {
                LOGGER.debug("{} reported {} findings, keeping the first {}", practice.id(), result.findings().size(), maxFindingsPerCheck);
                result = new CheckResult(result.id(), result.name(), result.passed(), result.findings().subList(0, maxFindingsPerCheck));
            }
            results.add(result);
        }
        var report = new ComplianceReport(results);
        LOGGER.atDebug()
                .setMessage("Compliance for namespace '{}': {}/{} checks passed, {} recommendations")
                .addArgument(topology.namespace())
                .addArgument(report.passed())
                .addArgument(report.total())
                .addArgument(() -> report.recommendations().size())
                .log();
        return report;
    }

    public List<Recommendation> getRecommendations(TopologyData topology) {
        return evaluate(topology).recommendations();
    }

    public Map<String, Object> getComplianceScore(TopologyData topology) {
        return evaluate(topology).details();
    }
}
