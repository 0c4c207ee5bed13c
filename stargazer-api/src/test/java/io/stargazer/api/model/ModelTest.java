/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.api.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.stargazer.api.selector.Selector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelTest {

    @Test
    void serviceKeys() {
        assertThat(ServiceKeys.of("ns1", "web")).isEqualTo("ns1/web");
        assertThat(ServiceKeys.of("", "web")).isEqualTo("web");
        assertThat(ServiceKeys.qualify("web", "ns1")).isEqualTo("ns1/web");
        assertThat(ServiceKeys.qualify("ns2/web", "ns1")).isEqualTo("ns2/web");
        assertThat(ServiceKeys.namespaceOf("ns1/web")).isEqualTo("ns1");
        assertThat(ServiceKeys.nameOf("ns1/web")).isEqualTo("web");
        assertThat(ServiceKeys.nameOf("web")).isEqualTo("web");
        assertThat(ServiceKeys.isGateway("external")).isTrue();
        assertThat(ServiceKeys.isGateway("ns1/web")).isFalse();
    }

    @Test
    void serviceNodeDefaultsMissingFields() {
        var node = new ServiceNode("web", null, null, null, null, null, null, null, 0, null, null, false, null, null, false, null);

        assertThat(node.namespace()).isEmpty();
        assertThat(node.labels()).isEmpty();
        assertThat(node.meshType()).isEqualTo(MeshType.NONE);
        assertThat(node.podSecurity()).isEqualTo(PodSecurityTier.BASELINE);
        assertThat(node.hasServiceMesh()).isFalse();
        assertThat(node.key()).isEqualTo("web");
    }

    @Test
    void workloadLabelsOverlaySelectorOnServiceLabels() {
        var node = new ServiceNode("web", "ns1", "ClusterIP", "10.0.0.1", List.of(), Map.of("app", "svc-label", "team", "a"),
                Map.of("app", "web"), List.of(), 0, null, MeshType.NONE, false, PodSecurityTier.BASELINE, "Unknown", false, null);

        assertThat(node.workloadLabels()).containsExactlyInAnyOrderEntriesOf(Map.of("app", "web", "team", "a"));
        assertThat(node.withPolicyCoverage(true).hasPolicy()).isTrue();
        assertThat(node.withPolicyCoverage(false)).isSameAs(node);
    }

    @Test
    void allowedEdgeCannotCarryBlockingPolicies() {
        assertThatThrownBy(() -> new ConnectivityEdge("a", "b", true, "x", List.of("deny"), false, MeshType.NONE, null, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nativePolicyDeniesDeclaredDirectionWithoutRules() {
        var ingressOnly = new NativePolicySpec(Selector.ALL, Set.of(Direction.INGRESS), 0, 0);
        var withRules = new NativePolicySpec(Selector.ALL, Set.of(Direction.INGRESS, Direction.EGRESS), 1, 0);

        assertThat(ingressOnly.deniesAll(Direction.INGRESS)).isTrue();
        assertThat(ingressOnly.deniesAll(Direction.EGRESS)).isFalse();
        assertThat(withRules.deniesAll(Direction.INGRESS)).isFalse();
        assertThat(withRules.deniesAll(Direction.EGRESS)).isTrue();
    }

    @Test
    void policyRuleScope() {
        var namespaced = new PolicyRule(PolicyEngine.EBPF, "CiliumNetworkPolicy", "block-egress", "ns1", null);
        var clusterWide = new PolicyRule(PolicyEngine.EBPF, "CiliumClusterwideNetworkPolicy", "allow-dns", "", null);

        assertThat(namespaced.appliesToNamespace("ns1")).isTrue();
        assertThat(namespaced.appliesToNamespace("ns2")).isFalse();
        assertThat(namespaced.nameSuggestsBlocking()).isTrue();
        assertThat(clusterWide.appliesToNamespace("ns2")).isTrue();
        assertThat(clusterWide.nameSuggestsBlocking()).isFalse();
        assertThatThrownBy(() -> new PolicyRule(PolicyEngine.MESH, "AuthorizationPolicy", "x", "ns1", new NativePolicySpec(Selector.ALL, Set.of(), 0, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void complianceReportDetails() {
        var failing = new Recommendation("np-001-ns1/web", "t", "d", Category.SECURITY, Severity.HIGH, "ns1/web", "ns1", Fix.manual("step"), "i");
        var report = new ComplianceReport(List.of(
                CheckResult.pass("a", "A"),
                CheckResult.pass("b", "B"),
                new CheckResult("np-001", "C", false, List.of(failing))));

        assertThat(report.score()).isEqualTo(66);
        assertThat(report.recommendations()).containsExactly(failing);
        assertThat(report.details())
                .containsEntry("score", 66)
                .containsEntry("passed", 2)
                .containsEntry("total", 3)
                .containsEntry("recommendations_count", 1)
                .containsEntry("check_details", Map.of("a", true, "b", true, "np-001", false));
    }

    @Test
    void emptyReportScoresFull() {
        assertThat(new ComplianceReport(List.of()).score()).isEqualTo(100);
    }

    @Test
    void fixTemplateCarriesApplyCommand() {
        var fix = Fix.ofTemplate("kind: NetworkPolicy\n");

        assertThat(fix.applyCommand()).isEqualTo("kubectl apply -f - <<EOF\nkind: NetworkPolicy\nEOF");
        assertThat(fix.manualSteps()).isEmpty();
    }
}
