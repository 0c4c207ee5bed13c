/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.fetch;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.LabelSelectorBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyEgressRuleBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyIngressRuleBuilder;

import io.stargazer.api.model.Direction;
import io.stargazer.api.selector.Selector;

import static org.assertj.core.api.Assertions.assertThat;

class NetworkPoliciesTest {

    @Test
    void policyTypesDefaultToIngress() {
        // @formatter:off
        var policy = new NetworkPolicyBuilder()
                .withNewMetadata().withName("allow-web").withNamespace("ns1").endMetadata()
                .withNewSpec()
                    .withNewPodSelector().addToMatchLabels("app", "web").endPodSelector()
                    .withIngress(new NetworkPolicyIngressRuleBuilder().build())
                .endSpec()
                .build();
        // @formatter:on

        var rule = NetworkPolicies.toRule(policy);

        assertThat(rule.namespace()).isEqualTo("ns1");
        assertThat(rule.nativeSpec().policyTypes()).containsExactly(Direction.INGRESS);
        assertThat(rule.nativeSpec().ingressRuleCount()).isEqualTo(1);
        assertThat(rule.nativeSpec().podSelector().test(Map.of("app", "web"))).isTrue();
        assertThat(rule.nativeSpec().podSelector().test(Map.of("app", "api"))).isFalse();
    }

    @Test
    void egressRulesImplyEgressType() {
        var policy = new NetworkPolicyBuilder()
                .withNewMetadata().withName("egress").withNamespace("ns1").endMetadata()
                .withNewSpec()
                .withNewPodSelector().endPodSelector()
                .withEgress(new NetworkPolicyEgressRuleBuilder().build())
                .endSpec()
                .build();

        assertThat(NetworkPolicies.toRule(policy).nativeSpec().policyTypes()).containsExactlyInAnyOrder(Direction.INGRESS, Direction.EGRESS);
    }

    @Test
    void explicitPolicyTypes() {
        var policy = new NetworkPolicyBuilder()
                .withNewMetadata().withName("deny-egress").withNamespace("ns1").endMetadata()
                .withNewSpec()
                .withNewPodSelector().endPodSelector()
                .withPolicyTypes("Egress")
                .endSpec()
                .build();

        var spec = NetworkPolicies.toRule(policy).nativeSpec();

        assertThat(spec.policyTypes()).containsExactly(Direction.EGRESS);
        assertThat(spec.deniesAll(Direction.EGRESS)).isTrue();
        assertThat(spec.podSelector()).isSameAs(Selector.ALL);
    }

    @Test
    void uninterpretablePolicyKeepsItsIdentity() {
        var policy = new NetworkPolicyBuilder()
                .withNewMetadata().withName("deny-odd").withNamespace("ns1").endMetadata()
                .withNewSpec()
                .withPodSelector(new LabelSelectorBuilder().addNewMatchExpression().withKey("tier").withOperator("Gt").withValues("1").endMatchExpression().build())
                .endSpec()
                .build();

        var rule = NetworkPolicies.toRule(policy);

        assertThat(rule.nativeSpec()).isNull();
        assertThat(rule.nameSuggestsBlocking()).isTrue();
    }

    @Test
    void selectorExpressions() {
        var selector = NetworkPolicies.selector(new LabelSelectorBuilder()
                .addToMatchLabels("app", "web")
                .addNewMatchExpression().withKey("env").withOperator("NotIn").withValues("prod").endMatchExpression()
                .addNewMatchExpression().withKey("canary").withOperator("DoesNotExist").endMatchExpression()
                .build());

        assertThat(selector.test(Map.of("app", "web", "env", "dev"))).isTrue();
        assertThat(selector.test(Map.of("app", "web", "env", "prod"))).isFalse();
        assertThat(selector.test(Map.of("app", "web", "canary", "true"))).isFalse();
        assertThat(NetworkPolicies.selector(null)).isSameAs(Selector.ALL);
        assertThat(Set.of(selector.toString().split(","))).contains("app==web", "env!=prod", "!canary");
    }
}
