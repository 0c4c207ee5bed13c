/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.fetch;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceBuilder;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import io.stargazer.api.FatalFetchException;
import io.stargazer.api.SoftFetchException;
import io.stargazer.api.model.DriftApplication;
import io.stargazer.api.model.PolicyEngine;
import io.stargazer.api.model.PolicyRule;
import io.stargazer.api.model.ResourceKind;
import io.stargazer.engine.cache.TtlCache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@EnableKubernetesMockClient(crud = true)
class ClusterResourcesTest {

    KubernetesClient kubeClient;
    KubernetesMockServer mockServer;

    private final MeterRegistry registry = new SimpleMeterRegistry();
    private ClusterResources resources;

    @BeforeEach
    void setUp() {
        resources = new ClusterResources(kubeClient, new TtlCache("resources", Duration.ofMinutes(1), registry));
    }

    @Test
    void shouldListServicesOfOneNamespaceOrAll() {
        // Given
        createService("ns1", "web");
        createService("ns2", "api");

        // When
        var inNs1 = resources.services("ns1");
        var everywhere = new ClusterResources(kubeClient, new TtlCache("other", Duration.ofMinutes(1), registry)).services("");

        // Then
        assertThat(inNs1).extracting(s -> s.getMetadata().getName()).containsExactly("web");
        assertThat(everywhere).extracting(s -> s.getMetadata().getName()).containsExactlyInAnyOrder("web", "api");
    }

    @Test
    void shouldServeRepeatedReadsFromCache() {
        // Given
        createService("ns1", "web");
        resources.services("ns1");
        createService("ns1", "api");

        // When
        var services = resources.services("ns1");

        // Then
        assertThat(services).extracting(s -> s.getMetadata().getName()).containsExactly("web");
    }

    @Test
    void shouldFailFatallyWhenServicesCannotBeRead() {
        // Given
        mockServer.expect().get().withPath("/api/v1/namespaces/ns1/services").andReturn(403, "forbidden").always();

        // When/Then
        assertThatThrownBy(() -> resources.services("ns1"))
                .isInstanceOf(FatalFetchException.class)
                .hasMessageStartingWith("Failed to fetch SERVICES in namespace 'ns1'")
                .extracting(e -> ((FatalFetchException) e).kind())
                .isEqualTo(ResourceKind.SERVICES);
    }

    @Test
    void shouldFailSoftlyWhenNetworkPoliciesCannotBeRead() {
        // Given
        mockServer.expect().get().withPath("/apis/networking.k8s.io/v1/namespaces/ns1/networkpolicies").andReturn(403, "forbidden").always();

        // When/Then
        assertThatThrownBy(() -> resources.networkPolicies("ns1"))
                .isInstanceOf(SoftFetchException.class)
                .satisfies(e -> {
                    var soft = (SoftFetchException) e;
                    assertThat(soft.kind()).isEqualTo(ResourceKind.NETWORK_POLICIES);
                    assertThat(soft.warning()).startsWith("NETWORK_POLICIES: namespace ns1: ");
                });
    }

    @Test
    void shouldConvertNetworkPolicies() {
        // Given
        // @formatter:off
        kubeClient.network().v1().networkPolicies().inNamespace("ns1").resource(new NetworkPolicyBuilder()
                .withNewMetadata()
                    .withName("default-deny")
                    .withNamespace("ns1")
                .endMetadata()
                .withNewSpec()
                    .withNewPodSelector().endPodSelector()
                    .withPolicyTypes("Ingress")
                .endSpec()
                .build()).create();
        // @formatter:on

        // When
        var rules = resources.networkPolicies("ns1");

        // Then
        assertThat(rules).singleElement().satisfies(rule -> {
            assertThat(rule.engine()).isEqualTo(PolicyEngine.NATIVE);
            assertThat(rule.name()).isEqualTo("default-deny");
            assertThat(rule.nativeSpec()).isNotNull();
        });
    }

    @Test
    void shouldIncludeClusterwideCiliumPolicies() {
        // Given
        create(CustomResourceContexts.CILIUM_NETWORK_POLICY, "ns1", "block-egress");
        create(CustomResourceContexts.CILIUM_NETWORK_POLICY, "ns2", "other");
        create(CustomResourceContexts.CILIUM_CLUSTERWIDE_NETWORK_POLICY, null, "allow-dns");

        // When
        var rules = resources.ciliumPolicies("ns1");

        // Then
        assertThat(rules).extracting(PolicyRule::name, PolicyRule::namespace, PolicyRule::engine)
                .containsExactlyInAnyOrder(
                        tuple("block-egress", "ns1", PolicyEngine.EBPF),
                        tuple("allow-dns", "", PolicyEngine.EBPF));
    }

    @Test
    void shouldFallBackToOlderAuthorizationPolicyVersion() {
        // Given
        mockServer.expect().get().withPath("/apis/security.istio.io/v1/namespaces/ns1/authorizationpolicies").andReturn(404, "not found").always();
        create(CustomResourceContexts.istioAuthorizationPolicy("v1beta1"), "ns1", "allow-all");
        create(CustomResourceContexts.ISTIO_PEER_AUTHENTICATION, "ns1", "default");

        // When
        var rules = resources.istioPolicies("ns1");

        // Then
        assertThat(rules).extracting(PolicyRule::kind).containsExactlyInAnyOrder("AuthorizationPolicy", "PeerAuthentication");
        assertThat(rules).allSatisfy(rule -> assertThat(rule.engine()).isEqualTo(PolicyEngine.MESH));
    }

    @Test
    void shouldReadDriftStatusOfApplications() {
        // Given
        var app = resource(CustomResourceContexts.ARGO_APPLICATION, ClusterResources.ARGOCD_NAMESPACE, "web");
        app.setAdditionalProperty("spec", Map.of("source", Map.of("repoURL", "https://git.example.com/web", "targetRevision", "main")));
        app.setAdditionalProperty("status", Map.of("sync", Map.of("status", "OutOfSync")));
        kubeClient.genericKubernetesResources(CustomResourceContexts.ARGO_APPLICATION).inNamespace(ClusterResources.ARGOCD_NAMESPACE).resource(app).create();

        // When
        var applications = resources.driftApplications();

        // Then
        assertThat(applications).containsExactly(
                new DriftApplication("web", ClusterResources.ARGOCD_NAMESPACE, "OutOfSync", "Unknown", "https://git.example.com/web", "main"));
    }

    @Test
    void shouldReadRbac() {
        // When
        var rbac = resources.rbac("ns1");

        // Then
        assertThat(rbac.roleBindings()).isEmpty();
        assertThat(rbac.serviceAccounts()).isEmpty();
    }

    private void createService(String namespace, String name) {
        kubeClient.services().inNamespace(namespace).resource(new ServiceBuilder()
                .withNewMetadata().withName(name).withNamespace(namespace).endMetadata()
                .withNewSpec().addToSelector("app", name).endSpec()
                .build()).create();
    }

    private void create(ResourceDefinitionContext context, String namespace, String name) {
        var resource = resource(context, namespace, name);
        if (namespace == null) {
            kubeClient.genericKubernetesResources(context).resource(resource).create();
        }
        else {
            kubeClient.genericKubernetesResources(context).inNamespace(namespace).resource(resource).create();
        }
    }

    private static GenericKubernetesResource resource(ResourceDefinitionContext context, String namespace, String name) {
        return new GenericKubernetesResourceBuilder()
                .withApiVersion(context.getGroup() + "/" + context.getVersion())
                .withKind(context.getKind())
                .withNewMetadata().withName(name).withNamespace(namespace).endMetadata()
                .build();
    }
}
