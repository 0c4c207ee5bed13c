/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.topology;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.ServiceBuilder;

import io.stargazer.api.model.DriftApplication;
import io.stargazer.api.model.InfrastructureInfo;
import io.stargazer.api.model.MeshType;
import io.stargazer.engine.config.CostConfiguration;

import static io.stargazer.engine.TestTopologies.pod;
import static io.stargazer.engine.TestTopologies.service;
import static org.assertj.core.api.Assertions.assertThat;

class TopologyBuilderTest {

    private static final InfrastructureInfo ISTIO = new InfrastructureInfo("calico", false, true, "v1beta1", false, false, 0, 0, 0);

    private final TopologyBuilder builder = new TopologyBuilder(new CostEstimator(CostConfiguration.DEFAULT));

    @Test
    void matchesPodsBySelectorWithinNamespace() {
        // Given
        var services = List.of(service("ns1", "web"), service("ns2", "web"));
        var pods = List.of(pod("ns1", "web-0", "web"), pod("ns1", "web-1", "web"), pod("ns2", "other-0", "other"));

        // When
        var nodes = builder.build(services, pods, InfrastructureInfo.none(), List.of(), null);

        // Then
        assertThat(nodes).containsOnlyKeys("ns1/web", "ns2/web");
        var web = nodes.get("ns1/web");
        assertThat(web.pods()).containsExactly("web-0", "web-1");
        assertThat(web.healthyPods()).isEqualTo(2);
        assertThat(web.deployment()).isEqualTo("web");
        assertThat(web.ports()).containsExactly("http:8080/TCP");
        assertThat(web.driftStatus()).isEqualTo("Unknown");
        assertThat(web.costSignal()).isNull();
        assertThat(nodes.get("ns2/web").pods()).isEmpty();
    }

    @Test
    void serviceWithoutSelectorHasNoPods() {
        var headless = new ServiceBuilder().withNewMetadata().withName("external-db").withNamespace("ns1").endMetadata().withNewSpec().endSpec().build();

        var nodes = builder.build(List.of(headless), List.of(pod("ns1", "web-0", "web")), InfrastructureInfo.none(), List.of(), null);

        assertThat(nodes.get("ns1/external-db").pods()).isEmpty();
        assertThat(nodes.get("ns1/external-db").deployment()).isNull();
    }

    @Test
    void unhealthyPodsAreCountedButNotHealthy() {
        var pending = new PodBuilder(pod("ns1", "web-1", "web")).editStatus().withPhase("Pending").endStatus().build();

        var web = builder.build(List.of(service("ns1", "web")), List.of(pod("ns1", "web-0", "web"), pending), InfrastructureInfo.none(), List.of(), null)
                .get("ns1/web");

        assertThat(web.podCount()).isEqualTo(2);
        assertThat(web.healthyPods()).isEqualTo(1);
    }

    @Test
    void istioSidecarOnlyCountsWhenIstioIsPresent() {
        var injected = new PodBuilder(pod("ns1", "web-0", "web")).editMetadata().addToAnnotations("sidecar.istio.io/status", "{}").endMetadata().build();

        var withIstio = builder.build(List.of(service("ns1", "web")), List.of(injected), ISTIO, List.of(), null).get("ns1/web");
        var withoutIstio = builder.build(List.of(service("ns1", "web")), List.of(injected), InfrastructureInfo.none(), List.of(), null).get("ns1/web");

        assertThat(withIstio.meshType()).isEqualTo(MeshType.ISTIO);
        assertThat(withIstio.hasServiceMesh()).isTrue();
        assertThat(withoutIstio.meshType()).isEqualTo(MeshType.NONE);
    }

    @Test
    void istioProxyImageMarksMembership() {
        var withProxy = new PodBuilder(pod("ns1", "web-0", "web")).editSpec().addNewContainer().withName("istio-proxy").withImage("docker.io/istio/proxyv2:1.20")
                .endContainer().endSpec().build();

        var web = builder.build(List.of(service("ns1", "web")), List.of(withProxy), ISTIO, List.of(), null).get("ns1/web");

        assertThat(web.meshType()).isEqualTo(MeshType.ISTIO);
    }

    @Test
    void ciliumProxyAnnotation() {
        var cilium = new InfrastructureInfo("cilium", true, false, "v1beta1", false, false, 0, 0, 0);
        var annotated = new PodBuilder(pod("ns1", "web-0", "web")).editMetadata().addToAnnotations("io.cilium.k8s.policy.name", "l7-web").endMetadata().build();

        var web = builder.build(List.of(service("ns1", "web")), List.of(annotated), cilium, List.of(), null).get("ns1/web");

        assertThat(web.ciliumProxy()).isTrue();
        assertThat(web.meshType()).isEqualTo(MeshType.CILIUM);
    }

    @Test
    void costSignalOnlyWhenRateKnown() {
        var nodes = builder.build(List.of(service("ns1", "web"), service("ns1", "api")),
                List.of(pod("ns1", "web-0", "web"), pod("ns1", "api-0", "api")),
                InfrastructureInfo.none(), List.of(), Map.of("ns1/web", 0.0));

        assertThat(nodes.get("ns1/web").costSignal()).isNotNull();
        assertThat(nodes.get("ns1/web").costSignal().likelyUnused()).isTrue();
        assertThat(nodes.get("ns1/api").costSignal()).isNull();
    }

    @Test
    void driftStatusFromMatchingApplication() {
        var drift = List.of(new DriftApplication("shop-web", "argocd", "OutOfSync", "Healthy", "https://git", "main"));

        var nodes = builder.build(List.of(service("ns1", "web"), service("ns1", "api")), List.of(), InfrastructureInfo.none(), drift, null);

        assertThat(nodes.get("ns1/web").driftStatus()).isEqualTo("OutOfSync");
        assertThat(nodes.get("ns1/api").driftStatus()).isEqualTo("Unknown");
    }

    @Test
    void portsWithoutNameOrProtocol() {
        var svc = new ServiceBuilder().withNewMetadata().withName("db").endMetadata()
                .withNewSpec().addNewPort().withPort(5432).endPort().endSpec().build();

        assertThat(TopologyBuilder.ports(svc.getSpec().getPorts())).containsExactly("5432/TCP");
    }
}
