/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.infra;

import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import io.stargazer.api.model.InfrastructureInfo;
import io.stargazer.engine.fetch.CustomResourceContexts;

/**
 * Works out which CNI, service mesh and policy-as-code engine the cluster runs.
 * <p>A mesh or policy engine counts as present only when both its well-known namespace and its
 * control plane deployment exist. A failed probe counts as absent.</p>
 */
public class InfrastructureDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(InfrastructureDetector.class);

    static final String ISTIO_NAMESPACE = "istio-system";
    static final String ISTIO_CONTROL_PLANE = "istiod";
    static final String KYVERNO_NAMESPACE = "kyverno";
    static final String KYVERNO_CONTROLLER = "kyverno";
    static final String HUBBLE_LABEL = "k8s-app";
    static final String HUBBLE_VALUE = "hubble";
    static final List<String> ISTIO_API_VERSIONS = List.of("v1beta1", "v1alpha3", "v1");

    private final KubernetesClient client;

    public InfrastructureDetector(KubernetesClient client) {
        this.client = client;
    }

    public InfrastructureInfo detect() {
        var cni = InfrastructureInfo.UNKNOWN_CNI;
        var cilium = false;
        for (DaemonSet daemonSet : daemonSets()) {
            var name = daemonSet.getMetadata().getName().toLowerCase(Locale.ROOT);
            if (name.contains("cilium")) {
                cni = "cilium";
                cilium = true;
                break;
            }
            else if (name.contains("calico")) {
                cni = "calico";
            }
            else if (name.contains("flannel")) {
                cni = "flannel";
            }
        }
        var istio = controlPlanePresent(ISTIO_NAMESPACE, ISTIO_CONTROL_PLANE);
        var istioApiVersion = istio ? istioApiVersion() : InfrastructureInfo.DEFAULT_ISTIO_API_VERSION;
        var kyverno = controlPlanePresent(KYVERNO_NAMESPACE, KYVERNO_CONTROLLER);
        var info = new InfrastructureInfo(cni, cilium, istio, istioApiVersion, kyverno, hubblePresent(), 0, 0, 0);
        LOGGER.atInfo()
                .setMessage("Detected infrastructure: cni={}, istio={}, kyverno={}, hubble={}")
                .addArgument(info.cni())
                .addArgument(info.istioEnabled())
                .addArgument(info.kyvernoEnabled())
                .addArgument(info.hubbleEnabled())
                .log();
        return info;
    }

    private List<DaemonSet> daemonSets() {
        try {
            return client.apps().daemonSets().inAnyNamespace().list().getItems();
        }
        catch (KubernetesClientException e) {
            LOGGER.warn("Could not list daemon sets, CNI unknown: {}", e.getMessage());
            return List.of();
        }
    }

    boolean controlPlanePresent(String namespace, String deployment) {
        try {
            return client.namespaces().withName(namespace).get() != null
                    && client.apps().deployments().inNamespace(namespace).withName(deployment).get() != null;
        }
        catch (KubernetesClientException e) {
            LOGGER.warn("Could not probe for {}/{}: {}", namespace, deployment, e.getMessage());
            return false;
        }
    }

    /**
     * The first networking API version whose gateways can be listed.
     */
    String istioApiVersion() {
        for (String version : ISTIO_API_VERSIONS) {
            try {
                client.genericKubernetesResources(CustomResourceContexts.istioGateway(version))
                        .inAnyNamespace()
                        .list(new ListOptionsBuilder().withLimit(1L).build());
                return version;
            }
            catch (KubernetesClientException e) {
                LOGGER.debug("networking.istio.io/{} not served: {}", version, e.getMessage());
            }
        }
        return InfrastructureInfo.DEFAULT_ISTIO_API_VERSION;
    }

    private boolean hubblePresent() {
        try {
            return !client.apps().deployments().inAnyNamespace().withLabel(HUBBLE_LABEL, HUBBLE_VALUE).list().getItems().isEmpty()
                    || !client.services().inAnyNamespace().withLabel(HUBBLE_LABEL, HUBBLE_VALUE).list().getItems().isEmpty();
        }
        catch (KubernetesClientException e) {
            LOGGER.warn("Could not probe for Hubble: {}", e.getMessage());
            return false;
        }
    }
}
