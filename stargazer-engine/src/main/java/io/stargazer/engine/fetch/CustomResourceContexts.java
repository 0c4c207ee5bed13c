/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.fetch;

import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;

/**
 * Definitions of the custom resources read through the generic client.
 * Giving the plural explicitly avoids an API discovery round trip per read.
 */
public final class CustomResourceContexts {

    public static final String CILIUM_GROUP = "cilium.io";
    public static final String ISTIO_NETWORKING_GROUP = "networking.istio.io";
    public static final String ISTIO_SECURITY_GROUP = "security.istio.io";
    public static final String KYVERNO_GROUP = "kyverno.io";
    public static final String ARGO_GROUP = "argoproj.io";

    public static final ResourceDefinitionContext CILIUM_NETWORK_POLICY = context(CILIUM_GROUP, "v2", "CiliumNetworkPolicy", "ciliumnetworkpolicies", true);
    public static final ResourceDefinitionContext CILIUM_CLUSTERWIDE_NETWORK_POLICY = context(CILIUM_GROUP, "v2", "CiliumClusterwideNetworkPolicy",
            "ciliumclusterwidenetworkpolicies", false);
    public static final ResourceDefinitionContext ISTIO_PEER_AUTHENTICATION = context(ISTIO_SECURITY_GROUP, "v1beta1", "PeerAuthentication",
            "peerauthentications", true);
    public static final ResourceDefinitionContext KYVERNO_POLICY = context(KYVERNO_GROUP, "v1", "Policy", "policies", true);
    public static final ResourceDefinitionContext KYVERNO_CLUSTER_POLICY = context(KYVERNO_GROUP, "v1", "ClusterPolicy", "clusterpolicies", false);
    public static final ResourceDefinitionContext ARGO_APPLICATION = context(ARGO_GROUP, "v1alpha1", "Application", "applications", true);

    private CustomResourceContexts() {
    }

    public static ResourceDefinitionContext istioAuthorizationPolicy(String version) {
        return context(ISTIO_SECURITY_GROUP, version, "AuthorizationPolicy", "authorizationpolicies", true);
    }

    public static ResourceDefinitionContext istioGateway(String version) {
        return context(ISTIO_NETWORKING_GROUP, version, "Gateway", "gateways", true);
    }

    public static ResourceDefinitionContext istioVirtualService(String version) {
        return context(ISTIO_NETWORKING_GROUP, version, "VirtualService", "virtualservices", true);
    }

    public static ResourceDefinitionContext istioServiceEntry(String version) {
        return context(ISTIO_NETWORKING_GROUP, version, "ServiceEntry", "serviceentries", true);
    }

    private static ResourceDefinitionContext context(String group, String version, String kind, String plural, boolean namespaced) {
        return new ResourceDefinitionContext.Builder()
                .withGroup(group)
                .withVersion(version)
                .withKind(kind)
                .withPlural(plural)
                .withNamespaced(namespaced)
                .build();
    }
}
