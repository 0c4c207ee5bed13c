/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.fetch;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleRef;
import io.fabric8.kubernetes.api.model.rbac.Subject;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;

import io.stargazer.api.FatalFetchException;
import io.stargazer.api.SoftFetchException;
import io.stargazer.api.model.DriftApplication;
import io.stargazer.api.model.PolicyEngine;
import io.stargazer.api.model.PolicyRule;
import io.stargazer.api.model.RbacInfo;
import io.stargazer.api.model.ResourceKind;
import io.stargazer.api.model.RoleBindingInfo;
import io.stargazer.api.model.ServiceAccountInfo;
import io.stargazer.api.model.SubjectInfo;
import io.stargazer.engine.cache.CacheKeys;
import io.stargazer.engine.cache.TtlCache;

/**
 * Reads cluster resources, one operation per resource kind.
 * <p>Each operation takes a namespace filter (empty meaning all namespaces) and is cached under a key
 * derived from the kind, the namespace and any flags that change the result.
 * A failed read of an {@linkplain ResourceKind#isEssential() essential} kind throws {@link FatalFetchException},
 * any other failed read throws {@link SoftFetchException}.</p>
 */
public class ClusterResources {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClusterResources.class);

    static final String ARGOCD_NAMESPACE = "argocd";
    static final String EGRESS_GATEWAY_APP = "istio-egressgateway";

    private final KubernetesClient client;
    private final TtlCache cache;

    public ClusterResources(KubernetesClient client, TtlCache cache) {
        this.client = client;
        this.cache = cache;
    }

    public List<Service> services(String namespace) {
        return fetch(ResourceKind.SERVICES, namespace, () -> list(client.services(), namespace));
    }

    public List<Pod> pods(String namespace) {
        return fetch(ResourceKind.PODS, namespace, () -> list(client.pods(), namespace));
    }

    public List<PolicyRule> networkPolicies(String namespace) {
        return fetch(ResourceKind.NETWORK_POLICIES, namespace, () -> list(client.network().v1().networkPolicies(), namespace).stream()
                .map(NetworkPolicies::toRule)
                .toList());
    }

    /**
     * Namespaced Cilium policies plus every cluster-wide one.
     */
    public List<PolicyRule> ciliumPolicies(String namespace) {
        return fetch(ResourceKind.CILIUM_POLICIES, namespace, () -> Stream.concat(
                list(client.genericKubernetesResources(CustomResourceContexts.CILIUM_NETWORK_POLICY), namespace).stream(),
                client.genericKubernetesResources(CustomResourceContexts.CILIUM_CLUSTERWIDE_NETWORK_POLICY).list().getItems().stream())
                .map(resource -> identityRule(PolicyEngine.EBPF, resource))
                .toList());
    }

    /**
     * Istio authorization policies and peer authentications.
     * Authorization policies are read at {@code security.istio.io/v1}, falling back to {@code v1beta1} on older meshes.
     */
    public List<PolicyRule> istioPolicies(String namespace) {
        return fetch(ResourceKind.ISTIO_POLICIES, namespace, () -> {
            List<GenericKubernetesResource> authorizationPolicies;
            try {
                authorizationPolicies = list(client.genericKubernetesResources(CustomResourceContexts.istioAuthorizationPolicy("v1")), namespace);
            }
            catch (KubernetesClientException e) {
                LOGGER.debug("security.istio.io/v1 not served, retrying with v1beta1: {}", e.getMessage());
                authorizationPolicies = list(client.genericKubernetesResources(CustomResourceContexts.istioAuthorizationPolicy("v1beta1")), namespace);
            }
            var rules = new ArrayList<PolicyRule>();
            authorizationPolicies.forEach(resource -> rules.add(identityRule(PolicyEngine.MESH, resource)));
            list(client.genericKubernetesResources(CustomResourceContexts.ISTIO_PEER_AUTHENTICATION), namespace)
                    .forEach(resource -> rules.add(identityRule(PolicyEngine.MESH, resource)));
            return rules;
        });
    }

    public List<PolicyRule> kyvernoPolicies(String namespace) {
        return fetch(ResourceKind.KYVERNO_POLICIES, namespace, () -> Stream.concat(
                list(client.genericKubernetesResources(CustomResourceContexts.KYVERNO_POLICY), namespace).stream(),
                client.genericKubernetesResources(CustomResourceContexts.KYVERNO_CLUSTER_POLICY).list().getItems().stream())
                .map(resource -> identityRule(PolicyEngine.ADMISSION, resource))
                .toList());
    }

    public RbacInfo rbac(String namespace) {
        return fetch(ResourceKind.RBAC, namespace, () -> new RbacInfo(
                list(client.rbac().roleBindings(), namespace).stream().map(ClusterResources::roleBinding).toList(),
                client.rbac().clusterRoleBindings().list().getItems().stream().map(ClusterResources::clusterRoleBinding).toList(),
                list(client.serviceAccounts(), namespace).stream().map(ClusterResources::serviceAccount).toList()));
    }

    /**
     * Argo CD applications, read from the {@code argocd} namespace and, failing that, from every namespace.
     */
    public List<DriftApplication> driftApplications() {
        return fetch(ResourceKind.DRIFT, ARGOCD_NAMESPACE, () -> {
            var applications = client.genericKubernetesResources(CustomResourceContexts.ARGO_APPLICATION);
            List<GenericKubernetesResource> items;
            try {
                items = applications.inNamespace(ARGOCD_NAMESPACE).list().getItems();
            }
            catch (KubernetesClientException e) {
                LOGGER.debug("Could not list applications in {}, trying all namespaces: {}", ARGOCD_NAMESPACE, e.getMessage());
                items = applications.inAnyNamespace().list().getItems();
            }
            return items.stream().map(ClusterResources::driftApplication).toList();
        });
    }

    public List<Ingress> ingresses(String namespace) {
        return fetch(ResourceKind.INGRESSES, namespace, () -> list(client.network().v1().ingresses(), namespace));
    }

    public List<GenericKubernetesResource> istioGateways(String namespace, String apiVersion) {
        return fetch(ResourceKind.MESH_GATEWAYS, namespace, () -> list(client.genericKubernetesResources(CustomResourceContexts.istioGateway(apiVersion)), namespace),
                "gateways", apiVersion);
    }

    public List<GenericKubernetesResource> istioVirtualServices(String namespace, String apiVersion) {
        return fetch(ResourceKind.MESH_GATEWAYS, namespace,
                () -> list(client.genericKubernetesResources(CustomResourceContexts.istioVirtualService(apiVersion)), namespace),
                "virtualservices", apiVersion);
    }

    public List<GenericKubernetesResource> istioServiceEntries(String namespace, String apiVersion) {
        return fetch(ResourceKind.SERVICE_ENTRIES, namespace,
                () -> list(client.genericKubernetesResources(CustomResourceContexts.istioServiceEntry(apiVersion)), namespace),
                apiVersion);
    }

    /**
     * Deployments of the Istio egress gateway, in any namespace.
     */
    public List<Deployment> egressGateways() {
        return fetch(ResourceKind.DEPLOYMENTS, "", () -> client.apps().deployments().inAnyNamespace()
                .withLabel("app", EGRESS_GATEWAY_APP)
                .list()
                .getItems(), EGRESS_GATEWAY_APP);
    }

    private <T> T fetch(ResourceKind kind, String namespace, Supplier<T> reader, String... flags) {
        try {
            return cache.getOrCompute(CacheKeys.resource(kind, namespace, flags), reader);
        }
        catch (KubernetesClientException e) {
            if (kind.isEssential()) {
                throw new FatalFetchException(kind, namespace, e);
            }
            throw new SoftFetchException(kind, describe(namespace) + ": " + e.getMessage(), e);
        }
    }

    private static String describe(String namespace) {
        return namespace.isEmpty() ? "all namespaces" : "namespace " + namespace;
    }

    static <T extends HasMetadata, L extends KubernetesResourceList<T>, R extends Resource<T>> List<T> list(MixedOperation<T, L, R> operation,
                                                                                                            String namespace) {
        if (namespace.isEmpty()) {
            return operation.inAnyNamespace().list().getItems();
        }
        return operation.inNamespace(namespace).list().getItems();
    }

    private static PolicyRule identityRule(PolicyEngine engine, GenericKubernetesResource resource) {
        return new PolicyRule(engine, resource.getKind(), resource.getMetadata().getName(), GenericResources.namespace(resource), null);
    }

    private static RoleBindingInfo roleBinding(RoleBinding binding) {
        return new RoleBindingInfo(binding.getMetadata().getName(), GenericResources.namespace(binding),
                roleKind(binding.getRoleRef()), roleName(binding.getRoleRef()), subjects(binding.getSubjects()));
    }

    private static RoleBindingInfo clusterRoleBinding(ClusterRoleBinding binding) {
        return new RoleBindingInfo(binding.getMetadata().getName(), "",
                roleKind(binding.getRoleRef()), roleName(binding.getRoleRef()), subjects(binding.getSubjects()));
    }

    private static String roleKind(RoleRef roleRef) {
        return roleRef == null ? "" : Optional.ofNullable(roleRef.getKind()).orElse("");
    }

    private static String roleName(RoleRef roleRef) {
        return roleRef == null ? "" : Optional.ofNullable(roleRef.getName()).orElse("");
    }

    private static List<SubjectInfo> subjects(List<Subject> subjects) {
        return Optional.ofNullable(subjects).orElse(List.of()).stream()
                .map(subject -> new SubjectInfo(subject.getKind(), subject.getName(), Optional.ofNullable(subject.getNamespace()).orElse("")))
                .toList();
    }

    private static ServiceAccountInfo serviceAccount(ServiceAccount account) {
        return new ServiceAccountInfo(account.getMetadata().getName(), GenericResources.namespace(account),
                Optional.ofNullable(account.getSecrets()).map(List::size).orElse(0));
    }

    private static DriftApplication driftApplication(GenericKubernetesResource application) {
        return new DriftApplication(application.getMetadata().getName(),
                GenericResources.namespace(application),
                orUnknown(GenericResources.string(application, "status", "sync", "status")),
                orUnknown(GenericResources.string(application, "status", "health", "status")),
                GenericResources.string(application, "spec", "source", "repoURL"),
                GenericResources.string(application, "spec", "source", "targetRevision"));
    }

    private static String orUnknown(String value) {
        return value.isEmpty() ? "Unknown" : value;
    }
}
