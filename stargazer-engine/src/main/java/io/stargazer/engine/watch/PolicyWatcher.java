/*
 * Copyright Stargazer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.stargazer.engine.watch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;

import io.stargazer.api.model.InfrastructureInfo;
import io.stargazer.api.model.PolicyChangeEvent;
import io.stargazer.api.model.PolicyChangeEvent.EventType;
import io.stargazer.api.model.PolicyEngine;
import io.stargazer.engine.fetch.CustomResourceContexts;
import io.stargazer.engine.fetch.GenericResources;

/**
 * Watches the policy resources of every detected policy engine and notifies listeners of changes.
 * <p>NetworkPolicies are always watched. Cilium, Istio and Kyverno resources are watched only when the
 * corresponding technology was detected. A resource type that cannot be watched is logged and skipped.</p>
 */
public class PolicyWatcher implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PolicyWatcher.class);

    static final String WATCHED_ISTIO_VERSION = "v1beta1";

    private final KubernetesClient client;
    private final InfrastructureInfo infrastructure;
    private final Duration resyncPeriod;
    private final List<PolicyChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final List<SharedIndexInformer<?>> informers = new ArrayList<>();

    public PolicyWatcher(KubernetesClient client, InfrastructureInfo infrastructure, Duration resyncPeriod) {
        this.client = Objects.requireNonNull(client);
        this.infrastructure = Objects.requireNonNull(infrastructure);
        this.resyncPeriod = Objects.requireNonNull(resyncPeriod);
    }

    public void addListener(PolicyChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    /**
     * Starts the informers.
     * @param namespace namespace to watch, empty for all namespaces
     */
    public synchronized void start(String namespace) {
        if (!informers.isEmpty()) {
            throw new IllegalStateException("already started");
        }
        long resync = resyncPeriod.toMillis();
        watch("NetworkPolicy", ns -> {
            var policies = client.network().v1().networkPolicies();
            return ns.isEmpty() ? policies.inAnyNamespace().inform(new Handler<>(PolicyEngine.NATIVE), resync)
                    : policies.inNamespace(ns).inform(new Handler<>(PolicyEngine.NATIVE), resync);
        }, namespace);
        if (infrastructure.ciliumEnabled()) {
            watchCustom(CustomResourceContexts.CILIUM_NETWORK_POLICY, PolicyEngine.EBPF, namespace);
            watchCustom(CustomResourceContexts.CILIUM_CLUSTERWIDE_NETWORK_POLICY, PolicyEngine.EBPF, "");
        }
        if (infrastructure.istioEnabled()) {
            watchCustom(CustomResourceContexts.istioAuthorizationPolicy(WATCHED_ISTIO_VERSION), PolicyEngine.MESH, namespace);
            watchCustom(CustomResourceContexts.ISTIO_PEER_AUTHENTICATION, PolicyEngine.MESH, namespace);
        }
        if (infrastructure.kyvernoEnabled()) {
            watchCustom(CustomResourceContexts.KYVERNO_POLICY, PolicyEngine.ADMISSION, namespace);
            watchCustom(CustomResourceContexts.KYVERNO_CLUSTER_POLICY, PolicyEngine.ADMISSION, "");
        }
        LOGGER.info("Watching {} policy resource types", informers.size());
    }

    synchronized int informerCount() {
        return informers.size();
    }

    @Override
    public synchronized void close() {
        informers.forEach(SharedIndexInformer::close);
        informers.clear();
    }

    private void watchCustom(ResourceDefinitionContext context, PolicyEngine engine, String namespace) {
        watch(context.getKind(), ns -> {
            var resources = client.genericKubernetesResources(context);
            return ns.isEmpty() || !context.isNamespaceScoped() ? resources.inAnyNamespace().inform(new Handler<>(engine), resyncPeriod.toMillis())
                    : resources.inNamespace(ns).inform(new Handler<>(engine), resyncPeriod.toMillis());
        }, namespace);
    }

    private void watch(String kind, Function<String, SharedIndexInformer<?>> starter, String namespace) {
        try {
            informers.add(starter.apply(namespace));
        }
        catch (KubernetesClientException e) {
            LOGGER.atWarn()
                    .setMessage("Cannot watch {}, changes to it will not be reported: {}")
                    .addArgument(kind)
                    .addArgument(e.getMessage())
                    .log();
        }
    }

    void emit(PolicyChangeEvent event) {
        LOGGER.debug("Policy change {}", event);
        for (PolicyChangeListener listener : listeners) {
            try {
                listener.onPolicyChange(event);
            }
            catch (RuntimeException e) {
                LOGGER.atWarn()
                        .setMessage("Policy change listener failed for {} {}/{}")
                        .addArgument(event.kind())
                        .addArgument(event.namespace())
                        .addArgument(event.name())
                        .setCause(e)
                        .log();
            }
        }
    }

    private class Handler<T extends HasMetadata> implements ResourceEventHandler<T> {

        private final PolicyEngine engine;

        Handler(PolicyEngine engine) {
            this.engine = engine;
        }

        @Override
        public void onAdd(T resource) {
            emit(event(EventType.ADDED, resource));
        }

        @Override
        public void onUpdate(T oldResource, T newResource) {
            if (Objects.equals(oldResource.getMetadata().getResourceVersion(), newResource.getMetadata().getResourceVersion())) {
                // resync
                return;
            }
            emit(event(EventType.MODIFIED, newResource));
        }

        @Override
        public void onDelete(T resource, boolean deletedFinalStateUnknown) {
            emit(event(EventType.DELETED, resource));
        }

        private PolicyChangeEvent event(EventType type, T resource) {
            return new PolicyChangeEvent(type, engine, resource.getKind(), resource.getMetadata().getName(), GenericResources.namespace(resource));
        }
    }
}
