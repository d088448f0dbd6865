/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.status;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;

import io.syncwarden.kubernetes.api.v1beta1.RSync;
import io.syncwarden.kubernetes.api.v1beta1.RSyncSpec;
import io.syncwarden.kubernetes.api.v1beta1.RSyncStatus;
import io.syncwarden.kubernetes.api.v1beta1.RepoSync;
import io.syncwarden.kubernetes.api.v1beta1.RootSync;
import io.syncwarden.kubernetes.reconciler.Annotations;
import io.syncwarden.kubernetes.reconciler.ResourcesUtil;

/**
 * {@link RSyncStore} backed by the fabric8 client.
 *
 * @param <R> RootSync or RepoSync
 */
public class KubernetesRSyncStore<R extends CustomResource<RSyncSpec, RSyncStatus> & RSync> implements RSyncStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(KubernetesRSyncStore.class);

    private final KubernetesClient client;
    private final Class<R> type;
    private final String namespace;
    private final String name;
    private final String rootSyncNamespace;

    KubernetesRSyncStore(KubernetesClient client, Class<R> type, String namespace, String name, String rootSyncNamespace) {
        this.client = Objects.requireNonNull(client);
        this.type = Objects.requireNonNull(type);
        this.namespace = Objects.requireNonNull(namespace);
        this.name = Objects.requireNonNull(name);
        this.rootSyncNamespace = Objects.requireNonNull(rootSyncNamespace);
    }

    public static KubernetesRSyncStore<RootSync> forRootSync(KubernetesClient client, String namespace, String name) {
        return new KubernetesRSyncStore<>(client, RootSync.class, namespace, name, namespace);
    }

    public static KubernetesRSyncStore<RepoSync> forRepoSync(KubernetesClient client, String namespace, String name, String rootSyncNamespace) {
        return new KubernetesRSyncStore<>(client, RepoSync.class, namespace, name, rootSyncNamespace);
    }

    private Resource<R> served() {
        return client.resources(type).inNamespace(namespace).withName(name);
    }

    @Override
    public Optional<RSync> get() {
        return Optional.ofNullable(served().get());
    }

    @Override
    public void updateStatus(RSync rsync) {
        client.resource(type.cast(rsync)).updateStatus();
    }

    @Override
    public void annotate(String key, String value) {
        R current = served().get();
        if (current == null || Annotations.readAnnotation(current, key).filter(value::equals).isPresent()) {
            return;
        }
        served().edit(r -> {
            Annotations.annotate(r, key, value);
            return r;
        });
    }

    @Override
    public Optional<RootSync> getRootSync(String rootSyncName) {
        return Optional.ofNullable(client.resources(RootSync.class).inNamespace(rootSyncNamespace).withName(rootSyncName).get());
    }

    @Override
    public void updateRootSyncStatus(RootSync rootSync) {
        client.resource(rootSync).updateStatus();
    }

    @Override
    public void addFinalizer(String finalizer) {
        R current = served().get();
        if (current == null || current.getFinalizers().contains(finalizer)) {
            return;
        }
        served().edit(r -> {
            r.addFinalizer(finalizer);
            return r;
        });
        LOGGER.info("Added finalizer {} to {}", finalizer, ResourcesUtil.describe(current));
    }

    @Override
    public void removeFinalizer(String finalizer) {
        R current = served().get();
        if (current == null || !current.getFinalizers().contains(finalizer)) {
            return;
        }
        try {
            served().edit(r -> {
                r.removeFinalizer(finalizer);
                return r;
            });
            LOGGER.info("Removed finalizer {} from {}", finalizer, ResourcesUtil.describe(current));
        }
        catch (KubernetesClientException e) {
            if (!ResourcesUtil.isNotFound(e)) {
                throw e;
            }
        }
    }

    @Override
    public AutoCloseable watch(Consumer<RSync> onChange) {
        SharedIndexInformer<R> informer = served().inform(new ResourceEventHandler<R>() {
            @Override
            public void onAdd(R obj) {
                onChange.accept(obj);
            }

            @Override
            public void onUpdate(R oldObj, R newObj) {
                onChange.accept(newObj);
            }

            @Override
            public void onDelete(R obj, boolean deletedFinalStateUnknown) {
                LOGGER.debug("{} deleted", ResourcesUtil.describe(obj));
            }
        });
        return informer::stop;
    }
}
