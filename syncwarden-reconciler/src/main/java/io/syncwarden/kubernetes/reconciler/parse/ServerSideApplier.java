/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import io.syncwarden.kubernetes.reconciler.Annotations;
import io.syncwarden.kubernetes.reconciler.ResourcesUtil;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

/**
 * <p>Applies objects with server-side apply under the {@value #FIELD_MANAGER} field manager, forcing conflicts so
 * that declared fields are taken back from whoever changed them.</p>
 *
 * <p>The inventory of applied objects is held in memory. Objects dropped from the source are pruned on the next
 * apply that succeeds for every object; after a restart the inventory starts empty, so nothing is pruned until
 * the first apply has rebuilt it.</p>
 */
public class ServerSideApplier implements Applier {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerSideApplier.class);

    public static final String FIELD_MANAGER = "syncwarden";

    private final KubernetesClient client;
    private final Map<String, HasMetadata> inventory = new LinkedHashMap<>();
    private volatile List<ReconcilerError> errors = List.of();

    public ServerSideApplier(KubernetesClient client) {
        this.client = Objects.requireNonNull(client);
    }

    @Override
    public synchronized ApplyResult apply(List<HasMetadata> objects) {
        var applyErrors = new ArrayList<ReconcilerError>();
        Set<String> groupKinds = new HashSet<>();
        Map<String, HasMetadata> declared = new LinkedHashMap<>();
        for (HasMetadata object : objects) {
            String id = ResourcesUtil.describe(object);
            declared.put(id, object);
            if (Annotations.isManagementDisabled(object)) {
                LOGGER.debug("Not applying {}: management is disabled", id);
                continue;
            }
            try {
                client.resource(object).fieldManager(FIELD_MANAGER).forceConflicts().serverSideApply();
                groupKinds.add(ResourcesUtil.group(object) + "/" + object.getKind());
                inventory.put(id, object);
            }
            catch (KubernetesClientException e) {
                applyErrors.add(ReconcilerError.forObject(ErrorKind.OBJECT_OPERATION, object, "failed to apply: " + e.getMessage()));
            }
        }
        if (applyErrors.isEmpty()) {
            applyErrors.addAll(prune(declared));
        }
        else {
            LOGGER.info("Skipping prune: {} objects failed to apply", applyErrors.size());
        }
        errors = List.copyOf(applyErrors);
        return new ApplyResult(groupKinds, applyErrors);
    }

    private List<ReconcilerError> prune(Map<String, HasMetadata> declared) {
        var pruneErrors = new ArrayList<ReconcilerError>();
        var iterator = inventory.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, HasMetadata> entry = iterator.next();
            HasMetadata declaredObject = declared.get(entry.getKey());
            if (declaredObject != null && !Annotations.isManagementDisabled(declaredObject)) {
                continue;
            }
            if (declaredObject == null) {
                try {
                    client.resource(entry.getValue()).delete();
                    LOGGER.info("Pruned {}", entry.getKey());
                }
                catch (KubernetesClientException e) {
                    if (!ResourcesUtil.isNotFound(e)) {
                        pruneErrors.add(ReconcilerError.forObject(ErrorKind.OBJECT_OPERATION, entry.getValue(), "failed to prune: " + e.getMessage()));
                        continue;
                    }
                }
            }
            // unmanaged objects are abandoned rather than deleted
            iterator.remove();
        }
        return pruneErrors;
    }

    @Override
    public List<ReconcilerError> errors() {
        return errors;
    }

    @Override
    public synchronized List<ReconcilerError> destroy() {
        var destroyErrors = new ArrayList<ReconcilerError>();
        var iterator = inventory.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, HasMetadata> entry = iterator.next();
            try {
                client.resource(entry.getValue()).delete();
                iterator.remove();
            }
            catch (KubernetesClientException e) {
                if (ResourcesUtil.isNotFound(e)) {
                    iterator.remove();
                }
                else {
                    destroyErrors.add(ReconcilerError.forObject(ErrorKind.OBJECT_OPERATION, entry.getValue(), "failed to delete: " + e.getMessage()));
                }
            }
        }
        LOGGER.info("Destroyed managed objects, {} remaining", inventory.size());
        errors = List.copyOf(destroyErrors);
        return destroyErrors;
    }

    int inventorySize() {
        return inventory.size();
    }
}
