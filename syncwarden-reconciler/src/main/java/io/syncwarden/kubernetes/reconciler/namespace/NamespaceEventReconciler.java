/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.namespace;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;

import static io.syncwarden.kubernetes.reconciler.ResourcesUtil.name;

/**
 * Records namespace label changes in the {@link NamespaceControllerState}. Namespaces being deleted are forgotten.
 * Labels do not change a namespace's generation, so every event is processed.
 */
@ControllerConfiguration(name = NamespaceEventReconciler.NAME, generationAwareEventProcessing = false)
public class NamespaceEventReconciler implements Reconciler<Namespace> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NamespaceEventReconciler.class);

    static final String NAME = "namespaces";

    private final NamespaceControllerState state;

    public NamespaceEventReconciler(NamespaceControllerState state) {
        this.state = Objects.requireNonNull(state);
    }

    @Override
    public UpdateControl<Namespace> reconcile(Namespace namespace, Context<Namespace> context) {
        String name = name(namespace);
        if (namespace.getMetadata().getDeletionTimestamp() != null) {
            if (state.forget(name)) {
                LOGGER.debug("Namespace {} is being deleted, scheduling a namespace resync", name);
            }
        }
        else {
            Map<String, String> labels = Optional.ofNullable(namespace.getMetadata()).map(ObjectMeta::getLabels).orElse(Map.of());
            if (state.observe(name, labels)) {
                LOGGER.debug("Namespace {} labels changed, scheduling a namespace resync", name);
            }
        }
        return UpdateControl.noUpdate();
    }
}
