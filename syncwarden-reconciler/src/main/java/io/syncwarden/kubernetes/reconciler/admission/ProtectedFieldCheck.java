/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.admission;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.syncwarden.kubernetes.reconciler.Annotations;
import io.syncwarden.kubernetes.reconciler.ResourcesUtil;
import io.syncwarden.kubernetes.reconciler.config.ReconcilerConfiguration;
import io.syncwarden.kubernetes.reconciler.declared.FieldPathSet;
import io.syncwarden.kubernetes.reconciler.declared.ManagerName;

/**
 * Decides whether a write by someone other than the owning pipeline may change a managed object.
 * A write is denied if it changes the reconciler's own bookkeeping metadata, or if it changes a field the
 * object's manifest declares. Writes by the service account of the reconciler named in the object's
 * manager annotation are always allowed.
 */
public class ProtectedFieldCheck {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProtectedFieldCheck.class);

    private final FieldDiffer differ;
    private final String reconcilerNamespace;

    public ProtectedFieldCheck() {
        this(new FieldDiffer(), ReconcilerConfiguration.DEFAULT_RSYNC_NAMESPACE);
    }

    /**
     * @param differ computes the changed fields
     * @param reconcilerNamespace the namespace the reconcilers and their service accounts live in
     */
    public ProtectedFieldCheck(FieldDiffer differ, String reconcilerNamespace) {
        this.differ = Objects.requireNonNull(differ);
        this.reconcilerNamespace = Objects.requireNonNull(reconcilerNamespace);
    }

    /**
     * @param oldObject the live object
     * @param newObject the object the requester wants to write
     * @param requester the user or service account making the request
     * @return the decision
     */
    public AdmissionDecision review(HasMetadata oldObject, HasMetadata newObject, String requester) {
        if (isOwningReconciler(oldObject, requester)) {
            return AdmissionDecision.allow();
        }
        FieldPathSet changed = differ.diff(oldObject, newObject);
        if (changed.isEmpty()) {
            return AdmissionDecision.allow();
        }
        FieldPathSet reserved = FieldDiffer.reservedMetadataSubset(changed);
        if (!reserved.isEmpty()) {
            return deny(oldObject, reserved, requester + " cannot modify reserved metadata of " + ResourcesUtil.describe(oldObject) + ": ");
        }
        if (Annotations.readAnnotation(oldObject, Annotations.MANAGER_ANNOTATION_KEY).isEmpty() || Annotations.isManagementDisabled(oldObject)) {
            return AdmissionDecision.allow();
        }
        FieldPathSet overlap = changed.intersect(FieldDiffer.declaredSubset(oldObject));
        if (overlap.isEmpty()) {
            return AdmissionDecision.allow();
        }
        return deny(oldObject, overlap, requester + " cannot modify fields of " + ResourcesUtil.describe(oldObject) + " which are declared in the source of truth: ");
    }

    private boolean isOwningReconciler(HasMetadata object, String requester) {
        Optional<String> manager = Annotations.readAnnotation(object, Annotations.MANAGER_ANNOTATION_KEY);
        if (manager.isEmpty()) {
            return false;
        }
        try {
            return ManagerName.parse(manager.get()).serviceAccountUser(reconcilerNamespace).equals(requester);
        }
        catch (IllegalArgumentException e) {
            LOGGER.atWarn().setMessage("Ignoring malformed manager annotation on {}: {}")
                    .addArgument(() -> ResourcesUtil.describe(object))
                    .addArgument(e::getMessage)
                    .log();
            return false;
        }
    }

    private static AdmissionDecision deny(HasMetadata object, FieldPathSet fields, String prefix) {
        LOGGER.atInfo().setMessage("Denying write to {} touching {}")
                .addArgument(() -> ResourcesUtil.describe(object))
                .addArgument(fields::toDisplayString)
                .log();
        return AdmissionDecision.deny(fields, prefix + fields.toDisplayString());
    }
}
