/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.hydrate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;

import io.syncwarden.kubernetes.reconciler.Annotations;
import io.syncwarden.kubernetes.reconciler.ResourcesUtil;
import io.syncwarden.kubernetes.reconciler.declared.FieldPathSet;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

/**
 * Annotates rendered objects with the fields their manifest declares. The admission guard reads the annotation
 * back to decide which fields of a live object belong to this pipeline.
 * <p>
 * The fields that identify an object ({@link #IDENTITY_FIELDS}) are never part of the declared set: changing
 * them would make it a different object.
 * </p>
 */
public class DeclaredFieldHydrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeclaredFieldHydrator.class);

    public static final List<String> IDENTITY_FIELDS = List.of(
            "/apiVersion",
            "/kind",
            "/metadata/name",
            "/metadata/namespace",
            "/metadata/creationTimestamp");

    /**
     * Hydrates every object in place. A malformed object is reported and left without the annotation; the rest
     * of the batch is still hydrated.
     *
     * @param objects rendered objects
     * @return one error per malformed object
     */
    public List<ReconcilerError> hydrate(List<? extends HasMetadata> objects) {
        Objects.requireNonNull(objects);
        var errors = new ArrayList<ReconcilerError>();
        for (HasMetadata object : objects) {
            if (object instanceof GenericKubernetesResource generic) {
                List<String> problems = DefaultProtocolBackfill.apply(generic);
                if (!problems.isEmpty()) {
                    errors.add(ReconcilerError.forObject(ErrorKind.PARSE, object, String.join("\n", problems)));
                    continue;
                }
            }
            Annotations.annotateWithDeclaredFields(object, declaredFields(object));
        }
        if (!errors.isEmpty()) {
            LOGGER.atWarn().setMessage("{} of {} objects could not be hydrated: {}")
                    .addArgument(errors.size())
                    .addArgument(objects.size())
                    .addArgument(() -> ReconcilerError.summarize(errors))
                    .log();
        }
        return errors;
    }

    /**
     * Computes the declared fields of an object, ignoring identity fields and any declared-fields annotation
     * left by an earlier hydration.
     *
     * @param object the object
     * @return its declared fields
     */
    public static FieldPathSet declaredFields(HasMetadata object) {
        Annotations.removeAnnotation(object, Annotations.DECLARED_FIELDS_ANNOTATION_KEY);
        FieldPathSet fields = FieldPathSet.compute(object, IDENTITY_FIELDS);
        LOGGER.atTrace().setMessage("declared fields of {}: {}")
                .addArgument(() -> ResourcesUtil.describe(object))
                .addArgument(fields::toDisplayString)
                .log();
        return fields;
    }
}
