/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;

import io.syncwarden.kubernetes.reconciler.Annotations;
import io.syncwarden.kubernetes.reconciler.ReconcilerMetrics;
import io.syncwarden.kubernetes.reconciler.ResourcesUtil;
import io.syncwarden.kubernetes.reconciler.declared.Documents;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ManagementConflict;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;
import io.syncwarden.kubernetes.reconciler.hydrate.DeclaredFieldHydrator;
import io.syncwarden.kubernetes.reconciler.pubsub.MessageStatus;
import io.syncwarden.kubernetes.reconciler.pubsub.PublishingException;
import io.syncwarden.kubernetes.reconciler.pubsub.StatusMessage;
import io.syncwarden.kubernetes.reconciler.pubsub.StatusMessagePublisher;
import io.syncwarden.kubernetes.reconciler.status.ConflictReporter;
import io.syncwarden.kubernetes.reconciler.status.RSyncStatusClient;
import io.syncwarden.kubernetes.reconciler.status.ReconcilerStatus;
import io.syncwarden.kubernetes.reconciler.status.RenderingStatus;
import io.syncwarden.kubernetes.reconciler.status.SourceSpec;
import io.syncwarden.kubernetes.reconciler.status.SourceStatus;
import io.syncwarden.kubernetes.reconciler.status.SyncStatus;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>One sync pipeline: the collaborators a run drives and the steps it composes them into.</p>
 *
 * <p>Parsing decodes the manifests, validates them against the pipeline scope, hydrates their declared fields and
 * adds the management metadata. Updating pauses the remediator, applies the objects and refreshes the remediator's
 * watches.</p>
 */
public class SyncPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(SyncPipeline.class);

    /**
     * Objects ready to apply and the errors found producing them.
     *
     * @param objects the objects
     * @param errors parse, validation and hydration errors
     */
    public record Parsed(List<HasMetadata> objects, List<ReconcilerError> errors) {
        public Parsed {
            objects = List.copyOf(objects);
            errors = List.copyOf(errors);
        }
    }

    private final PipelineOptions options;
    private final SourceReader sourceReader;
    private final ManifestParser manifestParser;
    private final DeclaredFieldHydrator hydrator;
    private final Applier applier;
    private final Remediator remediator;
    private final RSyncStatusClient statusClient;
    private final ConflictReporter conflictReporter;
    private final StatusMessagePublisher publisher;
    private final ReconcilerMetrics metrics;

    @SuppressWarnings("java:S107")
    public SyncPipeline(PipelineOptions options,
                        SourceReader sourceReader,
                        ManifestParser manifestParser,
                        DeclaredFieldHydrator hydrator,
                        Applier applier,
                        Remediator remediator,
                        RSyncStatusClient statusClient,
                        ConflictReporter conflictReporter,
                        StatusMessagePublisher publisher,
                        ReconcilerMetrics metrics) {
        this.options = Objects.requireNonNull(options);
        this.sourceReader = Objects.requireNonNull(sourceReader);
        this.manifestParser = Objects.requireNonNull(manifestParser);
        this.hydrator = Objects.requireNonNull(hydrator);
        this.applier = Objects.requireNonNull(applier);
        this.remediator = Objects.requireNonNull(remediator);
        this.statusClient = Objects.requireNonNull(statusClient);
        this.conflictReporter = Objects.requireNonNull(conflictReporter);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
    }

    public PipelineOptions options() {
        return options;
    }

    public SourceReader sourceReader() {
        return sourceReader;
    }

    public ReconcilerMetrics metrics() {
        return metrics;
    }

    public Applier applier() {
        return applier;
    }

    public Remediator remediator() {
        return remediator;
    }

    public ReconcilerStatus readReconcilerStatus() {
        return statusClient.readReconcilerStatus();
    }

    public void setSourceStatus(SourceStatus status) {
        statusClient.setSourceStatus(status);
    }

    public void setRenderingStatus(@Nullable RenderingStatus oldStatus, RenderingStatus newStatus) {
        statusClient.setRenderingStatus(oldStatus, newStatus);
    }

    public void setRequiresRendering(boolean requiresRendering) {
        statusClient.setRequiresRendering(requiresRendering);
    }

    /**
     * Decodes, validates, hydrates and annotates the objects of a source.
     *
     * @param source the source, with its files listed
     * @return the objects and the errors
     */
    public Parsed parseSource(SourceState source) {
        ParseResult result = manifestParser.parse(source);
        var errors = new ArrayList<>(result.errors());
        var valid = new ArrayList<ParsedManifest>();
        Set<String> seen = new HashSet<>();
        for (ParsedManifest manifest : result.manifests()) {
            ReconcilerError invalid = validate(manifest.object());
            if (invalid != null) {
                errors.add(invalid);
                continue;
            }
            if (!seen.add(ResourcesUtil.describe(manifest.object()))) {
                errors.add(ReconcilerError.forObject(ErrorKind.VALIDATION, manifest.object(),
                        "duplicate object declared in " + manifest.relativePath()));
                continue;
            }
            valid.add(manifest);
        }
        List<HasMetadata> objects = valid.stream().<HasMetadata> map(ParsedManifest::object).toList();
        errors.addAll(hydrator.hydrate(objects));
        for (ParsedManifest manifest : valid) {
            GenericKubernetesResource object = manifest.object();
            addManagementMetadata(object, manifest.relativePath(), source.commit());
            if (!options.webhookEnabled()) {
                Annotations.removeAnnotation(object, Annotations.DECLARED_FIELDS_ANNOTATION_KEY);
            }
        }
        return new Parsed(objects, errors);
    }

    private @Nullable ReconcilerError validate(GenericKubernetesResource object) {
        if (isBlank(object.getApiVersion())) {
            return ReconcilerError.forObject(ErrorKind.VALIDATION, object, "apiVersion is required");
        }
        if (isBlank(object.getKind())) {
            return ReconcilerError.forObject(ErrorKind.VALIDATION, object, "kind is required");
        }
        if (isBlank(ResourcesUtil.name(object))) {
            return ReconcilerError.forObject(ErrorKind.VALIDATION, object, "metadata.name is required");
        }
        if (!options.isRootScoped()) {
            String scope = options.managerName().scope();
            String namespace = ResourcesUtil.namespace(object);
            if (namespace.isEmpty()) {
                object.getMetadata().setNamespace(scope);
            }
            else if (!namespace.equals(scope)) {
                return ReconcilerError.forObject(ErrorKind.VALIDATION, object, "objects of a namespace scoped pipeline must be in namespace " + scope);
            }
        }
        return null;
    }

    private static boolean isBlank(@Nullable String s) {
        return s == null || s.isBlank();
    }

    private void addManagementMetadata(HasMetadata object, Path relativePath, String commit) {
        if (Annotations.isManagementDisabled(object)) {
            return;
        }
        Annotations.annotate(object, Annotations.MANAGEMENT_ANNOTATION_KEY, Annotations.MANAGEMENT_ENABLED);
        Annotations.annotate(object, Annotations.MANAGER_ANNOTATION_KEY, options.managerName().value());
        Annotations.annotate(object, Annotations.SOURCE_PATH_ANNOTATION_KEY, sourcePath(relativePath));
        Annotations.annotate(object, Annotations.RESOURCE_ID_ANNOTATION_KEY, resourceId(object));
        Annotations.annotate(object, Annotations.SYNC_TOKEN_ANNOTATION_KEY, commit);
        Annotations.annotate(object, Annotations.OWNING_INVENTORY_ANNOTATION_KEY, options.rsyncNamespace() + "_" + options.managerName().name());
        Annotations.annotate(object, Annotations.GIT_CONTEXT_ANNOTATION_KEY, gitContext());
        Annotations.label(object, Annotations.MANAGED_BY_LABEL_KEY, Annotations.MANAGED_BY_VALUE);
    }

    private String sourcePath(Path relativePath) {
        String file = relativePath.toString().replace('\\', '/');
        String dir = options.syncDir();
        if (dir.isEmpty() || ".".equals(dir)) {
            return file;
        }
        return (dir.endsWith("/") ? dir : dir + "/") + file;
    }

    static String resourceId(HasMetadata object) {
        String namespace = ResourcesUtil.namespace(object);
        String kind = Objects.requireNonNullElse(object.getKind(), "").toLowerCase(Locale.ROOT);
        return ResourcesUtil.group(object) + "_" + kind + "_" + (namespace.isEmpty() ? "" : namespace + "_") + ResourcesUtil.name(object);
    }

    private String gitContext() {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("repo", options.sourceRepo());
        if (!options.sourceBranch().isEmpty()) {
            context.put("branch", options.sourceBranch());
        }
        context.put("rev", options.sourceRev());
        return Documents.serialization().asJson(context);
    }

    /**
     * Applies the cached objects with the remediator paused, then refreshes its watches.
     *
     * @param cache the cache holding the parsed objects
     * @return the apply and watch errors
     */
    public List<ReconcilerError> update(ReconcilerCache cache) {
        remediator.pause();
        try {
            ApplyResult result = applier.apply(cache.objects());
            var errors = new ArrayList<>(result.errors());
            errors.addAll(remediator.updateWatches(result.appliedGroupKinds(), cache.objects()));
            return errors;
        }
        finally {
            remediator.resume();
        }
    }

    /**
     * @return the errors of the last apply, the remediator's errors and its management conflicts
     */
    public List<ReconcilerError> syncErrors() {
        var errors = new ArrayList<>(applier.errors());
        errors.addAll(remediator.errors());
        for (ManagementConflict conflict : remediator.managementConflicts()) {
            errors.add(conflict.toError());
        }
        return errors;
    }

    /**
     * Writes the sync status if it needs writing, then reports management conflicts to the other pipelines.
     *
     * @param state the reconciler state
     * @param syncing true while the apply is still running
     * @param errors the sync errors
     * @throws io.syncwarden.kubernetes.reconciler.errors.ReconcilerException if a status write fails
     */
    public void setSyncStatus(ReconcilerState state, boolean syncing, List<ReconcilerError> errors) {
        ReconcilerStatus status = Objects.requireNonNull(state.status());
        state.withStatusLock(() -> {
            SourceState source = Objects.requireNonNull(state.cache().source());
            SourceSpec spec = status.sourceStatus() != null ? status.sourceStatus().spec() : source.spec();
            var newStatus = new SyncStatus(spec, syncing, source.commit(), errors, options.clock().instant());
            if (status.needToSetSyncStatus(newStatus)) {
                statusClient.setSyncStatus(newStatus);
                status.syncStatus(newStatus);
            }
        });
        conflictReporter.report(remediator.managementConflicts());
    }

    /**
     * Rewrites the last sync status with the current sync errors, keeping its commit. Used between runs, so
     * remediator errors reach the RSync without a run.
     *
     * @param state the reconciler state
     * @throws io.syncwarden.kubernetes.reconciler.errors.ReconcilerException if the status write fails
     */
    public void refreshSyncStatus(ReconcilerState state) {
        ReconcilerStatus status = state.status();
        if (status == null || status.syncStatus() == null) {
            return;
        }
        List<ReconcilerError> errors = syncErrors();
        state.withStatusLock(() -> {
            SyncStatus current = Objects.requireNonNull(status.syncStatus());
            var newStatus = new SyncStatus(current.spec(), false, current.commit(), errors, options.clock().instant());
            if (status.needToSetSyncStatus(newStatus)) {
                statusClient.setSyncStatus(newStatus);
                status.syncStatus(newStatus);
            }
        });
        conflictReporter.report(remediator.managementConflicts());
    }

    /**
     * Publishes the outcome of an apply, unless the same outcome was the last one published.
     *
     * @param state the reconciler state
     * @param commit the commit applied
     * @param errors the sync errors
     */
    public void publishApplyOutcome(ReconcilerState state, String commit, List<ReconcilerError> errors) {
        String topic = options.publishTopic();
        ReconcilerStatus status = state.status();
        if (topic == null || status == null) {
            return;
        }
        var message = new StatusMessage(options.clusterName(),
                options.nodeName(),
                topic,
                options.rsyncNamespace(),
                options.managerName().name(),
                commit,
                errors.isEmpty() ? MessageStatus.APPLY_SUCCEEDED : MessageStatus.APPLY_FAILED,
                errors.isEmpty() ? null : ReconcilerError.summarize(errors));
        state.withStatusLock(() -> {
            if (status.hasPublishedMessage(message)) {
                return;
            }
            try {
                publisher.publish(message);
                status.setPublishedMessage(message);
            }
            catch (PublishingException e) {
                LOGGER.warn("Failed to publish the {} message for commit {}, it will be published after the next apply", message.status().value(),
                        commit, e);
            }
        });
    }
}
