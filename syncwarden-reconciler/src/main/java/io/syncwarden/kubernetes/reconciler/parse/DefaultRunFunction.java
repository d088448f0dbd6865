/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncwarden.kubernetes.reconciler.ReconcilerMetrics;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerException;
import io.syncwarden.kubernetes.reconciler.errors.SourceFetchException;
import io.syncwarden.kubernetes.reconciler.status.ReconcilerStatus;
import io.syncwarden.kubernetes.reconciler.status.RenderingStatus;
import io.syncwarden.kubernetes.reconciler.status.SourceSpec;
import io.syncwarden.kubernetes.reconciler.status.SourceStatus;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>The parse-apply-watch run:</p>
 * <ol>
 *     <li>prime the in-memory status from the RSync on the first run,</li>
 *     <li>resolve the source commit and directory,</li>
 *     <li>write the source status if the fetch failed or the commit changed,</li>
 *     <li>wait for the renderer to finish the commit, when rendering is enabled,</li>
 *     <li>read the manifest files, unless the directory is the one already cached; a reimport stops here when
 *     nothing changed,</li>
 *     <li>parse, validate and hydrate the objects, unless the cached result is still current,</li>
 *     <li>apply them,</li>
 *     <li>republishing the sync status periodically while the apply runs,</li>
 *     <li>write the final sync status from the apply, remediator and conflict errors,</li>
 *     <li>checkpoint, only if every step succeeded.</li>
 * </ol>
 * <p>Any failure invalidates the cache, so the next retry repeats every step.</p>
 */
public class DefaultRunFunction implements RunFunction {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRunFunction.class);

    static final String STAGE_READ = "read";
    static final String STAGE_PARSE = "parse";
    static final String STAGE_UPDATE = "update";

    static final String WET_SOURCE_WITH_RENDERING = "sync source contains only wet configs and hydration-controller is running";
    static final String DRY_SOURCE_WITHOUT_RENDERING = "sync source contains dry configs and hydration-controller is not running";

    private record ReadOutcome(String renderingMessage,
                               boolean requiresRendering,
                               List<ReconcilerError> renderingErrors,
                               List<ReconcilerError> sourceErrors) {}

    @Override
    public RunResult run(SyncPipeline pipeline, Trigger trigger, ReconcilerState state) {
        return state.withRunLock(() -> {
            LOGGER.debug("Starting a {} run of {}", trigger, pipeline.options().managerName());
            RunResult result = doRun(pipeline, trigger, state);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Finished a {} run of {}: success={}, sourceChanged={}, errors={}", trigger, pipeline.options().managerName(),
                        result.success(), result.sourceChanged(), ReconcilerError.summarize(result.errors()));
            }
            return result;
        });
    }

    private RunResult doRun(SyncPipeline pipeline, Trigger trigger, ReconcilerState state) {
        PipelineOptions options = pipeline.options();
        Clock clock = options.clock();
        if (state.status() == null) {
            try {
                state.status(pipeline.readReconcilerStatus());
            }
            catch (ReconcilerException e) {
                return fail(state, List.of(e.error()));
            }
        }
        ReconcilerStatus status = Objects.requireNonNull(state.status());

        String commit = "";
        Path syncDir = null;
        List<ReconcilerError> fetchErrors = List.of();
        try {
            SourceRevision revision = pipeline.sourceReader().readSource();
            commit = revision.commit();
            syncDir = revision.syncDir();
        }
        catch (SourceFetchException e) {
            fetchErrors = List.of(ReconcilerError.of(ErrorKind.FETCH, String.valueOf(e.getMessage()), e));
        }
        SourceSpec spec = options.sourceSpec(commit);

        // a status for an unchanged commit may hold parse errors, which a fetch must not overwrite
        if (!fetchErrors.isEmpty() || status.sourceStatus() == null || !commit.equals(status.sourceStatus().commit())) {
            var sourceStatus = new SourceStatus(spec, commit, fetchErrors, clock.instant());
            try {
                writeSourceStatus(pipeline, state, status, sourceStatus);
            }
            catch (ReconcilerException e) {
                return fail(state, concat(fetchErrors, List.of(e.error())));
            }
            if (!fetchErrors.isEmpty()) {
                return fail(state, fetchErrors);
            }
        }
        Objects.requireNonNull(syncDir);

        boolean requiresRendering = status.renderingStatus() != null && status.renderingStatus().requiresRendering();
        if (options.renderingEnabled()) {
            Optional<RunResult> notRendered = checkRenderingDone(pipeline, state, status, spec, commit, requiresRendering);
            if (notRendered.isPresent()) {
                return notRendered.get();
            }
        }

        SourceState oldSource = state.cache().source();
        Path oldSyncDir = oldSource == null ? null : oldSource.syncDir();
        List<ReconcilerError> readErrors = read(pipeline, trigger, state, new SourceState(spec, commit, syncDir, List.of()));
        if (!readErrors.isEmpty()) {
            return fail(state, readErrors);
        }
        SourceState newSource = state.cache().source();
        Path newSyncDir = newSource == null ? null : newSource.syncDir();
        boolean sourceChanged = !Objects.equals(oldSyncDir, newSyncDir);
        if (sourceChanged) {
            LOGGER.info("{} is syncing {} from {}", options.managerName(), commit, newSyncDir);
        }

        // earlier runs over this directory either succeeded or are being retried
        if (trigger == Trigger.REIMPORT && !sourceChanged) {
            return new RunResult(false, false, List.of());
        }

        List<ReconcilerError> errors = parseAndUpdate(pipeline, trigger, state);
        if (!errors.isEmpty()) {
            state.invalidate(errors);
            return new RunResult(sourceChanged, false, withStageContext(errors));
        }
        state.checkpoint();
        return new RunResult(sourceChanged, true, List.of());
    }

    private static void writeSourceStatus(SyncPipeline pipeline, ReconcilerState state, ReconcilerStatus status, SourceStatus sourceStatus) {
        state.withStatusLock(() -> {
            if (status.needToSetSourceStatus(sourceStatus)) {
                LOGGER.debug("Updating source status");
                pipeline.setSourceStatus(sourceStatus);
                status.sourceStatus(sourceStatus);
            }
        });
    }

    private static void writeRenderingStatus(SyncPipeline pipeline, ReconcilerState state, ReconcilerStatus status, RenderingStatus renderingStatus) {
        state.withStatusLock(() -> {
            LOGGER.debug("Updating rendering status");
            pipeline.setRenderingStatus(status.renderingStatus(), renderingStatus);
            status.renderingStatus(renderingStatus);
        });
    }

    private Optional<RunResult> checkRenderingDone(SyncPipeline pipeline,
                                                   ReconcilerState state,
                                                   ReconcilerStatus status,
                                                   SourceSpec spec,
                                                   String commit,
                                                   boolean requiresRendering) {
        Instant now = pipeline.options().clock().instant();
        Optional<String> doneCommit;
        try {
            doneCommit = pipeline.sourceReader().renderingDoneCommit();
        }
        catch (SourceFetchException e) {
            var failed = new RenderingStatus(spec, commit, RenderingStatus.RENDERING_FAILED,
                    List.of(ReconcilerError.of(ErrorKind.RENDERING, String.valueOf(e.getMessage()), e)), now, requiresRendering);
            var errors = new ArrayList<>(failed.errors());
            try {
                writeRenderingStatus(pipeline, state, status, failed);
            }
            catch (ReconcilerException re) {
                errors.add(re.error());
            }
            return Optional.of(fail(state, errors));
        }
        if (doneCommit.isPresent() && doneCommit.get().equals(commit)) {
            return Optional.empty();
        }
        var inProgress = new RenderingStatus(spec, commit, RenderingStatus.RENDERING_IN_PROGRESS, List.of(), now, requiresRendering);
        try {
            writeRenderingStatus(pipeline, state, status, inProgress);
            state.resetCache();
            return Optional.of(new RunResult(false, false, List.of()));
        }
        catch (ReconcilerException e) {
            return Optional.of(fail(state, List.of(e.error())));
        }
    }

    /**
     * Reads the source, or its rendered output, and writes the rendering status and, on failure, the source status.
     */
    private List<ReconcilerError> read(SyncPipeline pipeline, Trigger trigger, ReconcilerState state, SourceState candidate) {
        PipelineOptions options = pipeline.options();
        ReconcilerStatus status = Objects.requireNonNull(state.status());
        ReadOutcome outcome = readFromSource(pipeline, trigger, state, candidate);

        var renderingErrors = new ArrayList<>(outcome.renderingErrors());
        if (options.renderingEnabled() != outcome.requiresRendering()) {
            // the reconciler is misconfigured; the annotation lets it be recreated with rendering flipped
            try {
                pipeline.setRequiresRendering(outcome.requiresRendering());
            }
            catch (ReconcilerException e) {
                renderingErrors.add(ReconcilerError.of(ErrorKind.RENDERING, e.error().message(), e));
            }
        }
        var renderingStatus = new RenderingStatus(candidate.spec(), candidate.commit(), outcome.renderingMessage(), renderingErrors,
                options.clock().instant(), outcome.requiresRendering());
        try {
            writeRenderingStatus(pipeline, state, status, renderingStatus);
        }
        catch (ReconcilerException e) {
            renderingErrors.add(e.error());
        }
        if (!renderingErrors.isEmpty()) {
            return renderingErrors;
        }
        if (outcome.sourceErrors().isEmpty()) {
            return List.of();
        }

        var errors = new ArrayList<>(outcome.sourceErrors());
        var sourceStatus = new SourceStatus(candidate.spec(), candidate.commit(), outcome.sourceErrors(), options.clock().instant());
        try {
            writeSourceStatus(pipeline, state, status, sourceStatus);
        }
        catch (ReconcilerException e) {
            errors.add(e.error());
        }
        return errors;
    }

    private ReadOutcome readFromSource(SyncPipeline pipeline, Trigger trigger, ReconcilerState state, SourceState candidate) {
        PipelineOptions options = pipeline.options();
        Instant start = options.clock().instant();
        SourceState source = candidate;
        String message;
        if (options.renderingEnabled()) {
            try {
                Optional<SourceRevision> hydrated = pipeline.sourceReader().readHydrated();
                if (hydrated.isEmpty()) {
                    return new ReadOutcome(RenderingStatus.RENDERING_NOT_REQUIRED, false,
                            List.of(ReconcilerError.of(ErrorKind.RENDERING, WET_SOURCE_WITH_RENDERING)), List.of());
                }
                source = new SourceState(candidate.spec(), candidate.commit(), hydrated.get().syncDir(), List.of());
                message = RenderingStatus.RENDERING_SUCCEEDED;
            }
            catch (SourceFetchException e) {
                return new ReadOutcome(RenderingStatus.RENDERING_FAILED, true,
                        List.of(ReconcilerError.of(ErrorKind.RENDERING, String.valueOf(e.getMessage()), e)), List.of());
            }
        }
        else {
            message = RenderingStatus.RENDERING_SKIPPED;
        }

        SourceState cached = state.cache().source();
        if (cached != null && source.syncDir().equals(cached.syncDir())) {
            return new ReadOutcome(message, options.renderingEnabled(), List.of(), List.of());
        }

        List<ReconcilerError> sourceErrors = List.of();
        try {
            source = source.withFiles(pipeline.sourceReader().listConfigFiles(source.syncDir()));
        }
        catch (SourceFetchException e) {
            sourceErrors = List.of(ReconcilerError.of(ErrorKind.FETCH, String.valueOf(e.getMessage()), e));
        }

        if (!options.renderingEnabled() && source.hasKustomization()) {
            return new ReadOutcome(RenderingStatus.RENDERING_REQUIRED, true,
                    List.of(ReconcilerError.of(ErrorKind.RENDERING, DRY_SOURCE_WITHOUT_RENDERING)), sourceErrors);
        }

        LOGGER.info("New source changes ({}) detected, reset the cache", source.syncDir());
        state.resetCache(sourceErrors.isEmpty() ? source : null);
        recordDuration(pipeline, trigger, STAGE_READ, sourceErrors, start);
        return new ReadOutcome(message, options.renderingEnabled(), List.of(), sourceErrors);
    }

    private List<ReconcilerError> parseSource(SyncPipeline pipeline, Trigger trigger, ReconcilerState state) {
        ReconcilerCache cache = state.cache();
        if (cache.parserResultUpToDate()) {
            return cache.parserErrors();
        }
        Instant start = pipeline.options().clock().instant();
        SyncPipeline.Parsed parsed = pipeline.parseSource(Objects.requireNonNull(cache.source()));
        recordDuration(pipeline, trigger, STAGE_PARSE, parsed.errors(), start);
        cache.setParserResult(parsed.objects(), parsed.errors());
        return parsed.errors();
    }

    private List<ReconcilerError> parseAndUpdate(SyncPipeline pipeline, Trigger trigger, ReconcilerState state) {
        PipelineOptions options = pipeline.options();
        ReconcilerStatus status = Objects.requireNonNull(state.status());
        LOGGER.debug("Parser starting");
        List<ReconcilerError> sourceErrors = parseSource(pipeline, trigger, state);
        LOGGER.debug("Parser stopped");
        SourceState source = Objects.requireNonNull(state.cache().source());
        var sourceStatus = new SourceStatus(source.spec(), source.commit(), sourceErrors, options.clock().instant());
        try {
            writeSourceStatus(pipeline, state, status, sourceStatus);
        }
        catch (ReconcilerException e) {
            // applying now would leave the sync commit ahead of the source commit
            return concat(sourceErrors, List.of(e.error()));
        }
        if (ReconcilerError.anyBlocksApply(sourceErrors)) {
            return sourceErrors;
        }

        LOGGER.debug("Updater starting");
        Instant start = options.clock().instant();
        List<ReconcilerError> updateErrors;
        PeriodicSyncStatusUpdater updater = PeriodicSyncStatusUpdater.start(pipeline, state);
        try {
            updateErrors = pipeline.update(state.cache());
        }
        finally {
            updater.stop();
        }
        recordDuration(pipeline, trigger, STAGE_UPDATE, updateErrors, start);
        LOGGER.debug("Updater stopped");

        var syncErrors = new ArrayList<>(pipeline.syncErrors());
        for (ReconcilerError error : updateErrors) {
            if (!syncErrors.contains(error)) {
                syncErrors.add(error);
            }
        }
        try {
            pipeline.setSyncStatus(state, false, syncErrors);
        }
        catch (ReconcilerException e) {
            syncErrors.add(e.error());
        }
        pipeline.publishApplyOutcome(state, source.commit(), syncErrors);
        return concat(sourceErrors, syncErrors);
    }

    private static void recordDuration(SyncPipeline pipeline, Trigger trigger, String stage, List<ReconcilerError> errors, Instant start) {
        Duration duration = Duration.between(start, pipeline.options().clock().instant());
        pipeline.metrics().recordParserDuration(trigger.label(), stage, ReconcilerMetrics.statusTag(errors), duration);
    }

    private static RunResult fail(ReconcilerState state, List<ReconcilerError> errors) {
        state.invalidate(errors);
        return RunResult.failed(withStageContext(errors));
    }

    private static List<ReconcilerError> withStageContext(List<ReconcilerError> errors) {
        return errors.stream().map(e -> e.wrap(e.kind().stage().name().toLowerCase(Locale.ROOT))).toList();
    }

    private static List<ReconcilerError> concat(List<ReconcilerError> a, @Nullable List<ReconcilerError> b) {
        var all = new ArrayList<>(a);
        if (b != null) {
            all.addAll(b);
        }
        return all;
    }
}
