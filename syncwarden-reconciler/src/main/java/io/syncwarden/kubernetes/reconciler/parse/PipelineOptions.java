/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

import io.syncwarden.kubernetes.reconciler.config.ReconcilerConfiguration;
import io.syncwarden.kubernetes.reconciler.declared.ManagerName;
import io.syncwarden.kubernetes.reconciler.status.SourceSpec;
import io.syncwarden.kubernetes.reconciler.status.SourceType;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The settings a {@link SyncPipeline} runs with.
 *
 * @param managerName the manager recorded on applied objects
 * @param reconcilerName the name of this reconciler process
 * @param rsyncNamespace namespace of the served RSync
 * @param clusterName the cluster name reported in status messages
 * @param nodeName the node name reported in status messages
 * @param sourceType the kind of source
 * @param sourceRepo the repository, image or chart repository
 * @param sourceBranch the git branch
 * @param sourceRev the git revision or the requested chart version
 * @param syncDir the directory within the source, or the chart name
 * @param renderingEnabled whether a renderer runs alongside this reconciler
 * @param webhookEnabled whether the admission guard protects declared fields
 * @param statusUpdatePeriod how often sync status is republished while an apply runs
 * @param publishTopic where status messages go, or null if they are not published
 * @param clock the clock stamping status updates
 */
public record PipelineOptions(ManagerName managerName,
                              String reconcilerName,
                              String rsyncNamespace,
                              String clusterName,
                              String nodeName,
                              SourceType sourceType,
                              String sourceRepo,
                              String sourceBranch,
                              String sourceRev,
                              String syncDir,
                              boolean renderingEnabled,
                              boolean webhookEnabled,
                              Duration statusUpdatePeriod,
                              @Nullable String publishTopic,
                              Clock clock) {

    public PipelineOptions {
        Objects.requireNonNull(managerName);
        Objects.requireNonNull(reconcilerName);
        Objects.requireNonNull(rsyncNamespace);
        Objects.requireNonNull(clusterName);
        Objects.requireNonNull(nodeName);
        Objects.requireNonNull(sourceType);
        Objects.requireNonNull(sourceRepo);
        Objects.requireNonNull(sourceBranch);
        Objects.requireNonNull(sourceRev);
        Objects.requireNonNull(syncDir);
        Objects.requireNonNull(statusUpdatePeriod);
        Objects.requireNonNull(clock);
    }

    public static PipelineOptions from(ReconcilerConfiguration config, String nodeName, Clock clock) {
        return new PipelineOptions(config.managerName(),
                config.reconcilerName(),
                config.servedNamespace(),
                config.clusterName(),
                nodeName,
                config.sourceType(),
                config.sourceRepo(),
                config.sourceBranch(),
                config.sourceRev(),
                config.syncDir(),
                config.renderingEnabled(),
                config.webhookEnabled(),
                config.statusUpdatePeriod(),
                config.publishingConfiguration().map(p -> p.topic()).orElse(null),
                clock);
    }

    public boolean isRootScoped() {
        return managerName.isRootScoped();
    }

    /**
     * @param commit the resolved commit
     * @return the source spec recorded alongside statuses computed for that commit
     */
    public SourceSpec sourceSpec(String commit) {
        return SourceSpec.of(sourceType, sourceRepo, sourceBranch, sourceRev, syncDir, commit);
    }
}
