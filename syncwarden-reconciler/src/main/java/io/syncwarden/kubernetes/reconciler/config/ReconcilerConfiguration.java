/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import io.syncwarden.kubernetes.reconciler.declared.ManagerName;
import io.syncwarden.kubernetes.reconciler.status.SourceType;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Configuration of one reconciler process. A process serves exactly one RSync: the RootSync named
 * {@code syncName} when {@code scope} is {@value ManagerName#ROOT_SCOPE}, otherwise the RepoSync of that name
 * in the namespace given by {@code scope}.
 *
 * @param scope {@value ManagerName#ROOT_SCOPE} or the namespace of the RepoSync
 * @param syncName name of the RSync served
 * @param rsyncNamespace namespace holding RootSync objects
 * @param reconcilerName name of this reconciler, used in status and logs
 * @param clusterName name of the cluster, reported in published messages
 * @param sourceType where configuration is read from
 * @param sourceRepo repository, image or chart repository
 * @param sourceBranch git branch
 * @param sourceRev git revision or requested chart version
 * @param syncDir directory within the source to sync, or the chart name for helm
 * @param sourceRoot directory holding the link to the fetched source
 * @param hydratedRoot directory holding the link to the rendered output
 * @param repoRoot directory holding the rendering done file
 * @param renderingEnabled whether a renderer runs alongside this reconciler
 * @param webhookEnabled whether the admission guard protects declared fields
 * @param dynamicNamespaceSelectorEnabled whether namespace label changes trigger a resync (root scope only)
 * @param pollingPeriod how often the source is checked for a new commit
 * @param resyncPeriod how often everything is re-applied even without a new commit
 * @param retryPeriod initial delay before retrying a failed sync
 * @param statusUpdatePeriod how often sync status is republished
 * @param namespaceResyncPeriod how often namespace events are checked for
 * @param apiServerTimeout timeout of each API server call
 * @param publishing where apply outcomes are published, if anywhere
 */
public record ReconcilerConfiguration(@JsonProperty(value = "scope", required = true) String scope,
                                      @JsonProperty(value = "syncName", required = true) String syncName,
                                      @JsonProperty("rsyncNamespace") @Nullable String rsyncNamespace,
                                      @JsonProperty("reconcilerName") @Nullable String reconcilerName,
                                      @JsonProperty("clusterName") @Nullable String clusterName,
                                      @JsonProperty("sourceType") @Nullable SourceType sourceType,
                                      @JsonProperty("sourceRepo") @Nullable String sourceRepo,
                                      @JsonProperty("sourceBranch") @Nullable String sourceBranch,
                                      @JsonProperty("sourceRev") @Nullable String sourceRev,
                                      @JsonProperty("syncDir") @Nullable String syncDir,
                                      @JsonProperty("sourceRoot") @Nullable Path sourceRoot,
                                      @JsonProperty("hydratedRoot") @Nullable Path hydratedRoot,
                                      @JsonProperty("repoRoot") @Nullable Path repoRoot,
                                      @JsonProperty("renderingEnabled") boolean renderingEnabled,
                                      @JsonProperty("webhookEnabled") boolean webhookEnabled,
                                      @JsonProperty("dynamicNamespaceSelectorEnabled") boolean dynamicNamespaceSelectorEnabled,
                                      @JsonProperty("pollingPeriod") @JsonDeserialize(using = GoDurationSerde.Deserializer.class) @JsonSerialize(using = GoDurationSerde.Serializer.class) @Nullable Duration pollingPeriod,
                                      @JsonProperty("resyncPeriod") @JsonDeserialize(using = GoDurationSerde.Deserializer.class) @JsonSerialize(using = GoDurationSerde.Serializer.class) @Nullable Duration resyncPeriod,
                                      @JsonProperty("retryPeriod") @JsonDeserialize(using = GoDurationSerde.Deserializer.class) @JsonSerialize(using = GoDurationSerde.Serializer.class) @Nullable Duration retryPeriod,
                                      @JsonProperty("statusUpdatePeriod") @JsonDeserialize(using = GoDurationSerde.Deserializer.class) @JsonSerialize(using = GoDurationSerde.Serializer.class) @Nullable Duration statusUpdatePeriod,
                                      @JsonProperty("namespaceResyncPeriod") @JsonDeserialize(using = GoDurationSerde.Deserializer.class) @JsonSerialize(using = GoDurationSerde.Serializer.class) @Nullable Duration namespaceResyncPeriod,
                                      @JsonProperty("apiServerTimeout") @JsonDeserialize(using = GoDurationSerde.Deserializer.class) @JsonSerialize(using = GoDurationSerde.Serializer.class) @Nullable Duration apiServerTimeout,
                                      @JsonProperty("publishing") @Nullable PublishingConfiguration publishing) {

    public static final String DEFAULT_RSYNC_NAMESPACE = "syncwarden-system";
    public static final Path DEFAULT_SOURCE_ROOT = Path.of("/repo/source");
    public static final Path DEFAULT_HYDRATED_ROOT = Path.of("/repo/hydrated");
    public static final Path DEFAULT_REPO_ROOT = Path.of("/repo");
    public static final Duration DEFAULT_POLLING_PERIOD = Duration.ofSeconds(15);
    public static final Duration DEFAULT_RESYNC_PERIOD = Duration.ofHours(1);
    public static final Duration DEFAULT_RETRY_PERIOD = Duration.ofSeconds(1);
    public static final Duration DEFAULT_STATUS_UPDATE_PERIOD = Duration.ofMinutes(1);
    public static final Duration DEFAULT_NAMESPACE_RESYNC_PERIOD = Duration.ofSeconds(1);
    public static final Duration DEFAULT_API_SERVER_TIMEOUT = Duration.ofSeconds(15);

    public ReconcilerConfiguration {
        Objects.requireNonNull(scope);
        Objects.requireNonNull(syncName);
        if (scope.isBlank()) {
            throw new IllegalArgumentException("scope must not be blank");
        }
        if (syncName.isBlank()) {
            throw new IllegalArgumentException("syncName must not be blank");
        }
        rsyncNamespace = orDefault(rsyncNamespace, DEFAULT_RSYNC_NAMESPACE);
        reconcilerName = orDefault(reconcilerName, defaultReconcilerName(scope, syncName));
        clusterName = orDefault(clusterName, "");
        sourceType = sourceType == null ? SourceType.GIT : sourceType;
        sourceRepo = orDefault(sourceRepo, "");
        sourceBranch = orDefault(sourceBranch, "");
        sourceRev = orDefault(sourceRev, "HEAD");
        syncDir = orDefault(syncDir, "");
        sourceRoot = sourceRoot == null ? DEFAULT_SOURCE_ROOT : sourceRoot;
        hydratedRoot = hydratedRoot == null ? DEFAULT_HYDRATED_ROOT : hydratedRoot;
        repoRoot = repoRoot == null ? DEFAULT_REPO_ROOT : repoRoot;
        pollingPeriod = positive("pollingPeriod", pollingPeriod, DEFAULT_POLLING_PERIOD);
        resyncPeriod = positive("resyncPeriod", resyncPeriod, DEFAULT_RESYNC_PERIOD);
        retryPeriod = positive("retryPeriod", retryPeriod, DEFAULT_RETRY_PERIOD);
        statusUpdatePeriod = positive("statusUpdatePeriod", statusUpdatePeriod, DEFAULT_STATUS_UPDATE_PERIOD);
        namespaceResyncPeriod = positive("namespaceResyncPeriod", namespaceResyncPeriod, DEFAULT_NAMESPACE_RESYNC_PERIOD);
        apiServerTimeout = positive("apiServerTimeout", apiServerTimeout, DEFAULT_API_SERVER_TIMEOUT);
        if (dynamicNamespaceSelectorEnabled && !ManagerName.ROOT_SCOPE.equals(scope)) {
            throw new IllegalArgumentException("dynamicNamespaceSelectorEnabled is only supported for the " + ManagerName.ROOT_SCOPE + " scope");
        }
    }

    private static String orDefault(@Nullable String value, String defaultValue) {
        return value == null ? defaultValue : value;
    }

    private static Duration positive(String name, @Nullable Duration value, Duration defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, but was " + GoDurationSerde.format(value));
        }
        return value;
    }

    private static String defaultReconcilerName(String scope, String syncName) {
        return new ManagerName(scope, syncName).reconcilerName();
    }

    @JsonIgnore
    public boolean isRootScoped() {
        return ManagerName.ROOT_SCOPE.equals(scope);
    }

    /**
     * @return the manager recorded on every object this reconciler applies
     */
    public ManagerName managerName() {
        return new ManagerName(scope, syncName);
    }

    /**
     * @return the namespace of the RSync served
     */
    public String servedNamespace() {
        return isRootScoped() ? rsyncNamespace : scope;
    }

    public Optional<PublishingConfiguration> publishingConfiguration() {
        return Optional.ofNullable(publishing);
    }
}
