/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.status;

import java.util.Objects;

import io.syncwarden.kubernetes.api.v1beta1.GitStatus;
import io.syncwarden.kubernetes.api.v1beta1.HelmStatus;
import io.syncwarden.kubernetes.api.v1beta1.OciStatus;
import io.syncwarden.kubernetes.api.v1beta1.RSyncStageStatus;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The source configuration a stage status was computed from. Storing it alongside the status lets the
 * reconciler tell whether a status reflects the current configuration.
 */
public sealed interface SourceSpec permits SourceSpec.Git, SourceSpec.Oci, SourceSpec.Helm {

    SourceType type();

    /**
     * Writes this spec into the matching field of a stage status, clearing the others.
     *
     * @param status the stage status
     */
    void writeTo(RSyncStageStatus status);

    /**
     * Builds the spec for the configured source.
     *
     * @param type the source type
     * @param repo the repository, image or chart repository
     * @param branch the git branch
     * @param revision the git revision or the requested chart version
     * @param dir the directory within the source, or the chart name for helm
     * @param commit the resolved commit; for helm it has the form {@code chart:version}
     * @return the spec
     */
    static SourceSpec of(SourceType type, String repo, String branch, String revision, String dir, String commit) {
        return switch (type) {
            case GIT -> new Git(repo, revision, branch, dir);
            case OCI -> new Oci(repo, dir);
            case HELM -> new Helm(repo, dir, chartVersion(revision, commit));
        };
    }

    /**
     * The requested version can be a range, so the version actually pulled is taken from the commit when it
     * has the {@code chart:version} form.
     */
    private static String chartVersion(String requestedVersion, String commit) {
        String[] parts = commit.split(":", -1);
        if (parts.length == 2) {
            return parts[1];
        }
        return requestedVersion;
    }

    /**
     * @param status a stage status read from the cluster
     * @return the spec recorded in it, or null if none is
     */
    @Nullable
    static SourceSpec readFrom(@Nullable RSyncStageStatus status) {
        if (status == null) {
            return null;
        }
        if (status.getGit() != null) {
            GitStatus git = status.getGit();
            return new Git(nullToEmpty(git.getRepo()), nullToEmpty(git.getRevision()), nullToEmpty(git.getBranch()), nullToEmpty(git.getDir()));
        }
        if (status.getOci() != null) {
            OciStatus oci = status.getOci();
            return new Oci(nullToEmpty(oci.getImage()), nullToEmpty(oci.getDir()));
        }
        if (status.getHelm() != null) {
            HelmStatus helm = status.getHelm();
            return new Helm(nullToEmpty(helm.getRepo()), nullToEmpty(helm.getChart()), nullToEmpty(helm.getVersion()));
        }
        return null;
    }

    private static String nullToEmpty(@Nullable String s) {
        return s == null ? "" : s;
    }

    record Git(String repo, String revision, String branch, String dir) implements SourceSpec {
        public Git {
            Objects.requireNonNull(repo);
            Objects.requireNonNull(revision);
            Objects.requireNonNull(branch);
            Objects.requireNonNull(dir);
        }

        @Override
        public SourceType type() {
            return SourceType.GIT;
        }

        @Override
        public void writeTo(RSyncStageStatus status) {
            var git = new GitStatus();
            git.setRepo(repo);
            git.setRevision(revision);
            git.setBranch(branch);
            git.setDir(dir);
            status.setGit(git);
            status.setOci(null);
            status.setHelm(null);
        }
    }

    record Oci(String image, String dir) implements SourceSpec {
        public Oci {
            Objects.requireNonNull(image);
            Objects.requireNonNull(dir);
        }

        @Override
        public SourceType type() {
            return SourceType.OCI;
        }

        @Override
        public void writeTo(RSyncStageStatus status) {
            var oci = new OciStatus();
            oci.setImage(image);
            oci.setDir(dir);
            status.setGit(null);
            status.setOci(oci);
            status.setHelm(null);
        }
    }

    record Helm(String repo, String chart, String version) implements SourceSpec {
        public Helm {
            Objects.requireNonNull(repo);
            Objects.requireNonNull(chart);
            Objects.requireNonNull(version);
        }

        @Override
        public SourceType type() {
            return SourceType.HELM;
        }

        @Override
        public void writeTo(RSyncStageStatus status) {
            var helm = new HelmStatus();
            helm.setRepo(repo);
            helm.setChart(chart);
            helm.setVersion(version);
            status.setGit(null);
            status.setOci(null);
            status.setHelm(helm);
        }
    }
}
