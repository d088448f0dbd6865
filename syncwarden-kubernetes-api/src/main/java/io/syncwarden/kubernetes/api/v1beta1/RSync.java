/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.api.v1beta1;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespaced;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Common view over the two sync pipeline resources, {@link RootSync} and {@link RepoSync}.
 * A RootSync manages cluster scoped and any-namespace objects, a RepoSync manages objects in its own namespace.
 */
public interface RSync extends HasMetadata, Namespaced {

    String GROUP = "syncwarden.io";
    String VERSION = "v1beta1";

    @Nullable
    RSyncSpec getSpec();

    void setSpec(RSyncSpec spec);

    @Nullable
    RSyncStatus getStatus();

    void setStatus(RSyncStatus status);

    /**
     * @return true if this is a root scoped pipeline.
     */
    boolean isRootScoped();
}
