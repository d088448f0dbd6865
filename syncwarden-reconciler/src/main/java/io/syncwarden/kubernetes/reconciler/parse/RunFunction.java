/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

/**
 * Runs one parse-apply-watch pass.
 */
@FunctionalInterface
public interface RunFunction {

    /**
     * @param pipeline the pipeline to run
     * @param trigger why the run was started
     * @param state the state carried between runs
     * @return the outcome
     */
    RunResult run(SyncPipeline pipeline, Trigger trigger, ReconcilerState state);
}
