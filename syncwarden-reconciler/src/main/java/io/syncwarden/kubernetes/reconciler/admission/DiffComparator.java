/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.admission;

/**
 * How two versions of a list are compared by the {@link FieldDiffer}.
 * <p>
 * The two comparators disagree on whether reordering a list without changing its elements is a change. Both
 * behaviours are kept deliberately; callers pick the one they need rather than the differ guessing.
 * </p>
 */
public enum DiffComparator {

    /**
     * Lists are compared by position. Swapping two elements changes the list's path.
     */
    STRUCTURAL,

    /**
     * A list with the same length and the same elements, in any order, is unchanged.
     * This is what the admission guard uses.
     */
    EQUIVALENT
}
