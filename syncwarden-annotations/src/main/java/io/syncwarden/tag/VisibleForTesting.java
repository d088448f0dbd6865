/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.tag;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a member whose visibility was widened beyond what production callers need so that tests can reach it.
 */
@Documented
@Target({ ElementType.TYPE,
        ElementType.METHOD,
        ElementType.CONSTRUCTOR,
        ElementType.FIELD })
@Retention(RetentionPolicy.SOURCE)
public @interface VisibleForTesting {
}
