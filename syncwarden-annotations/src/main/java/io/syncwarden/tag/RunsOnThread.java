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
 * Documents the thread on which the annotated code executes.
 * The control loop relies on a small number of well known threads
 * (the funnel thread, the status ticker thread) and this annotation names them.
 */
@Documented
@Target({ ElementType.METHOD,
        ElementType.CONSTRUCTOR })
@Retention(RetentionPolicy.SOURCE)
public @interface RunsOnThread {
    /**
     * The name of the thread on which the annotated code is executed.
     * @return thread name
     */
    String value();
}
