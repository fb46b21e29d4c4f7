/*
 * API.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2026 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.apple.foundationdb.summary.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks public types, fields and methods of the Summary Layer with how stable they are for consumers.
 *
 * <p>
 * A member without its own annotation inherits the status of its enclosing type. A status may only move toward
 * {@link Status#STABLE} within a minor release.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability statuses, from least to most stable.
     */
    enum Status {
        /**
         * Public only so that other packages of the Summary Layer can reach it. May change at any time.
         */
        INTERNAL,

        /**
         * Scheduled for removal in the next minor release.
         */
        DEPRECATED,

        /**
         * Under development. May change or be removed without notice.
         */
        EXPERIMENTAL,

        /**
         * Will not change until the next minor release.
         */
        UNSTABLE,

        /**
         * Will not change incompatibly until the next major release.
         */
        STABLE
    }
}
