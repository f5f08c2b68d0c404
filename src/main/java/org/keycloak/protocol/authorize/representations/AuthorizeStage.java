/*
 * Copyright 2025 Red Hat, Inc. and/or its affiliates
 * and other contributors as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.keycloak.protocol.authorize.representations;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stage of a multi-step authorization flow.
 *
 * A stage is only a dispatch key: the {@code AuthorizeHandlerMux} picks the
 * handler registered for the stage of an incoming request. The flow order is
 * decided by the handlers, which move a request from one stage to the next.
 *
 * Values 0-99 are reserved for the built-in stages. Custom stages should use
 * values of 100 and above.
 */
public final class AuthorizeStage {

    public static final int CUSTOM_STAGE_MINIMUM = 100;

    /**
     * Default stage of every request. The request has just arrived and the user
     * is about to enter login information.
     */
    public static final AuthorizeStage INITIALIZE = new AuthorizeStage(0, "INITIALIZE");

    /**
     * The request comes with login information (e.g. a submitted login form).
     * On success the request should move on to {@link #TO_AUTHORIZE}.
     */
    public static final AuthorizeStage TO_AUTHENTICATE = new AuthorizeStage(1, "TO_AUTHENTICATE");

    /**
     * Any step between authentication and authorization: the user has logged in
     * but has not yet approved the requested scope (MFA, client selection...).
     */
    public static final AuthorizeStage INTERMEDIATE = new AuthorizeStage(2, "INTERMEDIATE");

    /**
     * The request comes with the user's decision on the requested scope
     * (e.g. a submitted consent form).
     */
    public static final AuthorizeStage TO_AUTHORIZE = new AuthorizeStage(3, "TO_AUTHORIZE");

    /**
     * Upper boundary of the built-in stages.
     */
    public static final AuthorizeStage CUSTOM = new AuthorizeStage(4, "CUSTOM");

    private static final AuthorizeStage[] BUILT_IN = {
            INITIALIZE, TO_AUTHENTICATE, INTERMEDIATE, TO_AUTHORIZE, CUSTOM
    };

    private final int value;
    private final String name;

    private AuthorizeStage(int value, String name) {
        this.value = value;
        this.name = name;
    }

    /**
     * Resolve any stage value, returning the built-in constant where one exists.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AuthorizeStage valueOf(int value) {
        if (value >= 0 && value < BUILT_IN.length) {
            return BUILT_IN[value];
        }
        return new AuthorizeStage(value, null);
    }

    /**
     * Create an integrator-defined stage.
     *
     * @param value stage value, at least {@value #CUSTOM_STAGE_MINIMUM}
     * @throws IllegalArgumentException if the value is in the reserved range
     */
    public static AuthorizeStage custom(int value) {
        if (value < CUSTOM_STAGE_MINIMUM) {
            throw new IllegalArgumentException("custom stage must be " + CUSTOM_STAGE_MINIMUM
                    + " or above, got " + value);
        }
        return new AuthorizeStage(value, null);
    }

    @JsonValue
    public int getValue() {
        return value;
    }

    public boolean isBuiltIn() {
        return value >= 0 && value < CUSTOM_STAGE_MINIMUM;
    }

    public boolean isInitial() {
        return value == INITIALIZE.value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AuthorizeStage)) {
            return false;
        }
        return value == ((AuthorizeStage) o).value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return name != null ? name : "STAGE_" + value;
    }
}
