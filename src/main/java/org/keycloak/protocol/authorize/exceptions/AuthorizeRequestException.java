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

package org.keycloak.protocol.authorize.exceptions;

/**
 * Problem found while decoding an authorization request.
 *
 * Decode failures are not fatal: the decoder returns them next to the decoded
 * request and the handler decides how to answer.
 */
public class AuthorizeRequestException extends Exception {

    private final String error;

    public AuthorizeRequestException(String error, String message) {
        super(message);
        this.error = error;
    }

    /**
     * RFC 6749 error code for an Error Response (e.g. {@code invalid_request}).
     */
    public String getError() {
        return error;
    }
}
