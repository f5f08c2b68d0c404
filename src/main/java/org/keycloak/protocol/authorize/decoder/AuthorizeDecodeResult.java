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

package org.keycloak.protocol.authorize.decoder;

import org.keycloak.protocol.authorize.exceptions.AuthorizeRequestException;
import org.keycloak.protocol.authorize.representations.AuthorizeRequest;

/**
 * Outcome of decoding: the request, which is always present, and the
 * validation error, which is null when the request is valid.
 */
public class AuthorizeDecodeResult {

    private final AuthorizeRequest request;
    private final AuthorizeRequestException error;

    public AuthorizeDecodeResult(AuthorizeRequest request, AuthorizeRequestException error) {
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        this.request = request;
        this.error = error;
    }

    public AuthorizeRequest getRequest() {
        return request;
    }

    public AuthorizeRequestException getError() {
        return error;
    }

    public boolean hasError() {
        return error != null;
    }
}
