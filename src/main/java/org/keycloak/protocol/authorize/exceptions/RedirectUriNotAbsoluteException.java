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

import jakarta.ws.rs.core.Response;

/**
 * The redirect URI parsed but has no scheme or no host.
 */
public class RedirectUriNotAbsoluteException extends ResponderException {

    private final String redirectUri;

    public RedirectUriNotAbsoluteException(String redirectUri) {
        super(Response.Status.BAD_REQUEST.getStatusCode(),
                String.format("redirect_uri is misformed. expected a full URI but got \"%s\"", redirectUri));
        this.redirectUri = redirectUri;
    }

    public String getRedirectUri() {
        return redirectUri;
    }
}
