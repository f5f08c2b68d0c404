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

package org.keycloak.protocol.authorize;

import org.keycloak.protocol.authorize.storage.TokenStorage;
import org.keycloak.protocol.authorize.tokens.TokenFactory;

/**
 * Collaborators the integrator hands to every authorize handler.
 *
 * Passed explicitly from the endpoint to the handlers. Either collaborator may
 * be null when the handlers in use do not need it.
 */
public class AuthorizeContext {

    private static final AuthorizeContext EMPTY = new AuthorizeContext(null, null);

    private final TokenFactory tokenFactory;
    private final TokenStorage tokenStorage;

    public AuthorizeContext(TokenFactory tokenFactory, TokenStorage tokenStorage) {
        this.tokenFactory = tokenFactory;
        this.tokenStorage = tokenStorage;
    }

    public static AuthorizeContext empty() {
        return EMPTY;
    }

    public TokenFactory getTokenFactory() {
        return tokenFactory;
    }

    public TokenStorage getTokenStorage() {
        return tokenStorage;
    }
}
