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

package org.keycloak.protocol.authorize.handlers;

import org.keycloak.protocol.authorize.AuthorizeContext;
import org.keycloak.protocol.authorize.exceptions.AuthorizeRequestException;
import org.keycloak.protocol.authorize.representations.AuthorizeRequest;
import org.keycloak.protocol.authorize.responders.Responder;

/**
 * Handles an Authorization Request.
 *
 * Per RFC 6749 the final response is an Authorization Response (Authorization
 * Code Grant), a Token Response (Implicit Grant) or an Error Response, all of
 * them URL redirections ({@link org.keycloak.protocol.authorize.responders.RedirectResponse}).
 *
 * In practice an authorization server shows intermediate pages before that,
 * such as a login form, a TOTP / MFA prompt, a scope review page or a prompt
 * for a missing client identifier. Those are returned as
 * {@link org.keycloak.protocol.authorize.responders.CachedResponse}.
 */
@FunctionalInterface
public interface AuthorizeHandler {

    /**
     * @param context collaborators supplied by the integrator
     * @param request the decoded request, never null
     * @param decodeError validation error from decoding, or null
     * @return the response to send, or null when no response is produced
     */
    Responder handleAuthorizeRequest(AuthorizeContext context, AuthorizeRequest request,
                                     AuthorizeRequestException decodeError);
}
