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

import org.jboss.logging.Logger;
import org.keycloak.protocol.authorize.AuthorizeContext;
import org.keycloak.protocol.authorize.exceptions.AuthorizeRequestException;
import org.keycloak.protocol.authorize.representations.AuthorizeRequest;
import org.keycloak.protocol.authorize.representations.AuthorizeStage;
import org.keycloak.protocol.authorize.responders.CachedResponse;
import org.keycloak.protocol.authorize.responders.Responder;

import jakarta.ws.rs.core.Response;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Routes each stage of an authorization request to its own handler.
 *
 * Handlers are registered on a {@link Builder}; the built mux is immutable and
 * safe to share between concurrent requests. A request whose stage has no
 * handler gets a {@code 500 Internal Server Error} page.
 */
public class AuthorizeHandlerMux implements AuthorizeHandler {

    private static final Logger logger = Logger.getLogger(AuthorizeHandlerMux.class);

    private final Map<AuthorizeStage, AuthorizeHandler> handlers;

    private AuthorizeHandlerMux(Map<AuthorizeStage, AuthorizeHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(new HashMap<>(handlers));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasHandler(AuthorizeStage stage) {
        return handlers.containsKey(stage);
    }

    @Override
    public Responder handleAuthorizeRequest(AuthorizeContext context, AuthorizeRequest request,
                                            AuthorizeRequestException decodeError) {
        AuthorizeHandler handler = handlers.get(request.getStage());
        if (handler != null) {
            return handler.handleAuthorizeRequest(context, request, decodeError);
        }
        logger.warnf("No authorize handler registered for stage %s (client_id=%s)",
                request.getStage(), request.getClientId());
        return CachedResponse.forStatus(Response.Status.INTERNAL_SERVER_ERROR);
    }

    public static class Builder {

        private final Map<AuthorizeStage, AuthorizeHandler> handlers = new HashMap<>();

        private Builder() {
        }

        /**
         * Register the handler of a stage. A later handler for the same stage
         * replaces the earlier one.
         */
        public Builder add(AuthorizeStage stage, AuthorizeHandler handler) {
            if (stage == null || handler == null) {
                throw new IllegalArgumentException("stage and handler are required");
            }
            AuthorizeHandler previous = handlers.put(stage, handler);
            if (previous != null) {
                logger.debugf("Replacing authorize handler for stage %s", stage);
            }
            return this;
        }

        public AuthorizeHandlerMux build() {
            return new AuthorizeHandlerMux(handlers);
        }
    }
}
