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

package org.keycloak.protocol.authorize.endpoints;

import org.jboss.logging.Logger;
import org.keycloak.protocol.authorize.AuthorizeContext;
import org.keycloak.protocol.authorize.decoder.AuthorizeDecodeResult;
import org.keycloak.protocol.authorize.decoder.AuthorizeDecoder;
import org.keycloak.protocol.authorize.handlers.AuthorizeHandler;
import org.keycloak.protocol.authorize.responders.Responder;
import org.keycloak.protocol.authorize.responders.ResponseEncoder;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

/**
 * Authorization endpoint (RFC 6749 section 3.1).
 *
 * Decodes the request, passes it to the handler together with any decode
 * error, and encodes the handler's responder. Requests are accepted as query
 * parameters ({@code GET}) or as a form body ({@code POST}).
 */
public class AuthorizeEndpoint {

    private static final Logger logger = Logger.getLogger(AuthorizeEndpoint.class);

    private final AuthorizeContext context;
    private final AuthorizeDecoder decoder;
    private final AuthorizeHandler handler;
    private final ResponseEncoder encoder;

    public AuthorizeEndpoint(AuthorizeContext context, AuthorizeDecoder decoder,
                             AuthorizeHandler handler, ResponseEncoder encoder) {
        this.context = context != null ? context : AuthorizeContext.empty();
        this.decoder = decoder;
        this.handler = handler;
        this.encoder = encoder;
    }

    @GET
    public Response authorizeGet(@Context UriInfo uriInfo) {
        return process(decoder.decode(uriInfo));
    }

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Response authorizePost(@Context UriInfo uriInfo, MultivaluedMap<String, String> formParams) {
        return process(decoder.decode(uriInfo, formParams));
    }

    private Response process(AuthorizeDecodeResult decoded) {
        logger.debugf("Authorization request: %s, decode error: %s", decoded.getRequest(),
                decoded.hasError() ? decoded.getError().getMessage() : "none");

        Responder responder = handler.handleAuthorizeRequest(context, decoded.getRequest(), decoded.getError());
        return encoder.encodeResponse(responder);
    }
}
