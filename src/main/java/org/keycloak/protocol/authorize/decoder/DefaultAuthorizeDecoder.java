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

import org.jboss.logging.Logger;
import org.keycloak.OAuth2Constants;
import org.keycloak.protocol.authorize.exceptions.AuthorizeRequestException;
import org.keycloak.protocol.authorize.exceptions.MissingResponseTypeException;
import org.keycloak.protocol.authorize.exceptions.ResponseTypeNotAllowedException;
import org.keycloak.protocol.authorize.representations.AuthorizeRequest;
import org.keycloak.protocol.authorize.util.ParameterUtils;

import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.UriInfo;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Default {@link AuthorizeDecoder}.
 *
 * Reads {@code response_type}, {@code client_id}, {@code redirect_uri},
 * {@code scope} and {@code state}, trims CR, LF, TAB and spaces around each
 * value, then validates {@code response_type}:
 * <ol>
 *   <li>it must be set, otherwise {@link MissingResponseTypeException};</li>
 *   <li>it must be one of the allowed response types, otherwise
 *       {@link ResponseTypeNotAllowedException}.</li>
 * </ol>
 * An empty allow-set rejects every response type.
 *
 * Instances are immutable and may be shared between concurrent requests.
 */
public class DefaultAuthorizeDecoder implements AuthorizeDecoder {

    private static final Logger logger = Logger.getLogger(DefaultAuthorizeDecoder.class);

    private final Set<String> allowedResponseTypes;

    public DefaultAuthorizeDecoder(Collection<String> allowedResponseTypes) {
        this.allowedResponseTypes = Collections.unmodifiableSet(new LinkedHashSet<>(allowedResponseTypes));
    }

    public static DefaultAuthorizeDecoder of(String... allowedResponseTypes) {
        return new DefaultAuthorizeDecoder(Arrays.asList(allowedResponseTypes));
    }

    public Set<String> getAllowedResponseTypes() {
        return allowedResponseTypes;
    }

    @Override
    public AuthorizeDecodeResult decode(UriInfo uriInfo, MultivaluedMap<String, String> parameters) {
        AuthorizeRequest request = new AuthorizeRequest(uriInfo);
        request.setResponseType(param(parameters, OAuth2Constants.RESPONSE_TYPE));
        request.setClientId(param(parameters, OAuth2Constants.CLIENT_ID));
        request.setRedirectUri(param(parameters, OAuth2Constants.REDIRECT_URI));
        request.setScope(param(parameters, OAuth2Constants.SCOPE));
        request.setState(param(parameters, OAuth2Constants.STATE));

        AuthorizeRequestException error = validate(request);
        if (error != null) {
            logger.debugf("Authorization request rejected (client_id=%s): %s", request.getClientId(), error.getMessage());
        }
        return new AuthorizeDecodeResult(request, error);
    }

    private AuthorizeRequestException validate(AuthorizeRequest request) {
        if (request.getResponseType().isEmpty()) {
            return new MissingResponseTypeException();
        }
        if (!allowedResponseTypes.contains(request.getResponseType())) {
            return new ResponseTypeNotAllowedException(request.getResponseType());
        }
        return null;
    }

    private static String param(MultivaluedMap<String, String> parameters, String name) {
        if (parameters == null) {
            return "";
        }
        return ParameterUtils.trim(parameters.getFirst(name));
    }
}
