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

import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.UriInfo;

/**
 * Decodes an HTTP request into an {@link org.keycloak.protocol.authorize.representations.AuthorizeRequest}.
 *
 * Implementations always return a request, also when validation fails.
 */
public interface AuthorizeDecoder {

    /**
     * Decode the authorization request from the given parameters.
     *
     * @param uriInfo request URI, kept as back-reference on the decoded request (may be null)
     * @param parameters query or form parameters carrying the request
     * @return the decoded request and the validation error, if any
     */
    AuthorizeDecodeResult decode(UriInfo uriInfo, MultivaluedMap<String, String> parameters);

    /**
     * Decode the authorization request from the query component of the request URI.
     */
    default AuthorizeDecodeResult decode(UriInfo uriInfo) {
        return decode(uriInfo, uriInfo.getQueryParameters());
    }
}
