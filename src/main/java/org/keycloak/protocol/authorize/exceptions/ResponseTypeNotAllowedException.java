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

import org.keycloak.OAuthErrorException;

/**
 * The {@code response_type} of the request is not one the decoder accepts.
 */
public class ResponseTypeNotAllowedException extends AuthorizeRequestException {

    private final String responseType;

    public ResponseTypeNotAllowedException(String responseType) {
        super(OAuthErrorException.UNSUPPORTED_RESPONSE_TYPE,
                String.format("response_type \"%s\" is not allowed", responseType));
        this.responseType = responseType;
    }

    public String getResponseType() {
        return responseType;
    }
}
