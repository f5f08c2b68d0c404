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

package org.keycloak.protocol.authorize.responders;

import org.keycloak.protocol.authorize.exceptions.ResponderException;

import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;

import java.io.IOException;

/**
 * A buffered HTTP response produced by an authorize handler.
 *
 * There are exactly two kinds: {@link CachedResponse} for intermediate pages
 * and error pages, and {@link RedirectResponse} for the final Authorization,
 * Token or Error Response. A responder is rendered once and then discarded.
 *
 * Should anything go wrong, a responder either writes nothing and throws a
 * {@link ResponderException}, leaving the error page to the
 * {@link ResponseEncoder}, or fails with an {@link IOException} while copying
 * its body.
 */
public abstract class Responder {

    Responder() {
    }

    /**
     * Write this response into the given builder. Headers are applied before the status.
     */
    public abstract void respondTo(Response.ResponseBuilder builder) throws ResponderException, IOException;

    static void copyHeaders(MultivaluedMap<String, String> headers, Response.ResponseBuilder builder) {
        if (headers == null) {
            return;
        }
        headers.forEach((name, values) -> {
            if (values != null) {
                for (String value : values) {
                    builder.header(name, value);
                }
            }
        });
    }
}
