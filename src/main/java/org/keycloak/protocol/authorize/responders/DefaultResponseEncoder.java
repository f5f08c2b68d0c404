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

import org.jboss.logging.Logger;
import org.keycloak.protocol.authorize.exceptions.ResponderException;

import jakarta.ws.rs.core.Response;

import java.io.IOException;

/**
 * Default {@link ResponseEncoder}.
 *
 * A null responder yields {@code 204 No Content}. When a responder fails with a
 * {@link ResponderException}, whatever it wrote is discarded and an error page
 * with the exception's status and message is sent instead. I/O failures while
 * copying a body give a generic {@code 500} page.
 */
public class DefaultResponseEncoder implements ResponseEncoder {

    private static final Logger logger = Logger.getLogger(DefaultResponseEncoder.class);

    private final String errorContentType;

    public DefaultResponseEncoder() {
        this(CachedResponse.TEXT_PLAIN_UTF_8);
    }

    public DefaultResponseEncoder(String errorContentType) {
        this.errorContentType = errorContentType;
    }

    public String getErrorContentType() {
        return errorContentType;
    }

    @Override
    public Response encodeResponse(Responder responder) {
        if (responder == null) {
            return Response.noContent().build();
        }

        try {
            Response.ResponseBuilder builder = Response.noContent();
            responder.respondTo(builder);
            return builder.build();
        } catch (ResponderException e) {
            logger.warnf("Responder failed, sending error page (status=%d): %s", e.getStatus(), e.getMessage());
            return render(CachedResponse.forMessage(e.getStatus(), e.getMessage(), errorContentType));
        } catch (IOException e) {
            logger.error("Failed to copy response body", e);
            return render(CachedResponse.forMessage(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(),
                    Response.Status.INTERNAL_SERVER_ERROR.getReasonPhrase(), errorContentType));
        }
    }

    private Response render(CachedResponse errorPage) {
        Response.ResponseBuilder builder = Response.noContent();
        try {
            errorPage.respondTo(builder);
        } catch (IOException e) {
            // in-memory body
            throw new IllegalStateException("Failed to render error page", e);
        }
        return builder.build();
    }
}
