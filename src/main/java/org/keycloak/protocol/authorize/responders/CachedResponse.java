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

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Fully buffered response with a fixed status, headers and an optional body.
 *
 * Used for the intermediate user interface of an authorization flow (login,
 * MFA, consent, client selection) and for error pages that must not be
 * redirected to the client (RFC 6749 sections 4.1.2.1 and 4.2.2.1).
 */
public final class CachedResponse extends Responder {

    public static final String TEXT_PLAIN_UTF_8 = "text/plain;charset=UTF-8";

    private final int status;
    private final MultivaluedMap<String, String> headers;
    private final InputStream body;

    public CachedResponse(int status, MultivaluedMap<String, String> headers, InputStream body) {
        this.status = status;
        this.headers = headers != null ? headers : new MultivaluedHashMap<>();
        this.body = body;
    }

    /**
     * Response with the given status and its standard reason phrase as plain text body.
     */
    public static CachedResponse forStatus(Response.Status status) {
        return forMessage(status.getStatusCode(), status.getReasonPhrase(), TEXT_PLAIN_UTF_8);
    }

    public static CachedResponse forMessage(int status, String message, String contentType) {
        return builder(status)
                .header(HttpHeaders.CONTENT_TYPE, contentType)
                .body(message)
                .build();
    }

    public static Builder builder(int status) {
        return new Builder(status);
    }

    public int getStatus() {
        return status;
    }

    public MultivaluedMap<String, String> getHeaders() {
        return headers;
    }

    public InputStream getBody() {
        return body;
    }

    @Override
    public void respondTo(Response.ResponseBuilder builder) throws IOException {
        copyHeaders(headers, builder);
        builder.status(status);
        if (body != null) {
            try (InputStream in = body) {
                builder.entity(in.readAllBytes());
            }
        }
    }

    public static class Builder {

        private final int status;
        private final MultivaluedMap<String, String> headers = new MultivaluedHashMap<>();
        private InputStream body;

        private Builder(int status) {
            this.status = status;
        }

        public Builder header(String name, String value) {
            headers.add(name, value);
            return this;
        }

        public Builder body(String body) {
            this.body = new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8));
            return this;
        }

        public Builder body(InputStream body) {
            this.body = body;
            return this;
        }

        public CachedResponse build() {
            return new CachedResponse(status, new MultivaluedHashMap<>(headers), body);
        }
    }
}
