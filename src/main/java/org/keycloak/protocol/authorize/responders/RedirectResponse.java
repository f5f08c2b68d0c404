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
import org.keycloak.OAuth2Constants;
import org.keycloak.protocol.authorize.exceptions.RedirectUriMalformedException;
import org.keycloak.protocol.authorize.exceptions.RedirectUriMissingException;
import org.keycloak.protocol.authorize.exceptions.RedirectUriNotAbsoluteException;
import org.keycloak.protocol.authorize.exceptions.ResponderException;
import org.keycloak.protocol.authorize.util.ParameterUtils;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriBuilder;
import jakarta.ws.rs.core.UriBuilderException;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;

/**
 * Final response to an authorization request, delivered as a URL redirection:
 * <ol>
 *   <li>an Authorization Response (Authorization Code Grant),</li>
 *   <li>a Token Response (Implicit Grant), or</li>
 *   <li>an Error Response, unless the error needs a page of its own
 *       (RFC 6749 sections 4.1.2.1 and 4.2.2.1).</li>
 * </ol>
 *
 * The query parameters are merged into the query of the redirect URI and the
 * whole query is re-encoded with keys in lexicographic order. The fragment
 * parameters become the form-encoded fragment. The response is sent as
 * {@code 307 Temporary Redirect}.
 */
public final class RedirectResponse extends Responder {

    private static final Logger logger = Logger.getLogger(RedirectResponse.class);

    private final MultivaluedMap<String, String> headers;
    private final String redirectUri;
    private final MultivaluedMap<String, String> query;
    private final MultivaluedMap<String, String> fragment;

    public RedirectResponse(MultivaluedMap<String, String> headers, String redirectUri,
                            MultivaluedMap<String, String> query, MultivaluedMap<String, String> fragment) {
        this.headers = headers != null ? headers : new MultivaluedHashMap<>();
        this.redirectUri = redirectUri;
        this.query = query != null ? query : new MultivaluedHashMap<>();
        this.fragment = fragment != null ? fragment : new MultivaluedHashMap<>();
    }

    public static Builder builder(String redirectUri) {
        return new Builder(redirectUri);
    }

    /**
     * Authorization Response of the Authorization Code Grant (RFC 6749 section 4.1.2).
     */
    public static RedirectResponse authorizationCode(String redirectUri, String code, String state) {
        return builder(redirectUri)
                .query(OAuth2Constants.CODE, code)
                .queryIfPresent(OAuth2Constants.STATE, state)
                .build();
    }

    /**
     * Access Token Response of the Implicit Grant (RFC 6749 section 4.2.2),
     * carried in the fragment.
     *
     * @param expiresIn lifetime in seconds, left out when not positive
     */
    public static RedirectResponse accessToken(String redirectUri, String accessToken, String tokenType,
                                               long expiresIn, String scope, String state) {
        Builder builder = builder(redirectUri)
                .fragment(OAuth2Constants.ACCESS_TOKEN, accessToken)
                .fragment(OAuth2Constants.TOKEN_TYPE, tokenType);
        if (expiresIn > 0) {
            builder.fragment(OAuth2Constants.EXPIRES_IN, String.valueOf(expiresIn));
        }
        return builder
                .fragmentIfPresent(OAuth2Constants.SCOPE, scope)
                .fragmentIfPresent(OAuth2Constants.STATE, state)
                .build();
    }

    /**
     * Error Response in the query component (RFC 6749 section 4.1.2.1).
     */
    public static RedirectResponse error(String redirectUri, String error, String errorDescription, String state) {
        return builder(redirectUri)
                .query(OAuth2Constants.ERROR, error)
                .queryIfPresent(OAuth2Constants.ERROR_DESCRIPTION, errorDescription)
                .queryIfPresent(OAuth2Constants.STATE, state)
                .build();
    }

    public MultivaluedMap<String, String> getHeaders() {
        return headers;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public MultivaluedMap<String, String> getQuery() {
        return query;
    }

    public MultivaluedMap<String, String> getFragment() {
        return fragment;
    }

    @Override
    public void respondTo(Response.ResponseBuilder builder) throws ResponderException {
        String location = buildLocation();

        copyHeaders(headers, builder);
        builder.header(HttpHeaders.LOCATION, null);
        builder.header(HttpHeaders.LOCATION, location);
        builder.status(Response.Status.TEMPORARY_REDIRECT);
        logger.debugf("Redirecting authorization response to %s", location);
    }

    /**
     * Resolve the final redirect target.
     */
    public String buildLocation() throws ResponderException {
        if (redirectUri == null || redirectUri.isEmpty()) {
            throw new RedirectUriMissingException();
        }

        URI uri;
        try {
            uri = new URI(redirectUri);
        } catch (URISyntaxException e) {
            throw new RedirectUriMalformedException(e);
        }
        if (uri.getScheme() == null || uri.getRawAuthority() == null || uri.getRawAuthority().isEmpty()) {
            throw new RedirectUriNotAbsoluteException(redirectUri);
        }

        // existing query bytes are kept as-is, whatever their charset
        MultivaluedMap<String, String> merged = ParameterUtils.parseQuery(uri.getRawQuery(), StandardCharsets.ISO_8859_1);
        query.forEach((key, values) -> {
            if (values != null) {
                for (String value : values) {
                    merged.add(ParameterUtils.toByteString(key), ParameterUtils.toByteString(value != null ? value : ""));
                }
            }
        });
        String encodedQuery = ParameterUtils.encodeForm(merged, StandardCharsets.ISO_8859_1);
        String encodedFragment = ParameterUtils.encodeForm(fragment);

        try {
            return UriBuilder.fromUri(uri)
                    .replaceQuery(encodedQuery.isEmpty() ? null : encodedQuery)
                    .fragment(encodedFragment.isEmpty() ? null : encodedFragment)
                    .build()
                    .toString();
        } catch (IllegalArgumentException | UriBuilderException e) {
            throw new RedirectUriMalformedException(e);
        }
    }

    public static class Builder {

        private final String redirectUri;
        private final MultivaluedMap<String, String> headers = new MultivaluedHashMap<>();
        private final MultivaluedMap<String, String> query = new MultivaluedHashMap<>();
        private final MultivaluedMap<String, String> fragment = new MultivaluedHashMap<>();

        private Builder(String redirectUri) {
            this.redirectUri = redirectUri;
        }

        public Builder header(String name, String value) {
            headers.add(name, value);
            return this;
        }

        public Builder query(String name, String value) {
            query.add(name, value);
            return this;
        }

        public Builder queryIfPresent(String name, String value) {
            if (value != null && !value.isEmpty()) {
                query.add(name, value);
            }
            return this;
        }

        public Builder fragment(String name, String value) {
            fragment.add(name, value);
            return this;
        }

        public Builder fragmentIfPresent(String name, String value) {
            if (value != null && !value.isEmpty()) {
                fragment.add(name, value);
            }
            return this;
        }

        public RedirectResponse build() {
            return new RedirectResponse(new MultivaluedHashMap<>(headers), redirectUri,
                    new MultivaluedHashMap<>(query), new MultivaluedHashMap<>(fragment));
        }
    }
}
