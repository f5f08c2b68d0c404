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

package org.keycloak.protocol.authorize.representations;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.keycloak.OAuth2Constants;
import org.keycloak.util.JsonSerialization;

import jakarta.ws.rs.core.UriInfo;

import java.io.IOException;

/**
 * Authorization Request for either the Authorization Code Grant
 * (RFC 6749 section 4.1.1) or the Implicit Grant (RFC 6749 section 4.2.1).
 *
 * The request is sent by the client to the authorization endpoint as query
 * components. When decoded from an HTTP request, the request URI is kept in
 * {@link #getUriInfo()}; it is never serialized.
 *
 * String fields are never null: missing values are stored as empty strings.
 */
@JsonPropertyOrder({
        OAuth2Constants.RESPONSE_TYPE,
        OAuth2Constants.CLIENT_ID,
        OAuth2Constants.REDIRECT_URI,
        OAuth2Constants.SCOPE,
        OAuth2Constants.STATE,
        "stage",
        "user_id"
})
public class AuthorizeRequest {

    @JsonIgnore
    private UriInfo uriInfo;

    // REQUIRED. "code" or "token"
    @JsonProperty(OAuth2Constants.RESPONSE_TYPE)
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String responseType = "";

    // REQUIRED. See RFC 6749 section 2.2
    @JsonProperty(OAuth2Constants.CLIENT_ID)
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String clientId = "";

    // OPTIONAL. Absolute URI, RFC 6749 section 3.1.2
    @JsonProperty(OAuth2Constants.REDIRECT_URI)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String redirectUri = "";

    // OPTIONAL. RFC 6749 section 3.3
    @JsonProperty(OAuth2Constants.SCOPE)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String scope = "";

    // RECOMMENDED. Opaque value echoed back to the client, RFC 6749 section 10.12
    @JsonProperty(OAuth2Constants.STATE)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String state = "";

    @JsonProperty("stage")
    @JsonInclude(value = JsonInclude.Include.CUSTOM, valueFilter = InitialStageFilter.class)
    private AuthorizeStage stage = AuthorizeStage.INITIALIZE;

    // Set by handlers once the user is authenticated
    @JsonProperty("user_id")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String userId = "";

    public AuthorizeRequest() {
    }

    public AuthorizeRequest(UriInfo uriInfo) {
        this.uriInfo = uriInfo;
    }

    public UriInfo getUriInfo() {
        return uriInfo;
    }

    public void setUriInfo(UriInfo uriInfo) {
        this.uriInfo = uriInfo;
    }

    public String getResponseType() {
        return responseType;
    }

    public void setResponseType(String responseType) {
        this.responseType = nonNull(responseType);
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = nonNull(clientId);
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public void setRedirectUri(String redirectUri) {
        this.redirectUri = nonNull(redirectUri);
    }

    public String getScope() {
        return scope;
    }

    public void setScope(String scope) {
        this.scope = nonNull(scope);
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = nonNull(state);
    }

    public AuthorizeStage getStage() {
        return stage;
    }

    public void setStage(AuthorizeStage stage) {
        this.stage = stage != null ? stage : AuthorizeStage.INITIALIZE;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = nonNull(userId);
    }

    /**
     * Serialize to the JSON form used when the request travels between stages
     * (hidden form fields, session notes).
     */
    public String toJson() throws IOException {
        return JsonSerialization.writeValueAsString(this);
    }

    public static AuthorizeRequest fromJson(String json) throws IOException {
        return JsonSerialization.readValue(json, AuthorizeRequest.class);
    }

    @Override
    public String toString() {
        return "AuthorizeRequest{responseType='" + responseType + "', clientId='" + clientId
                + "', stage=" + stage + "}";
    }

    private static String nonNull(String value) {
        return value != null ? value : "";
    }

    /**
     * Jackson inclusion filter leaving out the initial stage.
     * Jackson excludes a value when {@code filter.equals(value)} is true.
     */
    public static final class InitialStageFilter {

        @Override
        public boolean equals(Object value) {
            return value == null || (value instanceof AuthorizeStage && ((AuthorizeStage) value).isInitial());
        }

        @Override
        public int hashCode() {
            return 0;
        }
    }
}
