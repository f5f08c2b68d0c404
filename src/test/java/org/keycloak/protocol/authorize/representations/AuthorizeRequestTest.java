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

import org.junit.jupiter.api.Test;

import jakarta.ws.rs.core.UriInfo;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class AuthorizeRequestTest {

    @Test
    void testToJson_EmptyRequestKeepsRequiredFieldsOnly() throws Exception {
        AuthorizeRequest request = new AuthorizeRequest();

        assertEquals("{\"response_type\":\"\",\"client_id\":\"\"}", request.toJson());
    }

    @Test
    void testToJson_StageIncludedWhenNotInitial() throws Exception {
        AuthorizeRequest request = new AuthorizeRequest();
        request.setStage(AuthorizeStage.TO_AUTHENTICATE);

        assertEquals("{\"response_type\":\"\",\"client_id\":\"\",\"stage\":1}", request.toJson());
    }

    @Test
    void testToJson_AllFields() throws Exception {
        AuthorizeRequest request = new AuthorizeRequest(mock(UriInfo.class));
        request.setResponseType("code");
        request.setClientId("dummy-client");
        request.setRedirectUri("https://client.example.com/cb");
        request.setScope("openid profile");
        request.setState("xyz");
        request.setStage(AuthorizeStage.custom(120));
        request.setUserId("user-1");

        assertEquals("{\"response_type\":\"code\",\"client_id\":\"dummy-client\","
                + "\"redirect_uri\":\"https://client.example.com/cb\",\"scope\":\"openid profile\","
                + "\"state\":\"xyz\",\"stage\":120,\"user_id\":\"user-1\"}", request.toJson());
    }

    @Test
    void testFromJson_RestoresStage() throws Exception {
        AuthorizeRequest request = AuthorizeRequest.fromJson(
                "{\"response_type\":\"token\",\"client_id\":\"c\",\"stage\":3,\"user_id\":\"u\"}");

        assertEquals("token", request.getResponseType());
        assertEquals("c", request.getClientId());
        assertEquals(AuthorizeStage.TO_AUTHORIZE, request.getStage());
        assertEquals("u", request.getUserId());
        assertEquals("", request.getRedirectUri());
        assertNull(request.getUriInfo());
    }

    @Test
    void testSetters_NullBecomesEmpty() {
        AuthorizeRequest request = new AuthorizeRequest();
        request.setState(null);
        request.setStage(null);

        assertEquals("", request.getState());
        assertEquals(AuthorizeStage.INITIALIZE, request.getStage());
    }
}
