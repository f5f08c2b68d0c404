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

package org.keycloak.protocol.authorize;

import org.junit.jupiter.api.Test;
import org.keycloak.protocol.authorize.decoder.DefaultAuthorizeDecoder;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AuthorizeConfigTest {

    @Test
    void testDefaults() {
        AuthorizeConfig config = AuthorizeConfig.forAttributes(Collections.emptyMap());

        assertEquals(Collections.singletonList("code"), config.getAllowedResponseTypes());
        assertEquals("text/plain;charset=UTF-8", config.getErrorContentType());
    }

    @Test
    void testAllowedResponseTypesFromJson() {
        AuthorizeConfig config = AuthorizeConfig.forAttributes(
                Map.of(AuthorizeConfig.ALLOWED_RESPONSE_TYPES, "[\"code\",\"token\"]"));

        DefaultAuthorizeDecoder decoder = config.createDecoder();

        assertEquals(Arrays.asList("code", "token"), config.getAllowedResponseTypes());
        assertTrue(decoder.getAllowedResponseTypes().contains("token"));
    }

    @Test
    void testEmptyJsonArrayRejectsEverything() {
        AuthorizeConfig config = AuthorizeConfig.forAttributes(
                Map.of(AuthorizeConfig.ALLOWED_RESPONSE_TYPES, "[]"));

        assertTrue(config.createDecoder().getAllowedResponseTypes().isEmpty());
    }

    @Test
    void testInvalidJsonFallsBackToDefault() {
        AuthorizeConfig config = AuthorizeConfig.forAttributes(
                Map.of(AuthorizeConfig.ALLOWED_RESPONSE_TYPES, "code,token"));

        assertEquals(AuthorizeConfig.DEFAULT_ALLOWED_RESPONSE_TYPES, config.getAllowedResponseTypes());
    }

    @Test
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(AuthorizeConfig.ERROR_CONTENT_TYPE, "text/html;charset=UTF-8");

        AuthorizeConfig config = AuthorizeConfig.fromProperties(properties);

        assertEquals("text/html;charset=UTF-8", config.createResponseEncoder().getErrorContentType());
    }
}
