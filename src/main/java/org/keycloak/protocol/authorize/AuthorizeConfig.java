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

import org.jboss.logging.Logger;
import org.keycloak.protocol.authorize.decoder.DefaultAuthorizeDecoder;
import org.keycloak.protocol.authorize.responders.CachedResponse;
import org.keycloak.protocol.authorize.responders.DefaultResponseEncoder;
import org.keycloak.util.JsonSerialization;

import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration settings for the authorization endpoint.
 *
 * Reads string attributes from a map, a {@link Properties} object or the JVM
 * system properties, falling back to defaults for missing or invalid values.
 */
public class AuthorizeConfig {

    private static final Logger logger = Logger.getLogger(AuthorizeConfig.class);

    // Attribute keys
    public static final String ALLOWED_RESPONSE_TYPES = "authorize.allowed.response.types";
    public static final String ERROR_CONTENT_TYPE = "authorize.error.content.type";

    // Default values
    public static final List<String> DEFAULT_ALLOWED_RESPONSE_TYPES = Collections.singletonList("code");
    public static final String DEFAULT_ERROR_CONTENT_TYPE = CachedResponse.TEXT_PLAIN_UTF_8;

    private final Map<String, String> attributes;

    public AuthorizeConfig(Map<String, String> attributes) {
        this.attributes = attributes != null ? new HashMap<>(attributes) : Collections.emptyMap();
    }

    public static AuthorizeConfig forAttributes(Map<String, String> attributes) {
        return new AuthorizeConfig(attributes);
    }

    public static AuthorizeConfig fromProperties(Properties properties) {
        Map<String, String> attributes = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            attributes.put(name, properties.getProperty(name));
        }
        return new AuthorizeConfig(attributes);
    }

    public static AuthorizeConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Response types the decoder accepts, given as a JSON array,
     * e.g. {@code ["code","token"]}. Defaults to {@code ["code"]}.
     * An explicit empty array rejects every response type.
     */
    public List<String> getAllowedResponseTypes() {
        return getJsonListAttribute(ALLOWED_RESPONSE_TYPES, DEFAULT_ALLOWED_RESPONSE_TYPES);
    }

    /**
     * Content type of the error pages sent when a responder fails.
     */
    public String getErrorContentType() {
        String value = attributes.get(ERROR_CONTENT_TYPE);
        return value == null || value.isEmpty() ? DEFAULT_ERROR_CONTENT_TYPE : value;
    }

    public DefaultAuthorizeDecoder createDecoder() {
        return new DefaultAuthorizeDecoder(getAllowedResponseTypes());
    }

    public DefaultResponseEncoder createResponseEncoder() {
        return new DefaultResponseEncoder(getErrorContentType());
    }

    /**
     * Parse a JSON array attribute into a list of strings.
     */
    @SuppressWarnings("unchecked")
    private List<String> getJsonListAttribute(String key, List<String> defaultValue) {
        String value = attributes.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }

        try {
            List<String> list = JsonSerialization.readValue(value, List.class);
            return list != null ? list : defaultValue;
        } catch (IOException e) {
            logger.warnf("Invalid JSON list in attribute %s, using default: %s", key, e.getMessage());
            return defaultValue;
        }
    }
}
