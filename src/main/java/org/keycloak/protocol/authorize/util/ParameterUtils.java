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

package org.keycloak.protocol.authorize.util;

import org.jboss.logging.Logger;

import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.MultivaluedMap;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Helpers for request parameters and {@code application/x-www-form-urlencoded} strings.
 */
public final class ParameterUtils {

    private static final Logger logger = Logger.getLogger(ParameterUtils.class);

    private static final String TRIMMED_CHARS = "\r\n\t ";

    private ParameterUtils() {
    }

    /**
     * Strip leading and trailing CR, LF, TAB and space characters.
     * Other whitespace is kept. Null becomes an empty string.
     */
    public static String trim(String value) {
        if (value == null) {
            return "";
        }
        int start = 0;
        int end = value.length();
        while (start < end && TRIMMED_CHARS.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && TRIMMED_CHARS.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }

    /**
     * Form-encode parameters with keys sorted lexicographically. Values of one
     * key keep their order. Only {@code A-Z a-z 0-9 - _ . ~} are left unescaped,
     * spaces become {@code +}.
     *
     * @return the encoded string, empty for no parameters
     */
    public static String encodeForm(MultivaluedMap<String, String> parameters) {
        return encodeForm(parameters, StandardCharsets.UTF_8);
    }

    /**
     * Form-encode parameters using the bytes of the given charset. With
     * {@link StandardCharsets#ISO_8859_1} each char is written as exactly one
     * byte, which pairs with {@link #parseQuery(String, Charset)} to carry
     * arbitrary bytes through unchanged.
     */
    public static String encodeForm(MultivaluedMap<String, String> parameters, Charset charset) {
        if (parameters == null || parameters.isEmpty()) {
            return "";
        }
        Map<String, List<String>> sorted = new TreeMap<>(parameters);
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<String>> entry : sorted.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            String key = escape(entry.getKey(), charset);
            for (String value : entry.getValue()) {
                if (sb.length() > 0) {
                    sb.append('&');
                }
                sb.append(key).append('=').append(escape(value != null ? value : "", charset));
            }
        }
        return sb.toString();
    }

    /**
     * Parse a raw (still encoded) query string as UTF-8. Pairs that cannot be
     * decoded are skipped.
     */
    public static MultivaluedMap<String, String> parseQuery(String rawQuery) {
        return parseQuery(rawQuery, StandardCharsets.UTF_8);
    }

    /**
     * Parse a raw (still encoded) query string, decoding escapes with the given charset.
     * Pairs with malformed escapes are skipped. Callers holding a parsed
     * {@link java.net.URI} never see this, as the URI parser rejects them first.
     */
    public static MultivaluedMap<String, String> parseQuery(String rawQuery, Charset charset) {
        MultivaluedMap<String, String> result = new MultivaluedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return result;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int equalsIndex = pair.indexOf('=');
            String key = equalsIndex >= 0 ? pair.substring(0, equalsIndex) : pair;
            String value = equalsIndex >= 0 ? pair.substring(equalsIndex + 1) : "";
            try {
                result.add(URLDecoder.decode(key, charset), URLDecoder.decode(value, charset));
            } catch (IllegalArgumentException e) {
                logger.debugf("Skipping undecodable query parameter '%s': %s", pair, e.getMessage());
            }
        }
        return result;
    }

    /**
     * Re-express a string as one char per UTF-8 byte, for use with the
     * {@link StandardCharsets#ISO_8859_1} variants of the methods above.
     */
    public static String toByteString(String value) {
        return new String(value.getBytes(StandardCharsets.UTF_8), StandardCharsets.ISO_8859_1);
    }

    private static String escape(String value, Charset charset) {
        return URLEncoder.encode(value, charset)
                .replace("*", "%2A")
                .replace("%7E", "~");
    }
}
