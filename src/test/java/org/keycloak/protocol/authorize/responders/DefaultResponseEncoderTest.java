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

import org.junit.jupiter.api.Test;

import jakarta.ws.rs.core.Response;

import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.keycloak.protocol.authorize.responders.ResponseTestSupport.body;

class DefaultResponseEncoderTest {

    private final DefaultResponseEncoder encoder = new DefaultResponseEncoder();

    @Test
    void testEncode_NullResponderGivesNoContent() {
        Response response = encoder.encodeResponse(null);

        assertEquals(204, response.getStatus());
    }

    @Test
    void testEncode_Redirect() {
        Response response = encoder.encodeResponse(
                RedirectResponse.authorizationCode("https://client.example.com/cb", "abc", "xyz"));

        assertEquals(307, response.getStatus());
        assertEquals("https://client.example.com/cb?code=abc&state=xyz", response.getHeaderString("Location"));
    }

    @Test
    void testEncode_ResponderErrorBecomesErrorPage() {
        RedirectResponse redirect = RedirectResponse.builder("/relative/path")
                .header("X-Partial", "dropped")
                .build();

        Response response = encoder.encodeResponse(redirect);

        assertEquals(400, response.getStatus());
        assertEquals("redirect_uri is misformed. expected a full URI but got \"/relative/path\"", body(response));
        assertNull(response.getHeaderString("X-Partial"));
        assertNull(response.getHeaderString("Location"));
        assertEquals(CachedResponse.TEXT_PLAIN_UTF_8, response.getHeaderString("Content-Type"));
    }

    @Test
    void testEncode_BodyFailureGivesInternalServerError() {
        InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("broken pipe");
            }
        };

        Response response = new DefaultResponseEncoder("text/html").encodeResponse(
                CachedResponse.builder(200).body(failing).build());

        assertEquals(500, response.getStatus());
        assertEquals("Internal Server Error", body(response));
        assertEquals("text/html", response.getHeaderString("Content-Type"));
    }
}
