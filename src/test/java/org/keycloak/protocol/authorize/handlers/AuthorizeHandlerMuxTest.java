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

package org.keycloak.protocol.authorize.handlers;

import org.junit.jupiter.api.Test;
import org.keycloak.protocol.authorize.AuthorizeContext;
import org.keycloak.protocol.authorize.exceptions.MissingResponseTypeException;
import org.keycloak.protocol.authorize.representations.AuthorizeRequest;
import org.keycloak.protocol.authorize.representations.AuthorizeStage;
import org.keycloak.protocol.authorize.responders.CachedResponse;
import org.keycloak.protocol.authorize.responders.Responder;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AuthorizeHandlerMuxTest {

    private static AuthorizeRequest request(AuthorizeStage stage, String clientId) {
        AuthorizeRequest request = new AuthorizeRequest();
        request.setStage(stage);
        request.setClientId(clientId);
        return request;
    }

    @Test
    void testDispatch_RoutesByStage() {
        AtomicInteger initialCalls = new AtomicInteger();
        AtomicInteger authorizeCalls = new AtomicInteger();

        AuthorizeHandler mux = AuthorizeHandlerMux.builder()
                .add(AuthorizeStage.INITIALIZE, (ctx, ar, err) -> {
                    assertEquals("hello-client-1", ar.getClientId());
                    initialCalls.incrementAndGet();
                    return null;
                })
                .add(AuthorizeStage.TO_AUTHORIZE, (ctx, ar, err) -> {
                    assertEquals("hello-client-2", ar.getClientId());
                    authorizeCalls.incrementAndGet();
                    return null;
                })
                .build();

        assertNull(mux.handleAuthorizeRequest(AuthorizeContext.empty(),
                request(AuthorizeStage.INITIALIZE, "hello-client-1"), null));
        assertEquals(1, initialCalls.get());
        assertEquals(0, authorizeCalls.get());

        mux.handleAuthorizeRequest(AuthorizeContext.empty(),
                request(AuthorizeStage.TO_AUTHORIZE, "hello-client-2"), null);
        assertEquals(1, initialCalls.get());
        assertEquals(1, authorizeCalls.get());
    }

    @Test
    void testDispatch_PassesContextAndDecodeError() {
        AuthorizeContext context = new AuthorizeContext(null, null);
        MissingResponseTypeException decodeError = new MissingResponseTypeException();
        Responder expected = CachedResponse.builder(200).body("login").build();

        AuthorizeHandlerMux mux = AuthorizeHandlerMux.builder()
                .add(AuthorizeStage.INITIALIZE, (ctx, ar, err) -> {
                    assertSame(context, ctx);
                    assertSame(decodeError, err);
                    return expected;
                })
                .build();

        assertSame(expected, mux.handleAuthorizeRequest(context, new AuthorizeRequest(), decodeError));
    }

    @Test
    void testDispatch_UnregisteredStageGivesInternalServerError() throws Exception {
        AuthorizeHandlerMux mux = AuthorizeHandlerMux.builder()
                .add(AuthorizeStage.INITIALIZE, (ctx, ar, err) -> fail("wrong handler"))
                .build();

        Responder responder = mux.handleAuthorizeRequest(AuthorizeContext.empty(),
                request(AuthorizeStage.INTERMEDIATE, "c"), null);

        CachedResponse cached = assertInstanceOf(CachedResponse.class, responder);
        assertEquals(500, cached.getStatus());
        assertEquals("Internal Server Error",
                new String(cached.getBody().readAllBytes(), StandardCharsets.UTF_8));
    }

    @Test
    void testAdd_LaterHandlerReplacesEarlier() {
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();

        AuthorizeHandlerMux mux = AuthorizeHandlerMux.builder()
                .add(AuthorizeStage.custom(100), (ctx, ar, err) -> {
                    first.incrementAndGet();
                    return null;
                })
                .add(AuthorizeStage.custom(100), (ctx, ar, err) -> {
                    second.incrementAndGet();
                    return null;
                })
                .build();

        mux.handleAuthorizeRequest(AuthorizeContext.empty(), request(AuthorizeStage.valueOf(100), "c"), null);

        assertEquals(0, first.get());
        assertEquals(1, second.get());
    }

    @Test
    void testBuild_LaterRegistrationDoesNotLeakIntoBuiltMux() {
        AuthorizeHandlerMux.Builder builder = AuthorizeHandlerMux.builder();
        AuthorizeHandlerMux mux = builder.build();
        builder.add(AuthorizeStage.INITIALIZE, (ctx, ar, err) -> null);

        assertFalse(mux.hasHandler(AuthorizeStage.INITIALIZE));
    }
}
