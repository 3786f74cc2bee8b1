/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2024 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.switchback.server;

import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import io.switchback.message.DefaultHttpResponse;
import io.switchback.message.HttpResponse;
import io.switchback.testutils.category.UnitTest;
import io.switchback.util.Headers;
import io.switchback.util.Methods;
import io.switchback.util.StatusCodes;

import static io.switchback.testutils.MessageUtils.body;
import static io.switchback.testutils.MessageUtils.request;

@Category(UnitTest.class)
public class MethodMapTestCase {

    private static HttpHandler text(final String text) {
        return (request, response) -> DefaultHttpResponse.of(StatusCodes.OK, text);
    }

    private static HttpResponse dispatch(final MethodMap map, final String method) throws Exception {
        return map.dispatch(request(method, "/cats"), new DefaultHttpResponse(), Next.TERMINAL);
    }

    @Test
    public void testDispatchByMethod() throws Exception {
        MethodMap map = new MethodMap()
                .register("GET", text("get"))
                .register("PUT,POST", text("write"));
        Assert.assertEquals("get", body(dispatch(map, "GET")));
        Assert.assertEquals("write", body(dispatch(map, "PUT")));
        Assert.assertEquals("write", body(dispatch(map, "POST")));
    }

    @Test
    public void testMethodNotAllowed() throws Exception {
        MethodMap map = new MethodMap().register("GET", text("get"));
        HttpResponse response = dispatch(map, "PUT");
        Assert.assertEquals(StatusCodes.METHOD_NOT_ALLOWED, response.getStatusCode());
        Assert.assertEquals("GET, HEAD, OPTIONS", response.getHeader(Headers.ALLOW));
        Assert.assertEquals("", body(response));
    }

    @Test
    public void testHeadFallsBackToGet() throws Exception {
        MethodMap map = new MethodMap().register("GET", text("get"));
        Assert.assertEquals("get", body(dispatch(map, "HEAD")));

        map.register("HEAD", text("head"));
        Assert.assertEquals("head", body(dispatch(map, "HEAD")));
        Assert.assertEquals("GET, HEAD, OPTIONS", map.getAllowedMethods());
    }

    @Test
    public void testOptions() throws Exception {
        MethodMap map = new MethodMap().register("POST", text("post")).register("DELETE", text("delete"));
        HttpResponse response = dispatch(map, "OPTIONS");
        Assert.assertEquals(StatusCodes.OK, response.getStatusCode());
        Assert.assertEquals("POST, DELETE, OPTIONS", response.getHeader(Headers.ALLOW));

        map.register("OPTIONS", text("options"));
        Assert.assertEquals("options", body(dispatch(map, "OPTIONS")));
        Assert.assertEquals("POST, DELETE, OPTIONS", map.getAllowedMethods());
    }

    @Test
    public void testWildcard() throws Exception {
        MethodMap map = new MethodMap()
                .register("GET", text("get"))
                .register(MethodMap.ANY_STRING, text("any"));
        Assert.assertEquals("get", body(dispatch(map, "GET")));
        Assert.assertEquals("any", body(dispatch(map, "DELETE")));
        Assert.assertEquals("any", body(dispatch(map, "PROPFIND")));
        Assert.assertEquals("get", body(dispatch(map, "HEAD")));
        Assert.assertEquals("any", body(dispatch(map, "OPTIONS")));
    }

    @Test
    public void testMethodsAreTrimmedAndUpperCased() throws Exception {
        MethodMap map = new MethodMap().register(" get , post", text("x"));
        Assert.assertNotNull(map.get(Methods.GET));
        Assert.assertNotNull(map.get(Methods.POST));
        Assert.assertEquals("GET, POST, HEAD, OPTIONS", map.getAllowedMethods());
    }

    @Test
    public void testLaterRegistrationReplaces() throws Exception {
        MethodMap map = new MethodMap().register("GET,PUT", text("first")).register("PUT", text("second"));
        Assert.assertEquals("first", body(dispatch(map, "GET")));
        Assert.assertEquals("second", body(dispatch(map, "PUT")));
    }

    @Test
    public void testMerge() throws Exception {
        MethodMap map = new MethodMap().register("GET", text("get")).register("PUT", text("put"));
        map.merge(new MethodMap().register("PUT", text("new put")).register("DELETE", text("delete")));
        Assert.assertEquals("get", body(dispatch(map, "GET")));
        Assert.assertEquals("new put", body(dispatch(map, "PUT")));
        Assert.assertEquals("delete", body(dispatch(map, "DELETE")));
    }

    @Test
    public void testEmptyMap() throws Exception {
        MethodMap map = new MethodMap();
        Assert.assertTrue(map.isEmpty());
        HttpResponse response = dispatch(map, "GET");
        Assert.assertEquals(StatusCodes.METHOD_NOT_ALLOWED, response.getStatusCode());
        Assert.assertEquals("OPTIONS", response.getHeader(Headers.ALLOW));
    }

    @Test
    public void testInvalidMethods() {
        assertRejected("GET,,POST");
        assertRejected("GET POST");
        assertRejected("");
        assertRejected("GET,get");
        assertRejected("PUT,PUT");
    }

    @Test
    public void testRejectedListLeavesMapUnchanged() {
        MethodMap map = new MethodMap();
        try {
            map.register("GET,BAD METHOD", text("x"));
            Assert.fail();
        } catch (IllegalArgumentException expected) {
            Assert.assertTrue(map.isEmpty());
        }
    }

    private static void assertRejected(final String methods) {
        try {
            new MethodMap().register(methods, text("x"));
            Assert.fail("expected " + methods + " to be rejected");
        } catch (IllegalArgumentException expected) {
            Assert.assertNotNull(expected.getMessage());
        }
    }
}
