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

package io.switchback.server.routing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import io.switchback.message.DefaultHttpRequest;
import io.switchback.message.DefaultHttpResponse;
import io.switchback.message.HttpRequest;
import io.switchback.message.HttpResponse;
import io.switchback.server.Dispatchable;
import io.switchback.server.Next;
import io.switchback.testutils.category.UnitTest;
import io.switchback.util.HttpString;
import io.switchback.util.StatusCodes;

@Category(UnitTest.class)
public class RouteTableTestCase {

    private final RouteFactory factory = new DefaultRouteFactory();

    private Route add(final RouteTable table, final String target, final String body) {
        final Route route = factory.register(table, target, null, null);
        route.setDispatchable(Dispatchable.of((request, response) -> DefaultHttpResponse.of(StatusCodes.OK, body)));
        return route;
    }

    private static String body(final HttpResponse response) {
        final byte[] bytes = new byte[response.getBody().remaining()];
        response.getBody().get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static HttpResponse get(final RouteTable table, final String target, final Next next) throws Exception {
        return table.handleRequest(new DefaultHttpRequest("GET", target), new DefaultHttpResponse(), next);
    }

    @Test
    public void testStaticRouteBeatsPrefixAndPattern() throws Exception {
        RouteTable table = new RouteTable();
        add(table, "/cats/*", "prefix");
        add(table, "/cats/{id}", "template");
        add(table, "/cats/molly", "static");

        Assert.assertEquals("static", body(get(table, "/cats/molly", Next.TERMINAL)));
        Assert.assertEquals("prefix", body(get(table, "/cats/12", Next.TERMINAL)));
    }

    @Test
    public void testLongestPrefixWins() throws Exception {
        RouteTable table = new RouteTable();
        add(table, "/a/*", "short");
        add(table, "/a/b/*", "long");
        add(table, "*", "everything");

        Assert.assertEquals("long", body(get(table, "/a/b/c", Next.TERMINAL)));
        Assert.assertEquals("long", body(get(table, "/a/b/", Next.TERMINAL)));
        Assert.assertEquals("short", body(get(table, "/a/bc", Next.TERMINAL)));
        Assert.assertEquals("short", body(get(table, "/a/", Next.TERMINAL)));
        Assert.assertEquals("everything", body(get(table, "/a", Next.TERMINAL)));
        Assert.assertEquals("everything", body(get(table, "/", Next.TERMINAL)));
    }

    @Test
    public void testPatternRoutesInRegistrationOrder() throws Exception {
        RouteTable table = new RouteTable();
        add(table, "/cats/{name}", "template");
        add(table, "~/cats/[0-9]+~", "pattern");

        Assert.assertEquals("template", body(get(table, "/cats/12", Next.TERMINAL)));

        table = new RouteTable();
        add(table, "~/cats/[0-9]+~", "pattern");
        add(table, "/cats/{name}", "template");

        Assert.assertEquals("pattern", body(get(table, "/cats/12", Next.TERMINAL)));
        Assert.assertEquals("template", body(get(table, "/cats/molly", Next.TERMINAL)));
    }

    @Test
    public void testMatchReturnsPathVariables() {
        RouteTable table = new RouteTable();
        Route route = add(table, "/cats/{id}", "template");
        RouteMatch match = table.match("/cats/42");
        Assert.assertSame(route, match.getRoute());
        Assert.assertEquals(Collections.singletonMap("id", "42"), match.getPathVariables());
        Assert.assertFalse(table.match("/cats/").isMatched());
        Assert.assertSame(RouteMatch.NONE, table.match("/dogs"));
    }

    @Test
    public void testPathVariablesBecomeAttributes() throws Exception {
        RouteTable table = new RouteTable();
        List<HttpRequest> seen = new ArrayList<>();
        factory.register(table, "/cats/{id}/toys/{toy}", null, null).setDispatchable(Dispatchable.of((request, response) -> {
            seen.add(request);
            return response;
        }));

        get(table, "/cats/42/toys/ball?x=1", Next.TERMINAL);
        Assert.assertEquals("42", seen.get(0).getAttribute("id"));
        Assert.assertEquals("ball", seen.get(0).getAttribute("toy"));

        table.setPathVariablesAttributeName("pathVariables");
        get(table, "/cats/7/toys/mouse", Next.TERMINAL);
        Assert.assertNull(seen.get(1).getAttribute("id"));
        Map<?, ?> variables = (Map<?, ?>) seen.get(1).getAttribute("pathVariables");
        Assert.assertEquals("7", variables.get("id"));
        Assert.assertEquals("mouse", variables.get("toy"));
    }

    @Test
    public void testStaticRoutesDoNotSetAttributes() throws Exception {
        RouteTable table = new RouteTable();
        table.setPathVariablesAttributeName("pathVariables");
        List<HttpRequest> seen = new ArrayList<>();
        factory.register(table, "/cats", null, null).setDispatchable(Dispatchable.of((request, response) -> {
            seen.add(request);
            return response;
        }));
        get(table, "/cats", Next.TERMINAL);
        Assert.assertTrue(seen.get(0).getAttributes().isEmpty());
    }

    @Test
    public void testNotFound() throws Exception {
        RouteTable table = new RouteTable();
        add(table, "/cats", "static");
        AtomicInteger calls = new AtomicInteger();
        Next next = (request, response) -> {
            calls.incrementAndGet();
            return response.withStatus(StatusCodes.NO_CONTENT);
        };

        Assert.assertEquals(StatusCodes.NOT_FOUND, get(table, "/dogs", next).getStatusCode());
        Assert.assertEquals(0, calls.get());

        table.setContinueOnNotFound(true);
        Assert.assertEquals(StatusCodes.NO_CONTENT, get(table, "/dogs", next).getStatusCode());
        Assert.assertEquals(1, calls.get());
    }

    @Test
    public void testRouteWithoutHandlerAnswers405() throws Exception {
        RouteTable table = new RouteTable();
        factory.register(table, "/cats", null, null);
        Assert.assertEquals(StatusCodes.METHOD_NOT_ALLOWED, get(table, "/cats", Next.TERMINAL).getStatusCode());
    }

    @Test
    public void testMiddlewareRunsBeforeMatchedRouteOnly() throws Exception {
        RouteTable table = new RouteTable();
        add(table, "/cats", "static");
        List<String> calls = new ArrayList<>();
        table.addMiddleware(Dispatchable.of((request, response, next) -> {
            calls.add("first");
            return next.proceed(request, response);
        }));
        table.addMiddleware(Dispatchable.of((request, response, next) -> {
            calls.add("second");
            return next.proceed(request, response);
        }));

        Assert.assertEquals("static", body(get(table, "/cats", Next.TERMINAL)));
        Assert.assertEquals(List.of("first", "second"), calls);

        get(table, "/dogs", Next.TERMINAL);
        Assert.assertEquals(2, calls.size());
    }

    @Test
    public void testRouteMiddlewareContinuesToCallerOnce() throws Exception {
        RouteTable table = new RouteTable();
        Route route = factory.register(table, "/cats", null, null);
        List<String> calls = new ArrayList<>();
        route.setDispatchable(Dispatchable.of((request, response, next) -> {
            calls.add("route");
            return next.proceed(request, response.withHeader(new HttpString("X-Route"), "cats"));
        }));
        table.addMiddleware(Dispatchable.of((request, response, next) -> {
            calls.add("middleware");
            return next.proceed(request, response);
        }));

        HttpResponse response = get(table, "/cats", (request, resp) -> {
            calls.add("caller");
            return resp.withStatus(StatusCodes.ACCEPTED);
        });
        Assert.assertEquals(List.of("middleware", "route", "caller"), calls);
        Assert.assertEquals(StatusCodes.ACCEPTED, response.getStatusCode());
        Assert.assertEquals("cats", response.getHeader(new HttpString("X-Route")));

        table.addMiddleware(Dispatchable.of((request, response2, next) -> {
            calls.add("late");
            return next.proceed(request, response2);
        }));
        calls.clear();
        get(table, "/cats", Next.TERMINAL);
        Assert.assertEquals(List.of("middleware", "late", "route"), calls);
    }

    @Test
    public void testAddRouteReplacesTarget() throws Exception {
        RouteTable table = new RouteTable();
        add(table, "/a/*", "first");
        PrefixRoute replacement = new PrefixRoute("/a/*");
        replacement.setDispatchable(Dispatchable.of((request, response) -> DefaultHttpResponse.of(StatusCodes.OK, "second")));
        table.addRoute(replacement);

        Assert.assertSame(replacement, table.getRoute("/a/*"));
        Assert.assertEquals(1, table.getRoutes().size());
        Assert.assertEquals("second", body(get(table, "/a/x", Next.TERMINAL)));
    }
}
