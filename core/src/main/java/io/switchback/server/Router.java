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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.xnio.OptionMap;

import io.switchback.RoutingOptions;
import io.switchback.SwitchbackLogger;
import io.switchback.SwitchbackMessages;
import io.switchback.message.HttpException;
import io.switchback.message.HttpRequest;
import io.switchback.message.HttpResponse;
import io.switchback.server.handlers.ContentLengthHandler;
import io.switchback.server.handlers.HeadHandler;
import io.switchback.server.routing.DefaultRouteFactory;
import io.switchback.server.routing.Route;
import io.switchback.server.routing.RouteFactory;
import io.switchback.server.routing.RouteMatch;
import io.switchback.server.routing.RouteTable;
import io.switchback.server.routing.TemplateRoute;
import io.switchback.util.Methods;
import io.switchback.util.StatusCodes;
import io.switchback.util.URLUtils;

/**
 * Routes requests to the handlers registered for their path, surrounded by a fixed sequence of hooks.
 * <p>
 * Every request goes through these stages, in this order:
 * <ol>
 *     <li>the pre-route hooks</li>
 *     <li>the route table; an {@link HttpException} raised here becomes a response with the exception's
 *     status code and message</li>
 *     <li>the status handler registered for the resulting status code, if there is one</li>
 *     <li>the post-route hooks</li>
 *     <li>the response preparation hooks, by default {@link #CONTENT_LENGTH_HOOK} and {@link #HEAD_HOOK}</li>
 * </ol>
 * A hook that hands a different request to its continuation changes the request seen by every later stage.
 * Exceptions other than {@link HttpException} are not caught.
 * <p>
 * Targets are interpreted as described in {@link RouteFactory#create(String)}. Registering a target that is
 * already registered returns to the same route, so methods can be added one call at a time:
 * <pre>
 * router.get("/cats/{id}", this::getCat)
 *       .put("/cats/{id}", this::putCat);
 * </pre>
 */
public class Router implements Middleware {

    /**
     * Sets {@code Content-Length} from the body size.
     */
    public static final Dispatchable CONTENT_LENGTH_HOOK = Dispatchable.of(new ContentLengthHandler());

    /**
     * Drops the body of responses to HEAD requests.
     */
    public static final Dispatchable HEAD_HOOK = Dispatchable.of(new HeadHandler());

    private final RouteTable routeTable = new RouteTable();
    private final RouteFactory routeFactory;

    private final List<Dispatchable> preRouteHooks = new CopyOnWriteArrayList<>();
    private final List<Dispatchable> postRouteHooks = new CopyOnWriteArrayList<>();
    private final List<Dispatchable> responsePreparationHooks = new CopyOnWriteArrayList<>();
    private final Map<Integer, Dispatchable> statusHandlers = new ConcurrentHashMap<>();

    public Router() {
        this(OptionMap.EMPTY);
    }

    public Router(final OptionMap options) {
        this(options, new DefaultRouteFactory(options.get(RoutingOptions.DEFAULT_VARIABLE_PATTERN, TemplateRoute.RE_SLUG)));
    }

    public Router(final OptionMap options, final RouteFactory routeFactory) {
        if (routeFactory == null) {
            throw SwitchbackMessages.MESSAGES.argumentCannotBeNull("routeFactory");
        }
        this.routeFactory = routeFactory;
        routeTable.setContinueOnNotFound(options.get(RoutingOptions.CONTINUE_ON_NOT_FOUND, false));
        routeTable.setPathVariablesAttributeName(options.get(RoutingOptions.PATH_VARIABLES_ATTRIBUTE));
        if (options.get(RoutingOptions.DEFAULT_RESPONSE_PREPARATION, true)) {
            responsePreparationHooks.add(CONTENT_LENGTH_HOOK);
            responsePreparationHooks.add(HEAD_HOOK);
        }
    }

    /**
     * Runs a request through the router with nothing after it.
     *
     * @param request  the request
     * @param response the initial response
     * @return the final response
     */
    public HttpResponse dispatch(final HttpRequest request, final HttpResponse response) throws Exception {
        return handleRequest(request, response, Next.TERMINAL);
    }

    @Override
    public HttpResponse handleRequest(final HttpRequest request, final HttpResponse response, final Next next) throws Exception {
        final Stage stage = new Stage(request, response);
        runHooks(preRouteHooks, stage);
        try {
            stage.response = routeTable.handleRequest(stage.request, stage.response, next);
        } catch (HttpException e) {
            // a subclass may report a code the constructor never saw
            final int statusCode = StatusCodes.isValid(e.getStatusCode()) ? e.getStatusCode() : StatusCodes.INTERNAL_SERVER_ERROR;
            SwitchbackLogger.REQUEST_LOGGER.httpExceptionRaised(stage.request.getRequestTarget(), statusCode, e);
            final String message = e.getMessage() == null ? "" : e.getMessage();
            stage.response = stage.response.withStatus(statusCode)
                    .withBody(ByteBuffer.wrap(message.getBytes(StandardCharsets.UTF_8)));
        }
        final Dispatchable statusHandler = statusHandlers.get(stage.response.getStatusCode());
        if (statusHandler != null) {
            stage.run(statusHandler);
        }
        runHooks(postRouteHooks, stage);
        runHooks(responsePreparationHooks, stage);
        return stage.response;
    }

    private static void runHooks(final List<Dispatchable> hooks, final Stage stage) throws Exception {
        for (Dispatchable hook : hooks) {
            stage.run(hook);
        }
    }

    /**
     * Finds the route for a path, without dispatching.
     *
     * @param path the path, with or without a query string
     * @return the match
     */
    public RouteMatch match(final String path) {
        return routeTable.match(URLUtils.getPath(path));
    }

    /**
     * Binds a dispatchable to a target.
     *
     * @param target       the path, prefix, URI template or delimited regular expression
     * @param dispatchable what to run for requests that match
     * @return this router
     */
    public Router add(final String target, final Dispatchable dispatchable) {
        return add(target, dispatchable, null, null);
    }

    public Router add(final String target, final HttpHandler handler) {
        return add(target, Dispatchable.of(handler));
    }

    public Router add(final String target, final Middleware middleware) {
        return add(target, Dispatchable.of(middleware));
    }

    public Router add(final String target, final Dispatchable dispatchable, final String defaultPattern) {
        return add(target, dispatchable, defaultPattern, null);
    }

    public Router add(final String target, final Dispatchable dispatchable, final Map<String, String> variablePatterns) {
        return add(target, dispatchable, null, variablePatterns);
    }

    /**
     * Binds a dispatchable to a target. The patterns are only used if the target is a URI template that has
     * not been registered before.
     *
     * @param target           the path, prefix, URI template or delimited regular expression
     * @param dispatchable     what to run for requests that match
     * @param defaultPattern   pattern for template variables not listed in {@code variablePatterns}, may be null
     * @param variablePatterns patterns by template variable name, may be null
     * @return this router
     */
    public synchronized Router add(final String target, final Dispatchable dispatchable, final String defaultPattern, final Map<String, String> variablePatterns) {
        HttpHandlers.handlerNotNull(dispatchable);
        final Route route = routeFactory.register(routeTable, target, defaultPattern, variablePatterns);
        route.setDispatchable(dispatchable);
        return this;
    }

    /**
     * Binds a dispatchable to some methods of a target, keeping whatever the target's other methods are
     * bound to.
     *
     * @param methods      comma separated methods, such as {@code "GET,HEAD"}, or {@code *}
     * @param target       the route target
     * @param dispatchable what to run
     * @return this router
     */
    public synchronized Router register(final String methods, final String target, final Dispatchable dispatchable) {
        HttpHandlers.handlerNotNull(dispatchable);
        final Route route = routeFactory.register(routeTable, target, null, null);
        route.register(methods, dispatchable);
        return this;
    }

    public Router register(final String methods, final String target, final HttpHandler handler) {
        return register(methods, target, Dispatchable.of(handler));
    }

    public Router register(final String methods, final String target, final Middleware middleware) {
        return register(methods, target, Dispatchable.of(middleware));
    }

    public Router get(final String target, final HttpHandler handler) {
        return register(Methods.GET_STRING, target, handler);
    }

    public Router post(final String target, final HttpHandler handler) {
        return register(Methods.POST_STRING, target, handler);
    }

    public Router put(final String target, final HttpHandler handler) {
        return register(Methods.PUT_STRING, target, handler);
    }

    public Router delete(final String target, final HttpHandler handler) {
        return register(Methods.DELETE_STRING, target, handler);
    }

    /**
     * Adds middleware that runs before the handler of every matched route.
     */
    public Router addMiddleware(final Dispatchable dispatchable) {
        routeTable.addMiddleware(dispatchable);
        return this;
    }

    public Router addMiddleware(final Middleware middleware) {
        return addMiddleware(Dispatchable.of(middleware));
    }

    public Router addPreRouteHook(final Dispatchable hook) {
        preRouteHooks.add(HttpHandlers.handlerNotNull(hook));
        return this;
    }

    public Router addPreRouteHook(final Middleware hook) {
        return addPreRouteHook(Dispatchable.of(hook));
    }

    public Router addPostRouteHook(final Dispatchable hook) {
        postRouteHooks.add(HttpHandlers.handlerNotNull(hook));
        return this;
    }

    public Router addPostRouteHook(final Middleware hook) {
        return addPostRouteHook(Dispatchable.of(hook));
    }

    public Router addResponsePreparationHook(final Dispatchable hook) {
        responsePreparationHooks.add(HttpHandlers.handlerNotNull(hook));
        return this;
    }

    public Router addResponsePreparationHook(final Middleware hook) {
        return addResponsePreparationHook(Dispatchable.of(hook));
    }

    /**
     * Removes a response preparation hook, for example {@link #HEAD_HOOK}.
     *
     * @param hook the hook
     * @return true if the hook was present
     */
    public boolean removeResponsePreparationHook(final Dispatchable hook) {
        return responsePreparationHooks.remove(hook);
    }

    public Router clearResponsePreparationHooks() {
        responsePreparationHooks.clear();
        return this;
    }

    /**
     * Sets the handler that runs after routing whenever the response has the given status code. Setting a
     * handler for a code that already has one replaces it.
     *
     * @param statusCode the status code
     * @param handler    the handler
     * @return this router
     */
    public Router setStatusHandler(final int statusCode, final Dispatchable handler) {
        if (!StatusCodes.isValid(statusCode)) {
            throw SwitchbackMessages.MESSAGES.invalidStatusCode(statusCode);
        }
        statusHandlers.put(statusCode, HttpHandlers.handlerNotNull(handler));
        return this;
    }

    public Router setStatusHandler(final int statusCode, final HttpHandler handler) {
        return setStatusHandler(statusCode, Dispatchable.of(handler));
    }

    public Router setStatusHandler(final int statusCode, final Middleware handler) {
        return setStatusHandler(statusCode, Dispatchable.of(handler));
    }

    public boolean isContinueOnNotFound() {
        return routeTable.isContinueOnNotFound();
    }

    public Router setContinueOnNotFound(final boolean continueOnNotFound) {
        routeTable.setContinueOnNotFound(continueOnNotFound);
        return this;
    }

    public String getPathVariablesAttributeName() {
        return routeTable.getPathVariablesAttributeName();
    }

    public Router setPathVariablesAttributeName(final String pathVariablesAttributeName) {
        routeTable.setPathVariablesAttributeName(pathVariablesAttributeName);
        return this;
    }

    public RouteTable getRouteTable() {
        return routeTable;
    }

    /**
     * The request and response as they move through the stages of one request. Used as the continuation of
     * every hook, so the request a hook passes on is remembered.
     */
    private static final class Stage implements Next {

        private HttpRequest request;
        private HttpResponse response;

        Stage(final HttpRequest request, final HttpResponse response) {
            this.request = request;
            this.response = response;
        }

        void run(final Dispatchable dispatchable) throws Exception {
            response = dispatchable.dispatch(request, response, this);
        }

        @Override
        public HttpResponse proceed(final HttpRequest request, final HttpResponse response) {
            this.request = request;
            return response;
        }
    }
}
