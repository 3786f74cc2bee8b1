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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

import io.switchback.SwitchbackLogger;
import io.switchback.SwitchbackMessages;
import io.switchback.message.HttpRequest;
import io.switchback.message.HttpResponse;
import io.switchback.server.Dispatchable;
import io.switchback.server.Dispatcher;
import io.switchback.server.Middleware;
import io.switchback.server.Next;
import io.switchback.server.handlers.ResponseCodeHandler;
import io.switchback.util.URLUtils;

/**
 * Holds the routes of a router, indexed by kind, and dispatches requests to the best matching one.
 * <p>
 * Matching is done in three steps, the first that finds a route wins:
 * <ol>
 *     <li>static routes, by exact path</li>
 *     <li>prefix routes, the longest prefix of the path wins</li>
 *     <li>template and pattern routes, tried in the order they were added</li>
 * </ol>
 * Routes are expected to be added while the application starts. Matching takes no locks, so adding routes
 * while requests are being matched is not supported.
 */
public class RouteTable implements Middleware {

    private final ConcurrentMap<String, Route> routesByTarget = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Route> staticRoutes = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Route> prefixRoutes = new ConcurrentHashMap<>();
    private final List<Route> patternRoutes = new CopyOnWriteArrayList<>();
    private final List<Dispatchable> middleware = new CopyOnWriteArrayList<>();

    /**
     * lengths of all registered prefixes, longest first
     */
    private volatile int[] prefixLengths = {};

    private volatile boolean continueOnNotFound;
    private volatile String pathVariablesAttributeName;

    /**
     * Adds a route. A route already registered for the same target is replaced.
     *
     * @param route the route
     */
    public synchronized void addRoute(final Route route) {
        if (route == null) {
            throw SwitchbackMessages.MESSAGES.argumentCannotBeNull("route");
        }
        final Route previous = routesByTarget.put(route.getTarget(), route);
        if (previous != null) {
            removeFromIndex(previous);
        }
        switch (route.getKind()) {
            case STATIC:
                staticRoutes.put(route.getTarget(), route);
                break;
            case PREFIX:
                prefixRoutes.put(((PrefixRoute) route).getPrefix(), route);
                buildLengths();
                break;
            default:
                patternRoutes.add(route);
                break;
        }
    }

    private void removeFromIndex(final Route route) {
        switch (route.getKind()) {
            case STATIC:
                staticRoutes.remove(route.getTarget());
                break;
            case PREFIX:
                prefixRoutes.remove(((PrefixRoute) route).getPrefix());
                buildLengths();
                break;
            default:
                patternRoutes.remove(route);
                break;
        }
    }

    /**
     * @param target the target string a route was registered with
     * @return the route, or null
     */
    public Route getRoute(final String target) {
        return routesByTarget.get(target);
    }

    /**
     * @return all routes by target
     */
    public Map<String, Route> getRoutes() {
        return Collections.unmodifiableMap(routesByTarget);
    }

    /**
     * Finds the route for a path.
     *
     * @param path the request path, without query string
     * @return the match, never null; {@link RouteMatch#NONE} if no route matched
     */
    public RouteMatch match(final String path) {
        final Route exact = staticRoutes.get(path);
        if (exact != null) {
            SwitchbackLogger.REQUEST_LOGGER.debugf("Matched exact path %s", path);
            return new RouteMatch(exact, Collections.emptyMap());
        }

        final int length = path.length();
        final int[] lengths = this.prefixLengths;
        for (int i = 0; i < lengths.length; ++i) {
            final int prefixLength = lengths[i];
            if (prefixLength <= length) {
                final Route prefix = prefixRoutes.get(path.substring(0, prefixLength));
                if (prefix != null) {
                    SwitchbackLogger.REQUEST_LOGGER.debugf("Matched prefix route %s for path %s", prefix.getTarget(), path);
                    return new RouteMatch(prefix, Collections.emptyMap());
                }
            }
        }

        for (Route route : patternRoutes) {
            final RouteMatch match = route.match(path);
            if (match.isMatched()) {
                SwitchbackLogger.REQUEST_LOGGER.debugf("Matched %s route %s for path %s", route.getKind(), route.getTarget(), path);
                return match;
            }
        }
        SwitchbackLogger.REQUEST_LOGGER.debugf("No route matched path %s", path);
        return RouteMatch.NONE;
    }

    @Override
    public HttpResponse handleRequest(final HttpRequest request, final HttpResponse response, final Next next) throws Exception {
        final RouteMatch match = match(URLUtils.getPath(request.getRequestTarget()));
        if (!match.isMatched()) {
            if (continueOnNotFound) {
                return next.proceed(request, response);
            }
            return ResponseCodeHandler.HANDLE_404.handleRequest(request, response);
        }
        final Route route = match.getRoute();
        final HttpRequest routed = bindPathVariables(request, match);
        if (middleware.isEmpty()) {
            return route.handleRequest(routed, response, next);
        }
        return Dispatcher.dispatch(middleware, routed, response, (req, resp) -> route.handleRequest(req, resp, next));
    }

    private HttpRequest bindPathVariables(final HttpRequest request, final RouteMatch match) {
        final RouteKind kind = match.getRoute().getKind();
        if (kind != RouteKind.TEMPLATE && kind != RouteKind.PATTERN) {
            return request;
        }
        final String attributeName = this.pathVariablesAttributeName;
        if (attributeName != null) {
            return request.withAttribute(attributeName, match.getPathVariables());
        }
        HttpRequest result = request;
        for (Map.Entry<String, String> variable : match.getPathVariables().entrySet()) {
            result = result.withAttribute(variable.getKey(), variable.getValue());
        }
        return result;
    }

    private void buildLengths() {
        final Set<Integer> lengths = new TreeSet<>(Collections.reverseOrder());
        for (String prefix : prefixRoutes.keySet()) {
            lengths.add(prefix.length());
        }

        final int[] lengthArray = new int[lengths.size()];
        int pos = 0;
        for (int i : lengths) {
            lengthArray[pos++] = i;
        }
        this.prefixLengths = lengthArray;
    }

    /**
     * Adds middleware that runs before the matched route, for every request that matches a route. Requests
     * that match nothing do not run it.
     *
     * @param dispatchable the middleware
     * @return this table
     */
    public RouteTable addMiddleware(final Dispatchable dispatchable) {
        if (dispatchable == null) {
            throw SwitchbackMessages.MESSAGES.handlerCannotBeNull();
        }
        middleware.add(dispatchable);
        return this;
    }

    public boolean isContinueOnNotFound() {
        return continueOnNotFound;
    }

    /**
     * @param continueOnNotFound if a request that matches no route is handed to the next handler instead
     *                           of getting a 404
     */
    public void setContinueOnNotFound(final boolean continueOnNotFound) {
        this.continueOnNotFound = continueOnNotFound;
    }

    public String getPathVariablesAttributeName() {
        return pathVariablesAttributeName;
    }

    /**
     * @param pathVariablesAttributeName the request attribute that receives all path variables as one map,
     *                                   or null to set every variable as its own attribute
     */
    public void setPathVariablesAttributeName(final String pathVariablesAttributeName) {
        this.pathVariablesAttributeName = pathVariablesAttributeName;
    }
}
