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

import java.util.Locale;
import java.util.Objects;

import io.switchback.SwitchbackLogger;
import io.switchback.message.HttpRequest;
import io.switchback.message.HttpResponse;
import io.switchback.server.Dispatchable;
import io.switchback.server.MethodMap;
import io.switchback.server.Middleware;
import io.switchback.server.Next;

/**
 * A path matching rule bound to a dispatchable.
 * <p>
 * The target and kind never change. The dispatchable can be replaced or, when it is a {@link MethodMap},
 * extended while the application is being configured. A route that has not been given anything yet holds
 * an empty method map, so it answers every request with a 405.
 */
public abstract class Route implements Middleware {

    private final String target;
    private final RouteKind kind;
    private volatile Dispatchable dispatchable = new MethodMap();

    protected Route(final String target, final RouteKind kind) {
        this.target = Objects.requireNonNull(target);
        this.kind = Objects.requireNonNull(kind);
    }

    /**
     * @return the string this route was registered with
     */
    public String getTarget() {
        return target;
    }

    public RouteKind getKind() {
        return kind;
    }

    public Dispatchable getDispatchable() {
        return dispatchable;
    }

    /**
     * Matches a request path against this route.
     *
     * @param path the request path, without query string
     * @return the match, or {@link RouteMatch#NONE}
     */
    public abstract RouteMatch match(String path);

    /**
     * Binds a dispatchable to this route. A method map given to a route that already holds one is merged
     * into it; anything else replaces the current dispatchable.
     *
     * @param dispatchable the dispatchable
     */
    public synchronized void setDispatchable(final Dispatchable dispatchable) {
        Objects.requireNonNull(dispatchable);
        final Dispatchable current = this.dispatchable;
        if (dispatchable.getKind() == Dispatchable.Kind.METHOD_MAP) {
            final MethodMap incoming = (MethodMap) dispatchable;
            if (current.getKind() == Dispatchable.Kind.METHOD_MAP) {
                ((MethodMap) current).merge(incoming);
                return;
            }
            SwitchbackLogger.ROUTING_LOGGER.routeHandlerReplaced(target);
            // copied so later registrations do not leak into the caller's map
            this.dispatchable = new MethodMap().merge(incoming);
            return;
        }
        if (current.getKind() != Dispatchable.Kind.METHOD_MAP || !((MethodMap) current).isEmpty()) {
            SwitchbackLogger.ROUTING_LOGGER.routeHandlerReplaced(target);
        }
        this.dispatchable = dispatchable;
    }

    /**
     * Registers a dispatchable for one or more methods of this route. A dispatchable that was bound to the
     * route as a whole is kept for every other method.
     *
     * @param methods      comma separated methods, see {@link MethodMap#register(String, Dispatchable)}
     * @param dispatchable the dispatchable
     */
    public synchronized void register(final String methods, final Dispatchable dispatchable) {
        final Dispatchable current = this.dispatchable;
        if (current.getKind() == Dispatchable.Kind.METHOD_MAP) {
            ((MethodMap) current).register(methods, dispatchable);
            return;
        }
        final MethodMap map = new MethodMap();
        map.register(MethodMap.ANY_STRING, current);
        map.register(methods, dispatchable);
        this.dispatchable = map;
    }

    @Override
    public HttpResponse handleRequest(final HttpRequest request, final HttpResponse response, final Next next) throws Exception {
        return dispatchable.dispatch(request, response, next);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ENGLISH) + "-route( " + target + " )";
    }
}
