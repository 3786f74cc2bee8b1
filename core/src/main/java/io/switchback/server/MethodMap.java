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

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

import io.switchback.SwitchbackMessages;
import io.switchback.message.HttpRequest;
import io.switchback.message.HttpResponse;
import io.switchback.util.Headers;
import io.switchback.util.HttpString;
import io.switchback.util.Methods;
import io.switchback.util.StatusCodes;

/**
 * Dispatches to a handler chosen by the request method.
 * <p>
 * Lookup order is: the exact method, GET for a HEAD request when HEAD itself is not mapped, and the
 * {@link #ANY} wildcard. If none of these is mapped the map answers itself: OPTIONS gets a 200 and
 * anything else a 405, both with an {@code Allow} header.
 */
public final class MethodMap extends Dispatchable {

    /**
     * Wildcard entry used for any method that is not mapped explicitly.
     */
    public static final String ANY_STRING = "*";
    public static final HttpString ANY = new HttpString(ANY_STRING);

    private final Map<HttpString, Dispatchable> map = new LinkedHashMap<>();

    public MethodMap() {
        super(Kind.METHOD_MAP);
    }

    /**
     * Maps one or more methods to a dispatchable. Methods are given as a comma separated list, such as
     * {@code "GET,HEAD"}, and are matched case insensitively. A method that is already mapped is
     * replaced.
     *
     * @param methods      the comma separated methods, or {@code *}
     * @param dispatchable the target
     * @return this map
     * @throws IllegalArgumentException if the list contains an invalid or repeated method
     */
    public synchronized MethodMap register(final String methods, final Dispatchable dispatchable) {
        if (methods == null) {
            throw SwitchbackMessages.MESSAGES.argumentCannotBeNull("methods");
        }
        if (dispatchable == null) {
            throw SwitchbackMessages.MESSAGES.handlerCannotBeNull();
        }
        final Set<HttpString> seen = new LinkedHashSet<>();
        for (String part : methods.split(",", -1)) {
            final String method = part.trim();
            if (!ANY_STRING.equals(method) && !Methods.isValidMethod(method)) {
                throw SwitchbackMessages.MESSAGES.invalidHttpMethod(method, methods);
            }
            final HttpString key = new HttpString(method).toUpperCase();
            if (!seen.add(key)) {
                throw SwitchbackMessages.MESSAGES.duplicateHttpMethod(key.toString(), methods);
            }
        }
        for (HttpString key : seen) {
            map.put(key, dispatchable);
        }
        return this;
    }

    public MethodMap register(final String methods, final HttpHandler handler) {
        return register(methods, Dispatchable.of(handler));
    }

    public MethodMap register(final String methods, final Middleware middleware) {
        return register(methods, Dispatchable.of(middleware));
    }

    /**
     * Copies every entry of the given map into this one, replacing entries for the same method.
     *
     * @param other the map to copy
     * @return this map
     */
    public synchronized MethodMap merge(final MethodMap other) {
        synchronized (other) {
            map.putAll(other.map);
        }
        return this;
    }

    /**
     * @param method the method
     * @return the dispatchable registered for exactly this method, or null
     */
    public Dispatchable get(final HttpString method) {
        return map.get(method);
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    @Override
    public HttpResponse dispatch(final HttpRequest request, final HttpResponse response, final Next next) throws Exception {
        final HttpString method = request.getMethod();
        Dispatchable target = map.get(method);
        if (target == null && Methods.HEAD.equals(method)) {
            target = map.get(Methods.GET);
        }
        if (target == null) {
            target = map.get(ANY);
        }
        if (target != null) {
            return target.dispatch(request, response, next);
        }
        final int status = Methods.OPTIONS.equals(method) ? StatusCodes.OK : StatusCodes.METHOD_NOT_ALLOWED;
        return response.withStatus(status).withHeader(Headers.ALLOW, getAllowedMethods());
    }

    /**
     * @return the value of the {@code Allow} header this map sends
     */
    public String getAllowedMethods() {
        final StringJoiner allowed = new StringJoiner(", ");
        for (HttpString method : map.keySet()) {
            if (!ANY.equals(method)) {
                allowed.add(method.toString());
            }
        }
        if (map.containsKey(Methods.GET) && !map.containsKey(Methods.HEAD)) {
            allowed.add(Methods.HEAD_STRING);
        }
        if (!map.containsKey(Methods.OPTIONS)) {
            allowed.add(Methods.OPTIONS_STRING);
        }
        return allowed.toString();
    }

    @Override
    public String toString() {
        return "method-map( " + map.keySet() + " )";
    }
}
