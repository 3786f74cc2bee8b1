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

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import io.switchback.SwitchbackLogger;
import io.switchback.SwitchbackMessages;
import io.switchback.message.HttpRequest;
import io.switchback.message.HttpResponse;

/**
 * Anything that can be placed in a handler chain or bound to a route.
 * <p>
 * The shape of the target is decided when the dispatchable is created, see {@link Kind}. Dispatching
 * never inspects the target again.
 */
public abstract class Dispatchable {

    public enum Kind {
        /**
         * An {@link HttpHandler}, the chain ends with it.
         */
        HANDLER,
        /**
         * A {@link Middleware}, which decides if the chain continues.
         */
        MIDDLEWARE,
        /**
         * An ordered sequence of dispatchables.
         */
        CHAIN,
        /**
         * A ready made response, returned as is.
         */
        RESPONSE,
        /**
         * A {@link MethodMap}.
         */
        METHOD_MAP,
        /**
         * A handler class or supplier that is instantiated on first use.
         */
        LATE_BOUND
    }

    private final Kind kind;

    Dispatchable(final Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Runs this dispatchable.
     *
     * @param request  the current request
     * @param response the current response
     * @param next     the rest of the chain
     * @return the resulting response
     */
    public abstract HttpResponse dispatch(HttpRequest request, HttpResponse response, Next next) throws Exception;

    public static Dispatchable of(final HttpHandler handler) {
        return new HandlerDispatchable(HttpHandlers.handlerNotNull(handler));
    }

    public static Dispatchable of(final Middleware middleware) {
        return new MiddlewareDispatchable(HttpHandlers.handlerNotNull(middleware));
    }

    public static Dispatchable chain(final Dispatchable... items) {
        return chain(Arrays.asList(items));
    }

    public static Dispatchable chain(final List<Dispatchable> items) {
        for (Dispatchable item : items) {
            HttpHandlers.handlerNotNull(item);
        }
        return new ChainDispatchable(List.copyOf(items));
    }

    public static Dispatchable response(final HttpResponse response) {
        if (response == null) {
            throw SwitchbackMessages.MESSAGES.argumentCannotBeNull("response");
        }
        return new ResponseDispatchable(response);
    }

    /**
     * Creates a dispatchable that instantiates the given class the first time it is dispatched. The class
     * is checked now: it must implement {@link HttpHandler} or {@link Middleware} and have a public
     * no-argument constructor.
     *
     * @param type the handler class
     * @return the dispatchable
     */
    public static Dispatchable lateBound(final Class<?> type) {
        HttpHandlers.handlerNotNull(type);
        if (!HttpHandler.class.isAssignableFrom(type) && !Middleware.class.isAssignableFrom(type)) {
            throw SwitchbackMessages.MESSAGES.notAHandlerClass(type.getName());
        }
        final Constructor<?> constructor;
        try {
            constructor = type.getConstructor();
        } catch (NoSuchMethodException e) {
            throw SwitchbackMessages.MESSAGES.noDefaultConstructor(type.getName());
        }
        return new LateBoundDispatchable(type.getName(), () -> {
            try {
                return constructor.newInstance();
            } catch (InvocationTargetException e) {
                throw SwitchbackMessages.MESSAGES.couldNotInstantiateHandler(type.getName(), e.getCause());
            } catch (ReflectiveOperationException e) {
                throw SwitchbackMessages.MESSAGES.couldNotInstantiateHandler(type.getName(), e);
            }
        });
    }

    /**
     * Creates a dispatchable that obtains its handler from the supplier the first time it is dispatched.
     * The supplier must return an {@link HttpHandler} or a {@link Middleware}.
     *
     * @param supplier the supplier
     * @return the dispatchable
     */
    public static Dispatchable lateBound(final Supplier<?> supplier) {
        return new LateBoundDispatchable(String.valueOf(HttpHandlers.handlerNotNull(supplier)), supplier);
    }

    private static final class HandlerDispatchable extends Dispatchable {

        private final HttpHandler handler;

        HandlerDispatchable(final HttpHandler handler) {
            super(Kind.HANDLER);
            this.handler = handler;
        }

        @Override
        public HttpResponse dispatch(final HttpRequest request, final HttpResponse response, final Next next) throws Exception {
            return handler.handleRequest(request, response);
        }

        @Override
        public String toString() {
            return "handler( " + handler + " )";
        }
    }

    private static final class MiddlewareDispatchable extends Dispatchable {

        private final Middleware middleware;

        MiddlewareDispatchable(final Middleware middleware) {
            super(Kind.MIDDLEWARE);
            this.middleware = middleware;
        }

        @Override
        public HttpResponse dispatch(final HttpRequest request, final HttpResponse response, final Next next) throws Exception {
            return middleware.handleRequest(request, response, next);
        }

        @Override
        public String toString() {
            return "middleware( " + middleware + " )";
        }
    }

    private static final class ChainDispatchable extends Dispatchable {

        private final List<Dispatchable> items;

        ChainDispatchable(final List<Dispatchable> items) {
            super(Kind.CHAIN);
            this.items = items;
        }

        @Override
        public HttpResponse dispatch(final HttpRequest request, final HttpResponse response, final Next next) throws Exception {
            return Dispatcher.dispatch(items, request, response, next);
        }

        @Override
        public String toString() {
            return "chain( " + items + " )";
        }
    }

    private static final class ResponseDispatchable extends Dispatchable {

        private final HttpResponse response;

        ResponseDispatchable(final HttpResponse response) {
            super(Kind.RESPONSE);
            this.response = response;
        }

        @Override
        public HttpResponse dispatch(final HttpRequest request, final HttpResponse response, final Next next) {
            return this.response;
        }

        @Override
        public String toString() {
            return "response( " + response.getStatusCode() + " )";
        }
    }

    private static final class LateBoundDispatchable extends Dispatchable {

        private final String name;
        private final Supplier<?> supplier;
        private volatile Dispatchable resolved;

        LateBoundDispatchable(final String name, final Supplier<?> supplier) {
            super(Kind.LATE_BOUND);
            this.name = name;
            this.supplier = Objects.requireNonNull(supplier);
        }

        @Override
        public HttpResponse dispatch(final HttpRequest request, final HttpResponse response, final Next next) throws Exception {
            return resolve().dispatch(request, response, next);
        }

        private Dispatchable resolve() {
            Dispatchable local = resolved;
            if (local == null) {
                synchronized (this) {
                    local = resolved;
                    if (local == null) {
                        final Object instance = supplier.get();
                        if (instance instanceof Middleware) {
                            local = new MiddlewareDispatchable((Middleware) instance);
                        } else if (instance instanceof HttpHandler) {
                            local = new HandlerDispatchable((HttpHandler) instance);
                        } else {
                            throw SwitchbackMessages.MESSAGES.notAHandlerInstance(instance);
                        }
                        SwitchbackLogger.REQUEST_LOGGER.lateBoundHandlerInstantiated(name);
                        resolved = local;
                    }
                }
            }
            return local;
        }

        @Override
        public String toString() {
            return "late-bound( " + name + " )";
        }
    }
}
