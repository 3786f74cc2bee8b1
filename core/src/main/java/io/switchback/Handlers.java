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

package io.switchback;

import java.util.List;

import org.xnio.OptionMap;

import io.switchback.server.Dispatchable;
import io.switchback.server.HttpHandler;
import io.switchback.server.MethodMap;
import io.switchback.server.Router;
import io.switchback.server.handlers.ResponseCodeHandler;

/**
 * Utility class with convenience methods for dealing with handlers
 */
public class Handlers {

    /**
     *
     * @return a new router
     */
    public static Router router() {
        return new Router();
    }

    /**
     * Creates a new router, configured from the given options.
     *
     * @param options the options, see {@link RoutingOptions}
     * @return a new router
     */
    public static Router router(final OptionMap options) {
        return new Router(options);
    }

    /**
     *
     * @return a new, empty method map
     */
    public static MethodMap methodMap() {
        return new MethodMap();
    }

    /**
     * Creates a dispatchable that runs the given dispatchables in order.
     *
     * @param items the dispatchables
     * @return the chain
     */
    public static Dispatchable chain(final Dispatchable... items) {
        return Dispatchable.chain(items);
    }

    public static Dispatchable chain(final List<Dispatchable> items) {
        return Dispatchable.chain(items);
    }

    /**
     * Returns a handler that sets the response code and does nothing else.
     *
     * @param code the response code
     * @return a handler that sets the response code
     */
    public static HttpHandler responseCode(final int code) {
        return new ResponseCodeHandler(code);
    }

    private Handlers() {

    }
}
