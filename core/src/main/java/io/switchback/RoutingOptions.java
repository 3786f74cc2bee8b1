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

import org.xnio.Option;

/**
 * Configuration keys understood by {@link io.switchback.server.Router}.
 */
public class RoutingOptions {

    /**
     * If a request that matches no route should be handed to the next handler in the chain instead of
     * being answered with a 404. Defaults to false.
     */
    public static final Option<Boolean> CONTINUE_ON_NOT_FOUND = Option.simple(RoutingOptions.class, "CONTINUE_ON_NOT_FOUND", Boolean.class);

    /**
     * The request attribute that receives all path variables as a single map. If this is not set every
     * variable becomes its own request attribute.
     */
    public static final Option<String> PATH_VARIABLES_ATTRIBUTE = Option.simple(RoutingOptions.class, "PATH_VARIABLES_ATTRIBUTE", String.class);

    /**
     * The regular expression used for URI template variables that have no pattern of their own.
     * Defaults to {@link io.switchback.server.routing.TemplateRoute#RE_SLUG}.
     */
    public static final Option<String> DEFAULT_VARIABLE_PATTERN = Option.simple(RoutingOptions.class, "DEFAULT_VARIABLE_PATTERN", String.class);

    /**
     * If the content length and HEAD response preparation hooks should be installed. Defaults to true.
     */
    public static final Option<Boolean> DEFAULT_RESPONSE_PREPARATION = Option.simple(RoutingOptions.class, "DEFAULT_RESPONSE_PREPARATION", Boolean.class);

    private RoutingOptions() {

    }
}
