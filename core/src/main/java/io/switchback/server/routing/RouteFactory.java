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

import java.util.Map;

/**
 * Creates routes from target strings.
 */
public interface RouteFactory {

    /**
     * Creates a route, choosing its kind from the syntax of the target:
     * <ul>
     *     <li>a delimited regular expression creates a {@link RegexRoute}</li>
     *     <li>a target ending with {@code *} creates a {@link PrefixRoute}</li>
     *     <li>a target containing a variable expression (<code>{id}</code>) creates a {@link TemplateRoute}</li>
     *     <li>anything else creates a {@link StaticRoute}</li>
     * </ul>
     *
     * @param target the route target
     * @return the new route
     * @throws IllegalArgumentException if the target is empty or is a malformed template or expression
     */
    Route create(String target);

    /**
     * As {@link #create(String)}, with the variable patterns used if the target is a URI template.
     *
     * @param target           the route target
     * @param defaultPattern   pattern for template variables not listed in {@code variablePatterns}, may be null
     * @param variablePatterns patterns by template variable name, may be null
     * @return the new route
     */
    Route create(String target, String defaultPattern, Map<String, String> variablePatterns);

    /**
     * Returns the route the table holds for the target, creating and adding it to the table if there is none
     * yet. Registering the same target twice returns the same route.
     *
     * @param table            the table to register with
     * @param target           the route target
     * @param defaultPattern   pattern for template variables, may be null
     * @param variablePatterns patterns by template variable name, may be null
     * @return the route for the target
     */
    Route register(RouteTable table, String target, String defaultPattern, Map<String, String> variablePatterns);
}
