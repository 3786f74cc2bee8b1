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
import java.util.Map;

/**
 * The result of matching a path against a {@link RouteTable}.
 */
public final class RouteMatch {

    /**
     * Returned when no route matched.
     */
    public static final RouteMatch NONE = new RouteMatch(null, Collections.emptyMap());

    private final Route route;
    private final Map<String, String> pathVariables;

    public RouteMatch(final Route route, final Map<String, String> pathVariables) {
        this.route = route;
        this.pathVariables = pathVariables;
    }

    /**
     * @return the matched route, or null if nothing matched
     */
    public Route getRoute() {
        return route;
    }

    /**
     * @return the path variables captured by a template or pattern route, empty for the other kinds
     */
    public Map<String, String> getPathVariables() {
        return pathVariables;
    }

    public boolean isMatched() {
        return route != null;
    }
}
