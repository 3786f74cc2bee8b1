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

/**
 * Route that matches every path starting with a literal prefix. The target is the prefix followed by
 * {@code *}.
 */
public class PrefixRoute extends Route {

    private final String prefix;

    public PrefixRoute(final String target) {
        super(target, RouteKind.PREFIX);
        this.prefix = target.endsWith("*") ? target.substring(0, target.length() - 1) : target;
    }

    /**
     * @return the target without its trailing {@code *}
     */
    public String getPrefix() {
        return prefix;
    }

    @Override
    public RouteMatch match(final String path) {
        return path.startsWith(prefix) ? new RouteMatch(this, Collections.emptyMap()) : RouteMatch.NONE;
    }
}
