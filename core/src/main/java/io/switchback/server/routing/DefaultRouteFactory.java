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

import io.switchback.SwitchbackLogger;
import io.switchback.SwitchbackMessages;

/**
 * The standard {@link RouteFactory}.
 */
public class DefaultRouteFactory implements RouteFactory {

    private final String defaultVariablePattern;

    public DefaultRouteFactory() {
        this(TemplateRoute.RE_SLUG);
    }

    /**
     * @param defaultVariablePattern the pattern used for template variables when a registration gives none
     */
    public DefaultRouteFactory(final String defaultVariablePattern) {
        this.defaultVariablePattern = defaultVariablePattern == null ? TemplateRoute.RE_SLUG : defaultVariablePattern;
    }

    @Override
    public Route create(final String target) {
        return create(target, null, null);
    }

    @Override
    public Route create(final String target, final String defaultPattern, final Map<String, String> variablePatterns) {
        if (target == null || target.isEmpty()) {
            throw SwitchbackMessages.MESSAGES.pathMustBeSpecified();
        }
        if (RegexRoute.isRegexTarget(target)) {
            return new RegexRoute(target);
        }
        if (target.endsWith("*")) {
            return new PrefixRoute(target);
        }
        if (TemplateRoute.isTemplate(target)) {
            return new TemplateRoute(target, defaultPattern == null ? defaultVariablePattern : defaultPattern, variablePatterns);
        }
        return new StaticRoute(target);
    }

    @Override
    public Route register(final RouteTable table, final String target, final String defaultPattern, final Map<String, String> variablePatterns) {
        synchronized (table) {
            final Route existing = table.getRoute(target);
            if (existing != null) {
                return existing;
            }
            final Route route = create(target, defaultPattern, variablePatterns);
            table.addRoute(route);
            SwitchbackLogger.ROUTING_LOGGER.routeRegistered(route.getKind(), target);
            return route;
        }
    }
}
