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

/**
 * How a route target is interpreted. The kind of a route is decided once, from the syntax of its target.
 */
public enum RouteKind {

    /**
     * The target is a literal path, for example {@code /cats/}.
     */
    STATIC,

    /**
     * The target ends with {@code *} and matches every path that starts with the rest of it,
     * for example {@code /cats/*}.
     */
    PREFIX,

    /**
     * The target is a URI template, for example {@code /cats/{id}}.
     */
    TEMPLATE,

    /**
     * The target is a delimited regular expression, for example {@code ~/cats/([0-9]+)~}.
     */
    PATTERN
}
