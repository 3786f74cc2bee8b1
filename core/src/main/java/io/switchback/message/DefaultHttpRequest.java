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

package io.switchback.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.switchback.util.HttpString;

/**
 * Immutable {@link HttpRequest} for callers that have no transport level request object of their own.
 */
public final class DefaultHttpRequest implements HttpRequest {

    private final HttpString method;
    private final String requestTarget;
    private final Map<String, Object> attributes;

    public DefaultHttpRequest(final HttpString method, final String requestTarget) {
        this(method, requestTarget, Collections.emptyMap());
    }

    public DefaultHttpRequest(final String method, final String requestTarget) {
        this(new HttpString(method), requestTarget);
    }

    private DefaultHttpRequest(final HttpString method, final String requestTarget, final Map<String, Object> attributes) {
        this.method = Objects.requireNonNull(method);
        this.requestTarget = Objects.requireNonNull(requestTarget);
        this.attributes = attributes;
    }

    @Override
    public HttpString getMethod() {
        return method;
    }

    @Override
    public String getRequestTarget() {
        return requestTarget;
    }

    @Override
    public Object getAttribute(final String name) {
        return attributes.get(name);
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public HttpRequest withAttribute(final String name, final Object value) {
        Objects.requireNonNull(name);
        final Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.put(name, value);
        return new DefaultHttpRequest(method, requestTarget, Collections.unmodifiableMap(copy));
    }

    @Override
    public String toString() {
        return method + " " + requestTarget;
    }
}
