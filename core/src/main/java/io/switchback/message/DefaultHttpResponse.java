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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.switchback.SwitchbackMessages;
import io.switchback.util.HttpString;
import io.switchback.util.StatusCodes;

/**
 * Immutable {@link HttpResponse}. A new instance has status 200, no headers and an empty body.
 */
public final class DefaultHttpResponse implements HttpResponse {

    private static final ByteBuffer EMPTY_BODY = ByteBuffer.allocate(0).asReadOnlyBuffer();

    private final int statusCode;
    private final Map<HttpString, List<String>> headers;
    private final ByteBuffer body;

    public DefaultHttpResponse() {
        this(StatusCodes.OK, Collections.emptyMap(), EMPTY_BODY);
    }

    public DefaultHttpResponse(final int statusCode) {
        this(checkStatus(statusCode), Collections.emptyMap(), EMPTY_BODY);
    }

    private DefaultHttpResponse(final int statusCode, final Map<HttpString, List<String>> headers, final ByteBuffer body) {
        this.statusCode = statusCode;
        this.headers = headers;
        this.body = body;
    }

    /**
     * Convenience method to create a response with a text body, encoded as UTF-8.
     *
     * @param statusCode the status code
     * @param body       the body
     * @return the response
     */
    public static DefaultHttpResponse of(final int statusCode, final String body) {
        return new DefaultHttpResponse(checkStatus(statusCode), Collections.emptyMap(),
                ByteBuffer.wrap(body.getBytes(StandardCharsets.UTF_8)).asReadOnlyBuffer());
    }

    private static int checkStatus(final int statusCode) {
        if (!StatusCodes.isValid(statusCode)) {
            throw SwitchbackMessages.MESSAGES.invalidStatusCode(statusCode);
        }
        return statusCode;
    }

    @Override
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public HttpResponse withStatus(final int statusCode) {
        return new DefaultHttpResponse(checkStatus(statusCode), headers, body);
    }

    @Override
    public ByteBuffer getBody() {
        return body.duplicate();
    }

    @Override
    public HttpResponse withBody(final ByteBuffer body) {
        if (body == null) {
            return new DefaultHttpResponse(statusCode, headers, EMPTY_BODY);
        }
        final ByteBuffer copy = ByteBuffer.allocate(body.remaining());
        copy.put(body.duplicate());
        copy.flip();
        return new DefaultHttpResponse(statusCode, headers, copy.asReadOnlyBuffer());
    }

    @Override
    public String getHeader(final HttpString name) {
        final List<String> values = headers.get(name);
        return values == null ? null : values.get(0);
    }

    @Override
    public List<String> getHeaders(final HttpString name) {
        final List<String> values = headers.get(name);
        return values == null ? Collections.emptyList() : values;
    }

    @Override
    public boolean hasHeader(final HttpString name) {
        return headers.containsKey(name);
    }

    @Override
    public HttpResponse withHeader(final HttpString name, final String value) {
        Objects.requireNonNull(value);
        final Map<HttpString, List<String>> copy = new LinkedHashMap<>(headers);
        copy.remove(name);
        copy.put(name, Collections.singletonList(value));
        return new DefaultHttpResponse(statusCode, Collections.unmodifiableMap(copy), body);
    }

    @Override
    public HttpResponse withAddedHeader(final HttpString name, final String value) {
        Objects.requireNonNull(value);
        final List<String> values = new ArrayList<>(getHeaders(name));
        values.add(value);
        final Map<HttpString, List<String>> copy = new LinkedHashMap<>(headers);
        copy.put(name, Collections.unmodifiableList(values));
        return new DefaultHttpResponse(statusCode, Collections.unmodifiableMap(copy), body);
    }

    @Override
    public HttpResponse withoutHeader(final HttpString name) {
        if (!headers.containsKey(name)) {
            return this;
        }
        final Map<HttpString, List<String>> copy = new LinkedHashMap<>(headers);
        copy.remove(name);
        return new DefaultHttpResponse(statusCode, Collections.unmodifiableMap(copy), body);
    }

    @Override
    public String toString() {
        return "DefaultHttpResponse{statusCode=" + statusCode + ", headers=" + headers + ", bodySize=" + body.remaining() + "}";
    }
}
