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
import java.util.List;

import io.switchback.util.HttpString;

/**
 * The response as seen by the routing core. Like {@link HttpRequest} every modification returns a new
 * response value.
 */
public interface HttpResponse {

    int getStatusCode();

    HttpResponse withStatus(int statusCode);

    /**
     * @return a read only view of the body, never null
     */
    ByteBuffer getBody();

    /**
     * @param body the new body, copied from its position to its limit; null for an empty body
     * @return a response with the given body
     */
    HttpResponse withBody(ByteBuffer body);

    /**
     * @param name the header name
     * @return the first value of the header, or null if it is not present
     */
    String getHeader(HttpString name);

    /**
     * @param name the header name
     * @return all values of the header, empty if it is not present
     */
    List<String> getHeaders(HttpString name);

    boolean hasHeader(HttpString name);

    /**
     * Returns a copy of this response with every existing value of the header replaced by the given value.
     */
    HttpResponse withHeader(HttpString name, String value);

    /**
     * Returns a copy of this response with the value appended to any existing values of the header.
     */
    HttpResponse withAddedHeader(HttpString name, String value);

    HttpResponse withoutHeader(HttpString name);
}
