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

import java.util.Map;

import io.switchback.util.HttpString;

/**
 * The request as seen by the routing core.
 * <p>
 * Requests are values: {@link #withAttribute(String, Object)} returns a new request and leaves the
 * receiver untouched, so a stage that wants later stages to see an attribute must pass the returned
 * instance on.
 */
public interface HttpRequest {

    /**
     * @return the request method
     */
    HttpString getMethod();

    /**
     * @return the raw request target, as it appeared in the request line
     */
    String getRequestTarget();

    /**
     * @param name the attribute name
     * @return the attribute value, or null if it is not present
     */
    Object getAttribute(String name);

    /**
     * @return an unmodifiable view of all attributes
     */
    Map<String, Object> getAttributes();

    /**
     * Returns a copy of this request with the given attribute set.
     *
     * @param name  the attribute name
     * @param value the attribute value
     * @return the new request
     */
    HttpRequest withAttribute(String name, Object value);
}
