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

package io.switchback.util;

/**
 * Header names used by the routing core.
 */
public final class Headers {

    private Headers() {
    }

    public static final String ALLOW_STRING = "Allow";
    public static final String CONTENT_LENGTH_STRING = "Content-Length";
    public static final String CONTENT_TYPE_STRING = "Content-Type";
    public static final String LOCATION_STRING = "Location";
    public static final String TRANSFER_ENCODING_STRING = "Transfer-Encoding";

    public static final HttpString ALLOW = new HttpString(ALLOW_STRING);
    public static final HttpString CONTENT_LENGTH = new HttpString(CONTENT_LENGTH_STRING);
    public static final HttpString CONTENT_TYPE = new HttpString(CONTENT_TYPE_STRING);
    public static final HttpString LOCATION = new HttpString(LOCATION_STRING);
    public static final HttpString TRANSFER_ENCODING = new HttpString(TRANSFER_ENCODING_STRING);

    public static final String CHUNKED = "chunked";

    /**
     * Returns true if the given comma separated header value contains the token, ignoring case.
     *
     * @param headerValue the header value, may be null
     * @param token the token to look for
     * @return true if the token is present
     */
    public static boolean containsToken(final String headerValue, final String token) {
        if (headerValue == null) {
            return false;
        }
        for (String part : headerValue.split(",")) {
            if (part.trim().equalsIgnoreCase(token)) {
                return true;
            }
        }
        return false;
    }
}
