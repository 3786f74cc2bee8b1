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
 * Utilities for dealing with request targets.
 */
public class URLUtils {

    private static final char PATH_SEPARATOR = '/';

    private URLUtils() {

    }

    /**
     * Extracts the path component of a raw request target. The query string and fragment are dropped, and
     * for absolute form targets ({@code http://host/path}) the scheme and authority are dropped as well.
     * The path is returned exactly as sent, no percent decoding takes place.
     * <p>
     * The asterisk form ({@code *}) is returned unchanged, and an empty path becomes {@code /}.
     *
     * @param requestTarget the raw request target
     * @return the path
     */
    public static String getPath(final String requestTarget) {
        if (requestTarget == null || requestTarget.isEmpty()) {
            return "/";
        }
        int start = 0;
        int end = requestTarget.length();
        for (int i = 0; i < end; ++i) {
            char c = requestTarget.charAt(i);
            if (c == '?' || c == '#') {
                end = i;
                break;
            }
        }
        if (isAbsoluteUrl(requestTarget)) {
            // skip "scheme://" then the authority
            int authority = requestTarget.indexOf("://") + 3;
            int slash = requestTarget.indexOf(PATH_SEPARATOR, authority);
            if (slash == -1 || slash >= end) {
                return "/";
            }
            start = slash;
        }
        if (start == end) {
            return "/";
        }
        return requestTarget.substring(start, end);
    }

    /**
     * Test if provided location is an absolute URI or not.
     *
     * @param location location to check, null = relative, having scheme = absolute
     * @return true if location is considered absolute
     */
    public static boolean isAbsoluteUrl(String location) {
        if (location == null || location.isEmpty() || location.charAt(0) == PATH_SEPARATOR) {
            return false;
        }
        int schemeEnd = location.indexOf("://");
        if (schemeEnd <= 0) {
            return false;
        }
        for (int i = 0; i < schemeEnd; ++i) {
            char c = location.charAt(i);
            boolean valid = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                    || (i > 0 && ((c >= '0' && c <= '9') || c == '+' || c == '-' || c == '.'));
            if (!valid) {
                return false;
            }
        }
        return true;
    }
}
