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

import java.util.HashMap;
import java.util.Map;

/**
 * Status codes used by the routing core and its default error responses, and their reason phrases.
 */
public final class StatusCodes {

    private static final Map<Integer, String> REASONS = new HashMap<>();

    public static final int OK = 200;
    public static final int CREATED = 201;
    public static final int ACCEPTED = 202;
    public static final int NO_CONTENT = 204;
    public static final int BAD_REQUEST = 400;
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;
    public static final int CONFLICT = 409;
    public static final int GONE = 410;
    public static final int INTERNAL_SERVER_ERROR = 500;
    public static final int SERVICE_UNAVAILABLE = 503;

    public static final String OK_STRING = "OK";
    public static final String CREATED_STRING = "Created";
    public static final String ACCEPTED_STRING = "Accepted";
    public static final String NO_CONTENT_STRING = "No Content";
    public static final String BAD_REQUEST_STRING = "Bad Request";
    public static final String FORBIDDEN_STRING = "Forbidden";
    public static final String NOT_FOUND_STRING = "Not Found";
    public static final String METHOD_NOT_ALLOWED_STRING = "Method Not Allowed";
    public static final String CONFLICT_STRING = "Conflict";
    public static final String GONE_STRING = "Gone";
    public static final String INTERNAL_SERVER_ERROR_STRING = "Internal Server Error";
    public static final String SERVICE_UNAVAILABLE_STRING = "Service Unavailable";

    static {
        REASONS.put(OK, OK_STRING);
        REASONS.put(CREATED, CREATED_STRING);
        REASONS.put(ACCEPTED, ACCEPTED_STRING);
        REASONS.put(NO_CONTENT, NO_CONTENT_STRING);
        REASONS.put(BAD_REQUEST, BAD_REQUEST_STRING);
        REASONS.put(FORBIDDEN, FORBIDDEN_STRING);
        REASONS.put(NOT_FOUND, NOT_FOUND_STRING);
        REASONS.put(METHOD_NOT_ALLOWED, METHOD_NOT_ALLOWED_STRING);
        REASONS.put(CONFLICT, CONFLICT_STRING);
        REASONS.put(GONE, GONE_STRING);
        REASONS.put(INTERNAL_SERVER_ERROR, INTERNAL_SERVER_ERROR_STRING);
        REASONS.put(SERVICE_UNAVAILABLE, SERVICE_UNAVAILABLE_STRING);
    }

    private StatusCodes() {
    }

    public static String getReason(final int code) {
        final String reason = REASONS.get(code);
        return reason == null ? "Unknown" : reason;
    }

    /**
     * @param code the status code
     * @return true if the code is a three digit HTTP status code
     */
    public static boolean isValid(final int code) {
        return code >= 100 && code <= 999;
    }
}
