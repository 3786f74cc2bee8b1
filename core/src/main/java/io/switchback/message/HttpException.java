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

import io.switchback.SwitchbackMessages;
import io.switchback.util.StatusCodes;

/**
 * An exception that maps onto an HTTP response. When raised by a handler below the
 * {@link io.switchback.server.Router} it is turned into a response with the exception's status code and
 * its message as the body.
 */
public class HttpException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public HttpException(final int statusCode) {
        this(statusCode, StatusCodes.getReason(statusCode));
    }

    public HttpException(final int statusCode, final String message) {
        super(message);
        this.statusCode = checkStatus(statusCode);
    }

    public HttpException(final int statusCode, final String message, final Throwable cause) {
        super(message, cause);
        this.statusCode = checkStatus(statusCode);
    }

    private static int checkStatus(final int statusCode) {
        if (!StatusCodes.isValid(statusCode)) {
            throw SwitchbackMessages.MESSAGES.invalidStatusCode(statusCode);
        }
        return statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
