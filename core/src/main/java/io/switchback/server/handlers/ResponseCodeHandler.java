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

package io.switchback.server.handlers;

import io.switchback.SwitchbackLogger;
import io.switchback.SwitchbackMessages;
import io.switchback.message.HttpRequest;
import io.switchback.message.HttpResponse;
import io.switchback.server.HttpHandler;
import io.switchback.util.StatusCodes;

/**
 * A handler which simply sets a response code.
 */
public final class ResponseCodeHandler implements HttpHandler {

    /**
     * A handler which sets a 403 code.
     */
    public static final ResponseCodeHandler HANDLE_403 = new ResponseCodeHandler(403);
    /**
     * A handler which sets a 404 code.
     */
    public static final ResponseCodeHandler HANDLE_404 = new ResponseCodeHandler(404);

    private final int responseCode;

    /**
     * Construct a new instance.
     *
     * @param responseCode the response code to set
     */
    public ResponseCodeHandler(final int responseCode) {
        if (!StatusCodes.isValid(responseCode)) {
            throw SwitchbackMessages.MESSAGES.invalidStatusCode(responseCode);
        }
        this.responseCode = responseCode;
    }

    @Override
    public HttpResponse handleRequest(final HttpRequest request, final HttpResponse response) {
        SwitchbackLogger.REQUEST_LOGGER.debugf("Response code set to [%s] for %s.", responseCode, request);
        return response.withStatus(responseCode);
    }

    @Override
    public String toString() {
        return "response-code( " + this.responseCode + " )";
    }
}
