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

import io.switchback.message.HttpRequest;
import io.switchback.message.HttpResponse;
import io.switchback.server.Middleware;
import io.switchback.server.Next;
import io.switchback.util.Headers;

/**
 * Sets {@code Content-Length} from the size of the body. Responses that already carry a
 * {@code Content-Length}, or that use chunked transfer encoding, are passed on untouched.
 */
public class ContentLengthHandler implements Middleware {

    @Override
    public HttpResponse handleRequest(final HttpRequest request, final HttpResponse response, final Next next) throws Exception {
        if (response.hasHeader(Headers.CONTENT_LENGTH)
                || Headers.containsToken(response.getHeader(Headers.TRANSFER_ENCODING), Headers.CHUNKED)) {
            return next.proceed(request, response);
        }
        final int size = response.getBody().remaining();
        return next.proceed(request, response.withHeader(Headers.CONTENT_LENGTH, Integer.toString(size)));
    }

    @Override
    public String toString() {
        return "content-length()";
    }
}
