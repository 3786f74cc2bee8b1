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

package io.switchback.server;

import io.switchback.message.HttpRequest;
import io.switchback.message.HttpResponse;

/**
 * A terminal handler for an HTTP request. A handler produces the response and never hands the request on.
 */
@FunctionalInterface
public interface HttpHandler {

    /**
     * Handle the request.
     *
     * @param request  the request
     * @param response the response built so far
     * @return the response to send
     */
    HttpResponse handleRequest(HttpRequest request, HttpResponse response) throws Exception;
}
