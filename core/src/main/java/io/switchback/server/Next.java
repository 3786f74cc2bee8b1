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
 * The continuation handed to a {@link Middleware}: everything after it in the chain.
 */
@FunctionalInterface
public interface Next {

    /**
     * The end of every chain, returns the response unchanged.
     */
    Next TERMINAL = (request, response) -> response;

    HttpResponse proceed(HttpRequest request, HttpResponse response) throws Exception;
}
