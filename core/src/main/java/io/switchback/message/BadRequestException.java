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

import io.switchback.util.StatusCodes;

public class BadRequestException extends HttpException {

    private static final long serialVersionUID = 1L;

    public BadRequestException() {
        super(StatusCodes.BAD_REQUEST, StatusCodes.BAD_REQUEST_STRING);
    }

    public BadRequestException(final String message) {
        super(StatusCodes.BAD_REQUEST, message);
    }
}
