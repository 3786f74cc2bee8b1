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

import java.util.List;

import io.switchback.message.HttpRequest;
import io.switchback.message.HttpResponse;

/**
 * Runs sequences of dispatchables against a request and response.
 * <p>
 * Element {@code i} of a sequence receives a continuation that runs element {@code i + 1}; the continuation
 * after the last element is the caller's {@code next}. An element that returns without calling its
 * continuation ends the sequence.
 */
public final class Dispatcher {

    private Dispatcher() {
    }

    public static HttpResponse dispatch(final Dispatchable dispatchable, final HttpRequest request, final HttpResponse response, final Next next) throws Exception {
        return dispatchable.dispatch(request, response, next);
    }

    public static HttpResponse dispatch(final List<Dispatchable> sequence, final HttpRequest request, final HttpResponse response, final Next next) throws Exception {
        if (sequence.isEmpty()) {
            return next.proceed(request, response);
        }
        return new SequenceNext(sequence, 0, next).proceed(request, response);
    }

    private static final class SequenceNext implements Next {

        private final List<Dispatchable> sequence;
        private final int position;
        private final Next last;

        SequenceNext(final List<Dispatchable> sequence, final int position, final Next last) {
            this.sequence = sequence;
            this.position = position;
            this.last = last;
        }

        @Override
        public HttpResponse proceed(final HttpRequest request, final HttpResponse response) throws Exception {
            if (position == sequence.size()) {
                return last.proceed(request, response);
            }
            return sequence.get(position).dispatch(request, response, new SequenceNext(sequence, position + 1, last));
        }
    }
}
