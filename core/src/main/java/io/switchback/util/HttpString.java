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

import io.switchback.SwitchbackMessages;

/**
 * A Latin-1 string compared without regard to ASCII case, used for method and header names.
 */
public final class HttpString {

    private final String string;
    private final String folded;

    /**
     * @param string the value, kept as given for {@link #toString()}
     * @throws IllegalArgumentException if the value holds CR, LF or a character outside Latin-1
     */
    public HttpString(final String string) {
        final char[] folded = new char[string.length()];
        for (int i = 0; i < folded.length; ++i) {
            final char c = string.charAt(i);
            if (c == '\r' || c == '\n') {
                throw SwitchbackMessages.MESSAGES.newlineNotSupportedInHttpString(string);
            }
            if (c > 0xff) {
                throw SwitchbackMessages.MESSAGES.invalidHttpStringCharacter(string);
            }
            folded[i] = c >= 'a' && c <= 'z' ? (char) (c - ('a' - 'A')) : c;
        }
        this.string = string;
        this.folded = new String(folded);
    }

    /**
     * @return an upper case copy of this string, or this instance if it is already upper case
     */
    public HttpString toUpperCase() {
        return folded.equals(string) ? this : new HttpString(folded);
    }

    @Override
    public int hashCode() {
        return folded.hashCode();
    }

    @Override
    public boolean equals(final Object other) {
        return other == this || other instanceof HttpString && folded.equals(((HttpString) other).folded);
    }

    @Override
    public String toString() {
        return string;
    }
}
