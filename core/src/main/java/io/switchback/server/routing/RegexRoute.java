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

package io.switchback.server.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import io.switchback.SwitchbackMessages;

/**
 * Route whose target is a delimited regular expression, such as {@code ~/cats/([0-9]+)~}.
 * <p>
 * The delimiter is the first character of the target. It may be any character that is not a letter,
 * digit or whitespace, except {@code /}, {@code \}, <code>{</code> and {@code *}. The brackets
 * {@code (}, {@code [} and {@code <} are closed by their counterpart. The closing delimiter may be
 * followed by modifiers: {@code i} (case insensitive), {@code m} (multiline), {@code s} (dot matches
 * line terminators), {@code x} (comments) and {@code u} (unicode).
 * <p>
 * The expression must match the whole path. Named groups become path variables under their name and every
 * numbered group under its number, starting with {@code "1"}.
 */
public class RegexRoute extends Route {

    private static final String MODIFIERS = "imsxu";

    private final Pattern pattern;
    private final List<String> groupNames;

    public RegexRoute(final String target) {
        super(target, RouteKind.PATTERN);
        this.pattern = compile(target);
        this.groupNames = findGroupNames(pattern.pattern(), pattern.flags());
    }

    protected RegexRoute(final String target, final RouteKind kind, final Pattern pattern, final List<String> groupNames) {
        super(target, kind);
        this.pattern = pattern;
        this.groupNames = Collections.unmodifiableList(new ArrayList<>(groupNames));
    }

    /**
     * @return the compiled expression, reused for every request
     */
    public Pattern getPattern() {
        return pattern;
    }

    /**
     * @return the names of the named groups, in the order they appear in the expression
     */
    public List<String> getGroupNames() {
        return groupNames;
    }

    @Override
    public RouteMatch match(final String path) {
        final Matcher matcher = pattern.matcher(path);
        if (!matcher.matches()) {
            return RouteMatch.NONE;
        }
        return new RouteMatch(this, Collections.unmodifiableMap(extractPathVariables(matcher)));
    }

    protected Map<String, String> extractPathVariables(final Matcher matcher) {
        final Map<String, String> variables = new LinkedHashMap<>();
        for (String name : groupNames) {
            final String value = matcher.group(name);
            if (value != null) {
                variables.put(name, value);
            }
        }
        for (int i = 1; i <= matcher.groupCount(); ++i) {
            final String value = matcher.group(i);
            if (value != null) {
                variables.put(Integer.toString(i), value);
            }
        }
        return variables;
    }

    /**
     * Returns true if the target is a delimited regular expression, as described in the class documentation.
     * Modifier letters are not validated here, an unsupported one fails when the route is created.
     *
     * @param target the route target
     * @return true if the target should become a regular expression route
     */
    public static boolean isRegexTarget(final String target) {
        if (target.length() < 2) {
            return false;
        }
        final char open = target.charAt(0);
        if (Character.isLetterOrDigit(open) || Character.isWhitespace(open) || "/\\{*".indexOf(open) != -1) {
            return false;
        }
        final int close = target.lastIndexOf(closingDelimiter(open));
        if (close <= 0) {
            return false;
        }
        for (int i = close + 1; i < target.length(); ++i) {
            final char c = target.charAt(i);
            if (!(c >= 'a' && c <= 'z') && !(c >= 'A' && c <= 'Z')) {
                return false;
            }
        }
        return true;
    }

    private static char closingDelimiter(final char open) {
        switch (open) {
            case '(':
                return ')';
            case '[':
                return ']';
            case '<':
                return '>';
            default:
                return open;
        }
    }

    private static Pattern compile(final String target) {
        final char open = target.charAt(0);
        final int close = target.lastIndexOf(closingDelimiter(open));
        int flags = 0;
        for (int i = close + 1; i < target.length(); ++i) {
            final char modifier = target.charAt(i);
            switch (modifier) {
                case 'i':
                    flags |= Pattern.CASE_INSENSITIVE;
                    break;
                case 'm':
                    flags |= Pattern.MULTILINE;
                    break;
                case 's':
                    flags |= Pattern.DOTALL;
                    break;
                case 'x':
                    flags |= Pattern.COMMENTS;
                    break;
                case 'u':
                    flags |= Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;
                    break;
                default:
                    throw SwitchbackMessages.MESSAGES.unsupportedRegexModifier(modifier, target);
            }
        }
        try {
            return Pattern.compile(target.substring(1, close), flags);
        } catch (PatternSyntaxException e) {
            throw SwitchbackMessages.MESSAGES.invalidRegexRoute(target, e);
        }
    }

    /**
     * Finds the names of the named groups ({@code (?<name>...)}) in a regular expression, skipping escaped
     * characters, quoted sections and character classes. With {@link Pattern#COMMENTS} an unescaped {@code #}
     * starts a comment that runs to the end of the line, inside a character class too, as {@link Pattern}
     * reads it.
     */
    static List<String> findGroupNames(final String regex, final int flags) {
        final boolean comments = (flags & Pattern.COMMENTS) != 0;
        final List<String> names = new ArrayList<>();
        int classDepth = 0;
        for (int i = 0; i < regex.length(); ++i) {
            final char c = regex.charAt(i);
            if (comments && c == '#') {
                final int end = regex.indexOf('\n', i);
                if (end == -1) {
                    break;
                }
                i = end;
            } else if (c == '\\') {
                if (i + 1 < regex.length() && regex.charAt(i + 1) == 'Q') {
                    final int end = regex.indexOf("\\E", i + 2);
                    if (end == -1) {
                        break;
                    }
                    i = end + 1;
                } else {
                    ++i;
                }
            } else if (c == '[') {
                ++classDepth;
            } else if (c == ']' && classDepth > 0) {
                --classDepth;
            } else if (c == '(' && classDepth == 0 && regex.startsWith("?<", i + 1)
                    && i + 3 < regex.length() && Character.isLetter(regex.charAt(i + 3))) {
                final int end = regex.indexOf('>', i + 3);
                if (end != -1) {
                    names.add(regex.substring(i + 3, end));
                    i = end;
                }
            }
        }
        return names;
    }
}
