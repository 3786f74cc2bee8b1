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
 * Route whose target is a URI template such as {@code /cats/{id}}.
 * <p>
 * The template is split on {@code /}. Every segment is matched literally, except for a variable expression
 * <code>{name}</code>, which matches the pattern registered for that variable or the default pattern. A
 * segment may hold literal text around its expression, but only one expression.
 * <p>
 * Only the template variables become path variables.
 */
public class TemplateRoute extends RegexRoute {

    /**
     * Letters, digits, hyphen and underscore.
     */
    public static final String RE_SLUG = "[0-9a-zA-Z\\-_]+";
    public static final String RE_NUM = "[0-9]+";
    public static final String RE_ALPHA = "[a-zA-Z]+";
    public static final String RE_ALPHANUM = "[0-9a-zA-Z]+";

    private static final Pattern EXPRESSION = Pattern.compile("\\{([a-zA-Z][a-zA-Z0-9]*)}");

    private static final Pattern ANY_EXPRESSION = Pattern.compile("\\{[^/]*?}");

    private static final Pattern CANDIDATE_EXPRESSION = Pattern.compile("\\{[^/{}]+}");

    public TemplateRoute(final String template) {
        this(template, RE_SLUG, Collections.emptyMap());
    }

    /**
     * @param template         the URI template
     * @param defaultPattern   the pattern for variables that have none in {@code variablePatterns}, null
     *                         for {@link #RE_SLUG}
     * @param variablePatterns patterns by variable name, may be null
     */
    public TemplateRoute(final String template, final String defaultPattern, final Map<String, String> variablePatterns) {
        this(template, new Builder(template,
                defaultPattern == null ? RE_SLUG : defaultPattern,
                variablePatterns == null ? Collections.emptyMap() : variablePatterns));
    }

    private TemplateRoute(final String template, final Builder builder) {
        super(template, RouteKind.TEMPLATE, builder.compile(), builder.names);
    }

    /**
     * Returns true if any segment of the target holds a non-empty brace expression. The expression is
     * only checked when the template is compiled, so an invalid variable name such as {@code {cat_id}}
     * fails there rather than turning the target into a static route.
     *
     * @param target the route target
     * @return true if the target is a template
     */
    public static boolean isTemplate(final String target) {
        return CANDIDATE_EXPRESSION.matcher(target).find();
    }

    @Override
    protected Map<String, String> extractPathVariables(final Matcher matcher) {
        final Map<String, String> variables = new LinkedHashMap<>();
        for (String name : getGroupNames()) {
            variables.put(name, matcher.group(name));
        }
        return variables;
    }

    private static final class Builder {

        private final String template;
        private final String defaultPattern;
        private final Map<String, String> variablePatterns;
        private final List<String> names = new ArrayList<>();

        Builder(final String template, final String defaultPattern, final Map<String, String> variablePatterns) {
            this.template = template;
            this.defaultPattern = defaultPattern;
            this.variablePatterns = variablePatterns;
        }

        Pattern compile() {
            final String path = template.startsWith("/") ? template.substring(1) : template;
            final StringBuilder regex = new StringBuilder();
            for (String segment : path.split("/", -1)) {
                regex.append('/');
                appendSegment(regex, segment);
            }
            try {
                return Pattern.compile(regex.toString());
            } catch (PatternSyntaxException e) {
                throw SwitchbackMessages.MESSAGES.invalidTemplatePattern(regex.toString(), template, e);
            }
        }

        private void appendSegment(final StringBuilder regex, final String segment) {
            if (segment.indexOf('{') == -1 && segment.indexOf('}') == -1) {
                appendLiteral(regex, segment);
                return;
            }
            final Matcher expressions = ANY_EXPRESSION.matcher(segment);
            int count = 0;
            while (expressions.find()) {
                ++count;
            }
            if (count > 1) {
                throw SwitchbackMessages.MESSAGES.multipleVariablesInTemplateSegment(template, segment);
            }
            final Matcher expression = EXPRESSION.matcher(segment);
            if (count == 0 || !expression.find()) {
                throw SwitchbackMessages.MESSAGES.malformedTemplateExpression(template, segment);
            }
            final String prefix = segment.substring(0, expression.start());
            final String suffix = segment.substring(expression.end());
            if (prefix.indexOf('{') != -1 || prefix.indexOf('}') != -1
                    || suffix.indexOf('{') != -1 || suffix.indexOf('}') != -1) {
                throw SwitchbackMessages.MESSAGES.malformedTemplateExpression(template, segment);
            }
            final String name = expression.group(1);
            if (names.contains(name)) {
                throw SwitchbackMessages.MESSAGES.duplicateTemplateVariable(template, name);
            }
            names.add(name);
            final String variablePattern = variablePatterns.getOrDefault(name, defaultPattern);
            appendLiteral(regex, prefix);
            regex.append("(?<").append(name).append('>').append(variablePattern).append(')');
            appendLiteral(regex, suffix);
        }

        private static void appendLiteral(final StringBuilder regex, final String literal) {
            if (!literal.isEmpty()) {
                regex.append(Pattern.quote(literal));
            }
        }
    }
}
