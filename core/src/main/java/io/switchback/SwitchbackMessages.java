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

package io.switchback;

import java.util.regex.PatternSyntaxException;

import org.jboss.logging.Messages;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageBundle;

@MessageBundle(projectCode = "SWB")
public interface SwitchbackMessages {

    SwitchbackMessages MESSAGES = Messages.getBundle(SwitchbackMessages.class);

    @Message(id = 1, value = "Path must be specified")
    IllegalArgumentException pathMustBeSpecified();

    @Message(id = 2, value = "Handler cannot be null")
    IllegalArgumentException handlerCannotBeNull();

    @Message(id = 3, value = "Argument %s cannot be null")
    IllegalArgumentException argumentCannotBeNull(String argument);

    @Message(id = 4, value = "Newline not supported in HttpString %s")
    IllegalArgumentException newlineNotSupportedInHttpString(String value);

    @Message(id = 5, value = "Invalid URI template %s, segment '%s' contains more than one variable")
    IllegalArgumentException multipleVariablesInTemplateSegment(String template, String segment);

    @Message(id = 6, value = "Invalid URI template %s, segment '%s' is not a valid variable expression")
    IllegalArgumentException malformedTemplateExpression(String template, String segment);

    @Message(id = 7, value = "Invalid URI template %s, variable %s is used more than once")
    IllegalArgumentException duplicateTemplateVariable(String template, String variable);

    @Message(id = 8, value = "Invalid pattern %s for URI template %s")
    IllegalArgumentException invalidTemplatePattern(String pattern, String template, @Cause PatternSyntaxException cause);

    @Message(id = 9, value = "Invalid regular expression route %s")
    IllegalArgumentException invalidRegexRoute(String target, @Cause PatternSyntaxException cause);

    @Message(id = 10, value = "Unsupported modifier '%s' in regular expression route %s")
    IllegalArgumentException unsupportedRegexModifier(char modifier, String target);

    @Message(id = 11, value = "Invalid HTTP method '%s' in method list '%s'")
    IllegalArgumentException invalidHttpMethod(String method, String methods);

    @Message(id = 12, value = "HTTP method %s is listed more than once in '%s'")
    IllegalArgumentException duplicateHttpMethod(String method, String methods);

    @Message(id = 13, value = "Invalid status code %s")
    IllegalArgumentException invalidStatusCode(int statusCode);

    @Message(id = 14, value = "Class %s is neither an HttpHandler nor a Middleware")
    IllegalArgumentException notAHandlerClass(String className);

    @Message(id = 15, value = "Class %s does not have a public no-argument constructor")
    IllegalArgumentException noDefaultConstructor(String className);

    @Message(id = 16, value = "Could not instantiate handler %s")
    IllegalStateException couldNotInstantiateHandler(String className, @Cause Throwable cause);

    @Message(id = 17, value = "Supplier for late bound handler returned %s, which is neither an HttpHandler nor a Middleware")
    IllegalStateException notAHandlerInstance(Object instance);

    @Message(id = 18, value = "Invalid character in HttpString %s, only Latin-1 is supported")
    IllegalArgumentException invalidHttpStringCharacter(String value);
}
