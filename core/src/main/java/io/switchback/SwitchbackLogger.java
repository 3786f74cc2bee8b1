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

import static org.jboss.logging.Logger.Level.DEBUG;

import org.jboss.logging.BasicLogger;
import org.jboss.logging.Logger;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

/**
 * log messages start at 5000
 */
@MessageLogger(projectCode = "SWB")
public interface SwitchbackLogger extends BasicLogger {

    SwitchbackLogger ROOT_LOGGER = Logger.getMessageLogger(SwitchbackLogger.class, SwitchbackLogger.class.getPackage().getName());
    SwitchbackLogger REQUEST_LOGGER = Logger.getMessageLogger(SwitchbackLogger.class, SwitchbackLogger.class.getPackage().getName() + ".request");
    SwitchbackLogger ROUTING_LOGGER = Logger.getMessageLogger(SwitchbackLogger.class, SwitchbackLogger.class.getPackage().getName() + ".routing");

    @LogMessage(level = DEBUG)
    @Message(id = 5001, value = "Request for %s raised an HTTP exception, responding with status %s")
    void httpExceptionRaised(String path, int statusCode, @Cause Throwable cause);

    @LogMessage(level = DEBUG)
    @Message(id = 5002, value = "Route %s already had a handler, it has been replaced")
    void routeHandlerReplaced(String target);

    @LogMessage(level = DEBUG)
    @Message(id = 5003, value = "Registered %s route for target %s")
    void routeRegistered(Object kind, String target);

    @LogMessage(level = DEBUG)
    @Message(id = 5004, value = "Instantiated late bound handler %s")
    void lateBoundHandlerInstantiated(String className);
}
