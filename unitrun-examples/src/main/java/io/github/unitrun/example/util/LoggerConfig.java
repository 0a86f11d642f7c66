/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.unitrun.example.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import io.github.unitrun.status.sinks.OutputMode;
import io.github.unitrun.status.sinks.ReporterAppender;
import org.slf4j.LoggerFactory;

/**
 * Centralized logging configuration for the command line runner.
 * Every logger, including java.util.logging loggers of the code under test, is routed through a
 * single {@link ReporterAppender} so that log output is drawn by the active reporter and never
 * tears the status line.
 */
public class LoggerConfig {

    private static final ThreadLocal<Boolean> configuring = ThreadLocal.withInitial(() -> false);

    /**
     * Configure logging for the given output mode.
     * This should be called before the first suite runs.
     *
     * @param outputMode the resolved output mode
     */
    public static void configure(OutputMode outputMode) {
        // Prevent infinite recursion
        if (configuring.get()) {
            return;
        }
        configuring.set(true);

        try {
            installJulBridge();

            LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();

            // Stop the context to prevent any logging during reconfiguration, then drop all appenders
            loggerContext.stop();
            loggerContext.reset();

            ReporterAppender appender = new ReporterAppender();
            appender.setContext(loggerContext);
            appender.setName("REPORTER");
            appender.start();

            Logger rootLogger = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
            rootLogger.setLevel(levelFor(outputMode));
            rootLogger.addAppender(appender);

            // Force all existing loggers to inherit from root
            for (Logger logger : loggerContext.getLoggerList()) {
                if (logger != rootLogger) {
                    logger.detachAndStopAllAppenders();
                    logger.setLevel(null);
                    logger.setAdditive(true);
                }
            }

            loggerContext.start();
        } finally {
            configuring.set(false);
        }
    }

    /**
     * The reporter filters again by verbosity; this only keeps debug events from being built
     * when nothing would show them.
     */
    static Level levelFor(OutputMode outputMode) {
        switch (outputMode) {
            case VERBOSE:
                return Level.DEBUG;
            case QUIET:
                return Level.WARN;
            case COMPACT:
            default:
                return Level.INFO;
        }
    }

    private static void installJulBridge() {
        try {
            // Remove existing JUL handlers
            java.util.logging.LogManager.getLogManager().reset();
            org.slf4j.bridge.SLF4JBridgeHandler.removeHandlersForRootLogger();
            org.slf4j.bridge.SLF4JBridgeHandler.install();
            java.util.logging.Logger.getLogger("").setLevel(java.util.logging.Level.FINE);
        } catch (Exception e) {
            // If jul-to-slf4j is not usable, continue without it
            System.err.println("[LoggerConfig] Warning: Could not install JUL to SLF4J bridge: " + e.getMessage());
        }
    }
}
