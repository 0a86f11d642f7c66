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

package io.github.unitrun.status.sinks;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.AppenderBase;
import io.github.unitrun.status.Reporter;
import org.slf4j.event.Level;

import java.util.ArrayDeque;
import java.util.Queue;

/**
 * Logback appender that hands every log event to the active {@link Reporter}, so that log output
 * from code under test is interleaved with the status line instead of corrupting it, and is
 * discarded entirely in quiet mode.
 * <p>
 * Events logged while no reporter is active are buffered and delivered to the next reporter
 * that is activated.
 */
public class ReporterAppender extends AppenderBase<ILoggingEvent> {

    private static final int MAX_BUFFER_SIZE = 1000; // Limit buffer size to prevent memory issues

    private static volatile Reporter activeReporter;
    private static final Queue<BufferedEvent> bufferedEvents = new ArrayDeque<>();

    /**
     * Register the reporter that receives log messages, flushing anything buffered to it
     */
    public static void setActiveReporter(Reporter reporter) {
        activeReporter = reporter;
        if (reporter != null) {
            synchronized (bufferedEvents) {
                BufferedEvent event;
                while ((event = bufferedEvents.poll()) != null) {
                    reporter.logMessage(event.level, event.loggerName, event.message);
                }
            }
        }
    }

    public static void clearActiveReporter() {
        activeReporter = null;
    }

    public static Reporter getActiveReporter() {
        return activeReporter;
    }

    /**
     * Drops buffered events without delivering them.
     */
    public static void discardBuffered() {
        synchronized (bufferedEvents) {
            bufferedEvents.clear();
        }
    }

    @Override
    protected void append(ILoggingEvent event) {
        // Simplify logger name (take last component)
        String loggerName = event.getLoggerName();
        int lastDot = loggerName.lastIndexOf('.');
        if (lastDot >= 0 && lastDot < loggerName.length() - 1) {
            loggerName = loggerName.substring(lastDot + 1);
        }

        String message = event.getFormattedMessage();
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            message += "\n" + throwable.getClassName() + ": " + throwable.getMessage();
        }

        Level level = Level.valueOf(event.getLevel().toString());

        Reporter reporter = activeReporter;
        if (reporter != null) {
            reporter.logMessage(level, loggerName, message);
        } else {
            synchronized (bufferedEvents) {
                if (bufferedEvents.size() < MAX_BUFFER_SIZE) {
                    bufferedEvents.offer(new BufferedEvent(level, loggerName, message));
                }
            }
        }
    }

    private static final class BufferedEvent {
        final Level level;
        final String loggerName;
        final String message;

        BufferedEvent(Level level, String loggerName, String message) {
            this.level = level;
            this.loggerName = loggerName;
            this.message = message;
        }
    }
}
