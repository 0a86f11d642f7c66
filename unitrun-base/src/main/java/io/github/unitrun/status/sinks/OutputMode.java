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

import io.github.unitrun.runner.ExecutionContext;
import io.github.unitrun.status.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Output modes for run progress
 */
public enum OutputMode {
    /**
     * Suite banners, one line per test, a glyph per assertion
     */
    VERBOSE("verbose"),

    /**
     * One in-place line per suite with a glyph per test
     */
    COMPACT("compact"),

    /**
     * No output at all, log messages included
     */
    QUIET("quiet");

    private static final Logger logger = LoggerFactory.getLogger(OutputMode.class);

    private final String name;

    OutputMode(String name) {
        this.name = name;
    }

    /**
     * Quiet wins over verbose.
     */
    public static OutputMode resolve(boolean verbose, boolean quiet) {
        if (quiet) {
            return QUIET;
        }
        return verbose ? VERBOSE : COMPACT;
    }

    /**
     * Parses a mode name as written in configuration files, case-insensitively. Null or an
     * unknown name gives {@link #COMPACT}.
     */
    public static OutputMode fromString(String value) {
        if (value == null) {
            return COMPACT;
        }

        String lower = value.toLowerCase().trim();
        for (OutputMode mode : values()) {
            if (mode.name.equals(lower)) {
                return mode;
            }
        }

        logger.warn("Unknown output mode: {}. Using {}.", value, COMPACT.name);
        return COMPACT;
    }

    /**
     * Creates the reporter for this mode. The builder's verbosity is overridden by the mode.
     */
    public Reporter createReporter(ExecutionContext context, ConsoleReporter.Builder builder) {
        if (this == QUIET) {
            return QuietReporter.getInstance();
        }
        return builder.withVerbose(this == VERBOSE).build(context);
    }

    /**
     * Detect whether ANSI colours are likely to render
     */
    public static boolean detectColor() {
        String term = System.getenv("TERM");

        // If TERM is not set or is "dumb", use plain text
        if (term == null || term.equals("dumb")) {
            return false;
        }

        // System.console() returns null when output is piped
        return System.console() != null;
    }
}
