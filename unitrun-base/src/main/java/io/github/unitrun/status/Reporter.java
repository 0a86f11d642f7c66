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

package io.github.unitrun.status;

import io.github.unitrun.ledger.Location;
import io.github.unitrun.runner.ExecutionContext;
import org.slf4j.event.Level;

/**
 * Renders the progress of a run. The runner calls these methods in lifecycle order; a reporter
 * reads suite and test names from the {@link ExecutionContext} it was created with, so it can
 * redraw the current header at any time, including after an interleaved log message.
 *
 * @see io.github.unitrun.status.sinks.ConsoleReporter
 * @see io.github.unitrun.status.sinks.QuietReporter
 */
public interface Reporter {

    /**
     * Draws the header of the current suite. Compact reporters redraw it in place so the status
     * line grows on one console line.
     */
    void suiteHeader();

    /**
     * Draws the header of the current test. Only meaningful in verbose mode.
     */
    void testHeader();

    /**
     * Reports an assertion that counted. Failures are always shown, whatever the verbosity.
     *
     * @param condition the value the assertion evaluated to
     * @param description what was asserted
     * @param location where it was asserted
     */
    void reportAssertion(boolean condition, String description, Location location);

    void reportTestOutcome(boolean passed);

    void reportSuiteOutcome(boolean passed);

    void resetStatusLine();

    /**
     * Interleaves a message emitted through the logging framework with the progress output.
     */
    void logMessage(Level level, String loggerName, String message);

    /**
     * Prints the final tally of the run.
     */
    void reportSummary(int passed, int total);

    /**
     * @return true if the reporter renders per-assertion progress and test headers
     */
    boolean isVerbose();
}
