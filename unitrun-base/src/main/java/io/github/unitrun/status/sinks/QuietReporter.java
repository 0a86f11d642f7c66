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

import io.github.unitrun.ledger.Location;
import io.github.unitrun.status.Reporter;
import org.slf4j.event.Level;

/**
 * Reporter for {@code --quiet}: prints nothing and swallows routed log messages. Failures are
 * still counted by the runner, so the exit code is unaffected.
 */
public final class QuietReporter implements Reporter {
    private static final QuietReporter INSTANCE = new QuietReporter();

    private QuietReporter() {
    }

    public static QuietReporter getInstance() {
        return INSTANCE;
    }

    @Override
    public void suiteHeader() {
    }

    @Override
    public void testHeader() {
    }

    @Override
    public void reportAssertion(boolean condition, String description, Location location) {
    }

    @Override
    public void reportTestOutcome(boolean passed) {
    }

    @Override
    public void reportSuiteOutcome(boolean passed) {
    }

    @Override
    public void resetStatusLine() {
    }

    @Override
    public void logMessage(Level level, String loggerName, String message) {
    }

    @Override
    public void reportSummary(int passed, int total) {
    }

    @Override
    public boolean isVerbose() {
        return false;
    }
}
