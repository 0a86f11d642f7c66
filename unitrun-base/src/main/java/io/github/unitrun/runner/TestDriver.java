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

package io.github.unitrun.runner;

import io.github.unitrun.ledger.RunCounters;
import io.github.unitrun.status.sinks.ReporterAppender;

import java.util.Objects;

/**
 * Top level of a run: routes log output to the runner's reporter, runs every suite of a
 * registry, prints the tally and returns the number of failed assertions, which callers use as
 * the process exit status (0 means everything passed).
 */
public class TestDriver {
    private final TestRunner runner;

    public TestDriver(TestRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    public int run(SuiteRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        runner.ledger().clear();
        ReporterAppender.setActiveReporter(runner.reporter());
        try {
            registry.runSuites(runner);
        } finally {
            ReporterAppender.clearActiveReporter();
            runner.ledger().clear();
        }

        RunCounters counters = runner.counters();
        runner.reporter().reportSummary(counters.passed(), counters.total());
        return counters.failed();
    }
}
