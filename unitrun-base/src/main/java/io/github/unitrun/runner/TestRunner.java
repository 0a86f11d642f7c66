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

import io.github.unitrun.exceptions.FixtureException;
import io.github.unitrun.ledger.AssertionLedger;
import io.github.unitrun.ledger.Evaluation;
import io.github.unitrun.ledger.Location;
import io.github.unitrun.ledger.RunCounters;
import io.github.unitrun.status.Reporter;
import io.github.unitrun.status.sinks.ConsoleReporter;
import io.github.unitrun.status.sinks.OutputMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs suites and tests, one at a time, and keeps the books on their assertions.
 *
 * <h2>Suite lifecycle</h2>
 * <ol>
 *   <li>snapshot the failed count, reset the status line, enter the suite, draw its header</li>
 *   <li>invoke the suite function, which registers setup/teardown and runs tests</li>
 *   <li>leave the suite, dropping its setup/teardown</li>
 *   <li>report PASS if no assertion failed while the suite ran</li>
 * </ol>
 *
 * <h2>Test lifecycle</h2>
 * <ol>
 *   <li>snapshot the failed count, clear the {@link AssertionLedger}, run setup</li>
 *   <li>log and clear the {@link ErrorIndicator} if setup left it raised</li>
 *   <li>run the test body; it passes if it returns {@link Verdict#DONE} and no assertion failed</li>
 *   <li>report the outcome, log and clear the indicator, run teardown, log and clear it again;
 *       this also happens when the body escapes with an {@link Error} or a {@link FixtureException},
 *       which is rethrown afterwards</li>
 * </ol>
 *
 * <h2>Assertions</h2>
 * <p>All assertion methods return the asserted condition, so test bodies can bail out early:</p>
 * <pre>{@code
 * runner.runSuite("parser", r -> {
 *     r.runTest("parses empty input", () -> {
 *         Document doc = Parser.parse("");
 *         if (!r.assertThat(doc != null, "doc != null", Location.here())) {
 *             return Verdict.FAIL;
 *         }
 *         r.assertEquals(Location.here(), "doc.size()", doc.size(), "0", 0);
 *         return Verdict.DONE;
 *     });
 * });
 * }</pre>
 *
 * <p>Not threadsafe. All state, counters included, belongs to this instance and must be used from
 * one thread.</p>
 */
public class TestRunner {
    private static final Logger logger = LoggerFactory.getLogger(TestRunner.class);

    private final ExecutionContext context;
    private final Reporter reporter;
    private final AssertionLedger ledger = new AssertionLedger();
    private final RunCounters counters = new RunCounters();
    private final ErrorIndicator errorIndicator = new ErrorIndicator();
    private boolean lastAssertionResult;

    /**
     * @param context the context the reporter reads headers from
     * @param reporter the reporter rendering this run
     */
    public TestRunner(ExecutionContext context, Reporter reporter) {
        this.context = Objects.requireNonNull(context, "context");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    /**
     * Creates a runner whose reporter is produced by {@code reporterFactory} from the runner's
     * own context.
     */
    public static TestRunner create(Function<ExecutionContext, Reporter> reporterFactory) {
        ExecutionContext context = new ExecutionContext();
        return new TestRunner(context, reporterFactory.apply(context));
    }

    /**
     * Creates a runner rendering in {@code mode} with the given console settings.
     */
    public static TestRunner create(OutputMode mode, ConsoleReporter.Builder builder) {
        return create(context -> mode.createReporter(context, builder));
    }

    public void runSuite(String title, SuiteFunction suite) {
        Objects.requireNonNull(suite, "suite");
        int previousFailures = counters.failed();

        reporter.resetStatusLine();
        context.enterSuite(title);
        reporter.suiteHeader();

        try {
            suite.run(this);
        } finally {
            context.exitSuite();
        }

        reporter.reportSuiteOutcome(counters.failed() == previousFailures);
    }

    public void runTest(String title, TestFunction test) {
        Objects.requireNonNull(test, "test");
        if (!context.inSuite()) {
            throw new IllegalStateException("test '" + title + "' must run inside a suite");
        }
        // checked before anything touches the ledger or the fixture of the running test
        if (context.inTest()) {
            throw new IllegalStateException("test '" + context.test() + "' is still running, cannot start '" + title + "'");
        }
        int previousFailures = counters.failed();

        ledger.clear();

        FixtureStep setup = context.setup();
        if (setup != null) {
            runFixtureStep("setup", title, setup);
        }
        clearErrorIndicator("before test", title);

        context.enterTest(title);
        boolean passed = false;
        Throwable pending = null;
        try {
            if (reporter.isVerbose()) {
                reporter.testHeader();
            }
            Verdict verdict = invoke(title, test);
            passed = verdict == Verdict.DONE && counters.failed() == previousFailures;
        } catch (RuntimeException | Error e) {
            pending = e;
            throw e;
        } finally {
            finishTest(title, passed, pending);
        }
    }

    /**
     * Everything after the test body: outcome, indicator checks and teardown. Runs even when the
     * body escapes with an {@link Error} or a {@link FixtureException}; a fatal teardown is then
     * attached to the escaping throwable instead of replacing it.
     */
    private void finishTest(String title, boolean passed, Throwable pending) {
        reporter.reportTestOutcome(passed);

        context.exitTest();
        if (reporter.isVerbose()) {
            reporter.resetStatusLine();
        }
        clearErrorIndicator("left by test", title);

        FixtureStep teardown = context.teardown();
        if (teardown != null) {
            try {
                runFixtureStep("teardown", title, teardown);
            } catch (FixtureException e) {
                if (pending == null) {
                    throw e;
                }
                pending.addSuppressed(e);
            }
        }
        clearErrorIndicator("after test cleanup for", title);
    }

    /**
     * Registers the setup step of the running suite, replacing any previous one.
     */
    public void setSetup(FixtureStep setup) {
        context.setSetup(setup);
    }

    /**
     * Registers the teardown step of the running suite, replacing any previous one.
     */
    public void setTeardown(FixtureStep teardown) {
        context.setTeardown(teardown);
    }

    public void useFixture(Fixture fixture) {
        Objects.requireNonNull(fixture, "fixture");
        context.setSetup(fixture::setUp);
        context.setTeardown(fixture::tearDown);
    }

    /**
     * Records one assertion. A failure is printed the first time it happens at a location, and
     * the location is not counted again until the next test.
     *
     * @return {@code condition}
     */
    public boolean assertThat(boolean condition, String description, Location location) {
        return record(condition, () -> description, location);
    }

    /**
     * {@link #assertThat} with a description built by {@link String#format}. The description is
     * only formatted when the assertion counts.
     */
    public boolean assertFormat(boolean condition, Location location, String format, Object... args) {
        return record(condition, () -> String.format(format, args), location);
    }

    public boolean assertComparison(boolean condition, Comparison comparison, Location location) {
        Objects.requireNonNull(comparison, "comparison");
        return record(condition, comparison::description, location);
    }

    /**
     * Asserts {@code Objects.equals(left, right)}.
     */
    public boolean assertEquals(Location location, String leftExpression, Object left, String rightExpression, Object right) {
        return assertComparison(Objects.equals(left, right),
                Comparison.of(leftExpression, left, Comparison.Operator.EQ, rightExpression, right), location);
    }

    public boolean assertNotEquals(Location location, String leftExpression, Object left, String rightExpression, Object right) {
        return assertComparison(!Objects.equals(left, right),
                Comparison.of(leftExpression, left, Comparison.Operator.NE, rightExpression, right), location);
    }

    /**
     * Asserts {@code left <operator> right} under natural ordering.
     */
    public <T extends Comparable<? super T>> boolean assertCompare(Location location, String leftExpression, T left,
                                                                   Comparison.Operator operator,
                                                                   String rightExpression, T right) {
        return assertComparison(Comparison.evaluate(left, operator, right),
                Comparison.of(leftExpression, left, operator, rightExpression, right), location);
    }

    /**
     * @return the condition passed to the most recent assertion, counted or not
     */
    public boolean lastAssertionResult() {
        return lastAssertionResult;
    }

    public RunCounters counters() {
        return counters;
    }

    public AssertionLedger ledger() {
        return ledger;
    }

    public ErrorIndicator errorIndicator() {
        return errorIndicator;
    }

    public ExecutionContext context() {
        return context;
    }

    public Reporter reporter() {
        return reporter;
    }

    private boolean record(boolean condition, Supplier<String> description, Location location) {
        Objects.requireNonNull(location, "location");
        lastAssertionResult = condition;

        Evaluation evaluation = ledger.record(location, condition);
        if (!evaluation.shouldCount()) {
            return condition;
        }
        counters.apply(evaluation);
        reporter.reportAssertion(condition, description.get(), location);
        return condition;
    }

    private Verdict invoke(String title, TestFunction test) {
        try {
            Verdict verdict = test.run();
            if (verdict == null) {
                logger.warn("test `{}' returned no verdict", title);
                return Verdict.ERROR;
            }
            return verdict;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("test `{}' was interrupted", title, e);
            return Verdict.ERROR;
        } catch (FixtureException e) {
            throw e;
        } catch (Exception e) {
            logger.warn("test `{}' threw {}", title, e.toString(), e);
            return Verdict.ERROR;
        }
    }

    private void runFixtureStep(String phase, String title, FixtureStep step) {
        try {
            step.run();
        } catch (FixtureException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("{} for test `{}' was interrupted", phase, title, e);
        } catch (Exception e) {
            logger.warn("{} for test `{}' failed: {}", phase, title, e.toString(), e);
        }
    }

    private void clearErrorIndicator(String when, String title) {
        if (errorIndicator.isRaised()) {
            logger.debug("clearing error indicator {} `{}' ({}: {})",
                    when, title, errorIndicator.code(), errorIndicator.message());
            errorIndicator.clear();
        }
    }
}
