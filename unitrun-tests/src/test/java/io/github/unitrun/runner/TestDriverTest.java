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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import io.github.unitrun.ConsoleCapture;
import io.github.unitrun.ledger.Location;
import io.github.unitrun.status.sinks.OutputMode;
import io.github.unitrun.status.sinks.ReporterAppender;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.Assert.*;

/**
 * Whole runs through {@link TestDriver}, with log routing active. Relies on logback-test.xml
 * sending every logger to {@link ReporterAppender} at DEBUG.
 */
public class TestDriverTest extends RandomizedTest {
    private static final Logger logger = LoggerFactory.getLogger(TestDriverTest.class);

    private ConsoleCapture capture;

    @Before
    public void setUp() {
        ReporterAppender.clearActiveReporter();
        ReporterAppender.discardBuffered();
        capture = new ConsoleCapture();
    }

    @After
    public void tearDown() {
        ReporterAppender.clearActiveReporter();
        ReporterAppender.discardBuffered();
    }

    @Test
    public void testPassingRunReturnsZero() {
        TestRunner runner = capture.runner(OutputMode.COMPACT);
        SuiteCatalog catalog = new SuiteCatalog()
                .register("s", r -> r.runTest("t", () -> {
                    r.assertThat(true, "d", Location.of("L1"));
                    return Verdict.DONE;
                }));

        int failed = new TestDriver(runner).run(catalog);

        assertEquals(0, failed);
        assertTrue(capture.text().endsWith(" PASS\r[PASS]\nAssertions passed: 1/1\n"));
    }

    @Test
    public void testReturnsFailureCount() {
        int failures = randomIntBetween(1, 20);
        TestRunner runner = capture.runner(OutputMode.COMPACT);
        SuiteCatalog catalog = new SuiteCatalog()
                .register("s", r -> r.runTest("t", () -> {
                    for (int i = 0; i < failures; i++) {
                        r.assertThat(false, "d" + i, Location.of("L" + i));
                    }
                    r.assertThat(true, "ok", Location.of("ok"));
                    return Verdict.DONE;
                }));

        assertEquals(failures, new TestDriver(runner).run(catalog));
        assertTrue(capture.text().endsWith("Assertions passed: 1/" + (failures + 1) + "\n"));
    }

    @Test
    public void testLogRoutingIsActiveOnlyDuringRun() {
        TestRunner runner = capture.runner(OutputMode.COMPACT);
        SuiteCatalog catalog = new SuiteCatalog()
                .register("s", r -> r.runTest("t", () -> {
                    assertSame(runner.reporter(), ReporterAppender.getActiveReporter());
                    logger.warn("disk almost full");
                    logger.info("not shown in compact mode");
                    return Verdict.DONE;
                }));

        new TestDriver(runner).run(catalog);

        assertNull(ReporterAppender.getActiveReporter());
        String text = capture.text();
        assertTrue(text.contains("\r[----]\n[WARN ] TestDriverTest - disk almost full\n" + ConsoleCapture.compactHeader("s")));
        assertFalse(text.contains("not shown"));
        assertTrue(runner.ledger().isEmpty());
    }

    @Test
    public void testVerboseRunShowsErrorIndicatorDiagnostics() {
        TestRunner runner = capture.runner(OutputMode.VERBOSE);
        SuiteCatalog catalog = new SuiteCatalog()
                .register("io", r -> {
                    r.runTest("raiser", () -> {
                        r.errorIndicator().raise(5, "boom");
                        return Verdict.DONE;
                    });
                });

        assertEquals(0, new TestDriver(runner).run(catalog));

        assertTrue(capture.text().contains("[DEBUG] TestRunner - clearing error indicator left by test `raiser' (5: boom)\n"));
    }

    @Test
    public void testQuietRunPrintsNothing() {
        TestRunner runner = capture.runner(OutputMode.QUIET);
        SuiteCatalog catalog = new SuiteCatalog()
                .register("s", r -> r.runTest("t", () -> {
                    logger.error("swallowed");
                    r.assertThat(false, "d", Location.of("L1"));
                    return Verdict.DONE;
                }));

        assertEquals(1, new TestDriver(runner).run(catalog));
        assertEquals("", capture.text());
    }

    @Test
    public void testRoutingIsClearedWhenRunAborts() {
        TestRunner runner = capture.runner(OutputMode.COMPACT);
        SuiteRegistry registry = r -> {
            throw new IllegalStateException("registry broke");
        };

        assertThrows(IllegalStateException.class, () -> new TestDriver(runner).run(registry));
        assertNull(ReporterAppender.getActiveReporter());
    }
}
