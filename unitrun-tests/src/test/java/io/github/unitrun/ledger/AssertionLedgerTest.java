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

package io.github.unitrun.ledger;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

/**
 * Recording rules of {@link AssertionLedger} and the counter invariants they guarantee.
 */
public class AssertionLedgerTest extends RandomizedTest {

    private static final Location L1 = Location.of("L1");
    private static final Location L2 = Location.of("L2");

    @Test
    public void testFirstEvaluationAlwaysCounts() {
        AssertionLedger ledger = new AssertionLedger();

        assertEquals(Evaluation.FIRST_PASS, ledger.record(L1, true));
        assertEquals(Evaluation.FIRST_FAILURE, ledger.record(L2, false));
        assertEquals(Outcome.SUCCESS, ledger.lastOutcome(L1));
        assertEquals(Outcome.FAILURE, ledger.lastOutcome(L2));
        assertEquals(2, ledger.size());
    }

    @Test
    public void testRepeatedPassIsSuppressed() {
        AssertionLedger ledger = new AssertionLedger();
        ledger.record(L1, true);

        assertEquals(Evaluation.SUPPRESSED, ledger.record(L1, true));
        assertEquals(Outcome.SUCCESS, ledger.lastOutcome(L1));
    }

    @Test
    public void testPassThenFailIsRegression() {
        AssertionLedger ledger = new AssertionLedger();
        ledger.record(L1, true);

        Evaluation evaluation = ledger.record(L1, false);
        assertEquals(Evaluation.REGRESSION, evaluation);
        assertTrue(evaluation.shouldCount());
        assertTrue(evaluation.isNewFailure());
        assertFalse(evaluation.countsTowardTotal());
        assertEquals(Outcome.FAILURE, ledger.lastOutcome(L1));
    }

    @Test
    public void testAnythingAfterFailureIsSuppressed() {
        AssertionLedger ledger = new AssertionLedger();
        ledger.record(L1, false);

        assertEquals(Evaluation.SUPPRESSED, ledger.record(L1, false));
        assertEquals(Evaluation.SUPPRESSED, ledger.record(L1, true));
        assertEquals(Outcome.FAILURE, ledger.lastOutcome(L1));

        ledger.record(L2, true);
        ledger.record(L2, false);
        assertEquals(Evaluation.SUPPRESSED, ledger.record(L2, false));
        assertEquals(Evaluation.SUPPRESSED, ledger.record(L2, true));
    }

    @Test
    public void testClearForgetsHistory() {
        AssertionLedger ledger = new AssertionLedger();
        ledger.record(L1, false);
        ledger.clear();

        assertTrue(ledger.isEmpty());
        assertNull(ledger.lastOutcome(L1));
        assertEquals(Evaluation.FIRST_PASS, ledger.record(L1, true));
    }

    @Test
    public void testLocationsAreComparedByValue() {
        AssertionLedger ledger = new AssertionLedger();
        ledger.record(Location.of("Parser.java:12"), true);

        assertEquals(Evaluation.REGRESSION, ledger.record(Location.of("Parser.java:12"), false));
    }

    /**
     * Random sequences of assertions over a few locations, checked against a straightforward
     * model of the rules: within one test, total grows by one per distinct location, failed by one
     * per location that ever evaluated false, and failed never exceeds total.
     */
    @Test
    public void testRandomSequencesKeepCounterInvariants() {
        for (int round = 0; round < 50; round++) {
            AssertionLedger ledger = new AssertionLedger();
            RunCounters counters = new RunCounters();
            int locationCount = randomIntBetween(1, 8);
            int tests = randomIntBetween(1, 5);

            int expectedTotal = 0;
            int expectedFailed = 0;
            for (int test = 0; test < tests; test++) {
                ledger.clear();
                Set<Location> seen = new HashSet<>();
                Map<Location, Boolean> everFailed = new HashMap<>();

                int assertions = randomIntBetween(0, 40);
                for (int i = 0; i < assertions; i++) {
                    Location location = Location.of("L" + randomIntBetween(0, locationCount - 1));
                    boolean condition = randomBoolean();
                    int totalBefore = counters.total();
                    int failedBefore = counters.failed();

                    counters.apply(ledger.record(location, condition));

                    seen.add(location);
                    if (!condition) {
                        everFailed.put(location, true);
                    }
                    assertTrue(counters.failed() <= counters.total());
                    assertTrue(counters.total() >= totalBefore);
                    assertTrue(counters.failed() >= failedBefore);
                }
                expectedTotal += seen.size();
                expectedFailed += everFailed.size();
            }

            assertEquals(expectedTotal, counters.total());
            assertEquals(expectedFailed, counters.failed());
        }
    }

    @Test
    public void testRepeatedTrueAssertionsNeverRecount() {
        AssertionLedger ledger = new AssertionLedger();
        RunCounters counters = new RunCounters();
        boolean firstCondition = randomBoolean();
        counters.apply(ledger.record(L1, firstCondition));
        int total = counters.total();
        int failed = counters.failed();

        int repeats = randomIntBetween(1, 100);
        for (int i = 0; i < repeats; i++) {
            counters.apply(ledger.record(L1, true));
        }

        assertEquals(total, counters.total());
        assertEquals(failed, counters.failed());
    }
}
