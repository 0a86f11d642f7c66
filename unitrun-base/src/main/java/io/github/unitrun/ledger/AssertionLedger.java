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

import java.util.HashMap;
import java.util.Map;

/**
 * Remembers, for every {@link Location} evaluated in the current test, whether its most recent
 * counted evaluation succeeded or failed. This is what keeps an assertion inside a loop from being
 * tallied once per iteration while still surfacing the iteration where it starts failing.
 * <p>
 * Recording rules:
 * <ul>
 *   <li>no record: the evaluation counts, its outcome is stored</li>
 *   <li>SUCCESS then false: a regression, counted as a failure, record becomes FAILURE</li>
 *   <li>SUCCESS then true: suppressed</li>
 *   <li>FAILURE then anything: suppressed, the failure has already been reported</li>
 * </ul>
 * The ledger is cleared at the start of every test, so history never crosses test boundaries.
 * <p>
 * Not threadsafe; owned by a single {@code TestRunner}.
 */
public class AssertionLedger {
    private final Map<Location, Outcome> records = new HashMap<>();

    /**
     * Records the evaluation of the assertion at {@code location}.
     *
     * @param location the call site
     * @param condition the value the assertion evaluated to
     * @return what the caller must count and report
     */
    public Evaluation record(Location location, boolean condition) {
        Outcome last = records.get(location);
        if (last == null) {
            records.put(location, Outcome.of(condition));
            return condition ? Evaluation.FIRST_PASS : Evaluation.FIRST_FAILURE;
        }
        if (last == Outcome.SUCCESS && !condition) {
            records.put(location, Outcome.FAILURE);
            return Evaluation.REGRESSION;
        }
        return Evaluation.SUPPRESSED;
    }

    /**
     * @return the last stored outcome at {@code location}, or null if it has not been evaluated
     *         since the last {@link #clear()}
     */
    public Outcome lastOutcome(Location location) {
        return records.get(location);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public void clear() {
        records.clear();
    }
}
