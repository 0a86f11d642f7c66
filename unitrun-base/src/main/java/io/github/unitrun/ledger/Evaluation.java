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

/**
 * What recording one assertion did to the {@link AssertionLedger}, and therefore what the caller
 * must do with the {@link RunCounters} and the reporter.
 *
 * <ul>
 *   <li>{@link #FIRST_PASS}: first evaluation at the location, condition held</li>
 *   <li>{@link #FIRST_FAILURE}: first evaluation at the location, condition failed</li>
 *   <li>{@link #REGRESSION}: the location passed earlier in this test and has now failed</li>
 *   <li>{@link #SUPPRESSED}: already tallied; nothing to count or report</li>
 * </ul>
 *
 * A regression is counted as a failure but not added to the total again, since the location was
 * already tallied when it first passed.
 */
public enum Evaluation {
    FIRST_PASS(true, false, true),
    FIRST_FAILURE(true, true, true),
    REGRESSION(true, true, false),
    SUPPRESSED(false, false, false);

    private final boolean shouldCount;
    private final boolean newFailure;
    private final boolean countsTowardTotal;

    Evaluation(boolean shouldCount, boolean newFailure, boolean countsTowardTotal) {
        this.shouldCount = shouldCount;
        this.newFailure = newFailure;
        this.countsTowardTotal = countsTowardTotal;
    }

    /**
     * @return true if this evaluation changes the counters and must be reported
     */
    public boolean shouldCount() {
        return shouldCount;
    }

    /**
     * @return true if this evaluation adds one to the failed count
     */
    public boolean isNewFailure() {
        return newFailure;
    }

    /**
     * @return true if this evaluation adds one to the total count
     */
    public boolean countsTowardTotal() {
        return countsTowardTotal;
    }
}
