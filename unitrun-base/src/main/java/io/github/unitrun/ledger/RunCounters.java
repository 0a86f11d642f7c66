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
 * Cumulative assertion counts for one run. Both counts only grow, and {@code failed <= total}
 * holds after every {@link #apply(Evaluation)}.
 */
public class RunCounters {
    private int total;
    private int failed;

    /**
     * Applies the effect of one recorded assertion.
     *
     * @return true if the failed count changed
     */
    public boolean apply(Evaluation evaluation) {
        if (evaluation.countsTowardTotal()) {
            total++;
        }
        if (evaluation.isNewFailure()) {
            failed++;
        }
        assert failed <= total : this;
        return evaluation.isNewFailure();
    }

    public int total() {
        return total;
    }

    public int failed() {
        return failed;
    }

    public int passed() {
        return total - failed;
    }

    @Override
    public String toString() {
        return String.format("RunCounters[total=%d, failed=%d]", total, failed);
    }
}
