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

/**
 * One character of progress on the {@link StatusLine}.
 */
public enum Glyph {
    /** A passing assertion (verbose) or a passing test (compact). */
    PASS('.'),
    /** A failed assertion, verbose mode only. */
    FAIL('F'),
    /** A failed test, compact mode only. */
    ERROR('E');

    private final char symbol;

    Glyph(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }
}
