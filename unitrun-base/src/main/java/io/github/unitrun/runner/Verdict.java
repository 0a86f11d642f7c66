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

/**
 * What a test function reports about its own run. Only {@link #DONE} can pass, and only if no
 * assertion failed while the test ran.
 */
public enum Verdict {
    /** Ran to completion. */
    DONE,
    /** Gave up on an explicit failure. */
    FAIL,
    /** Hit something unexpected. */
    ERROR
}
