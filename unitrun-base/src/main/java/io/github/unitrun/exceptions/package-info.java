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

/**
 * Exception types thrown by the runner.
 * <p>
 * {@link io.github.unitrun.exceptions.FixtureException} is the only exception that is allowed to
 * end a run early. Assertion failures never unwind the stack; they are recorded in the
 * {@link io.github.unitrun.ledger.AssertionLedger} and counted in the
 * {@link io.github.unitrun.ledger.RunCounters}. Exceptions thrown by a test body turn its verdict
 * into {@link io.github.unitrun.runner.Verdict#ERROR}, and exceptions thrown by other setup and
 * teardown steps are logged and the run continues.
 *
 * <h2>Exception Handling Example</h2>
 * <pre>{@code
 * try {
 *     exitCode = new TestDriver(runner).run(registry);
 * } catch (FixtureException e) {
 *     logger.error("Aborting run", e);
 *     exitCode = 1;
 * }
 * }</pre>
 */
package io.github.unitrun.exceptions;
