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
 * A matched setup/teardown pair, registered with {@link TestRunner#useFixture(Fixture)}.
 * {@link #tearDown()} runs after every test whose {@link #setUp()} ran, whatever the test's
 * outcome.
 */
public interface Fixture {
    void setUp() throws Exception;

    void tearDown() throws Exception;
}
