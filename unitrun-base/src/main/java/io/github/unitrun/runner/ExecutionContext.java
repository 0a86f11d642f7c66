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
 * What is running right now: the current suite, the current test within it, and the
 * setup/teardown pair the suite registered. At most one suite, and within it at most one test,
 * is active at a time.
 * <p>
 * Written by the {@code TestRunner}; read by reporters when drawing headers.
 */
public class ExecutionContext {
    private String suite;
    private String test;
    private FixtureStep setup;
    private FixtureStep teardown;

    public void enterSuite(String title) {
        if (suite != null) {
            throw new IllegalStateException("suite '" + suite + "' is still running, cannot start '" + title + "'");
        }
        suite = title;
        setup = null;
        teardown = null;
    }

    public void exitSuite() {
        suite = null;
        test = null;
        setup = null;
        teardown = null;
    }

    public void enterTest(String title) {
        if (suite == null) {
            throw new IllegalStateException("test '" + title + "' must run inside a suite");
        }
        if (test != null) {
            throw new IllegalStateException("test '" + test + "' is still running, cannot start '" + title + "'");
        }
        test = title;
    }

    public void exitTest() {
        test = null;
    }

    public String suite() {
        return suite;
    }

    /**
     * @return the current test, or null between tests
     */
    public String test() {
        return test;
    }

    public boolean inSuite() {
        return suite != null;
    }

    public boolean inTest() {
        return test != null;
    }

    public FixtureStep setup() {
        return setup;
    }

    public FixtureStep teardown() {
        return teardown;
    }

    public void setSetup(FixtureStep setup) {
        requireSuite("setup");
        this.setup = setup;
    }

    public void setTeardown(FixtureStep teardown) {
        requireSuite("teardown");
        this.teardown = teardown;
    }

    private void requireSuite(String what) {
        if (suite == null) {
            throw new IllegalStateException(what + " can only be registered while a suite is running");
        }
    }

    @Override
    public String toString() {
        return String.format("ExecutionContext[suite=%s, test=%s]", suite, test);
    }
}
