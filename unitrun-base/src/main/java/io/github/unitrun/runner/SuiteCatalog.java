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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered registry of suites by title. Suites run in registration order.
 */
public class SuiteCatalog implements SuiteRegistry {
    private final Map<String, SuiteFunction> suites = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if a suite with this title is already registered
     */
    public SuiteCatalog register(String title, SuiteFunction suite) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(suite, "suite");
        if (suites.putIfAbsent(title, suite) != null) {
            throw new IllegalArgumentException("Duplicate suite title: " + title);
        }
        return this;
    }

    public List<String> titles() {
        return new ArrayList<>(suites.keySet());
    }

    public int size() {
        return suites.size();
    }

    /**
     * Returns a catalog with only the named suites, kept in registration order.
     *
     * @throws IllegalArgumentException if a title is not registered
     */
    public SuiteCatalog select(Collection<String> titles) {
        for (String title : titles) {
            if (!suites.containsKey(title)) {
                throw new IllegalArgumentException("Unknown suite: " + title + ". Known suites: " + suites.keySet());
            }
        }
        SuiteCatalog selected = new SuiteCatalog();
        suites.forEach((title, suite) -> {
            if (titles.contains(title)) {
                selected.register(title, suite);
            }
        });
        return selected;
    }

    @Override
    public void runSuites(TestRunner runner) {
        suites.forEach(runner::runSuite);
    }

    @Override
    public String toString() {
        return "SuiteCatalog" + suites.keySet();
    }
}
