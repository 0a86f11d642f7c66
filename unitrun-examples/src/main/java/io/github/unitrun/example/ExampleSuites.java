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

package io.github.unitrun.example;

import io.github.unitrun.fixtures.TempFileFixture;
import io.github.unitrun.ledger.Location;
import io.github.unitrun.runner.Comparison;
import io.github.unitrun.runner.SuiteCatalog;
import io.github.unitrun.runner.TestRunner;
import io.github.unitrun.runner.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Suites run by {@code unitrun} when no other registry is given. They exercise each feature of
 * the runner: comparison descriptions, assertions inside loops, a fixture, log output interleaved
 * with progress, and the error indicator.
 */
public final class ExampleSuites {
    private static final Logger logger = LoggerFactory.getLogger(ExampleSuites.class);

    private ExampleSuites() {
    }

    public static SuiteCatalog catalog() {
        return new SuiteCatalog()
                .register("arithmetic", ExampleSuites::arithmetic)
                .register("strings", ExampleSuites::strings)
                .register("loops", ExampleSuites::loops)
                .register("temp files", ExampleSuites::tempFiles)
                .register("diagnostics", ExampleSuites::diagnostics);
    }

    static void arithmetic(TestRunner r) {
        r.runTest("addition", () -> {
            r.assertEquals(Location.here(), "2 + 2", 2 + 2, "4", 4);
            return Verdict.DONE;
        });
        r.runTest("floor division rounds down", () -> {
            r.assertEquals(Location.here(), "Math.floorDiv(-7, 2)", Math.floorDiv(-7, 2), "-4", -4);
            r.assertEquals(Location.here(), "Math.floorMod(-7, 2)", Math.floorMod(-7, 2), "1", 1);
            return Verdict.DONE;
        });
        r.runTest("int overflow wraps", () -> {
            int max = Integer.MAX_VALUE;
            r.assertCompare(Location.here(), "max + 1", max + 1, Comparison.Operator.LT, "max", max);
            return Verdict.DONE;
        });
    }

    static void strings(TestRunner r) {
        r.runTest("join", () -> {
            r.assertEquals(Location.here(), "String.join(\",\", a, b)", String.join(",", "a", "b"), "\"a,b\"", "a,b");
            return Verdict.DONE;
        });
        r.runTest("strip", () -> {
            r.assertEquals(Location.here(), "\" x \".strip()", " x ".strip(), "\"x\"", "x");
            r.assertThat("".isBlank(), "\"\".isBlank()", Location.here());
            return Verdict.DONE;
        });
        r.runTest("format is locale independent", () -> {
            String formatted = String.format(Locale.ROOT, "%.2f", 1.5);
            r.assertEquals(Location.here(), "formatted", formatted, "\"1.50\"", "1.50");
            return Verdict.DONE;
        });
    }

    static void loops(TestRunner r) {
        r.runTest("squares are non-negative", () -> {
            // one location, counted once however many times it runs
            for (int i = -50; i <= 50; i++) {
                r.assertFormat(i * i >= 0, Location.here(), "%d * %d >= 0", i, i);
            }
            return Verdict.DONE;
        });
        r.runTest("stack pops in reverse order", () -> {
            Deque<Integer> stack = new ArrayDeque<>();
            List<Integer> pushed = List.of(1, 2, 3, 4, 5);
            pushed.forEach(stack::push);
            for (int i = pushed.size() - 1; i >= 0; i--) {
                if (!r.assertEquals(Location.here(), "stack.pop()", stack.pop(), "pushed.get(i)", pushed.get(i))) {
                    return Verdict.FAIL;
                }
            }
            r.assertThat(stack.isEmpty(), "stack.isEmpty()", Location.here());
            return Verdict.DONE;
        });
    }

    static void tempFiles(TestRunner r) {
        TempFileFixture temp = new TempFileFixture();
        r.useFixture(temp);

        r.runTest("starts empty", () -> {
            r.assertEquals(Location.here(), "temp.channel().size()", temp.channel().size(), "0L", 0L);
            return Verdict.DONE;
        });
        r.runTest("reads back what was written", () -> {
            FileChannel channel = temp.channel();
            byte[] payload = "unitrun".getBytes(StandardCharsets.UTF_8);
            channel.write(ByteBuffer.wrap(payload));
            channel.position(0);

            ByteBuffer read = ByteBuffer.allocate(payload.length);
            while (read.hasRemaining() && channel.read(read) >= 0) {
                // keep reading
            }
            r.assertEquals(Location.here(), "new String(read)", new String(read.array(), StandardCharsets.UTF_8), "\"unitrun\"", "unitrun");
            return Verdict.DONE;
        });
    }

    static void diagnostics(TestRunner r) {
        r.runTest("warnings are drawn between progress", () -> {
            logger.warn("cache miss for key {}", "user_123");
            r.assertThat(true, "logging does not disturb assertions", Location.here());
            return Verdict.DONE;
        });
        r.runTest("raises the error indicator", () -> {
            r.errorIndicator().raise(5, "simulated I/O error");
            return Verdict.DONE;
        });
        r.runTest("error indicator starts clear", () -> {
            r.assertThat(!r.errorIndicator().isRaised(), "!errorIndicator.isRaised()", Location.here());
            return Verdict.DONE;
        });
    }
}
