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

package io.github.unitrun.fixtures;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import io.github.unitrun.ConsoleCapture;
import io.github.unitrun.exceptions.FixtureException;
import io.github.unitrun.ledger.Location;
import io.github.unitrun.runner.TestRunner;
import io.github.unitrun.runner.Verdict;
import io.github.unitrun.status.sinks.OutputMode;
import io.github.unitrun.status.sinks.ReporterAppender;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class TempFileFixtureTest extends RandomizedTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @After
    public void tearDown() {
        ReporterAppender.discardBuffered();
    }

    @Test
    public void testSetUpAndTearDown() throws Exception {
        Path dir = folder.getRoot().toPath();
        TempFileFixture fixture = new TempFileFixture(dir);
        assertFalse(fixture.isOpen());

        fixture.setUp();
        Path path = fixture.path();
        assertTrue(fixture.isOpen());
        assertTrue(Files.exists(path));
        assertEquals(dir, path.getParent());
        assertEquals(0, fixture.channel().position());
        assertEquals(0, fixture.channel().size());

        fixture.tearDown();
        assertFalse(fixture.isOpen());
        assertFalse(Files.exists(path));
        assertThrows(IllegalStateException.class, fixture::path);
        assertThrows(IllegalStateException.class, fixture::channel);
    }

    @Test
    public void testTearDownWithoutSetUp() {
        assertThrows(IllegalStateException.class, () -> new TempFileFixture(folder.getRoot().toPath()).tearDown());
    }

    @Test
    public void testMissingDirectoryIsFatal() {
        Path missing = folder.getRoot().toPath().resolve("does-not-exist");
        TempFileFixture fixture = new TempFileFixture(missing);

        FixtureException e = assertThrows(FixtureException.class, fixture::setUp);
        assertNotNull(e.getCause());
        assertFalse(fixture.isOpen());
    }

    @Test
    public void testTearDownDeletesFileAlreadyClosedByTest() throws Exception {
        TempFileFixture fixture = new TempFileFixture(folder.getRoot().toPath());
        fixture.setUp();
        Path path = fixture.path();
        fixture.channel().close();

        fixture.tearDown();
        assertFalse(Files.exists(path));
    }

    @Test
    public void testEachTestGetsFreshFile() {
        TempFileFixture fixture = new TempFileFixture(folder.getRoot().toPath());
        List<Path> paths = new ArrayList<>();
        TestRunner runner = new ConsoleCapture().runner(OutputMode.QUIET);
        int tests = randomIntBetween(2, 5);

        runner.runSuite("temp", r -> {
            r.useFixture(fixture);
            for (int i = 0; i < tests; i++) {
                int index = i;
                r.runTest("writes " + i, () -> {
                    paths.add(fixture.path());
                    r.assertEquals(Location.of("empty"), "size", fixture.channel().size(), "0L", 0L);
                    fixture.channel().write(ByteBuffer.wrap("data".getBytes(StandardCharsets.UTF_8)));
                    return index % 2 == 0 ? Verdict.DONE : Verdict.ERROR;
                });
            }
        });

        assertEquals(tests, paths.size());
        assertEquals(tests, paths.stream().distinct().count());
        for (Path path : paths) {
            assertFalse(Files.exists(path));
        }
        assertEquals(0, runner.counters().failed());
        assertFalse(fixture.isOpen());
    }
}
