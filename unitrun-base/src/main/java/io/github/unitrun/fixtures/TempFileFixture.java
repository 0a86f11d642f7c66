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

import io.github.unitrun.exceptions.FixtureException;
import io.github.unitrun.runner.Fixture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Gives every test of a suite a fresh, empty temporary file open for reading and writing.
 * <pre>{@code
 * runner.runSuite("journal", r -> {
 *     TempFileFixture temp = new TempFileFixture();
 *     r.useFixture(temp);
 *     r.runTest("appends", () -> {
 *         Journal journal = new Journal(temp.channel());
 *         ...
 *     });
 * });
 * }</pre>
 * A file that cannot be created is fatal for the run ({@link FixtureException}). Teardown always
 * deletes the file, even if closing it fails.
 */
public class TempFileFixture implements Fixture {
    private static final Logger logger = LoggerFactory.getLogger(TempFileFixture.class);

    private final Path directory;
    private Path path;
    private FileChannel channel;

    /**
     * Creates temp files in the default temporary-file directory.
     */
    public TempFileFixture() {
        this(null);
    }

    /**
     * @param directory where to create temp files, or null for the default location
     */
    public TempFileFixture(Path directory) {
        this.directory = directory;
    }

    @Override
    public void setUp() {
        try {
            path = directory == null
                    ? Files.createTempFile("unitrun", ".tmp")
                    : Files.createTempFile(directory, "unitrun", ".tmp");
        } catch (IOException e) {
            logger.error("can't create test file: {}", e.getMessage());
            throw new FixtureException("can't create test file", e);
        }

        try {
            channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
            // make sure it works
            channel.position(0);
            if (channel.position() != 0) {
                throw new IOException("channel is not at the start of " + path);
            }
        } catch (IOException e) {
            logger.error("can't seek in test file: {}", e.getMessage());
            FixtureException fatal = new FixtureException("can't seek in test file " + path, e);
            try {
                release();
            } catch (UncheckedIOException suppressed) {
                fatal.addSuppressed(suppressed);
            }
            throw fatal;
        }
    }

    @Override
    public void tearDown() {
        if (channel == null || path == null) {
            throw new IllegalStateException("tearDown without a successful setUp");
        }
        release();
    }

    /**
     * @throws IllegalStateException outside a test
     */
    public FileChannel channel() {
        if (channel == null) {
            throw new IllegalStateException("no temp file is open");
        }
        return channel;
    }

    /**
     * @throws IllegalStateException outside a test
     */
    public Path path() {
        if (path == null) {
            throw new IllegalStateException("no temp file is open");
        }
        return path;
    }

    public boolean isOpen() {
        return channel != null;
    }

    private void release() {
        IOException failure = null;
        try {
            if (channel != null) {
                channel.close();
            }
        } catch (IOException e) {
            failure = e;
        } finally {
            channel = null;
        }

        try {
            if (path != null) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        } finally {
            path = null;
        }

        if (failure != null) {
            throw new UncheckedIOException("can't release test file", failure);
        }
    }
}
