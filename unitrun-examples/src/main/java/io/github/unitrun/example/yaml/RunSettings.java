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

package io.github.unitrun.example.yaml;

import io.github.unitrun.status.sinks.OutputMode;
import org.yaml.snakeyaml.Yaml;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Run settings loaded from a yaml file, for example:
 * <pre>
 * mode: verbose
 * color: false
 * statusCapacity: 120
 * suites:
 *   - arithmetic
 *   - temp files
 * </pre>
 *
 * {@code mode} is one of {@code verbose}, {@code compact} or {@code quiet}; the {@code verbose} and
 * {@code quiet} booleans are accepted as well. Flags given on the command line take precedence
 * over the file.
 */
public class RunSettings {
    /** null means decided by {@link #verbose} and {@link #quiet}. */
    public String mode;

    public boolean verbose;
    public boolean quiet;

    /** null means detect from the terminal. */
    public Boolean color;

    /** null means the reporter's default. */
    public Integer statusCapacity;

    /** Suites to run, in registration order; null or empty means all. */
    public List<String> suites;

    /**
     * The output mode these settings ask for; quiet wins over verbose.
     */
    public OutputMode outputMode() {
        if (mode != null) {
            OutputMode named = OutputMode.fromString(mode);
            return OutputMode.resolve(verbose || named == OutputMode.VERBOSE, quiet || named == OutputMode.QUIET);
        }
        return OutputMode.resolve(verbose, quiet);
    }

    public static RunSettings load(Path configFile) throws FileNotFoundException {
        if (!Files.exists(configFile)) {
            throw new FileNotFoundException(configFile.toAbsolutePath().toString());
        }
        try (InputStream inputStream = Files.newInputStream(configFile)) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + configFile, e);
        }
    }

    public static RunSettings parse(InputStream inputStream) {
        Yaml yaml = new Yaml();
        RunSettings settings = yaml.loadAs(inputStream, RunSettings.class);
        // an empty document loads as null
        return settings != null ? settings : new RunSettings();
    }
}
