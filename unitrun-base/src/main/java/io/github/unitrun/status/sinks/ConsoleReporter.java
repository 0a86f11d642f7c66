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

package io.github.unitrun.status.sinks;

import io.github.unitrun.ledger.Location;
import io.github.unitrun.runner.ExecutionContext;
import io.github.unitrun.status.Glyph;
import io.github.unitrun.status.Reporter;
import io.github.unitrun.status.StatusLine;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;
import org.slf4j.event.Level;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Line-oriented console reporter with two verbosity levels.
 *
 * <h2>Compact mode</h2>
 * <p>One line per suite, redrawn in place with a carriage return while the suite runs. Each
 * finished test appends a glyph ({@code .} passed, {@code E} failed); the tag turns into
 * PASS or FAIL when the suite concludes:</p>
 * <pre>
 * [----]                         parser ...E.
 * [FAIL]                         parser ...E. FAIL
 * </pre>
 *
 * <h2>Verbose mode</h2>
 * <p>A banner per suite and one line per test, redrawn in place while its assertions run. Each
 * passing assertion appends {@code .}, each failing one {@code F}:</p>
 * <pre>
 * ====== parser ======
 *  - (PASS)                         parses empty input .... PASS
 *  - (FAIL)                       rejects trailing comma ..F FAIL
 * </pre>
 *
 * <p>Failed assertions are printed as a three line block in both modes, after which the current
 * header is redrawn. When the status line fills up it is flushed with a newline and the header is
 * redrawn, so progress always continues on a single line.</p>
 *
 * <p>Not threadsafe. One instance renders one run on one thread.</p>
 *
 * @see QuietReporter
 * @see OutputMode
 */
public class ConsoleReporter implements Reporter {

    private static final AttributedStyle STYLE_PENDING = AttributedStyle.BOLD.foreground(AttributedStyle.YELLOW);
    private static final AttributedStyle STYLE_PASS = AttributedStyle.BOLD.foreground(AttributedStyle.GREEN);
    private static final AttributedStyle STYLE_FAIL = AttributedStyle.BOLD.foreground(AttributedStyle.RED);
    private static final AttributedStyle STYLE_HEADER = AttributedStyle.BOLD;

    private final ExecutionContext context;
    private final PrintStream output;
    private final boolean verbose;
    private final boolean useColors;
    private final StatusLine statusLine;
    private final int suiteWidth;
    private final int testWidth;

    private ConsoleReporter(Builder builder, ExecutionContext context) {
        this.context = Objects.requireNonNull(context, "context");
        this.output = builder.output;
        this.verbose = builder.verbose;
        this.useColors = builder.useColors;
        this.statusLine = new StatusLine(builder.statusCapacity);
        this.suiteWidth = builder.suiteWidth;
        this.testWidth = builder.testWidth;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void suiteHeader() {
        if (verbose) {
            emit("\r" + styled(STYLE_HEADER, "====== " + context.suite() + " ======") + "\n");
        } else {
            emit("\r[" + styled(STYLE_PENDING, "----") + "] " + pad(context.suite(), suiteWidth) + " " + statusLine);
        }
    }

    @Override
    public void testHeader() {
        emit("\r - (" + styled(STYLE_PENDING, "----") + ") " + pad(context.test(), testWidth) + " " + statusLine);
    }

    @Override
    public void reportAssertion(boolean condition, String description, Location location) {
        if (condition) {
            if (verbose) {
                appendGlyph(Glyph.PASS, true);
            }
            return;
        }

        emit("\rAssertion failed: " + description + "   \n"
                + "\tin suite \"" + context.suite() + "\", test " + context.test() + "\n"
                + "\tat " + location + "\n");
        if (verbose) {
            appendGlyph(Glyph.FAIL, false);
        }
        redrawHeader();
    }

    @Override
    public void reportTestOutcome(boolean passed) {
        if (verbose) {
            if (passed) {
                emit(" PASS\r - (" + styled(STYLE_PASS, "PASS") + ")\n");
            } else {
                emit(" FAIL\r - (" + styled(STYLE_FAIL, "FAIL") + ")\n");
            }
        } else {
            appendGlyph(passed ? Glyph.PASS : Glyph.ERROR, true);
        }
    }

    @Override
    public void reportSuiteOutcome(boolean passed) {
        if (verbose) {
            return;
        }
        if (passed) {
            emit(" PASS\r[" + styled(STYLE_PASS, "PASS") + "]\n");
        } else {
            emit(" FAIL\r[" + styled(STYLE_FAIL, "FAIL") + "]\n");
        }
    }

    @Override
    public void resetStatusLine() {
        statusLine.reset();
    }

    @Override
    public void logMessage(Level level, String loggerName, String message) {
        // compact output only has room for warnings and errors
        if (!verbose && level.toInt() < Level.WARN.toInt()) {
            return;
        }

        boolean anchored = context.inSuite() && (!verbose || context.inTest());
        if (anchored) {
            emit(verbose ? "\r - (" + styled(STYLE_PENDING, "----") + ")\n" : "\r[" + styled(STYLE_PENDING, "----") + "]\n");
        }
        emit(styled(STYLE_PENDING, String.format("[%-5s] %s - %s", level, loggerName, message)) + "\n");
        if (anchored) {
            redrawHeader();
        }
    }

    @Override
    public void reportSummary(int passed, int total) {
        emit("Assertions passed: " + passed + "/" + total + "\n");
    }

    @Override
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * @return the glyphs accumulated since the last reset or flush
     */
    public String statusLine() {
        return statusLine.toString();
    }

    private void appendGlyph(Glyph glyph, boolean echo) {
        if (statusLine.isFull()) {
            emit("\n");
            statusLine.reset();
            redrawHeader();
        }
        statusLine.append(glyph);
        if (echo) {
            emit(String.valueOf(glyph.symbol()));
        }
    }

    private void redrawHeader() {
        if (verbose && context.inTest()) {
            testHeader();
        } else {
            suiteHeader();
        }
    }

    private String styled(AttributedStyle style, String text) {
        return useColors ? new AttributedString(text, style).toAnsi() : text;
    }

    private static String pad(String text, int width) {
        return String.format("%" + width + "s", text);
    }

    private void emit(String text) {
        output.print(text);
        output.flush();
    }

    /**
     * Builder for {@link ConsoleReporter}. Defaults: {@code System.out}, compact, colours when
     * attached to a capable terminal, a status line of {@value StatusLine#DEFAULT_CAPACITY} glyphs.
     */
    public static class Builder {
        private PrintStream output = System.out;
        private boolean verbose = false;
        private boolean useColors = OutputMode.detectColor();
        private int statusCapacity = StatusLine.DEFAULT_CAPACITY;
        private int suiteWidth = 30;
        private int testWidth = 40;

        public Builder withOutput(PrintStream output) {
            this.output = Objects.requireNonNull(output, "output");
            return this;
        }

        public Builder withVerbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder withColorOutput(boolean useColors) {
            this.useColors = useColors;
            return this;
        }

        public Builder withStatusCapacity(int statusCapacity) {
            if (statusCapacity < 1) {
                throw new IllegalArgumentException("status capacity must be positive: " + statusCapacity);
            }
            this.statusCapacity = statusCapacity;
            return this;
        }

        public Builder withSuiteWidth(int suiteWidth) {
            this.suiteWidth = suiteWidth;
            return this;
        }

        public Builder withTestWidth(int testWidth) {
            this.testWidth = testWidth;
            return this;
        }

        public ConsoleReporter build(ExecutionContext context) {
            return new ConsoleReporter(this, context);
        }
    }
}
