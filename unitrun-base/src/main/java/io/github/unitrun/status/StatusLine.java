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

package io.github.unitrun.status;

/**
 * Bounded buffer of progress glyphs rendered after a suite or test header. The length never
 * exceeds the capacity; callers check {@link #isFull()} and flush before appending.
 */
public class StatusLine {
    public static final int DEFAULT_CAPACITY = 1024;

    private final char[] glyphs;
    private int length;

    public StatusLine() {
        this(DEFAULT_CAPACITY);
    }

    public StatusLine(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.glyphs = new char[capacity];
    }

    /**
     * @throws IllegalStateException if the line is full
     */
    public void append(Glyph glyph) {
        if (isFull()) {
            throw new IllegalStateException("status line is full (" + glyphs.length + " glyphs)");
        }
        glyphs[length++] = glyph.symbol();
    }

    public boolean isFull() {
        return length == glyphs.length;
    }

    public int length() {
        return length;
    }

    public int capacity() {
        return glyphs.length;
    }

    public void reset() {
        length = 0;
    }

    @Override
    public String toString() {
        return new String(glyphs, 0, length);
    }
}
