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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;

import static org.junit.Assert.*;

public class StatusLineTest extends RandomizedTest {

    @Test
    public void testDefaultCapacity() {
        StatusLine line = new StatusLine();
        assertEquals(StatusLine.DEFAULT_CAPACITY, line.capacity());
        assertEquals(0, line.length());
        assertEquals("", line.toString());
    }

    @Test
    public void testAppendAndReset() {
        StatusLine line = new StatusLine(4);
        line.append(Glyph.PASS);
        line.append(Glyph.FAIL);
        line.append(Glyph.ERROR);
        assertEquals(".FE", line.toString());
        assertFalse(line.isFull());

        line.reset();
        assertEquals(0, line.length());
        assertEquals("", line.toString());
    }

    @Test
    public void testAppendToFullLineThrows() {
        int capacity = randomIntBetween(1, 64);
        StatusLine line = new StatusLine(capacity);
        for (int i = 0; i < capacity; i++) {
            line.append(randomFrom(Glyph.values()));
        }
        assertTrue(line.isFull());
        assertEquals(capacity, line.length());
        assertThrows(IllegalStateException.class, () -> line.append(Glyph.PASS));
        assertEquals(capacity, line.length());
    }

    @Test
    public void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new StatusLine(0));
        assertThrows(IllegalArgumentException.class, () -> new StatusLine(-1));
    }
}
