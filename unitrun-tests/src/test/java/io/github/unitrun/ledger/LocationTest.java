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

package io.github.unitrun.ledger;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;

import static org.junit.Assert.*;

public class LocationTest extends RandomizedTest {

    @Test
    public void testHereCapturesCallerFileAndLine() {
        Location location = Location.here();
        assertTrue(location.id(), location.id().startsWith("LocationTest.java:"));
    }

    @Test
    public void testSameCallSiteInLoopIsEqual() {
        Location first = null;
        for (int i = 0; i < 3; i++) {
            Location location = Location.here();
            if (first == null) {
                first = location;
            }
            assertEquals(first, location);
            assertEquals(first.hashCode(), location.hashCode());
        }
    }

    @Test
    public void testDifferentLinesDiffer() {
        Location a = Location.here();
        Location b = Location.here();
        assertNotEquals(a, b);
    }

    @Test
    public void testOfRejectsEmpty() {
        assertThrows(IllegalArgumentException.class, () -> Location.of(""));
        assertThrows(NullPointerException.class, () -> Location.of(null));
    }

    @Test
    public void testToStringIsId() {
        assertEquals("Parser.java:7", Location.of("Parser.java:7").toString());
    }
}
