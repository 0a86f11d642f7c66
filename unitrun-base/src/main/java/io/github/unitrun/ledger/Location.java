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

import java.util.Objects;

/**
 * Identifies one assertion call site. Two locations are equal when their identifiers are equal,
 * so the identifier has to be stable across repeated evaluations of the same call site (loop
 * iterations, helper methods called twice) and distinct between call sites.
 * <p>
 * The conventional identifier is {@code File.java:line}, which {@link #here()} captures from the
 * caller's stack frame.
 */
public final class Location {
    private static final StackWalker WALKER = StackWalker.getInstance();

    private final String id;

    private Location(String id) {
        this.id = id;
    }

    /**
     * @param id a caller-supplied identifier, e.g. {@code "ParserTest.java:42"}
     */
    public static Location of(String id) {
        Objects.requireNonNull(id, "id");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("location id must not be empty");
        }
        return new Location(id);
    }

    /**
     * Returns the location of the statement that called this method.
     */
    public static Location here() {
        return WALKER.walk(frames -> frames.skip(1)
                .findFirst()
                .map(f -> of((f.getFileName() != null ? f.getFileName() : f.getClassName()) + ":" + f.getLineNumber()))
                .orElseThrow(() -> new IllegalStateException("no caller frame")));
    }

    public String id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Location)) {
            return false;
        }
        return id.equals(((Location) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
