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

/**
 * Ambient error slot shared by the runner and the code it runs. Code under test and fixtures
 * raise it when something went wrong that is not an assertion (a failed close, a resource left
 * behind); the runner inspects it before and after every phase of a test, logs what it finds and
 * clears it, so that error state never leaks from one test into the next.
 * <p>
 * A code of 0 means clear.
 */
public class ErrorIndicator {
    private int code;
    private String message;

    /**
     * @param code a non-zero error code
     * @param message a description of the error
     */
    public void raise(int code, String message) {
        if (code == 0) {
            throw new IllegalArgumentException("error code 0 means no error");
        }
        this.code = code;
        this.message = message;
    }

    public boolean isRaised() {
        return code != 0;
    }

    public int code() {
        return code;
    }

    public String message() {
        return message;
    }

    public void clear() {
        code = 0;
        message = null;
    }

    @Override
    public String toString() {
        return isRaised() ? code + ": " + message : "clear";
    }
}
