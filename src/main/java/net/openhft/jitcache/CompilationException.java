/*
 * Copyright 2014 Higher Frequency Trading
 *
 *       https://chronicle.software
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.openhft.jitcache;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a signature cannot be built, a function fails to compile, or an executable fails to build.
 * <p>
 * A cached failure is replayed as a new exception on every call, each carrying the same
 * {@link CompilationStatus} instance.
 */
public class CompilationException extends Exception {
    private static final long serialVersionUID = 0L;

    @NotNull
    private final transient CompilationStatus status;

    /**
     * @throws IllegalArgumentException if {@code status} is OK
     */
    public CompilationException(@NotNull CompilationStatus status) {
        super(status.toString(), status.cause());
        if (status.isOk())
            throw new IllegalArgumentException("Cannot throw an OK status");
        this.status = status;
    }

    public CompilationException(@NotNull CompilationStatus.Code code, @NotNull String message) {
        this(CompilationStatus.error(code, message));
    }

    @NotNull
    public CompilationStatus status() {
        return status;
    }

    @NotNull
    public CompilationStatus.Code code() {
        return status.code();
    }
}
