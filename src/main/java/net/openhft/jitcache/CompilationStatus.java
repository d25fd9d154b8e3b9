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
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The outcome of building a signature, compiling a function or building an executable.
 * Immutable, so a failed outcome can be stored once and handed to every later caller.
 */
public final class CompilationStatus {
    public enum Code {
        OK,
        /** The request itself is malformed, e.g. more constant arguments than inputs. */
        INVALID_ARGUMENT,
        /** A value needed at compile time is not available yet. */
        FAILED_PRECONDITION,
        /** An argument kind or operation the compiler cannot handle. */
        UNIMPLEMENTED,
        /** The compiler or executable builder failed unexpectedly. */
        INTERNAL
    }

    public static final CompilationStatus OK = new CompilationStatus(Code.OK, "", null);

    @NotNull
    private final Code code;
    @NotNull
    private final String message;
    @Nullable
    private final Throwable cause;

    private CompilationStatus(@NotNull Code code, @NotNull String message, @Nullable Throwable cause) {
        this.code = code;
        this.message = message;
        this.cause = cause;
    }

    /**
     * @throws IllegalArgumentException if {@code code} is {@link Code#OK}, use {@link #OK} instead
     */
    @NotNull
    public static CompilationStatus error(@NotNull Code code, @NotNull String message) {
        return error(code, message, null);
    }

    @NotNull
    public static CompilationStatus error(@NotNull Code code, @NotNull String message, @Nullable Throwable cause) {
        if (code == Code.OK)
            throw new IllegalArgumentException("An error status needs an error code");
        return new CompilationStatus(code, Objects.requireNonNull(message, "message"), cause);
    }

    @NotNull
    public static CompilationStatus invalidArgument(@NotNull String message) {
        return error(Code.INVALID_ARGUMENT, message);
    }

    @NotNull
    public static CompilationStatus failedPrecondition(@NotNull String message) {
        return error(Code.FAILED_PRECONDITION, message);
    }

    @NotNull
    public static CompilationStatus unimplemented(@NotNull String message) {
        return error(Code.UNIMPLEMENTED, message);
    }

    @NotNull
    public static CompilationStatus internal(@NotNull String message, @Nullable Throwable cause) {
        return error(Code.INTERNAL, message, cause);
    }

    public boolean isOk() {
        return code == Code.OK;
    }

    @NotNull
    public Code code() {
        return code;
    }

    @NotNull
    public String message() {
        return message;
    }

    @Nullable
    public Throwable cause() {
        return cause;
    }

    /**
     * @throws CompilationException carrying this status, unless it is {@link #OK}
     */
    public void throwIfError() throws CompilationException {
        if (!isOk())
            throw new CompilationException(this);
    }

    @Override
    public String toString() {
        return isOk() ? "OK" : code + ": " + message;
    }
}
