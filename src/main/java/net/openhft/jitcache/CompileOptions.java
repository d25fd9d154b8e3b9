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
 * Settings a {@link CompilationCache} passes to its compiler with every request.
 */
public final class CompileOptions {
    /**
     * Targets the {@code "cpu"} device and resolves compile-time constants.
     */
    public static final CompileOptions DEFAULT = new CompileOptions("cpu", true);

    @NotNull
    private final String deviceType;
    private final boolean resolveCompileTimeConstants;

    /**
     * @param deviceType                  the device the compiled code will run on, e.g. {@code "cpu"} or {@code "gpu"}
     * @param resolveCompileTimeConstants whether the compiler should fold outputs which only depend on
     *                                    constants, returning them as constant outputs rather than computing them
     */
    public CompileOptions(@NotNull String deviceType, boolean resolveCompileTimeConstants) {
        if (deviceType.isEmpty())
            throw new IllegalArgumentException("The device type cannot be empty.");
        this.deviceType = deviceType;
        this.resolveCompileTimeConstants = resolveCompileTimeConstants;
    }

    @NotNull
    public String deviceType() {
        return deviceType;
    }

    public boolean resolveCompileTimeConstants() {
        return resolveCompileTimeConstants;
    }

    @Override
    public String toString() {
        return "CompileOptions{deviceType=" + deviceType +
                ", resolveCompileTimeConstants=" + resolveCompileTimeConstants + '}';
    }
}
