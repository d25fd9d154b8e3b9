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

/**
 * A view of a resolved cache entry: the signature, the compilation result and, if one was
 * requested and could be built, the executable.
 */
public final class CompiledFunction {
    @NotNull
    private final Signature signature;
    @NotNull
    private final CompilationResult result;
    @Nullable
    private final Executable executable;

    CompiledFunction(@NotNull Signature signature, @NotNull CompilationResult result, @Nullable Executable executable) {
        this.signature = signature;
        this.result = result;
        this.executable = executable;
    }

    @NotNull
    public Signature signature() {
        return signature;
    }

    @NotNull
    public CompilationResult result() {
        return result;
    }

    /**
     * @return the executable, or null if none was requested or the computation has nothing to execute
     */
    @Nullable
    public Executable executable() {
        return executable;
    }

    @Override
    public String toString() {
        return "CompiledFunction{" + signature.debugString() + ", executable=" + (executable != null) + '}';
    }
}
