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
 * The ahead-of-time compiler a {@link CompilationCache} memoizes.
 * <p>
 * The cache calls {@link #compileFunction(CompilationRequest)} at most once per signature and
 * {@link #buildExecutable(CompilationResult)} at most once per successful result, but calls for
 * different signatures may run concurrently.
 */
public interface FunctionCompiler {

    /**
     * Compiles a function specialized for the argument types, shapes and constant values of a signature.
     *
     * @param request the function, its arguments and the compile options
     * @return the compiled result
     * @throws CompilationException if the function cannot be compiled for these arguments
     */
    @NotNull
    CompilationResult compileFunction(@NotNull CompilationRequest request) throws CompilationException;

    /**
     * Builds a runnable executable. Only called for results where {@link CompilationResult#isBuildable()}.
     *
     * @param result a successful compilation result
     * @return the executable, or null if there is nothing to execute
     * @throws CompilationException if the executable cannot be built
     */
    @Nullable
    Executable buildExecutable(@NotNull CompilationResult result) throws CompilationException;
}
