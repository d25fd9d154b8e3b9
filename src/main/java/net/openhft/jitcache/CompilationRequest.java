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

import java.util.List;
import java.util.Objects;

import static net.openhft.jitcache.JitUtils.immutableCopy;

/**
 * What a {@link FunctionCompiler} is asked to compile on a cache miss.
 */
public final class CompilationRequest {
    @NotNull
    private final FunctionDescriptor function;
    @NotNull
    private final Signature signature;
    @NotNull
    private final List<Argument> arguments;
    @NotNull
    private final CompileOptions options;

    public CompilationRequest(@NotNull FunctionDescriptor function,
                              @NotNull Signature signature,
                              @NotNull List<Argument> arguments,
                              @NotNull CompileOptions options) {
        this.function = Objects.requireNonNull(function, "function");
        this.signature = Objects.requireNonNull(signature, "signature");
        this.arguments = immutableCopy(arguments, "arguments");
        this.options = Objects.requireNonNull(options, "options");
    }

    @NotNull
    public FunctionDescriptor function() {
        return function;
    }

    @NotNull
    public Signature signature() {
        return signature;
    }

    /**
     * @return one argument per input, in input order
     */
    @NotNull
    public List<Argument> arguments() {
        return arguments;
    }

    @NotNull
    public CompileOptions options() {
        return options;
    }

    @Override
    public String toString() {
        return "CompilationRequest{" + signature.debugString() + ", " + arguments.size() + " arguments, " + options + '}';
    }
}
