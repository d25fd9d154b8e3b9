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

import java.util.Arrays;
import java.util.List;

import static net.openhft.jitcache.JitUtils.immutableCopy;

/**
 * What a {@link FunctionCompiler} produced for one signature.
 * <p>
 * The computation is opaque to the cache; it is only handed back to
 * {@link FunctionCompiler#buildExecutable(CompilationResult)}. It is null when every output is a
 * compile-time constant, in which case there is nothing to execute.
 */
public final class CompilationResult {
    @NotNull
    private final int[] inputMapping;
    @NotNull
    private final List<Output> outputs;
    @Nullable
    private final Object computation;

    /**
     * @param inputMapping for each parameter of the computation, the index of the input it is bound to
     * @param outputs      the outputs of the function, in order
     * @param computation  the compiled computation, or null if there is nothing to run
     */
    public CompilationResult(@NotNull int[] inputMapping, @NotNull List<Output> outputs, @Nullable Object computation) {
        this.inputMapping = inputMapping.clone();
        this.outputs = immutableCopy(outputs, "outputs");
        this.computation = computation;
    }

    @NotNull
    public int[] inputMapping() {
        return inputMapping.clone();
    }

    @NotNull
    public List<Output> outputs() {
        return outputs;
    }

    @Nullable
    public Object computation() {
        return computation;
    }

    /**
     * @return true if an executable can be built from this result
     */
    public boolean isBuildable() {
        return computation != null;
    }

    @Override
    public String toString() {
        return "CompilationResult{inputMapping=" + Arrays.toString(inputMapping) +
                ", outputs=" + outputs +
                ", buildable=" + isBuildable() + '}';
    }

    /**
     * Describes one output of a compiled function.
     */
    public static final class Output {
        @NotNull
        private final TensorType type;
        @Nullable
        private final Tensor constantValue;

        private Output(@NotNull TensorType type, @Nullable Tensor constantValue) {
            this.type = type;
            this.constantValue = constantValue;
        }

        /**
         * An output produced by running the computation.
         */
        @NotNull
        public static Output computed(@NotNull TensorType type) {
            return new Output(type, null);
        }

        /**
         * An output fully determined at compile time.
         */
        @NotNull
        public static Output constant(@NotNull Tensor value) {
            return new Output(TensorType.of(value), value);
        }

        @NotNull
        public TensorType type() {
            return type;
        }

        public boolean isConstant() {
            return constantValue != null;
        }

        @Nullable
        public Tensor constantValue() {
            return constantValue;
        }

        @Override
        public String toString() {
            return isConstant() ? "constant " + constantValue : type.toString();
        }
    }
}
