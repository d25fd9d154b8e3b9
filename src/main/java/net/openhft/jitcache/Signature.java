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

import static net.openhft.jitcache.JitUtils.immutableCopy;

/**
 * The key of a {@link CompilationCache}: the types and shapes of the non-constant arguments and
 * the values of the compile-time constant arguments of one function.
 * <p>
 * Both lists are in argument order and the order is part of the identity. Constant values are
 * compared by type, shape and raw bytes.
 */
public final class Signature {
    @NotNull
    private final String name;
    @NotNull
    private final List<TensorType> argTypes;
    @NotNull
    private final List<Tensor> argValues;
    private final int hashCode;

    /**
     * @param name      canonical name of the function, see {@link FunctionDescriptor#canonicalName()}
     * @param argTypes  types and shapes of the non-constant arguments, in argument order
     * @param argValues values of the compile-time constant arguments, in argument order
     */
    public Signature(@NotNull String name, @NotNull List<TensorType> argTypes, @NotNull List<Tensor> argValues) {
        this.name = name;
        this.argTypes = immutableCopy(argTypes, "argTypes");
        this.argValues = immutableCopy(argValues, "argValues");
        int h = name.hashCode();
        h = 31 * h + this.argTypes.hashCode();
        h = 31 * h + this.argValues.hashCode();
        this.hashCode = h;
    }

    @NotNull
    public String name() {
        return name;
    }

    @NotNull
    public List<TensorType> argTypes() {
        return argTypes;
    }

    @NotNull
    public List<Tensor> argValues() {
        return argValues;
    }

    /**
     * Renders the signature as {@code name,float32[2,2],int32[]; Tensor<...>}, non-constant argument
     * types after commas followed by constant values after semicolons.
     */
    @NotNull
    public String debugString() {
        StringBuilder sb = new StringBuilder(name);
        for (TensorType argType : argTypes)
            sb.append(',').append(argType);
        for (Tensor argValue : argValues)
            sb.append("; ").append(argValue.debugString());
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Signature)) return false;
        Signature other = (Signature) o;
        return hashCode == other.hashCode
                && name.equals(other.name)
                && argTypes.equals(other.argTypes)
                && argValues.equals(other.argValues);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return debugString();
    }
}
