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
 * One argument as the compiler binds it, positionally.
 */
public final class Argument {
    public enum Kind {
        /** A compile-time constant; its value is folded into the compiled code. */
        CONSTANT,
        /** An ordinary argument; only its type and shape are fixed at compile time. */
        PARAMETER,
        /** A resource variable, possibly uninitialized. */
        VARIABLE
    }

    @NotNull
    private final Kind kind;
    @NotNull
    private final TensorType type;
    @Nullable
    private final Tensor constantValue;
    private final boolean initialized;

    private Argument(@NotNull Kind kind, @NotNull TensorType type, @Nullable Tensor constantValue, boolean initialized) {
        this.kind = kind;
        this.type = type;
        this.constantValue = constantValue;
        this.initialized = initialized;
    }

    @NotNull
    public static Argument constant(@NotNull Tensor value) {
        return new Argument(Kind.CONSTANT, TensorType.of(value), value, true);
    }

    @NotNull
    public static Argument parameter(@NotNull TensorType type) {
        return new Argument(Kind.PARAMETER, type, null, true);
    }

    @NotNull
    public static Argument variable(@NotNull OptionalTensor value) {
        return value.isPresent()
                ? new Argument(Kind.VARIABLE, TensorType.of(value.value()), null, true)
                : new Argument(Kind.VARIABLE, TensorType.UNINITIALIZED, null, false);
    }

    @NotNull
    public Kind kind() {
        return kind;
    }

    @NotNull
    public TensorType type() {
        return type;
    }

    /**
     * @return the value of a {@link Kind#CONSTANT} argument, null for the other kinds
     */
    @Nullable
    public Tensor constantValue() {
        return constantValue;
    }

    /**
     * @return false only for a {@link Kind#VARIABLE} which has no value yet
     */
    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public String toString() {
        switch (kind) {
            case CONSTANT:
                return "constant " + constantValue;
            case VARIABLE:
                return initialized ? "variable " + type : "variable <uninitialized>";
            default:
                return "parameter " + type;
        }
    }
}
