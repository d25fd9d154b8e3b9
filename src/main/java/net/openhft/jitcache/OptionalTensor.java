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
 * A snapshot of a resource variable's value, absent while the variable is uninitialized.
 */
public final class OptionalTensor {
    private static final OptionalTensor ABSENT = new OptionalTensor(null);

    @Nullable
    private final Tensor value;

    private OptionalTensor(@Nullable Tensor value) {
        this.value = value;
    }

    @NotNull
    public static OptionalTensor of(@NotNull Tensor value) {
        return new OptionalTensor(Objects.requireNonNull(value, "value"));
    }

    @NotNull
    public static OptionalTensor absent() {
        return ABSENT;
    }

    public boolean isPresent() {
        return value != null;
    }

    /**
     * @throws IllegalStateException if the variable is uninitialized
     */
    @NotNull
    public Tensor value() {
        if (value == null)
            throw new IllegalStateException("Variable is not initialized");
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptionalTensor)) return false;
        return Objects.equals(value, ((OptionalTensor) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "<absent>" : value.debugString();
    }
}
