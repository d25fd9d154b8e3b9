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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An {@link ArgumentContext} backed by a list of inputs.
 */
public final class SimpleArgumentContext implements ArgumentContext {
    private final List<TensorType> types;
    private final List<Tensor> values;

    private SimpleArgumentContext(List<TensorType> types, List<Tensor> values) {
        this.types = types;
        this.values = values;
    }

    /**
     * @return a context whose inputs are the given tensors, all available
     */
    @NotNull
    public static SimpleArgumentContext of(@NotNull Tensor... inputs) {
        Builder builder = builder();
        for (Tensor input : inputs)
            builder.add(input);
        return builder.build();
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public int numInputs() {
        return types.size();
    }

    @NotNull
    @Override
    public DataType inputType(int index) {
        return types.get(index).type();
    }

    @NotNull
    @Override
    public TensorShape inputShape(int index) {
        return types.get(index).shape();
    }

    @Nullable
    @Override
    public Tensor input(int index) {
        return values.get(index);
    }

    public static final class Builder {
        private final List<TensorType> types = new ArrayList<>();
        private final List<Tensor> values = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds an input whose value is available.
         */
        @NotNull
        public Builder add(@NotNull Tensor value) {
            types.add(TensorType.of(value));
            values.add(value);
            return this;
        }

        /**
         * Adds an input whose type and shape are known but whose value is not available in host memory.
         */
        @NotNull
        public Builder addUnavailable(@NotNull DataType type, @NotNull TensorShape shape) {
            types.add(new TensorType(type, shape));
            values.add(null);
            return this;
        }

        /**
         * Adds a resource variable handle.
         */
        @NotNull
        public Builder addResource() {
            return addUnavailable(DataType.RESOURCE, TensorShape.scalar());
        }

        @NotNull
        public SimpleArgumentContext build() {
            return new SimpleArgumentContext(
                    Collections.unmodifiableList(new ArrayList<>(types)),
                    Collections.unmodifiableList(new ArrayList<>(values)));
        }
    }
}
