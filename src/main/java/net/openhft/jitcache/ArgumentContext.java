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
 * The runtime's view of the inputs of one call.
 * <p>
 * Inputs are ordered compile-time constants first, then ordinary parameters, then one
 * {@link DataType#RESOURCE} input for each resource variable.
 */
public interface ArgumentContext {

    int numInputs();

    /**
     * @return the declared element type of the input
     */
    @NotNull
    DataType inputType(int index);

    /**
     * @return the runtime shape of the input, scalar for a resource handle
     */
    @NotNull
    TensorShape inputShape(int index);

    /**
     * @return the value of the input in host memory, or null if it is not available
     */
    @Nullable
    Tensor input(int index);
}
