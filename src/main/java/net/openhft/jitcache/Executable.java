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

/**
 * A loaded, runnable form of a {@link CompilationResult}. Shared by every caller of the same
 * signature, so implementations must be thread-safe.
 */
public interface Executable {

    /**
     * @param arguments the values of the computation's parameters, ordered by
     *                  {@link CompilationResult#inputMapping()}
     * @return the computed outputs, in order
     */
    @NotNull
    List<Tensor> execute(@NotNull List<Tensor> arguments);
}
