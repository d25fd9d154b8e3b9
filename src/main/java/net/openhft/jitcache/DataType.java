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

/**
 * Element type of a tensor argument.
 */
public enum DataType {
    /** Only appears in signatures, for a variable that has no value yet. */
    INVALID("invalid", 0),
    FLOAT16("float16", 2),
    BFLOAT16("bfloat16", 2),
    FLOAT32("float32", 4),
    FLOAT64("float64", 8),
    INT8("int8", 1),
    INT16("int16", 2),
    INT32("int32", 4),
    INT64("int64", 8),
    UINT8("uint8", 1),
    BOOL("bool", 1),
    /** A handle to a resource variable, passed in place of its value. */
    RESOURCE("resource", 0);

    @NotNull
    private final String displayName;
    private final int byteSize;

    DataType(@NotNull String displayName, int byteSize) {
        this.displayName = displayName;
        this.byteSize = byteSize;
    }

    /**
     * @return the number of bytes per element, or 0 for types which cannot hold values
     */
    public int byteSize() {
        return byteSize;
    }

    /**
     * @return true if tensors of this type can carry host memory values
     */
    public boolean hasValues() {
        return byteSize > 0;
    }

    @NotNull
    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
