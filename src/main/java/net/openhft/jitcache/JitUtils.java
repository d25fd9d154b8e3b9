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

import java.lang.management.ManagementFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Static helpers shared by the signature and cache classes.
 */
public enum JitUtils {
    ; // none
    /**
     * When the JVM runs under a debugger every new signature is logged at info level rather than debug.
     */
    public static final boolean DEBUGGING = isDebug();

    /**
     * Checks if the JVM is running in debug mode.
     *
     * @return true if the JVM is in debug mode, false otherwise
     */
    public static boolean isDebug() {
        String inputArguments = ManagementFactory.getRuntimeMXBean().getInputArguments().toString();
        return inputArguments.contains("-Xdebug") || inputArguments.contains("-agentlib:jdwp=");
    }

    /**
     * Copies a list into an unmodifiable one, rejecting null elements.
     *
     * @param list  the list to copy
     * @param label used in the exception message
     * @return an unmodifiable copy
     * @throws NullPointerException if the list or any element is null
     */
    @NotNull
    public static <T> List<T> immutableCopy(@NotNull List<? extends T> list, @NotNull String label) {
        if (list == null)
            throw new NullPointerException(label);
        List<T> copy = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            T t = list.get(i);
            if (t == null)
                throw new NullPointerException(label + "[" + i + "]");
            copy.add(t);
        }
        return Collections.unmodifiableList(copy);
    }

    /**
     * @param startNanos a value previously returned by {@link System#nanoTime()}
     * @return the whole milliseconds elapsed since
     */
    public static long millisSince(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
