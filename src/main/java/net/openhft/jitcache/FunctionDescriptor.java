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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Identifies the function to compile: its name and the attributes it was instantiated with.
 */
public final class FunctionDescriptor {
    @NotNull
    private final String name;
    @NotNull
    private final SortedMap<String, String> attributes;

    public FunctionDescriptor(@NotNull String name) {
        this(name, Collections.<String, String>emptyMap());
    }

    /**
     * @param name       the function name
     * @param attributes the function attributes; copied and ordered by key
     */
    public FunctionDescriptor(@NotNull String name, @NotNull Map<String, String> attributes) {
        if (name.isEmpty())
            throw new IllegalArgumentException("The function name cannot be empty.");
        this.name = name;
        this.attributes = Collections.unmodifiableSortedMap(new TreeMap<>(attributes));
    }

    @NotNull
    public String name() {
        return name;
    }

    @NotNull
    public SortedMap<String, String> attributes() {
        return attributes;
    }

    /**
     * The name used in signatures, {@code name[key1=value1,key2=value2]} with attributes ordered by key.
     * Any {@code \ [ ] = ,} inside the name, a key or a value is escaped with a backslash, so two
     * descriptors have the same canonical name if and only if they are equal.
     */
    @NotNull
    public String canonicalName() {
        StringBuilder sb = new StringBuilder();
        appendEscaped(sb, name).append('[');
        boolean first = true;
        for (Map.Entry<String, String> attr : attributes.entrySet()) {
            if (!first)
                sb.append(',');
            first = false;
            appendEscaped(sb, attr.getKey()).append('=');
            appendEscaped(sb, attr.getValue());
        }
        return sb.append(']').toString();
    }

    private static StringBuilder appendEscaped(StringBuilder sb, String text) {
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
                case '\\':
                case '[':
                case ']':
                case '=':
                case ',':
                    sb.append('\\');
                    break;
                default:
                    break;
            }
            sb.append(ch);
        }
        return sb;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionDescriptor)) return false;
        FunctionDescriptor other = (FunctionDescriptor) o;
        return name.equals(other.name) && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, attributes);
    }

    @Override
    public String toString() {
        return canonicalName();
    }
}
