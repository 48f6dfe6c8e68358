/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.pivot;

import java.util.*;

/**
 * An ordered, immutable collection of attribute names belonging to a single {@link Record record} or a
 * {@link RecordSet record-set}. Attribute names are matched leniently: two names are considered the same attribute if
 * they are equal after {@link #normalize normalization}. If a header is created with several names that normalize to
 * the same key, lookups resolve to the first of them.
 */
public class Header {
    final Map<String, Integer> indexByKey;
    final String[] names;

    Header(List<String> names) {
        this.names = names.toArray(new String[0]);
        this.indexByKey = new HashMap<>();
        for (int i = 0; i < this.names.length; i++)
            indexByKey.putIfAbsent(normalize(this.names[i]), i);
    }

    /**
     * Returns the lookup key for the given attribute name. The key is the name lower-cased, with every character that
     * is not a letter or digit removed. So {@code "createdAt"}, {@code "Created At"}, and {@code "created_at"} all
     * share the key {@code "createdat"}.
     *
     * @param name the attribute name
     * @return the lookup key for the attribute name
     */
    public static String normalize(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isLetterOrDigit(c))
                sb.append(Character.toLowerCase(c));
        }
        return sb.toString();
    }

    /**
     * Returns the index of the given attribute in this header, or {@code -1} if this header does not contain the
     * attribute.
     *
     * @param name the attribute name to search for
     * @return the index of the given attribute in this header, or {@code -1} if this header does not contain it
     */
    public int indexOf(String name) {
        Objects.requireNonNull(name);
        Integer index = indexByKey.get(normalize(name));
        return index != null ? index : -1;
    }

    /**
     * Returns {@code true} if this header contains the given attribute.
     *
     * @param name the attribute name
     * @return {@code true} if this header contains the given attribute
     */
    public boolean contains(String name) {
        return indexOf(name) != -1;
    }

    /**
     * Returns an unmodifiable view of the attribute names, as they were given when this header was created.
     *
     * @return the attribute names
     */
    public List<String> names() {
        return Collections.unmodifiableList(Arrays.asList(names));
    }

    /**
     * Returns the number of attributes in this header.
     *
     * @return the number of attributes in this header
     */
    public int size() {
        return names.length;
    }

    /**
     * Returns {@code true} if and only if the given object is a header containing the same attribute names in the same
     * order as this header.
     *
     * @param o the object to be compared for equality with this header
     * @return {@code true} if the given object is equal to this header
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Header))
            return false;
        return Arrays.equals(names, ((Header) o).names);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(names);
    }

    /**
     * Returns a string representation of this header. The string representation consists of the characters
     * {@code "Header"}, followed by the string representation of the header {@link #names()}.
     *
     * @return a string representation of this header
     */
    @Override
    public String toString() {
        return "Header" + Arrays.toString(names);
    }
}
