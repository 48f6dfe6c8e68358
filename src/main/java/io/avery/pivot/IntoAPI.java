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
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collector;
import java.util.stream.Collectors;

/**
 * A configurator used to define a conversion from input elements to {@link Record records}, such as from a typed lead
 * object to the open-ended record form that the pivot engine reads.
 *
 * <p>Attributes defined on the configurator become names on a resultant {@link Header header}, in order of definition.
 * Attribute names are matched as by {@link Header#normalize}, so defining {@code "Status"} after {@code "status"}
 * redefines the same attribute: the later function replaces the earlier one, and the first spelling and position are
 * kept.
 *
 * @see RecordSet#collector
 * @param <T> the type of input elements
 */
public class IntoAPI<T> {
    private final Map<String, Attribute<T>> attributesByKey = new LinkedHashMap<>();

    IntoAPI() {} // Prevent default public constructor

    /**
     * Defines (or redefines) the given attribute as the application of the given function to each input object.
     *
     * @param name the attribute name
     * @param mapper a function to apply to each input object
     * @return this configurator
     */
    public IntoAPI<T> attribute(String name, Function<? super T, ?> mapper) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(mapper);
        attributesByKey.merge(Header.normalize(name), new Attribute<>(name, mapper),
                              (previous, next) -> new Attribute<>(previous.name, next.mapper));
        return this;
    }

    Collector<T, ?, RecordSet> collector(Consumer<IntoAPI<T>> config) {
        config.accept(this);

        // Snapshot, so later calls on this configurator cannot leak into the collector
        List<Attribute<T>> attributes = List.copyOf(attributesByKey.values());
        List<String> names = new ArrayList<>(attributes.size());
        for (Attribute<T> attribute : attributes)
            names.add(attribute.name);
        Header header = new Header(names);

        return Collectors.collectingAndThen(
            Collectors.mapping((T element) -> {
                Object[] values = new Object[attributes.size()];
                for (int i = 0; i < values.length; i++)
                    values[i] = attributes.get(i).mapper.apply(element);
                return values;
            }, Collectors.toList()),
            rows -> new RecordSet(header, rows.toArray(new Object[0][]))
        );
    }

    private static class Attribute<T> {
        final String name;
        final Function<? super T, ?> mapper;

        Attribute(String name, Function<? super T, ?> mapper) {
            this.name = name;
            this.mapper = mapper;
        }
    }
}
