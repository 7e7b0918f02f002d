/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

/**
 * Converts the text of a node into a typed value. Used by
 * {@link ConfigNode#as(ValueConverter, Object)} and by the atom and entity id
 * accessors, whose codecs live outside this library.
 *
 * @param <T>
 *            the produced type
 */
public interface ValueConverter<T> {

    /**
     * @param value
     *            non-empty node text
     * @return the converted value
     * @throws RuntimeException
     *             if the text is not valid for the target type
     */
    T convert(String value);
}
