/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

/**
 * Implement this interface and provide an instance to
 * {@link ConfigParseOptions#setIncluder ConfigParseOptions.setIncluder()} to
 * customize how <code>#include&lt;name&gt;</code> lines are satisfied.
 */
public interface ConfigIncluder {
    /**
     * Reads the text of an included item. The returned text is preprocessed
     * for nested includes before it replaces the include line.
     *
     * @param name
     *            the include argument, with the required marker and
     *            variables already stripped and expanded
     * @return the text, or null if the item does not exist
     * @throws ConfigException
     *             if the item exists but cannot be read
     */
    String include(String name);
}
