/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

/**
 * Represents the origin (such as filename, line and column) of a token or of
 * an exception, for use in error messages. Exceptions may have an origin, see
 * {@link ConfigException#origin}, but be careful because
 * <code>ConfigException.origin()</code> may return null.
 *
 * <p>
 * <em>Do not implement this interface</em>; it should only be implemented by
 * the config library.
 */
public interface ConfigOrigin {
    /**
     * Returns a string describing the origin of a token or exception, such as
     * <code>app.laconf: 3:14</code>. This will never return null.
     *
     * @return string describing the origin
     */
    public String description();

    /**
     * Returns a filename describing the origin. This will return null if the
     * origin was not a file.
     *
     * @return filename of the origin or null
     */
    public String filename();

    /**
     * Returns a line number (1-based) where the token or exception originated.
     * This will return -1 if there's no meaningful line number.
     *
     * @return line number or -1 if none is available
     */
    public int lineNumber();

    /**
     * Returns a column number (1-based) within {@link #lineNumber()}, or -1.
     *
     * @return column number or -1 if none is available
     */
    public int columnNumber();

    /**
     * Returns the absolute character offset into the source text, or -1.
     *
     * @return offset or -1 if none is available
     */
    public int offset();
}
