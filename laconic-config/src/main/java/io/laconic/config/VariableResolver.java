/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

/**
 * Application hook for <code>$(...)</code> expressions. An installed resolver
 * is asked first, before environment variables and before path navigation.
 */
public interface VariableResolver {

    /**
     * @param context
     *            the section the expression is evaluated against
     * @param expression
     *            the trimmed text between the variable markers
     * @return the replacement text, or null to fall back to the built-in
     *         resolution
     */
    String resolve(ConfigNode context, String expression);
}
