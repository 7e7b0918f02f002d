/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

/**
 * Looks up environment variables for <code>$(~NAME)</code> substitutions and
 * for {@link Configuration#resolveEnvVar}. Install a custom one with
 * {@link ConfigResolveOptions#setEnvironmentResolver}.
 */
public interface EnvironmentResolver {

    /**
     * Resolver backed by {@link System#getenv(String)}.
     */
    EnvironmentResolver SYSTEM = new EnvironmentResolver() {
        @Override
        public String getEnv(String name) {
            return System.getenv(name);
        }
    };

    /**
     * @param name
     *            variable name, never null or empty
     * @return the variable value or null if it is not set
     */
    String getEnv(String name);
}
