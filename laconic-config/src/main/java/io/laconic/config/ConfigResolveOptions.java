/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

/**
 * A set of options related to resolving node values: the variable syntax used
 * by <code>$(...)</code> substitutions, where environment variables come from,
 * an optional application {@link VariableResolver}, and the converters used by
 * {@link ConfigNode#asAtom} and {@link ConfigNode#asEntityId}.
 * <p>
 * This object is immutable, so the "setters" return a new object.
 * <p>
 * Here is an example of creating a custom {@code ConfigResolveOptions}:
 *
 * <pre>
 *     ConfigResolveOptions options = ConfigResolveOptions.defaults()
 *         .setEnvironmentResolver(myEnv)
 *         .setAtomConverter(Atoms::encode)
 * </pre>
 * <p>
 * In addition to {@link ConfigResolveOptions#defaults}, there's a prebuilt
 * {@link ConfigResolveOptions#noSystem} which never looks at the process
 * environment.
 */
public final class ConfigResolveOptions {
    public static final String DEFAULT_VARIABLE_START = "$(";
    public static final String DEFAULT_VARIABLE_END = ")";
    public static final String DEFAULT_VARIABLE_ESCAPE = "$$";
    public static final String DEFAULT_ENV_MODIFIER = "~";
    public static final String DEFAULT_PATH_MODIFIER = "@";

    private static final EnvironmentResolver NO_ENVIRONMENT = new EnvironmentResolver() {
        @Override
        public String getEnv(String name) {
            return null;
        }
    };

    final private String variableStart;
    final private String variableEnd;
    final private String variableEscape;
    final private String envModifier;
    final private String pathModifier;
    final private EnvironmentResolver environmentResolver;
    final private VariableResolver variableResolver;
    final private ValueConverter<?> atomConverter;
    final private ValueConverter<?> entityIdConverter;

    private ConfigResolveOptions(String variableStart, String variableEnd,
            String variableEscape, String envModifier, String pathModifier,
            EnvironmentResolver environmentResolver, VariableResolver variableResolver,
            ValueConverter<?> atomConverter, ValueConverter<?> entityIdConverter) {
        this.variableStart = variableStart;
        this.variableEnd = variableEnd;
        this.variableEscape = variableEscape;
        this.envModifier = envModifier;
        this.pathModifier = pathModifier;
        this.environmentResolver = environmentResolver;
        this.variableResolver = variableResolver;
        this.atomConverter = atomConverter;
        this.entityIdConverter = entityIdConverter;
    }

    /**
     * Returns the default resolve options: <code>$(</code>, <code>)</code>,
     * <code>$$</code>, <code>~</code> and <code>@</code> markers, the process
     * environment, no custom resolver and no converters.
     *
     * @return the default resolve options
     */
    public static ConfigResolveOptions defaults() {
        return new ConfigResolveOptions(DEFAULT_VARIABLE_START, DEFAULT_VARIABLE_END,
                DEFAULT_VARIABLE_ESCAPE, DEFAULT_ENV_MODIFIER, DEFAULT_PATH_MODIFIER,
                EnvironmentResolver.SYSTEM, null, null, null);
    }

    /**
     * Returns resolve options that disable any reference to the process
     * environment; every environment variable reads as absent.
     *
     * @return the resolve options with env variables disabled
     */
    public static ConfigResolveOptions noSystem() {
        return defaults().setEnvironmentResolver(NO_ENVIRONMENT);
    }

    /**
     * Sets the markers of the variable syntax.
     *
     * @param start
     *            marker opening a variable, <code>$(</code> by default
     * @param end
     *            marker closing a variable, <code>)</code> by default
     * @param escape
     *            prefix that disables expansion of a whole value,
     *            <code>$$</code> by default
     * @return options with the markers set
     */
    public ConfigResolveOptions setVariableMarkers(String start, String end, String escape) {
        requireMarker(start, "start");
        requireMarker(end, "end");
        requireMarker(escape, "escape");
        return new ConfigResolveOptions(start, end, escape, envModifier, pathModifier,
                environmentResolver, variableResolver, atomConverter, entityIdConverter);
    }

    /**
     * Sets the prefixes which select environment lookup and path lookup
     * inside a variable.
     *
     * @param envModifier
     *            <code>~</code> by default
     * @param pathModifier
     *            <code>@</code> by default
     * @return options with the modifiers set
     */
    public ConfigResolveOptions setModifiers(String envModifier, String pathModifier) {
        requireMarker(envModifier, "environment modifier");
        requireMarker(pathModifier, "path modifier");
        return new ConfigResolveOptions(variableStart, variableEnd, variableEscape, envModifier,
                pathModifier, environmentResolver, variableResolver, atomConverter,
                entityIdConverter);
    }

    public ConfigResolveOptions setEnvironmentResolver(EnvironmentResolver environmentResolver) {
        if (environmentResolver == null)
            throw new ConfigException.BugOrBroken("null environment resolver");
        if (this.environmentResolver == environmentResolver)
            return this;
        return new ConfigResolveOptions(variableStart, variableEnd, variableEscape, envModifier,
                pathModifier, environmentResolver, variableResolver, atomConverter,
                entityIdConverter);
    }

    /**
     * @param variableResolver
     *            resolver asked before environment and path lookup, or null
     *            for none
     * @return options with the resolver set
     */
    public ConfigResolveOptions setVariableResolver(VariableResolver variableResolver) {
        if (this.variableResolver == variableResolver)
            return this;
        return new ConfigResolveOptions(variableStart, variableEnd, variableEscape, envModifier,
                pathModifier, environmentResolver, variableResolver, atomConverter,
                entityIdConverter);
    }

    public ConfigResolveOptions setAtomConverter(ValueConverter<?> atomConverter) {
        return new ConfigResolveOptions(variableStart, variableEnd, variableEscape, envModifier,
                pathModifier, environmentResolver, variableResolver, atomConverter,
                entityIdConverter);
    }

    public ConfigResolveOptions setEntityIdConverter(ValueConverter<?> entityIdConverter) {
        return new ConfigResolveOptions(variableStart, variableEnd, variableEscape, envModifier,
                pathModifier, environmentResolver, variableResolver, atomConverter,
                entityIdConverter);
    }

    public String getVariableStart() {
        return variableStart;
    }

    public String getVariableEnd() {
        return variableEnd;
    }

    public String getVariableEscape() {
        return variableEscape;
    }

    public String getEnvModifier() {
        return envModifier;
    }

    public String getPathModifier() {
        return pathModifier;
    }

    public EnvironmentResolver getEnvironmentResolver() {
        return environmentResolver;
    }

    /** @return the custom resolver or null */
    public VariableResolver getVariableResolver() {
        return variableResolver;
    }

    /** @return the atom converter or null */
    public ValueConverter<?> getAtomConverter() {
        return atomConverter;
    }

    /** @return the entity id converter or null */
    public ValueConverter<?> getEntityIdConverter() {
        return entityIdConverter;
    }

    private static void requireMarker(String marker, String what) {
        if (marker == null || marker.isEmpty())
            throw new ConfigException.Generic("Variable " + what + " marker must not be empty");
    }
}
