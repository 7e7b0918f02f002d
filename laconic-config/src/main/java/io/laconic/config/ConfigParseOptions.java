/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

import java.io.File;


/**
 * A set of options related to parsing.
 *
 * <p>
 * This object is immutable, so the "setters" return a new object.
 *
 * <p>
 * Here is an example of creating a custom {@code ConfigParseOptions}:
 *
 * <pre>
 *     ConfigParseOptions options = ConfigParseOptions.defaults()
 *         .setReadOnly(true)
 *         .setAllowMissing(false)
 * </pre>
 *
 */
public final class ConfigParseOptions {
    final String originDescription;
    final boolean allowMissing;
    final boolean readOnly;
    final boolean processIncludes;
    final File includeRoot;
    final ConfigIncluder includer;
    final ConfigResolveOptions resolveOptions;

    private ConfigParseOptions(String originDescription, boolean allowMissing, boolean readOnly,
            boolean processIncludes, File includeRoot, ConfigIncluder includer,
            ConfigResolveOptions resolveOptions) {
        this.originDescription = originDescription;
        this.allowMissing = allowMissing;
        this.readOnly = readOnly;
        this.processIncludes = processIncludes;
        this.includeRoot = includeRoot;
        this.includer = includer;
        this.resolveOptions = resolveOptions;
    }

    public static ConfigParseOptions defaults() {
        return new ConfigParseOptions(null, true, false, true, null, null,
                ConfigResolveOptions.defaults());
    }

    /**
     * Set a description for the thing being parsed. In most cases this will be
     * set up for you to something like the filename, but if you provide just a
     * string you might want to improve on it. Set to null to allow the library
     * to come up with something automatically. This description is the basis
     * for the {@link ConfigOrigin} of tokens and errors.
     *
     * @param originDescription
     * @return options with the origin description set
     */
    public ConfigParseOptions setOriginDescription(String originDescription) {
        if (this.originDescription == originDescription)
            return this;
        else if (this.originDescription != null && originDescription != null
                && this.originDescription.equals(originDescription))
            return this;
        else
            return new ConfigParseOptions(originDescription, allowMissing, readOnly,
                    processIncludes, includeRoot, includer, resolveOptions);
    }

    public String getOriginDescription() {
        return originDescription;
    }

    /** this is package-private, not public API */
    ConfigParseOptions withFallbackOriginDescription(String originDescription) {
        if (this.originDescription == null)
            return setOriginDescription(originDescription);
        else
            return this;
    }

    /**
     * Set to false to throw an exception if the item being parsed (for example
     * a file) is missing. Set to true to just return an empty configuration in
     * that case.
     *
     * @param allowMissing
     * @return options with the "allow missing" flag set
     */
    public ConfigParseOptions setAllowMissing(boolean allowMissing) {
        if (this.allowMissing == allowMissing)
            return this;
        else
            return new ConfigParseOptions(originDescription, allowMissing, readOnly,
                    processIncludes, includeRoot, includer, resolveOptions);
    }

    public boolean getAllowMissing() {
        return allowMissing;
    }

    /**
     * Set to true to get the parsed tree back as a read-only
     * {@link Configuration}.
     *
     * @param readOnly
     * @return options with the read-only flag set
     */
    public ConfigParseOptions setReadOnly(boolean readOnly) {
        if (this.readOnly == readOnly)
            return this;
        else
            return new ConfigParseOptions(originDescription, allowMissing, readOnly,
                    processIncludes, includeRoot, includer, resolveOptions);
    }

    public boolean getReadOnly() {
        return readOnly;
    }

    /**
     * Set to false to leave <code>#include&lt;...&gt;</code> lines alone; they
     * are then ordinary line comments.
     *
     * @param processIncludes
     * @return options with include processing switched on or off
     */
    public ConfigParseOptions setProcessIncludes(boolean processIncludes) {
        if (this.processIncludes == processIncludes)
            return this;
        else
            return new ConfigParseOptions(originDescription, allowMissing, readOnly,
                    processIncludes, includeRoot, includer, resolveOptions);
    }

    public boolean getProcessIncludes() {
        return processIncludes;
    }

    /**
     * Set the directory relative include names are resolved against by the
     * default includer. When parsing a file and this is null, the file's own
     * directory is used.
     *
     * @param includeRoot
     * @return options with the include root set
     */
    public ConfigParseOptions setIncludeRoot(File includeRoot) {
        return new ConfigParseOptions(originDescription, allowMissing, readOnly,
                processIncludes, includeRoot, includer, resolveOptions);
    }

    public File getIncludeRoot() {
        return includeRoot;
    }

    /** this is package-private, not public API */
    ConfigParseOptions withFallbackIncludeRoot(File includeRoot) {
        if (this.includeRoot == null)
            return setIncludeRoot(includeRoot);
        else
            return this;
    }

    /**
     * Set a ConfigIncluder which customizes how includes are handled. When
     * null, includes are read from files under {@link #getIncludeRoot()}.
     *
     * @param includer
     * @return new version of the parse options with different includer
     */
    public ConfigParseOptions setIncluder(ConfigIncluder includer) {
        if (this.includer == includer)
            return this;
        else
            return new ConfigParseOptions(originDescription, allowMissing, readOnly,
                    processIncludes, includeRoot, includer, resolveOptions);
    }

    public ConfigIncluder getIncluder() {
        return includer;
    }

    /**
     * Set the resolve options the parsed {@link Configuration} is created
     * with; they are also used to expand variables in include names.
     *
     * @param resolveOptions
     * @return options with the resolve options set
     */
    public ConfigParseOptions setResolveOptions(ConfigResolveOptions resolveOptions) {
        if (resolveOptions == null)
            throw new ConfigException.BugOrBroken("null resolve options");
        if (this.resolveOptions == resolveOptions)
            return this;
        else
            return new ConfigParseOptions(originDescription, allowMissing, readOnly,
                    processIncludes, includeRoot, includer, resolveOptions);
    }

    public ConfigResolveOptions getResolveOptions() {
        return resolveOptions;
    }

}
