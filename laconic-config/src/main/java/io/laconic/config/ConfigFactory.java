/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

import java.io.File;
import java.io.Reader;
import java.util.Locale;

import io.laconic.config.impl.ConfigImplUtil;
import io.laconic.config.impl.Parseable;

/**
 * Contains static methods for creating {@link Configuration} instances from
 * Laconic source text.
 *
 * <p>
 * Every method preprocesses <code>#include&lt;...&gt;</code> lines (unless
 * {@link ConfigParseOptions#setProcessIncludes} turned that off), tokenizes
 * the whole source, and parses it into a tree. The returned configuration
 * uses the {@link ConfigResolveOptions} of the parse options for variable
 * expansion.
 */
public final class ConfigFactory {
    /**
     * Environment variable consulted by {@link #parseEntryPointFile} when no
     * environment name is given.
     */
    public static final String ENVIRONMENT_NAME_VAR = "LACONIC_ENVIRONMENT";

    public static final String DEFAULT_ENVIRONMENT = "local";

    public static final String FILE_EXTENSION = ".laconf";

    private ConfigFactory() {
    }

    /**
     * @return a writable configuration with no root
     */
    public static Configuration empty() {
        return new Configuration();
    }

    public static Configuration parseString(String s, ConfigParseOptions options) {
        return Parseable.newString(s, options).parse();
    }

    public static Configuration parseString(String s) {
        return parseString(s, ConfigParseOptions.defaults());
    }

    /**
     * Parses everything the reader delivers. The reader is not closed.
     */
    public static Configuration parseReader(Reader reader, ConfigParseOptions options) {
        return Parseable.newReader(reader, options).parse();
    }

    public static Configuration parseReader(Reader reader) {
        return parseReader(reader, ConfigParseOptions.defaults());
    }

    /**
     * Parses a UTF-8 file. Relative includes are resolved against the file's
     * directory unless the options name an include root.
     *
     * @param file
     *            the file to parse
     * @param options
     *            parse options
     * @return the parsed configuration; an empty one if the file is missing
     *         and the options allow that
     * @throws ConfigException.IO
     *             if the file is missing and may not be, or can't be read
     */
    public static Configuration parseFile(File file, ConfigParseOptions options) {
        File dir = file.getAbsoluteFile().getParentFile();
        return Parseable.newFile(file, options.withFallbackIncludeRoot(dir)).parse();
    }

    public static Configuration parseFile(File file) {
        return parseFile(file, ConfigParseOptions.defaults());
    }

    /**
     * Parses a classpath resource. The resource name is "raw", as in
     * {@link ClassLoader#getResource}: it is not made relative to any package.
     *
     * @param loader
     *            class loader to look the resource up in
     * @param resource
     *            resource name
     * @param options
     *            parse options
     * @return the parsed configuration
     */
    public static Configuration parseResources(ClassLoader loader, String resource,
            ConfigParseOptions options) {
        return Parseable.newResources(loader, resource, options).parse();
    }

    public static Configuration parseResources(ClassLoader loader, String resource) {
        return parseResources(loader, resource, ConfigParseOptions.defaults());
    }

    /**
     * Like {@link #parseResources(ClassLoader, String)} with the current
     * thread's context class loader.
     */
    public static Configuration parseResources(String resource) {
        return parseResources(Thread.currentThread().getContextClassLoader(), resource);
    }

    /**
     * Parses the configuration file co-located with an application entry point.
     * For an entry point <code>/opt/app/main.py</code> and environment
     * <code>Prod</code> this is <code>/opt/app/main-prod.laconf</code>.
     *
     * <p>
     * When the environment is blank, the {@value #ENVIRONMENT_NAME_VAR}
     * variable of the options' {@link EnvironmentResolver} is used, and
     * {@value #DEFAULT_ENVIRONMENT} when that is not set either. The name is
     * always lower-cased.
     *
     * @param entryPoint
     *            the entry point file
     * @param environment
     *            environment name, or null
     * @param options
     *            parse options; with allow-missing (the default) an absent
     *            file gives an empty configuration
     * @return the parsed configuration
     */
    public static Configuration parseEntryPointFile(File entryPoint, String environment,
            ConfigParseOptions options) {
        return parseFile(entryPointFile(entryPoint, environment, options), options);
    }

    public static Configuration parseEntryPointFile(File entryPoint, String environment) {
        return parseEntryPointFile(entryPoint, environment, ConfigParseOptions.defaults());
    }

    /**
     * @return the file {@link #parseEntryPointFile} reads
     */
    public static File entryPointFile(File entryPoint, String environment,
            ConfigParseOptions options) {
        String env = environmentName(environment, options.getResolveOptions()
                .getEnvironmentResolver());
        String fileName = entryPoint.getName();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        File dir = entryPoint.getAbsoluteFile().getParentFile();
        return new File(dir, stem + "-" + env + FILE_EXTENSION);
    }

    static String environmentName(String environment, EnvironmentResolver resolver) {
        String env = environment;
        if (env == null || ConfigImplUtil.unicodeTrim(env).isEmpty())
            env = resolver.getEnv(ENVIRONMENT_NAME_VAR);
        if (env == null || ConfigImplUtil.unicodeTrim(env).isEmpty())
            env = DEFAULT_ENVIRONMENT;
        return ConfigImplUtil.unicodeTrim(env).toLowerCase(Locale.ROOT);
    }
}
