/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FilterReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.laconic.config.ConfigException;
import io.laconic.config.ConfigIncluder;
import io.laconic.config.ConfigOrigin;
import io.laconic.config.ConfigParseOptions;
import io.laconic.config.Configuration;

/**
 * This is public but it's only for use by the config package; DO NOT TOUCH. The
 * point of this class is to avoid "propagating" each overload on
 * "thing which can be parsed" through the factory methods: each source is a
 * Parseable, and all of them are loaded the same way.
 */
public abstract class Parseable {
    private static final Logger log = LoggerFactory.getLogger(Parseable.class);

    final private ConfigParseOptions options;

    protected Parseable(ConfigParseOptions options) {
        this.options = options;
    }

    // opening happens here and not in the constructor, so failures surface
    // from parse(). A missing source must be a FileNotFoundException, which
    // is what allow-missing looks for.
    protected abstract Reader reader() throws IOException;

    protected abstract ConfigOrigin createOrigin();

    protected static void trace(String message) {
        if (log.isDebugEnabled())
            log.debug(message);
    }

    public ConfigParseOptions options() {
        return options;
    }

    public final ConfigOrigin origin() {
        if (options.getOriginDescription() != null)
            return SimpleConfigOrigin.newSimple(options.getOriginDescription());
        else
            return createOrigin();
    }

    public final Configuration parse() {
        ConfigOrigin origin = origin();
        String text;
        try {
            text = readAll();
        } catch (FileNotFoundException e) {
            if (options.getAllowMissing()) {
                trace(origin.description() + " not found, using an empty configuration");
                return new Configuration(options.getResolveOptions(), options.getReadOnly());
            } else {
                throw new ConfigException.IO(origin, e.getMessage(), e);
            }
        } catch (IOException e) {
            throw new ConfigException.IO(origin, e.getMessage(), e);
        }
        return parseText(origin, text);
    }

    private String readAll() throws IOException {
        Reader reader = reader();
        try {
            StringBuilder sb = new StringBuilder();
            char[] buf = new char[4096];
            int n;
            while ((n = reader.read(buf)) >= 0)
                sb.append(buf, 0, n);
            return sb.toString();
        } finally {
            reader.close();
        }
    }

    private Configuration parseText(ConfigOrigin origin, String text) {
        if (options.getProcessIncludes())
            text = new IncludePreprocessor(includer(), options.getResolveOptions()).process(text);
        return Parser.parse(Tokenizer.tokenize(origin, text), options);
    }

    private ConfigIncluder includer() {
        if (options.getIncluder() != null)
            return options.getIncluder();
        return new FileIncluder(options.getIncludeRoot());
    }

    private static Reader readerFromStream(InputStream input) {
        return new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    private final static class ParseableString extends Parseable {
        final private String input;

        ParseableString(String input, ConfigParseOptions options) {
            super(options);
            this.input = input;
        }

        @Override
        protected Reader reader() {
            trace("Loading config from a String");
            return new StringReader(input);
        }

        @Override
        protected ConfigOrigin createOrigin() {
            return SimpleConfigOrigin.newSimple("String");
        }
    }

    public static Parseable newString(String input, ConfigParseOptions options) {
        if (input == null)
            throw new ConfigException.BugOrBroken("null string to parse");
        return new ParseableString(input, options);
    }

    private final static class ParseableReader extends Parseable {
        final private Reader reader;

        ParseableReader(Reader reader, ConfigParseOptions options) {
            super(options);
            this.reader = reader;
        }

        @Override
        protected Reader reader() {
            trace("Loading config from reader " + reader);
            // the caller owns the reader, so keep it open
            return new FilterReader(reader) {
                @Override
                public void close() {
                    // NOTHING.
                }
            };
        }

        @Override
        protected ConfigOrigin createOrigin() {
            return SimpleConfigOrigin.newSimple("Reader");
        }
    }

    /**
     * The reader stays open after parsing; closing it is up to the caller.
     */
    public static Parseable newReader(Reader reader, ConfigParseOptions options) {
        return new ParseableReader(reader, options);
    }

    private final static class ParseableFile extends Parseable {
        final private File input;

        ParseableFile(File input, ConfigParseOptions options) {
            super(options);
            this.input = input;
        }

        @Override
        protected Reader reader() throws IOException {
            trace("Loading config from a file: " + input);
            if (!input.isFile())
                throw new FileNotFoundException(input.getPath() + " is not a readable file");
            return readerFromStream(new FileInputStream(input));
        }

        @Override
        protected ConfigOrigin createOrigin() {
            return SimpleConfigOrigin.newFile(input);
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "(" + input.getPath() + ")";
        }
    }

    public static Parseable newFile(File input, ConfigParseOptions options) {
        return new ParseableFile(input, options);
    }

    private final static class ParseableResources extends Parseable {
        final private ClassLoader loader;
        final private String resource;

        ParseableResources(ClassLoader loader, String resource, ConfigParseOptions options) {
            super(options);
            this.loader = loader;
            this.resource = resource;
        }

        @Override
        protected Reader reader() throws IOException {
            URL url = loader.getResource(resource);
            if (url == null)
                throw new FileNotFoundException("resource not found on classpath: " + resource);
            trace("Loading config from resource '" + resource + "' URL " + url.toExternalForm());
            return readerFromStream(url.openStream());
        }

        @Override
        protected ConfigOrigin createOrigin() {
            return SimpleConfigOrigin.newSimple(resource + " on classpath");
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "(" + resource + ")";
        }
    }

    public static Parseable newResources(ClassLoader loader, String resource,
            ConfigParseOptions options) {
        if (loader == null)
            throw new ConfigException.BugOrBroken("null class loader");
        // class loaders don't want the leading slash
        if (resource.startsWith("/"))
            resource = resource.substring(1);
        return new ParseableResources(loader, resource, options);
    }
}
