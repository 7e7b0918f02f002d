/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.laconic.config.ConfigException;
import io.laconic.config.ConfigIncluder;
import io.laconic.config.ConfigResolveOptions;

/**
 * Replaces <code>#include&lt;name&gt;</code> lines with the text they name
 * before the source is tokenized. A name starting with <code>!</code> is
 * required; a missing optional include becomes an empty line. Environment
 * variables (<code>$(~NAME)</code>) in the name are expanded first. Included
 * text is processed the same way, down to {@link #MAX_INCLUDE_DEPTH} levels.
 */
final class IncludePreprocessor {
    private static final Logger log = LoggerFactory.getLogger(IncludePreprocessor.class);

    static final int MAX_INCLUDE_DEPTH = 8;

    private static final Pattern INCLUDE = Pattern.compile("#include<(.*)>");

    final private ConfigIncluder includer;
    final private ConfigResolveOptions options;

    IncludePreprocessor(ConfigIncluder includer, ConfigResolveOptions options) {
        this.includer = includer;
        this.options = options;
    }

    String process(String text) {
        return process(text, 0);
    }

    private String process(String text, int depth) {
        // cheap check first, most sources include nothing
        if (!text.contains("#include<"))
            return text;

        StringBuilder sb = new StringBuilder(text.length());
        int lineStart = 0;
        while (lineStart < text.length()) {
            int newline = text.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? text.length() : newline;
            String line = text.substring(lineStart, lineEnd);

            Matcher m = INCLUDE.matcher(ConfigImplUtil.unicodeTrim(line));
            if (m.matches())
                sb.append(include(m.group(1), depth));
            else
                sb.append(line);

            if (newline < 0)
                break;
            sb.append('\n');
            lineStart = newline + 1;
        }
        return sb.toString();
    }

    private String include(String argument, int depth) {
        String name = ConfigImplUtil.unicodeTrim(argument);
        boolean required = false;
        if (name.startsWith("!")) {
            required = true;
            name = ConfigImplUtil.unicodeTrim(name.substring(1));
        }
        name = expandEnvironment(name);
        if (name.isEmpty())
            throw new ConfigException.Include("Include line '#include<" + argument
                    + ">' names nothing");

        if (depth + 1 > MAX_INCLUDE_DEPTH)
            throw new ConfigException.Include("Includes nest deeper than " + MAX_INCLUDE_DEPTH
                    + " levels at '" + name + "'");

        String included = includer.include(name);
        if (included == null) {
            if (required)
                throw new ConfigException.Include("Required include '" + name + "' not found");
            if (log.isDebugEnabled())
                log.debug("Optional include '{}' not found, skipping it", name);
            return "";
        }
        if (log.isDebugEnabled())
            log.debug("Including '{}' ({} chars) at depth {}", name, included.length(), depth + 1);
        return process(included, depth + 1);
    }

    // only environment variables are known before the tree exists
    private String expandEnvironment(String name) {
        String start = options.getVariableStart();
        String end = options.getVariableEnd();
        String envModifier = options.getEnvModifier();

        StringBuilder sb = new StringBuilder();
        int from = 0;
        while (true) {
            int s = name.indexOf(start, from);
            if (s < 0)
                break;
            int e = name.indexOf(end, s + start.length());
            if (e < 0)
                break;
            String expression = ConfigImplUtil.unicodeTrim(name.substring(s + start.length(), e));
            sb.append(name, from, s);
            if (expression.startsWith(envModifier)) {
                sb.append(environmentValue(expression, expression.substring(envModifier.length())));
            } else {
                sb.append(name, s, e + end.length());
            }
            from = e + end.length();
        }
        sb.append(name.substring(from));
        return sb.toString();
    }

    private String environmentValue(String expression, String variable) {
        boolean required = false;
        if (variable.startsWith("!")) {
            required = true;
            variable = variable.substring(1);
        }
        String v = variable.isEmpty() ? null : options.getEnvironmentResolver().getEnv(variable);
        if (v == null) {
            if (required)
                throw new ConfigException.UnresolvedSubstitution(expression,
                        "required environment variable '" + variable + "' is not set");
            return "";
        }
        return v;
    }
}
