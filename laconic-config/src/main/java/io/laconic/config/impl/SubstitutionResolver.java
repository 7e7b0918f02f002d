/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import java.util.HashSet;
import java.util.Set;

import io.laconic.config.ConfigException;
import io.laconic.config.ConfigNode;
import io.laconic.config.ConfigResolveOptions;
import io.laconic.config.VariableResolver;

/**
 * Expands <code>$(...)</code> variables in node values. One instance lives for
 * a single top-level read and remembers which variables are being resolved
 * against which node, so that values referring back to themselves through any
 * chain of other values are reported instead of recursing forever.
 *
 * <p>
 * This is public just for the "config" package to use, don't touch it
 */
public final class SubstitutionResolver {
    static final int MAX_ITERATIONS = 1000;

    private static final class ResolvingKey {
        ResolvingKey(ConfigNode context, String expression) {
            this.context = context;
            this.expression = expression;
        }

        final private ConfigNode context;
        final private String expression;

        @Override
        public final int hashCode() {
            return 41 * (41 + System.identityHashCode(context)) + expression.hashCode();
        }

        @Override
        public final boolean equals(Object other) {
            if (other instanceof ResolvingKey) {
                ResolvingKey o = (ResolvingKey) other;
                return o.context == this.context && o.expression.equals(this.expression);
            } else {
                return false;
            }
        }
    }

    final private ConfigResolveOptions options;
    final private Set<ResolvingKey> resolving;
    // values compared by bracket queries, expanded under this resolver
    final private PathResolver.ValueReader queryValues = new PathResolver.ValueReader() {
        @Override
        public String read(ConfigNode node) {
            String raw = node.verbatimValue();
            if (raw == null || raw.isEmpty())
                return null;
            return expand(contextOf(node), raw);
        }
    };

    private SubstitutionResolver(ConfigResolveOptions options) {
        this.options = options;
        this.resolving = new HashSet<ResolvingKey>();
    }

    /**
     * Expands the variables of raw text read from the given node. Sections
     * evaluate against themselves, attributes against their parent section
     * when it exists.
     *
     * @param node
     *            node the text belongs to
     * @param raw
     *            text to expand
     * @return the expanded text
     */
    public static String evaluate(ConfigNode node, String raw) {
        SubstitutionResolver resolver = new SubstitutionResolver(node.configuration()
                .resolveOptions());
        return resolver.expand(contextOf(node), raw);
    }

    private static ConfigNode contextOf(ConfigNode node) {
        if (node.isAttribute() && node.parent().exists())
            return node.parent();
        return node;
    }

    private String expand(ConfigNode context, String raw) {
        String escape = options.getVariableEscape();
        if (raw.startsWith(escape))
            return raw.substring(escape.length());

        String start = options.getVariableStart();
        String end = options.getVariableEnd();

        String result = raw;
        int iterations = 0;
        while (true) {
            if (iterations > MAX_ITERATIONS)
                throw new ConfigException.Expansion("Variable expansion of '" + raw
                        + "' exceeded max iterations (" + MAX_ITERATIONS + ")");
            iterations += 1;

            int startIndex = result.indexOf(start);
            if (startIndex < 0)
                break;
            int endIndex = result.indexOf(end, startIndex + start.length());
            // an unterminated variable is left as literal text
            if (endIndex < 0)
                break;

            String expression = ConfigImplUtil.unicodeTrim(result.substring(
                    startIndex + start.length(), endIndex));
            ResolvingKey key = new ResolvingKey(context, expression);
            if (!resolving.add(key))
                throw new ConfigException.SubstitutionCycle(expression);
            try {
                String replacement = resolveVariable(context, expression);
                result = result.substring(0, startIndex) + replacement
                        + result.substring(endIndex + end.length());
            } finally {
                resolving.remove(key);
            }
        }
        return result;
    }

    private String resolveVariable(ConfigNode context, String expression) {
        if (expression.isEmpty())
            return "";

        VariableResolver custom = options.getVariableResolver();
        if (custom != null) {
            String v = custom.resolve(context, expression);
            if (v != null)
                return v;
        }

        String envModifier = options.getEnvModifier();
        if (expression.startsWith(envModifier)) {
            String name = expression.substring(envModifier.length());
            boolean required = false;
            if (name.startsWith("!")) {
                required = true;
                name = name.substring(1);
            }
            String v = context.configuration().resolveEnvVar(name);
            if (v == null) {
                if (required)
                    throw new ConfigException.UnresolvedSubstitution(expression,
                            "required environment variable '" + name + "' is not set");
                return "";
            }
            return v;
        }

        String pathModifier = options.getPathModifier();
        if (expression.startsWith(pathModifier))
            return resolvePath(context, expression.substring(pathModifier.length()));
        return resolvePath(context, expression);
    }

    private String resolvePath(ConfigNode context, String path) {
        ConfigNode target = PathResolver.navigate(context, path, queryValues);
        String raw = target.verbatimValue();
        if (raw == null || raw.isEmpty())
            return "";
        return expand(contextOf(target), raw);
    }
}
