/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;


/**
 * All exceptions thrown by the library are subclasses of
 * <code>ConfigException</code>.
 */
public abstract class ConfigException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    final private transient ConfigOrigin origin;

    protected ConfigException(ConfigOrigin origin, String message,
            Throwable cause) {
        super(origin.description() + ": " + message, cause);
        this.origin = origin;
    }

    protected ConfigException(ConfigOrigin origin, String message) {
        this(origin, message, null);
    }

    protected ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.origin = null;
    }

    protected ConfigException(String message) {
        this(message, null);
    }

    /**
     * Returns an "origin" (such as a filename, line and column) for the
     * exception, or null if none is available. Only exceptions raised while
     * reading source text carry an origin; never assume this will return
     * non-null.
     *
     * @return origin of the problem, or null if unknown/inapplicable
     */
    public ConfigOrigin origin() {
        return origin;
    }

    /**
     * Exception indicating that the configuration source is malformed: an
     * unexpected token, a missing value or body, or an unexpected end of
     * input.
     */
    public static class Parse extends ConfigException {
        private static final long serialVersionUID = 1L;

        public Parse(ConfigOrigin origin, String message, Throwable cause) {
            super(origin, message, cause);
        }

        public Parse(ConfigOrigin origin, String message) {
            this(origin, message, null);
        }
    }

    /**
     * Exception indicating that the source text could not be split into
     * tokens: an unterminated string, verbatim string or comment, an
     * unexpected character or an invalid escape sequence.
     */
    public static class Lex extends Parse {
        private static final long serialVersionUID = 1L;

        public Lex(ConfigOrigin origin, String message, Throwable cause) {
            super(origin, message, cause);
        }

        public Lex(ConfigOrigin origin, String message) {
            this(origin, message, null);
        }
    }

    /**
     * Base of the exceptions raised while navigating a path.
     */
    public static class Navigation extends ConfigException {
        private static final long serialVersionUID = 1L;

        protected Navigation(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Exception indicating that a path expression was invalid: blank, with a
     * non-numeric index, or continuing past an attribute.
     */
    public static class BadPath extends Navigation {
        private static final long serialVersionUID = 1L;

        public BadPath(String path, String message, Throwable cause) {
            super(path != null ? ("Invalid path '" + path + "': " + message)
                    : message, cause);
        }

        public BadPath(String path, String message) {
            this(path, message, null);
        }
    }

    /**
     * Exception indicating that a required path (one starting with
     * <code>!</code>) did not lead to an existing node.
     */
    public static class Missing extends Navigation {
        private static final long serialVersionUID = 1L;

        public Missing(String path, Throwable cause) {
            super("Required configuration node not found at path '" + path + "'", cause);
        }

        public Missing(String path) {
            this(path, null);
        }
    }

    /**
     * Exception indicating that variable expansion could not complete.
     * Thrown as-is when expansion exceeds its iteration ceiling.
     */
    public static class Expansion extends ConfigException {
        private static final long serialVersionUID = 1L;

        public Expansion(String message, Throwable cause) {
            super(message, cause);
        }

        public Expansion(String message) {
            this(message, null);
        }
    }

    /**
     * Exception indicating that a required substitution, such as
     * <code>$(~!NAME)</code>, did not resolve to a value.
     */
    public static class UnresolvedSubstitution extends Expansion {
        private static final long serialVersionUID = 1L;

        public UnresolvedSubstitution(String expression, String message) {
            super("Could not resolve substitution '" + expression + "': " + message);
        }
    }

    /**
     * Exception indicating that a substitution refers back to itself, directly
     * or through other values.
     */
    public static class SubstitutionCycle extends Expansion {
        private static final long serialVersionUID = 1L;

        public SubstitutionCycle(String expression) {
            super("Recursive variable expansion of '" + expression + "'");
        }
    }

    /**
     * Exception indicating that a value was messed up, for example you may have
     * asked for an int and the value can't be sensibly parsed as one.
     */
    public static class BadValue extends ConfigException {
        private static final long serialVersionUID = 1L;

        public BadValue(String path, String message, Throwable cause) {
            super("Invalid value at '" + path + "': " + message, cause);
        }

        public BadValue(String path, String message) {
            this(path, message, null);
        }
    }

    /**
     * Exception indicating an attempt to modify a node that does not exist
     * (a sentinel or a detached node).
     */
    public static class Mutation extends ConfigException {
        private static final long serialVersionUID = 1L;

        public Mutation(String message) {
            super(message);
        }
    }

    /**
     * Exception indicating an attempt to modify a read-only configuration.
     */
    public static class ReadOnly extends Mutation {
        private static final long serialVersionUID = 1L;

        public ReadOnly(String message) {
            super(message);
        }
    }

    /**
     * Exception indicating that there was an IO error.
     */
    public static class IO extends ConfigException {
        private static final long serialVersionUID = 1L;

        public IO(ConfigOrigin origin, String message, Throwable cause) {
            super(origin, message, cause);
        }

        public IO(ConfigOrigin origin, String message) {
            this(origin, message, null);
        }
    }

    /**
     * Exception indicating that an <code>#include&lt;...&gt;</code> line could
     * not be satisfied: a required include is missing or includes nest too
     * deeply.
     */
    public static class Include extends ConfigException {
        private static final long serialVersionUID = 1L;

        public Include(String message, Throwable cause) {
            super(message, cause);
        }

        public Include(String message) {
            this(message, null);
        }
    }

    /**
     * Exception indicating that there's a bug in something (possibly the
     * library itself) or the runtime environment is broken. This exception
     * should never be handled; instead, something should be fixed to keep the
     * exception from occurring.
     */
    public static class BugOrBroken extends ConfigException {
        private static final long serialVersionUID = 1L;

        public BugOrBroken(String message, Throwable cause) {
            super(message, cause);
        }

        public BugOrBroken(String message) {
            this(message, null);
        }
    }

    /**
     * Exception that doesn't fall into any other category.
     */
    public static class Generic extends ConfigException {
        private static final long serialVersionUID = 1L;

        public Generic(String message, Throwable cause) {
            super(message, cause);
        }

        public Generic(String message) {
            this(message, null);
        }
    }

}
