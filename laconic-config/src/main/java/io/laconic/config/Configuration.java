/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.laconic.config.impl.ConfigRenderer;

/**
 * The owner of a configuration tree. A configuration has at most one root
 * section, created with {@link #create(String, String)} or by the parser
 * through {@link ConfigFactory}; until then {@link #root()} is the empty
 * section sentinel.
 *
 * <p>
 * A configuration is either writable or read-only for its whole life. On a
 * read-only configuration every modification of a node throws
 * {@link ConfigException.ReadOnly}.
 *
 * <p>
 * Instances are not thread-safe: the read-only flag is checked at the start of
 * each modification but is not a synchronization mechanism. Any application
 * that mutates a tree must confine it to one thread.
 */
public final class Configuration {
    private static final Logger log = LoggerFactory.getLogger(Configuration.class);

    public static final String DEFAULT_ROOT_NAME = "config";

    final private boolean readOnly;
    final private ConfigResolveOptions resolveOptions;
    final private ConfigSectionNode emptySection;
    final private ConfigAttributeNode emptyAttribute;
    private ConfigSectionNode root;

    public Configuration() {
        this(ConfigResolveOptions.defaults(), false);
    }

    public Configuration(boolean readOnly) {
        this(ConfigResolveOptions.defaults(), readOnly);
    }

    public Configuration(ConfigResolveOptions resolveOptions, boolean readOnly) {
        if (resolveOptions == null)
            throw new ConfigException.BugOrBroken("null resolve options");
        this.resolveOptions = resolveOptions;
        this.readOnly = readOnly;
        this.emptySection = new ConfigSectionNode(this, null, null, null, true);
        this.emptyAttribute = new ConfigAttributeNode(this, null, null, null, true);
        this.root = null;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public ConfigResolveOptions resolveOptions() {
        return resolveOptions;
    }

    /** @return the root section, or the empty section if there is none */
    public ConfigSectionNode root() {
        return root != null ? root : emptySection;
    }

    ConfigSectionNode rootOrNull() {
        return root;
    }

    /** @return the section sentinel, which never exists */
    public ConfigSectionNode emptySection() {
        return emptySection;
    }

    /** @return the attribute sentinel, which never exists */
    public ConfigAttributeNode emptyAttribute() {
        return emptyAttribute;
    }

    public Configuration create() {
        return create(DEFAULT_ROOT_NAME, null);
    }

    public Configuration create(String rootName) {
        return create(rootName, null);
    }

    /**
     * Replaces the tree with a new root section. Nodes of the previous tree no
     * longer exist afterwards.
     *
     * @param rootName
     *            name of the root section
     * @param rootValue
     *            value of the root section, or null
     * @return this configuration
     */
    public Configuration create(String rootName, String rootValue) {
        this.root = new ConfigSectionNode(this, null, rootName, rootValue, false);
        return this;
    }

    /**
     * Drops the tree. Every node obtained from it observes
     * {@link ConfigNode#exists()} false afterwards.
     */
    public void destroy() {
        if (root != null && log.isDebugEnabled())
            log.debug("Destroying configuration tree rooted at '{}'", root.name());
        this.root = null;
    }

    /**
     * Navigates from the root; see {@link ConfigSectionNode#navigate(String)}.
     *
     * @param path
     *            path expression
     * @return the node found, or a sentinel
     */
    public ConfigNode get(String path) {
        if (root == null)
            return emptySection;
        return root.navigate(path);
    }

    public boolean exists(String path) {
        return get(path).exists();
    }

    /**
     * @param name
     *            environment variable name
     * @return the variable's value from the configured
     *         {@link EnvironmentResolver}, or null when the name is empty or
     *         the variable is not set
     */
    public String resolveEnvVar(String name) {
        if (name == null || name.isEmpty())
            return null;
        return resolveOptions.getEnvironmentResolver().getEnv(name);
    }

    /**
     * Returns a read-only deep copy of this configuration with the same
     * resolve options. Returns this if it is already read-only.
     *
     * @return read-only configuration
     */
    public Configuration asReadOnly() {
        if (readOnly)
            return this;
        Configuration copy = new Configuration(resolveOptions, true);
        if (root != null) {
            copy.root = new ConfigSectionNode(copy, null, root.name(), root.verbatimValue(), false);
            copyContent(root, copy.root);
        }
        return copy;
    }

    private static void copyContent(ConfigSectionNode from, ConfigSectionNode to) {
        for (ConfigAttributeNode attr : from.attributes())
            to.appendAttribute(attr.name(), attr.verbatimValue());
        for (ConfigSectionNode child : from.children())
            copyContent(child, to.appendChild(child.name(), child.verbatimValue()));
    }

    /**
     * @return the tree as Laconic text, or an empty string if there is no
     *         root
     */
    public String render() {
        if (root == null)
            return "";
        return ConfigRenderer.render(root);
    }

    @Override
    public String toString() {
        return "Configuration(" + (root != null ? root.name() : "<empty>")
                + (readOnly ? ", read-only" : "") + ")";
    }
}
