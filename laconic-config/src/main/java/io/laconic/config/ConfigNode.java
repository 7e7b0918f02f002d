/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

import java.time.OffsetDateTime;
import java.util.List;

import io.laconic.config.impl.ConfigImplUtil;
import io.laconic.config.impl.SubstitutionResolver;
import io.laconic.config.impl.ValueParsers;

/**
 * A named node of a {@link Configuration} tree, either a
 * {@link ConfigSectionNode} or a {@link ConfigAttributeNode}.
 *
 * <p>
 * A node holds a name (trimmed, compared case-insensitively) and an optional
 * verbatim value. The {@link #value()} of a node is its verbatim value with
 * <code>$(...)</code> variables expanded at the time of the read; the
 * verbatim value itself never changes because of a read.
 *
 * <p>
 * A node exists while it is attached, through its parent chain, to the
 * current root of its configuration. The sentinel nodes returned for lookups
 * that find nothing never exist, and neither do nodes that were removed or
 * whose configuration was destroyed. A node that does not exist has an empty
 * name and no value, and rejects every modification with
 * {@link ConfigException.Mutation}.
 *
 * <p>
 * The typed accessors ({@link #asInt(int)}, {@link #asBoolean(boolean)} and
 * so on) return their default when the value is null or empty and throw
 * {@link ConfigException.BadValue} when the text can't be converted.
 */
public abstract class ConfigNode {

    final private Configuration configuration;
    final private boolean sentinel;
    // null for the root, sentinels and detached nodes
    ConfigSectionNode parent;
    private String name;
    private String value;
    boolean modified;

    ConfigNode(Configuration configuration, ConfigSectionNode parent, String name, String value,
            boolean sentinel) {
        this.configuration = configuration;
        this.parent = parent;
        this.name = ConfigImplUtil.normalizeName(name);
        this.value = value;
        this.sentinel = sentinel;
        this.modified = false;
    }

    public final Configuration configuration() {
        return configuration;
    }

    /**
     * @return true if this node is attached to the current root of its
     *         configuration
     */
    public final boolean exists() {
        if (sentinel)
            return false;
        ConfigNode top = this;
        while (top.parent != null)
            top = top.parent;
        return top == configuration.rootOrNull();
    }

    public final String name() {
        if (!exists())
            return "";
        return name;
    }

    public final void setName(String name) {
        checkCanModify();
        String newName = ConfigImplUtil.normalizeName(name);
        if (!this.name.equals(newName)) {
            this.name = newName;
            this.modified = true;
        }
    }

    /** @return the raw value as written, or null */
    public final String verbatimValue() {
        if (!exists())
            return null;
        return value;
    }

    /**
     * Returns the value with variables expanded. Sections expand relative to
     * themselves, attributes relative to their parent section.
     *
     * @return the expanded value, or null when the verbatim value is null or
     *         empty
     * @throws ConfigException.Expansion
     *             if a variable can't be expanded
     */
    public final String value() {
        String raw = verbatimValue();
        if (raw == null || raw.isEmpty())
            return null;
        return SubstitutionResolver.evaluate(this, raw);
    }

    public final void setValue(String value) {
        checkCanModify();
        if (!ConfigImplUtil.equalsHandlingNull(this.value, value)) {
            this.value = value;
            this.modified = true;
        }
    }

    /**
     * Expands the variables of arbitrary text the way {@link #value()} does
     * for this node's own value.
     *
     * @param text
     *            text possibly containing variables
     * @return the expanded text, or null for null
     */
    public final String evaluate(String text) {
        if (text == null)
            return null;
        return SubstitutionResolver.evaluate(this, text);
    }

    /** @return the owning section, or the empty section sentinel */
    public final ConfigSectionNode parent() {
        if (parent == null)
            return configuration.emptySection();
        return parent;
    }

    /** @return the topmost section above this node */
    public final ConfigSectionNode root() {
        ConfigNode node = this;
        while (node.parent != null && node.parent.exists())
            node = node.parent;
        if (node instanceof ConfigSectionNode)
            return (ConfigSectionNode) node;
        return configuration.root();
    }

    public final boolean isRoot() {
        return parent == null || !parent.exists();
    }

    public abstract boolean isSection();

    public abstract boolean isAttribute();

    public final boolean isModified() {
        return modified;
    }

    public void resetModified() {
        modified = false;
    }

    /**
     * Returns the location of this node from the root: <code>/</code> for the
     * root itself, <code>/a/b</code> for sections and <code>/a/$port</code>
     * for attributes. When several siblings of the same kind share the name,
     * the segment carries the node's position among them, as in
     * <code>/a/srv[1]</code>.
     *
     * @return the path of this node
     */
    public final String path() {
        if (!parent().exists())
            return "/";
        String prefix = isAttribute() ? "$" : "";
        int index = siblingIndex();
        String segment = index >= 0 ? (prefix + name + "[" + index + "]") : (prefix + name);
        String parentPath = parent.path();
        if (parentPath.endsWith("/"))
            return parentPath + segment;
        else
            return parentPath + "/" + segment;
    }

    private int siblingIndex() {
        List<? extends ConfigNode> siblings = isAttribute() ? parent.attributes() : parent.children();
        int count = 0;
        int found = -1;
        for (ConfigNode sibling : siblings) {
            if (sibling.isSameName(name)) {
                if (sibling == this)
                    found = count;
                count += 1;
            }
        }
        return count > 1 ? found : -1;
    }

    /**
     * Finds a node by path. See {@link ConfigSectionNode#navigate(String)} for
     * the syntax.
     *
     * @param path
     *            path expression
     * @return the node found, or a sentinel
     */
    public abstract ConfigNode navigate(String path);

    /** Removes this node from its parent. */
    public abstract void delete();

    public final boolean isSameName(String otherName) {
        return ConfigImplUtil.equalsIgnoreCase(name(), otherName);
    }

    final void checkCanModify() {
        if (!exists())
            throw new ConfigException.Mutation("Cannot modify empty node");
        if (configuration.isReadOnly())
            throw new ConfigException.ReadOnly("Configuration is read-only");
    }

    private String text(boolean verbatim) {
        return verbatim ? verbatimValue() : value();
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    public final String asString() {
        return asString(null, false);
    }

    public final String asString(String dflt) {
        return asString(dflt, false);
    }

    public final String asString(String dflt, boolean verbatim) {
        String s = text(verbatim);
        return isEmpty(s) ? dflt : s;
    }

    public final int asInt(int dflt) {
        return asInt(dflt, false);
    }

    public final int asInt(int dflt, boolean verbatim) {
        String s = text(verbatim);
        return isEmpty(s) ? dflt : ValueParsers.parseInt(path(), s);
    }

    public final long asLong(long dflt) {
        return asLong(dflt, false);
    }

    public final long asLong(long dflt, boolean verbatim) {
        String s = text(verbatim);
        return isEmpty(s) ? dflt : ValueParsers.parseLong(path(), s);
    }

    public final double asDouble(double dflt) {
        return asDouble(dflt, false);
    }

    public final double asDouble(double dflt, boolean verbatim) {
        String s = text(verbatim);
        return isEmpty(s) ? dflt : ValueParsers.parseDouble(path(), s);
    }

    public final boolean asBoolean(boolean dflt) {
        return asBoolean(dflt, false);
    }

    public final boolean asBoolean(boolean dflt, boolean verbatim) {
        String s = text(verbatim);
        return isEmpty(s) ? dflt : ValueParsers.parseBoolean(path(), s);
    }

    public final OffsetDateTime asDateTime(OffsetDateTime dflt) {
        return asDateTime(dflt, false);
    }

    public final OffsetDateTime asDateTime(OffsetDateTime dflt, boolean verbatim) {
        String s = text(verbatim);
        return isEmpty(s) ? dflt : ValueParsers.parseDateTime(path(), s);
    }

    /**
     * Converts the value with the atom converter of the configuration's
     * {@link ConfigResolveOptions}.
     *
     * @throws ConfigException.Generic
     *             if no atom converter is installed
     */
    public final <T> T asAtom(T dflt) {
        return asAtom(dflt, false);
    }

    public final <T> T asAtom(T dflt, boolean verbatim) {
        String s = text(verbatim);
        if (isEmpty(s))
            return dflt;
        ValueConverter<T> converter = installedConverter(
                configuration.resolveOptions().getAtomConverter(), "atom");
        return convert(converter, s, "invalid atom value");
    }

    /**
     * Converts the value with the entity id converter of the configuration's
     * {@link ConfigResolveOptions}.
     *
     * @throws ConfigException.Generic
     *             if no entity id converter is installed
     */
    public final <T> T asEntityId(T dflt) {
        return asEntityId(dflt, false);
    }

    public final <T> T asEntityId(T dflt, boolean verbatim) {
        String s = text(verbatim);
        if (isEmpty(s))
            return dflt;
        ValueConverter<T> converter = installedConverter(
                configuration.resolveOptions().getEntityIdConverter(), "entityid");
        return convert(converter, s, "invalid entityid value");
    }

    public final <T> T as(ValueConverter<T> converter, T dflt) {
        return as(converter, dflt, false);
    }

    public final <T> T as(ValueConverter<T> converter, T dflt, boolean verbatim) {
        if (converter == null)
            throw new ConfigException.BugOrBroken("null converter");
        String s = text(verbatim);
        if (isEmpty(s))
            return dflt;
        return convert(converter, s, "invalid value");
    }

    @SuppressWarnings("unchecked")
    private static <T> ValueConverter<T> installedConverter(ValueConverter<?> converter,
            String what) {
        if (converter == null)
            throw new ConfigException.Generic("No " + what
                    + " converter installed in the resolve options");
        return (ValueConverter<T>) converter;
    }

    private <T> T convert(ValueConverter<T> converter, String s, String failure) {
        try {
            return converter.convert(s);
        } catch (ConfigException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigException.BadValue(path(), failure, e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + path() + ")";
    }
}
