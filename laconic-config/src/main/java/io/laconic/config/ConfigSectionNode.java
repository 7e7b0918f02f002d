/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

import java.util.ArrayList;
import java.util.List;

import io.laconic.config.impl.ConfigRenderer;
import io.laconic.config.impl.PathResolver;

/**
 * A section of a {@link Configuration} tree: a node with an optional value,
 * an ordered list of child sections and an ordered list of attributes. Names
 * may repeat among siblings; insertion order is kept.
 */
public final class ConfigSectionNode extends ConfigNode {

    final private List<ConfigSectionNode> children;
    final private List<ConfigAttributeNode> attributes;

    ConfigSectionNode(Configuration configuration, ConfigSectionNode parent, String name,
            String value, boolean sentinel) {
        super(configuration, parent, name, value, sentinel);
        this.children = new ArrayList<ConfigSectionNode>();
        this.attributes = new ArrayList<ConfigAttributeNode>();
    }

    @Override
    public boolean isSection() {
        return true;
    }

    @Override
    public boolean isAttribute() {
        return false;
    }

    /** @return a copy of the child sections in order */
    public List<ConfigSectionNode> children() {
        return new ArrayList<ConfigSectionNode>(children);
    }

    /** @return a copy of the attributes in order */
    public List<ConfigAttributeNode> attributes() {
        return new ArrayList<ConfigAttributeNode>(attributes);
    }

    public int childCount() {
        return children.size();
    }

    public int attributeCount() {
        return attributes.size();
    }

    public ConfigSectionNode addChildNode(String name) {
        return addChildNode(name, null);
    }

    public ConfigSectionNode addChildNode(String name, String value) {
        checkCanModify();
        ConfigSectionNode node = appendChild(name, value);
        modified = true;
        return node;
    }

    public ConfigAttributeNode addAttributeNode(String name) {
        return addAttributeNode(name, null);
    }

    public ConfigAttributeNode addAttributeNode(String name, String value) {
        checkCanModify();
        ConfigAttributeNode node = appendAttribute(name, value);
        modified = true;
        return node;
    }

    // no guards, used to build trees that are already read-only
    ConfigSectionNode appendChild(String name, String value) {
        ConfigSectionNode node = new ConfigSectionNode(configuration(), this, name, value, false);
        children.add(node);
        return node;
    }

    ConfigAttributeNode appendAttribute(String name, String value) {
        ConfigAttributeNode node = new ConfigAttributeNode(configuration(), this, name, value,
                false);
        attributes.add(node);
        return node;
    }

    /**
     * Removes the given child, which then no longer exists. Does nothing if
     * the node is not a child of this section.
     */
    public void removeChild(ConfigSectionNode node) {
        checkCanModify();
        if (children.remove(node)) {
            node.parent = null;
            modified = true;
        }
    }

    /**
     * Removes the given attribute, which then no longer exists. Does nothing if
     * the node is not an attribute of this section.
     */
    public void removeAttribute(ConfigAttributeNode node) {
        checkCanModify();
        if (attributes.remove(node)) {
            node.parent = null;
            modified = true;
        }
    }

    public void clearChildren() {
        checkCanModify();
        for (ConfigSectionNode child : children)
            child.parent = null;
        children.clear();
        modified = true;
    }

    public void clearAttributes() {
        checkCanModify();
        for (ConfigAttributeNode attr : attributes)
            attr.parent = null;
        attributes.clear();
        modified = true;
    }

    /** @return the first child section with the name, or the empty section */
    public ConfigSectionNode getChild(String name) {
        for (ConfigSectionNode child : children) {
            if (child.isSameName(name))
                return child;
        }
        return configuration().emptySection();
    }

    /** @return the first attribute with the name, or the empty attribute */
    public ConfigAttributeNode attrByName(String name) {
        for (ConfigAttributeNode attr : attributes) {
            if (attr.isSameName(name))
                return attr;
        }
        return configuration().emptyAttribute();
    }

    public ConfigSectionNode childByIndex(int index) {
        if (index >= 0 && index < children.size())
            return children.get(index);
        return configuration().emptySection();
    }

    public ConfigAttributeNode attrByIndex(int index) {
        if (index >= 0 && index < attributes.size())
            return attributes.get(index);
        return configuration().emptyAttribute();
    }

    /**
     * Finds a node by path.
     *
     * <ul>
     * <li>a leading <code>!</code> makes the path required: if the final node
     * does not exist {@link ConfigException.Missing} is thrown</li>
     * <li>a leading <code>/</code> or <code>\</code> starts at the root,
     * otherwise the path is relative to this section</li>
     * <li>segments are separated by <code>/</code> or <code>\</code>; empty
     * segments are ignored</li>
     * <li><code>..</code> is the parent</li>
     * <li><code>$name</code> is an attribute; <code>[n]</code> and
     * <code>$[n]</code> select a child section or attribute by position</li>
     * <li><code>name[attr=value]</code> is the first child section called
     * name whose attribute matches the value; <code>name[value]</code> matches
     * the section's own value; both compare ignoring case</li>
     * </ul>
     *
     * Navigation stops as soon as it reaches a node that does not exist and
     * returns that sentinel.
     *
     * @param path
     *            path expression
     * @return the node found, or a sentinel
     * @throws ConfigException.BadPath
     *             if the path is blank, has a non-numeric index, or continues
     *             past an attribute
     */
    @Override
    public ConfigNode navigate(String path) {
        return PathResolver.navigate(this, path);
    }

    /**
     * Removes this section from its parent; deleting the root destroys the
     * configuration's tree.
     */
    @Override
    public void delete() {
        checkCanModify();
        if (!parent().exists())
            configuration().destroy();
        else
            parent.removeChild(this);
    }

    @Override
    public void resetModified() {
        super.resetModified();
        for (ConfigSectionNode child : children)
            child.resetModified();
        for (ConfigAttributeNode attr : attributes)
            attr.resetModified();
    }

    /**
     * @return this section and everything below it as Laconic text
     */
    public String render() {
        return ConfigRenderer.render(this);
    }
}
