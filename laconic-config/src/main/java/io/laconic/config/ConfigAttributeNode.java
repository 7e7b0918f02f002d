/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

import io.laconic.config.impl.PathResolver;

/**
 * A leaf of a {@link Configuration} tree: a name with a value.
 */
public final class ConfigAttributeNode extends ConfigNode {

    ConfigAttributeNode(Configuration configuration, ConfigSectionNode parent, String name,
            String value, boolean sentinel) {
        super(configuration, parent, name, value, sentinel);
    }

    @Override
    public boolean isSection() {
        return false;
    }

    @Override
    public boolean isAttribute() {
        return true;
    }

    /**
     * Navigates starting at this attribute, so <code>..</code> is its parent
     * section. Other relative segments need a section and must come after a
     * <code>..</code>.
     */
    @Override
    public ConfigNode navigate(String path) {
        return PathResolver.navigate(this, path);
    }

    /** Removes this attribute from its parent section. */
    @Override
    public void delete() {
        checkCanModify();
        parent.removeAttribute(this);
    }
}
