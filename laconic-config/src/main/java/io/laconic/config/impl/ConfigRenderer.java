/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import io.laconic.config.ConfigAttributeNode;
import io.laconic.config.ConfigSectionNode;

/**
 * Writes a section tree back as Laconic text. Verbatim values are written, so
 * variables survive a round trip unexpanded. Names and values that can't be
 * read back as a bare identifier are quoted. Within a section attributes come
 * before child sections.
 *
 * <p>
 * This is public just for the "config" package to use, don't touch it
 */
public final class ConfigRenderer {
    private static final String INDENT = "  ";

    private ConfigRenderer() {
    }

    public static String render(ConfigSectionNode section) {
        StringBuilder sb = new StringBuilder();
        renderSection(sb, section, 0);
        return sb.toString();
    }

    private static void indent(StringBuilder sb, int level) {
        for (int i = 0; i < level; ++i)
            sb.append(INDENT);
    }

    private static void renderSection(StringBuilder sb, ConfigSectionNode section, int level) {
        indent(sb, level);
        sb.append(ConfigImplUtil.renderBareOrQuoted(section.name()));
        String value = section.verbatimValue();
        if (value != null) {
            sb.append('=');
            sb.append(ConfigImplUtil.renderBareOrQuoted(value));
        }
        sb.append(" {\n");
        for (ConfigAttributeNode attr : section.attributes()) {
            indent(sb, level + 1);
            sb.append(ConfigImplUtil.renderBareOrQuoted(attr.name()));
            sb.append('=');
            // an attribute needs a value to parse, so null is written as ""
            String v = attr.verbatimValue();
            sb.append(ConfigImplUtil.renderBareOrQuoted(v != null ? v : ""));
            sb.append('\n');
        }
        for (ConfigSectionNode child : section.children())
            renderSection(sb, child, level + 1);
        indent(sb, level);
        sb.append("}\n");
    }
}
