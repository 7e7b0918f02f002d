/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import io.laconic.config.ConfigException;
import io.laconic.config.ConfigNode;
import io.laconic.config.ConfigSectionNode;
import io.laconic.config.Configuration;

/** This is public just for the "config" package to use, don't touch it */
public final class PathResolver {
    private PathResolver() {
    }

    /**
     * Reads the value a bracket query compares against. During expansion the
     * reader expands under the active resolver and its cycle detection.
     */
    interface ValueReader {
        String read(ConfigNode node);
    }

    private static final ValueReader NODE_VALUE = new ValueReader() {
        @Override
        public String read(ConfigNode node) {
            return node.value();
        }
    };

    public static ConfigNode navigate(ConfigNode start, String pathExpression) {
        return navigate(start, pathExpression, NODE_VALUE);
    }

    static ConfigNode navigate(ConfigNode start, String pathExpression, ValueReader reader) {
        Path path = Path.newPath(pathExpression);
        Configuration configuration = start.configuration();

        ConfigNode current = path.absolute() ? configuration.root() : start;
        for (Path.Segment seg : path.segments()) {
            if (!current.exists())
                break;
            if (seg.kind() == Path.Kind.PARENT) {
                current = current.parent();
                continue;
            }
            if (!current.isSection())
                throw new ConfigException.BadPath(path.original(), "Path segment is not a section: '"
                        + seg + "' follows attribute '" + current.name() + "'");

            ConfigSectionNode section = (ConfigSectionNode) current;
            switch (seg.kind()) {
            case CHILD:
                current = section.getChild(seg.name());
                break;
            case ATTRIBUTE:
                current = section.attrByName(seg.name());
                break;
            case CHILD_INDEX:
                current = section.childByIndex(seg.index());
                break;
            case ATTRIBUTE_INDEX:
                current = section.attrByIndex(seg.index());
                break;
            case CHILD_BY_ATTRIBUTE:
                current = findByAttribute(section, seg.name(), seg.queryName(), seg.queryValue(),
                        reader);
                break;
            case CHILD_BY_VALUE:
                current = findByValue(section, seg.name(), seg.queryValue(), reader);
                break;
            default:
                throw new ConfigException.BugOrBroken("unhandled path segment " + seg);
            }
        }

        if (path.required() && !current.exists())
            throw new ConfigException.Missing(path.original());
        return current;
    }

    private static ConfigSectionNode findByAttribute(ConfigSectionNode section, String name,
            String attrName, String attrValue, ValueReader reader) {
        for (ConfigSectionNode child : section.children()) {
            if (child.isSameName(name)
                    && ConfigImplUtil.equalsIgnoreCase(reader.read(child.attrByName(attrName)),
                            attrValue))
                return child;
        }
        return section.configuration().emptySection();
    }

    private static ConfigSectionNode findByValue(ConfigSectionNode section, String name,
            String value, ValueReader reader) {
        for (ConfigSectionNode child : section.children()) {
            if (child.isSameName(name) && ConfigImplUtil.equalsIgnoreCase(reader.read(child), value))
                return child;
        }
        return section.configuration().emptySection();
    }
}
