/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.laconic.config.ConfigException;

/**
 * A parsed navigation path such as <code>!/servers/srv[name=main]/$port</code>.
 */
final class Path {

    enum Kind {
        PARENT, CHILD, ATTRIBUTE, CHILD_INDEX, ATTRIBUTE_INDEX, CHILD_BY_ATTRIBUTE, CHILD_BY_VALUE
    }

    static final class Segment {
        final private Kind kind;
        final private String name;
        final private int index;
        final private String queryName;
        final private String queryValue;

        private Segment(Kind kind, String name, int index, String queryName, String queryValue) {
            this.kind = kind;
            this.name = name;
            this.index = index;
            this.queryName = queryName;
            this.queryValue = queryValue;
        }

        Kind kind() {
            return kind;
        }

        String name() {
            return name;
        }

        int index() {
            return index;
        }

        /** attribute name of a CHILD_BY_ATTRIBUTE query */
        String queryName() {
            return queryName;
        }

        String queryValue() {
            return queryValue;
        }

        @Override
        public String toString() {
            switch (kind) {
            case PARENT:
                return "..";
            case ATTRIBUTE:
                return "$" + name;
            case CHILD_INDEX:
                return "[" + index + "]";
            case ATTRIBUTE_INDEX:
                return "$[" + index + "]";
            case CHILD_BY_ATTRIBUTE:
                return name + "[" + queryName + "=" + queryValue + "]";
            case CHILD_BY_VALUE:
                return name + "[" + queryValue + "]";
            default:
                return name;
            }
        }
    }

    final private String original;
    final private boolean required;
    final private boolean absolute;
    final private List<Segment> segments;

    private Path(String original, boolean required, boolean absolute, List<Segment> segments) {
        this.original = original;
        this.required = required;
        this.absolute = absolute;
        this.segments = Collections.unmodifiableList(segments);
    }

    String original() {
        return original;
    }

    boolean required() {
        return required;
    }

    boolean absolute() {
        return absolute;
    }

    List<Segment> segments() {
        return segments;
    }

    static Path newPath(String path) {
        if (ConfigImplUtil.isBlank(path))
            throw new ConfigException.BadPath(path, "path is empty");

        String working = ConfigImplUtil.unicodeTrim(path);
        boolean required = false;
        if (working.startsWith("!")) {
            required = true;
            working = working.substring(1);
        }
        boolean absolute = false;
        if (working.startsWith("/") || working.startsWith("\\")) {
            absolute = true;
            working = working.substring(1);
        }

        List<Segment> segments = new ArrayList<Segment>();
        for (String raw : working.replace('\\', '/').split("/")) {
            String seg = ConfigImplUtil.unicodeTrim(raw);
            if (seg.isEmpty())
                continue;
            segments.add(parseSegment(path, seg));
        }
        return new Path(path, required, absolute, segments);
    }

    private static Segment parseSegment(String path, String seg) {
        if (seg.equals(".."))
            return new Segment(Kind.PARENT, null, -1, null, null);

        boolean attribute = false;
        if (seg.startsWith("$")) {
            attribute = true;
            seg = ConfigImplUtil.unicodeTrim(seg.substring(1));
        }

        if (seg.startsWith("[") && seg.endsWith("]")) {
            int index = parseIndex(path, seg.substring(1, seg.length() - 1));
            return new Segment(attribute ? Kind.ATTRIBUTE_INDEX : Kind.CHILD_INDEX, null, index,
                    null, null);
        }

        if (!attribute && seg.endsWith("]") && seg.indexOf('[') > 0) {
            int open = seg.indexOf('[');
            String name = ConfigImplUtil.unicodeTrim(seg.substring(0, open));
            String query = seg.substring(open + 1, seg.length() - 1);
            int eq = query.indexOf('=');
            // an attribute query wins whenever there is an equals sign
            if (eq >= 0) {
                return new Segment(Kind.CHILD_BY_ATTRIBUTE, name, -1,
                        ConfigImplUtil.unicodeTrim(query.substring(0, eq)),
                        query.substring(eq + 1));
            } else {
                return new Segment(Kind.CHILD_BY_VALUE, name, -1, null, query);
            }
        }

        if (attribute)
            return new Segment(Kind.ATTRIBUTE, seg, -1, null, null);
        else
            return new Segment(Kind.CHILD, seg, -1, null, null);
    }

    private static int parseIndex(String path, String text) {
        try {
            return Integer.parseInt(ConfigImplUtil.unicodeTrim(text));
        } catch (NumberFormatException e) {
            throw new ConfigException.BadPath(path, "invalid index '" + text + "'", e);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Path(");
        if (required)
            sb.append('!');
        if (absolute)
            sb.append('/');
        for (int i = 0; i < segments.size(); ++i) {
            if (i > 0)
                sb.append('/');
            sb.append(segments.get(i));
        }
        sb.append(')');
        return sb.toString();
    }
}
