/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import java.io.File;
import java.io.Serializable;

import io.laconic.config.ConfigOrigin;

/** This is public just for the "config" package to use, don't touch it */
public final class SimpleConfigOrigin implements ConfigOrigin, Serializable {

    private static final long serialVersionUID = 1L;

    final private String description;
    final private String filenameOrNull;
    final private int lineNumber;
    final private int columnNumber;
    final private int offset;

    private SimpleConfigOrigin(String description, String filenameOrNull, int lineNumber,
            int columnNumber, int offset) {
        this.description = description;
        this.filenameOrNull = filenameOrNull;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
        this.offset = offset;
    }

    public static SimpleConfigOrigin newSimple(String description) {
        return new SimpleConfigOrigin(description, null, -1, -1, -1);
    }

    public static SimpleConfigOrigin newFile(File file) {
        return new SimpleConfigOrigin(file.getPath(), file.getPath(), -1, -1, -1);
    }

    SimpleConfigOrigin setPosition(int lineNumber, int columnNumber, int offset) {
        if (lineNumber == this.lineNumber && columnNumber == this.columnNumber
                && offset == this.offset) {
            return this;
        } else {
            return new SimpleConfigOrigin(this.description, this.filenameOrNull, lineNumber,
                    columnNumber, offset);
        }
    }

    @Override
    public String description() {
        if (lineNumber < 0) {
            return description;
        } else if (columnNumber < 0) {
            return description + ": " + lineNumber;
        } else {
            return description + ": " + lineNumber + ":" + columnNumber;
        }
    }

    @Override
    public String filename() {
        return filenameOrNull;
    }

    @Override
    public int lineNumber() {
        return lineNumber;
    }

    @Override
    public int columnNumber() {
        return columnNumber;
    }

    @Override
    public int offset() {
        return offset;
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof SimpleConfigOrigin) {
            SimpleConfigOrigin otherOrigin = (SimpleConfigOrigin) other;

            return this.description.equals(otherOrigin.description)
                    && ConfigImplUtil.equalsHandlingNull(this.filenameOrNull,
                            otherOrigin.filenameOrNull)
                    && this.lineNumber == otherOrigin.lineNumber
                    && this.columnNumber == otherOrigin.columnNumber
                    && this.offset == otherOrigin.offset;
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        int h = 41 * (41 + description.hashCode());
        h = 41 * (h + lineNumber);
        h = 41 * (h + columnNumber);
        h = 41 * (h + offset);
        if (filenameOrNull != null)
            h = 41 * (h + filenameOrNull.hashCode());
        return h;
    }

    @Override
    public String toString() {
        return "ConfigOrigin(" + description() + ")";
    }
}
