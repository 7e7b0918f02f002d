/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import io.laconic.config.ConfigException;
import io.laconic.config.ConfigIncluder;

/**
 * The default includer: reads UTF-8 files, resolving relative names against
 * an include root directory (the working directory when there is none).
 */
final class FileIncluder implements ConfigIncluder {
    final private File root;

    FileIncluder(File root) {
        this.root = root;
    }

    File fileFor(String name) {
        File f = new File(name);
        if (f.isAbsolute() || root == null)
            return f;
        return new File(root, name);
    }

    @Override
    public String include(String name) {
        File f = fileFor(name);
        if (!f.isFile())
            return null;
        try {
            return new String(Files.readAllBytes(f.toPath()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException.IO(SimpleConfigOrigin.newFile(f), "Could not read include: "
                    + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "FileIncluder(" + root + ")";
    }
}
