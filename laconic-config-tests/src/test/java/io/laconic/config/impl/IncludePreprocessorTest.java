/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import io.laconic.config.ConfigException;
import io.laconic.config.ConfigIncluder;
import io.laconic.config.ConfigResolveOptions;
import io.laconic.config.MapEnvironment;

public class IncludePreprocessorTest {

    private static final class MapIncluder implements ConfigIncluder {
        final Map<String, String> files = new HashMap<String, String>();
        final List<String> requested = new ArrayList<String>();

        MapIncluder put(String name, String text) {
            files.put(name, text);
            return this;
        }

        @Override
        public String include(String name) {
            requested.add(name);
            return files.get(name);
        }
    }

    private static IncludePreprocessor preprocessor(ConfigIncluder includer, String... env) {
        return new IncludePreprocessor(includer, ConfigResolveOptions.defaults()
                .setEnvironmentResolver(new MapEnvironment(env)));
    }

    @Test
    public void textWithoutIncludesIsUntouched() {
        String text = "r {\r\n  a=1\n}\n";
        assertEquals(text, preprocessor(new MapIncluder()).process(text));
    }

    @Test
    public void includeLineIsReplaced() {
        MapIncluder includer = new MapIncluder().put("db.inc", "db { port=1 }");
        String out = preprocessor(includer).process("r {\n  #include<db.inc>\n  a=2\n}");
        assertEquals("r {\ndb { port=1 }\n  a=2\n}", out);
        assertEquals("db.inc", includer.requested.get(0));
    }

    @Test
    public void includeMustBeAloneOnItsLine() {
        MapIncluder includer = new MapIncluder().put("x", "boom");
        String text = "r { a=1 } #include<x>";
        assertEquals(text, preprocessor(includer).process(text));
        assertTrue(includer.requested.isEmpty());
    }

    @Test
    public void missingOptionalIncludeIsEmpty() {
        String out = preprocessor(new MapIncluder()).process("a\n#include< nothing.inc >\nb");
        assertEquals("a\n\nb", out);
    }

    @Test
    public void missingRequiredInclude() {
        try {
            preprocessor(new MapIncluder()).process("#include<!needed.inc>");
            fail("expected an include failure");
        } catch (ConfigException.Include e) {
            assertTrue(e.getMessage().contains("needed.inc"));
        }
    }

    @Test
    public void environmentVariablesInName() {
        MapIncluder includer = new MapIncluder().put("conf/prod/db.inc", "db {}");
        String out = preprocessor(includer, "STAGE", "prod").process(
                "#include<conf/$(~STAGE)/db.inc>");
        assertEquals("db {}", out);
    }

    @Test
    public void pathVariablesInNameAreLeftAlone() {
        MapIncluder includer = new MapIncluder();
        preprocessor(includer).process("#include<$($dir)/x.inc>");
        assertEquals("$($dir)/x.inc", includer.requested.get(0));
    }

    @Test(expected = ConfigException.UnresolvedSubstitution.class)
    public void requiredEnvironmentVariableInName() {
        preprocessor(new MapIncluder()).process("#include<$(~!MISSING)/x.inc>");
    }

    @Test(expected = ConfigException.Include.class)
    public void emptyName() {
        preprocessor(new MapIncluder()).process("#include<$(~UNSET)>");
    }

    @Test
    public void nestedIncludes() {
        MapIncluder includer = new MapIncluder().put("a", "a {\n#include<b>\n}").put("b", "b=1");
        assertEquals("r {\na {\nb=1\n}\n}", preprocessor(includer).process("r {\n#include<a>\n}"));
    }

    @Test
    public void depthLimit() {
        MapIncluder includer = new MapIncluder();
        for (int i = 1; i <= IncludePreprocessor.MAX_INCLUDE_DEPTH; ++i)
            includer.put("f" + i, "#include<f" + (i + 1) + ">");
        includer.put("f" + (IncludePreprocessor.MAX_INCLUDE_DEPTH + 1), "end");
        try {
            preprocessor(includer).process("#include<f1>");
            fail("expected the nesting limit");
        } catch (ConfigException.Include e) {
            assertTrue(e.getMessage().contains("deeper than"));
        }

        // one level less is fine
        includer.put("f" + IncludePreprocessor.MAX_INCLUDE_DEPTH, "end");
        assertEquals("end", preprocessor(includer).process("#include<f1>"));
    }

    @Test(expected = ConfigException.Include.class)
    public void recursiveIncludeHitsTheLimit() {
        MapIncluder includer = new MapIncluder().put("self", "#include<self>");
        preprocessor(includer).process("#include<self>");
    }
}
