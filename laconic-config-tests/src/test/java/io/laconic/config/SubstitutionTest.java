/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class SubstitutionTest {

    private static Configuration parse(String s, EnvironmentResolver env) {
        ConfigParseOptions options = ConfigParseOptions.defaults().setResolveOptions(
                ConfigResolveOptions.defaults().setEnvironmentResolver(env));
        return ConfigFactory.parseString(s, options);
    }

    private static Configuration parse(String s) {
        return parse(s, new MapEnvironment());
    }

    @Test
    public void textWithoutVariablesIsUnchanged() {
        Configuration conf = parse("r { a=1 }");
        ConfigSectionNode root = conf.root();
        String[] samples = { "plain", "", "a $ b", "100%", "(x)", "$ (x)", "ends with $" };
        for (String s : samples)
            assertEquals(s, root.evaluate(s));
        assertNull(root.evaluate(null));
    }

    @Test
    public void pathVariable() {
        Configuration conf = parse("r { home=/var path=\"$($home)/data\" }");
        assertEquals("/var/data", conf.get("$path").value());
        assertEquals("$($home)/data", conf.get("$path").verbatimValue());
    }

    @Test
    public void pathModifier() {
        Configuration conf = parse("r { db { port=5432 } url=\"db:$(@db/$port)\" }");
        assertEquals("db:5432", conf.get("$url").value());
    }

    @Test
    public void absolutePathsAndSections() {
        Configuration conf = parse("r { base=/opt s { inner=\"$(/$base)/s\" t=\"$(../$base)\" } }");
        assertEquals("/opt/s", conf.get("s/$inner").value());
        assertEquals("/opt", conf.get("s/$t").value());
    }

    @Test
    public void sectionValueEvaluatesAgainstItself() {
        Configuration conf = parse("r { s=\"id-$($n)\" { n=7 } }");
        assertEquals("id-7", conf.get("s").value());
    }

    @Test
    public void chainedVariables() {
        Configuration conf = parse("r { a=\"$($b)-a\" b=\"$($c)-b\" c=c }");
        assertEquals("c-b-a", conf.get("$a").value());
    }

    @Test
    public void repeatedVariableIsNotACycle() {
        Configuration conf = parse("r { x=1 y=\"$($x)+$($x)\" }");
        assertEquals("1+1", conf.get("$y").value());
    }

    @Test
    public void environmentVariable() {
        Configuration conf = parse("r { path=\"home=$(~TEST_HOME)\" }", new MapEnvironment(
                "TEST_HOME", "/tmp"));
        assertEquals("home=/tmp", conf.get("$path").value());
    }

    @Test
    public void missingEnvironmentVariableIsEmpty() {
        Configuration conf = parse("r { path=\"[$(~NOT_THERE)]\" }");
        assertEquals("[]", conf.get("$path").value());
    }

    @Test
    public void requiredEnvironmentVariable() {
        Configuration conf = parse("r { a=\"$(~!NEEDED)\" b=\"$(~!SET)\" }", new MapEnvironment(
                "SET", "yes"));
        assertEquals("yes", conf.get("$b").value());
        try {
            conf.get("$a").value();
            fail("expected unresolved substitution");
        } catch (ConfigException.UnresolvedSubstitution e) {
            assertTrue(e.getMessage().contains("NEEDED"));
        }
    }

    @Test
    public void missingPathIsEmpty() {
        Configuration conf = parse("r { a=\"<$($nope)>\" b=\"<$(x/y/z)>\" c=\"<$()>\" }");
        assertEquals("<>", conf.get("$a").value());
        assertEquals("<>", conf.get("$b").value());
        assertEquals("<>", conf.get("$c").value());
    }

    @Test
    public void escapedValueIsNotExpanded() {
        Configuration conf = parse("r { a=\"$$$(x)\" b=$$ x=1 }");
        assertEquals("$(x)", conf.get("$a").value());
        assertEquals("$$$(x)", conf.get("$a").verbatimValue());
        assertEquals("", conf.get("$b").value());
    }

    @Test
    public void unterminatedVariableIsLiteral() {
        Configuration conf = parse("r { x=1 a=\"$($x) and $(x\" }");
        assertEquals("1 and $(x", conf.get("$a").value());
    }

    @Test
    public void directCycle() {
        Configuration conf = parse("r { a=\"$($b)\" b=\"$($a)\" }");
        try {
            conf.get("$a").value();
            fail("expected a cycle");
        } catch (ConfigException.SubstitutionCycle e) {
            assertTrue(e instanceof ConfigException.Expansion);
        }
    }

    @Test(expected = ConfigException.SubstitutionCycle.class)
    public void selfReference() {
        parse("r { a=\"x$($a)\" }").get("$a").value();
    }

    @Test(expected = ConfigException.SubstitutionCycle.class)
    public void cycleThroughSections() {
        parse("r { s { v=\"$(/t/$v)\" } t { v=\"$(/s/$v)\" } }").get("s/$v").value();
    }

    @Test(expected = ConfigException.SubstitutionCycle.class)
    public void cycleThroughValueQuery() {
        parse("r { s=\"$(/s[foo])\" { } }").get("s").value();
    }

    @Test
    public void cycleThroughAttributeQuery() {
        Configuration conf = parse("r { db { name=\"$(/db[name=x]/$name)\" } }");
        try {
            conf.get("db/$name").value();
            fail("expected a cycle");
        } catch (ConfigException.Expansion e) {
            assertTrue(e instanceof ConfigException.SubstitutionCycle);
        }
    }

    @Test
    public void queriesCompareExpandedValues() {
        Configuration conf = parse("r { x=1 s=\"$(/$x)\" { a=2 } db { name=\"$(/$x)\" port=9 }"
                + " t=\"$(/s[1]/$a)\" p=\"$(/db[name=1]/$port)\" }");
        assertEquals("2", conf.get("$t").value());
        assertEquals("9", conf.get("$p").value());
    }

    @Test
    public void readingAValueNeverChangesIt() {
        Configuration conf = parse("r { x=1 a=\"$($x)\" }");
        ConfigNode a = conf.get("$a");
        assertEquals("1", a.value());
        assertEquals("$($x)", a.verbatimValue());
        assertTrue(!a.isModified());
    }

    @Test
    public void customVariableResolverGoesFirst() {
        VariableResolver custom = new VariableResolver() {
            @Override
            public String resolve(ConfigNode context, String expression) {
                if (expression.equals("app.name"))
                    return "demo@" + context.name();
                return null;
            }
        };
        ConfigParseOptions options = ConfigParseOptions.defaults().setResolveOptions(
                ConfigResolveOptions.noSystem().setVariableResolver(custom));
        Configuration conf = ConfigFactory.parseString(
                "r { x=1 a=\"$(app.name) $($x)\" }", options);
        assertEquals("demo@r 1", conf.get("$a").value());
    }

    @Test
    public void iterationCeiling() {
        // every expansion of LOOP produces the variable again
        Configuration conf = parse("r { a=\"$(~LOOP)\" }", new MapEnvironment("LOOP", "x$(~LOOP)"));
        try {
            conf.get("$a").value();
            fail("expected the expansion to give up");
        } catch (ConfigException.Expansion e) {
            assertTrue(e.getMessage().contains("max iterations"));
        }
    }

    @Test
    public void customMarkers() {
        ConfigParseOptions options = ConfigParseOptions.defaults().setResolveOptions(
                ConfigResolveOptions.noSystem().setVariableMarkers("${", "}", "\\\\")
                        .setModifiers("env:", "path:"));
        Configuration conf = ConfigFactory.parseString(
                "r { x=1 a=\"${$x}/${path:$x}/${env:NONE}\" b=\"\\\\\\\\${x}\" }", options);
        assertEquals("1/1/", conf.get("$a").value());
        assertEquals("${x}", conf.get("$b").value());
    }

    @Test(expected = ConfigException.Generic.class)
    public void emptyMarkersRejected() {
        ConfigResolveOptions.defaults().setVariableMarkers("", ")", "$$");
    }
}
