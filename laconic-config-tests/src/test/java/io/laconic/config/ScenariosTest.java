/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

/**
 * End to end uses of the library, from source text to typed values.
 */
public class ScenariosTest {

    @Test
    public void applicationSettings() {
        Configuration conf = ConfigFactory.parseString(
                "app{ log-level=debug database{ connection=\"mongo://localhost\" } }");
        ConfigSectionNode root = conf.root();
        assertEquals("app", root.name());
        assertEquals("debug", root.attrByName("log-level").value());
        assertEquals("mongo://localhost", root.getChild("database").attrByName("connection")
                .value());
    }

    @Test
    public void buildThenNavigate() {
        Configuration conf = ConfigFactory.parseString("root{ db{ } }");
        conf.root().getChild("db").addAttributeNode("port", "5432");
        assertEquals(5432, conf.root().navigate("/db/$port").asInt(0));
        assertTrue(conf.root().getChild("db").isModified());
    }

    @Test
    public void unterminatedStringFailsBeforeParsing() {
        try {
            ConfigFactory.parseString("root{ a=\"x }");
            fail("expected a lex failure");
        } catch (ConfigException.Lex e) {
            assertEquals(1, e.origin().lineNumber());
            assertEquals(9, e.origin().columnNumber());
        }
    }

    @Test
    public void nothingIsModifiedAfterParsing() {
        Configuration conf = ConfigFactory.parseResources("sample.laconf");
        List<ConfigNode> all = new ArrayList<ConfigNode>();
        collect(conf.root(), all);
        assertTrue(all.size() > 5);
        for (ConfigNode node : all)
            assertFalse(node.path(), node.isModified());
    }

    @Test
    public void parentAndRootNavigation() {
        Configuration conf = ConfigFactory.parseResources("sample.laconf");
        List<ConfigNode> all = new ArrayList<ConfigNode>();
        collect(conf.root(), all);
        for (ConfigNode node : all) {
            assertSame(node.path(), node.parent(), node.navigate(".."));
            assertSame(node.path(), conf.root(), node.navigate("/"));
        }
    }

    @Test
    public void everyPathLeadsBackToItsNode() {
        Configuration conf = ConfigFactory.parseResources("sample.laconf");
        List<ConfigNode> all = new ArrayList<ConfigNode>();
        collect(conf.root(), all);
        // no duplicate names in the sample, so paths are plain
        for (ConfigNode node : all)
            assertSame(node.path(), node, conf.get(node.path()));
    }

    private static void collect(ConfigSectionNode section, List<ConfigNode> into) {
        into.add(section);
        into.addAll(section.attributes());
        for (ConfigSectionNode child : section.children())
            collect(child, into);
    }
}
