/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config.impl;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import io.laconic.config.ConfigAttributeNode;
import io.laconic.config.ConfigException;
import io.laconic.config.ConfigNode;
import io.laconic.config.ConfigParseOptions;
import io.laconic.config.ConfigSectionNode;
import io.laconic.config.Configuration;

public class ParserTest {

    private static Configuration parse(String s, ConfigParseOptions options) {
        List<Token> tokens = Tokenizer.tokenize(SimpleConfigOrigin.newSimple("test"), s);
        return Parser.parse(tokens, options);
    }

    private static Configuration parse(String s) {
        return parse(s, ConfigParseOptions.defaults());
    }

    private static ConfigException.Parse parseFailure(String s) {
        try {
            parse(s);
        } catch (ConfigException.Parse e) {
            return e;
        }
        fail("expected a parse failure for: " + s);
        return null;
    }

    @Test
    public void simpleConfig() {
        Configuration conf = parse("app { log-level=debug database { connection=\"mongo://localhost\" } }");
        ConfigSectionNode root = conf.root();
        assertEquals("app", root.name());
        assertNull(root.verbatimValue());
        assertEquals(1, root.attributeCount());
        assertEquals(1, root.childCount());
        assertEquals("debug", root.attrByName("log-level").value());
        ConfigSectionNode db = root.getChild("database");
        assertEquals("mongo://localhost", db.attrByName("connection").value());
        assertFalse(conf.isReadOnly());
    }

    @Test
    public void sectionWithValue() {
        Configuration conf = parse("root=top { srv=main { port=80 } }");
        assertEquals("top", conf.root().verbatimValue());
        ConfigSectionNode srv = conf.root().getChild("srv");
        assertEquals("main", srv.verbatimValue());
        assertEquals(80, srv.attrByName("port").asInt(0));
    }

    @Test
    public void nullSectionValue() {
        Configuration conf = parse("r { s=null { } }");
        ConfigSectionNode s = conf.root().getChild("s");
        assertTrue(s.exists());
        assertNull(s.verbatimValue());
    }

    @Test
    public void emptyStringIsAnAttributeValue() {
        Configuration conf = parse("r { a='' }");
        ConfigAttributeNode a = conf.root().attrByName("a");
        assertTrue(a.exists());
        assertEquals("", a.verbatimValue());
        assertNull(a.value());
    }

    @Test
    public void quotedNames() {
        Configuration conf = parse("'my root' { \"key with space\"=1 \"null\"=2 }");
        assertEquals("my root", conf.root().name());
        assertEquals("1", conf.root().attrByName("key with space").verbatimValue());
        assertEquals("2", conf.root().attrByName("null").verbatimValue());
    }

    @Test
    public void duplicatesKeepOrder() {
        Configuration conf = parse("r { a=1 a=2 s { } s=x { } a=3 }");
        List<ConfigAttributeNode> attrs = conf.root().attributes();
        assertEquals(3, attrs.size());
        assertEquals("1", attrs.get(0).verbatimValue());
        assertEquals("2", attrs.get(1).verbatimValue());
        assertEquals("3", attrs.get(2).verbatimValue());
        assertEquals("x", conf.root().childByIndex(1).verbatimValue());
    }

    @Test
    public void everythingUnmodifiedAfterParse() {
        Configuration conf = parse("r { a=1 s { b=2 t { c=3 } } }");
        assertUnmodified(conf.root());
    }

    private static void assertUnmodified(ConfigSectionNode section) {
        assertFalse(section.path(), section.isModified());
        for (ConfigNode attr : section.attributes())
            assertFalse(attr.path(), attr.isModified());
        for (ConfigSectionNode child : section.children())
            assertUnmodified(child);
    }

    @Test
    public void readOnlyOption() {
        Configuration conf = parse("r { a=1 }", ConfigParseOptions.defaults().setReadOnly(true));
        assertTrue(conf.isReadOnly());
        assertEquals("1", conf.root().attrByName("a").verbatimValue());
        try {
            conf.root().addAttributeNode("b", "2");
            fail("read-only tree accepted a new attribute");
        } catch (ConfigException.ReadOnly e) {
            // expected
        }
    }

    @Test
    public void entryWithoutValueOrBody() {
        ConfigException.Parse e = parseFailure("r { a }");
        assertTrue(e.getMessage().contains("'a'"));
        parseFailure("r { a=null }");
    }

    @Test
    public void errorNamesEnclosingSection() {
        ConfigException.Parse e = parseFailure("r { outer { inner { x } } }");
        assertTrue(e.getMessage(), e.getMessage().contains("/outer/inner"));
    }

    @Test
    public void missingCloseBrace() {
        parseFailure("r { a=1");
        parseFailure("r { s { a=1 }");
    }

    @Test
    public void trailingTokensAfterRoot() {
        parseFailure("r { } extra");
        parseFailure("r { } { }");
    }

    @Test
    public void rootMustHaveBody() {
        parseFailure("r");
        parseFailure("r=1");
        parseFailure("");
    }

    @Test
    public void badNames() {
        parseFailure("null { }");
        parseFailure("r { =1 }");
        parseFailure("r { { } }");
    }

    @Test
    public void badValue() {
        ConfigException.Parse e = parseFailure("r { a={ } }");
        assertEquals(1, e.origin().lineNumber());
        assertEquals(7, e.origin().columnNumber());
    }

    @Test
    public void lexFailureComesBeforeParsing() {
        // the structure is broken too, but the lexer reports first
        try {
            parse("} } root{ a=\"x }");
            fail("expected failure");
        } catch (ConfigException.Lex e) {
            assertTrue(e.getMessage().contains("Unterminated string"));
        }
    }
}
