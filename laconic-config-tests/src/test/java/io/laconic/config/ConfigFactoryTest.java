/**
 *   Copyright (C) 2026 The Laconic Config Authors
 */
package io.laconic.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ConfigFactoryTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static File write(File file, String text) throws IOException {
        file.getParentFile().mkdirs();
        Files.write(file.toPath(), text.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void emptyConfiguration() {
        Configuration conf = ConfigFactory.empty();
        assertFalse(conf.root().exists());
        assertFalse(conf.isReadOnly());
        assertEquals("", conf.render());
    }

    @Test
    public void parseFile() throws IOException {
        File f = write(new File(tmp.getRoot(), "app.laconf"), "app { name=\"caf\u00e9\" }");
        Configuration conf = ConfigFactory.parseFile(f);
        assertEquals("caf\u00e9", conf.get("$name").value());
    }

    @Test
    public void fileIncludesAreRelativeToTheFile() throws IOException {
        File dir = tmp.newFolder("conf");
        write(new File(dir, "parts/db.inc"), "db { port=5432 }");
        File main = write(new File(dir, "main.laconf"), "app {\n  #include<!parts/db.inc>\n}\n");
        Configuration conf = ConfigFactory.parseFile(main);
        assertEquals(5432, conf.get("/db/$port").asInt(0));
    }

    @Test
    public void explicitIncludeRootWins() throws IOException {
        File dir = tmp.newFolder("conf");
        File other = tmp.newFolder("other");
        write(new File(other, "x.inc"), "x=1");
        File main = write(new File(dir, "main.laconf"), "app {\n#include<!x.inc>\n}");
        Configuration conf = ConfigFactory.parseFile(main, ConfigParseOptions.defaults()
                .setIncludeRoot(other));
        assertEquals("1", conf.get("$x").verbatimValue());
    }

    @Test
    public void missingFileIsAllowedByDefault() {
        Configuration conf = ConfigFactory.parseFile(new File(tmp.getRoot(), "nope.laconf"));
        assertFalse(conf.root().exists());
    }

    @Test
    public void missingFileWhenNotAllowed() {
        File missing = new File(tmp.getRoot(), "nope.laconf");
        try {
            ConfigFactory.parseFile(missing, ConfigParseOptions.defaults().setAllowMissing(false));
            fail("expected an IO failure");
        } catch (ConfigException.IO e) {
            assertTrue(e.getMessage().contains("nope.laconf"));
            assertEquals(missing.getPath(), e.origin().filename());
        }
    }

    @Test
    public void missingFileKeepsReadOnlyOption() {
        Configuration conf = ConfigFactory.parseFile(new File(tmp.getRoot(), "nope.laconf"),
                ConfigParseOptions.defaults().setReadOnly(true));
        assertTrue(conf.isReadOnly());
    }

    @Test
    public void parseErrorsNameTheFile() throws IOException {
        File f = write(new File(tmp.getRoot(), "broken.laconf"), "app {\n  a=\n}");
        try {
            ConfigFactory.parseFile(f);
            fail("expected a parse failure");
        } catch (ConfigException.Parse e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith(f.getPath() + ": 3:"));
        }
    }

    @Test
    public void parseResources() {
        Configuration conf = ConfigFactory.parseResources("sample.laconf");
        assertEquals("demo", conf.root().verbatimValue());
        assertEquals("debug", conf.get("$log-level").value());
        assertEquals("postgres://localhost:5432/app", conf.get("database/$url").value());

        Configuration again = ConfigFactory.parseResources(getClass().getClassLoader(),
                "/sample.laconf");
        assertEquals(conf.render(), again.render());
    }

    @Test
    public void missingResource() {
        assertFalse(ConfigFactory.parseResources("no-such.laconf").root().exists());
        try {
            ConfigFactory.parseResources(getClass().getClassLoader(), "no-such.laconf",
                    ConfigParseOptions.defaults().setAllowMissing(false));
            fail("expected an IO failure");
        } catch (ConfigException.IO e) {
            assertTrue(e.getMessage().contains("no-such.laconf"));
        }
    }

    @Test
    public void resourceWithIncludeRoot() {
        // the build runs tests from the module directory
        File includes = new File("src/test/resources/includes");
        Configuration conf = ConfigFactory.parseResources(getClass().getClassLoader(),
                "includes/main.laconf", ConfigParseOptions.defaults().setIncludeRoot(includes));
        assertEquals("orders", conf.get("$name").value());
        assertEquals(6543, conf.get("database/$port").asInt(0));
    }

    @Test
    public void includesCanBeTurnedOff() {
        ConfigParseOptions options = ConfigParseOptions.defaults().setProcessIncludes(false)
                .setIncluder(new ConfigIncluder() {
                    @Override
                    public String include(String name) {
                        throw new AssertionError("includer must not be called");
                    }
                });
        // the include line is a comment once it is not processed
        Configuration conf = ConfigFactory.parseString("r {\n#include<!x>\na=1\n}", options);
        assertEquals(1, conf.root().attributeCount());
    }

    @Test
    public void customIncluder() {
        ConfigParseOptions options = ConfigParseOptions.defaults().setIncluder(
                new ConfigIncluder() {
                    @Override
                    public String include(String name) {
                        return "from=" + name;
                    }
                });
        Configuration conf = ConfigFactory.parseString("r {\n#include<memory>\n}", options);
        assertEquals("memory", conf.get("$from").value());
    }

    @Test
    public void parseReaderLeavesReaderOpen() throws IOException {
        StringReader reader = new StringReader("r { a=1 }");
        Configuration conf = ConfigFactory.parseReader(reader);
        assertEquals(1, conf.get("$a").asInt(0));
        // a closed StringReader would throw here
        assertTrue(reader.ready());
    }

    @Test
    public void originDescription() {
        try {
            ConfigFactory.parseString("r {", ConfigParseOptions.defaults().setOriginDescription(
                    "inline settings"));
            fail("expected a parse failure");
        } catch (ConfigException.Parse e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("inline settings"));
        }
    }

    @Test
    public void entryPointFileName() {
        ConfigParseOptions options = ConfigParseOptions.defaults().setResolveOptions(
                ConfigResolveOptions.noSystem());
        File entry = new File(tmp.getRoot(), "main.py");
        assertEquals(new File(tmp.getRoot(), "main-prod.laconf").getAbsoluteFile(),
                ConfigFactory.entryPointFile(entry, " Prod ", options));
        assertEquals(new File(tmp.getRoot(), "main-local.laconf").getAbsoluteFile(),
                ConfigFactory.entryPointFile(entry, null, options));
        assertEquals(new File(tmp.getRoot(), "main.tar-local.laconf").getAbsoluteFile(),
                ConfigFactory.entryPointFile(new File(tmp.getRoot(), "main.tar.gz"), "", options));
        assertEquals(new File(tmp.getRoot(), "runner-local.laconf").getAbsoluteFile(),
                ConfigFactory.entryPointFile(new File(tmp.getRoot(), "runner"), "", options));
    }

    @Test
    public void environmentNameFallsBackToVariable() {
        MapEnvironment env = new MapEnvironment(ConfigFactory.ENVIRONMENT_NAME_VAR, "Staging");
        assertEquals("staging", ConfigFactory.environmentName(null, env));
        assertEquals("staging", ConfigFactory.environmentName("  ", env));
        assertEquals("qa", ConfigFactory.environmentName("QA", env));
        assertEquals(ConfigFactory.DEFAULT_ENVIRONMENT, ConfigFactory.environmentName(null,
                new MapEnvironment()));
    }

    @Test
    public void parseEntryPointFile() throws IOException {
        File entry = write(new File(tmp.getRoot(), "main.py"), "print('hi')\n");
        write(new File(tmp.getRoot(), "main-prod.laconf"), "main { workers=8 }");
        Configuration conf = ConfigFactory.parseEntryPointFile(entry, "PROD");
        assertEquals(8, conf.get("$workers").asInt(0));

        ConfigParseOptions options = ConfigParseOptions.defaults().setResolveOptions(
                ConfigResolveOptions.defaults().setEnvironmentResolver(
                        new MapEnvironment(ConfigFactory.ENVIRONMENT_NAME_VAR, "prod")));
        assertEquals(8, ConfigFactory.parseEntryPointFile(entry, null, options).get("$workers")
                .asInt(0));

        // no main-dev.laconf, and missing files are allowed by default
        assertFalse(ConfigFactory.parseEntryPointFile(entry, "dev").root().exists());
    }
}
