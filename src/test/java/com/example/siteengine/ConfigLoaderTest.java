package com.example.siteengine;

import com.example.siteengine.config.AppConfig;
import com.example.siteengine.config.DocPaths;
import com.example.siteengine.config.Server;
import com.example.siteengine.config.Site;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    private static final String VALID = String.join("\n",
            "[site]",
            "name = \"Site\"",
            "author = \"Author\"",
            "template = \"default.tmpl\"",
            "topics = [\"One\"]",
            "",
            "[server]",
            "bind = \"0.0.0.0\"",
            "port = 9090",
            "",
            "[docpaths]",
            "templates = \"/srv/site/templates\"",
            "webroot = \"/srv/site/webroot\"",
            "");

    private final ConfigLoader loader = new ConfigLoader();

    @Test
    void loadsConfigFile() throws Exception {
        Path path = Path.of(getClass().getResource("/test-config.toml").toURI());

        AppConfig config = loader.load(path);

        assertEquals("Test Site", config.site().name());
        assertEquals("Test Author", config.site().author());
        assertEquals(Site.DEFAULT_TEMPLATE, config.site().template());
        assertEquals(List.of("One", "Two", "And More"), config.site().topics());
        assertEquals(new Server("127.0.0.1", 8080), config.server());
        assertEquals("/srv/test-site/site/webroot", config.docpaths().webroot());
    }

    @Test
    void parsesHandWrittenTables() throws Exception {
        AppConfig config = loader.parse(VALID);

        assertEquals(Server.defaults(), config.server());
        assertEquals(new DocPaths("/srv/site/templates", "/srv/site/webroot"), config.docpaths());
    }

    @Test
    void renderedConfigParsesBackToEqualConfig() throws Exception {
        AppConfig config = new AppConfig(
                new Site("My \"Quoted\" Site", "Zoë O'Brien", Site.DEFAULT_TEMPLATE, List.of("Foo", "Bar Baz", "", "Foo")),
                new Server("::1", 65535),
                DocPaths.forBaseDirectory(Path.of("/srv/my site"))
        );

        assertEquals(config, loader.parse(loader.render(config)));
    }

    @Test
    void rejectsUnknownKeys() {
        String toml = VALID.replace("port = 9090", "port = 9090\ntls = true");

        assertThrows(JsonProcessingException.class, () -> loader.parse(toml));
    }

    @Test
    void rejectsMissingKeys() {
        assertThrows(JsonProcessingException.class, () -> loader.parse(VALID.replace("port = 9090", "")));
        assertThrows(JsonProcessingException.class, () -> loader.parse(VALID.replace("author = \"Author\"", "")));
    }

    @Test
    void rejectsMissingTables() {
        String toml = VALID.substring(0, VALID.indexOf("[docpaths]"));

        assertThrows(JsonProcessingException.class, () -> loader.parse(toml));
    }

    @Test
    void rejectsPortOutOfRange() {
        assertThrows(JsonProcessingException.class, () -> loader.parse(VALID.replace("port = 9090", "port = 70000")));
    }

    @Test
    void wrapsParseFailureWithPath() throws Exception {
        Path path = Files.createTempDirectory("loader-test").resolve("config.toml");
        Files.writeString(path, "[site\nname = ");

        IOException ex = assertThrows(IOException.class, () -> loader.load(path));
        assertTrue(ex.getMessage().startsWith("failed to parse TOML"));
        assertTrue(ex.getMessage().contains(path.toString()));
        assertInstanceOf(JsonProcessingException.class, ex.getCause());
    }

    @Test
    void wrapsReadFailureWithPath() throws Exception {
        Path path = Files.createTempDirectory("loader-test").resolve("absent.toml");

        IOException ex = assertThrows(IOException.class, () -> loader.load(path));
        assertTrue(ex.getMessage().startsWith("failed reading"));
        assertInstanceOf(NoSuchFileException.class, ex.getCause());
    }
}
