package com.example.siteengine;

import ch.qos.logback.classic.Level;
import com.example.siteengine.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final String USAGE = "Usage: java -jar site-engine.jar [-v|-vv] new | check <config.toml>";

    private App() {
    }

    public static void main(String[] args) {
        System.exit(run(args, Path.of("").toAbsolutePath(), System.in));
    }

    static int run(String[] args, Path workingDirectory, InputStream stdin) {
        int index = 0;
        int verbosity = 0;
        while (index < args.length && args[index].matches("-v+")) {
            verbosity += args[index].length() - 1;
            index++;
        }
        setLogLevel(verbosity);
        LOGGER.debug("Logging started");

        if (index >= args.length) {
            LOGGER.error(USAGE);
            return 1;
        }
        String command = args[index];
        if (command.equals("new") && args.length == index + 1) {
            return createSite(workingDirectory, stdin);
        }
        if (command.equals("check") && args.length == index + 2) {
            return checkSite(Path.of(args[index + 1]));
        }
        LOGGER.error(USAGE);
        return 1;
    }

    private static int createSite(Path workingDirectory, InputStream stdin) {
        LOGGER.trace("Application called with `new` subcommand - creating config from user input");
        BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
        try {
            AppConfig config = new ConfigGenerator().generate(workingDirectory, reader);
            LOGGER.info("Site '{}' created in {}", config.site().name(), workingDirectory);
            return 0;
        } catch (IOException ex) {
            LOGGER.error("Site generation failed", ex);
            return 1;
        }
    }

    private static int checkSite(Path configPath) {
        LOGGER.trace("Application called with `check` subcommand - loading config from disk");
        try {
            AppConfig config = new ConfigLoader().load(configPath);
            LOGGER.info("Configuration loaded for '{}', serving on {}", config.site().name(), config.server().address());
            Map<String, List<Path>> sections = new SiteContent(new ContentPathResolver()).posts(config);
            sections.forEach((slug, posts) -> {
                LOGGER.info("{}: {} posts", slug, posts.size());
                posts.forEach(post -> LOGGER.debug("  {}", post));
            });
            return 0;
        } catch (IOException ex) {
            LOGGER.error("Unable to load configuration from {}", configPath, ex);
            return 1;
        }
    }

    private static void setLogLevel(int verbosity) {
        Level level = verbosity == 0 ? Level.INFO : verbosity == 1 ? Level.DEBUG : Level.TRACE;
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(level);
        }
    }
}
