package com.example.siteengine;

import com.example.siteengine.config.AppConfig;
import com.example.siteengine.config.DocPaths;
import com.example.siteengine.config.Server;
import com.example.siteengine.config.Site;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a new site from user input: asks for the site details, creates the directory tree and
 * writes {@code config.toml} into the base directory.
 *
 * <p>Steps are not rolled back. If writing the configuration fails, the directories created
 * before it stay on disk, and a later run overwrites any existing configuration file.
 */
public final class ConfigGenerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigGenerator.class);

    public static final String CONFIG_FILE_NAME = "config.toml";

    private final ConfigLoader loader;
    private final ProtectedFileWriter writer;
    private final PrintStream prompts;

    public ConfigGenerator() {
        this(new ConfigLoader(), ProtectedFileWriter.forPlatform(), System.out);
    }

    public ConfigGenerator(ConfigLoader loader, ProtectedFileWriter writer, PrintStream prompts) {
        this.loader = loader;
        this.writer = writer;
        this.prompts = prompts;
    }

    /**
     * Runs the interactive setup. Blocks on {@code input} for each answer, so hosts with their own
     * scheduling should call this from a thread that may block.
     */
    public AppConfig generate(Path baseDirectory, BufferedReader input) throws IOException {
        LOGGER.info("Generating new site configuration");
        DocPaths docpaths = DocPaths.forBaseDirectory(baseDirectory);
        Site site = readSite(input);
        AppConfig config = new AppConfig(site, Server.defaults(), docpaths);

        try {
            SiteTree.create(config);
        } catch (IOException ex) {
            throw new IOException("failed while creating site paths", ex);
        }
        try {
            write(config, baseDirectory);
        } catch (IOException ex) {
            throw new IOException("failed to write site config to disk", ex);
        }
        return config;
    }

    Site readSite(BufferedReader input) throws IOException {
        String name = prompt("Please enter a name for the site: ", input);
        String author = prompt("Please enter the site author's name: ", input);
        List<String> topics = splitTopics(prompt("Please enter comma-separated site topics: ", input));
        Site site = new Site(name, author, Site.DEFAULT_TEMPLATE, topics);
        LOGGER.trace("Site: {}", site);
        return site;
    }

    private void write(AppConfig config, Path baseDirectory) throws IOException {
        LOGGER.info("Writing site configuration to disk");
        String toml = loader.render(config);
        writer.write(toml, baseDirectory.resolve(CONFIG_FILE_NAME));
    }

    private String prompt(String prompt, BufferedReader input) throws IOException {
        prompts.println(prompt);
        prompts.flush();
        String line;
        try {
            line = input.readLine();
        } catch (IOException ex) {
            throw new IOException("failed reading input from user", ex);
        }
        // End of input answers with an empty string.
        return line == null ? "" : line.strip();
    }

    /**
     * Splits on commas and trims each topic. Empty entries are kept.
     */
    static List<String> splitTopics(String csv) {
        LOGGER.debug("Creating topic list from csv topics: {}", csv);
        List<String> topics = new ArrayList<>();
        for (String topic : csv.split(",", -1)) {
            topics.add(topic.strip());
        }
        return topics;
    }
}
