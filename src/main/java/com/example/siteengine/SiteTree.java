package com.example.siteengine;

import com.example.siteengine.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Directory layout of a site. The webroot holds {@code static/ext}, the {@code main} section
 * and one section per topic; each section has an {@code ext} and a {@code posts} directory.
 */
public final class SiteTree {
    private static final Logger LOGGER = LoggerFactory.getLogger(SiteTree.class);

    public static final String STATIC_SECTION = "static";
    public static final String MAIN_SECTION = "main";
    public static final String ASSETS_DIRECTORY = "ext";
    public static final String POSTS_DIRECTORY = "posts";

    private SiteTree() {
    }

    /**
     * Lists every directory the site needs, in creation order.
     */
    public static List<Path> directories(AppConfig config) {
        String webroot = config.docpaths().webroot();
        List<Path> directories = new ArrayList<>();
        directories.add(config.docpaths().templatesPath());
        directories.add(Path.of(webroot, STATIC_SECTION, ASSETS_DIRECTORY));
        directories.add(Path.of(webroot, MAIN_SECTION, ASSETS_DIRECTORY));
        directories.add(Path.of(webroot, MAIN_SECTION, POSTS_DIRECTORY));
        for (String topic : config.site().topics()) {
            String slug = Slugs.slugify(topic);
            directories.add(Path.of(webroot, slug, ASSETS_DIRECTORY));
            directories.add(Path.of(webroot, slug, POSTS_DIRECTORY));
        }
        return directories;
    }

    /**
     * Creates the site directories, including missing parents. Existing directories are left alone.
     */
    public static void create(AppConfig config) throws IOException {
        LOGGER.info("Creating site filesystem tree");
        for (Path directory : directories(config)) {
            LOGGER.trace("Creating {}", directory);
            try {
                Files.createDirectories(directory);
            } catch (IOException ex) {
                throw new IOException("failed to create directory '" + directory + "'", ex);
            }
        }
    }
}
