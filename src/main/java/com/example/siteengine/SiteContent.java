package com.example.siteengine;

import com.example.siteengine.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists the posts of each site section for rendering: {@code main} first, then the topics in
 * configured order.
 */
public final class SiteContent {
    private static final Logger LOGGER = LoggerFactory.getLogger(SiteContent.class);

    public static final String POSTS_GLOB = "*.md";

    private final ContentPathResolver resolver;

    public SiteContent(ContentPathResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Returns {@code <webroot>/<slug>/posts/*.md} for a section slug, with the webroot and slug
     * quoted so they match literally.
     */
    public static String postsPattern(AppConfig config, String slug) {
        return String.join("/",
                ContentPathResolver.escape(config.docpaths().webroot()),
                ContentPathResolver.escape(slug),
                SiteTree.POSTS_DIRECTORY,
                POSTS_GLOB);
    }

    /**
     * Resolves the posts of every section, keyed by section slug. Each list is newest first.
     *
     * @throws java.nio.file.NoSuchFileException if a section's posts directory is missing
     */
    public Map<String, List<Path>> posts(AppConfig config) throws IOException {
        Map<String, List<Path>> sections = new LinkedHashMap<>();
        sections.put(SiteTree.MAIN_SECTION, resolver.resolve(postsPattern(config, SiteTree.MAIN_SECTION)));
        for (String topic : config.site().topics()) {
            String slug = Slugs.slugify(topic);
            if (!sections.containsKey(slug)) {
                sections.put(slug, resolver.resolve(postsPattern(config, slug)));
            }
        }
        LOGGER.debug("Resolved posts for {} sections", sections.size());
        return sections;
    }
}
