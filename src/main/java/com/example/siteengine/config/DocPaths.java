package com.example.siteengine.config;

import java.nio.file.Path;

/**
 * Template and webroot directories of a site. Both always live under the same
 * {@code <base>/site} directory.
 */
public record DocPaths(
        String templates,
        String webroot
) {
    public DocPaths {
        if (templates == null || webroot == null) {
            throw new IllegalArgumentException("DocPaths requires templates and webroot.");
        }
    }

    /**
     * Derives {@code <base>/site/templates} and {@code <base>/site/webroot} from a base directory.
     */
    public static DocPaths forBaseDirectory(Path baseDirectory) {
        Path site = baseDirectory.toAbsolutePath().normalize().resolve("site");
        return new DocPaths(site.resolve("templates").toString(), site.resolve("webroot").toString());
    }

    public Path templatesPath() {
        return Path.of(templates);
    }

    public Path webrootPath() {
        return Path.of(webroot);
    }
}
