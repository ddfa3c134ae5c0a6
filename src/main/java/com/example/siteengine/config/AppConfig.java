package com.example.siteengine.config;

/**
 * Root of a site configuration as persisted in {@code config.toml}.
 */
public record AppConfig(
        Site site,
        Server server,
        DocPaths docpaths
) {
    public AppConfig {
        if (site == null || server == null || docpaths == null) {
            throw new IllegalArgumentException("AppConfig requires site, server and docpaths tables.");
        }
    }
}
