package com.example.siteengine.config;

import java.util.List;

/**
 * Identity of a site: display name, author, template and the ordered topic names.
 */
public record Site(
        String name,
        String author,
        String template,
        List<String> topics
) {
    public static final String DEFAULT_TEMPLATE = "default.tmpl";

    public Site {
        if (name == null || author == null || template == null || topics == null) {
            throw new IllegalArgumentException("Site requires name, author, template and topics.");
        }
        topics = List.copyOf(topics);
    }
}
