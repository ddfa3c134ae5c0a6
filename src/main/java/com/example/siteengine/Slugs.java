package com.example.siteengine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps topic display names to the directory and URL segment used for them.
 */
public final class Slugs {
    private static final Logger LOGGER = LoggerFactory.getLogger(Slugs.class);

    private Slugs() {
    }

    /**
     * Lower-cases ASCII letters and replaces each Unicode whitespace character with a hyphen.
     * Non-ASCII letters keep their case; nothing is trimmed or collapsed.
     */
    public static String slugify(String topic) {
        LOGGER.debug("Creating slugified topic string from {}", topic);
        StringBuilder slug = new StringBuilder(topic.length());
        for (int i = 0; i < topic.length(); i++) {
            char c = topic.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                slug.append((char) (c + ('a' - 'A')));
            } else if (isWhitespace(c)) {
                slug.append('-');
            } else {
                slug.append(c);
            }
        }
        return slug.toString();
    }

    // Unicode White_Space property
    private static boolean isWhitespace(char c) {
        return (c >= 0x09 && c <= 0x0D)
                || c == 0x20
                || c == 0x85
                || c == 0xA0
                || c == 0x1680
                || (c >= 0x2000 && c <= 0x200A)
                || c == 0x2028
                || c == 0x2029
                || c == 0x202F
                || c == 0x205F
                || c == 0x3000;
    }
}
