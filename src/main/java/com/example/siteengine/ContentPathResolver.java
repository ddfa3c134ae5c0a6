package com.example.siteengine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;

/**
 * Expands glob patterns into content paths, most recent first.
 *
 * <p>Content files are expected to carry sortable, time-ascending name prefixes, so the
 * reverse-lexical order returned here is newest-first. Nothing is cached; each call
 * scans the file system again.
 *
 * <p>Patterns use {@code java.nio} glob syntax with {@code /} as separator. A {@code **}
 * segment matches zero or more directories, so {@code a/**}{@code /*.md} also matches
 * {@code a/x.md}. A backslash escapes the next character; {@link #escape(String)} quotes
 * literal text such as a directory name.
 */
public final class ContentPathResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContentPathResolver.class);
    private static final String GLOB_META = "*?[{";
    private static final String GLOB_SPECIAL = "\\*?[]{}";
    private static final Comparator<Path> REVERSE_LEXICAL =
            Comparator.comparing(Path::toString).reversed();

    /**
     * Returns the existing paths matching {@code pattern}, sorted reverse-lexically by full path.
     *
     * @throws NoSuchFileException if the parent directory of the pattern does not exist
     * @throws IOException if the pattern is not a valid glob
     */
    public List<Path> resolve(String pattern) throws IOException {
        LOGGER.trace("Verifying parent exists for pattern: {}", pattern);
        String[] segments = pattern.split("/", -1);
        int firstGlob = firstGlobSegment(segments);
        int parentEnd = firstGlob < 0 ? segments.length - 1 : Math.min(firstGlob, segments.length - 1);
        Path parent = literalPrefix(segments, parentEnd);
        if (parent == null || !Files.isDirectory(parent)) {
            throw new NoSuchFileException(pattern, null, "No valid parent path for '" + pattern + "'");
        }

        LOGGER.debug("Building content list from {}", pattern);
        List<Path> matches = new ArrayList<>();
        if (firstGlob < 0) {
            Path literal = literalPrefix(segments, segments.length);
            if (Files.exists(literal)) {
                matches.add(literal);
            }
            return matches;
        }

        String[] remainder = Arrays.copyOfRange(segments, firstGlob, segments.length);
        int maxDepth = Arrays.stream(remainder).anyMatch(s -> s.contains("**"))
                ? Integer.MAX_VALUE
                : remainder.length;
        String base = escape(parent.toString());
        String glob = (base.endsWith("/") ? base : base + "/") + String.join("/", remainder);
        List<PathMatcher> matchers = new ArrayList<>();
        try {
            matchers.add(parent.getFileSystem().getPathMatcher("glob:" + glob));
            String collapsed = glob.replace("/**/", "/");
            if (!collapsed.equals(glob)) {
                matchers.add(parent.getFileSystem().getPathMatcher("glob:" + collapsed));
            }
        } catch (IllegalArgumentException ex) {
            throw new IOException("failure globbing paths for '" + pattern + "'", ex);
        }

        LOGGER.trace("Globbing {}", glob);
        Files.walkFileTree(parent, EnumSet.of(FileVisitOption.FOLLOW_LINKS), maxDepth, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(parent)) {
                    collect(dir);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                collect(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                LOGGER.trace("Skipping unreadable entry {}", file, exc);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                if (exc != null) {
                    LOGGER.trace("Listing of {} ended early", dir, exc);
                }
                return FileVisitResult.CONTINUE;
            }

            private void collect(Path candidate) {
                for (PathMatcher matcher : matchers) {
                    if (matcher.matches(candidate)) {
                        LOGGER.trace("Adding '{}' to content list", candidate);
                        matches.add(candidate);
                        return;
                    }
                }
            }
        });

        LOGGER.trace("Ordering content list newest first");
        matches.sort(REVERSE_LEXICAL);
        return matches;
    }

    /**
     * Quotes glob metacharacters so {@code text} only matches itself.
     */
    public static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (GLOB_SPECIAL.indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private static int firstGlobSegment(String[] segments) {
        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i];
            for (int j = 0; j < segment.length(); j++) {
                char c = segment.charAt(j);
                if (c == '\\') {
                    j++;
                } else if (GLOB_META.indexOf(c) >= 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static Path literalPrefix(String[] segments, int end) {
        if (end <= 0) {
            return null;
        }
        String prefix = unescape(String.join("/", Arrays.copyOfRange(segments, 0, end)));
        // "/x" keeps an empty first segment
        return prefix.isEmpty() ? Path.of("/") : Path.of(prefix);
    }

    private static String unescape(String text) {
        StringBuilder literal = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                c = text.charAt(++i);
            }
            literal.append(c);
        }
        return literal.toString();
    }
}
