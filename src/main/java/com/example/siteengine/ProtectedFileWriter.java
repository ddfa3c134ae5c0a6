package com.example.siteengine;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Path;

/**
 * Writes text files that only their owner may read or modify. Content always ends with a newline.
 */
public interface ProtectedFileWriter {
    /**
     * Creates or truncates {@code dest} and writes {@code content} to it as UTF-8.
     */
    void write(String content, Path dest) throws IOException;

    /**
     * Picks owner-only creation modes where the file system has POSIX permissions,
     * and the read-only flag everywhere else.
     */
    static ProtectedFileWriter forFileSystem(FileSystem fileSystem) {
        if (fileSystem.supportedFileAttributeViews().contains("posix")) {
            return new PosixProtectedFileWriter();
        }
        return new ReadOnlyFlagFileWriter();
    }

    static ProtectedFileWriter forPlatform() {
        return forFileSystem(FileSystems.getDefault());
    }

    static String withTrailingNewline(String content) {
        return content.endsWith("\n") ? content : content + "\n";
    }
}
