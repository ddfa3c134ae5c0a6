package com.example.siteengine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Fallback for file systems without POSIX permissions: writes the file, then marks it read-only.
 * This guards against accidental overwrites only; it does not restrict who can read the file.
 */
public final class ReadOnlyFlagFileWriter implements ProtectedFileWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReadOnlyFlagFileWriter.class);

    @Override
    public void write(String content, Path dest) throws IOException {
        LOGGER.debug("Writing protected file: {}", dest);
        byte[] bytes = ProtectedFileWriter.withTrailingNewline(content).getBytes(StandardCharsets.UTF_8);
        File file = dest.toFile();
        if (file.exists() && !file.canWrite() && !file.setWritable(true)) {
            throw new IOException("failed to open '" + dest + "' for writing: read-only flag could not be cleared");
        }

        LOGGER.trace("Opening '{}' to write", dest);
        OutputStream out;
        try {
            out = Files.newOutputStream(dest);
        } catch (IOException ex) {
            throw new IOException("failed to open '" + dest + "' for writing", ex);
        }
        try (out) {
            out.write(bytes);
        } catch (IOException ex) {
            throw new IOException("failure writing '" + dest + "'", ex);
        }
        LOGGER.trace("Content written to destination");

        LOGGER.trace("Setting read-only on destination file");
        if (!file.setReadOnly()) {
            LOGGER.warn("Could not mark {} read-only", dest);
        }
    }
}
