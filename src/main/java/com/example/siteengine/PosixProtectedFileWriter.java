package com.example.siteengine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Creates files with mode {@code 0600}. The mode is part of the create call, so a new file
 * is never visible with wider permissions.
 */
public final class PosixProtectedFileWriter implements ProtectedFileWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(PosixProtectedFileWriter.class);
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");
    private static final Set<OpenOption> OPTIONS = Set.of(
            StandardOpenOption.CREATE,
            StandardOpenOption.WRITE,
            StandardOpenOption.TRUNCATE_EXISTING
    );

    @Override
    public void write(String content, Path dest) throws IOException {
        LOGGER.debug("Writing protected file: {}", dest);
        byte[] bytes = ProtectedFileWriter.withTrailingNewline(content).getBytes(StandardCharsets.UTF_8);

        LOGGER.trace("Opening '{}' to write", dest);
        SeekableByteChannel channel;
        try {
            // The creation attribute is ignored for existing files, so narrow those before truncating.
            if (Files.exists(dest)) {
                Files.setPosixFilePermissions(dest, OWNER_ONLY);
            }
            channel = Files.newByteChannel(dest, OPTIONS, PosixFilePermissions.asFileAttribute(OWNER_ONLY));
        } catch (IOException ex) {
            throw new IOException("failed to open '" + dest + "' for writing", ex);
        }

        try (channel) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        } catch (IOException ex) {
            throw new IOException("failure writing '" + dest + "'", ex);
        }
        LOGGER.trace("Content written to destination");
    }
}
