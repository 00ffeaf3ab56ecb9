package com.lbg.markets.turbosort.sink;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.util.UUID;

/**
 * Writes delivered files into the local destination tree.
 * Readers of the destination never observe a partially written file.
 */
@ApplicationScoped
public class LocalFsSink implements Sink {

    private final int bufferSize;

    public LocalFsSink(@ConfigProperty(name = "sink.buffer.size", defaultValue = "65536") int bufferSize) {
        this.bufferSize = bufferSize;
    }

    @Override
    public long write(Path target, InputStream in, long mtimeEpochMs) throws IOException {
        Files.createDirectories(target.getParent());

        // Unique hidden staging name, created exclusively so a delivered sibling is never reused
        Path temp = target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + ".part");
        OutputStream out = Files.newOutputStream(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);

        try {
            long written = copy(in, out);
            if (mtimeEpochMs > 0) {
                Files.setLastModifiedTime(temp, FileTime.fromMillis(mtimeEpochMs));
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            return written;
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    private long copy(InputStream in, OutputStream target) throws IOException {
        try (OutputStream out = target) {
            byte[] buffer = new byte[bufferSize];
            long totalWritten = 0;
            int bytesRead;

            while ((bytesRead = in.read(buffer)) != -1) {
                out.write(buffer, 0, bytesRead);
                totalWritten += bytesRead;
            }

            return totalWritten;
        }
    }
}
