package com.project.pvb.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves {@code file:} URIs, {@code ipfs://} content ids and bare names against a local directory.
 * Paths that would escape the base directory are rejected.
 */
public class LocalFileStorageFetcher implements StorageFetcher {

    private final Path baseDirectory;

    public LocalFileStorageFetcher(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    @Override
    public Optional<byte[]> fetch(String dataUri) {
        if (dataUri == null || dataUri.isBlank()) {
            return Optional.empty();
        }

        String relative = dataUri.trim()
                .replaceFirst("^file://", "")
                .replaceFirst("^file:", "")
                .replaceFirst("^ipfs://", "");

        Path candidate = baseDirectory.resolve(relative).normalize();
        if (!candidate.startsWith(baseDirectory)) {
            return Optional.empty();
        }
        if (Files.notExists(candidate)) {
            candidate = baseDirectory.resolve(relative + ".bin").normalize();
        }
        if (!Files.isRegularFile(candidate)) {
            return Optional.empty();
        }

        try {
            return Optional.of(Files.readAllBytes(candidate));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read stored payload for " + dataUri, e);
        }
    }
}
