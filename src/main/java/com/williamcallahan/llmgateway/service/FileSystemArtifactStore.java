package com.williamcallahan.llmgateway.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Writes artifacts as files below a root directory, one file per artifact path.
 */
public class FileSystemArtifactStore implements ArtifactStore {
    private final Path rootDir;

    /**
     * Creates the store, creating the root directory when missing.
     *
     * @param rootDir artifact root
     * @throws IOException when the root directory cannot be created
     */
    public FileSystemArtifactStore(String rootDir) throws IOException {
        this.rootDir = Paths.get(rootDir).toAbsolutePath().normalize();
        Files.createDirectories(this.rootDir);
    }

    @Override
    public String put(String runId, String path, byte[] data, String contentType) throws IOException {
        Path target = rootDir.resolve(path).normalize();
        if (!target.startsWith(rootDir)) {
            throw new IOException("Artifact path escapes the artifact root: " + path);
        }
        Files.createDirectories(target.getParent());
        // Write-then-move so a reader never sees a half-written record
        Path staging = Files.createTempFile(target.getParent(), ".artifact-", ".tmp");
        try {
            Files.write(staging, data);
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException writeFailure) {
            try {
                Files.deleteIfExists(staging);
            } catch (IOException cleanupFailure) {
                writeFailure.addSuppressed(cleanupFailure);
            }
            throw writeFailure;
        }
        return target.toUri().toString();
    }

    public Path getRootDir() {
        return rootDir;
    }
}
