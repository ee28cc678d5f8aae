package io.validata.core.model;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/** An {@link UploadedFile} backed by a file on disk, e.g. a multipart upload spooled by a server. */
public final class PathFile implements UploadedFile {

    private final Path path;
    private final String name;

    public PathFile(Path path) {
        this(path, path.getFileName() != null ? path.getFileName().toString() : path.toString());
    }

    public PathFile(Path path, String name) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public Path path() {
        return path;
    }

    @Override
    public String name() {
        return name;
    }

    /** Size on disk; {@code 0} when the file no longer exists. */
    @Override
    public long size() {
        try {
            return Files.size(path);
        } catch (NoSuchFileException e) {
            return 0;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read size of " + path, e);
        }
    }

    @Override
    public InputStream open() throws IOException {
        return Files.newInputStream(path);
    }

    @Override
    public String toString() {
        return "PathFile[" + path + "]";
    }
}
