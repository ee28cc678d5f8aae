package io.validata.core.model;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Objects;

/** An {@link UploadedFile} held fully in memory. */
public final class InMemoryFile implements UploadedFile {

    private final String name;
    private final byte[] content;

    public InMemoryFile(String name, byte[] content) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.content = Objects.requireNonNull(content, "content must not be null").clone();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public long size() {
        return content.length;
    }

    @Override
    public InputStream open() {
        return new ByteArrayInputStream(content);
    }

    @Override
    public String toString() {
        return "InMemoryFile[" + name + ", " + content.length + " bytes]";
    }
}
