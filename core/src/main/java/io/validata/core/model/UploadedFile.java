package io.validata.core.model;

import java.io.IOException;
import java.io.InputStream;

/**
 * Handle to an uploaded file as seen by the file rules ({@code file}, {@code image},
 * {@code mimes}, {@code size}). The engine only opens and measures it; it never closes or deletes
 * the underlying resource beyond the streams it opens itself.
 */
public interface UploadedFile {

    /** Client-supplied file name, for diagnostics only. */
    String name();

    /** Declared size in bytes. */
    long size();

    /**
     * Opens the content for reading. Callers close the returned stream.
     *
     * @throws IOException if the content cannot be opened
     */
    InputStream open() throws IOException;
}
