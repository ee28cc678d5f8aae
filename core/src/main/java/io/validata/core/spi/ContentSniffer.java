package io.validata.core.spi;

/**
 * Detects a file's type from its leading bytes. Used by the {@code image}, {@code file} and
 * {@code mimes} rules, which compare the result with {@code "." + token}.
 */
@FunctionalInterface
public interface ContentSniffer {

    /** Number of leading bytes the validator reads before calling {@link #detectExtension}. */
    int HEADER_LENGTH = 512;

    /**
     * @param content leading bytes of the file, possibly fewer than {@link #HEADER_LENGTH}
     * @return a dotted lower-case extension such as {@code ".png"}, or {@code ""} when unknown
     */
    String detectExtension(byte[] content);
}
