package io.validata.core.engine.predicate;

import io.validata.core.model.SizeLimit;
import io.validata.core.model.UploadedFile;
import io.validata.core.spi.ContentSniffer;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks on uploaded files. A file that cannot be opened or read violates every content rule.
 */
public final class FilePredicates {

    private static final Logger LOG = LoggerFactory.getLogger(FilePredicates.class);

    /** Extensions accepted by the bare {@code image} rule. */
    public static final String IMAGE_EXTENSIONS = "jpg,jpeg,png,webp";

    private FilePredicates() {}

    /** Violates when the file cannot be opened. */
    public static boolean isNotFile(UploadedFile file) {
        try (InputStream in = file.open()) {
            return false;
        } catch (IOException | UncheckedIOException e) {
            LOG.debug("file.unreadable name={} cause={}", file.name(), e.getMessage());
            return true;
        }
    }

    /**
     * Violates when the sniffed extension is not one of {@code extensions}.
     *
     * @param extensions comma-separated list without dots, e.g. {@code "pdf,docx"}
     */
    public static boolean isNotMimes(UploadedFile file, String extensions, ContentSniffer sniffer) {
        byte[] header;
        try (InputStream in = file.open()) {
            header = in.readNBytes(ContentSniffer.HEADER_LENGTH);
        } catch (IOException | UncheckedIOException e) {
            LOG.debug("file.unreadable name={} cause={}", file.name(), e.getMessage());
            return true;
        }
        String detected = sniffer.detectExtension(header);
        for (String token : List.of(extensions.split(",", -1))) {
            if (("." + token).toLowerCase(Locale.ROOT).equals(detected.toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }

    /** Violates only when the file is strictly larger than an active limit. */
    public static boolean isTooLarge(UploadedFile file, SizeLimit limit) {
        return limit.isExceededBy(file.size());
    }
}
