package io.validata.core.engine.predicate;

import static org.assertj.core.api.Assertions.assertThat;

import io.validata.core.engine.mime.MagicNumberSniffer;
import io.validata.core.model.InMemoryFile;
import io.validata.core.model.PathFile;
import io.validata.core.model.UploadedFile;
import io.validata.core.spec.FileSizeParser;
import io.validata.core.spi.ContentSniffer;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FilePredicatesTest")
class FilePredicatesTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0};
    private static final ContentSniffer SNIFFER = new MagicNumberSniffer();

    @TempDir
    Path tempDir;

    @Test
    void readableFileIsAFile() {
        assertThat(FilePredicates.isNotFile(new InMemoryFile("a.txt", "hello".getBytes()))).isFalse();
    }

    @Test
    void missingFileIsNotAFile() {
        assertThat(FilePredicates.isNotFile(new PathFile(tempDir.resolve("missing.bin")))).isTrue();
    }

    @Test
    @DisplayName("extension comparison is case-insensitive")
    void mimesCaseInsensitive() {
        UploadedFile png = new InMemoryFile("logo", PNG);

        assertThat(FilePredicates.isNotMimes(png, "PNG", SNIFFER)).isFalse();
        assertThat(FilePredicates.isNotMimes(png, FilePredicates.IMAGE_EXTENSIONS, SNIFFER)).isFalse();
        assertThat(FilePredicates.isNotMimes(png, "pdf,zip", SNIFFER)).isTrue();
    }

    @Test
    @DisplayName("an unreadable file violates content rules")
    void unreadableFileViolates() {
        UploadedFile broken = new UploadedFile() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public long size() {
                return 10;
            }

            @Override
            public InputStream open() throws IOException {
                throw new IOException("gone");
            }
        };

        assertThat(FilePredicates.isNotMimes(broken, "png", SNIFFER)).isTrue();
        assertThat(FilePredicates.isNotFile(broken)).isTrue();
    }

    @Test
    @DisplayName("size:2mb accepts exactly 2 MiB and rejects one byte more")
    void sizeBoundary() {
        UploadedFile exact = new InMemoryFile("exact", new byte[2 * 1024 * 1024]);
        UploadedFile over = new InMemoryFile("over", new byte[2 * 1024 * 1024 + 1]);

        assertThat(FilePredicates.isTooLarge(exact, FileSizeParser.parse("2mb"))).isFalse();
        assertThat(FilePredicates.isTooLarge(over, FileSizeParser.parse("2mb"))).isTrue();
    }
}
