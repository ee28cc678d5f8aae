package io.validata.core.engine.mime;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayName("MagicNumberSnifferTest")
class MagicNumberSnifferTest {

    private final MagicNumberSniffer sniffer = new MagicNumberSniffer();

    static Stream<Arguments> signatures() {
        return Stream.of(
                Arguments.of(bytes(0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 0x0D), ".png"),
                Arguments.of(bytes(0xFF, 0xD8, 0xFF, 0xE0, 0, 0x10), ".jpg"),
                Arguments.of("GIF89a\u0001\u0000".getBytes(StandardCharsets.ISO_8859_1), ".gif"),
                Arguments.of("RIFF\u0000\u0000\u0000\u0000WEBPVP8 ".getBytes(StandardCharsets.ISO_8859_1), ".webp"),
                Arguments.of(bytes('I', 'I', 0x2A, 0x00, 8, 0, 0, 0), ".tiff"),
                Arguments.of("%PDF-1.7\n".getBytes(StandardCharsets.US_ASCII), ".pdf"),
                Arguments.of(bytes('P', 'K', 0x03, 0x04, 0x14, 0), ".zip"),
                Arguments.of(bytes(0x1F, 0x8B, 0x08, 0), ".gz"));
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("signatures")
    void detectsSignature(byte[] content, String extension) {
        assertThat(sniffer.detectExtension(content)).isEqualTo(extension);
    }

    @Test
    @DisplayName("UTF-8 text without control characters is .txt")
    void plainText() {
        assertThat(sniffer.detectExtension("name,age\nAma,30\n".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo(".txt");
        assertThat(sniffer.detectExtension("Akwaaba, café".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo(".txt");
    }

    @Test
    @DisplayName("a multi-byte character cut by the header still counts as text")
    void truncatedUtf8() {
        byte[] full = "ab€".getBytes(StandardCharsets.UTF_8);
        byte[] cut = Arrays.copyOf(full, full.length - 1);

        assertThat(sniffer.detectExtension(cut)).isEqualTo(".txt");
    }

    @Test
    @DisplayName("RIFF without WEBP is not an image")
    void riffWithoutWebp() {
        byte[] wav = "RIFF\u0000\u0000\u0000\u0000WAVEfmt ".getBytes(StandardCharsets.ISO_8859_1);

        assertThat(sniffer.detectExtension(wav)).isEqualTo("");
    }

    @Test
    void bitmapWithBinaryHeader() {
        byte[] bmp = bytes('B', 'M', 0x36, 0, 0, 0, 0, 0, 0, 0, 0x36, 0, 0, 0, 0x28, 0);

        assertThat(sniffer.detectExtension(bmp)).isEqualTo(".bmp");
    }

    @Test
    void unknownAndEmpty() {
        assertThat(sniffer.detectExtension(bytes(0x00, 0x01, 0x02, 0x03))).isEqualTo("");
        assertThat(sniffer.detectExtension(new byte[0])).isEqualTo("");
        assertThat(sniffer.detectExtension(null)).isEqualTo("");
    }

    private static byte[] bytes(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }
}
