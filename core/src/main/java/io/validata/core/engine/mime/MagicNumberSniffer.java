package io.validata.core.engine.mime;

import io.validata.core.spi.ContentSniffer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * {@link ContentSniffer} recognizing common formats by their leading magic bytes.
 *
 * <p>
 * Binary signatures are checked first. Content with no signature is reported as {@code .txt}
 * when it decodes as UTF-8 without control characters other than whitespace, and as {@code ""}
 * otherwise. Stateless and thread-safe.
 */
public final class MagicNumberSniffer implements ContentSniffer {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A};
    private static final byte[] JPG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] GIF87 = {'G', 'I', 'F', '8', '7', 'a'};
    private static final byte[] GIF89 = {'G', 'I', 'F', '8', '9', 'a'};
    private static final byte[] RIFF = {'R', 'I', 'F', 'F'};
    private static final byte[] WEBP = {'W', 'E', 'B', 'P'};
    private static final byte[] BMP = {'B', 'M'};
    private static final byte[] TIFF_LE = {'I', 'I', 0x2A, 0x00};
    private static final byte[] TIFF_BE = {'M', 'M', 0x00, 0x2A};
    private static final byte[] PDF = {'%', 'P', 'D', 'F', '-'};
    private static final byte[] ZIP = {'P', 'K', 0x03, 0x04};
    private static final byte[] GZIP = {0x1F, (byte) 0x8B};

    @Override
    public String detectExtension(byte[] content) {
        if (content == null || content.length == 0) {
            return "";
        }
        if (startsWith(content, 0, PNG)) {
            return ".png";
        }
        if (startsWith(content, 0, JPG)) {
            return ".jpg";
        }
        if (startsWith(content, 0, GIF87) || startsWith(content, 0, GIF89)) {
            return ".gif";
        }
        if (startsWith(content, 0, RIFF) && startsWith(content, 8, WEBP)) {
            return ".webp";
        }
        if (startsWith(content, 0, TIFF_LE) || startsWith(content, 0, TIFF_BE)) {
            return ".tiff";
        }
        if (startsWith(content, 0, PDF)) {
            return ".pdf";
        }
        if (startsWith(content, 0, ZIP)) {
            return ".zip";
        }
        if (startsWith(content, 0, GZIP)) {
            return ".gz";
        }
        // BM is short enough to collide with text, so text wins when both fit.
        if (isText(content)) {
            return ".txt";
        }
        if (startsWith(content, 0, BMP) && content.length >= 14) {
            return ".bmp";
        }
        return "";
    }

    private static boolean startsWith(byte[] content, int offset, byte[] signature) {
        if (content.length < offset + signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if (content[offset + i] != signature[i]) {
                return false;
            }
        }
        return true;
    }

    private static boolean isText(byte[] content) {
        CharsetDecoder decoder = StandardCharsets.UTF_8
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        // The header may cut a multi-byte sequence short; drop up to three trailing bytes.
        for (int trim = 0; trim <= 3 && trim < content.length; trim++) {
            try {
                String text = decoder.reset().decode(ByteBuffer.wrap(content, 0, content.length - trim)).toString();
                return text.chars().noneMatch(c -> c < 0x20 && c != '\n' && c != '\r' && c != '\t');
            } catch (CharacterCodingException e) {
                if (trim == 3) {
                    return false;
                }
            }
        }
        return false;
    }
}
