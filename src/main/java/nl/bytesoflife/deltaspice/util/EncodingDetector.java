package nl.bytesoflife.deltaspice.util;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Detects the text encoding of a file by decoding it with each candidate
 * charset in turn and keeping the first one that decodes cleanly and shows the
 * expected pattern at the start of some line.
 * <p>
 * A byte order mark settles the charset to the concrete byte order it names.
 * The decoded text then starts with {@link #BYTE_ORDER_MARK}.
 */
public final class EncodingDetector {

    private static final List<Charset> CANDIDATES = List.of(
            StandardCharsets.UTF_8,
            StandardCharsets.UTF_16BE,
            Charset.forName("windows-1252"),
            StandardCharsets.UTF_16LE,
            Charset.forName("windows-1250"),
            Charset.forName("Shift_JIS")
    );

    public static final char BYTE_ORDER_MARK = '\uFEFF';

    private EncodingDetector() {
    }

    /**
     * @param file            file to probe
     * @param expectedPattern regular expression that must be found at the
     *                        start of some line, or empty to accept any
     *                        cleanly decoded content
     * @throws EncodingDetectException if no candidate charset fits
     */
    public static Charset detect(Path file, String expectedPattern) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        Pattern expected = expectedPattern == null || expectedPattern.isEmpty()
                ? null : Pattern.compile(expectedPattern, Pattern.MULTILINE);

        Charset marked = byteOrderMark(bytes);
        for (Charset charset : marked != null ? List.of(marked) : CANDIDATES) {
            String text = tryDecode(bytes, charset);
            if (text == null || text.isEmpty()) {
                continue;
            }
            if (text.charAt(0) == BYTE_ORDER_MARK) {
                text = text.substring(1);
            }
            if (expected != null && !expected.matcher(text).find()) {
                continue;
            }
            // A NUL as second character means a two-byte encoding read as a single-byte one
            if (!isUtf16(charset) && text.length() > 1 && text.charAt(1) == '\0') {
                continue;
            }
            return charset;
        }
        if (expected != null) {
            throw new EncodingDetectException("Expected pattern \"" + expectedPattern + "\" not found in file: " + file);
        }
        throw new EncodingDetectException("Unable to detect encoding of file: " + file);
    }

    private static Charset byteOrderMark(byte[] bytes) {
        if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
            return StandardCharsets.UTF_8;
        }
        if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xFE) {
            return StandardCharsets.UTF_16LE;
        }
        if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFE && (bytes[1] & 0xFF) == 0xFF) {
            return StandardCharsets.UTF_16BE;
        }
        return null;
    }

    private static String tryDecode(byte[] bytes, Charset charset) {
        try {
            CharBuffer chars = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes));
            return chars.toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static boolean isUtf16(Charset charset) {
        return charset.name().startsWith("UTF-16");
    }
}
