package su.grinev.jstream.json.token;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Scans and decodes JSON string tokens held in a byte array.
 * Scanning only finds the closing quote and validates escapes; decoding is done on demand.
 */
public class StringParser {

    public static final int INCOMPLETE = -1;

    private final byte[] bytes;
    private final ByteBuffer words;
    private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);

    public StringParser(byte[] bytes) {
        this.bytes = bytes;
        this.words = ByteBuffer.wrap(bytes);
    }

    /**
     * Scans a string whose opening quote is at {@code quotePos}.
     *
     * @return the index just past the closing quote, or {@link #INCOMPLETE} if {@code end} is reached first
     * @throws MalformedStringException on a raw control character or a bad escape sequence
     */
    public int scan(int quotePos, int end, Escapes escapes) {
        int pos = quotePos + 1;
        escapes.found = false;
        while (true) {
            while (pos + 8 <= end && !Masks.hasStringSpecial(words.getLong(pos))) {
                pos += 8;
            }
            if (pos >= end) {
                return INCOMPLETE;
            }

            byte b = bytes[pos];
            if (b == '"') {
                return pos + 1;
            }
            if (b == '\\') {
                escapes.found = true;
                int escapeEnd = scanEscape(pos, end);
                if (escapeEnd == INCOMPLETE) {
                    return INCOMPLETE;
                }
                pos = escapeEnd;
                continue;
            }
            if ((b & 0xFF) < 0x20) {
                throw new MalformedStringException("Control character 0x%02X must be escaped".formatted(b & 0xFF), pos);
            }
            pos++;
        }
    }

    private int scanEscape(int backslashPos, int end) {
        if (backslashPos + 1 >= end) {
            return INCOMPLETE;
        }
        byte esc = bytes[backslashPos + 1];
        switch (esc) {
            case '"', '\\', '/', 'b', 'f', 'n', 'r', 't' -> {
                return backslashPos + 2;
            }
            case 'u' -> {
                for (int i = backslashPos + 2; i < backslashPos + 6; i++) {
                    if (i >= end) {
                        return INCOMPLETE;
                    }
                    if (Character.digit(bytes[i], 16) < 0) {
                        throw new MalformedStringException("Invalid hex digit in unicode escape", i);
                    }
                }
                return backslashPos + 6;
            }
            default -> throw new MalformedStringException("Invalid escape character '\\%c'".formatted((char) esc), backslashPos + 1);
        }
    }

    /**
     * Decodes string content (between the quotes) that was previously validated by {@link #scan}.
     *
     * @throws MalformedStringException if the content is not well-formed UTF-8
     */
    public String decode(int from, int to, boolean escaped) {
        if (!escaped) {
            return utf8(from, to);
        }

        StringBuilder sb = new StringBuilder(to - from);
        int runStart = from;
        int pos = from;
        while (pos < to) {
            if (bytes[pos] != '\\') {
                pos++;
                continue;
            }
            if (pos > runStart) {
                sb.append(utf8(runStart, pos));
            }
            byte esc = bytes[pos + 1];
            if (esc == 'u') {
                sb.append(parseUnicode(pos + 2));
                pos += 6;
            } else {
                sb.append(switch (esc) {
                    case '"' -> '"';
                    case '\\' -> '\\';
                    case '/' -> '/';
                    case 'b' -> '\b';
                    case 'f' -> '\f';
                    case 'n' -> '\n';
                    case 'r' -> '\r';
                    case 't' -> '\t';
                    default -> throw new IllegalStateException("Unvalidated escape character: \\" + (char) esc);
                });
                pos += 2;
            }
            runStart = pos;
        }
        if (to > runStart) {
            sb.append(utf8(runStart, to));
        }
        return sb.toString();
    }

    private String utf8(int from, int to) {
        boolean ascii = true;
        for (int i = from; i < to && ascii; i++) {
            ascii = bytes[i] >= 0;
        }
        if (ascii) {
            return new String(bytes, from, to - from, StandardCharsets.US_ASCII);
        }

        ByteBuffer in = ByteBuffer.wrap(bytes, from, to - from);
        // UTF-8 never yields more chars than bytes
        CharBuffer out = CharBuffer.allocate(to - from);
        utf8.reset();
        CoderResult result = utf8.decode(in, out, true);
        if (!result.isError()) {
            result = utf8.flush(out);
        }
        if (result.isError()) {
            throw new MalformedStringException("Invalid UTF-8 byte 0x%02X in string".formatted(bytes[in.position()] & 0xFF),
                    in.position());
        }
        return out.flip().toString();
    }

    private char parseUnicode(int pos) {
        int value = 0;
        for (int i = 0; i < 4; i++) {
            value = (value << 4) | Character.digit(bytes[pos + i], 16);
        }
        return (char) value;
    }

    /**
     * Per-scan output flag, reused by the caller to avoid allocating a result object per string.
     */
    public static final class Escapes {
        private boolean found;

        public boolean found() {
            return found;
        }
    }

    public static class MalformedStringException extends RuntimeException {
        private final int index;

        public MalformedStringException(String message, int index) {
            super(message);
            this.index = index;
        }

        public int getIndex() {
            return index;
        }
    }
}
