package su.grinev.jstream.decode;

/**
 * Per-stream decoding settings shared by every descriptor invoked for that stream.
 *
 * @param caseSensitive whether property names must match field names exactly
 */
public record DecodeContext(boolean caseSensitive) {

    public static final DecodeContext CASE_INSENSITIVE = new DecodeContext(false);
    public static final DecodeContext CASE_SENSITIVE = new DecodeContext(true);

    public boolean matches(String expected, String actual) {
        return caseSensitive ? expected.equals(actual) : expected.equalsIgnoreCase(actual);
    }
}
