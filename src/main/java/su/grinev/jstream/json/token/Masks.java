package su.grinev.jstream.json.token;

/**
 * Eight-bytes-at-a-time probes over big-endian words.
 * A non-zero result means at least one byte of the word matches.
 */
public final class Masks {

    private Masks() {
    }

    public static long maskQuote(long word) {
        long cmp = word ^ 0x2222222222222222L;
        return ((cmp - 0x0101010101010101L) & ~cmp & 0x8080808080808080L);
    }

    public static long maskBackslash(long word) {
        long cmp = word ^ 0x5C5C5C5C5C5C5C5CL;
        return ((cmp - 0x0101010101010101L) & ~cmp & 0x8080808080808080L);
    }

    // bytes below 0x20
    public static long maskControl(long word) {
        return ((word - 0x2020202020202020L) & ~word & 0x8080808080808080L);
    }

    /**
     * True when the word holds a byte that ends the fast path of a string scan.
     */
    public static boolean hasStringSpecial(long word) {
        return (maskQuote(word) | maskBackslash(word) | maskControl(word)) != 0;
    }
}
