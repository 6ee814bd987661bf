package su.grinev.jstream.source;

import java.util.List;
import java.util.Objects;

/**
 * Read-only view over bytes that may be split across several arrays. The arrays are not copied:
 * a sequence returned by a {@link ChunkSource} is valid only until the next call to
 * {@link ChunkSource#advanceTo(long, long)}.
 */
public final class ByteSequence {

    public static final ByteSequence EMPTY = new ByteSequence(List.of(), 0);

    private final List<Segment> segments;
    private final long length;

    private ByteSequence(List<Segment> segments, long length) {
        this.segments = segments;
        this.length = length;
    }

    public static ByteSequence of(byte[] bytes) {
        return of(bytes, 0, bytes.length);
    }

    public static ByteSequence of(byte[] bytes, int offset, int length) {
        if (length == 0) {
            return EMPTY;
        }
        return new ByteSequence(List.of(new Segment(bytes, offset, length)), length);
    }

    public static ByteSequence of(List<Segment> segments) {
        List<Segment> nonEmpty = segments.stream().filter(s -> s.length() > 0).toList();
        long total = 0;
        for (Segment segment : nonEmpty) {
            total += segment.length();
        }
        return nonEmpty.isEmpty() ? EMPTY : new ByteSequence(nonEmpty, total);
    }

    public long length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public boolean isSingleSegment() {
        return segments.size() <= 1;
    }

    public List<Segment> segments() {
        return segments;
    }

    /**
     * The only segment of a single-segment sequence; an empty segment for {@link #EMPTY}.
     */
    public Segment first() {
        return segments.isEmpty() ? new Segment(new byte[0], 0, 0) : segments.get(0);
    }

    /**
     * Copies all segments into one new array.
     */
    public byte[] toArray() {
        if (length > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("Sequence of %d bytes does not fit in an array".formatted(length));
        }
        byte[] bytes = new byte[(int) length];
        int position = 0;
        for (Segment segment : segments) {
            System.arraycopy(segment.array(), segment.offset(), bytes, position, segment.length());
            position += segment.length();
        }
        return bytes;
    }

    @Override
    public String toString() {
        return "ByteSequence{length=" + length + ", segments=" + segments.size() + "}";
    }

    public record Segment(byte[] array, int offset, int length) {
        public Segment {
            Objects.checkFromIndexSize(offset, length, array.length);
        }
    }
}
