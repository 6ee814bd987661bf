package su.grinev.jstream.source;

/**
 * Pull-based supplier of bytes for one stream.
 * <p>
 * Every {@link #read} must be followed by exactly one {@link #advanceTo} before the next read. Offsets passed to
 * {@code advanceTo} are relative to the start of the buffer returned by that read. Bytes before {@code consumed}
 * are never returned again. A following read returns the bytes from {@code consumed} on, and waits until bytes
 * beyond {@code examined} are available or the source completes.
 */
public interface ChunkSource extends AutoCloseable {

    /**
     * Blocks until unexamined bytes are available, the source completes, or the pull is cancelled.
     *
     * @throws su.grinev.jstream.exception.StreamCancelledException if {@code cancellationToken} fires while waiting
     */
    ChunkReadResult read(CancellationToken cancellationToken);

    void advanceTo(long consumed, long examined);

    @Override
    void close();
}
