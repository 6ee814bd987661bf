package su.grinev.jstream.source;

/**
 * Outcome of one pull from a {@link ChunkSource}.
 *
 * @param buffer    every byte not yet consumed, starting where the previous {@code advanceTo} left off
 * @param completed the source will produce no bytes beyond {@code buffer}
 * @param cancelled the pull was interrupted by {@link BytePipe#cancelPendingRead()} rather than by data arriving
 */
public record ChunkReadResult(ByteSequence buffer, boolean completed, boolean cancelled) {
}
