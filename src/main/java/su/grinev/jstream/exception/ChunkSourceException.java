package su.grinev.jstream.exception;

/**
 * Wraps a checked failure reported by the producer side of a chunk source.
 */
public class ChunkSourceException extends RuntimeException {

    public ChunkSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
