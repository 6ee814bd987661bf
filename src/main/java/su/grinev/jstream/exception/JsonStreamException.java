package su.grinev.jstream.exception;

/**
 * Base of the errors caused by the bytes of a stream: malformed JSON or a value that
 * cannot be mapped to the requested element type.
 */
public class JsonStreamException extends RuntimeException {

    public JsonStreamException(String message) {
        super(message);
    }

    public JsonStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
