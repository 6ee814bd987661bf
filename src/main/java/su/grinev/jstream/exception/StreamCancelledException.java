package su.grinev.jstream.exception;

import java.util.concurrent.CancellationException;

/**
 * The stream was stopped on purpose through its cancellation token.
 * Not a data error, so it is kept outside of the {@link JsonStreamException} hierarchy.
 */
public class StreamCancelledException extends CancellationException {

    public StreamCancelledException(String message) {
        super(message);
    }
}
