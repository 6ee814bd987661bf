package su.grinev.jstream.exception;

import lombok.Getter;

/**
 * The input is not valid JSON under the active reader options.
 * Fatal to the stream: there is no resynchronization point after a syntax error.
 */
@Getter
public class JsonSyntaxException extends JsonStreamException {

    private final long bytePosition;
    private final long lineNumber;
    private final long bytePositionInLine;

    public JsonSyntaxException(String message, long bytePosition, long lineNumber, long bytePositionInLine) {
        super("%s (offset: %d, line: %d, position in line: %d)".formatted(message, bytePosition, lineNumber, bytePositionInLine));
        this.bytePosition = bytePosition;
        this.lineNumber = lineNumber;
        this.bytePositionInLine = bytePositionInLine;
    }
}
